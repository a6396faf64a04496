package org.tanzu.vcenterperf.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Configuration of the WebClient used to talk to the vCenter VI/JSON API.
 *
 * The builder carries the transport settings only: certificate validation, the
 * response timeout, and the in-memory buffer limit. The endpoint URL is applied
 * per session by {@link org.tanzu.vcenterperf.vcenter.VimClientFactory}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder for vCenter communication.
     *
     * When insecure=true the SSL context trusts every certificate through
     * InsecureTrustManagerFactory, which is meant for lab vCenters with self-signed
     * certificates. With insecure=false the JDK's default trust store applies.
     *
     * @param vCenterConfig The vCenter configuration containing SSL and timeout settings
     * @return A configured WebClient.Builder
     * @throws IllegalStateException if the insecure SSL context cannot be built
     */
    @Bean
    public WebClient.Builder webClientBuilder(VCenterConfig vCenterConfig) {
        logger.debug("Configuring WebClient.Builder for vCenter: {}:{} (insecure={})",
                vCenterConfig.getHost(), vCenterConfig.getPort(), vCenterConfig.isInsecure());

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(vCenterConfig.getRequestTimeout());

        if (vCenterConfig.isInsecure()) {
            logger.warn("SSL validation is DISABLED for vCenter connection (insecure=true). This is not recommended for production!");
            try {
                SslContext sslContext = SslContextBuilder.forClient()
                        .trustManager(InsecureTrustManagerFactory.INSTANCE)
                        .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.debug("Using default SSL validation for vCenter connection");
        }

        int maxInMemorySize = (int) vCenterConfig.getMaxResponseSize().toBytes();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }
}
