package org.tanzu.vcenterperf.vcenter;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.vcenterperf.config.VCenterConfig;

import java.net.URI;

/**
 * Creates {@link VimApi} clients bound to an SDK endpoint, sharing the configured
 * WebClient settings and the run's cancellation scope.
 */
@Component
public class VimClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final VCenterConfig vCenterConfig;
    private final RunContext runContext;

    public VimClientFactory(WebClient.Builder webClientBuilder, VCenterConfig vCenterConfig, RunContext runContext) {
        this.webClientBuilder = webClientBuilder;
        this.vCenterConfig = vCenterConfig;
        this.runContext = runContext;
    }

    /**
     * @param endpoint SDK endpoint, e.g. https://vc.example.com:443/sdk
     * @return A client for that endpoint
     */
    public VimApi create(URI endpoint) {
        return new VimJsonClient(endpoint, vCenterConfig.getApiRelease(), webClientBuilder, runContext);
    }
}
