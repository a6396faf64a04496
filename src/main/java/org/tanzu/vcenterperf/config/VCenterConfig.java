package org.tanzu.vcenterperf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration class for vCenter connection settings.
 *
 * This class uses Spring Boot's @ConfigurationProperties to bind vCenter
 * configuration from application.properties and environment variables. Missing
 * values are completed by {@link VCenterConfigProcessor} from the legacy
 * environment variable names and Cloud Foundry service bindings.
 *
 * Configuration properties are bound using the "vcenter" prefix, so properties
 * like "vcenter.host", "vcenter.port", etc. are automatically mapped to this class.
 */
@Component
@ConfigurationProperties(prefix = "vcenter")
public class VCenterConfig {

    /** vCenter server hostname or IP address */
    private String host;

    /** vCenter server port (default: 443 for HTTPS) */
    private int port = 443;

    /** Username for vCenter authentication */
    private String username;

    /** Password for vCenter authentication */
    private String password;

    /** Whether to skip SSL certificate validation (default: false, must be enabled explicitly) */
    private boolean insecure = false;

    /** VI/JSON API release used in the /sdk/vim25/{release} path */
    private String apiRelease = "8.0.1.0";

    /** Response timeout applied to every request */
    private Duration requestTimeout = Duration.ofSeconds(60);

    /** Largest response body buffered in memory; the counter catalog runs to several megabytes */
    private DataSize maxResponseSize = DataSize.ofMegabytes(16);

    /**
     * Gets the vCenter server hostname or IP address.
     * @return The hostname or IP address
     */
    public String getHost() { return host; }

    /**
     * Sets the vCenter server hostname or IP address.
     * @param host The hostname or IP address
     */
    public void setHost(String host) { this.host = host; }

    /**
     * Gets the vCenter server port.
     * @return The port number (default: 443)
     */
    public int getPort() { return port; }

    /**
     * Sets the vCenter server port.
     * @param port The port number
     */
    public void setPort(int port) { this.port = port; }

    /**
     * Gets the username for vCenter authentication.
     * @return The username
     */
    public String getUsername() { return username; }

    /**
     * Sets the username for vCenter authentication.
     * @param username The username
     */
    public void setUsername(String username) { this.username = username; }

    /**
     * Gets the password for vCenter authentication.
     * @return The password
     */
    public String getPassword() { return password; }

    /**
     * Sets the password for vCenter authentication.
     * @param password The password
     */
    public void setPassword(String password) { this.password = password; }

    /**
     * Checks if SSL certificate validation should be skipped.
     * @return true if SSL validation is disabled, false otherwise
     */
    public boolean isInsecure() { return insecure; }

    /**
     * Sets whether SSL certificate validation should be skipped.
     * @param insecure true to disable SSL validation, false to enable it
     */
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public String getApiRelease() { return apiRelease; }

    public void setApiRelease(String apiRelease) { this.apiRelease = apiRelease; }

    public Duration getRequestTimeout() { return requestTimeout; }

    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public DataSize getMaxResponseSize() { return maxResponseSize; }

    public void setMaxResponseSize(DataSize maxResponseSize) { this.maxResponseSize = maxResponseSize; }

    /**
     * Builds the SDK endpoint URL for the configured host and port.
     *
     * The VI/JSON paths are resolved below this URL, so "https://vc.example.com:443/sdk"
     * becomes "https://vc.example.com:443/sdk/vim25/8.0.1.0/..." on the wire.
     *
     * @return The endpoint URL in the form https://host:port/sdk
     */
    public URI getEndpointUrl() {
        return URI.create("https://" + host + ":" + port + "/sdk");
    }

    /**
     * Returns a string representation of the configuration.
     *
     * The password is hidden so that it never appears in logs or debug output.
     *
     * @return String representation with password hidden
     */
    @Override
    public String toString() {
        return "VCenterConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", insecure=" + insecure +
                ", apiRelease='" + apiRelease + '\'' +
                '}';
    }
}
