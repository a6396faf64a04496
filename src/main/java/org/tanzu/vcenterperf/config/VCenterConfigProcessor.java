package org.tanzu.vcenterperf.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.util.ArrayList;
import java.util.List;

/**
 * Completes and validates the vCenter connection settings.
 *
 * Values bound from application.properties and the VCENTER_* environment variables
 * take precedence. Anything still missing is filled, in order, from:
 * 1. The legacy environment variables VCSA_SERVER, QA_VCENTER_USERNAME and QA_VCENTER_PASSWORD
 * 2. A Cloud Foundry service binding in VCAP_SERVICES whose name contains "vcenter"
 *
 * {@link #validate()} is called by the runner before the collection pass starts, so an
 * incomplete configuration stops the run before any remote call is made.
 */
@Component
public class VCenterConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(VCenterConfigProcessor.class);

    static final String LEGACY_HOST = "VCSA_SERVER";
    static final String LEGACY_USERNAME = "QA_VCENTER_USERNAME";
    static final String LEGACY_PASSWORD = "QA_VCENTER_PASSWORD";

    private final VCenterConfig vCenterConfig;

    private final Environment environment;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public VCenterConfigProcessor(VCenterConfig vCenterConfig, Environment environment) {
        this.vCenterConfig = vCenterConfig;
        this.environment = environment;
    }

    /**
     * Fills missing connection settings from the legacy environment and VCAP_SERVICES.
     *
     * This method is called once after the configuration has been bound. It never fails:
     * a configuration that stays incomplete is reported by {@link #validate()}.
     */
    @PostConstruct
    public void processConfiguration() {
        logger.debug("Processing vCenter configuration: {}", vCenterConfig);

        applyLegacyEnvironment();
        if (isConfigurationComplete()) {
            logger.debug("vCenter configuration is complete from properties and environment");
            return;
        }

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.debug("VCAP_SERVICES not available and configuration incomplete");
            return;
        }

        try {
            JsonNode credentials = findVCenterCredentials(objectMapper.readTree(vcapServices));
            if (credentials != null) {
                updateConfigurationFromVCap(credentials);
                logger.info("vCenter configuration updated from VCAP_SERVICES: {}", vCenterConfig);
            } else {
                logger.warn("No vCenter service found in VCAP_SERVICES");
            }
        } catch (Exception e) {
            // validate() reports whatever is still missing
            logger.warn("Could not parse VCAP_SERVICES: {}", e.getMessage());
        }
    }

    /**
     * Checks that the configuration can be used to connect.
     *
     * @throws ConfigurationException listing every missing or invalid setting
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (!isValid(vCenterConfig.getHost())) {
            problems.add("vcenter.host (VCENTER_HOST or " + LEGACY_HOST + ") is not set");
        }
        if (!isValid(vCenterConfig.getUsername())) {
            problems.add("vcenter.username (VCENTER_USERNAME or " + LEGACY_USERNAME + ") is not set");
        }
        if (!isValid(vCenterConfig.getPassword())) {
            problems.add("vcenter.password (VCENTER_PASSWORD or " + LEGACY_PASSWORD + ") is not set");
        }
        if (vCenterConfig.getPort() < 1 || vCenterConfig.getPort() > 65535) {
            problems.add("vcenter.port must be between 1 and 65535, was " + vCenterConfig.getPort());
        }
        if (!isValid(vCenterConfig.getApiRelease())) {
            problems.add("vcenter.api-release is not set");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private void applyLegacyEnvironment() {
        if (!isValid(vCenterConfig.getHost()) && isValid(environment.getProperty(LEGACY_HOST))) {
            vCenterConfig.setHost(environment.getProperty(LEGACY_HOST));
            logger.info("Set host from {}: {}", LEGACY_HOST, vCenterConfig.getHost());
        }
        if (!isValid(vCenterConfig.getUsername()) && isValid(environment.getProperty(LEGACY_USERNAME))) {
            vCenterConfig.setUsername(environment.getProperty(LEGACY_USERNAME));
            logger.info("Set username from {}: {}", LEGACY_USERNAME, vCenterConfig.getUsername());
        }
        if (!isValid(vCenterConfig.getPassword()) && isValid(environment.getProperty(LEGACY_PASSWORD))) {
            vCenterConfig.setPassword(environment.getProperty(LEGACY_PASSWORD));
            logger.info("Set password from {}: ***", LEGACY_PASSWORD);
        }
    }

    private boolean isConfigurationComplete() {
        return isValid(vCenterConfig.getHost())
                && isValid(vCenterConfig.getUsername())
                && isValid(vCenterConfig.getPassword());
    }

    /**
     * A value is valid when it is non-blank and not an unresolved ${...} placeholder.
     */
    private static boolean isValid(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }

    private JsonNode findVCenterCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                if (serviceName.toLowerCase().contains("vcenter")) {
                    logger.info("Found vCenter service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    /**
     * Copies credentials from the service binding into settings that are still unset.
     * Port and insecure are taken from the binding only when present there.
     */
    private void updateConfigurationFromVCap(JsonNode credentials) {
        if (!isValid(vCenterConfig.getHost()) && credentials.hasNonNull("host")) {
            vCenterConfig.setHost(credentials.path("host").asText());
        }
        if (!isValid(vCenterConfig.getUsername()) && credentials.hasNonNull("username")) {
            vCenterConfig.setUsername(credentials.path("username").asText());
        }
        if (!isValid(vCenterConfig.getPassword()) && credentials.hasNonNull("password")) {
            vCenterConfig.setPassword(credentials.path("password").asText());
        }
        if (credentials.has("port")) {
            vCenterConfig.setPort(credentials.path("port").asInt(vCenterConfig.getPort()));
        }
        if (credentials.has("insecure")) {
            vCenterConfig.setInsecure(credentials.path("insecure").asBoolean(false));
        }
    }
}
