package org.tanzu.vcenterperf.config;

import org.tanzu.vcenterperf.VCenterPerfException;

import java.util.List;

/**
 * Thrown when the vCenter configuration is missing or invalid. Raised before any remote call.
 */
public class ConfigurationException extends VCenterPerfException {

    public static final int EXIT_CONFIGURATION = 2;

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("configuration", "Invalid vCenter configuration: " + String.join("; ", problems), null, EXIT_CONFIGURATION);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
