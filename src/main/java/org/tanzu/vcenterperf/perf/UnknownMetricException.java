package org.tanzu.vcenterperf.perf;

/**
 * The counter catalog has no counter with the requested name.
 */
public class UnknownMetricException extends CounterResolutionException {

    private final String metricName;

    public UnknownMetricException(String metricName) {
        super("Metric " + metricName + " not found", null);
        this.metricName = metricName;
    }

    public String getMetricName() { return metricName; }
}
