package org.tanzu.vcenterperf.perf;

import java.util.List;

/**
 * Values of one counter instance, oldest first.
 */
public final class MetricSeries {

    private final String instance;
    private final List<Long> values;

    public MetricSeries(String instance, List<Long> values) {
        this.instance = instance != null ? instance : "";
        this.values = List.copyOf(values);
    }

    /** Counter instance; empty for the aggregate */
    public String getInstance() { return instance; }

    public List<Long> getValues() { return values; }

    @Override
    public String toString() {
        return (instance.isEmpty() ? "" : instance + "=") + values;
    }
}
