package org.tanzu.vcenterperf.vcenter;

import java.util.List;

/**
 * Integer-valued series, the representation used by cpu.usagemhz and most other counters.
 */
public final class PerfMetricIntSeries extends PerfMetricSeries {

    public static final String TYPE_NAME = "PerfMetricIntSeries";

    private final List<Long> values;

    public PerfMetricIntSeries(int counterId, String instance, List<Long> values) {
        super(TYPE_NAME, counterId, instance);
        this.values = List.copyOf(values);
    }

    public List<Long> getValues() { return values; }

    @Override
    public String toString() {
        return "PerfMetricIntSeries{counterId=" + getCounterId() + ", instance='" + getInstance() + "', values=" + values + '}';
    }
}
