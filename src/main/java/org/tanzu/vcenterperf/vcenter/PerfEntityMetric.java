package org.tanzu.vcenterperf.vcenter;

import java.util.List;

/**
 * Entity result with sample timestamps and one value series per requested counter.
 */
public final class PerfEntityMetric extends PerfEntityMetricBase {

    public static final String TYPE_NAME = "PerfEntityMetric";

    private final List<String> sampleTimestamps;
    private final List<PerfMetricSeries> values;

    public PerfEntityMetric(ManagedObjectReference entity, List<String> sampleTimestamps, List<PerfMetricSeries> values) {
        super(TYPE_NAME, entity);
        this.sampleTimestamps = List.copyOf(sampleTimestamps);
        this.values = List.copyOf(values);
    }

    /** ISO-8601 timestamps of the samples, in the order of the series values */
    public List<String> getSampleTimestamps() { return sampleTimestamps; }

    public List<PerfMetricSeries> getValues() { return values; }

    @Override
    public String toString() {
        return "PerfEntityMetric{entity=" + getEntity() + ", series=" + values.size() + '}';
    }
}
