package org.tanzu.vcenterperf.perf;

import org.tanzu.vcenterperf.inventory.VirtualMachineRef;

import java.util.List;

/**
 * What a performance query returned for one virtual machine and one counter.
 *
 * An empty sample is a successful query that found no data, for instance because the
 * machine is powered off; it is distinct from a failed query.
 */
public final class MetricSample {

    private final VirtualMachineRef entity;
    private final int counterId;
    private final List<MetricSeries> series;
    private final int skipped;

    public MetricSample(VirtualMachineRef entity, int counterId, List<MetricSeries> series, int skipped) {
        this.entity = entity;
        this.counterId = counterId;
        this.series = List.copyOf(series);
        this.skipped = skipped;
    }

    public VirtualMachineRef getEntity() { return entity; }

    public String getEntityName() { return entity.getName(); }

    public int getCounterId() { return counterId; }

    /** Matching series in response order */
    public List<MetricSeries> getSeries() { return series; }

    /** Number of entity results or series skipped because they were not integer data */
    public int getSkipped() { return skipped; }

    public boolean isEmpty() { return series.isEmpty(); }

    @Override
    public String toString() {
        return "MetricSample{entity=" + entity + ", counterId=" + counterId + ", series=" + series
                + (skipped > 0 ? ", skipped=" + skipped : "") + '}';
    }
}
