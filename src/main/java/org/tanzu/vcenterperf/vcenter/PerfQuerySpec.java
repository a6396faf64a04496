package org.tanzu.vcenterperf.vcenter;

import java.util.Objects;

/**
 * A performance query for one counter of one entity.
 */
public final class PerfQuerySpec {

    private final ManagedObjectReference entity;
    private final int counterId;
    private final String instance;
    private final int intervalId;
    private final int maxSample;

    public PerfQuerySpec(ManagedObjectReference entity, int counterId, String instance, int intervalId, int maxSample) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.counterId = counterId;
        this.instance = instance != null ? instance : "";
        this.intervalId = intervalId;
        this.maxSample = maxSample;
    }

    public ManagedObjectReference getEntity() { return entity; }

    public int getCounterId() { return counterId; }

    public String getInstance() { return instance; }

    /** Sampling interval in seconds */
    public int getIntervalId() { return intervalId; }

    public int getMaxSample() { return maxSample; }

    @Override
    public String toString() {
        return "PerfQuerySpec{entity=" + entity + ", counterId=" + counterId + ", instance='" + instance
                + "', intervalId=" + intervalId + ", maxSample=" + maxSample + '}';
    }
}
