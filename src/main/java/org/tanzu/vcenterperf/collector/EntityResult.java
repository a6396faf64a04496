package org.tanzu.vcenterperf.collector;

import org.tanzu.vcenterperf.inventory.VirtualMachineRef;
import org.tanzu.vcenterperf.perf.MetricSample;

import java.util.Objects;

/**
 * Outcome of the query for one virtual machine: a sample, or the error that prevented it.
 */
public final class EntityResult {

    private final VirtualMachineRef entity;
    private final MetricSample sample;
    private final RuntimeException error;

    private EntityResult(VirtualMachineRef entity, MetricSample sample, RuntimeException error) {
        this.entity = entity;
        this.sample = sample;
        this.error = error;
    }

    public static EntityResult ok(MetricSample sample) {
        Objects.requireNonNull(sample, "sample");
        return new EntityResult(sample.getEntity(), sample, null);
    }

    public static EntityResult failed(VirtualMachineRef entity, RuntimeException error) {
        Objects.requireNonNull(error, "error");
        return new EntityResult(entity, null, error);
    }

    public VirtualMachineRef getEntity() { return entity; }

    public boolean isOk() { return error == null; }

    /** The sample; null for a failed result */
    public MetricSample getSample() { return sample; }

    /** The error; null for a successful result */
    public RuntimeException getError() { return error; }

    @Override
    public String toString() {
        return isOk() ? "ok(" + sample + ")" : "failed(" + entity + ": " + error.getMessage() + ")";
    }
}
