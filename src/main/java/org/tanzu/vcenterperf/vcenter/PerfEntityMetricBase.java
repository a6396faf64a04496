package org.tanzu.vcenterperf.vcenter;

/**
 * One entity's part of a QueryPerf response.
 *
 * The server answers with a base-typed array whose elements are discriminated by
 * "_typeName". Only {@link PerfEntityMetric} carries typed value series; every other
 * element kind is kept as an {@link UnsupportedEntityMetric} so callers can skip it.
 */
public abstract class PerfEntityMetricBase {

    private final String typeName;
    private final ManagedObjectReference entity;

    protected PerfEntityMetricBase(String typeName, ManagedObjectReference entity) {
        this.typeName = typeName;
        this.entity = entity;
    }

    /** The "_typeName" the server sent, e.g. "PerfEntityMetric" or "PerfEntityMetricCSV" */
    public String getTypeName() { return typeName; }

    /** The entity the values belong to; may be null if the server omitted it */
    public ManagedObjectReference getEntity() { return entity; }
}
