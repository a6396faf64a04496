package org.tanzu.vcenterperf.vcenter;

/**
 * Any entity result kind other than {@link PerfEntityMetric}, such as the CSV format.
 */
public final class UnsupportedEntityMetric extends PerfEntityMetricBase {

    public UnsupportedEntityMetric(String typeName, ManagedObjectReference entity) {
        super(typeName, entity);
    }

    @Override
    public String toString() {
        return "UnsupportedEntityMetric{typeName='" + getTypeName() + "', entity=" + getEntity() + '}';
    }
}
