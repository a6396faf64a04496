package org.tanzu.vcenterperf.vcenter;

/**
 * A series in a representation this client does not read, e.g. "PerfMetricSeriesCSV".
 */
public final class UnsupportedMetricSeries extends PerfMetricSeries {

    public UnsupportedMetricSeries(String typeName, int counterId, String instance) {
        super(typeName, counterId, instance);
    }

    @Override
    public String toString() {
        return "UnsupportedMetricSeries{typeName='" + getTypeName() + "', counterId=" + getCounterId() + '}';
    }
}
