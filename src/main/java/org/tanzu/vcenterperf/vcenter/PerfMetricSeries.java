package org.tanzu.vcenterperf.vcenter;

/**
 * One counter's values inside an entity result.
 *
 * The element type depends on the counter: integer counters come back as
 * {@link PerfMetricIntSeries}; anything else is an {@link UnsupportedMetricSeries}.
 */
public abstract class PerfMetricSeries {

    private final String typeName;
    private final int counterId;
    private final String instance;

    protected PerfMetricSeries(String typeName, int counterId, String instance) {
        this.typeName = typeName;
        this.counterId = counterId;
        this.instance = instance != null ? instance : "";
    }

    public String getTypeName() { return typeName; }

    public int getCounterId() { return counterId; }

    public String getInstance() { return instance; }
}
