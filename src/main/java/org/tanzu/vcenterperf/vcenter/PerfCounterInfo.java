package org.tanzu.vcenterperf.vcenter;

/**
 * A performance counter definition as published by the PerformanceManager.
 */
public final class PerfCounterInfo {

    private final int key;
    private final String groupKey;
    private final String nameKey;
    private final String rollupType;
    private final String unitKey;
    private final String statsType;
    private final int level;
    private final String label;

    public PerfCounterInfo(int key, String groupKey, String nameKey, String rollupType,
                           String unitKey, String statsType, int level, String label) {
        this.key = key;
        this.groupKey = groupKey;
        this.nameKey = nameKey;
        this.rollupType = rollupType;
        this.unitKey = unitKey;
        this.statsType = statsType;
        this.level = level;
        this.label = label;
    }

    public int getKey() { return key; }

    public String getGroupKey() { return groupKey; }

    public String getNameKey() { return nameKey; }

    public String getRollupType() { return rollupType; }

    public String getUnitKey() { return unitKey; }

    public String getStatsType() { return statsType; }

    public int getLevel() { return level; }

    public String getLabel() { return label; }

    /**
     * Gets the dotted counter name used to look counters up, e.g. "cpu.usagemhz.average".
     * @return group.name.rollup
     */
    public String getFullName() {
        return groupKey + "." + nameKey + "." + rollupType;
    }

    @Override
    public String toString() {
        return "PerfCounterInfo{key=" + key + ", name='" + getFullName() + "', unit='" + unitKey + "'}";
    }
}
