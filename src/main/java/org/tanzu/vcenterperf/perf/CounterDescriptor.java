package org.tanzu.vcenterperf.perf;

import java.util.Objects;

/**
 * A resolved performance counter: the server's numeric key plus what it measures.
 */
public final class CounterDescriptor {

    private final int key;
    private final String name;
    private final String unit;
    private final String rollupType;
    private final String statsType;
    private final int level;

    public CounterDescriptor(int key, String name, String unit, String rollupType, String statsType, int level) {
        this.key = key;
        this.name = Objects.requireNonNull(name, "name");
        this.unit = unit;
        this.rollupType = rollupType;
        this.statsType = statsType;
        this.level = level;
    }

    /** The id to put in performance queries */
    public int getKey() { return key; }

    /** group.name.rollup, e.g. "cpu.usagemhz.average" */
    public String getName() { return name; }

    /** Unit key, e.g. "megaHertz" */
    public String getUnit() { return unit; }

    public String getRollupType() { return rollupType; }

    public String getStatsType() { return statsType; }

    public int getLevel() { return level; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterDescriptor)) return false;
        CounterDescriptor that = (CounterDescriptor) o;
        return key == that.key && level == that.level && name.equals(that.name)
                && Objects.equals(unit, that.unit) && Objects.equals(rollupType, that.rollupType)
                && Objects.equals(statsType, that.statsType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, name, unit, rollupType, statsType, level);
    }

    @Override
    public String toString() {
        return name + "#" + key + " [" + unit + "]";
    }
}
