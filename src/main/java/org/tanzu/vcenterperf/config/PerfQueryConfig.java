package org.tanzu.vcenterperf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the performance query pass, bound from the "vcenter.perf" prefix.
 *
 * The defaults ask for the most recent sample of "cpu.usagemhz.average" at the
 * 20 second real-time interval, one query at a time.
 */
@Component
@ConfigurationProperties(prefix = "vcenter.perf")
public class PerfQueryConfig {

    /** Counter name in group.name.rollup form */
    private String metricName = "cpu.usagemhz.average";

    /** Sampling interval in seconds; 20 is the real-time interval */
    private int intervalId = 20;

    /** Upper bound on samples returned per series */
    private int maxSample = 1;

    /** Counter instance; the empty string selects the aggregate */
    private String instance = "";

    /** Label printed next to each value in the report */
    private String label = "CPU Usage (MHz)";

    /** Number of per-VM queries in flight at once; 1 keeps the pass sequential */
    private int concurrency = 1;

    /** Cancels the whole pass when it runs longer than this; null means no limit */
    private Duration runTimeout;

    /** Whether the pass runs as soon as the application starts */
    private boolean runOnStartup = true;

    public String getMetricName() { return metricName; }

    public void setMetricName(String metricName) { this.metricName = metricName; }

    public int getIntervalId() { return intervalId; }

    public void setIntervalId(int intervalId) { this.intervalId = intervalId; }

    public int getMaxSample() { return maxSample; }

    public void setMaxSample(int maxSample) { this.maxSample = maxSample; }

    public String getInstance() { return instance; }

    /**
     * Sets the counter instance. A null value (an empty property) maps to the aggregate instance.
     * @param instance The instance name, or null
     */
    public void setInstance(String instance) { this.instance = instance != null ? instance : ""; }

    public String getLabel() { return label; }

    public void setLabel(String label) { this.label = label; }

    public int getConcurrency() { return concurrency; }

    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public Duration getRunTimeout() { return runTimeout; }

    public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }

    public boolean isRunOnStartup() { return runOnStartup; }

    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

    @Override
    public String toString() {
        return "PerfQueryConfig{" +
                "metricName='" + metricName + '\'' +
                ", intervalId=" + intervalId +
                ", maxSample=" + maxSample +
                ", instance='" + instance + '\'' +
                ", concurrency=" + concurrency +
                ", runTimeout=" + runTimeout +
                '}';
    }
}
