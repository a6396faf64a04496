package org.tanzu.vcenterperf.perf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.vcenterperf.inventory.VirtualMachineRef;
import org.tanzu.vcenterperf.vcenter.PerfEntityMetric;
import org.tanzu.vcenterperf.vcenter.PerfEntityMetricBase;
import org.tanzu.vcenterperf.vcenter.PerfMetricIntSeries;
import org.tanzu.vcenterperf.vcenter.PerfMetricSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the integer series of one counter out of a QueryPerf response.
 *
 * Only {@link PerfEntityMetric} results and {@link PerfMetricIntSeries} series are read.
 * Other kinds are logged and skipped; series of other counters are ignored.
 */
public class MetricExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MetricExtractor.class);

    /**
     * @param entity The virtual machine the query was for
     * @param counterId The counter that was queried
     * @param results The response, possibly empty
     * @return The matching series; empty when the response holds none
     */
    public MetricSample extract(VirtualMachineRef entity, int counterId, List<PerfEntityMetricBase> results) {
        List<MetricSeries> series = new ArrayList<>();
        int skipped = 0;

        for (PerfEntityMetricBase result : results) {
            if (!(result instanceof PerfEntityMetric)) {
                logger.warn("Error asserting metric type for VM {}: got {}", entity.getName(), result.getTypeName());
                skipped++;
                continue;
            }
            for (PerfMetricSeries value : ((PerfEntityMetric) result).getValues()) {
                if (!(value instanceof PerfMetricIntSeries)) {
                    logger.warn("Error asserting metric series type for VM {}: got {}", entity.getName(), value.getTypeName());
                    skipped++;
                    continue;
                }
                if (value.getCounterId() == counterId) {
                    PerfMetricIntSeries intSeries = (PerfMetricIntSeries) value;
                    series.add(new MetricSeries(intSeries.getInstance(), intSeries.getValues()));
                }
            }
        }

        if (series.isEmpty()) {
            logger.debug("No samples of counter {} for VM {}", counterId, entity.getName());
        }
        return new MetricSample(entity, counterId, series, skipped);
    }
}
