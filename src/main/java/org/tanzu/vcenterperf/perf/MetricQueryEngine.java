package org.tanzu.vcenterperf.perf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.config.PerfQueryConfig;
import org.tanzu.vcenterperf.inventory.VirtualMachineRef;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.PerfEntityMetricBase;
import org.tanzu.vcenterperf.vcenter.PerfQuerySpec;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;

import java.util.List;

/**
 * Queries one counter for one virtual machine and extracts the integer values.
 *
 * The engine keeps no state between calls; the session and counter id are passed in,
 * so concurrent calls for different machines are safe.
 */
@Component
public class MetricQueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(MetricQueryEngine.class);

    private final MetricExtractor extractor = new MetricExtractor();

    private final String instance;

    public MetricQueryEngine(PerfQueryConfig perfQueryConfig) {
        this.instance = perfQueryConfig.getInstance();
    }

    /**
     * Runs the query.
     *
     * @param session The authenticated session
     * @param entity The virtual machine
     * @param counterId Counter key from the catalog
     * @param intervalSeconds Sampling interval, 20 for real-time
     * @param maxSamples Upper bound on values per series
     * @return The extracted sample; empty when the server had no data
     * @throws QueryException if the query fails; the entity is named in the exception
     * @throws RunCancelledException if the run was cancelled
     */
    public MetricSample queryMetric(VSphereSession session, VirtualMachineRef entity, int counterId,
                                    int intervalSeconds, int maxSamples) {
        PerfQuerySpec querySpec = new PerfQuerySpec(entity.getReference(), counterId, instance, intervalSeconds, maxSamples);
        logger.debug("Querying {} for VM {}", querySpec, entity.getName());

        List<PerfEntityMetricBase> results;
        try {
            results = session.getClient().queryPerf(session.getSessionId(),
                    session.getServiceContent().getPerfManager(), querySpec);
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QueryException(entity, "Error querying performance metrics for VM " + entity.getName()
                    + ": " + e.getMessage(), e);
        }
        return extractor.extract(entity, counterId, results);
    }
}
