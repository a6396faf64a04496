package org.tanzu.vcenterperf.perf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.PerfCounterInfo;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the performance counter catalog and resolves metric names against it.
 *
 * The server publishes several hundred counters keyed by opaque numeric ids. The
 * catalog is fetched once per run and handed to every per-VM query, so its size is
 * paid once rather than once per virtual machine.
 */
@Component
public class CounterCatalogResolver {

    private static final Logger logger = LoggerFactory.getLogger(CounterCatalogResolver.class);

    /**
     * Fetches the full counter catalog.
     *
     * @param session The authenticated session
     * @return The catalog
     * @throws CounterResolutionException if the catalog cannot be read
     */
    public CounterCatalog fetchCatalog(VSphereSession session) {
        List<PerfCounterInfo> counters;
        try {
            counters = session.getClient().retrievePerfCounters(session.getSessionId(),
                    session.getServiceContent().getPerfManager());
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CounterResolutionException("Error retrieving counter info: " + e.getMessage(), e);
        }

        List<CounterDescriptor> descriptors = new ArrayList<>(counters.size());
        for (PerfCounterInfo counter : counters) {
            descriptors.add(new CounterDescriptor(counter.getKey(), counter.getFullName(), counter.getUnitKey(),
                    counter.getRollupType(), counter.getStatsType(), counter.getLevel()));
        }
        CounterCatalog catalog = CounterCatalog.of(descriptors);
        logger.info("Loaded {} performance counters", catalog.size());
        return catalog;
    }

    /**
     * Fetches the catalog and resolves one name in it.
     *
     * @param session The authenticated session
     * @param metricName e.g. "cpu.usagemhz.average"
     * @return The descriptor
     * @throws UnknownMetricException if the catalog has no counter of that name
     * @throws CounterResolutionException if the catalog cannot be read
     */
    public CounterDescriptor resolveCounter(VSphereSession session, String metricName) {
        return fetchCatalog(session).resolve(metricName);
    }
}
