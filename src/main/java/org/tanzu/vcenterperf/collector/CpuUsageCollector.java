package org.tanzu.vcenterperf.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tanzu.vcenterperf.config.PerfQueryConfig;
import org.tanzu.vcenterperf.config.VCenterConfig;
import org.tanzu.vcenterperf.inventory.InventoryEnumerator;
import org.tanzu.vcenterperf.inventory.VirtualMachineRef;
import org.tanzu.vcenterperf.perf.CounterCatalog;
import org.tanzu.vcenterperf.perf.CounterCatalogResolver;
import org.tanzu.vcenterperf.perf.CounterDescriptor;
import org.tanzu.vcenterperf.perf.MetricQueryEngine;
import org.tanzu.vcenterperf.perf.MetricSample;
import org.tanzu.vcenterperf.perf.MetricSeries;
import org.tanzu.vcenterperf.perf.QueryException;
import org.tanzu.vcenterperf.report.ReportEmitter;
import org.tanzu.vcenterperf.session.SessionManager;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.RunContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one collection pass.
 *
 * The pass connects, lists the virtual machines, resolves the configured counter once,
 * queries it for every machine, and hands the extracted values to the
 * {@link ReportEmitter}. Failures to connect, list, or resolve end the pass. A failed
 * query only removes that machine from the report.
 *
 * With vcenter.perf.concurrency above 1 the per-machine queries run in parallel on
 * Reactor's bounded elastic scheduler; results keep inventory order either way.
 */
@Service
public class CpuUsageCollector {

    private static final Logger logger = LoggerFactory.getLogger(CpuUsageCollector.class);

    private final VCenterConfig vCenterConfig;
    private final PerfQueryConfig perfQueryConfig;
    private final SessionManager sessionManager;
    private final InventoryEnumerator inventoryEnumerator;
    private final CounterCatalogResolver catalogResolver;
    private final MetricQueryEngine queryEngine;
    private final ReportEmitter reportEmitter;
    private final RunContext runContext;

    public CpuUsageCollector(VCenterConfig vCenterConfig,
                             PerfQueryConfig perfQueryConfig,
                             SessionManager sessionManager,
                             InventoryEnumerator inventoryEnumerator,
                             CounterCatalogResolver catalogResolver,
                             MetricQueryEngine queryEngine,
                             ReportEmitter reportEmitter,
                             RunContext runContext) {
        this.vCenterConfig = vCenterConfig;
        this.perfQueryConfig = perfQueryConfig;
        this.sessionManager = sessionManager;
        this.inventoryEnumerator = inventoryEnumerator;
        this.catalogResolver = catalogResolver;
        this.queryEngine = queryEngine;
        this.reportEmitter = reportEmitter;
        this.runContext = runContext;
    }

    /**
     * Runs the pass and emits the report.
     *
     * @return Per-machine results in inventory order
     * @throws org.tanzu.vcenterperf.VCenterPerfException subclasses for the failures that end the pass
     */
    public CollectionReport collect() {
        runContext.throwIfCancelled();
        VSphereSession session = sessionManager.connect(vCenterConfig.getEndpointUrl(),
                vCenterConfig.getUsername(), vCenterConfig.getPassword());
        try {
            List<VirtualMachineRef> vms = inventoryEnumerator.listVirtualMachines(session);

            CounterCatalog catalog = catalogResolver.fetchCatalog(session);
            CounterDescriptor counter = catalog.resolve(perfQueryConfig.getMetricName());
            logger.info("Resolved {} to counter {}", perfQueryConfig.getMetricName(), counter);

            List<EntityResult> results = queryAll(session, vms, counter);
            CollectionReport report = new CollectionReport(counter, results);
            emit(report);

            logger.info("Collected {} for {} of {} virtual machines ({} failed)",
                    counter.getName(), report.getSamples().size(), report.getEntityCount(), report.getFailures().size());
            return report;
        } finally {
            sessionManager.disconnect(session);
        }
    }

    private List<EntityResult> queryAll(VSphereSession session, List<VirtualMachineRef> vms, CounterDescriptor counter) {
        int concurrency = Math.max(1, perfQueryConfig.getConcurrency());
        if (concurrency == 1 || vms.size() < 2) {
            List<EntityResult> results = new ArrayList<>(vms.size());
            for (VirtualMachineRef vm : vms) {
                results.add(queryOne(session, vm, counter));
            }
            return results;
        }

        logger.debug("Querying {} virtual machines with concurrency {}", vms.size(), concurrency);
        return Flux.fromIterable(vms)
                .flatMapSequential(vm -> Mono.fromCallable(() -> queryOne(session, vm, counter))
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .collectList()
                .block();
    }

    private EntityResult queryOne(VSphereSession session, VirtualMachineRef vm, CounterDescriptor counter) {
        runContext.throwIfCancelled();
        try {
            MetricSample sample = queryEngine.queryMetric(session, vm, counter.getKey(),
                    perfQueryConfig.getIntervalId(), perfQueryConfig.getMaxSample());
            return EntityResult.ok(sample);
        } catch (QueryException e) {
            logger.error(e.getMessage());
            return EntityResult.failed(vm, e);
        }
    }

    private void emit(CollectionReport report) {
        for (MetricSample sample : report.getSamples()) {
            if (sample.isEmpty()) {
                logger.info("No {} sample for VM {}", report.getCounter().getName(), sample.getEntityName());
                continue;
            }
            for (MetricSeries series : sample.getSeries()) {
                reportEmitter.emit(sample.getEntityName(), series.getValues());
            }
        }
    }
}
