package org.tanzu.vcenterperf.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.config.PerfQueryConfig;
import org.tanzu.vcenterperf.config.VCenterConfig;
import org.tanzu.vcenterperf.inventory.InventoryEnumerator;
import org.tanzu.vcenterperf.inventory.InventoryException;
import org.tanzu.vcenterperf.perf.CounterCatalogResolver;
import org.tanzu.vcenterperf.perf.MetricQueryEngine;
import org.tanzu.vcenterperf.perf.QueryException;
import org.tanzu.vcenterperf.perf.UnknownMetricException;
import org.tanzu.vcenterperf.report.ReportEmitter;
import org.tanzu.vcenterperf.session.AuthenticationException;
import org.tanzu.vcenterperf.session.SessionManager;
import org.tanzu.vcenterperf.vcenter.FakeVimApi;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;
import org.tanzu.vcenterperf.vcenter.RunContext;
import org.tanzu.vcenterperf.vcenter.VimClientFactory;
import org.tanzu.vcenterperf.vcenter.VimFaultException;
import org.tanzu.vcenterperf.vcenter.VimTransportException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs whole collection passes against an in-memory vCenter.
 */
class CpuUsageCollectorTest {

    private final List<String> lines = Collections.synchronizedList(new ArrayList<>());
    private final ReportEmitter emitter = (name, values) -> lines.add(name + " " + values);

    private VCenterConfig vCenterConfig;
    private PerfQueryConfig perfQueryConfig;
    private RunContext runContext;
    private FakeVimApi vim;

    @BeforeEach
    void setUp() {
        vCenterConfig = new VCenterConfig();
        vCenterConfig.setHost("vc.example.com");
        vCenterConfig.setUsername("admin");
        vCenterConfig.setPassword("s3cret");
        perfQueryConfig = new PerfQueryConfig();
        runContext = new RunContext();
        vim = new FakeVimApi()
                .withVm("vm-1", "web-01")
                .withVm("vm-2", "db-01")
                .withCounter(FakeVimApi.counter(2, "cpu", "usage", "average"))
                .withCounter(FakeVimApi.counter(6, "cpu", "usagemhz", "average"));
    }

    private CpuUsageCollector collector() {
        VimClientFactory clientFactory = mock(VimClientFactory.class);
        when(clientFactory.create(any())).thenReturn(vim);
        return new CpuUsageCollector(vCenterConfig, perfQueryConfig, new SessionManager(clientFactory),
                new InventoryEnumerator(), new CounterCatalogResolver(), new MetricQueryEngine(perfQueryConfig),
                emitter, runContext);
    }

    @Test
    void reportsMachinesWithDataAndSkipsFailedOnes() {
        vim.withPerf("vm-1", FakeVimApi.intResult("vm-1", 6, 350))
                .withPerfFailure("vm-2", new VimTransportException("read timed out", null));

        CollectionReport report = collector().collect();

        assertThat(lines).containsExactly("web-01 [350]");
        assertThat(report.getCounter().getKey()).isEqualTo(6);
        assertThat(report.getEntityCount()).isEqualTo(2);
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getEntity().getName()).isEqualTo("db-01");
            assertThat(failure.getError()).isInstanceOf(QueryException.class);
        });
        assertThat(vim.logouts).hasValue(1);
    }

    @Test
    void failedMachineDoesNotHideMachinesBeforeOrAfterIt() {
        assertIsolatedFailure(1);
    }

    @Test
    void failedMachineDoesNotHideOthersWhenQueriedInParallel() {
        assertIsolatedFailure(4);
    }

    private void assertIsolatedFailure(int concurrency) {
        perfQueryConfig.setConcurrency(concurrency);
        vim = new FakeVimApi()
                .withCounter(FakeVimApi.counter(6, "cpu", "usagemhz", "average"))
                .withVm("vm-a", "a")
                .withVm("vm-b", "b")
                .withVm("vm-c", "c")
                .withPerf("vm-a", FakeVimApi.intResult("vm-a", 6, 1))
                .withPerfFailure("vm-b", new VimFaultException("ManagedObjectNotFound", 500, "vm-b is gone"))
                .withPerf("vm-c", FakeVimApi.intResult("vm-c", 6, 3));

        CollectionReport report = collector().collect();

        assertThat(lines).containsExactly("a [1]", "c [3]");
        assertThat(vim.queries).hasSize(3);
        assertThat(report.getResults()).extracting(result -> result.getEntity().getName())
                .containsExactly("a", "b", "c");
        assertThat(report.getFailures()).singleElement()
                .satisfies(failure -> assertThat(failure.getEntity().getName()).isEqualTo("b"));
    }

    @Test
    void everyMachineIsQueriedWithTheResolvedCounter() {
        collector().collect();

        assertThat(vim.queries).hasSize(2)
                .allSatisfy(spec -> {
                    assertThat(spec.getCounterId()).isEqualTo(6);
                    assertThat(spec.getIntervalId()).isEqualTo(20);
                    assertThat(spec.getMaxSample()).isEqualTo(1);
                });
        assertThat(vim.catalogFetches).hasValue(1);
    }

    @Test
    void machineWithoutDataIsNotReported() {
        vim.withPerf("vm-2", FakeVimApi.intResult("vm-2", 6, 1200));

        CollectionReport report = collector().collect();

        assertThat(lines).containsExactly("db-01 [1200]");
        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getSamples()).hasSize(2);
    }

    @Test
    void unknownMetricEndsThePassBeforeAnyQuery() {
        perfQueryConfig.setMetricName("cpu.bogus.average");

        assertThatThrownBy(() -> collector().collect()).isInstanceOf(UnknownMetricException.class);
        assertThat(vim.queries).isEmpty();
        assertThat(lines).isEmpty();
        assertThat(vim.logouts).hasValue(1);
    }

    @Test
    void inventoryFailureEndsThePassBeforeCatalogFetch() {
        vim.failRetrieve(new VimFaultException("SystemError", 500, "boom"));

        assertThatThrownBy(() -> collector().collect()).isInstanceOf(InventoryException.class);
        assertThat(vim.catalogFetches).hasValue(0);
        assertThat(vim.viewsDestroyed).hasValue(1);
        assertThat(vim.logouts).hasValue(1);
    }

    @Test
    void rejectedCredentialsEndThePassWithoutLogout() {
        vim.failLogin(new VimFaultException("InvalidLogin", 500, "Cannot complete login"));

        assertThatThrownBy(() -> collector().collect()).isInstanceOf(AuthenticationException.class);
        assertThat(vim.logouts).hasValue(0);
        assertThat(vim.viewsCreated).hasValue(0);
    }

    @Test
    void emptyInventoryProducesEmptyReport() {
        vim = new FakeVimApi().withCounter(FakeVimApi.counter(6, "cpu", "usagemhz", "average"));

        CollectionReport report = collector().collect();

        assertThat(report.getEntityCount()).isZero();
        assertThat(lines).isEmpty();
    }

    @Test
    void parallelQueriesKeepInventoryOrder() {
        perfQueryConfig.setConcurrency(4);
        vim = new FakeVimApi().withCounter(FakeVimApi.counter(6, "cpu", "usagemhz", "average"));
        for (int i = 1; i <= 12; i++) {
            vim.withVm("vm-" + i, "vm" + i).withPerf("vm-" + i, FakeVimApi.intResult("vm-" + i, 6, i * 100L));
        }

        CollectionReport report = collector().collect();

        assertThat(report.getEntityCount()).isEqualTo(12);
        assertThat(vim.queries).hasSize(12);
        assertThat(lines).hasSize(12).startsWith("vm1 [100]", "vm2 [200]").endsWith("vm12 [1200]");
    }

    @Test
    void cancelledRunMakesNoCalls() {
        runContext.cancel("interrupted");

        assertThatThrownBy(() -> collector().collect()).isInstanceOf(RunCancelledException.class);
        assertThat(vim.logins).hasValue(0);
    }
}
