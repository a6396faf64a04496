package org.tanzu.vcenterperf.perf;

import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.config.PerfQueryConfig;
import org.tanzu.vcenterperf.inventory.VirtualMachineRef;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.FakeVimApi;
import org.tanzu.vcenterperf.vcenter.PerfQuerySpec;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;
import org.tanzu.vcenterperf.vcenter.VimTransportException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricQueryEngineTest {

    private static final VirtualMachineRef WEB = new VirtualMachineRef(FakeVimApi.vmRef("vm-1"), "web-01");

    private static VSphereSession sessionOf(FakeVimApi vim) {
        return new VSphereSession(vim, "admin", FakeVimApi.SESSION_ID, FakeVimApi.CONTENT);
    }

    @Test
    void sendsOneSpecForTheEntity() {
        FakeVimApi vim = new FakeVimApi().withPerf("vm-1", FakeVimApi.intResult("vm-1", 6, 350));
        MetricQueryEngine engine = new MetricQueryEngine(new PerfQueryConfig());

        MetricSample sample = engine.queryMetric(sessionOf(vim), WEB, 6, 20, 1);

        assertThat(sample.getSeries()).singleElement()
                .satisfies(series -> assertThat(series.getValues()).containsExactly(350L));
        assertThat(vim.queries).singleElement().satisfies(spec -> {
            assertThat(spec.getEntity()).isEqualTo(FakeVimApi.vmRef("vm-1"));
            assertThat(spec.getCounterId()).isEqualTo(6);
            assertThat(spec.getInstance()).isEmpty();
            assertThat(spec.getIntervalId()).isEqualTo(20);
            assertThat(spec.getMaxSample()).isEqualTo(1);
        });
    }

    @Test
    void usesConfiguredInstance() {
        PerfQueryConfig config = new PerfQueryConfig();
        config.setInstance("*");
        FakeVimApi vim = new FakeVimApi();

        new MetricQueryEngine(config).queryMetric(sessionOf(vim), WEB, 6, 300, 5);

        PerfQuerySpec spec = vim.queries.get(0);
        assertThat(spec.getInstance()).isEqualTo("*");
        assertThat(spec.getIntervalId()).isEqualTo(300);
        assertThat(spec.getMaxSample()).isEqualTo(5);
    }

    @Test
    void failureNamesTheVirtualMachine() {
        FakeVimApi vim = new FakeVimApi().withPerfFailure("vm-1", new VimTransportException("read timed out", null));
        MetricQueryEngine engine = new MetricQueryEngine(new PerfQueryConfig());

        assertThatThrownBy(() -> engine.queryMetric(sessionOf(vim), WEB, 6, 20, 1))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getEntity()).isEqualTo(WEB);
                    assertThat(e.getMessage())
                            .isEqualTo("Error querying performance metrics for VM web-01: read timed out");
                });
    }

    @Test
    void cancellationIsNotAQueryFailure() {
        FakeVimApi vim = new FakeVimApi().withPerfFailure("vm-1", new RunCancelledException("interrupted"));
        MetricQueryEngine engine = new MetricQueryEngine(new PerfQueryConfig());

        assertThatThrownBy(() -> engine.queryMetric(sessionOf(vim), WEB, 6, 20, 1))
                .isInstanceOf(RunCancelledException.class);
    }
}
