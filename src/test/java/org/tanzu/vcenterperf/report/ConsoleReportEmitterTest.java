package org.tanzu.vcenterperf.report;

import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.config.PerfQueryConfig;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReportEmitterTest {

    @Test
    void printsOneLinePerSeries() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReportEmitter emitter = new ConsoleReportEmitter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), "CPU Usage (MHz)");

        emitter.emit("web-01", List.of(350L));
        emitter.emit("app-02", List.of(120L, 135L));

        assertThat(buffer.toString(StandardCharsets.UTF_8).lines())
                .containsExactly("VM: web-01, CPU Usage (MHz): [350]", "VM: app-02, CPU Usage (MHz): [120, 135]");
    }

    @Test
    void usesConfiguredLabel() {
        PerfQueryConfig config = new PerfQueryConfig();
        config.setLabel("Memory Usage (%)");

        ConsoleReportEmitter emitter = new ConsoleReportEmitter(config);

        assertThat(emitter.format("db-01", List.of(4200L))).isEqualTo("VM: db-01, Memory Usage (%): [4200]");
    }
}
