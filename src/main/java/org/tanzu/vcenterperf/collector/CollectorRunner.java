package org.tanzu.vcenterperf.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.VCenterPerfException;
import org.tanzu.vcenterperf.config.PerfQueryConfig;
import org.tanzu.vcenterperf.config.VCenterConfigProcessor;
import org.tanzu.vcenterperf.vcenter.RunContext;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs the collection pass when the application starts and records the exit status.
 *
 * The configuration is validated first. Fatal failures are logged once, naming the step
 * that failed, and turned into a non-zero exit status. Ctrl-C and the optional
 * vcenter.perf.run-timeout cancel the run through the {@link RunContext}.
 */
@Component
@ConditionalOnProperty(prefix = "vcenter.perf", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class CollectorRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CollectorRunner.class);

    private final VCenterConfigProcessor configProcessor;
    private final CpuUsageCollector collector;
    private final PerfQueryConfig perfQueryConfig;
    private final RunContext runContext;

    private volatile int exitCode = 0;

    public CollectorRunner(VCenterConfigProcessor configProcessor, CpuUsageCollector collector,
                           PerfQueryConfig perfQueryConfig, RunContext runContext) {
        this.configProcessor = configProcessor;
        this.collector = collector;
        this.perfQueryConfig = perfQueryConfig;
        this.runContext = runContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        Thread shutdownHook = new Thread(() -> runContext.cancel("interrupted"), "vcenter-perf-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        Disposable timeout = scheduleTimeout(perfQueryConfig.getRunTimeout());
        try {
            configProcessor.validate();
            collector.collect();
            exitCode = 0;
        } catch (VCenterPerfException e) {
            logger.error("{} failed: {}", e.getStep(), e.getMessage());
            logger.debug("Failure detail", e);
            exitCode = e.getExitCode();
        } finally {
            timeout.dispose();
            removeShutdownHook(shutdownHook);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Disposable scheduleTimeout(Duration runTimeout) {
        if (runTimeout == null || runTimeout.isZero() || runTimeout.isNegative()) {
            return () -> { };
        }
        return Mono.delay(runTimeout)
                .subscribe(tick -> runContext.cancel("run exceeded " + runTimeout));
    }

    private static void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is shutting down, shutdown hook stays registered");
        }
    }
}
