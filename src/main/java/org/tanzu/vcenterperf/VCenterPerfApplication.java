package org.tanzu.vcenterperf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the vCenter CPU usage reporter.
 *
 * The application connects to a vCenter, lists its virtual machines, and prints the
 * latest "cpu.usagemhz.average" sample of each one. It runs a single pass and exits:
 * status 0 when the pass completed (even if some machines could not be queried),
 * 2 for configuration errors, 1 for other failures and 130 when cancelled.
 *
 * Key features:
 * - Talks to vCenter through the VI/JSON API using Spring WebClient
 * - Resolves the counter name to its numeric id once per run
 * - Optional parallel per-VM queries (vcenter.perf.concurrency)
 * - Supports Cloud Foundry deployment with service binding
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VCenterPerfApplication {

    /**
     * Main application entry point.
     *
     * The collection pass runs inside {@link SpringApplication#run}; the exit status
     * recorded by the runner is then passed to {@link System#exit}.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "vcenter-perf");
        System.exit(SpringApplication.exit(SpringApplication.run(VCenterPerfApplication.class, args)));
    }
}
