/**
 * Configuration for the vCenter CPU usage reporter.
 *
 * <p>Provides vCenter connection settings ({@link org.tanzu.vcenterperf.config.VCenterConfig}),
 * query settings ({@link org.tanzu.vcenterperf.config.PerfQueryConfig}),
 * legacy environment and Cloud Foundry VCAP_SERVICES processing plus validation
 * ({@link org.tanzu.vcenterperf.config.VCenterConfigProcessor}),
 * and WebClient setup with optional insecure SSL ({@link org.tanzu.vcenterperf.config.WebClientConfig}).
 */
package org.tanzu.vcenterperf.config;
