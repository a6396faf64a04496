/**
 * Counter resolution and per-VM performance queries.
 */
package org.tanzu.vcenterperf.perf;
