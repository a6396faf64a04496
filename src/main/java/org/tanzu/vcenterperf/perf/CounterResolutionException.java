package org.tanzu.vcenterperf.perf;

import org.tanzu.vcenterperf.VCenterPerfException;

/**
 * A metric name could not be resolved to a counter, either because the catalog could
 * not be read or because it has no counter of that name.
 */
public class CounterResolutionException extends VCenterPerfException {

    public CounterResolutionException(String message, Throwable cause) {
        super("resolve counter", message, cause);
    }
}
