package org.tanzu.vcenterperf.vcenter;

import org.tanzu.vcenterperf.VCenterPerfException;

/**
 * Thrown by a remote call that was aborted, or refused to start, because the run was cancelled.
 */
public class RunCancelledException extends VCenterPerfException {

    public static final int EXIT_CANCELLED = 130;

    public RunCancelledException(String reason) {
        super("run", "Run cancelled: " + reason, null, EXIT_CANCELLED);
    }
}
