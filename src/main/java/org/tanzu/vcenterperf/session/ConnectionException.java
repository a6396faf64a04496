package org.tanzu.vcenterperf.session;

import org.tanzu.vcenterperf.VCenterPerfException;

/**
 * The endpoint could not be reached, or did not behave like a vCenter SDK endpoint.
 */
public class ConnectionException extends VCenterPerfException {

    public ConnectionException(String message, Throwable cause) {
        super("connect", message, cause);
    }
}
