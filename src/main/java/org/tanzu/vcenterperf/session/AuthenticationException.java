package org.tanzu.vcenterperf.session;

import org.tanzu.vcenterperf.VCenterPerfException;

/**
 * The endpoint was reached but rejected the credentials.
 */
public class AuthenticationException extends VCenterPerfException {

    public AuthenticationException(String message, Throwable cause) {
        super("connect", message, cause);
    }
}
