package org.tanzu.vcenterperf.vcenter;

/**
 * The request did not produce a response: DNS failure, refused connection, TLS error or timeout.
 */
public class VimTransportException extends RuntimeException {

    public VimTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
