package org.tanzu.vcenterperf.vcenter;

/**
 * A fault reported by the vCenter VI/JSON API, e.g. "InvalidLogin" or "ManagedObjectNotFound".
 */
public class VimFaultException extends RuntimeException {

    private final String faultType;
    private final int httpStatus;

    public VimFaultException(String faultType, int httpStatus, String message) {
        super(faultType + " (HTTP " + httpStatus + "): " + message);
        this.faultType = faultType;
        this.httpStatus = httpStatus;
    }

    /** The fault's "_typeName", or "HttpError" when the body carried no fault */
    public String getFaultType() { return faultType; }

    public int getHttpStatus() { return httpStatus; }

    /**
     * Checks whether the server rejected the caller's identity or credentials.
     * @return true for login, permission and authentication faults, or HTTP 401/403
     */
    public boolean isAuthenticationFault() {
        return "InvalidLogin".equals(faultType)
                || "NotAuthenticated".equals(faultType)
                || "NoPermission".equals(faultType)
                || httpStatus == 401
                || httpStatus == 403;
    }
}
