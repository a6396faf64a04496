package org.tanzu.vcenterperf.session;

import org.tanzu.vcenterperf.vcenter.ServiceContent;
import org.tanzu.vcenterperf.vcenter.VimApi;

import java.net.URI;

/**
 * An authenticated vCenter session.
 *
 * Holds the endpoint-bound client, the session id issued at login, and the service
 * content that names the inventory root and the managers. Immutable; shared read-only
 * by every step of a run.
 */
public final class VSphereSession {

    private final VimApi client;
    private final String username;
    private final String sessionId;
    private final ServiceContent serviceContent;

    public VSphereSession(VimApi client, String username, String sessionId, ServiceContent serviceContent) {
        this.client = client;
        this.username = username;
        this.sessionId = sessionId;
        this.serviceContent = serviceContent;
    }

    public VimApi getClient() { return client; }

    public URI getEndpoint() { return client.getEndpoint(); }

    public String getUsername() { return username; }

    public String getSessionId() { return sessionId; }

    public ServiceContent getServiceContent() { return serviceContent; }

    /**
     * The session id is hidden so that it never appears in logs.
     */
    @Override
    public String toString() {
        return "VSphereSession{endpoint=" + getEndpoint() + ", username='" + username + "', sessionId='[HIDDEN]'}";
    }
}
