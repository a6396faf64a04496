package org.tanzu.vcenterperf.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;
import org.tanzu.vcenterperf.vcenter.ServiceContent;
import org.tanzu.vcenterperf.vcenter.VimApi;
import org.tanzu.vcenterperf.vcenter.VimClientFactory;
import org.tanzu.vcenterperf.vcenter.VimFaultException;
import org.tanzu.vcenterperf.vcenter.VimTransportException;

import java.net.URI;

/**
 * Establishes and ends authenticated vCenter sessions.
 *
 * Connecting reads the ServiceInstance content and logs in through the session manager
 * it names. There is no retry: a failure is reported as either
 * {@link ConnectionException} (endpoint not reachable or not a vCenter) or
 * {@link AuthenticationException} (credentials rejected).
 */
@Component
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final VimClientFactory clientFactory;

    public SessionManager(VimClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Opens a session.
     *
     * @param endpointUrl SDK endpoint, e.g. https://vc.example.com:443/sdk
     * @param username User name
     * @param password Password
     * @return The authenticated session
     * @throws ConnectionException if the endpoint cannot be reached
     * @throws AuthenticationException if the credentials are rejected
     * @throws RunCancelledException if the run was cancelled
     */
    public VSphereSession connect(URI endpointUrl, String username, String password) {
        logger.info("Connecting to {} as {}", endpointUrl, username);
        VimApi client = clientFactory.create(endpointUrl);

        ServiceContent serviceContent;
        try {
            serviceContent = client.retrieveServiceContent();
        } catch (RunCancelledException e) {
            throw e;
        } catch (VimTransportException e) {
            throw new ConnectionException("Could not reach " + endpointUrl + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ConnectionException("Could not read service content from " + endpointUrl + ": " + e.getMessage(), e);
        }

        String sessionId;
        try {
            sessionId = client.login(serviceContent.getSessionManager(), username, password);
        } catch (VimTransportException e) {
            throw new ConnectionException("Could not reach " + endpointUrl + " during login: " + e.getMessage(), e);
        } catch (VimFaultException e) {
            if (e.isAuthenticationFault()) {
                throw new AuthenticationException("Credentials for '" + username + "' rejected by " + endpointUrl
                        + ": " + e.getMessage(), e);
            }
            throw new ConnectionException("Login to " + endpointUrl + " failed: " + e.getMessage(), e);
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectionException("Login to " + endpointUrl + " failed: " + e.getMessage(), e);
        }

        VSphereSession session = new VSphereSession(client, username, sessionId, serviceContent);
        logger.info("Connected to {} ({})", endpointUrl, serviceContent.getFullName());
        return session;
    }

    /**
     * Logs the session out. Failures are logged and otherwise ignored, since the server
     * expires abandoned sessions on its own.
     *
     * @param session The session to end
     */
    public void disconnect(VSphereSession session) {
        try {
            session.getClient().logout(session.getSessionId(), session.getServiceContent().getSessionManager());
            logger.debug("Logged out of {}", session.getEndpoint());
        } catch (RuntimeException e) {
            logger.warn("Logout from {} failed: {}", session.getEndpoint(), e.getMessage());
        }
    }
}
