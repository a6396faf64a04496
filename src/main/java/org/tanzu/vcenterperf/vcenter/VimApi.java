package org.tanzu.vcenterperf.vcenter;

import java.net.URI;
import java.util.List;

/**
 * The vCenter VI/JSON operations used by a collection run, bound to one endpoint.
 *
 * Every method blocks until the server answers. Server faults surface as
 * {@link VimFaultException}, network failures as {@link VimTransportException}, and
 * cancellation of the run as {@link RunCancelledException}. Methods taking a session id
 * require a session obtained from {@link #login}.
 */
public interface VimApi {

    /**
     * @return The SDK endpoint this client talks to
     */
    URI getEndpoint();

    /**
     * Reads the ServiceInstance content. Does not require a session.
     */
    ServiceContent retrieveServiceContent();

    /**
     * Logs in and returns the new session id.
     */
    String login(ManagedObjectReference sessionManager, String userName, String password);

    void logout(String sessionId, ManagedObjectReference sessionManager);

    /**
     * Creates a container view over the objects of the given types below a container.
     *
     * @return Reference to the new ContainerView; it must be destroyed by the caller
     */
    ManagedObjectReference createContainerView(String sessionId, ManagedObjectReference viewManager,
                                               ManagedObjectReference container, List<String> types, boolean recursive);

    /**
     * Retrieves properties of every object of one type listed by a container view.
     *
     * @return The first page of results; follow {@link RetrieveResult#getToken()} with
     *         {@link #continueRetrieveProperties}
     */
    RetrieveResult retrieveViewProperties(String sessionId, ManagedObjectReference propertyCollector,
                                          ManagedObjectReference view, String type, List<String> pathSet);

    RetrieveResult continueRetrieveProperties(String sessionId, ManagedObjectReference propertyCollector, String token);

    void destroyView(String sessionId, ManagedObjectReference view);

    /**
     * Reads every counter definition published by the performance manager.
     */
    List<PerfCounterInfo> retrievePerfCounters(String sessionId, ManagedObjectReference perfManager);

    /**
     * Runs one performance query.
     *
     * @return One element per entity; empty when the server has no data
     */
    List<PerfEntityMetricBase> queryPerf(String sessionId, ManagedObjectReference perfManager, PerfQuerySpec querySpec);
}
