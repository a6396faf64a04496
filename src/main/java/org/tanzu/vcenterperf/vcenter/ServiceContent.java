package org.tanzu.vcenterperf.vcenter;

/**
 * The subset of the ServiceInstance content used by a collection run:
 * the inventory root and the managers the run calls into.
 */
public final class ServiceContent {

    private final ManagedObjectReference rootFolder;
    private final ManagedObjectReference propertyCollector;
    private final ManagedObjectReference viewManager;
    private final ManagedObjectReference perfManager;
    private final ManagedObjectReference sessionManager;
    private final String apiVersion;
    private final String fullName;

    public ServiceContent(ManagedObjectReference rootFolder,
                          ManagedObjectReference propertyCollector,
                          ManagedObjectReference viewManager,
                          ManagedObjectReference perfManager,
                          ManagedObjectReference sessionManager,
                          String apiVersion,
                          String fullName) {
        this.rootFolder = rootFolder;
        this.propertyCollector = propertyCollector;
        this.viewManager = viewManager;
        this.perfManager = perfManager;
        this.sessionManager = sessionManager;
        this.apiVersion = apiVersion;
        this.fullName = fullName;
    }

    public ManagedObjectReference getRootFolder() { return rootFolder; }

    public ManagedObjectReference getPropertyCollector() { return propertyCollector; }

    public ManagedObjectReference getViewManager() { return viewManager; }

    public ManagedObjectReference getPerfManager() { return perfManager; }

    public ManagedObjectReference getSessionManager() { return sessionManager; }

    /** API version reported by the server, e.g. "8.0.2.0" */
    public String getApiVersion() { return apiVersion; }

    /** Product name and build, e.g. "VMware vCenter Server 8.0.2 build-22385739" */
    public String getFullName() { return fullName; }

    @Override
    public String toString() {
        return "ServiceContent{fullName='" + fullName + "', apiVersion='" + apiVersion
                + "', rootFolder=" + rootFolder + '}';
    }
}
