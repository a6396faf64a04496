package org.tanzu.vcenterperf.inventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.ManagedObjectReference;
import org.tanzu.vcenterperf.vcenter.ObjectContent;
import org.tanzu.vcenterperf.vcenter.RetrieveResult;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;
import org.tanzu.vcenterperf.vcenter.ServiceContent;
import org.tanzu.vcenterperf.vcenter.VimApi;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the virtual machines visible to a session.
 *
 * A recursive container view over the root folder is created for the VirtualMachine
 * type, the "name" property of every listed object is read through the property
 * collector (following continuation tokens), and the view is destroyed again whether
 * or not retrieval succeeded.
 */
@Component
public class InventoryEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(InventoryEnumerator.class);

    static final String VIRTUAL_MACHINE = "VirtualMachine";

    /**
     * Lists every virtual machine below the inventory root.
     *
     * @param session The authenticated session
     * @return The virtual machines in the order the server listed them
     * @throws InventoryException if the view cannot be created or read
     * @throws RunCancelledException if the run was cancelled
     */
    public List<VirtualMachineRef> listVirtualMachines(VSphereSession session) {
        VimApi client = session.getClient();
        ServiceContent content = session.getServiceContent();

        ManagedObjectReference view;
        try {
            view = client.createContainerView(session.getSessionId(), content.getViewManager(),
                    content.getRootFolder(), List.of(VIRTUAL_MACHINE), true);
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InventoryException("Error creating container view: " + e.getMessage(), e);
        }

        try {
            List<VirtualMachineRef> vms = retrieveAll(session, view);
            logger.info("Found {} virtual machines", vms.size());
            return vms;
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InventoryException("Error retrieving virtual machines: " + e.getMessage(), e);
        } finally {
            destroyQuietly(session, view);
        }
    }

    private List<VirtualMachineRef> retrieveAll(VSphereSession session, ManagedObjectReference view) {
        VimApi client = session.getClient();
        ManagedObjectReference propertyCollector = session.getServiceContent().getPropertyCollector();

        List<VirtualMachineRef> vms = new ArrayList<>();
        RetrieveResult page = client.retrieveViewProperties(session.getSessionId(), propertyCollector,
                view, VIRTUAL_MACHINE, List.of("name"));
        addAll(vms, page);
        while (page.hasMore()) {
            page = client.continueRetrieveProperties(session.getSessionId(), propertyCollector, page.getToken());
            addAll(vms, page);
        }
        return vms;
    }

    private void addAll(List<VirtualMachineRef> vms, RetrieveResult page) {
        for (ObjectContent object : page.getObjects()) {
            String name = object.getText("name");
            if (name == null) {
                logger.debug("No name returned for {}, using its reference", object.getObj());
                name = object.getObj().getValue();
            }
            vms.add(new VirtualMachineRef(object.getObj(), name));
        }
    }

    private void destroyQuietly(VSphereSession session, ManagedObjectReference view) {
        try {
            session.getClient().destroyView(session.getSessionId(), view);
        } catch (RuntimeException e) {
            logger.warn("Could not destroy container view {}: {}", view, e.getMessage());
        }
    }
}
