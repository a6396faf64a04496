package org.tanzu.vcenterperf.inventory;

import org.tanzu.vcenterperf.VCenterPerfException;

/**
 * The virtual machine inventory could not be listed.
 */
public class InventoryException extends VCenterPerfException {

    public InventoryException(String message, Throwable cause) {
        super("inventory", message, cause);
    }
}
