package org.tanzu.vcenterperf.perf;

import org.tanzu.vcenterperf.VCenterPerfException;
import org.tanzu.vcenterperf.inventory.VirtualMachineRef;

/**
 * The performance query for one virtual machine failed. Does not end the run.
 */
public class QueryException extends VCenterPerfException {

    private final VirtualMachineRef entity;

    public QueryException(VirtualMachineRef entity, String message, Throwable cause) {
        super("query", message, cause);
        this.entity = entity;
    }

    public VirtualMachineRef getEntity() { return entity; }
}
