package org.tanzu.vcenterperf.report;

import java.util.List;

/**
 * Receives the values extracted for each virtual machine.
 */
public interface ReportEmitter {

    /**
     * @param entityName Display name of the virtual machine
     * @param values The values of one series, oldest first
     */
    void emit(String entityName, List<Long> values);
}
