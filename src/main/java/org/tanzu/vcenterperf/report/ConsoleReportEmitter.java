package org.tanzu.vcenterperf.report;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.config.PerfQueryConfig;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints one line per series to standard output, e.g.
 * {@code VM: web-01, CPU Usage (MHz): [350]}.
 */
@Component
public class ConsoleReportEmitter implements ReportEmitter {

    private final PrintStream out;
    private final String label;

    @Autowired
    public ConsoleReportEmitter(PerfQueryConfig perfQueryConfig) {
        this(System.out, perfQueryConfig.getLabel());
    }

    public ConsoleReportEmitter(PrintStream out, String label) {
        this.out = out;
        this.label = label;
    }

    @Override
    public void emit(String entityName, List<Long> values) {
        out.println(format(entityName, values));
        out.flush();
    }

    String format(String entityName, List<Long> values) {
        return "VM: " + entityName + ", " + label + ": " + values;
    }
}
