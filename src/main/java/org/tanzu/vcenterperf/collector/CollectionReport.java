package org.tanzu.vcenterperf.collector;

import org.tanzu.vcenterperf.perf.CounterDescriptor;
import org.tanzu.vcenterperf.perf.MetricSample;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The result of one collection pass: the counter that was queried and one
 * {@link EntityResult} per virtual machine, in inventory order.
 */
public final class CollectionReport {

    private final CounterDescriptor counter;
    private final List<EntityResult> results;

    public CollectionReport(CounterDescriptor counter, List<EntityResult> results) {
        this.counter = counter;
        this.results = List.copyOf(results);
    }

    public CounterDescriptor getCounter() { return counter; }

    public List<EntityResult> getResults() { return results; }

    public List<MetricSample> getSamples() {
        return results.stream()
                .filter(EntityResult::isOk)
                .map(EntityResult::getSample)
                .collect(Collectors.toList());
    }

    public List<EntityResult> getFailures() {
        return results.stream()
                .filter(result -> !result.isOk())
                .collect(Collectors.toList());
    }

    public int getEntityCount() {
        return results.size();
    }

    @Override
    public String toString() {
        return "CollectionReport{counter=" + counter + ", entities=" + results.size()
                + ", failures=" + getFailures().size() + '}';
    }
}
