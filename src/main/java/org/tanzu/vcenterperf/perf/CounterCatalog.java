package org.tanzu.vcenterperf.perf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only mapping from counter name to {@link CounterDescriptor}.
 *
 * Names are unique: when the server publishes the same name twice the first
 * definition is kept. Safe to share between threads.
 */
public final class CounterCatalog {

    private static final Logger logger = LoggerFactory.getLogger(CounterCatalog.class);

    private final Map<String, CounterDescriptor> byName;

    private CounterCatalog(Map<String, CounterDescriptor> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds a catalog from counter descriptors.
     *
     * @param descriptors Descriptors in server order
     * @return The catalog
     */
    public static CounterCatalog of(Collection<CounterDescriptor> descriptors) {
        Map<String, CounterDescriptor> byName = new LinkedHashMap<>();
        for (CounterDescriptor descriptor : descriptors) {
            CounterDescriptor existing = byName.putIfAbsent(descriptor.getName(), descriptor);
            if (existing != null) {
                logger.debug("Duplicate counter name {} (keys {} and {}), keeping {}",
                        descriptor.getName(), existing.getKey(), descriptor.getKey(), existing.getKey());
            }
        }
        return new CounterCatalog(byName);
    }

    /**
     * Looks a counter up by exact name.
     *
     * @param metricName e.g. "cpu.usagemhz.average"
     * @return The descriptor
     * @throws UnknownMetricException if no counter has that name
     */
    public CounterDescriptor resolve(String metricName) {
        CounterDescriptor descriptor = byName.get(metricName);
        if (descriptor == null) {
            throw new UnknownMetricException(metricName);
        }
        return descriptor;
    }

    public Optional<CounterDescriptor> find(String metricName) {
        return Optional.ofNullable(byName.get(metricName));
    }

    public int size() {
        return byName.size();
    }

    @Override
    public String toString() {
        return "CounterCatalog{counters=" + byName.size() + '}';
    }
}
