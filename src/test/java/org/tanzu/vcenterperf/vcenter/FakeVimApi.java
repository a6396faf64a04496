package org.tanzu.vcenterperf.vcenter;

import com.fasterxml.jackson.databind.node.TextNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory vCenter for tests: a fixed inventory, counter catalog and per-VM answers,
 * with switches to make individual calls fail. Records the calls it receives.
 */
public class FakeVimApi implements VimApi {

    public static final String SESSION_ID = "fake-session";

    public static final ServiceContent CONTENT = new ServiceContent(
            new ManagedObjectReference("Folder", "group-d1"),
            new ManagedObjectReference("PropertyCollector", "propertyCollector"),
            new ManagedObjectReference("ViewManager", "ViewManager"),
            new ManagedObjectReference("PerformanceManager", "PerfMgr"),
            new ManagedObjectReference("SessionManager", "SessionManager"),
            "8.0.2.0",
            "VMware vCenter Server 8.0.2 build-22385739");

    private final URI endpoint = URI.create("https://vc.example.com:443/sdk");

    private final Map<ManagedObjectReference, String> vms = new LinkedHashMap<>();
    private final List<PerfCounterInfo> counters = new ArrayList<>();
    private final Map<String, List<PerfEntityMetricBase>> perfAnswers = new HashMap<>();
    private final Map<String, RuntimeException> perfFailures = new HashMap<>();

    private int pageSize = Integer.MAX_VALUE;
    private RuntimeException loginFailure;
    private RuntimeException createViewFailure;
    private RuntimeException retrieveFailure;
    private RuntimeException countersFailure;

    public final AtomicInteger logins = new AtomicInteger();
    public final AtomicInteger logouts = new AtomicInteger();
    public final AtomicInteger viewsCreated = new AtomicInteger();
    public final AtomicInteger viewsDestroyed = new AtomicInteger();
    public final AtomicInteger catalogFetches = new AtomicInteger();
    public final List<PerfQuerySpec> queries = new CopyOnWriteArrayList<>();

    public static ManagedObjectReference vmRef(String value) {
        return new ManagedObjectReference("VirtualMachine", value);
    }

    public static PerfCounterInfo counter(int key, String group, String name, String rollup) {
        return new PerfCounterInfo(key, group, name, rollup, "megaHertz", "rate", 1, name);
    }

    public static PerfEntityMetric intResult(String vmValue, int counterId, long... values) {
        List<Long> list = new ArrayList<>();
        for (long value : values) {
            list.add(value);
        }
        return new PerfEntityMetric(vmRef(vmValue), List.of("2026-10-17T10:00:00Z"),
                List.of(new PerfMetricIntSeries(counterId, "", list)));
    }

    public FakeVimApi withVm(String value, String name) {
        vms.put(vmRef(value), name);
        return this;
    }

    public FakeVimApi withCounter(PerfCounterInfo counter) {
        counters.add(counter);
        return this;
    }

    public FakeVimApi withPerf(String vmValue, PerfEntityMetricBase... results) {
        perfAnswers.put(vmValue, List.of(results));
        return this;
    }

    public FakeVimApi withPerfFailure(String vmValue, RuntimeException failure) {
        perfFailures.put(vmValue, failure);
        return this;
    }

    public FakeVimApi withPageSize(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public FakeVimApi failLogin(RuntimeException failure) {
        this.loginFailure = failure;
        return this;
    }

    public FakeVimApi failCreateView(RuntimeException failure) {
        this.createViewFailure = failure;
        return this;
    }

    public FakeVimApi failRetrieve(RuntimeException failure) {
        this.retrieveFailure = failure;
        return this;
    }

    public FakeVimApi failCounters(RuntimeException failure) {
        this.countersFailure = failure;
        return this;
    }

    @Override
    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public ServiceContent retrieveServiceContent() {
        return CONTENT;
    }

    @Override
    public String login(ManagedObjectReference sessionManager, String userName, String password) {
        if (loginFailure != null) {
            throw loginFailure;
        }
        logins.incrementAndGet();
        return SESSION_ID;
    }

    @Override
    public void logout(String sessionId, ManagedObjectReference sessionManager) {
        logouts.incrementAndGet();
    }

    @Override
    public ManagedObjectReference createContainerView(String sessionId, ManagedObjectReference viewManager,
                                                      ManagedObjectReference container, List<String> types, boolean recursive) {
        if (createViewFailure != null) {
            throw createViewFailure;
        }
        return new ManagedObjectReference("ContainerView", "session[x]view-" + viewsCreated.incrementAndGet());
    }

    @Override
    public RetrieveResult retrieveViewProperties(String sessionId, ManagedObjectReference propertyCollector,
                                                 ManagedObjectReference view, String type, List<String> pathSet) {
        if (retrieveFailure != null) {
            throw retrieveFailure;
        }
        return page(0);
    }

    @Override
    public RetrieveResult continueRetrieveProperties(String sessionId, ManagedObjectReference propertyCollector, String token) {
        return page(Integer.parseInt(token));
    }

    private RetrieveResult page(int from) {
        List<ObjectContent> objects = new ArrayList<>();
        List<Map.Entry<ManagedObjectReference, String>> entries = new ArrayList<>(vms.entrySet());
        int to = (int) Math.min((long) from + pageSize, entries.size());
        for (Map.Entry<ManagedObjectReference, String> entry : entries.subList(from, to)) {
            objects.add(new ObjectContent(entry.getKey(),
                    Map.of("name", TextNode.valueOf(entry.getValue()))));
        }
        return new RetrieveResult(to < entries.size() ? String.valueOf(to) : null, objects);
    }

    @Override
    public void destroyView(String sessionId, ManagedObjectReference view) {
        viewsDestroyed.incrementAndGet();
    }

    @Override
    public List<PerfCounterInfo> retrievePerfCounters(String sessionId, ManagedObjectReference perfManager) {
        catalogFetches.incrementAndGet();
        if (countersFailure != null) {
            throw countersFailure;
        }
        return List.copyOf(counters);
    }

    @Override
    public List<PerfEntityMetricBase> queryPerf(String sessionId, ManagedObjectReference perfManager, PerfQuerySpec querySpec) {
        queries.add(querySpec);
        String vm = querySpec.getEntity().getValue();
        RuntimeException failure = perfFailures.get(vm);
        if (failure != null) {
            throw failure;
        }
        return perfAnswers.getOrDefault(vm, List.of());
    }
}
