package org.tanzu.vcenterperf.vcenter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between VI/JSON documents and the client's model types.
 *
 * VI/JSON marks every data object with a "_typeName" discriminator, and wraps values
 * held in untyped ("Any") positions as {"_typeName": "string", "_value": ...}.
 * Readers are lenient about missing optional fields; a document that lacks a required
 * field fails with IllegalArgumentException.
 */
public class VimJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(VimJsonCodec.class);

    static final String TYPE_NAME = "_typeName";
    static final String VALUE = "_value";

    private final ObjectMapper objectMapper;

    public VimJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String json) throws JsonProcessingException {
        return objectMapper.readTree(json);
    }

    // ---- requests ----

    public ObjectNode moRef(ManagedObjectReference ref) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE_NAME, "ManagedObjectReference");
        node.put("type", ref.getType());
        node.put("value", ref.getValue());
        return node;
    }

    public ObjectNode loginRequest(String userName, String password) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("userName", userName);
        request.put("password", password);
        return request;
    }

    public ObjectNode createContainerViewRequest(ManagedObjectReference container, List<String> types, boolean recursive) {
        ObjectNode request = objectMapper.createObjectNode();
        request.set("container", moRef(container));
        ArrayNode typeArray = request.putArray("type");
        types.forEach(typeArray::add);
        request.put("recursive", recursive);
        return request;
    }

    /**
     * Builds a RetrievePropertiesEx request that starts at a container view, skips the
     * view itself, and follows its "view" property to the listed objects.
     */
    public ObjectNode retrieveViewPropertiesRequest(ManagedObjectReference view, String type, List<String> pathSet) {
        ObjectNode traversal = objectMapper.createObjectNode();
        traversal.put(TYPE_NAME, "TraversalSpec");
        traversal.put("name", "traverseEntities");
        traversal.put("type", "ContainerView");
        traversal.put("path", "view");
        traversal.put("skip", false);

        ObjectNode objectSpec = objectMapper.createObjectNode();
        objectSpec.put(TYPE_NAME, "ObjectSpec");
        objectSpec.set("obj", moRef(view));
        objectSpec.put("skip", true);
        objectSpec.putArray("selectSet").add(traversal);

        ObjectNode propertySpec = objectMapper.createObjectNode();
        propertySpec.put(TYPE_NAME, "PropertySpec");
        propertySpec.put("type", type);
        ArrayNode paths = propertySpec.putArray("pathSet");
        pathSet.forEach(paths::add);

        ObjectNode filterSpec = objectMapper.createObjectNode();
        filterSpec.put(TYPE_NAME, "PropertyFilterSpec");
        filterSpec.putArray("propSet").add(propertySpec);
        filterSpec.putArray("objectSet").add(objectSpec);

        ObjectNode request = objectMapper.createObjectNode();
        request.putArray("specSet").add(filterSpec);
        ObjectNode options = request.putObject("options");
        options.put(TYPE_NAME, "RetrieveOptions");
        return request;
    }

    public ObjectNode continueRetrievePropertiesRequest(String token) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("token", token);
        return request;
    }

    public ObjectNode queryPerfRequest(PerfQuerySpec spec) {
        ObjectNode metricId = objectMapper.createObjectNode();
        metricId.put(TYPE_NAME, "PerfMetricId");
        metricId.put("counterId", spec.getCounterId());
        metricId.put("instance", spec.getInstance());

        ObjectNode querySpec = objectMapper.createObjectNode();
        querySpec.put(TYPE_NAME, "PerfQuerySpec");
        querySpec.set("entity", moRef(spec.getEntity()));
        querySpec.put("maxSample", spec.getMaxSample());
        querySpec.putArray("metricId").add(metricId);
        querySpec.put("intervalId", spec.getIntervalId());

        ObjectNode request = objectMapper.createObjectNode();
        request.putArray("querySpec").add(querySpec);
        return request;
    }

    // ---- responses ----

    public ManagedObjectReference readMoRef(JsonNode node) {
        if (node == null || node.isNull() || !node.hasNonNull("type") || !node.hasNonNull("value")) {
            throw new IllegalArgumentException("Not a ManagedObjectReference: " + node);
        }
        return new ManagedObjectReference(node.get("type").asText(), node.get("value").asText());
    }

    private ManagedObjectReference readOptionalMoRef(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : readMoRef(node);
    }

    public ServiceContent readServiceContent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || !node.isObject()) {
            throw new IllegalArgumentException("Not a ServiceContent: " + node);
        }
        return new ServiceContent(
                readMoRef(node.get("rootFolder")),
                readMoRef(node.get("propertyCollector")),
                readMoRef(node.get("viewManager")),
                readMoRef(node.get("perfManager")),
                readMoRef(node.get("sessionManager")),
                node.path("about").path("apiVersion").asText(null),
                node.path("about").path("fullName").asText(null));
    }

    /**
     * Reads a RetrieveResult. A missing body means the collector found nothing.
     */
    public RetrieveResult readRetrieveResult(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isEmpty()) {
            return new RetrieveResult(null, List.of());
        }
        List<ObjectContent> objects = new ArrayList<>();
        for (JsonNode object : node.path("objects")) {
            Map<String, JsonNode> properties = new LinkedHashMap<>();
            for (JsonNode property : object.path("propSet")) {
                properties.put(property.path("name").asText(), unwrap(property.get("val")));
            }
            objects.add(new ObjectContent(readMoRef(object.get("obj")), properties));
        }
        return new RetrieveResult(node.path("token").asText(null), objects);
    }

    public List<PerfCounterInfo> readPerfCounters(JsonNode node) {
        List<PerfCounterInfo> counters = new ArrayList<>();
        if (node == null) {
            return counters;
        }
        for (JsonNode counter : node) {
            if (!counter.has("key")) {
                logger.debug("Skipping counter without key: {}", counter);
                continue;
            }
            counters.add(new PerfCounterInfo(
                    counter.get("key").asInt(),
                    counter.path("groupInfo").path("key").asText(),
                    counter.path("nameInfo").path("key").asText(),
                    counter.path("rollupType").asText(),
                    counter.path("unitInfo").path("key").asText(),
                    counter.path("statsType").asText(),
                    counter.path("level").asInt(0),
                    counter.path("nameInfo").path("label").asText(null)));
        }
        return counters;
    }

    /**
     * Reads a QueryPerf response into its polymorphic entity results.
     * Element kinds other than PerfEntityMetric are kept as {@link UnsupportedEntityMetric}.
     */
    public List<PerfEntityMetricBase> readPerfEntityMetrics(JsonNode node) {
        List<PerfEntityMetricBase> results = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return results;
        }
        for (JsonNode element : node) {
            String typeName = element.path(TYPE_NAME).asText("");
            ManagedObjectReference entity = readOptionalMoRef(element.get("entity"));
            if (!PerfEntityMetric.TYPE_NAME.equals(typeName)) {
                results.add(new UnsupportedEntityMetric(typeName, entity));
                continue;
            }
            List<String> timestamps = new ArrayList<>();
            for (JsonNode sampleInfo : element.path("sampleInfo")) {
                timestamps.add(sampleInfo.path("timestamp").asText());
            }
            List<PerfMetricSeries> series = new ArrayList<>();
            for (JsonNode value : element.path("value")) {
                series.add(readSeries(value));
            }
            results.add(new PerfEntityMetric(entity, timestamps, series));
        }
        return results;
    }

    private PerfMetricSeries readSeries(JsonNode node) {
        String typeName = node.path(TYPE_NAME).asText("");
        int counterId = node.path("id").path("counterId").asInt(-1);
        String instance = node.path("id").path("instance").asText("");
        if (!PerfMetricIntSeries.TYPE_NAME.equals(typeName)) {
            return new UnsupportedMetricSeries(typeName, counterId, instance);
        }
        List<Long> values = new ArrayList<>();
        for (JsonNode value : node.path("value")) {
            values.add(value.asLong());
        }
        return new PerfMetricIntSeries(counterId, instance, values);
    }

    /**
     * Builds the exception for an error response.
     *
     * @param httpStatus The HTTP status code
     * @param body The response body, possibly empty or not JSON
     */
    public VimFaultException readFault(int httpStatus, String body) {
        if (body != null && body.trim().startsWith("{")) {
            try {
                JsonNode fault = objectMapper.readTree(body);
                String faultType = fault.path(TYPE_NAME).asText("HttpError");
                String message = fault.path("faultMessage").path(0).path("message").asText(null);
                if (message == null) {
                    message = fault.path("msg").asText(faultType);
                }
                return new VimFaultException(faultType, httpStatus, message);
            } catch (Exception e) {
                logger.debug("Error body is not a VI/JSON fault: {}", e.getMessage());
            }
        }
        String message = body == null || body.isBlank() ? "no response body" : body.trim();
        return new VimFaultException("HttpError", httpStatus, message);
    }

    /**
     * Removes the {"_typeName", "_value"} envelope of a boxed primitive.
     */
    JsonNode unwrap(JsonNode node) {
        if (node != null && node.isObject() && node.has(VALUE)) {
            return node.get(VALUE);
        }
        return node;
    }
}
