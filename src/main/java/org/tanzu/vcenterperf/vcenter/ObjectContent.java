package org.tanzu.vcenterperf.vcenter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One object returned by the property collector with the properties that were asked for.
 * Property values are unwrapped from their VI/JSON "_value" envelope.
 */
public final class ObjectContent {

    private final ManagedObjectReference obj;
    private final Map<String, JsonNode> properties;

    public ObjectContent(ManagedObjectReference obj, Map<String, JsonNode> properties) {
        this.obj = obj;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public ManagedObjectReference getObj() { return obj; }

    public Map<String, JsonNode> getProperties() { return properties; }

    /**
     * Gets a property as text.
     * @param name The property path, e.g. "name"
     * @return The text value, or null when the property was not returned
     */
    public String getText(String name) {
        JsonNode value = properties.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public String toString() {
        return "ObjectContent{obj=" + obj + ", properties=" + properties.keySet() + '}';
    }
}
