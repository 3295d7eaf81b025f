package com.platform.onboarding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable property map of one configuration object, keyed by the
 * current property id with device-encoded values. Insertion order is kept.
 */
public final class ConfigObject {
    
    private static final ConfigObject EMPTY = new ConfigObject(Map.of());
    
    private final Map<String, JsonNode> properties;
    
    private ConfigObject(Map<String, JsonNode> properties) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        properties.forEach((key, value) -> copy.put(key, value.deepCopy()));
        this.properties = Collections.unmodifiableMap(copy);
    }
    
    public static ConfigObject empty() {
        return EMPTY;
    }
    
    public static ConfigObject of(Map<String, JsonNode> properties) {
        return new ConfigObject(properties);
    }
    
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ConfigObject fromJson(ObjectNode node) {
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.put(field.getKey(), field.getValue());
        }
        return new ConfigObject(properties);
    }
    
    /**
     * Copy of the value, safe to modify.
     */
    public Optional<JsonNode> get(String id) {
        JsonNode value = properties.get(id);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }
    
    public boolean has(String id) {
        return properties.containsKey(id);
    }
    
    public Set<String> propertyNames() {
        return properties.keySet();
    }
    
    public boolean isEmpty() {
        return properties.isEmpty();
    }
    
    public ConfigObject with(String id, JsonNode value) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(properties);
        copy.put(id, value);
        return new ConfigObject(copy);
    }
    
    public ConfigObject without(String id) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(properties);
        copy.remove(id);
        return new ConfigObject(copy);
    }
    
    @JsonValue
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        properties.forEach((key, value) -> node.set(key, value.deepCopy()));
        return node;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigObject other)) return false;
        return properties.equals(other.properties);
    }
    
    @Override
    public int hashCode() {
        return properties.hashCode();
    }
    
    @Override
    public String toString() {
        return toJson().toString();
    }
}
