package com.platform.onboarding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.schema.ConfigClass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical, immutable view of a device configuration.
 * 
 * Named classes map object name to properties in insertion order;
 * nameless classes hold at most one object. The JSON form is keyed by
 * declared class name, the same shape a declaration's Common section uses.
 */
public final class DeviceConfig {
    
    private static final DeviceConfig EMPTY = new DeviceConfig(
        new EnumMap<>(ConfigClass.class), new EnumMap<>(ConfigClass.class));
    
    private final Map<ConfigClass, ConfigObject> nameless;
    private final Map<ConfigClass, Map<String, ConfigObject>> named;
    
    private DeviceConfig(Map<ConfigClass, ConfigObject> nameless, Map<ConfigClass, Map<String, ConfigObject>> named) {
        this.nameless = Collections.unmodifiableMap(new EnumMap<>(nameless));
        Map<ConfigClass, Map<String, ConfigObject>> copy = new EnumMap<>(ConfigClass.class);
        named.forEach((configClass, objects) ->
            copy.put(configClass, Collections.unmodifiableMap(new LinkedHashMap<>(objects))));
        this.named = Collections.unmodifiableMap(copy);
    }
    
    public static DeviceConfig empty() {
        return EMPTY;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.nameless.putAll(nameless);
        named.forEach((configClass, objects) -> builder.named.put(configClass, new LinkedHashMap<>(objects)));
        return builder;
    }
    
    public Optional<ConfigObject> nameless(ConfigClass configClass) {
        return Optional.ofNullable(nameless.get(configClass));
    }
    
    /**
     * Objects of a named class, empty when none exist.
     */
    public Map<String, ConfigObject> named(ConfigClass configClass) {
        return named.getOrDefault(configClass, Map.of());
    }
    
    /**
     * Looks up an object; the name is ignored for nameless classes.
     */
    public Optional<ConfigObject> find(ConfigClass configClass, String name) {
        if (configClass.isNameless()) {
            return nameless(configClass);
        }
        return Optional.ofNullable(named(configClass).get(name));
    }
    
    public boolean contains(ConfigClass configClass, String name) {
        return find(configClass, name).isPresent();
    }
    
    /**
     * Fills nameless classes this configuration leaves out with the values
     * from another configuration, typically the device's original state.
     */
    public DeviceConfig withMissingNamelessFrom(DeviceConfig other) {
        Builder builder = toBuilder();
        other.nameless.forEach((configClass, object) -> builder.nameless.putIfAbsent(configClass, object));
        return builder.build();
    }
    
    @JsonValue
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        for (ConfigClass configClass : ConfigClass.values()) {
            if (configClass.isNameless()) {
                ConfigObject object = nameless.get(configClass);
                if (object != null) {
                    root.set(configClass.getDeclaredName(), object.toJson());
                }
            } else {
                Map<String, ConfigObject> objects = named.get(configClass);
                if (objects != null && !objects.isEmpty()) {
                    ObjectNode byName = root.putObject(configClass.getDeclaredName());
                    objects.forEach((name, object) -> byName.set(name, object.toJson()));
                }
            }
        }
        return root;
    }
    
    /**
     * Rebuilds a configuration from its JSON form. Unknown class keys are ignored.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DeviceConfig fromJson(JsonNode root) {
        Builder builder = builder();
        if (root == null || !root.isObject()) {
            return builder.build();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<ConfigClass> configClass = ConfigClass.fromDeclaredName(field.getKey());
            if (configClass.isEmpty() || !field.getValue().isObject()) {
                continue;
            }
            if (configClass.get().isNameless()) {
                builder.putNameless(configClass.get(), ConfigObject.fromJson((ObjectNode) field.getValue()));
            } else {
                Iterator<Map.Entry<String, JsonNode>> objects = field.getValue().fields();
                while (objects.hasNext()) {
                    Map.Entry<String, JsonNode> object = objects.next();
                    if (object.getValue().isObject()) {
                        builder.putNamed(configClass.get(), object.getKey(),
                            ConfigObject.fromJson((ObjectNode) object.getValue()));
                    }
                }
            }
        }
        return builder.build();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceConfig other)) return false;
        return nameless.equals(other.nameless) && normalized(named).equals(normalized(other.named));
    }
    
    @Override
    public int hashCode() {
        return 31 * nameless.hashCode() + normalized(named).hashCode();
    }
    
    private static Map<ConfigClass, Map<String, ConfigObject>> normalized(Map<ConfigClass, Map<String, ConfigObject>> named) {
        Map<ConfigClass, Map<String, ConfigObject>> result = new EnumMap<>(ConfigClass.class);
        named.forEach((configClass, objects) -> {
            if (!objects.isEmpty()) {
                result.put(configClass, objects);
            }
        });
        return result;
    }
    
    @Override
    public String toString() {
        return toJson().toString();
    }
    
    /**
     * Mutable builder; {@link #build()} takes an immutable snapshot.
     */
    public static final class Builder {
        
        private final Map<ConfigClass, ConfigObject> nameless = new EnumMap<>(ConfigClass.class);
        private final Map<ConfigClass, Map<String, ConfigObject>> named = new EnumMap<>(ConfigClass.class);
        
        private Builder() {
        }
        
        public Builder putNameless(ConfigClass configClass, ConfigObject object) {
            if (!configClass.isNameless()) {
                throw new IllegalArgumentException(configClass + " is a named class");
            }
            nameless.put(configClass, object);
            return this;
        }
        
        public Builder putNamed(ConfigClass configClass, String name, ConfigObject object) {
            if (configClass.isNameless()) {
                throw new IllegalArgumentException(configClass + " is a nameless class");
            }
            named.computeIfAbsent(configClass, k -> new LinkedHashMap<>()).put(name, object);
            return this;
        }
        
        public Builder remove(ConfigClass configClass) {
            nameless.remove(configClass);
            named.remove(configClass);
            return this;
        }
        
        public DeviceConfig build() {
            return new DeviceConfig(nameless, named);
        }
    }
}
