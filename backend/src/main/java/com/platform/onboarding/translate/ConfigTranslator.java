package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.NestedReference;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.schema.SchemaMap;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts declarations and raw device reads into the canonical
 * {@link DeviceConfig}, and canonical objects into device request bodies.
 * 
 * In the canonical form every property is keyed by its current id, values
 * carry the device encoding, references are full paths and optional
 * properties with a default are filled in. Comparing two canonical objects
 * therefore compares what the device would hold.
 */
public class ConfigTranslator {
    
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final String COMMON_PREFIX = "/Common/";
    
    private final SchemaMap schema;
    private final IdentifierMigrator migrator;
    
    public ConfigTranslator(SchemaMap schema, IdentifierMigrator migrator) {
        this.schema = schema;
        this.migrator = migrator;
    }
    
    public SchemaMap getSchema() {
        return schema;
    }
    
    // ==================== Declaration -> canonical ====================
    
    /**
     * Translates the Common section of a validated declaration.
     */
    public DeviceConfig fromDeclaration(Declaration declaration) {
        DeviceConfig.Builder builder = DeviceConfig.builder();
        ObjectNode common = declaration.common();
        ObjectNode system = null;
        
        Iterator<Map.Entry<String, JsonNode>> entries = common.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            if (!value.isObject() || !value.has("class")) {
                continue;
            }
            String declaredClass = value.get("class").asText();
            ConfigItem item = schema.find(declaredClass)
                .orElseThrow(() -> new ValidationException("class", declaredClass, "unknown configuration class"));
            
            ObjectNode properties = ((ObjectNode) value).deepCopy();
            properties.remove("class");
            properties.remove("label");
            migrator.updateIds(item, properties);
            
            if (item.isNameless()) {
                if (item.configClass() == ConfigClass.SYSTEM) {
                    system = properties;
                    continue;
                }
                builder.putNameless(item.configClass(), canonicalize(item, properties));
            } else {
                builder.putNamed(item.configClass(), entry.getKey(), canonicalize(item, properties));
            }
        }
        
        // Common.hostname is shorthand for System.hostname
        JsonNode hostname = common.get("hostname");
        if (hostname != null && hostname.isTextual()) {
            if (system == null) {
                system = JSON.objectNode();
            }
            if (!system.has("hostname")) {
                system.set("hostname", hostname);
            }
        }
        if (system != null) {
            builder.putNameless(ConfigClass.SYSTEM, canonicalize(schema.item(ConfigClass.SYSTEM), system));
        }
        return builder.build();
    }
    
    /**
     * Canonicalizes one object given in declared form, keyed by property id.
     * Unknown properties are dropped.
     */
    public ConfigObject canonicalize(ConfigItem item, ObjectNode declared) {
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = declared.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<PropertyDescriptor> descriptor = item.property(field.getKey());
            if (descriptor.isPresent() && !field.getValue().isNull()) {
                properties.put(field.getKey(), encode(descriptor.get(), field.getValue()));
            }
        }
        for (PropertyDescriptor descriptor : item.properties()) {
            if (!properties.containsKey(descriptor.id()) && descriptor.hasDefault()) {
                properties.put(descriptor.id(), descriptor.defaultValue().deepCopy());
            }
        }
        if (item.configClass() == ConfigClass.AUTHENTICATION) {
            ObjectNode authentication = JSON.objectNode();
            properties.forEach(authentication::set);
            AuthenticationMapper.canonicalize(authentication);
            return ConfigObject.fromJson(authentication);
        }
        return ConfigObject.of(properties);
    }
    
    /**
     * Encodes a declared value for the device. Already encoded values pass
     * through unchanged, so encoding is idempotent.
     */
    public JsonNode encode(PropertyDescriptor descriptor, JsonNode value) {
        if (value.isTextual() && descriptor.valueMap().containsKey(value.asText())) {
            return TextNode.valueOf(descriptor.valueMap().get(value.asText()));
        }
        return switch (descriptor.type()) {
            case ENABLED_DISABLED -> value.isBoolean()
                ? TextNode.valueOf(value.asBoolean() ? "enabled" : "disabled") : value.deepCopy();
            case INVERTED_ENABLED_DISABLED -> value.isBoolean()
                ? TextNode.valueOf(value.asBoolean() ? "disabled" : "enabled") : value.deepCopy();
            case TRUE_FALSE_STRING -> value.isBoolean()
                ? TextNode.valueOf(value.asBoolean() ? "true" : "false") : value.deepCopy();
            case YES_NO -> value.isBoolean()
                ? TextNode.valueOf(value.asBoolean() ? "yes" : "no") : value.deepCopy();
            case INTEGER -> encodeInteger(value);
            case REFERENCE -> value.isTextual() ? TextNode.valueOf(normalizeReference(value.asText())) : value.deepCopy();
            case REFERENCE_LIST -> encodeReferenceList(value);
            case LIST -> normalizeNested(descriptor, value.isTextual() ? JSON.arrayNode().add(value.asText()) : value.deepCopy());
            case OBJECT -> normalizeNested(descriptor, value.deepCopy());
            default -> value.deepCopy();
        };
    }
    
    private static JsonNode encodeInteger(JsonNode value) {
        if (value.isTextual()) {
            try {
                return IntNode.valueOf(Integer.parseInt(value.asText()));
            } catch (NumberFormatException e) {
                return value.deepCopy();
            }
        }
        return value.deepCopy();
    }
    
    private static JsonNode encodeReferenceList(JsonNode value) {
        ArrayNode list = JSON.arrayNode();
        if (value.isTextual()) {
            // the device reports some reference lists as one "a and b" string
            for (String name : value.asText().split(" and ")) {
                if (!name.isBlank()) {
                    list.add(normalizeReference(name.trim()));
                }
            }
            return list;
        }
        if (!value.isArray()) {
            return value.deepCopy();
        }
        for (JsonNode element : value) {
            list.add(element.isTextual() ? TextNode.valueOf(normalizeReference(element.asText())) : element.deepCopy());
        }
        return list;
    }
    
    private static JsonNode normalizeNested(PropertyDescriptor descriptor, JsonNode value) {
        for (NestedReference reference : descriptor.nestedReferences()) {
            normalizeAt(value, reference.segments(), 0);
        }
        return value;
    }
    
    private static void normalizeAt(JsonNode node, String[] segments, int index) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                normalizeAt(element, segments, index);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode object = (ObjectNode) node;
        String field = segments[index];
        JsonNode child = object.get(field);
        if (child == null) {
            return;
        }
        if (index < segments.length - 1) {
            normalizeAt(child, segments, index + 1);
        } else if (child.isTextual()) {
            object.put(field, normalizeReference(child.asText()));
        } else if (child.isArray()) {
            ArrayNode normalized = JSON.arrayNode();
            child.forEach(name -> normalized.add(name.isTextual() ? normalizeReference(name.asText()) : name.asText()));
            object.set(field, normalized);
        }
    }
    
    // ==================== Device -> canonical ====================
    
    /**
     * Translates raw device reads. Nameless classes map to one device object,
     * named classes to an array of items; items outside Common are skipped.
     */
    public DeviceConfig fromDevice(Map<ConfigClass, JsonNode> raw) {
        DeviceConfig.Builder builder = DeviceConfig.builder();
        for (ConfigItem item : schema.items()) {
            JsonNode value = raw.get(item.configClass());
            if (value == null) {
                continue;
            }
            if (item.isNameless()) {
                if (value.isObject()) {
                    builder.putNameless(item.configClass(), fromDeviceObject(item, value));
                }
                continue;
            }
            for (JsonNode element : value) {
                String partition = element.path("partition").asText("Common");
                String name = element.path("name").asText(null);
                if (name == null || !"Common".equals(partition)) {
                    continue;
                }
                builder.putNamed(item.configClass(), name, fromDeviceObject(item, element));
            }
        }
        return builder.build();
    }
    
    public ConfigObject fromDeviceObject(ConfigItem item, JsonNode body) {
        ObjectNode declared = JSON.objectNode();
        for (PropertyDescriptor descriptor : item.properties()) {
            JsonNode value = body.get(descriptor.deviceName());
            if (value != null && !value.isNull()) {
                declared.set(descriptor.id(), value.deepCopy());
            }
        }
        return canonicalize(item, declared);
    }
    
    // ==================== Canonical -> device ====================
    
    /**
     * Builds a device request body from canonical properties.
     */
    public ObjectNode toDeviceBody(ConfigItem item, ConfigObject properties) {
        ObjectNode body = JSON.objectNode();
        for (String id : properties.propertyNames()) {
            item.property(id).ifPresent(descriptor ->
                properties.get(id).ifPresent(value -> body.set(descriptor.deviceName(), value)));
        }
        return body;
    }
    
    // ==================== References ====================
    
    public static String normalizeReference(String name) {
        return name.startsWith("/") ? name : COMMON_PREFIX + name;
    }
    
    /**
     * Object name of a reference in Common, or empty for other partitions.
     */
    public static Optional<String> commonName(String reference) {
        if (reference.startsWith(COMMON_PREFIX)) {
            return Optional.of(reference.substring(COMMON_PREFIX.length()));
        }
        return reference.startsWith("/") ? Optional.empty() : Optional.of(reference);
    }
}
