package com.platform.onboarding.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes one property of a configuration class.
 * 
 * Default values are held in device encoding so they compare directly
 * against what the device reports.
 *
 * @param id current property key in declarations and in the canonical form
 * @param deviceName attribute name used by the device API
 * @param type value encoding
 * @param defaultValue device-encoded default, or null when the property is unmanaged unless declared
 * @param legacyId deprecated key still accepted in stored configurations
 * @param referenceTarget class named by REFERENCE and REFERENCE_LIST values
 * @param nestedReferences references inside LIST and OBJECT values
 * @param valueMap declared to device value translation for enumerated strings
 * @param immutable the device cannot modify the property in place
 * @param writeOnly the device never reports the value back
 */
public record PropertyDescriptor(
    String id,
    String deviceName,
    PropertyType type,
    JsonNode defaultValue,
    String legacyId,
    ConfigClass referenceTarget,
    List<NestedReference> nestedReferences,
    Map<String, String> valueMap,
    boolean immutable,
    boolean writeOnly
) {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    public PropertyDescriptor {
        nestedReferences = List.copyOf(nestedReferences);
        valueMap = Map.copyOf(valueMap);
    }
    
    public static PropertyDescriptor property(String id, PropertyType type) {
        return new PropertyDescriptor(id, id, type, null, null, null, List.of(), Map.of(), false, false);
    }
    
    public PropertyDescriptor device(String name) {
        return new PropertyDescriptor(id, name, type, defaultValue, legacyId, referenceTarget,
            nestedReferences, valueMap, immutable, writeOnly);
    }
    
    public PropertyDescriptor defaultsTo(Object value) {
        return new PropertyDescriptor(id, deviceName, type, MAPPER.valueToTree(value), legacyId,
            referenceTarget, nestedReferences, valueMap, immutable, writeOnly);
    }
    
    public PropertyDescriptor legacy(String name) {
        return new PropertyDescriptor(id, deviceName, type, defaultValue, name, referenceTarget,
            nestedReferences, valueMap, immutable, writeOnly);
    }
    
    public PropertyDescriptor references(ConfigClass target) {
        return new PropertyDescriptor(id, deviceName, type, defaultValue, legacyId, target,
            nestedReferences, valueMap, immutable, writeOnly);
    }
    
    public PropertyDescriptor nested(String path, ConfigClass target) {
        List<NestedReference> refs = new ArrayList<>(nestedReferences);
        refs.add(new NestedReference(path, target));
        return new PropertyDescriptor(id, deviceName, type, defaultValue, legacyId, referenceTarget,
            refs, valueMap, immutable, writeOnly);
    }
    
    public PropertyDescriptor mapValue(String declared, String onDevice) {
        Map<String, String> values = new LinkedHashMap<>(valueMap);
        values.put(declared, onDevice);
        return new PropertyDescriptor(id, deviceName, type, defaultValue, legacyId, referenceTarget,
            nestedReferences, values, immutable, writeOnly);
    }
    
    public PropertyDescriptor asImmutable() {
        return new PropertyDescriptor(id, deviceName, type, defaultValue, legacyId, referenceTarget,
            nestedReferences, valueMap, true, writeOnly);
    }
    
    public PropertyDescriptor asWriteOnly() {
        return new PropertyDescriptor(id, deviceName, type, defaultValue, legacyId, referenceTarget,
            nestedReferences, valueMap, immutable, true);
    }
    
    public boolean hasDefault() {
        return defaultValue != null;
    }
    
    public boolean isReference() {
        return type == PropertyType.REFERENCE || type == PropertyType.REFERENCE_LIST;
    }
}
