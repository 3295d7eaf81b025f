package com.platform.onboarding.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.error.ErrorCode;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.NestedReference;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.schema.SchemaMap;
import com.platform.onboarding.translate.ConfigTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that every reference in a desired configuration names an object
 * that will exist once the plan is applied.
 * 
 * A reference resolves when the target is declared, is a device-owned
 * protected name, or already exists on the device in a class that is
 * never pruned. References into partitions other than Common are not
 * managed here and always resolve.
 */
public class ReferenceResolver {
    
    private final SchemaMap schema;
    
    public ReferenceResolver(SchemaMap schema) {
        this.schema = schema;
    }
    
    /**
     * Throws with every unresolved reference listed.
     */
    public void validate(DeviceConfig desired, DeviceConfig current) {
        List<String> problems = unresolved(desired, current);
        if (!problems.isEmpty()) {
            throw new ValidationException(ErrorCode.UNRESOLVED_REFERENCE, problems);
        }
    }
    
    public List<String> unresolved(DeviceConfig desired, DeviceConfig current) {
        List<String> problems = new ArrayList<>();
        for (ConfigItem item : schema.items()) {
            if (item.isNameless()) {
                desired.nameless(item.configClass()).ifPresent(object ->
                    checkObject(item, item.configClass().getDeclaredName(), object, desired, current, problems));
            } else {
                for (Map.Entry<String, ConfigObject> entry : desired.named(item.configClass()).entrySet()) {
                    String owner = item.configClass().getDeclaredName() + " " + entry.getKey();
                    checkObject(item, owner, entry.getValue(), desired, current, problems);
                }
            }
        }
        return problems;
    }
    
    private void checkObject(ConfigItem item, String owner, ConfigObject object,
            DeviceConfig desired, DeviceConfig current, List<String> problems) {
        for (PropertyDescriptor descriptor : item.properties()) {
            Optional<JsonNode> value = object.get(descriptor.id());
            if (value.isEmpty()) {
                continue;
            }
            if (descriptor.isReference()) {
                List<String> names = new ArrayList<>();
                collectNames(value.get(), names);
                for (String name : names) {
                    check(descriptor.referenceTarget(), name, owner, descriptor.id(), desired, current, problems);
                }
            }
            for (NestedReference nested : descriptor.nestedReferences()) {
                List<String> names = new ArrayList<>();
                collectAt(value.get(), nested.segments(), 0, names);
                for (String name : names) {
                    check(nested.target(), name, owner, descriptor.id() + "." + nested.path(), desired, current, problems);
                }
            }
        }
    }
    
    private void check(ConfigClass target, String reference, String owner, String property,
            DeviceConfig desired, DeviceConfig current, List<String> problems) {
        Optional<String> name = ConfigTranslator.commonName(reference);
        if (name.isEmpty() || resolvable(target, name.get(), desired, current)) {
            return;
        }
        problems.add(String.format("%s %s referenced by %s (%s) does not exist",
            target.getDeclaredName(), name.get(), owner, property));
    }
    
    private boolean resolvable(ConfigClass target, String name, DeviceConfig desired, DeviceConfig current) {
        ConfigItem item = schema.item(target);
        return desired.contains(target, name)
            || item.isProtected(name)
            || (!item.pruneUndeclared() && current.contains(target, name));
    }
    
    private static void collectNames(JsonNode value, List<String> names) {
        if (value.isTextual()) {
            names.add(value.asText());
        } else if (value.isArray()) {
            value.forEach(element -> collectNames(element, names));
        }
    }
    
    private static void collectAt(JsonNode node, String[] segments, int index, List<String> names) {
        if (node.isArray()) {
            node.forEach(element -> collectAt(element, segments, index, names));
            return;
        }
        JsonNode child = node.get(segments[index]);
        if (child == null) {
            return;
        }
        if (index == segments.length - 1) {
            collectNames(child, names);
        } else {
            collectAt(child, segments, index + 1, names);
        }
    }
}
