package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.schema.SchemaMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renames deprecated property ids to their current ids.
 * 
 * A legacy value is only carried over when the current id is absent, so
 * running the migration twice changes nothing.
 */
@Slf4j
public class IdentifierMigrator {
    
    private final SchemaMap schema;
    
    public IdentifierMigrator(SchemaMap schema) {
        this.schema = schema;
    }
    
    /**
     * Migrates one object's properties in place.
     * 
     * @return true if anything was renamed or dropped
     */
    public boolean updateIds(ConfigItem item, ObjectNode properties) {
        boolean changed = false;
        for (PropertyDescriptor descriptor : item.properties()) {
            String legacyId = descriptor.legacyId();
            if (legacyId == null || legacyId.equals(descriptor.id()) || !properties.has(legacyId)) {
                continue;
            }
            JsonNode legacyValue = properties.remove(legacyId);
            if (!properties.has(descriptor.id())) {
                properties.set(descriptor.id(), legacyValue);
            }
            changed = true;
        }
        return changed;
    }
    
    /**
     * Migrates a whole configuration tree keyed by declared class name, in place.
     * Nameless classes are migrated as one object, named classes item by item.
     */
    public boolean migrate(ObjectNode config) {
        boolean changed = false;
        Iterator<Map.Entry<String, JsonNode>> classes = config.fields();
        while (classes.hasNext()) {
            Map.Entry<String, JsonNode> entry = classes.next();
            Optional<ConfigItem> item = schema.find(entry.getKey());
            if (item.isEmpty() || !entry.getValue().isObject()) {
                continue;
            }
            ObjectNode value = (ObjectNode) entry.getValue();
            if (item.get().isNameless()) {
                changed |= updateIds(item.get(), value);
            } else {
                for (JsonNode object : collectObjects(value)) {
                    changed |= updateIds(item.get(), (ObjectNode) object);
                }
            }
        }
        if (changed) {
            log.debug("Migrated legacy property ids in stored configuration");
        }
        return changed;
    }
    
    private static List<JsonNode> collectObjects(ObjectNode byName) {
        List<JsonNode> objects = new ArrayList<>();
        byName.elements().forEachRemaining(object -> {
            if (object.isObject()) {
                objects.add(object);
            }
        });
        return objects;
    }
}
