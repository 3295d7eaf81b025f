package com.platform.onboarding.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.error.PlanningException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.schema.SchemaMap;
import com.platform.onboarding.translate.JsonValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the ordered list of operations that moves a device from its
 * current configuration to the desired one.
 * 
 * Creates and modifies come first, class by class in precedence order.
 * Deletes follow in reverse precedence order, so referencing objects go
 * before the objects they reference. Within a class, objects keep the
 * desired configuration's order. Nameless classes are never created or
 * deleted and produce at most one modify carrying the full desired object.
 * Planning the same pair twice yields the same plan; planning desired
 * against an identical current yields none, once its secrets are recorded
 * as applied.
 */
public class DiffPlanner {
    
    private final SchemaMap schema;
    private final ReferenceResolver referenceResolver;
    
    public DiffPlanner(SchemaMap schema, ReferenceResolver referenceResolver) {
        this.schema = schema;
        this.referenceResolver = referenceResolver;
    }
    
    public List<Operation> plan(DeviceConfig desired, DeviceConfig current) {
        return plan(desired, current, SecretDigests.none());
    }
    
    /**
     * Plan that also re-sends any secret whose declared value no longer
     * matches the digest recorded when it was last applied.
     */
    public List<Operation> plan(DeviceConfig desired, DeviceConfig current, SecretDigests applied) {
        return plan(desired, current, applied, false);
    }
    
    /**
     * Plan that restores a snapshot exactly: every unprotected object absent
     * from the snapshot is deleted, including classes normally left alone.
     */
    public List<Operation> planRestore(DeviceConfig snapshot, DeviceConfig current) {
        return plan(snapshot, current, SecretDigests.none(), true);
    }
    
    /**
     * Digests of every secret in a configuration, to be recorded once it is applied.
     */
    public SecretDigests secretDigests(DeviceConfig config) {
        Map<String, String> digests = new LinkedHashMap<>();
        for (ConfigItem item : schema.items()) {
            if (item.isNameless()) {
                config.nameless(item.configClass()).ifPresent(object -> putDigests(item, null, object, digests));
            } else {
                config.named(item.configClass()).forEach((name, object) -> putDigests(item, name, object, digests));
            }
        }
        return SecretDigests.of(digests);
    }
    
    private static void putDigests(ConfigItem item, String name, ConfigObject object, Map<String, String> digests) {
        for (String id : object.propertyNames()) {
            item.property(id).flatMap(descriptor -> SecretDigests.digest(descriptor, object.get(id).orElse(null)))
                .ifPresent(digest -> digests.put(SecretDigests.key(item.configClass(), name, id), digest));
        }
    }
    
    private List<Operation> plan(DeviceConfig desired, DeviceConfig current, SecretDigests applied,
            boolean pruneAll) {
        List<String> unresolved = referenceResolver.unresolved(desired, current);
        if (!unresolved.isEmpty()) {
            throw new PlanningException(unresolved);
        }
        
        List<Operation> operations = new ArrayList<>();
        List<List<Operation>> deletesByClass = new ArrayList<>();
        
        for (ConfigItem item : schema.items()) {
            if (item.isNameless()) {
                planNameless(item, desired, current, applied).ifPresent(operations::add);
                continue;
            }
            Map<String, ConfigObject> desiredObjects = desired.named(item.configClass());
            Map<String, ConfigObject> currentObjects = current.named(item.configClass());
            
            for (Map.Entry<String, ConfigObject> entry : desiredObjects.entrySet()) {
                ConfigObject existing = currentObjects.get(entry.getKey());
                if (existing == null) {
                    operations.add(Operation.create(item.configClass(), entry.getKey(), entry.getValue()));
                    continue;
                }
                ConfigObject changes = changedProperties(item, entry.getKey(), entry.getValue(), existing, applied);
                if (!changes.isEmpty()) {
                    operations.add(Operation.modify(item.configClass(), entry.getKey(), changes,
                        entry.getValue(), existing));
                }
            }
            
            List<Operation> deletes = new ArrayList<>();
            if (pruneAll || item.pruneUndeclared()) {
                for (Map.Entry<String, ConfigObject> entry : currentObjects.entrySet()) {
                    if (!desiredObjects.containsKey(entry.getKey()) && !item.isProtected(entry.getKey())) {
                        deletes.add(Operation.delete(item.configClass(), entry.getKey(), entry.getValue()));
                    }
                }
            }
            deletesByClass.add(deletes);
        }
        
        Collections.reverse(deletesByClass);
        deletesByClass.forEach(operations::addAll);
        return operations;
    }
    
    private Optional<Operation> planNameless(ConfigItem item, DeviceConfig desired, DeviceConfig current,
            SecretDigests applied) {
        Optional<ConfigObject> wanted = desired.nameless(item.configClass());
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        ConfigObject existing = current.nameless(item.configClass()).orElse(ConfigObject.empty());
        if (changedProperties(item, null, wanted.get(), existing, applied).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Operation.modify(item.configClass(), null, wanted.get(), wanted.get(), existing));
    }
    
    /**
     * Desired properties whose value differs from the current one, in
     * desired order. A property missing on the current side compares as its
     * default. Values the device never reports count as changed when their
     * digest differs from the applied one.
     */
    ConfigObject changedProperties(ConfigItem item, String name, ConfigObject desired, ConfigObject current,
            SecretDigests applied) {
        Map<String, JsonNode> changes = new LinkedHashMap<>();
        for (String id : desired.propertyNames()) {
            Optional<PropertyDescriptor> descriptor = item.property(id);
            if (descriptor.isEmpty()) {
                continue;
            }
            JsonNode wanted = desired.get(id).orElse(null);
            boolean readableChanged = !descriptor.get().writeOnly()
                && !JsonValues.equivalent(wanted, current.get(id).orElse(descriptor.get().defaultValue()));
            boolean secretChanged = SecretDigests.digest(descriptor.get(), wanted)
                .map(digest -> !applied.matches(item.configClass(), name, id, digest))
                .orElse(false);
            if (readableChanged || secretChanged) {
                changes.put(id, wanted);
            }
        }
        return ConfigObject.of(changes);
    }
}
