package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.device.RequestOptions;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.SchemaMap;
import com.platform.onboarding.translate.ConfigTranslator;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Turns plan operations into create, modify and delete requests against
 * the schema's device paths.
 * 
 * A modify touching an immutable property becomes a delete of the object
 * followed by a create with the full desired properties.
 */
public class ResourceWriter {
    
    private final SchemaMap schema;
    private final ConfigTranslator translator;
    
    public ResourceWriter(SchemaMap schema, ConfigTranslator translator) {
        this.schema = schema;
        this.translator = translator;
    }
    
    public ConfigItem item(Operation operation) {
        return schema.item(operation.configClass());
    }
    
    public ConfigItem item(ConfigClass configClass) {
        return schema.item(configClass);
    }
    
    public ObjectNode body(ConfigItem item, ConfigObject properties) {
        return translator.toDeviceBody(item, properties);
    }
    
    /**
     * Requests carrying write-only values are sent silently.
     */
    public RequestOptions options(ConfigItem item) {
        boolean secret = item.properties().stream().anyMatch(p -> p.writeOnly());
        return secret ? RequestOptions.silentRequest() : RequestOptions.defaults();
    }
    
    public List<ApplyStep> stepsFor(Operation operation) {
        ConfigItem item = item(operation);
        return stepsFor(operation, item.path(), UnaryOperator.identity());
    }
    
    /**
     * Steps for an operation using a specific collection path and a hook
     * applied to every outgoing body.
     */
    public List<ApplyStep> stepsFor(Operation operation, String collectionPath, UnaryOperator<ObjectNode> customizer) {
        ConfigItem item = item(operation);
        RequestOptions options = options(item);
        String name = operation.name();
        
        if (item.isNameless()) {
            ObjectNode body = customizer.apply(body(item, operation.changes()));
            return List.of(new ApplyStep(item.configClass(), null, collectionPath,
                client -> client.modify(collectionPath, body, options)));
        }
        
        String objectPath = collectionPath + "/~Common~" + name;
        return switch (operation.kind()) {
            case CREATE -> List.of(createStep(item, operation, collectionPath, customizer, options));
            case MODIFY -> {
                if (touchesImmutable(item, operation.changes())) {
                    yield List.of(
                        new ApplyStep(item.configClass(), name, objectPath,
                            client -> client.delete(objectPath, options)),
                        createStep(item, operation, collectionPath, customizer, options));
                }
                ObjectNode body = customizer.apply(body(item, operation.changes()));
                yield List.of(new ApplyStep(item.configClass(), name, objectPath,
                    client -> client.modify(objectPath, body, options)));
            }
            case DELETE -> List.of(new ApplyStep(item.configClass(), name, objectPath,
                client -> client.delete(objectPath, options)));
        };
    }
    
    private ApplyStep createStep(ConfigItem item, Operation operation, String collectionPath,
            UnaryOperator<ObjectNode> customizer, RequestOptions options) {
        ObjectNode body = customizer.apply(body(item, operation.desired()));
        body.put("name", operation.name());
        body.put("partition", "Common");
        return new ApplyStep(item.configClass(), operation.name(), collectionPath,
            client -> client.create(collectionPath, body, options));
    }
    
    private static boolean touchesImmutable(ConfigItem item, ConfigObject changes) {
        return changes.propertyNames().stream()
            .anyMatch(id -> item.property(id).map(p -> p.immutable()).orElse(false));
    }
}
