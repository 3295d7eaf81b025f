package com.platform.onboarding.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A submitted onboarding document. Holds a private copy of the JSON;
 * structural checks happen in the schema validator, not here.
 */
public final class Declaration {
    
    public static final String COMMON = "Common";
    
    private final ObjectNode root;
    
    private Declaration(ObjectNode root) {
        this.root = root;
    }
    
    public static Declaration of(JsonNode json) {
        ObjectNode root = json != null && json.isObject()
            ? ((ObjectNode) json).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        return new Declaration(root);
    }
    
    /**
     * Copy of the raw document.
     */
    public ObjectNode raw() {
        return root.deepCopy();
    }
    
    public String schemaVersion() {
        return root.path("schemaVersion").asText(null);
    }
    
    public boolean isAsync() {
        return root.path("async").asBoolean(false);
    }
    
    /**
     * Common partition section, empty when missing.
     */
    public ObjectNode common() {
        JsonNode common = root.get(COMMON);
        return common != null && common.isObject()
            ? ((ObjectNode) common).deepCopy()
            : JsonNodeFactory.instance.objectNode();
    }
    
    public Controls controls() {
        JsonNode controls = root.path("controls");
        if (!controls.isObject()) {
            return Controls.none();
        }
        return new Controls(
            controls.path("dryRun").asBoolean(false),
            controls.path("trace").asBoolean(false),
            controls.path("traceResponse").asBoolean(false),
            controls.path("userAgent").asText(null));
    }
}
