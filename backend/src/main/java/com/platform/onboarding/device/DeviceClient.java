package com.platform.onboarding.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.error.DeviceClientException;

/**
 * Transport to the device management API. Paths are relative to the
 * management root, e.g. {@code /tm/net/vlan}.
 * 
 * Every failure surfaces as {@link DeviceClientException}.
 */
public interface DeviceClient {
    
    JsonNode get(String path, RequestOptions options);
    
    JsonNode create(String path, JsonNode body, RequestOptions options);
    
    JsonNode modify(String path, JsonNode body, RequestOptions options);
    
    void delete(String path, RequestOptions options);
    
    /**
     * Raw content upload, e.g. certificate material.
     */
    JsonNode upload(String path, String content, RequestOptions options);
    
    default JsonNode get(String path) {
        return get(path, RequestOptions.defaults());
    }
    
    /**
     * Creates the named object in {@code collectionPath}, or modifies it if
     * it already exists. The body must carry {@code name}.
     */
    default JsonNode createOrModify(String collectionPath, ObjectNode body, RequestOptions options) {
        String name = body.path("name").asText();
        String partition = body.path("partition").asText("Common");
        String objectPath = collectionPath + "/~" + partition + "~" + name;
        try {
            get(objectPath, RequestOptions.defaults().withoutRetry());
        } catch (DeviceClientException e) {
            if (e.isNotFound()) {
                return create(collectionPath, body, options);
            }
            throw e;
        }
        ObjectNode changes = body.deepCopy();
        changes.remove("name");
        changes.remove("partition");
        return modify(objectPath, changes, options);
    }
}
