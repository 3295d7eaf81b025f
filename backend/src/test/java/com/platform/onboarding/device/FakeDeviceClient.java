package com.platform.onboarding.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.error.DeviceClientException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory device for engine tests.
 *
 * Named objects live at {@code <collection>/~Common~<name>}; a GET on a
 * collection that has held objects returns them as {@code items}. Any other
 * unknown path answers 404. Every call is recorded as {@code METHOD path}.
 */
public class FakeDeviceClient implements DeviceClient {

    public static final String MACHINE_ID = "00000000-0000-0000-0000-000000000001";
    public static final String LOCAL_DEVICE = "bigip1.localhost";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Map<String, ObjectNode> objects = new LinkedHashMap<>();
    private final Set<String> collections = new HashSet<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Integer> failures = new LinkedHashMap<>();
    private final Map<String, RuntimeException> thrown = new LinkedHashMap<>();

    public FakeDeviceClient() {
        objects.put(DevicePaths.DEVICE_INFO, JSON.objectNode().put("machineId", MACHINE_ID));
        ObjectNode self = JSON.objectNode()
            .put("name", LOCAL_DEVICE)
            .put("partition", "Common")
            .put("selfDevice", "true");
        put(DevicePaths.CM_DEVICE, self);
    }

    // ==================== Test setup ====================

    /**
     * Seeds a named object without recording a call.
     */
    public synchronized FakeDeviceClient put(String collection, ObjectNode body) {
        collections.add(collection);
        objects.put(collection + "/~Common~" + body.path("name").asText(), body.deepCopy());
        return this;
    }

    /**
     * Seeds an object at an exact path, e.g. a singleton.
     */
    public synchronized FakeDeviceClient putAt(String path, ObjectNode body) {
        objects.put(path, body.deepCopy());
        return this;
    }

    /**
     * Makes every matching request fail with the given HTTP status.
     */
    public synchronized FakeDeviceClient failOn(String method, String path, int status) {
        failures.put(method + " " + path, status);
        return this;
    }

    /**
     * Makes every matching request throw the given exception instead of answering.
     */
    public synchronized FakeDeviceClient throwOn(String method, String path, RuntimeException exception) {
        thrown.put(method + " " + path, exception);
        return this;
    }

    public synchronized void clearFailures() {
        failures.clear();
        thrown.clear();
    }

    public List<String> getCalls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public List<String> getMutations() {
        return getCalls().stream().filter(call -> !call.startsWith("GET ")).toList();
    }

    public void clearCalls() {
        calls.clear();
    }

    public synchronized boolean exists(String path) {
        return objects.containsKey(path);
    }

    public synchronized ObjectNode object(String path) {
        ObjectNode object = objects.get(path);
        return object == null ? null : object.deepCopy();
    }

    // ==================== DeviceClient ====================

    @Override
    public synchronized JsonNode get(String path, RequestOptions options) {
        record("GET", path);
        ObjectNode object = objects.get(path);
        if (object != null) {
            return object.deepCopy();
        }
        if (collections.contains(path)) {
            ObjectNode body = JSON.objectNode();
            ArrayNode items = body.putArray("items");
            String prefix = path + "/~";
            objects.forEach((key, value) -> {
                if (key.startsWith(prefix) && key.indexOf('/', prefix.length()) < 0) {
                    items.add(value.deepCopy());
                }
            });
            return body;
        }
        throw new DeviceClientException("GET", path, 404, "not found");
    }

    @Override
    public synchronized JsonNode create(String path, JsonNode body, RequestOptions options) {
        record("POST", path);
        String objectPath = path + "/~Common~" + body.path("name").asText();
        if (objects.containsKey(objectPath)) {
            throw new DeviceClientException("POST", path, 409, "object already exists");
        }
        collections.add(path);
        ObjectNode stored = ((ObjectNode) body).deepCopy();
        stored.put("partition", "Common");
        objects.put(objectPath, stored);
        return stored.deepCopy();
    }

    @Override
    public synchronized JsonNode modify(String path, JsonNode body, RequestOptions options) {
        record("PATCH", path);
        ObjectNode existing = objects.get(path);
        if (existing == null) {
            if (path.contains("/~Common~")) {
                throw new DeviceClientException("PATCH", path, 404, "not found");
            }
            existing = JSON.objectNode();
            objects.put(path, existing);
        }
        existing.setAll((ObjectNode) body);
        return existing.deepCopy();
    }

    @Override
    public synchronized void delete(String path, RequestOptions options) {
        record("DELETE", path);
        if (objects.remove(path) == null) {
            throw new DeviceClientException("DELETE", path, 404, "not found");
        }
    }

    @Override
    public synchronized JsonNode upload(String path, String content, RequestOptions options) {
        record("UPLOAD", path);
        return JSON.objectNode().put("remainingByteCount", 0);
    }

    private void record(String method, String path) {
        Integer status = failures.get(method + " " + path);
        calls.add(method + " " + path);
        RuntimeException exception = thrown.get(method + " " + path);
        if (exception != null) {
            throw exception;
        }
        if (status != null) {
            throw new DeviceClientException(method, path, status, "injected failure");
        }
    }
}
