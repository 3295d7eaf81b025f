package com.platform.onboarding.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Non-durable store used when no database is configured and in tests.
 */
public class InMemoryStatePersistence implements StatePersistence {

    private final Map<String, JsonNode> records = new ConcurrentHashMap<>();

    @Override
    public Optional<JsonNode> read(String key) {
        return Optional.ofNullable(records.get(key)).map(JsonNode::deepCopy);
    }

    @Override
    public void write(String key, JsonNode value) {
        records.put(key, value.deepCopy());
    }

    @Override
    public void delete(String key) {
        records.remove(key);
    }

    @Override
    public List<String> keys(String prefix) {
        return records.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }
}
