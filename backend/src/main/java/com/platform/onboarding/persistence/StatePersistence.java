package com.platform.onboarding.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Durable key/value store for task and original-configuration records.
 *
 * Implementations throw {@link com.platform.onboarding.error.PersistenceException}
 * when the backend cannot be read or written.
 */
public interface StatePersistence {

    Optional<JsonNode> read(String key);

    void write(String key, JsonNode value);

    void delete(String key);

    /**
     * Keys starting with the given prefix, in no particular order.
     */
    List<String> keys(String prefix);
}
