package com.platform.onboarding.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.onboarding.error.PersistenceException;
import com.platform.onboarding.persistence.entity.StateRecordEntity;
import com.platform.onboarding.persistence.repository.StateRecordJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * State persistence backed by a relational table through Spring Data JPA.
 * Each record is stored as a JSON document under its key.
 */
@Slf4j
public class JpaStatePersistence implements StatePersistence {

    private final StateRecordJpaRepository repository;
    private final ObjectMapper objectMapper;

    public JpaStatePersistence(StateRecordJpaRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JsonNode> read(String key) {
        try {
            Optional<StateRecordEntity> entity = repository.findById(key);
            if (entity.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(entity.get().getPayload()));
        } catch (JsonProcessingException e) {
            throw new PersistenceException(key, "stored payload is not valid JSON", false, e);
        } catch (DataAccessException e) {
            throw translate(key, "read failed", e);
        }
    }

    @Override
    @Transactional
    public void write(String key, JsonNode value) {
        try {
            String payload = objectMapper.writeValueAsString(value);
            StateRecordEntity entity = repository.findById(key)
                .orElseGet(() -> StateRecordEntity.builder().recordKey(key).build());
            entity.setPayload(payload);
            repository.save(entity);
            log.debug("Persisted state record {} ({} chars)", key, payload.length());
        } catch (JsonProcessingException e) {
            throw new PersistenceException(key, "value could not be serialized", false, e);
        } catch (DataAccessException e) {
            throw translate(key, "write failed", e);
        }
    }

    @Override
    @Transactional
    public void delete(String key) {
        try {
            if (repository.existsById(key)) {
                repository.deleteById(key);
                log.debug("Deleted state record {}", key);
            }
        } catch (DataAccessException e) {
            throw translate(key, "delete failed", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> keys(String prefix) {
        try {
            return repository.findKeysStartingWith(prefix);
        } catch (DataAccessException e) {
            throw translate(prefix + "*", "key scan failed", e);
        }
    }

    private static PersistenceException translate(String key, String message, DataAccessException e) {
        boolean retryable = e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException;
        log.error("State persistence {} for {}: {}", message, key, e.getMessage());
        return new PersistenceException(key, message, retryable, e);
    }
}
