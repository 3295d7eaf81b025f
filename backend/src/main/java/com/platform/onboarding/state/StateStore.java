package com.platform.onboarding.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.error.ErrorCode;
import com.platform.onboarding.error.InvalidTransitionException;
import com.platform.onboarding.error.TaskNotFoundException;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.observability.StructuredLogger;
import com.platform.onboarding.persistence.StatePersistence;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owner of all task and original-configuration state.
 *
 * Every write goes through {@link ConcurrentHashMap#computeIfPresent}, so
 * updates to one task are serialized while unrelated tasks never contend.
 * Each accepted change is written through to {@link StatePersistence}
 * before it becomes visible.
 */
@Slf4j
public class StateStore {

    static final String TASK_PREFIX = "task/";
    static final String ORIGINAL_CONFIG_PREFIX = "originalConfig/";
    static final String APPLIED_SECRETS_PREFIX = "appliedSecrets/";
    static final String LEGACY_STATE_KEY = "doState";

    // Valid state transitions (from -> to)
    private static final Map<TaskState, Set<TaskState>> ALLOWED_TRANSITIONS = Map.of(
        TaskState.CREATED, Set.of(TaskState.VALIDATING),
        TaskState.VALIDATING, Set.of(TaskState.APPLYING, TaskState.SUCCEEDED, TaskState.FAILED),
        TaskState.APPLYING, Set.of(TaskState.SUCCEEDED, TaskState.ROLLING_BACK, TaskState.FAILED),
        TaskState.ROLLING_BACK, Set.of(TaskState.ROLLED_BACK, TaskState.FAILED),
        TaskState.SUCCEEDED, Set.of(),
        TaskState.ROLLED_BACK, Set.of(),
        TaskState.FAILED, Set.of()
    );

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, ObjectNode> originalConfigs = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> appliedSecrets = new ConcurrentHashMap<>();
    private final AtomicReference<String> mostRecentTask = new AtomicReference<>();

    private final StatePersistence persistence;
    private final StateUpgrader upgrader;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Duration retention;
    private final Clock clock;

    public StateStore(StatePersistence persistence, StateUpgrader upgrader, ObjectMapper objectMapper,
                      MetricsRegistry metricsRegistry, StructuredLogger structuredLogger,
                      Duration retention, Clock clock) {
        this.persistence = persistence;
        this.upgrader = upgrader;
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.retention = retention;
        this.clock = clock;
    }

    // ==================== Loading ====================

    /**
     * Reads persisted state, converting a legacy single-blob state first if one exists.
     */
    public void load() {
        persistence.read(LEGACY_STATE_KEY).ifPresent(this::importLegacyState);

        for (String key : persistence.keys(TASK_PREFIX)) {
            persistence.read(key).ifPresent(node -> {
                try {
                    Task task = objectMapper.treeToValue(node, Task.class);
                    tasks.put(task.getId(), task);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.error("Skipping unreadable task record {}: {}", key, e.getMessage());
                    metricsRegistry.recordError(ErrorCode.PERSISTENCE_ERROR.getCode());
                }
            });
        }
        for (String key : persistence.keys(ORIGINAL_CONFIG_PREFIX)) {
            persistence.read(key)
                .filter(JsonNode::isObject)
                .ifPresent(node -> originalConfigs.put(key.substring(ORIGINAL_CONFIG_PREFIX.length()), (ObjectNode) node));
        }
        for (String key : persistence.keys(APPLIED_SECRETS_PREFIX)) {
            persistence.read(key)
                .filter(JsonNode::isObject)
                .ifPresent(node -> appliedSecrets.put(key.substring(APPLIED_SECRETS_PREFIX.length()),
                    digestsFrom(node)));
        }

        String recent = mostRecentTask.get();
        if (recent == null || !tasks.containsKey(recent)) {
            tasks.values().stream()
                .filter(task -> task.getCreatedAt() != null)
                .max(Comparator.comparing(Task::getCreatedAt))
                .ifPresent(task -> mostRecentTask.set(task.getId()));
        }
        log.info("Loaded {} tasks and {} original configurations", tasks.size(), originalConfigs.size());
    }

    private void importLegacyState(JsonNode blob) {
        StateUpgrader.UpgradedState upgraded = upgrader.upgradeLegacyState(blob);
        for (Task task : upgraded.tasks()) {
            persistence.write(TASK_PREFIX + task.getId(), objectMapper.valueToTree(task));
        }
        upgraded.originalConfigs().forEach((configId, record) ->
            persistence.write(ORIGINAL_CONFIG_PREFIX + configId, record));
        persistence.delete(LEGACY_STATE_KEY);
        mostRecentTask.set(upgraded.mostRecentTask());
        structuredLogger.task().stateUpgraded(upgraded.tasks().size(), upgraded.originalConfigs().size());
    }

    // ==================== Tasks ====================

    /**
     * Creates a task in CREATED and purges tasks past the retention window.
     *
     * @return the new task id
     */
    public String addTask() {
        Instant now = clock.instant();
        String taskId = UUID.randomUUID().toString();
        Task task = Task.builder()
            .id(taskId)
            .state(TaskState.CREATED)
            .createdAt(now)
            .lastUpdate(now)
            .build();
        persistTask(task);
        tasks.put(taskId, task);
        mostRecentTask.set(taskId);

        structuredLogger.task().created(taskId);
        metricsRegistry.recordTaskTransition(null, TaskState.CREATED);

        purgeExpired(now);
        return taskId;
    }

    private void purgeExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        List<String> candidates = new ArrayList<>();
        tasks.forEach((id, task) -> {
            if (isExpired(task, cutoff)) {
                candidates.add(id);
            }
        });
        int purged = 0;
        for (String id : candidates) {
            if (purgeIfExpired(id, cutoff)) {
                purged++;
            }
        }
        if (purged > 0) {
            structuredLogger.task().purged(purged);
        }
    }

    /**
     * Removes a task only if it is still expired once its entry is locked,
     * so an update racing the purge keeps the task.
     */
    boolean purgeIfExpired(String taskId, Instant cutoff) {
        AtomicReference<Boolean> removed = new AtomicReference<>(false);
        tasks.computeIfPresent(taskId, (id, task) -> {
            if (!isExpired(task, cutoff)) {
                return task;
            }
            persistence.delete(TASK_PREFIX + id);
            removed.set(true);
            return null;
        });
        if (removed.get()) {
            mostRecentTask.compareAndSet(taskId, null);
        }
        return removed.get();
    }

    private static boolean isExpired(Task task, Instant cutoff) {
        return task.getLastUpdate() != null && task.getLastUpdate().isBefore(cutoff);
    }

    public Task getTask(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    public List<String> getTaskIds() {
        return List.copyOf(tasks.keySet());
    }

    public Optional<String> getMostRecentTaskId() {
        return Optional.ofNullable(mostRecentTask.get());
    }

    /**
     * Moves a task to a new state. Rejected transitions leave the task unchanged.
     *
     * @throws InvalidTransitionException if the current state does not lead to the target
     */
    public Task transition(String taskId, TaskState targetState, String reason) {
        AtomicReference<TaskState> previous = new AtomicReference<>();
        Task updated = update(taskId, task -> {
            if (!isTransitionAllowed(task.getState(), targetState)) {
                metricsRegistry.recordInvalidTransition(task.getState(), targetState);
                structuredLogger.task().transitionRejected(taskId, String.valueOf(task.getState()), targetState.name());
                throw new InvalidTransitionException(taskId, task.getState(), targetState);
            }
            previous.set(task.getState());
            return task.toBuilder().state(targetState).build();
        });

        log.info("Task transition: {} -> {} for {} (reason: {})", previous.get(), targetState, taskId, reason);
        metricsRegistry.recordTaskTransition(previous.get(), targetState);
        structuredLogger.task().transition(taskId, String.valueOf(previous.get()), targetState.name(), reason);
        return updated;
    }

    public static boolean isTransitionAllowed(TaskState from, TaskState to) {
        return from != null && ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public TaskState getState(String taskId) {
        return getTask(taskId).getState();
    }

    public Instant getLastUpdate(String taskId) {
        return getTask(taskId).getLastUpdate();
    }

    // ==================== Result ====================

    public int getCode(String taskId) {
        return getTask(taskId).getResult().getCode();
    }

    public void setCode(String taskId, int code) {
        updateResultWith(taskId, result -> result.toBuilder().code(code).build());
    }

    public String getMessage(String taskId) {
        return getTask(taskId).getResult().getMessage();
    }

    public void setMessage(String taskId, String message) {
        updateResultWith(taskId, result -> result.toBuilder().message(message).build());
    }

    public String getStatus(String taskId) {
        return getTask(taskId).getResult().getStatus();
    }

    public void setStatus(String taskId, String status) {
        updateResultWith(taskId, result -> result.toBuilder().status(status).build());
    }

    public List<String> getErrors(String taskId) {
        return getTask(taskId).getResult().getErrors();
    }

    /**
     * Replaces the error list.
     */
    public void setErrors(String taskId, List<String> errors) {
        List<String> copy = errors == null ? List.of() : List.copyOf(errors);
        updateResultWith(taskId, result -> result.toBuilder().errors(copy).build());
    }

    /**
     * Updates the result. Null or zero values leave the existing field alone;
     * errors are appended, never replaced.
     */
    public void updateResult(String taskId, int code, String status, String message, List<String> errors) {
        updateResultWith(taskId, result -> {
            TaskResult.TaskResultBuilder builder = result.toBuilder();
            if (code != 0) {
                builder.code(code);
            }
            if (status != null) {
                builder.status(status);
            }
            if (message != null) {
                builder.message(message);
            }
            return builder.build().withAddedErrors(errors);
        });
    }

    private void updateResultWith(String taskId, UnaryOperator<TaskResult> change) {
        update(taskId, task -> task.toBuilder().result(change.apply(task.getResult())).build());
    }

    // ==================== Task content ====================

    /**
     * Stores the declaration with secret values masked.
     */
    public void setDeclaration(String taskId, JsonNode declaration) {
        JsonNode masked = DeclarationMasker.mask(declaration);
        update(taskId, task -> task.toBuilder().declaration(masked).build());
    }

    public Optional<JsonNode> getDeclaration(String taskId) {
        return Optional.ofNullable(getTask(taskId).getDeclaration()).map(JsonNode::deepCopy);
    }

    public void setMachineId(String taskId, String machineId) {
        update(taskId, task -> task.toBuilder().machineId(machineId).build());
    }

    public Optional<String> getMachineId(String taskId) {
        return Optional.ofNullable(getTask(taskId).getMachineId());
    }

    public void setCurrentConfig(String taskId, DeviceConfig currentConfig) {
        update(taskId, task -> task.toBuilder().currentConfig(currentConfig).build());
    }

    public Optional<DeviceConfig> getCurrentConfig(String taskId) {
        return Optional.ofNullable(getTask(taskId).getCurrentConfig());
    }

    public void setOriginalConfigByTaskId(String taskId, DeviceConfig originalConfig) {
        update(taskId, task -> task.toBuilder().originalConfig(originalConfig).build());
    }

    public Optional<DeviceConfig> getOriginalConfigByTaskId(String taskId) {
        return Optional.ofNullable(getTask(taskId).getOriginalConfig());
    }

    public void setRebootRequired(String taskId, boolean rebootRequired) {
        update(taskId, task -> task.toBuilder().rebootRequired(rebootRequired).build());
    }

    public boolean getRebootRequired(String taskId) {
        return getTask(taskId).isRebootRequired();
    }

    /**
     * Records the pre-apply snapshot. A null snapshot is ignored.
     */
    public void setRollbackInfo(String taskId, DeviceConfig snapshot) {
        if (snapshot == null) {
            getTask(taskId);
            return;
        }
        update(taskId, task -> task.toBuilder().rollbackInfo(snapshot).build());
    }

    public Optional<DeviceConfig> getRollbackInfo(String taskId) {
        return Optional.ofNullable(getTask(taskId).getRollbackInfo());
    }

    // ==================== Trace ====================

    public void setTraceCurrent(String taskId, JsonNode trace) {
        JsonNode masked = DeclarationMasker.mask(trace);
        update(taskId, task -> task.toBuilder().traceCurrent(masked).build());
    }

    public Optional<JsonNode> getTraceCurrent(String taskId) {
        return Optional.ofNullable(getTask(taskId).getTraceCurrent()).map(JsonNode::deepCopy);
    }

    public void setTraceDesired(String taskId, JsonNode trace) {
        JsonNode masked = DeclarationMasker.mask(trace);
        update(taskId, task -> task.toBuilder().traceDesired(masked).build());
    }

    public Optional<JsonNode> getTraceDesired(String taskId) {
        return Optional.ofNullable(getTask(taskId).getTraceDesired()).map(JsonNode::deepCopy);
    }

    public void setTraceDiff(String taskId, JsonNode trace) {
        JsonNode masked = DeclarationMasker.mask(trace);
        update(taskId, task -> task.toBuilder().traceDiff(masked).build());
    }

    public Optional<JsonNode> getTraceDiff(String taskId) {
        return Optional.ofNullable(getTask(taskId).getTraceDiff()).map(JsonNode::deepCopy);
    }

    public boolean hasTrace(String taskId) {
        return getTask(taskId).hasTrace();
    }

    // ==================== Original configuration ====================

    /**
     * Records the configuration a device had before it was first onboarded,
     * stamped with the current engine version.
     */
    public void setOriginalConfigByConfigId(String configId, DeviceConfig originalConfig) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put(StateUpgrader.VERSION_FIELD, upgrader.getCurrentVersion());
        record.set(StateUpgrader.CONFIG_FIELD, originalConfig.toJson());
        originalConfigs.compute(configId, (id, existing) -> {
            persistence.write(ORIGINAL_CONFIG_PREFIX + id, record);
            return record;
        });
    }

    /**
     * Original configuration for a device. A record from an older version is
     * migrated and written back the first time it is read.
     */
    public Optional<DeviceConfig> getOriginalConfigByConfigId(String configId) {
        ObjectNode record = originalConfigs.computeIfPresent(configId, (id, stored) -> {
            ObjectNode copy = stored.deepCopy();
            if (!upgrader.upgradeOriginalConfig(copy)) {
                return stored;
            }
            persistence.write(ORIGINAL_CONFIG_PREFIX + id, copy);
            return copy;
        });
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(DeviceConfig.fromJson(record.path(StateUpgrader.CONFIG_FIELD)));
    }

    public void deleteOriginalConfigByConfigId(String configId) {
        originalConfigs.computeIfPresent(configId, (id, stored) -> {
            persistence.delete(ORIGINAL_CONFIG_PREFIX + id);
            return null;
        });
    }

    public List<String> getOriginalConfigIds() {
        return List.copyOf(originalConfigs.keySet());
    }

    // ==================== Applied secrets ====================

    /**
     * Records the digests of the secret values last applied to a device,
     * replacing any earlier record. Only digests are kept, never the values.
     */
    public void setAppliedSecrets(String configId, Map<String, String> digests) {
        Map<String, String> copy = Map.copyOf(digests);
        ObjectNode record = objectMapper.createObjectNode();
        copy.forEach(record::put);
        appliedSecrets.compute(configId, (id, existing) -> {
            persistence.write(APPLIED_SECRETS_PREFIX + id, record);
            return copy;
        });
    }

    public Map<String, String> getAppliedSecrets(String configId) {
        return appliedSecrets.getOrDefault(configId, Map.of());
    }

    private static Map<String, String> digestsFrom(JsonNode record) {
        Map<String, String> digests = new HashMap<>();
        record.fields().forEachRemaining(entry -> digests.put(entry.getKey(), entry.getValue().asText()));
        return Map.copyOf(digests);
    }

    // ==================== Internals ====================

    private Task update(String taskId, UnaryOperator<Task> change) {
        Task updated = tasks.computeIfPresent(taskId, (id, task) -> {
            Task next = change.apply(task).toBuilder().lastUpdate(clock.instant()).build();
            persistTask(next);
            return next;
        });
        if (updated == null) {
            throw new TaskNotFoundException(taskId);
        }
        return updated;
    }

    private void persistTask(Task task) {
        persistence.write(TASK_PREFIX + task.getId(), objectMapper.valueToTree(task));
    }
}
