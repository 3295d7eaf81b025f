package com.platform.onboarding.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.translate.IdentifierMigrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Brings state written by earlier releases up to the current record format.
 *
 * Two upgrades exist. A single-blob state without a tasks container is
 * wrapped into one synthesized task. Original configurations stamped with
 * an older version get their property ids migrated and are re-stamped.
 */
@Slf4j
public class StateUpgrader {

    static final String VERSION_FIELD = "version";
    static final String CONFIG_FIELD = "Common";

    private final IdentifierMigrator migrator;
    private final String currentVersion;
    private final Clock clock;

    public StateUpgrader(IdentifierMigrator migrator, String currentVersion, Clock clock) {
        this.migrator = migrator;
        this.currentVersion = currentVersion;
        this.clock = clock;
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    /**
     * Converts a whole legacy state blob into task and original-config records.
     */
    public UpgradedState upgradeLegacyState(JsonNode blob) {
        List<Task> tasks = new ArrayList<>();
        Map<String, ObjectNode> originals = new LinkedHashMap<>();
        String mostRecent = null;

        if (blob == null || !blob.isObject()) {
            return new UpgradedState(tasks, originals, null);
        }

        if (!blob.has("tasks")) {
            // Pre-task layout: the blob itself is the only task.
            String taskId = UUID.randomUUID().toString();
            tasks.add(toTask(taskId, blob.deepCopy(), clock.instant()));
            mostRecent = taskId;
            log.info("Wrapped legacy state without task container into task {}", taskId);
        } else {
            Iterator<Map.Entry<String, JsonNode>> entries = blob.get("tasks").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                if (entry.getValue().isObject()) {
                    tasks.add(toTask(entry.getKey(), (ObjectNode) entry.getValue(), null));
                }
            }
            JsonNode recent = blob.path("mostRecentTask");
            mostRecent = recent.isTextual() ? recent.asText() : null;
        }

        JsonNode originalConfig = blob.path("originalConfig");
        if (originalConfig.isObject()) {
            originalConfig.fields().forEachRemaining(entry -> {
                if (entry.getValue().path(CONFIG_FIELD).isObject()) {
                    originals.put(entry.getKey(), entry.getValue().deepCopy());
                }
            });
        }
        return new UpgradedState(tasks, originals, mostRecent);
    }

    /**
     * Migrates one stored original configuration in place when it predates
     * the current version.
     *
     * @return true if the record changed and should be written back
     */
    public boolean upgradeOriginalConfig(ObjectNode record) {
        String recordVersion = record.path(VERSION_FIELD).asText(VersionComparator.UNVERSIONED);
        if (!VersionComparator.isOlder(recordVersion, currentVersion)) {
            return false;
        }
        JsonNode config = record.get(CONFIG_FIELD);
        if (config == null || !config.isObject()) {
            return false;
        }
        migrator.migrate((ObjectNode) config);
        record.put(VERSION_FIELD, currentVersion);
        log.info("Upgraded original configuration from version {} to {}", recordVersion, currentVersion);
        return true;
    }

    private Task toTask(String taskId, ObjectNode node, Instant fallbackUpdate) {
        TaskResult result = toResult(node.path("result"));
        Instant lastUpdate = parseInstant(node.path("lastUpdate"), fallbackUpdate);

        JsonNode declaration = node.path("internalDeclaration");
        if (!declaration.isObject() || declaration.isEmpty()) {
            declaration = node.path("declaration");
        }

        return Task.builder()
            .id(node.path("id").asText(taskId))
            .state(stateFor(result))
            .createdAt(lastUpdate)
            .lastUpdate(lastUpdate)
            .result(result)
            .declaration(declaration.isObject() ? DeclarationMasker.mask(declaration) : null)
            .currentConfig(toConfig(node.path("currentConfig")))
            .originalConfig(toConfig(node.path("originalConfig")))
            .build();
    }

    private DeviceConfig toConfig(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        JsonNode config = node.has(CONFIG_FIELD) ? node.get(CONFIG_FIELD) : node;
        if (!config.isObject()) {
            return null;
        }
        ObjectNode copy = config.deepCopy();
        migrator.migrate(copy);
        return DeviceConfig.fromJson(copy);
    }

    private static TaskResult toResult(JsonNode node) {
        List<String> errors = new ArrayList<>();
        node.path("errors").forEach(error -> errors.add(error.isTextual() ? error.asText() : error.toString()));
        return TaskResult.builder()
            .code(node.path("code").asInt(0))
            .status(node.path("status").asText(null))
            .message(node.path("message").asText(null))
            .errors(List.copyOf(errors))
            .build();
    }

    /**
     * Derives a lifecycle state for a task recorded before states were stored.
     */
    static TaskState stateFor(TaskResult result) {
        if (TaskResult.STATUS_OK.equals(result.getStatus()) || result.getCode() == 200) {
            return TaskState.SUCCEEDED;
        }
        if (TaskResult.STATUS_ROLLING_BACK.equals(result.getStatus())) {
            return TaskState.ROLLING_BACK;
        }
        String message = result.getMessage() == null ? "" : result.getMessage();
        if (result.getCode() == 422 && message.contains("rolled back")) {
            return TaskState.ROLLED_BACK;
        }
        if (result.getCode() >= 400 || TaskResult.STATUS_ERROR.equals(result.getStatus())) {
            return TaskState.FAILED;
        }
        return TaskState.APPLYING;
    }

    private Instant parseInstant(JsonNode node, Instant fallback) {
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                log.warn("Unparseable lastUpdate '{}' in legacy task, using current time", node.asText());
            }
        } else if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        return fallback != null ? fallback : clock.instant();
    }

    /**
     * Result of a legacy state conversion.
     */
    public record UpgradedState(List<Task> tasks, Map<String, ObjectNode> originalConfigs, String mostRecentTask) {
    }
}
