package com.platform.onboarding.observability;

import com.platform.onboarding.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for task lifecycle events.
 *
 * All logs are JSON-formatted and machine-parsable. Declarations and
 * device payloads are never part of an event.
 */
@Component
public class StructuredLogger {

    @Value("${spring.application.name:declarative-onboarding}")
    private String serviceName = "declarative-onboarding";

    /**
     * Get task event logger.
     */
    public TaskLogger task() {
        return new TaskLogger(serviceName);
    }

    /**
     * Get reconciliation event logger.
     */
    public ReconciliationLogger reconciliation() {
        return new ReconciliationLogger(serviceName);
    }

    // ==================== TASK LOGGER ====================

    public static class TaskLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.task");
        private final String service;

        TaskLogger(String service) {
            this.service = service;
        }

        public void created(String taskId) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.TASK_CREATED, "INFO")
                .taskId(taskId)
                .toState("CREATED")
                .build();
            log.info(event.toJson());
        }

        public void transition(String taskId, String fromState, String toState, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.TASK_TRANSITION, "INFO")
                .taskId(taskId)
                .fromState(fromState)
                .toState(toState)
                .message(reason)
                .build();
            log.info(event.toJson());
        }

        public void transitionRejected(String taskId, String fromState, String toState) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.TASK_TRANSITION_REJECTED, "WARN")
                .taskId(taskId)
                .fromState(fromState)
                .toState(toState)
                .success(false)
                .build();
            log.warn(event.toJson());
        }

        public void purged(int count) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.TASK_PURGED, "INFO")
                .context(Map.of("purged", count))
                .build();
            log.info(event.toJson());
        }

        public void stateUpgraded(int tasks, int originalConfigs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.STATE_UPGRADED, "INFO")
                .context(Map.of(
                    "tasks", tasks,
                    "original_configs", originalConfigs
                ))
                .build();
            log.info(event.toJson());
        }
    }

    // ==================== RECONCILIATION LOGGER ====================

    public static class ReconciliationLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.reconciliation");
        private final String service;

        ReconciliationLogger(String service) {
            this.service = service;
        }

        public void planned(String taskId, int operations, boolean dryRun) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILIATION_PLANNED, "INFO")
                .taskId(taskId)
                .context(Map.of(
                    "operations", operations,
                    "dry_run", dryRun
                ))
                .build();
            log.info(event.toJson());
        }

        public void completed(String taskId, long durationMs, boolean rebootRequired) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILIATION_COMPLETED, "INFO")
                .taskId(taskId)
                .success(true)
                .durationMs(durationMs)
                .context(Map.of("reboot_required", rebootRequired))
                .build();
            log.info(event.toJson());
        }

        public void failed(String taskId, String configClass, String objectName, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILIATION_FAILED, "ERROR")
                .taskId(taskId)
                .configClass(configClass)
                .objectName(objectName)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }

        public void rollbackStarted(String taskId, int operations) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.ROLLBACK_STARTED, "WARN")
                .taskId(taskId)
                .context(Map.of("operations", operations))
                .build();
            log.warn(event.toJson());
        }

        public void rollbackCompleted(String taskId, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.ROLLBACK_COMPLETED, "INFO")
                .taskId(taskId)
                .success(true)
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }

        public void rollbackFailed(String taskId, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.ROLLBACK_FAILED, "ERROR")
                .taskId(taskId)
                .success(false)
                .errorCode(ErrorCode.ROLLBACK_FAILED.getCode())
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
    }
}
