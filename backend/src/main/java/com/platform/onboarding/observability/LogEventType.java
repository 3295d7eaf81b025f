package com.platform.onboarding.observability;

/**
 * Event types emitted through {@link StructuredLogger}.
 */
public enum LogEventType {
    TASK_CREATED,
    TASK_TRANSITION,
    TASK_TRANSITION_REJECTED,
    TASK_PURGED,
    
    RECONCILIATION_PLANNED,
    RECONCILIATION_COMPLETED,
    RECONCILIATION_FAILED,
    
    ROLLBACK_STARTED,
    ROLLBACK_COMPLETED,
    ROLLBACK_FAILED,
    
    STATE_UPGRADED
}
