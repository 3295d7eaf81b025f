package com.platform.onboarding.error;

/**
 * Standardized error codes for the onboarding service.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: DO-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Declaration validation errors
 * - 3xx: Resource errors (not found)
 * - 4xx: Device and persistence errors
 * - 5xx: Reconciliation errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DO-100", "Declaration validation failed", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DO-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    UNSUPPORTED_SCHEMA_VERSION("DO-102", "Unsupported schema version", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DO-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNRESOLVED_REFERENCE("DO-104", "Unresolved reference", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DO-300", "Resource not found", ErrorCategory.RECOVERABLE),
    TASK_NOT_FOUND("DO-301", "taskId does not exist", ErrorCategory.RECOVERABLE),
    
    // ==================== Device / Persistence Errors (4xx) ====================
    
    DEVICE_ERROR("DO-400", "Device request failed", ErrorCategory.RECOVERABLE),
    DEVICE_UNAVAILABLE("DO-401", "Device unavailable", ErrorCategory.RECOVERABLE),
    PERSISTENCE_ERROR("DO-410", "State persistence failed", ErrorCategory.FATAL),
    PERSISTENCE_UNAVAILABLE("DO-411", "State persistence unavailable", ErrorCategory.RECOVERABLE),
    
    // ==================== Reconciliation Errors (5xx) ====================
    
    PLANNING_FAILED("DO-500", "Unable to compute change plan", ErrorCategory.RECOVERABLE),
    APPLY_FAILED("DO-510", "Failed to apply configuration", ErrorCategory.RECOVERABLE),
    ROLLBACK_FAILED("DO-520", "Rollback failed", ErrorCategory.FATAL),
    STATE_TRANSITION_INVALID("DO-530", "Invalid task state transition", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("DO-900", "Internal server error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the declaration.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - device or service may need manual intervention.
         */
        FATAL
    }
}
