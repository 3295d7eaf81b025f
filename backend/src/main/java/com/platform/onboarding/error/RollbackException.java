package com.platform.onboarding.error;

/**
 * Rollback could not restore the pre-apply snapshot.
 * The device may be partially configured.
 */
public class RollbackException extends OnboardingException {
    
    private final String taskId;
    
    public RollbackException(String taskId, Throwable cause) {
        super(ErrorCode.ROLLBACK_FAILED,
            String.format("Rollback of task %s failed: %s", taskId, cause.getMessage()), cause);
        this.taskId = taskId;
    }
    
    public RollbackException(String taskId, String message) {
        super(ErrorCode.ROLLBACK_FAILED, String.format("Rollback of task %s failed: %s", taskId, message));
        this.taskId = taskId;
    }
    
    public String getTaskId() {
        return taskId;
    }
}
