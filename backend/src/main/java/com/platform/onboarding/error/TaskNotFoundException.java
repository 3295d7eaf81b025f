package com.platform.onboarding.error;

/**
 * Raised by every task accessor when the id is unknown.
 */
public class TaskNotFoundException extends ResourceNotFoundException {
    
    public TaskNotFoundException(String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Task", taskId);
    }
}
