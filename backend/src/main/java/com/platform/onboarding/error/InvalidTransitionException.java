package com.platform.onboarding.error;

/**
 * A task was asked to move to a state its current state does not lead to.
 */
public class InvalidTransitionException extends OnboardingException {
    
    private final String taskId;
    private final String fromState;
    private final String toState;
    
    public InvalidTransitionException(String taskId, Object fromState, Object toState) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
            String.format("Task %s cannot move from %s to %s", taskId, fromState, toState));
        this.taskId = taskId;
        this.fromState = String.valueOf(fromState);
        this.toState = String.valueOf(toState);
    }
    
    public String getTaskId() {
        return taskId;
    }
    
    public String getFromState() {
        return fromState;
    }
    
    public String getToState() {
        return toState;
    }
}
