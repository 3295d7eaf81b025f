package com.platform.onboarding.error;

import java.util.List;

/**
 * Thrown when a change plan cannot be computed, for example when the
 * desired configuration references objects that will not exist.
 */
public class PlanningException extends OnboardingException {
    
    private final List<String> unresolved;
    
    public PlanningException(List<String> unresolved) {
        super(ErrorCode.PLANNING_FAILED, "Unresolved references: " + String.join(", ", unresolved));
        this.unresolved = List.copyOf(unresolved);
    }
    
    public List<String> getUnresolved() {
        return unresolved;
    }
}
