package com.platform.onboarding.handler;

/**
 * Result of applying one or more domain slices.
 */
public record HandlerOutcome(int operationsApplied, boolean rebootRequired) {
    
    public static HandlerOutcome none() {
        return new HandlerOutcome(0, false);
    }
    
    public HandlerOutcome combine(HandlerOutcome other) {
        return new HandlerOutcome(operationsApplied + other.operationsApplied,
            rebootRequired || other.rebootRequired);
    }
}
