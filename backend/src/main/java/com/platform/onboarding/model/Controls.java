package com.platform.onboarding.model;

/**
 * Optional per-request switches carried in a declaration.
 *
 * @param dryRun compute and record the plan without touching the device
 * @param trace record current, desired and diff on the task
 * @param traceResponse include the recorded trace in task responses
 * @param userAgent caller identification, informational only
 */
public record Controls(boolean dryRun, boolean trace, boolean traceResponse, String userAgent) {
    
    public static Controls none() {
        return new Controls(false, false, false, null);
    }
}
