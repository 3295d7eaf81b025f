package com.platform.onboarding.state;

/**
 * Lifecycle of one reconciliation task.
 *
 * Transitions are validated by StateStore. CREATED is the only initial
 * state; SUCCEEDED, FAILED and ROLLED_BACK are terminal.
 */
public enum TaskState {
    /**
     * Task record exists, nothing has run yet.
     * Transitions: VALIDATING
     */
    CREATED,

    /**
     * Declaration is being validated, translated and planned. No device mutation happens here.
     * Transitions: APPLYING, SUCCEEDED (dry run), FAILED
     */
    VALIDATING,

    /**
     * Domain handlers are mutating the device.
     * Transitions: SUCCEEDED, ROLLING_BACK, FAILED
     */
    APPLYING,

    /**
     * Reverse plan is being applied after a failed apply.
     * Transitions: ROLLED_BACK, FAILED
     */
    ROLLING_BACK,

    SUCCEEDED,

    ROLLED_BACK,

    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ROLLED_BACK || this == FAILED;
    }

    /**
     * Checks if the device may currently be receiving changes for this task.
     */
    public boolean isMutating() {
        return this == APPLYING || this == ROLLING_BACK;
    }
}
