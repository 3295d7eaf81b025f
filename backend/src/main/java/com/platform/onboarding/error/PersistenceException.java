package com.platform.onboarding.error;

/**
 * Exception for failures of the durable state backend.
 */
public class PersistenceException extends OnboardingException {
    
    private final String key;
    private final boolean retryable;
    
    public PersistenceException(String key, String message, boolean retryable, Throwable cause) {
        super(retryable ? ErrorCode.PERSISTENCE_UNAVAILABLE : ErrorCode.PERSISTENCE_ERROR,
            String.format("State record '%s': %s", key, message), cause);
        this.key = key;
        this.retryable = retryable;
    }
    
    public String getKey() {
        return key;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
}
