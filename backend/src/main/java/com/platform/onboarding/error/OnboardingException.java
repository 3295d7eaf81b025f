package com.platform.onboarding.error;

/**
 * Base exception for all onboarding exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class OnboardingException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected OnboardingException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected OnboardingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected OnboardingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
