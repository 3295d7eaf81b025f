package com.platform.onboarding.error;

import java.util.List;

/**
 * Exception for declarations rejected before any device mutation.
 * Collects every problem found rather than only the first.
 */
public class ValidationException extends OnboardingException {
    
    private final String field;
    private final Object rejectedValue;
    private final List<String> problems;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
        this.problems = List.of(message);
    }
    
    public ValidationException(ErrorCode errorCode, List<String> problems) {
        super(errorCode, String.join("; ", problems));
        this.field = null;
        this.rejectedValue = null;
        this.problems = List.copyOf(problems);
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
        this.problems = List.of(getMessage());
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
    
    public List<String> getProblems() {
        return problems;
    }
}
