package com.platform.onboarding.error;

/**
 * Non-success response or transport failure from the device management API.
 */
public class DeviceClientException extends OnboardingException {
    
    private final String method;
    private final String path;
    private final int status;
    
    public DeviceClientException(String method, String path, int status, String message) {
        super(status == 0 ? ErrorCode.DEVICE_UNAVAILABLE : ErrorCode.DEVICE_ERROR,
            String.format("%s %s returned %d: %s", method, path, status, message));
        this.method = method;
        this.path = path;
        this.status = status;
    }
    
    public DeviceClientException(String method, String path, Throwable cause) {
        super(ErrorCode.DEVICE_UNAVAILABLE,
            String.format("%s %s failed: %s", method, path, cause.getMessage()), cause);
        this.method = method;
        this.path = path;
        this.status = 0;
    }
    
    public String getMethod() {
        return method;
    }
    
    public String getPath() {
        return path;
    }
    
    public int getStatus() {
        return status;
    }
    
    public boolean isNotFound() {
        return status == 404;
    }
    
    /**
     * Transport failures and 5xx responses are worth another attempt.
     */
    public boolean isRetryable() {
        return status == 0 || status >= 500;
    }
}
