package com.platform.onboarding.error;

/**
 * Failure while pushing one step of a plan to the device.
 * Identifies the configuration class, object and device path involved.
 */
public class ApplyException extends OnboardingException {
    
    private final String configClass;
    private final String objectName;
    private final String path;
    
    public ApplyException(String configClass, String objectName, String path, String message) {
        super(ErrorCode.APPLY_FAILED, format(configClass, objectName, path, message));
        this.configClass = configClass;
        this.objectName = objectName;
        this.path = path;
    }
    
    public ApplyException(String configClass, String objectName, String path, Throwable cause) {
        super(ErrorCode.APPLY_FAILED, format(configClass, objectName, path, cause.getMessage()), cause);
        this.configClass = configClass;
        this.objectName = objectName;
        this.path = path;
    }
    
    private static String format(String configClass, String objectName, String path, String message) {
        String target = objectName != null ? configClass + " " + objectName : configClass;
        return String.format("Failed to apply %s at %s: %s", target, path, message);
    }
    
    public String getConfigClass() {
        return configClass;
    }
    
    public String getObjectName() {
        return objectName;
    }
    
    public String getPath() {
        return path;
    }
}
