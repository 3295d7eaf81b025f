package com.platform.onboarding.device;

import java.util.Map;

/**
 * Per-request flags for device calls.
 *
 * @param silent never log the request body or echo it in errors
 * @param retry retry transient failures
 * @param headers extra HTTP headers
 */
public record RequestOptions(boolean silent, boolean retry, Map<String, String> headers) {
    
    private static final RequestOptions DEFAULTS = new RequestOptions(false, true, Map.of());
    
    public RequestOptions {
        headers = Map.copyOf(headers);
    }
    
    public static RequestOptions defaults() {
        return DEFAULTS;
    }
    
    public static RequestOptions silentRequest() {
        return new RequestOptions(true, true, Map.of());
    }
    
    public RequestOptions withoutRetry() {
        return new RequestOptions(silent, false, headers);
    }
}
