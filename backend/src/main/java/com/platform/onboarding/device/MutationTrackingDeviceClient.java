package com.platform.onboarding.device;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator counting successful mutating requests, used to decide
 * whether a failed apply left anything to roll back.
 */
public class MutationTrackingDeviceClient implements DeviceClient {
    
    private final DeviceClient delegate;
    private final AtomicInteger mutations = new AtomicInteger();
    
    public MutationTrackingDeviceClient(DeviceClient delegate) {
        this.delegate = delegate;
    }
    
    public int getMutationCount() {
        return mutations.get();
    }
    
    public boolean hasMutated() {
        return mutations.get() > 0;
    }
    
    @Override
    public JsonNode get(String path, RequestOptions options) {
        return delegate.get(path, options);
    }
    
    @Override
    public JsonNode create(String path, JsonNode body, RequestOptions options) {
        JsonNode result = delegate.create(path, body, options);
        mutations.incrementAndGet();
        return result;
    }
    
    @Override
    public JsonNode modify(String path, JsonNode body, RequestOptions options) {
        JsonNode result = delegate.modify(path, body, options);
        mutations.incrementAndGet();
        return result;
    }
    
    @Override
    public void delete(String path, RequestOptions options) {
        delegate.delete(path, options);
        mutations.incrementAndGet();
    }
    
    @Override
    public JsonNode upload(String path, String content, RequestOptions options) {
        JsonNode result = delegate.upload(path, content, options);
        mutations.incrementAndGet();
        return result;
    }
}
