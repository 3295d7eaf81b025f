package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.schema.Domain;

/**
 * Applies the operations of one configuration domain to the device.
 * 
 * Implementations must leave the device untouched for operations they
 * never reached, and report the first failure as an
 * {@link com.platform.onboarding.error.ApplyException}.
 */
public interface DomainHandler {
    
    Domain domain();
    
    HandlerOutcome process(DomainSlice slice, DeviceClient client);
}
