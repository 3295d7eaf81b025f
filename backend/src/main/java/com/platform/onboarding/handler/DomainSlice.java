package com.platform.onboarding.handler;

import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.schema.Domain;

import java.util.List;

/**
 * A contiguous run of plan operations belonging to one domain, together
 * with the full desired and current configurations for context.
 */
public record DomainSlice(Domain domain, List<Operation> operations, DeviceConfig desired, DeviceConfig current) {
    
    public DomainSlice {
        operations = List.copyOf(operations);
    }
}
