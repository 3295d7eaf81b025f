package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.RequestOptions;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.model.Operation;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Base handler applying a slice operation by operation, in plan order.
 * Subclasses replace the generic steps for classes the device treats
 * specially.
 */
@Slf4j
public abstract class AbstractDomainHandler implements DomainHandler {
    
    protected final ResourceWriter writer;
    protected final StepRunner runner;
    
    protected AbstractDomainHandler(ResourceWriter writer, StepRunner runner) {
        this.writer = writer;
        this.runner = runner;
    }
    
    @Override
    public HandlerOutcome process(DomainSlice slice, DeviceClient client) {
        log.debug("Applying {} {} operation(s)", slice.operations().size(), domain());
        boolean rebootRequired = false;
        for (Operation operation : slice.operations()) {
            runner.runSequential(stepsFor(operation, slice), client);
            rebootRequired |= requiresReboot(operation);
        }
        return new HandlerOutcome(slice.operations().size(), rebootRequired);
    }
    
    protected List<ApplyStep> stepsFor(Operation operation, DomainSlice slice) {
        return writer.stepsFor(operation);
    }
    
    protected boolean requiresReboot(Operation operation) {
        return false;
    }
    
    /**
     * Deletes an object that may already be gone.
     */
    protected static void deleteIfPresent(DeviceClient client, String path) {
        try {
            client.delete(path, RequestOptions.defaults().withoutRetry());
        } catch (DeviceClientException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("{} already absent", path);
        }
    }
}
