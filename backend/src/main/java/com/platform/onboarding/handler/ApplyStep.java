package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.schema.ConfigClass;

import java.util.concurrent.CancellationException;

/**
 * One device interaction, labelled with the object it belongs to. A
 * failure is reported with the path of the request that failed; any other
 * runtime failure while building or sending the request is reported
 * against the step path. Cancellation passes through unchanged.
 */
public record ApplyStep(ConfigClass configClass, String name, String path, DeviceAction action) {
    
    /**
     * The device calls a step performs.
     */
    @FunctionalInterface
    public interface DeviceAction {
        void run(DeviceClient client);
    }
    
    public void run(DeviceClient client) {
        try {
            action.run(client);
        } catch (DeviceClientException e) {
            throw new ApplyException(configClass.getDeclaredName(), name, e.getPath(), e);
        } catch (ApplyException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ApplyException(configClass.getDeclaredName(), name, path, e);
        }
    }
}
