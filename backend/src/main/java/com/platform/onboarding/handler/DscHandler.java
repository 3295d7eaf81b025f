package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.schema.Domain;
import com.platform.onboarding.translate.DeviceConfigReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Device service clustering: config sync, failover and mirroring addresses
 * of the local device, plus traffic groups and device groups.
 * 
 * The clustering addresses live on the local device's entry in the device
 * list, whose name is looked up once per run.
 */
@Slf4j
@Component
public class DscHandler extends AbstractDomainHandler {
    
    private final DeviceConfigReader reader;
    
    public DscHandler(ResourceWriter writer, StepRunner runner, DeviceConfigReader reader) {
        super(writer, runner);
        this.reader = reader;
    }
    
    @Override
    public Domain domain() {
        return Domain.DSC;
    }
    
    @Override
    public HandlerOutcome process(DomainSlice slice, DeviceClient client) {
        String localDevicePath = null;
        for (Operation operation : slice.operations()) {
            List<ApplyStep> steps;
            if (operation.configClass().isNameless()) {
                if (localDevicePath == null) {
                    localDevicePath = DevicePaths.commonObject(DevicePaths.CM_DEVICE, localDeviceName(operation, client));
                    log.debug("Applying clustering settings to {}", localDevicePath);
                }
                steps = writer.stepsFor(operation, localDevicePath, UnaryOperator.identity());
            } else {
                steps = writer.stepsFor(operation);
            }
            runner.runSequential(steps, client);
        }
        return new HandlerOutcome(slice.operations().size(), false);
    }
    
    private String localDeviceName(Operation operation, DeviceClient client) {
        try {
            return reader.localDeviceName(client);
        } catch (DeviceClientException e) {
            throw new ApplyException(operation.configClass().getDeclaredName(), null, e.getPath(), e);
        }
    }
}
