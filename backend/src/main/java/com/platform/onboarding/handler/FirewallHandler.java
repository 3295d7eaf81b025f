package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.OperationKind;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.Domain;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Firewall address lists, port lists and policies.
 * Creating or changing them requires the AFM module.
 */
@Component
public class FirewallHandler extends AbstractDomainHandler {
    
    public FirewallHandler(ResourceWriter writer, StepRunner runner) {
        super(writer, runner);
    }
    
    @Override
    public Domain domain() {
        return Domain.FIREWALL;
    }
    
    @Override
    public HandlerOutcome process(DomainSlice slice, DeviceClient client) {
        boolean writes = slice.operations().stream().anyMatch(op -> op.kind() != OperationKind.DELETE);
        if (writes && !afmProvisioned(slice)) {
            throw new ApplyException(slice.operations().get(0).configClass().getDeclaredName(), null,
                DevicePaths.PROVISION + "/afm", "AFM must be provisioned to configure firewall objects");
        }
        return super.process(slice, client);
    }
    
    /**
     * Unknown provisioning state is not treated as a failure.
     */
    private static boolean afmProvisioned(DomainSlice slice) {
        Optional<ConfigObject> provision = slice.desired().nameless(ConfigClass.PROVISION)
            .or(() -> slice.current().nameless(ConfigClass.PROVISION));
        if (provision.isEmpty()) {
            return true;
        }
        String level = provision.get().get("afm").map(JsonNode::asText).orElse("none");
        return !"none".equals(level);
    }
}
