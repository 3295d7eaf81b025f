package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.Domain;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * VLANs, route domains, self IPs, routes, DNS resolvers and dynamic routing.
 * 
 * Self IP address and VLAN cannot change in place; the writer replaces the
 * self IP when either differs.
 */
@Component
public class NetworkHandler extends AbstractDomainHandler {
    
    private static final Set<String> PORT_LOCKDOWN_KEYWORDS = Set.of("all", "none", "default");
    
    public NetworkHandler(ResourceWriter writer, StepRunner runner) {
        super(writer, runner);
    }
    
    @Override
    public Domain domain() {
        return Domain.NETWORK;
    }
    
    @Override
    protected List<ApplyStep> stepsFor(Operation operation, DomainSlice slice) {
        if (operation.configClass() == ConfigClass.SELF_IP) {
            return writer.stepsFor(operation, writer.item(operation).path(), NetworkHandler::collapseAllowService);
        }
        return writer.stepsFor(operation);
    }
    
    /**
     * The device takes port lockdown keywords as a plain string, not a list.
     */
    static ObjectNode collapseAllowService(ObjectNode body) {
        JsonNode allowService = body.get("allowService");
        if (allowService != null && allowService.isArray() && allowService.size() == 1
                && PORT_LOCKDOWN_KEYWORDS.contains(allowService.get(0).asText())) {
            body.put("allowService", allowService.get(0).asText());
        }
        return body;
    }
}
