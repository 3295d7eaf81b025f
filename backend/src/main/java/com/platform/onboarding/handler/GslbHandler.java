package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.model.OperationKind;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.Domain;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * GSLB global settings, data centers, monitors, prober pools and servers.
 */
@Component
public class GslbHandler extends AbstractDomainHandler {
    
    public GslbHandler(ResourceWriter writer, StepRunner runner) {
        super(writer, runner);
    }
    
    @Override
    public Domain domain() {
        return Domain.GSLB;
    }
    
    @Override
    protected List<ApplyStep> stepsFor(Operation operation, DomainSlice slice) {
        ConfigItem item = writer.item(operation);
        return switch (operation.configClass()) {
            case GSLB_MONITOR -> monitorSteps(item, operation);
            case GSLB_SERVER -> writer.stepsFor(operation, item.path(), GslbHandler::joinMonitors);
            default -> writer.stepsFor(operation);
        };
    }
    
    /**
     * Monitors live under a per-type collection, so a type change deletes
     * from the old collection and creates in the new one.
     */
    private List<ApplyStep> monitorSteps(ConfigItem item, Operation operation) {
        UnaryOperator<ObjectNode> stripType = body -> {
            body.remove(item.discriminator());
            return body;
        };
        if (operation.kind() == OperationKind.MODIFY && operation.changes().has(item.discriminator())) {
            List<ApplyStep> steps = new ArrayList<>();
            steps.addAll(writer.stepsFor(Operation.delete(operation.configClass(), operation.name(), operation.current()),
                item.variantPath(monitorType(operation.current())), stripType));
            steps.addAll(writer.stepsFor(Operation.create(operation.configClass(), operation.name(), operation.desired()),
                item.variantPath(monitorType(operation.desired())), stripType));
            return steps;
        }
        ConfigObject source = operation.desired() != null ? operation.desired() : operation.current();
        return writer.stepsFor(operation, item.variantPath(monitorType(source)), stripType);
    }
    
    private static String monitorType(ConfigObject monitor) {
        return monitor.get("monitorType").map(JsonNode::asText).orElse("http");
    }
    
    /**
     * The device expresses a server's monitor list as "a and b".
     */
    static ObjectNode joinMonitors(ObjectNode body) {
        JsonNode monitors = body.get("monitor");
        if (monitors != null && monitors.isArray()) {
            List<String> names = new ArrayList<>();
            monitors.forEach(m -> names.add(m.asText()));
            body.put("monitor", String.join(" and ", names));
        }
        return body;
    }
}
