package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.device.RequestOptions;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.model.OperationKind;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.Domain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * System settings, DNS, NTP, provisioning, management routes, users and
 * device certificates.
 */
@Slf4j
@Component
public class SystemHandler extends AbstractDomainHandler {
    
    private final CertificateInstaller certificateInstaller;
    
    public SystemHandler(ResourceWriter writer, StepRunner runner, CertificateInstaller certificateInstaller) {
        super(writer, runner);
        this.certificateInstaller = certificateInstaller;
    }
    
    @Override
    public Domain domain() {
        return Domain.SYSTEM;
    }
    
    @Override
    protected List<ApplyStep> stepsFor(Operation operation, DomainSlice slice) {
        return switch (operation.configClass()) {
            case DEVICE_CERTIFICATE -> certificateSteps(operation);
            case PROVISION -> provisioningSteps(operation);
            default -> writer.stepsFor(operation);
        };
    }
    
    /**
     * Any provisioning change needs a reboot before the new modules are usable.
     */
    @Override
    protected boolean requiresReboot(Operation operation) {
        return operation.configClass() == ConfigClass.PROVISION;
    }
    
    private List<ApplyStep> certificateSteps(Operation operation) {
        String name = operation.name();
        if (operation.kind() == OperationKind.DELETE) {
            return List.of(
                new ApplyStep(ConfigClass.DEVICE_CERTIFICATE, name, DevicePaths.SSL_CERT,
                    client -> client.delete(DevicePaths.commonObject(DevicePaths.SSL_CERT, name), RequestOptions.defaults())),
                new ApplyStep(ConfigClass.DEVICE_CERTIFICATE, name, DevicePaths.SSL_KEY,
                    client -> deleteIfPresent(client, DevicePaths.commonObject(DevicePaths.SSL_KEY, name))));
        }
        
        List<ApplyStep> steps = new ArrayList<>();
        ConfigObject desired = operation.desired();
        String certificate = desired.get("certificate").map(c -> c.path("base64").asText("")).orElse("");
        if (!certificate.isEmpty()) {
            steps.add(certificateInstaller.installStep(ConfigClass.DEVICE_CERTIFICATE, name,
                name, name + ".crt", certificate, DevicePaths.SSL_CERT));
        }
        String key = desired.get("privateKey").map(k -> k.path("base64").asText("")).orElse("");
        if (!key.isEmpty()) {
            steps.add(certificateInstaller.installStep(ConfigClass.DEVICE_CERTIFICATE, name,
                name, name + ".key", key, DevicePaths.SSL_KEY));
        }
        return steps;
    }
    
    private List<ApplyStep> provisioningSteps(Operation operation) {
        List<ApplyStep> steps = new ArrayList<>();
        ConfigObject current = operation.current() != null ? operation.current() : ConfigObject.empty();
        for (String module : operation.desired().propertyNames()) {
            String level = operation.desired().get(module).map(JsonNode::asText).orElse("none");
            String existing = current.get(module).map(JsonNode::asText).orElse("none");
            if (level.equals(existing)) {
                continue;
            }
            String path = DevicePaths.PROVISION + "/" + module;
            ObjectNode body = JsonNodeFactory.instance.objectNode().put("level", level);
            log.info("Provisioning {} from {} to {}", module, existing, level);
            steps.add(new ApplyStep(ConfigClass.PROVISION, null, path,
                client -> client.modify(path, body, RequestOptions.defaults())));
        }
        return steps;
    }
}
