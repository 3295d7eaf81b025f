package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.device.RequestOptions;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.model.OperationKind;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.Domain;
import com.platform.onboarding.translate.AuthenticationMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote authentication roles and the authentication source settings.
 * 
 * Order: remote roles (in parallel), RADIUS, TACACS, LDAP, the source
 * type, then remote user defaults. Each section runs only when declared.
 */
@Slf4j
@Component
public class AuthenticationHandler implements DomainHandler {
    
    private final ResourceWriter writer;
    private final StepRunner runner;
    private final CertificateInstaller certificateInstaller;
    
    public AuthenticationHandler(ResourceWriter writer, StepRunner runner, CertificateInstaller certificateInstaller) {
        this.writer = writer;
        this.runner = runner;
        this.certificateInstaller = certificateInstaller;
    }
    
    @Override
    public Domain domain() {
        return Domain.AUTHENTICATION;
    }
    
    @Override
    public HandlerOutcome process(DomainSlice slice, DeviceClient client) {
        List<ApplyStep> roleUpserts = new ArrayList<>();
        List<ApplyStep> roleDeletes = new ArrayList<>();
        Operation authentication = null;
        
        for (Operation operation : slice.operations()) {
            if (operation.configClass() == ConfigClass.AUTHENTICATION) {
                authentication = operation;
            } else if (operation.kind() == OperationKind.DELETE) {
                roleDeletes.addAll(writer.stepsFor(operation));
            } else {
                roleUpserts.add(roleStep(operation));
            }
        }
        
        runner.runParallel(roleUpserts, client);
        runner.runSequential(roleDeletes, client);
        if (authentication != null) {
            applyAuthentication(authentication.desired(), client);
        }
        return new HandlerOutcome(slice.operations().size(), false);
    }
    
    private ApplyStep roleStep(Operation operation) {
        ConfigItem item = writer.item(operation);
        ObjectNode body = writer.body(item, operation.desired());
        body.put("name", operation.name());
        return new ApplyStep(ConfigClass.REMOTE_AUTH_ROLE, operation.name(), DevicePaths.AUTH_REMOTE_ROLE,
            client -> client.createOrModify(DevicePaths.AUTH_REMOTE_ROLE, body, RequestOptions.defaults()));
    }
    
    private void applyAuthentication(ConfigObject desired, DeviceClient client) {
        Optional<JsonNode> radius = desired.get("radius");
        if (radius.isPresent() && radius.get().path("servers").path("primary").isObject()) {
            logged("RADIUS", () -> applyRadius(radius.get(), client));
        }
        desired.get("tacacs").ifPresent(tacacs -> logged("TACACS", () ->
            runner.runSequential(List.of(step(DevicePaths.AUTH_TACACS,
                c -> c.createOrModify(DevicePaths.AUTH_TACACS, AuthenticationMapper.tacacsToDevice(tacacs),
                    RequestOptions.silentRequest()))), client)));
        desired.get("ldap").ifPresent(ldap -> logged("LDAP", () -> applyLdap(ldap, client)));
        
        ConfigItem item = writer.item(ConfigClass.AUTHENTICATION);
        Map<String, JsonNode> source = new LinkedHashMap<>();
        desired.get("enabledSourceType").ifPresent(type -> source.put("enabledSourceType", type));
        desired.get("fallback").ifPresent(fallback -> source.put("fallback", fallback));
        ObjectNode sourceBody = writer.body(item, ConfigObject.of(source));
        runner.runSequential(List.of(step(DevicePaths.AUTH_SOURCE,
            c -> c.modify(DevicePaths.AUTH_SOURCE, sourceBody, RequestOptions.defaults()))), client);
        
        desired.get("remoteUsersDefaults").ifPresent(defaults ->
            runner.runSequential(List.of(step(DevicePaths.AUTH_REMOTE_USER,
                c -> c.modify(DevicePaths.AUTH_REMOTE_USER, AuthenticationMapper.remoteUsersToDevice(defaults),
                    RequestOptions.defaults()))), client));
    }
    
    /**
     * Servers first, then the aggregate object naming them. A secondary
     * server left over from an earlier declaration is removed last.
     */
    private void applyRadius(JsonNode radius, DeviceClient client) {
        JsonNode servers = radius.path("servers");
        List<ApplyStep> serverSteps = new ArrayList<>();
        serverSteps.add(step(DevicePaths.AUTH_RADIUS_SERVER, c -> c.createOrModify(DevicePaths.AUTH_RADIUS_SERVER,
            AuthenticationMapper.radiusServerBody(servers.path("primary"), AuthenticationMapper.RADIUS_PRIMARY),
            RequestOptions.silentRequest())));
        if (AuthenticationMapper.hasSecondaryRadius(radius)) {
            serverSteps.add(step(DevicePaths.AUTH_RADIUS_SERVER, c -> c.createOrModify(DevicePaths.AUTH_RADIUS_SERVER,
                AuthenticationMapper.radiusServerBody(servers.path("secondary"), AuthenticationMapper.RADIUS_SECONDARY),
                RequestOptions.silentRequest())));
        }
        runner.runParallel(serverSteps, client);
        
        List<ApplyStep> finish = new ArrayList<>();
        finish.add(step(DevicePaths.AUTH_RADIUS, c -> c.createOrModify(DevicePaths.AUTH_RADIUS,
            AuthenticationMapper.radiusAggregateBody(radius), RequestOptions.silentRequest())));
        if (!AuthenticationMapper.hasSecondaryRadius(radius)) {
            finish.add(step(DevicePaths.AUTH_RADIUS_SERVER, c -> AbstractDomainHandler.deleteIfPresent(c,
                DevicePaths.commonObject(DevicePaths.AUTH_RADIUS_SERVER, AuthenticationMapper.RADIUS_SECONDARY))));
        }
        runner.runSequential(finish, client);
    }
    
    /**
     * Certificate material is installed before the LDAP object that refers to it.
     */
    private void applyLdap(JsonNode ldap, DeviceClient client) {
        List<ApplyStep> certificates = new ArrayList<>();
        addCertificate(certificates, ldap.path("sslCaCert"), AuthenticationMapper.LDAP_CA_CERT, DevicePaths.SSL_CERT);
        addCertificate(certificates, ldap.path("sslClientCert"), AuthenticationMapper.LDAP_CLIENT_CERT, DevicePaths.SSL_CERT);
        addCertificate(certificates, ldap.path("sslClientKey"), AuthenticationMapper.LDAP_CLIENT_KEY, DevicePaths.SSL_KEY);
        runner.runParallel(certificates, client);
        
        runner.runSequential(List.of(step(DevicePaths.AUTH_LDAP, c -> c.createOrModify(DevicePaths.AUTH_LDAP,
            AuthenticationMapper.ldapToDevice(ldap), RequestOptions.silentRequest()))), client);
    }
    
    private void addCertificate(List<ApplyStep> steps, JsonNode certificate, String name, String installPath) {
        String base64 = certificate.path("base64").asText("");
        if (!base64.isEmpty()) {
            steps.add(certificateInstaller.installStep(ConfigClass.AUTHENTICATION, null, name, name, base64, installPath));
        }
    }
    
    private static ApplyStep step(String path, ApplyStep.DeviceAction action) {
        return new ApplyStep(ConfigClass.AUTHENTICATION, null, path, action);
    }
    
    private static void logged(String section, Runnable work) {
        try {
            work.run();
        } catch (ApplyException e) {
            log.error("Error configuring remote {} auth: {}", section, e.getMessage());
            throw e;
        }
    }
}
