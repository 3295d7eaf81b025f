package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.SchemaMap;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the live configuration of every supported class from the device.
 * Classes whose endpoint does not exist (module not provisioned) are
 * treated as absent.
 */
@Slf4j
public class DeviceConfigReader {
    
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    
    private final SchemaMap schema;
    private final ConfigTranslator translator;
    
    public DeviceConfigReader(SchemaMap schema, ConfigTranslator translator) {
        this.schema = schema;
        this.translator = translator;
    }
    
    public DeviceConfig read(DeviceClient client) {
        Map<ConfigClass, JsonNode> raw = new EnumMap<>(ConfigClass.class);
        JsonNode localDevice = null;
        
        for (ConfigItem item : schema.items()) {
            Optional<JsonNode> value;
            switch (item.readMode()) {
                case COLLECTION -> value = optional(client, item.path()).map(body -> items(body));
                case SINGLETON -> value = optional(client, item.path());
                case PROVISIONING_LEVELS -> value = optional(client, item.path()).map(DeviceConfigReader::provisioningLevels);
                case LOCAL_DEVICE -> {
                    if (localDevice == null) {
                        localDevice = findLocalDevice(client);
                    }
                    value = Optional.ofNullable(localDevice);
                }
                case VARIANTS -> value = Optional.of(readVariants(client, item));
                case COMPOSITE -> value = readAuthentication(client);
                default -> throw new IllegalStateException("Unhandled read mode " + item.readMode());
            }
            value.ifPresent(v -> raw.put(item.configClass(), v));
        }
        
        DeviceConfig config = translator.fromDevice(raw);
        log.debug("Read device configuration covering {} classes", raw.size());
        return config;
    }
    
    /**
     * Stable identity of the device, used to key its original configuration.
     */
    public String readMachineId(DeviceClient client) {
        String machineId = client.get(DevicePaths.DEVICE_INFO).path("machineId").asText("");
        if (machineId.isEmpty()) {
            throw new DeviceClientException("GET", DevicePaths.DEVICE_INFO, 200, "response has no machineId");
        }
        return machineId;
    }
    
    /**
     * Name of the local device in the device trust list.
     */
    public String localDeviceName(DeviceClient client) {
        JsonNode local = findLocalDevice(client);
        if (local == null) {
            throw new DeviceClientException("GET", DevicePaths.CM_DEVICE, 200, "no entry with selfDevice=true");
        }
        return local.path("name").asText();
    }
    
    private static JsonNode findLocalDevice(DeviceClient client) {
        for (JsonNode device : items(client.get(DevicePaths.CM_DEVICE))) {
            if ("true".equals(device.path("selfDevice").asText())) {
                return device;
            }
        }
        return null;
    }
    
    private static ArrayNode items(JsonNode body) {
        JsonNode items = body.path("items");
        return items.isArray() ? (ArrayNode) items : JSON.arrayNode();
    }
    
    private static JsonNode provisioningLevels(JsonNode body) {
        ObjectNode levels = JSON.objectNode();
        for (JsonNode module : items(body)) {
            levels.put(module.path("name").asText(), module.path("level").asText("none"));
        }
        return levels;
    }
    
    private static ArrayNode readVariants(DeviceClient client, ConfigItem item) {
        ArrayNode all = JSON.arrayNode();
        for (String variant : item.variants()) {
            optional(client, item.variantPath(variant)).ifPresent(body -> {
                for (JsonNode element : items(body)) {
                    ObjectNode tagged = ((ObjectNode) element).deepCopy();
                    tagged.put(item.discriminator(), variant);
                    all.add(tagged);
                }
            });
        }
        return all;
    }
    
    private static Optional<JsonNode> readAuthentication(DeviceClient client) {
        Optional<JsonNode> source = optional(client, DevicePaths.AUTH_SOURCE);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode composite = JSON.objectNode();
        composite.set("type", source.get().path("type"));
        composite.set("fallback", source.get().path("fallback"));
        
        optional(client, DevicePaths.AUTH_REMOTE_USER).ifPresent(remoteUser ->
            composite.set("remoteUsersDefaults", AuthenticationMapper.remoteUsersFromDevice(remoteUser)));
        
        optional(client, DevicePaths.commonObject(DevicePaths.AUTH_RADIUS, AuthenticationMapper.SUBCLASS_NAME))
            .ifPresent(aggregate -> composite.set("radius", AuthenticationMapper.radiusFromDevice(aggregate,
                optional(client, DevicePaths.commonObject(DevicePaths.AUTH_RADIUS_SERVER,
                    AuthenticationMapper.RADIUS_PRIMARY)).orElse(null),
                optional(client, DevicePaths.commonObject(DevicePaths.AUTH_RADIUS_SERVER,
                    AuthenticationMapper.RADIUS_SECONDARY)).orElse(null))));
        
        optional(client, DevicePaths.commonObject(DevicePaths.AUTH_TACACS, AuthenticationMapper.SUBCLASS_NAME))
            .ifPresent(tacacs -> composite.set("tacacs", AuthenticationMapper.tacacsFromDevice(tacacs)));
        
        optional(client, DevicePaths.commonObject(DevicePaths.AUTH_LDAP, AuthenticationMapper.SUBCLASS_NAME))
            .ifPresent(ldap -> composite.set("ldap", AuthenticationMapper.ldapFromDevice(ldap)));
        
        return Optional.of(composite);
    }
    
    private static Optional<JsonNode> optional(DeviceClient client, String path) {
        try {
            return Optional.of(client.get(path));
        } catch (DeviceClientException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
