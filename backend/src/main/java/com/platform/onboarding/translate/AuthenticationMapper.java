package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Two-way mapping between the declared remote authentication settings and
 * the device objects that hold them.
 * 
 * The canonical form of each section is what reading the device back would
 * produce, plus the secrets and key material the device never returns.
 */
public final class AuthenticationMapper {
    
    public static final String SUBCLASS_NAME = "system-auth";
    public static final String RADIUS_PRIMARY = "system_auth_name1";
    public static final String RADIUS_SECONDARY = "system_auth_name2";
    
    public static final String LDAP_CA_CERT = "do_ldapCaCert.crt";
    public static final String LDAP_CLIENT_CERT = "do_ldapClientCert.crt";
    public static final String LDAP_CLIENT_KEY = "do_ldapClientCert.key";
    
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final String NONE = "none";
    private static final int DEFAULT_RADIUS_PORT = 1812;
    
    private AuthenticationMapper() {
    }
    
    /**
     * Canonicalizes the nested sections of an Authentication object in place.
     */
    public static void canonicalize(ObjectNode authentication) {
        replaceObject(authentication, "remoteUsersDefaults",
            section -> remoteUsersFromDevice(remoteUsersToDevice(section)));
        replaceObject(authentication, "radius", AuthenticationMapper::canonicalRadius);
        replaceObject(authentication, "tacacs", section -> {
            ObjectNode canonical = tacacsFromDevice(tacacsToDevice(section));
            copyIfPresent(section, canonical, "secret");
            return canonical;
        });
        replaceObject(authentication, "ldap", AuthenticationMapper::canonicalLdap);
    }
    
    private interface SectionMapper {
        ObjectNode map(ObjectNode section);
    }
    
    private static void replaceObject(ObjectNode parent, String field, SectionMapper mapper) {
        JsonNode section = parent.get(field);
        if (section != null && section.isObject()) {
            parent.set(field, mapper.map((ObjectNode) section));
        }
    }
    
    // ==================== Remote user defaults ====================
    
    public static ObjectNode remoteUsersToDevice(JsonNode declared) {
        ObjectNode body = JSON.objectNode();
        body.put("defaultPartition", declared.path("partitionAccess").asText("all"));
        body.put("defaultRole", declared.path("role").asText("no-access"));
        body.put("remoteConsoleAccess", declared.path("terminalAccess").asText("disabled"));
        return body;
    }
    
    public static ObjectNode remoteUsersFromDevice(JsonNode device) {
        ObjectNode declared = JSON.objectNode();
        declared.put("partitionAccess", device.path("defaultPartition").asText("all"));
        declared.put("role", device.path("defaultRole").asText("no-access"));
        declared.put("terminalAccess", device.path("remoteConsoleAccess").asText("disabled"));
        return declared;
    }
    
    // ==================== RADIUS ====================
    
    private static ObjectNode canonicalRadius(ObjectNode declared) {
        ObjectNode canonical = JSON.objectNode();
        canonical.put("serviceType", declared.path("serviceType").asText("default"));
        ObjectNode servers = canonical.putObject("servers");
        for (String role : List.of("primary", "secondary")) {
            JsonNode server = declared.path("servers").path(role);
            if (server.isObject()) {
                ObjectNode entry = servers.putObject(role);
                entry.put("server", server.path("server").asText());
                entry.put("port", server.path("port").asInt(DEFAULT_RADIUS_PORT));
                copyIfPresent(server, entry, "secret");
            }
        }
        return canonical;
    }
    
    public static ObjectNode radiusServerBody(JsonNode server, String name) {
        ObjectNode body = JSON.objectNode();
        body.put("name", name);
        body.put("partition", "Common");
        body.put("server", server.path("server").asText());
        body.put("port", server.path("port").asInt(DEFAULT_RADIUS_PORT));
        copyIfPresent(server, body, "secret");
        return body;
    }
    
    public static ObjectNode radiusAggregateBody(JsonNode radius) {
        ObjectNode body = JSON.objectNode();
        body.put("name", SUBCLASS_NAME);
        body.put("partition", "Common");
        body.put("serviceType", radius.path("serviceType").asText("default"));
        ArrayNode servers = body.putArray("servers");
        servers.add(RADIUS_PRIMARY);
        if (hasSecondaryRadius(radius)) {
            servers.add(RADIUS_SECONDARY);
        }
        return body;
    }
    
    public static boolean hasSecondaryRadius(JsonNode radius) {
        return radius.path("servers").path("secondary").isObject();
    }
    
    /**
     * Rebuilds the declared RADIUS section from the aggregate object and its servers.
     * A missing secondary server argument means none is configured.
     */
    public static ObjectNode radiusFromDevice(JsonNode aggregate, JsonNode primary, JsonNode secondary) {
        ObjectNode declared = JSON.objectNode();
        declared.put("serviceType", aggregate.path("serviceType").asText("default"));
        ObjectNode servers = declared.putObject("servers");
        if (primary != null) {
            ObjectNode entry = servers.putObject("primary");
            entry.put("server", primary.path("server").asText());
            entry.put("port", primary.path("port").asInt(DEFAULT_RADIUS_PORT));
        }
        if (secondary != null && listsName(aggregate.path("servers"), RADIUS_SECONDARY)) {
            ObjectNode entry = servers.putObject("secondary");
            entry.put("server", secondary.path("server").asText());
            entry.put("port", secondary.path("port").asInt(DEFAULT_RADIUS_PORT));
        }
        return declared;
    }
    
    private static boolean listsName(JsonNode servers, String name) {
        for (JsonNode server : servers) {
            String value = server.asText();
            if (value.equals(name) || value.endsWith("/" + name)) {
                return true;
            }
        }
        return false;
    }
    
    // ==================== TACACS ====================
    
    public static ObjectNode tacacsToDevice(JsonNode declared) {
        ObjectNode body = JSON.objectNode();
        body.put("name", SUBCLASS_NAME);
        body.put("partition", "Common");
        body.put("accounting", declared.path("accounting").asText("send-to-first-server"));
        body.put("authentication", declared.path("authentication").asText("use-first-server"));
        body.put("debug", declared.path("debug").asBoolean(false) ? "enabled" : "disabled");
        JsonNode encryption = declared.path("encryption");
        body.put("encryption", encryption.isBoolean() && !encryption.asBoolean() ? "disabled" : "enabled");
        copyIfPresent(declared, body, "secret");
        body.set("servers", arrayOrEmpty(declared.path("servers")));
        copyIfPresent(declared, body, "service");
        copyIfPresent(declared, body, "protocol");
        return body;
    }
    
    public static ObjectNode tacacsFromDevice(JsonNode device) {
        ObjectNode declared = JSON.objectNode();
        declared.put("accounting", device.path("accounting").asText("send-to-first-server"));
        declared.put("authentication", device.path("authentication").asText("use-first-server"));
        declared.put("debug", "enabled".equals(device.path("debug").asText()));
        declared.put("encryption", !"disabled".equals(device.path("encryption").asText()));
        declared.set("servers", arrayOrEmpty(device.path("servers")));
        copyIfPresent(device, declared, "service");
        copyIfPresent(device, declared, "protocol");
        return declared;
    }
    
    // ==================== LDAP ====================
    
    private static ObjectNode canonicalLdap(ObjectNode declared) {
        ObjectNode canonical = ldapFromDevice(ldapToDevice(declared));
        copyIfPresent(declared, canonical, "bindPassword");
        for (String field : List.of("sslCaCert", "sslClientCert", "sslClientKey")) {
            JsonNode cert = declared.path(field);
            if (cert.has("base64")) {
                canonical.putObject(field).set("base64", cert.get("base64"));
            }
        }
        return canonical;
    }
    
    public static ObjectNode ldapToDevice(JsonNode declared) {
        ObjectNode body = JSON.objectNode();
        body.put("name", SUBCLASS_NAME);
        body.put("partition", "Common");
        body.put("bindDn", declared.path("bindDn").asText(NONE));
        body.put("bindPw", declared.path("bindPassword").asText(NONE));
        body.put("bindTimeout", declared.path("bindTimeout").asInt(30));
        body.put("checkHostAttr", enabled(declared.path("checkBindPassword").asBoolean(false)));
        body.put("checkRolesGroup", enabled(declared.path("checkRemoteRole").asBoolean(false)));
        body.put("filter", declared.path("filter").asText(NONE));
        body.put("groupDn", declared.path("groupDn").asText(NONE));
        body.put("groupMemberAttribute", declared.path("groupMemberAttribute").asText(NONE));
        body.put("idleTimeout", declared.path("idleTimeout").asInt(3600));
        body.put("ignoreAuthInfoUnavail", declared.path("ignoreAuthInfoUnavailable").asBoolean(false) ? "yes" : "no");
        body.put("ignoreUnknownUser", enabled(declared.path("ignoreUnknownUser").asBoolean(false)));
        body.put("loginAttribute", declared.path("loginAttribute").asText(NONE));
        body.put("port", declared.path("port").asInt(389));
        body.put("scope", declared.path("searchScope").asText("sub"));
        body.put("searchBaseDn", declared.path("searchBaseDn").asText(NONE));
        body.put("searchTimeout", declared.path("searchTimeout").asInt(30));
        body.set("servers", arrayOrEmpty(declared.path("servers")));
        body.put("ssl", declared.path("ssl").asText("disabled"));
        body.put("sslCaCertFile", declared.has("sslCaCert") ? "/Common/" + LDAP_CA_CERT : NONE);
        body.put("sslCheckPeer", enabled(declared.path("sslCheckPeer").asBoolean(false)));
        body.put("sslCiphers", joinCiphers(declared.path("sslCiphers")));
        body.put("sslClientCert", declared.has("sslClientCert") ? "/Common/" + LDAP_CLIENT_CERT : NONE);
        body.put("sslClientKey", declared.has("sslClientKey") ? "/Common/" + LDAP_CLIENT_KEY : NONE);
        body.put("userTemplate", declared.path("userTemplate").asText(NONE));
        body.put("version", declared.path("version").asInt(3));
        return body;
    }
    
    public static ObjectNode ldapFromDevice(JsonNode device) {
        ObjectNode declared = JSON.objectNode();
        putUnlessNone(device, declared, "bindDn", "bindDn");
        declared.put("bindTimeout", device.path("bindTimeout").asInt(30));
        declared.put("checkBindPassword", "enabled".equals(device.path("checkHostAttr").asText()));
        declared.put("checkRemoteRole", "enabled".equals(device.path("checkRolesGroup").asText()));
        putUnlessNone(device, declared, "filter", "filter");
        putUnlessNone(device, declared, "groupDn", "groupDn");
        putUnlessNone(device, declared, "groupMemberAttribute", "groupMemberAttribute");
        declared.put("idleTimeout", device.path("idleTimeout").asInt(3600));
        declared.put("ignoreAuthInfoUnavailable", "yes".equals(device.path("ignoreAuthInfoUnavail").asText()));
        declared.put("ignoreUnknownUser", "enabled".equals(device.path("ignoreUnknownUser").asText()));
        putUnlessNone(device, declared, "loginAttribute", "loginAttribute");
        declared.put("port", device.path("port").asInt(389));
        declared.put("searchScope", device.path("scope").asText("sub"));
        putUnlessNone(device, declared, "searchBaseDn", "searchBaseDn");
        declared.put("searchTimeout", device.path("searchTimeout").asInt(30));
        declared.set("servers", arrayOrEmpty(device.path("servers")));
        declared.put("ssl", device.path("ssl").asText("disabled"));
        if (isSet(device.path("sslCaCertFile"))) {
            declared.putObject("sslCaCert");
        }
        declared.put("sslCheckPeer", "enabled".equals(device.path("sslCheckPeer").asText()));
        String ciphers = device.path("sslCiphers").asText("");
        if (!ciphers.isEmpty() && !NONE.equals(ciphers)) {
            ArrayNode list = declared.putArray("sslCiphers");
            for (String cipher : ciphers.split(":")) {
                list.add(cipher);
            }
        }
        if (isSet(device.path("sslClientCert"))) {
            declared.putObject("sslClientCert");
        }
        if (isSet(device.path("sslClientKey"))) {
            declared.putObject("sslClientKey");
        }
        putUnlessNone(device, declared, "userTemplate", "userTemplate");
        declared.put("version", device.path("version").asInt(3));
        return declared;
    }
    
    // ==================== Helpers ====================
    
    private static String enabled(boolean value) {
        return value ? "enabled" : "disabled";
    }
    
    private static boolean isSet(JsonNode value) {
        return value.isTextual() && !value.asText().isEmpty() && !NONE.equals(value.asText());
    }
    
    private static String joinCiphers(JsonNode ciphers) {
        if (!ciphers.isArray()) {
            return "";
        }
        StringBuilder joined = new StringBuilder();
        for (JsonNode cipher : ciphers) {
            if (joined.length() > 0) {
                joined.append(':');
            }
            joined.append(cipher.asText());
        }
        return joined.toString();
    }
    
    private static void putUnlessNone(JsonNode source, ObjectNode target, String sourceField, String targetField) {
        JsonNode value = source.path(sourceField);
        if (isSet(value)) {
            target.put(targetField, value.asText());
        }
    }
    
    private static void copyIfPresent(JsonNode source, ObjectNode target, String field) {
        JsonNode value = source.get(field);
        if (value != null && !value.isNull()) {
            target.set(field, value.deepCopy());
        }
    }
    
    private static JsonNode arrayOrEmpty(JsonNode value) {
        return value.isArray() ? value.deepCopy() : JSON.arrayNode();
    }
}
