package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Value comparison rules shared by planning and state handling.
 */
public final class JsonValues {
    
    /**
     * Fields holding credentials or key material, at any depth.
     */
    public static final Set<String> SECRET_FIELDS =
        Set.of("password", "bindPassword", "secret", "passphrase", "privateKey", "sslClientKey");
    
    // Values the device accepts but never reports back. The device reports
    // sslClientKey as an empty object when set, so it stays comparable.
    private static final Set<String> UNREADABLE_FIELDS =
        Set.of("password", "bindPassword", "secret", "passphrase", "privateKey", "base64");
    
    private JsonValues() {
    }
    
    public static boolean isSecretField(String name) {
        return SECRET_FIELDS.contains(name);
    }
    
    public static boolean isUnreadableField(String name) {
        return UNREADABLE_FIELDS.contains(name);
    }
    
    /**
     * Structural equality that tolerates numeric representation differences
     * and ignores fields the device never reports.
     */
    public static boolean equivalent(JsonNode a, JsonNode b) {
        boolean aMissing = a == null || a.isMissingNode() || a.isNull();
        boolean bMissing = b == null || b.isMissingNode() || b.isNull();
        if (aMissing || bMissing) {
            return aMissing == bMissing;
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.isNumber() && b.isTextual() || a.isTextual() && b.isNumber()) {
            return a.asText().equals(b.asText());
        }
        if (a.isObject() && b.isObject()) {
            Set<String> keys = readableKeys(a);
            if (!keys.equals(readableKeys(b))) {
                return false;
            }
            for (String key : keys) {
                if (!equivalent(a.get(key), b.get(key))) {
                    return false;
                }
            }
            return true;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equivalent(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }
    
    private static Set<String> readableKeys(JsonNode node) {
        Set<String> keys = new HashSet<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            JsonNode value = node.get(name);
            if (!isUnreadableField(name) && value != null && !value.isNull()) {
                keys.add(name);
            }
        }
        return keys;
    }
}
