package com.platform.onboarding.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.translate.JsonValues;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SHA-256 digests of the values a device accepts but never reports back,
 * keyed by class, object name and property.
 *
 * A device read cannot show that a password or key changed, so the planner
 * compares the digest of the declared value with the digest recorded when
 * that property was last applied.
 */
public final class SecretDigests {

    private static final SecretDigests NONE = new SecretDigests(Map.of());

    private final Map<String, String> digests;

    private SecretDigests(Map<String, String> digests) {
        this.digests = digests;
    }

    public static SecretDigests none() {
        return NONE;
    }

    public static SecretDigests of(Map<String, String> digests) {
        return new SecretDigests(Map.copyOf(digests));
    }

    public static String key(ConfigClass configClass, String name, String propertyId) {
        return configClass.name() + "/" + (name == null ? "" : name) + "/" + propertyId;
    }

    /**
     * Whether the recorded digest for the property equals the given one.
     * A property with no recorded digest never matches.
     */
    public boolean matches(ConfigClass configClass, String name, String propertyId, String digest) {
        return digest.equals(digests.get(key(configClass, name, propertyId)));
    }

    public Map<String, String> asMap() {
        return digests;
    }

    /**
     * Digest of the unreadable content of a property value: the whole value
     * for a write-only property, otherwise every nested unreadable field.
     * Empty when the value carries nothing the device hides.
     */
    static Optional<String> digest(PropertyDescriptor descriptor, JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        if (descriptor.writeOnly()) {
            parts.add(value.toString());
        } else {
            collectUnreadable("", value, parts);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        Collections.sort(parts);
        return Optional.of(sha256(String.join("\n", parts)));
    }

    private static void collectUnreadable(String path, JsonNode node, List<String> parts) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String childPath = path + "/" + field.getKey();
                JsonNode child = field.getValue();
                if (JsonValues.isUnreadableField(field.getKey()) && !child.isNull()) {
                    parts.add(childPath + "=" + child);
                } else {
                    collectUnreadable(childPath, child, parts);
                }
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collectUnreadable(path + "/" + i, node.get(i), parts);
            }
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
