package com.platform.onboarding.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.translate.JsonValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces secret values in a JSON tree before it is stored or returned.
 */
public final class DeclarationMasker {

    public static final String MASK = "********";

    private DeclarationMasker() {
    }

    /**
     * Masked deep copy; a secret field is masked whole, including key
     * objects such as {@code privateKey: {base64: ...}}. the input is left untouched. Null stays null.
     */
    public static JsonNode mask(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        maskInPlace(copy);
        return copy;
    }

    private static void maskInPlace(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = object.get(name);
                if (JsonValues.isSecretField(name) && value != null && !value.isNull()) {
                    object.put(name, MASK);
                } else {
                    maskInPlace(value);
                }
            }
        } else if (node instanceof ArrayNode array) {
            array.forEach(DeclarationMasker::maskInPlace);
        }
    }
}
