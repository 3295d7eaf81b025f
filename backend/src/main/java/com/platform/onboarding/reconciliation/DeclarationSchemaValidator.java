package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.error.ErrorCode;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.PropertyDescriptor;
import com.platform.onboarding.schema.SchemaMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validation of a declaration against the {@link SchemaMap}.
 *
 * Legacy property ids are accepted; translation renames them.
 */
@Slf4j
public class DeclarationSchemaValidator implements SchemaValidator {

    private static final Set<String> ROOT_FIELDS =
        Set.of("schemaVersion", "class", "async", "label", "Common", "Credentials", "controls", "result");
    private static final Set<String> OBJECT_META_FIELDS = Set.of("class", "label");
    private static final String BASE64_FIELD = "base64";
    private static final Pattern OBJECT_NAME = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.:-]{0,254}$");

    private final SchemaMap schema;
    private final Set<String> supportedVersions;

    public DeclarationSchemaValidator(SchemaMap schema, List<String> supportedVersions) {
        this.schema = schema;
        this.supportedVersions = Set.copyOf(supportedVersions);
    }

    @Override
    public void validate(JsonNode declaration) {
        if (declaration == null || !declaration.isObject()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, List.of("declaration must be a JSON object"));
        }

        JsonNode version = declaration.path("schemaVersion");
        if (!version.isTextual() || !supportedVersions.contains(version.asText())) {
            throw new ValidationException(ErrorCode.UNSUPPORTED_SCHEMA_VERSION,
                List.of("schemaVersion '" + version.asText() + "' is not supported"));
        }

        List<String> problems = new ArrayList<>();

        declaration.fieldNames().forEachRemaining(field -> {
            if (!ROOT_FIELDS.contains(field)) {
                problems.add("unknown property '" + field + "'");
            }
        });
        expectText(declaration, "class", "Device", "", problems);
        if (declaration.has("async") && !declaration.get("async").isBoolean()) {
            problems.add("async must be a boolean");
        }
        JsonNode controls = declaration.path("controls");
        if (!controls.isMissingNode() && !controls.isObject()) {
            problems.add("controls must be an object");
        }

        JsonNode common = declaration.get(Declaration.COMMON);
        if (common == null || !common.isObject()) {
            problems.add("Common must be an object");
        } else {
            expectText(common, "class", "Tenant", "Common", problems);
            validateCommon(common, problems);
        }

        if (!problems.isEmpty()) {
            log.debug("Declaration rejected with {} problem(s)", problems.size());
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, problems);
        }
    }

    private void validateCommon(JsonNode common, List<String> problems) {
        Iterator<Map.Entry<String, JsonNode>> entries = common.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            JsonNode value = entry.getValue();
            if ("class".equals(name) || "label".equals(name)) {
                continue;
            }
            if ("hostname".equals(name)) {
                if (!value.isTextual()) {
                    problems.add("Common.hostname must be a string");
                }
                continue;
            }
            if (!value.isObject() || !value.path("class").isTextual()) {
                problems.add("Common." + name + " must be an object with a class");
                continue;
            }
            String declaredClass = value.get("class").asText();
            Optional<ConfigItem> item = schema.find(declaredClass);
            if (item.isEmpty()) {
                problems.add("Common." + name + ": unknown class '" + declaredClass + "'");
                continue;
            }
            if (!item.get().isNameless() && !OBJECT_NAME.matcher(name).matches()) {
                problems.add("Common." + name + ": invalid object name");
            }
            validateObject(item.get(), "Common." + name, value, problems);
        }
    }

    private void validateObject(ConfigItem item, String location, JsonNode object, List<String> problems) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (OBJECT_META_FIELDS.contains(field.getKey())) {
                continue;
            }
            Optional<PropertyDescriptor> descriptor = findDescriptor(item, field.getKey());
            if (descriptor.isEmpty()) {
                problems.add(location + ": unknown property '" + field.getKey() + "'");
            } else if (!field.getValue().isNull() && !acceptsValue(descriptor.get(), field.getValue())) {
                problems.add(location + "." + field.getKey() + ": expected " + describe(descriptor.get()));
            } else {
                validateBase64(location + "." + field.getKey(), field.getValue(), problems);
            }
        }

        if (item.discriminator() != null) {
            JsonNode variant = object.path(item.discriminator());
            if (!variant.isTextual() || !item.variants().contains(variant.asText())) {
                problems.add(location + "." + item.discriminator() + ": must be one of " + item.variants());
            }
        }
    }

    /**
     * Certificate and key content must decode before anything is sent.
     */
    static void validateBase64(String location, JsonNode value, List<String> problems) {
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String fieldLocation = location + "." + field.getKey();
                if (BASE64_FIELD.equals(field.getKey())) {
                    if (!isDecodable(field.getValue())) {
                        problems.add(fieldLocation + ": invalid base64");
                    }
                } else {
                    validateBase64(fieldLocation, field.getValue(), problems);
                }
            }
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                validateBase64(location + "[" + i + "]", value.get(i), problems);
            }
        }
    }

    private static boolean isDecodable(JsonNode value) {
        if (!value.isTextual()) {
            return false;
        }
        try {
            return Base64.getMimeDecoder().decode(value.asText()).length > 0;
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting base64 value: {}", e.getMessage());
            return false;
        }
    }

    private static Optional<PropertyDescriptor> findDescriptor(ConfigItem item, String key) {
        return item.properties().stream()
            .filter(p -> p.id().equals(key) || key.equals(p.legacyId()))
            .findFirst();
    }

    static boolean acceptsValue(PropertyDescriptor descriptor, JsonNode value) {
        return switch (descriptor.type()) {
            case STRING -> value.isTextual() || value.isNumber();
            case INTEGER -> value.isIntegralNumber() || value.isTextual() && value.asText().matches("-?\\d+");
            case BOOLEAN -> value.isBoolean();
            case ENABLED_DISABLED, INVERTED_ENABLED_DISABLED, TRUE_FALSE_STRING, YES_NO ->
                value.isBoolean() || value.isTextual();
            case REFERENCE -> value.isTextual();
            case REFERENCE_LIST -> value.isArray() && allText(value);
            case LIST -> value.isArray() || value.isTextual();
            case OBJECT -> value.isObject();
        };
    }

    private static boolean allText(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                return false;
            }
        }
        return true;
    }

    private static String describe(PropertyDescriptor descriptor) {
        return switch (descriptor.type()) {
            case STRING, REFERENCE -> "a string";
            case INTEGER -> "an integer";
            case BOOLEAN -> "a boolean";
            case ENABLED_DISABLED, INVERTED_ENABLED_DISABLED, TRUE_FALSE_STRING, YES_NO -> "a boolean or string";
            case REFERENCE_LIST -> "an array of names";
            case LIST -> "an array";
            case OBJECT -> "an object";
        };
    }

    private static void expectText(JsonNode node, String field, String expected, String location, List<String> problems) {
        JsonNode value = node.get(field);
        if (value != null && !expected.equals(value.asText())) {
            String prefix = location.isEmpty() ? "" : location + ".";
            problems.add(prefix + field + " must be '" + expected + "'");
        }
    }
}
