package com.plm.plugin.validation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a plugin's config payload against the schema the plugin declares
 * through {@link com.plm.plugin.Plugin#configSchema()}.
 *
 * <p>
 * Supports the subset of JSON Schema plugins actually use: {@code type:
 * object}, {@code required}, {@code additionalProperties: false} and a
 * scalar {@code type} per property.
 * </p>
 */
public final class PluginSchemaValidator {

    private PluginSchemaValidator() {
    }

    public sealed interface ValidationResult {
        record Ok() implements ValidationResult {
        }

        record Fail(List<String> errors) implements ValidationResult {
        }
    }

    /**
     * Validate {@code value} against {@code schema}. An empty schema accepts
     * anything.
     */
    @SuppressWarnings("unchecked")
    public static ValidationResult validate(Map<String, Object> schema, Object value) {
        if (schema == null || schema.isEmpty()) {
            return new ValidationResult.Ok();
        }

        String type = schema.get("type") instanceof String s ? s : null;
        if (!"object".equals(type)) {
            return new ValidationResult.Ok();
        }

        List<String> errors = new ArrayList<>();
        if (!(value instanceof Map)) {
            errors.add("<root>: expected object");
            return new ValidationResult.Fail(errors);
        }

        Map<String, Object> valueMap = (Map<String, Object>) value;
        Map<String, Object> properties = schema.get("properties") instanceof Map
                ? (Map<String, Object>) schema.get("properties")
                : Map.of();

        if (schema.get("required") instanceof List<?> required) {
            for (Object r : required) {
                if (r instanceof String key && !valueMap.containsKey(key)) {
                    errors.add(key + ": required");
                }
            }
        }

        if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
            for (String key : valueMap.keySet()) {
                if (!properties.containsKey(key)) {
                    errors.add(key + ": unexpected property");
                }
            }
        }

        for (Map.Entry<String, Object> property : properties.entrySet()) {
            Object actual = valueMap.get(property.getKey());
            if (actual == null || !(property.getValue() instanceof Map<?, ?> propertySchema)) {
                continue;
            }
            if (propertySchema.get("type") instanceof String expected && !matchesType(expected, actual)) {
                errors.add(property.getKey() + ": expected " + expected);
            }
        }

        return errors.isEmpty() ? new ValidationResult.Ok() : new ValidationResult.Fail(errors);
    }

    static boolean matchesType(String expected, Object actual) {
        return switch (expected) {
            case "string" -> actual instanceof String;
            case "boolean" -> actual instanceof Boolean;
            case "integer" -> actual instanceof Integer || actual instanceof Long
                    || actual instanceof BigInteger;
            case "number" -> actual instanceof Number;
            case "object" -> actual instanceof Map;
            case "array" -> actual instanceof List;
            default -> true;
        };
    }
}
