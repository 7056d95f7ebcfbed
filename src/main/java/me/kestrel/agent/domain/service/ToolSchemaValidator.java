package me.kestrel.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validates tool arguments against the JSON Schema subset used by tool
 * definitions: {@code type}, {@code required}, {@code enum},
 * {@code minimum}/{@code maximum}, {@code minLength}/{@code maxLength}, nested
 * object {@code properties} and array {@code items}.
 *
 * <p>
 * All violations are collected rather than stopping at the first one, so the
 * LLM can fix every problem in a single retry. Unknown arguments are ignored.
 */
public final class ToolSchemaValidator {

    private static final String KEY_TYPE = "type";
    private static final String KEY_PROPERTIES = "properties";
    private static final String TYPE_OBJECT = "object";
    private static final String ROOT_LABEL = "parameter";

    private ToolSchemaValidator() {
    }

    /**
     * Validates the arguments of a tool call.
     *
     * @param schema
     *            the tool's input schema, may be null (accepts anything)
     * @param arguments
     *            the arguments to check, null is treated as an empty map
     * @return the list of violations, empty when the arguments are valid
     */
    public static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        if (schema == null || schema.isEmpty()) {
            return List.of();
        }
        Object declaredType = schema.getOrDefault(KEY_TYPE, TYPE_OBJECT);
        if (!TYPE_OBJECT.equals(declaredType)) {
            throw new IllegalArgumentException("Tool parameter schema must be of type object, got " + declaredType);
        }
        List<String> errors = new ArrayList<>();
        validateValue(arguments != null ? arguments : Map.of(), schema, "", errors);
        return errors;
    }

    @SuppressWarnings("unchecked")
    private static void validateValue(Object value, Map<String, Object> schema, String path, List<String> errors) {
        String type = (String) schema.get(KEY_TYPE);
        String label = path.isEmpty() ? ROOT_LABEL : path;

        if (type != null && !matchesType(value, type)) {
            errors.add(label + " should be " + type);
            return;
        }

        Object enumValues = schema.get("enum");
        if (enumValues instanceof Collection<?> allowed && !allowed.contains(value)) {
            errors.add(label + " must be one of " + allowed);
        }

        if (value instanceof Number number) {
            Object minimum = schema.get("minimum");
            if (minimum instanceof Number min && compare(number, min) < 0) {
                errors.add(label + " must be >= " + min);
            }
            Object maximum = schema.get("maximum");
            if (maximum instanceof Number max && compare(number, max) > 0) {
                errors.add(label + " must be <= " + max);
            }
        }

        if (value instanceof String text) {
            Object minLength = schema.get("minLength");
            if (minLength instanceof Number min && text.length() < min.intValue()) {
                errors.add(label + " must be at least " + min + " chars");
            }
            Object maxLength = schema.get("maxLength");
            if (maxLength instanceof Number max && text.length() > max.intValue()) {
                errors.add(label + " must be at most " + max + " chars");
            }
        }

        if (value instanceof Map<?, ?> object) {
            Map<String, Object> properties = (Map<String, Object>) schema.getOrDefault(KEY_PROPERTIES, Map.of());
            Object required = schema.get("required");
            if (required instanceof Collection<?> requiredKeys) {
                for (Object key : requiredKeys) {
                    if (!object.containsKey(key)) {
                        errors.add("missing required " + child(path, String.valueOf(key)));
                    }
                }
            }
            for (Map.Entry<?, ?> entry : object.entrySet()) {
                Object propertySchema = properties.get(String.valueOf(entry.getKey()));
                if (propertySchema instanceof Map<?, ?> nested) {
                    validateValue(entry.getValue(), (Map<String, Object>) nested,
                            child(path, String.valueOf(entry.getKey())), errors);
                }
            }
        }

        if (value instanceof List<?> items && schema.get("items") instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < items.size(); i++) {
                String itemPath = path.isEmpty() ? "[" + i + "]" : path + "[" + i + "]";
                validateValue(items.get(i), (Map<String, Object>) itemSchema, itemPath, errors);
            }
        }
    }

    private static boolean matchesType(Object value, String type) {
        return switch (type) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger;
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case TYPE_OBJECT -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private static int compare(Number left, Number right) {
        return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
