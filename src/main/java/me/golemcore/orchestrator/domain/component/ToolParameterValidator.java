package me.golemcore.orchestrator.domain.component;

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

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks tool parameters against a JSON-schema-like contract: required fields
 * must be present and non-null, declared fields must match their JSON type and
 * enum values. Undeclared fields are accepted.
 */
public final class ToolParameterValidator {

    private ToolParameterValidator() {
    }

    @SuppressWarnings("unchecked")
    public static Optional<String> validate(Map<String, Object> schema, Map<String, Object> parameters) {
        if (schema == null) {
            return Optional.empty();
        }
        Map<String, Object> params = parameters != null ? parameters : Map.of();

        Object required = schema.get("required");
        if (required instanceof List<?> requiredFields) {
            for (Object field : requiredFields) {
                if (params.get(String.valueOf(field)) == null) {
                    return Optional.of("Missing required parameter: " + field);
                }
            }
        }

        Object properties = schema.get("properties");
        if (!(properties instanceof Map<?, ?>)) {
            return Optional.empty();
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) properties).entrySet()) {
            Object value = params.get(entry.getKey());
            if (value == null || !(entry.getValue() instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> fieldSchema = (Map<String, Object>) entry.getValue();
            String type = (String) fieldSchema.get("type");
            if (type != null && !matchesType(type, value)) {
                return Optional.of("Invalid parameter '" + entry.getKey() + "': expected " + type
                        + " but got " + describe(value));
            }
            Object allowed = fieldSchema.get("enum");
            if (allowed instanceof List<?> values && !values.contains(value)) {
                return Optional.of("Invalid parameter '" + entry.getKey() + "': must be one of " + values);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "string" -> value instanceof CharSequence;
        case "boolean" -> value instanceof Boolean;
        case "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
        case "number" -> value instanceof Number;
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof Collection<?> || value.getClass().isArray();
        default -> true;
        };
    }

    private static String describe(Object value) {
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
