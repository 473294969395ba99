package me.toolpilot.domain.service;

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

import me.toolpilot.domain.model.ToolDefinition;
import me.toolpilot.domain.model.ToolParameter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the function schema a model sees for a tool:
 *
 * <pre>{@code
 * {name, description, parameters: {type: "object", properties, required}}
 * }</pre>
 *
 * <p>
 * Property types are derived from the declared Java type of each parameter;
 * anything that is not numeric or boolean is advertised as a string.
 */
public final class ToolSchemaBuilder {

    private static final Set<Class<?>> INTEGER_TYPES = Set.of(
            Integer.class, int.class, Long.class, long.class,
            Short.class, short.class, Byte.class, byte.class);
    private static final Set<Class<?>> NUMBER_TYPES = Set.of(
            Double.class, double.class, Float.class, float.class, BigDecimal.class);

    private ToolSchemaBuilder() {
    }

    public static Map<String, Object> build(ToolDefinition definition) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : definition.getParameters()) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", jsonType(parameter.getType()));
            if (parameter.getDescription() != null && !parameter.getDescription().isBlank()) {
                property.put("description", parameter.getDescription());
            }
            properties.put(parameter.getName(), Collections.unmodifiableMap(property));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", Collections.unmodifiableMap(properties));
        parameters.put("required", requiredNames(definition));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", definition.getName());
        schema.put("description", definition.getDescription() != null ? definition.getDescription() : "");
        schema.put("parameters", Collections.unmodifiableMap(parameters));
        return Collections.unmodifiableMap(schema);
    }

    /**
     * Names of the parameters without a default, in declaration order.
     */
    public static List<String> requiredNames(ToolDefinition definition) {
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : definition.getParameters()) {
            if (parameter.isRequired()) {
                required.add(parameter.getName());
            }
        }
        return Collections.unmodifiableList(required);
    }

    public static String jsonType(Class<?> type) {
        if (type == null) {
            return "string";
        }
        if (INTEGER_TYPES.contains(type)) {
            return "integer";
        }
        if (NUMBER_TYPES.contains(type)) {
            return "number";
        }
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        return "string";
    }
}
