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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raw argument map bound against a {@link ToolDefinition}: every declared
 * parameter is present (defaults applied), values are coerced to the declared
 * type, unknown names are rejected.
 *
 * <p>
 * All binding errors are reported as {@link IllegalArgumentException}.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static ToolArguments bind(ToolDefinition definition, Map<String, Object> raw) {
        Map<String, Object> source = raw != null ? raw : Map.of();
        for (String name : source.keySet()) {
            if (definition.findParameter(name).isEmpty()) {
                throw new IllegalArgumentException(
                        "Unknown parameter '" + name + "' for tool '" + definition.getName() + "'");
            }
        }

        Map<String, Object> bound = new LinkedHashMap<>();
        for (ToolParameter parameter : definition.getParameters()) {
            Object value = source.get(parameter.getName());
            if (value == null) {
                if (parameter.isRequired()) {
                    throw new IllegalArgumentException("Missing required parameter '" + parameter.getName()
                            + "' for tool '" + definition.getName() + "'");
                }
                bound.put(parameter.getName(), parameter.getDefaultValue());
            } else {
                bound.put(parameter.getName(), coerce(parameter, value));
            }
        }
        return new ToolArguments(Collections.unmodifiableMap(bound));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean isPresent(String name) {
        return values.get(name) != null;
    }

    public String getString(String name) {
        return (String) values.get(name);
    }

    public Integer getInteger(String name) {
        return (Integer) values.get(name);
    }

    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(values.get(name));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    static Object coerce(ToolParameter parameter, Object value) {
        Class<?> type = parameter.getType();
        String name = parameter.getName();
        if (type == null || type == Object.class || type.isInstance(value)) {
            return value;
        }
        if (type == String.class) {
            if (value instanceof Map || value instanceof Collection) {
                throw new IllegalArgumentException("Parameter '" + name + "' must be a string");
            }
            return String.valueOf(value);
        }
        if (type == Integer.class || type == int.class) {
            long number = toLong(name, value);
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Parameter '" + name + "' is out of range: " + value);
            }
            return (int) number;
        }
        if (type == Long.class || type == long.class) {
            return toLong(name, value);
        }
        if (type == Double.class || type == double.class) {
            return toDecimal(name, value).doubleValue();
        }
        if (type == Boolean.class || type == boolean.class) {
            return toBoolean(name, value);
        }
        throw new IllegalArgumentException(
                "Parameter '" + name + "' has unsupported type " + type.getSimpleName());
    }

    private static long toLong(String name, Object value) {
        BigDecimal decimal = toDecimal(name, value);
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be an integer, got: " + value, e);
        }
    }

    private static BigDecimal toDecimal(String name, Object value) {
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' must be a number, got: " + value, e);
            }
        }
        throw new IllegalArgumentException("Parameter '" + name + "' must be a number, got: " + value);
    }

    private static boolean toBoolean(String name, Object value) {
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return true;
            }
            if ("false".equals(normalized)) {
                return false;
            }
        }
        throw new IllegalArgumentException("Parameter '" + name + "' must be a boolean, got: " + value);
    }
}
