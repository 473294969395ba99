package me.toolpilot.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Single declared parameter of a tool: name, Java type, description and an
 * optional default value.
 *
 * <p>
 * A parameter without a default is required and appears in the schema's
 * {@code required} list. An optional parameter may default to {@code null},
 * meaning "not provided".
 */
@Value
@Builder
public class ToolParameter {

    String name;
    Class<?> type;
    String description;
    Object defaultValue;
    boolean optional;

    public static ToolParameter required(String name, Class<?> type, String description) {
        return ToolParameter.builder()
                .name(name)
                .type(type)
                .description(description)
                .optional(false)
                .build();
    }

    public static ToolParameter optional(String name, Class<?> type, Object defaultValue, String description) {
        return ToolParameter.builder()
                .name(name)
                .type(type)
                .description(description)
                .defaultValue(defaultValue)
                .optional(true)
                .build();
    }

    public boolean hasDefault() {
        return optional;
    }

    public boolean isRequired() {
        return !optional;
    }
}
