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
import lombok.Singular;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static declaration of a tool: unique name, summary text, owning toolset,
 * permission flags and the ordered parameter list. Each tool supplies one
 * instance; the registry derives the schema from it.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    String toolset;
    @Builder.Default
    Set<ToolPermission> permissions = EnumSet.noneOf(ToolPermission.class);
    @Singular
    List<ToolParameter> parameters;

    public String getPermissionFlags() {
        return ToolPermission.format(permissions);
    }

    public Optional<ToolParameter> findParameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.getName().equals(parameterName))
                .findFirst();
    }
}
