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

import me.toolpilot.domain.component.ToolComponent;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry entry: the tool's definition, its handler and the schema built
 * once at registration.
 */
@Value
public class ToolDescriptor {

    ToolDefinition definition;
    ToolComponent handler;
    Map<String, Object> schema;
    /** Names listed under {@code parameters.required} in the schema. */
    List<String> required;

    public String getName() {
        return definition.getName();
    }

    public String getToolset() {
        return definition.getToolset();
    }

    public Set<ToolPermission> getPermissions() {
        return definition.getPermissions();
    }
}
