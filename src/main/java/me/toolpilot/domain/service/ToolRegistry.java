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

import me.toolpilot.domain.component.ToolComponent;
import me.toolpilot.domain.exception.ToolNotFoundException;
import me.toolpilot.domain.exception.ToolRegistrationException;
import me.toolpilot.domain.model.ToolDefinition;
import me.toolpilot.domain.model.ToolDescriptor;
import me.toolpilot.domain.model.ToolParameter;
import me.toolpilot.domain.model.ToolPermission;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name to {@link ToolDescriptor} mapping.
 *
 * <p>
 * Built once at startup through {@link Builder} or {@link #discover} and
 * read-only afterwards, so lookups need no locking. Iteration order is
 * registration order, which keeps {@link #listSchemas()} stable within a run.
 *
 * <p>
 * Permission flags are carried as metadata only. The registry never decides
 * whether a tool may run.
 */
@Slf4j
public final class ToolRegistry {

    private final Map<String, ToolDescriptor> descriptors;
    private final List<Map<String, Object>> schemas;

    private ToolRegistry(Map<String, ToolDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        List<Map<String, Object>> built = new ArrayList<>(descriptors.size());
        for (ToolDescriptor descriptor : descriptors.values()) {
            built.add(descriptor.getSchema());
        }
        this.schemas = Collections.unmodifiableList(built);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(Map.of());
    }

    /**
     * Registers the enabled tools of the given toolsets. Toolsets are visited in
     * the given order and tools within a toolset are sorted by name. Tools that
     * are disabled or belong to other toolsets are skipped.
     *
     * @throws ToolRegistrationException
     *             if two tools share a name
     */
    public static ToolRegistry discover(List<String> toolsets, Collection<? extends ToolComponent> candidates) {
        Builder builder = builder();
        for (String toolset : toolsets) {
            String wanted = toolset.trim();
            if (wanted.isEmpty()) {
                continue;
            }
            List<ToolComponent> members = new ArrayList<>();
            for (ToolComponent candidate : candidates) {
                if (wanted.equals(candidate.getDefinition().getToolset())) {
                    members.add(candidate);
                }
            }
            if (members.isEmpty()) {
                log.warn("[Tools] Toolset '{}' has no tools, skipping", wanted);
                continue;
            }
            members.sort(Comparator.comparing(ToolComponent::getToolName));
            for (ToolComponent tool : members) {
                if (!tool.isEnabled()) {
                    log.debug("[Tools] Skipping disabled tool: {}", tool.getToolName());
                    continue;
                }
                builder.register(tool);
            }
        }
        return builder.build();
    }

    /**
     * @throws ToolNotFoundException
     *             if no tool with that name is registered
     */
    public ToolDescriptor resolve(String name) {
        ToolDescriptor descriptor = name != null ? descriptors.get(name) : null;
        if (descriptor == null) {
            throw new ToolNotFoundException(name, getToolNames());
        }
        return descriptor;
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(name != null ? descriptors.get(name) : null);
    }

    public List<Map<String, Object>> listSchemas() {
        return schemas;
    }

    public Map<String, Object> buildSchema(ToolDescriptor descriptor) {
        return ToolSchemaBuilder.build(descriptor.getDefinition());
    }

    public Set<ToolPermission> getPermissions(String name) {
        return resolve(name).getPermissions();
    }

    public List<String> getToolNames() {
        return List.copyOf(descriptors.keySet());
    }

    public List<ToolDescriptor> getDescriptors() {
        return List.copyOf(descriptors.values());
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    public static final class Builder {

        private final Map<String, ToolDescriptor> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ToolComponent tool) {
            ToolDefinition definition = tool.getDefinition();
            if (definition == null || definition.getName() == null || definition.getName().isBlank()) {
                throw new ToolRegistrationException(
                        "Tool " + tool.getClass().getSimpleName() + " declares no name");
            }
            String name = definition.getName();
            ToolDescriptor existing = entries.get(name);
            if (existing != null) {
                throw new ToolRegistrationException("Duplicate tool name '" + name + "' declared by "
                        + existing.getHandler().getClass().getSimpleName() + " and "
                        + tool.getClass().getSimpleName());
            }
            Set<String> parameterNames = new HashSet<>();
            for (ToolParameter parameter : definition.getParameters()) {
                if (!parameterNames.add(parameter.getName())) {
                    throw new ToolRegistrationException(
                            "Tool '" + name + "' declares parameter '" + parameter.getName() + "' twice");
                }
            }

            entries.put(name, new ToolDescriptor(definition, tool, ToolSchemaBuilder.build(definition),
                    ToolSchemaBuilder.requiredNames(definition)));
            log.debug("[Tools] Registered {} [{}] from toolset '{}'",
                    name, definition.getPermissionFlags(), definition.getToolset());
            return this;
        }

        public Builder registerAll(Collection<? extends ToolComponent> tools) {
            tools.forEach(this::register);
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(entries);
        }
    }
}
