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

import me.toolpilot.domain.model.ToolDescriptor;
import me.toolpilot.domain.model.ToolPermission;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a registered tool may run, based on the permission flags
 * allowed by {@code toolpilot.security.allowed-permissions}.
 */
@Component
@Slf4j
public class ToolPermissionPolicy {

    private final Set<ToolPermission> allowed;

    public ToolPermissionPolicy(ToolPilotProperties properties) {
        this(ToolPermission.parse(properties.getSecurity().getAllowedPermissions()));
    }

    public ToolPermissionPolicy(Set<ToolPermission> allowed) {
        this.allowed = allowed.isEmpty() ? EnumSet.noneOf(ToolPermission.class) : EnumSet.copyOf(allowed);
        log.debug("[Policy] Allowed tool permissions: {}", ToolPermission.format(this.allowed));
    }

    public boolean isAllowed(ToolDescriptor descriptor) {
        return allowed.containsAll(descriptor.getPermissions());
    }

    public String describeDenial(ToolDescriptor descriptor) {
        Set<ToolPermission> missing = EnumSet.noneOf(ToolPermission.class);
        missing.addAll(descriptor.getPermissions());
        missing.removeAll(allowed);
        return "Tool '" + descriptor.getName() + "' requires permissions [" + ToolPermission.format(missing)
                + "] which are not allowed (allowed: [" + ToolPermission.format(allowed) + "])";
    }
}
