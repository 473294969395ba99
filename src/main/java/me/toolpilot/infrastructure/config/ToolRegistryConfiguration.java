package me.toolpilot.infrastructure.config;

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
import me.toolpilot.domain.service.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the process-wide {@link ToolRegistry} from the {@link ToolComponent}
 * beans of the toolsets listed in {@code toolpilot.tools.autoload}.
 *
 * <p>
 * A duplicate tool name fails application startup with a
 * {@link me.toolpilot.domain.exception.ToolRegistrationException}.
 */
@Configuration
@Slf4j
public class ToolRegistryConfiguration {

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools, ToolPilotProperties properties) {
        List<String> toolsets = properties.getTools().getAutoload();
        ToolRegistry registry = ToolRegistry.discover(toolsets, tools);
        log.info("[Tools] Loaded {} tool(s) from toolsets {}: {}", registry.size(), toolsets,
                registry.getToolNames());
        return registry;
    }
}
