package me.toolpilot.tools;

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
import me.toolpilot.domain.model.ToolPermission;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class CreateDirectoryTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("createDirectory")
            .description("Create a directory.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("w"))
            .parameter(ToolParameter.required("directory", String.class, "Path of the directory to create"))
            .parameter(ToolParameter.optional("parents", Boolean.class, false,
                    "Create missing parent directories"))
            .parameter(ToolParameter.optional("exist_ok", Boolean.class, false,
                    "Succeed if the directory already exists"))
            .build();

    public CreateDirectoryTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String directory = arguments.getString("directory");
        boolean parents = arguments.getBoolean("parents");
        boolean existOk = arguments.getBoolean("exist_ok");
        Path path = resolvePath(directory);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("directory", directory);
        data.put("parents", parents);
        data.put("exist_ok", existOk);

        if (Files.exists(path)) {
            if (!Files.isDirectory(path)) {
                return ToolResult.failure("Path exists but is not a directory: " + path);
            }
            if (!existOk) {
                return ToolResult.failure("Directory already exists: " + path);
            }
            data.put("created", false);
            data.put("message", "Directory already exists: " + path);
            return ToolResult.success(data);
        }

        Path parent = path.getParent();
        if (!parents && parent != null && !Files.isDirectory(parent)) {
            return ToolResult.failure("Parent directory does not exist: " + parent + " (set parents=true)");
        }
        if (parents) {
            Files.createDirectories(path);
        } else {
            Files.createDirectory(path);
        }
        log.info("[createDirectory] Created {}", path);

        data.put("created", true);
        data.put("message", "Created directory: " + path);
        return ToolResult.success(data);
    }
}
