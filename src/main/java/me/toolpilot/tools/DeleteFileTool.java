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
public class DeleteFileTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("deleteFile")
            .description("Delete a single file. Directories are not deleted; use removeDirectory.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("w"))
            .parameter(ToolParameter.required("filepath", String.class, "Path of the file to delete"))
            .build();

    public DeleteFileTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String filepath = arguments.getString("filepath");
        Path path = resolvePath(filepath);
        if (!Files.exists(path)) {
            return ToolResult.failure("File does not exist: " + path);
        }
        if (Files.isDirectory(path)) {
            return ToolResult.failure("Path is a directory: " + path + " (use removeDirectory)");
        }

        Files.delete(path);
        log.info("[deleteFile] Deleted {}", path);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filepath", filepath);
        data.put("message", "Deleted file: " + path);
        return ToolResult.success(data);
    }
}
