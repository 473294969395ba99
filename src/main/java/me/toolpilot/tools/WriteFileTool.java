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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes text to a file, creating missing parent directories.
 */
@Component
@Slf4j
public class WriteFileTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("writeFile")
            .description("Create or overwrite a text file with the given content.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("w"))
            .parameter(ToolParameter.required("filepath", String.class, "Path of the file to write"))
            .parameter(ToolParameter.required("content", String.class, "Text to write"))
            .parameter(ToolParameter.optional("overwrite", Boolean.class, true,
                    "Replace the file if it already exists"))
            .build();

    public WriteFileTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String filepath = arguments.getString("filepath");
        String content = arguments.getString("content");
        boolean overwrite = arguments.getBoolean("overwrite");
        Path path = resolvePath(filepath);

        if (Files.isDirectory(path)) {
            return ToolResult.failure("Path is a directory: " + path);
        }
        if (Files.exists(path) && !overwrite) {
            return ToolResult.failure("File already exists: " + path + " (set overwrite=true to replace it)");
        }

        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Files.write(path, bytes);
        log.info("[writeFile] Wrote {} bytes to {}", bytes.length, path);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filepath", filepath);
        data.put("bytes_written", bytes.length);
        data.put("lines_written", content.isEmpty() ? 0 : content.lines().count());
        data.put("overwrite", overwrite);
        return ToolResult.success(data);
    }
}
