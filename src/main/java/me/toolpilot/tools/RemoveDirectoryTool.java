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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
@Slf4j
public class RemoveDirectoryTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("removeDirectory")
            .description("Remove a directory. A non-empty directory is only removed with recursive=true.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("w"))
            .parameter(ToolParameter.required("directory", String.class, "Path of the directory to remove"))
            .parameter(ToolParameter.optional("recursive", Boolean.class, false,
                    "Remove the directory together with its contents"))
            .build();

    public RemoveDirectoryTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String directory = arguments.getString("directory");
        boolean recursive = arguments.getBoolean("recursive");
        Path path = resolvePath(directory);

        if (!Files.exists(path)) {
            return ToolResult.failure("Directory does not exist: " + path);
        }
        if (!Files.isDirectory(path)) {
            return ToolResult.failure("Path is not a directory: " + path);
        }
        if (path.equals(getWorkspaceRoot()) || path.getParent() == null) {
            return ToolResult.failure("Refusing to remove " + path);
        }

        int removed;
        if (recursive) {
            List<Path> entries;
            try (Stream<Path> walk = Files.walk(path)) {
                entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            }
            for (Path entry : entries) {
                Files.delete(entry);
            }
            removed = entries.size();
        } else {
            try (Stream<Path> children = Files.list(path)) {
                if (children.findAny().isPresent()) {
                    return ToolResult.failure("Directory is not empty: " + path + " (set recursive=true)");
                }
            }
            Files.delete(path);
            removed = 1;
        }
        log.info("[removeDirectory] Removed {} ({} item(s))", path, removed);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("directory", directory);
        data.put("recursive", recursive);
        data.put("items_removed", removed);
        data.put("message", "Removed directory: " + path);
        return ToolResult.success(data);
    }
}
