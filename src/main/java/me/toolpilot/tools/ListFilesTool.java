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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists directory entries, optionally recursively and filtered by a glob on
 * the file name (e.g. {@code *.java}).
 */
@Component
public class ListFilesTool extends AbstractFileTool {

    private static final int MAX_ENTRIES = 1000;

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("listFiles")
            .description("List files and directories in a directory.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("r"))
            .parameter(ToolParameter.optional("directory", String.class, ".", "Directory to list"))
            .parameter(ToolParameter.optional("pattern", String.class, null,
                    "Glob applied to entry names, e.g. *.py"))
            .parameter(ToolParameter.optional("recursive", Boolean.class, false, "Descend into subdirectories"))
            .parameter(ToolParameter.optional("max_depth", Integer.class, null,
                    "Maximum depth when recursive (1 = direct children)"))
            .build();

    public ListFilesTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String directory = arguments.getString("directory");
        String pattern = arguments.getString("pattern");
        boolean recursive = arguments.getBoolean("recursive");
        Integer maxDepth = arguments.getInteger("max_depth");
        if (maxDepth != null && maxDepth < 1) {
            throw new IllegalArgumentException("max_depth must be >= 1");
        }

        Path root = resolvePath(directory);
        if (!Files.isDirectory(root)) {
            return ToolResult.failure("Directory does not exist: " + root);
        }

        int depth = recursive ? (maxDepth != null ? maxDepth : Integer.MAX_VALUE) : 1;
        PathMatcher matcher = pattern != null && !pattern.isBlank()
                ? FileSystems.getDefault().getPathMatcher("glob:" + pattern)
                : null;

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root, depth)) {
            paths = walk.filter(p -> !p.equals(root))
                    .filter(p -> matcher == null || matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<Map<String, Object>> entries = new ArrayList<>();
        for (Path path : paths) {
            if (entries.size() >= MAX_ENTRIES) {
                break;
            }
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", root.relativize(path).toString().replace('\\', '/'));
            entry.put("type", attrs.isDirectory() ? "directory" : "file");
            if (!attrs.isDirectory()) {
                entry.put("size", attrs.size());
            }
            entries.add(entry);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("directory", directory);
        data.put("files", entries);
        data.put("total_items", entries.size());
        data.put("truncated", paths.size() > entries.size());
        data.put("pattern", pattern);
        data.put("recursive", recursive);
        return ToolResult.success(data);
    }
}
