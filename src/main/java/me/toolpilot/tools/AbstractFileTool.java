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

import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.infrastructure.config.ToolPilotProperties;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for the {@code files} toolset. Relative paths are resolved against
 * {@code toolpilot.tools.workspace}; absolute paths are used as given.
 */
public abstract class AbstractFileTool extends AbstractTool {

    protected static final String TOOLSET = "files";
    protected static final long MAX_FILE_SIZE = 10L * 1024 * 1024;

    private final Path workspaceRoot;

    protected AbstractFileTool(ToolPilotProperties properties) {
        this.workspaceRoot = Paths.get(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
    }

    protected Path resolvePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        try {
            return workspaceRoot.resolve(path.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + path, e);
        }
    }

    /**
     * Reads one UTF-8 text file, the whole file or its first {@code maxLines}
     * lines. Missing files, directories and oversized files are failures;
     * decoding and I/O errors are thrown.
     */
    protected ToolResult readTextFile(String filepath, Integer maxLines) throws IOException {
        Path path = resolvePath(filepath);
        if (!Files.exists(path)) {
            return ToolResult.failure("File does not exist: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Path is not a file: " + path);
        }

        String content;
        int linesRead;
        if (maxLines != null) {
            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                while (lines.size() < maxLines && (line = reader.readLine()) != null) {
                    lines.add(line);
                }
            }
            content = String.join("\n", lines);
            linesRead = lines.size();
        } else {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                return ToolResult.failure("File too large (" + size + " bytes, max " + MAX_FILE_SIZE
                        + "); use max_lines or readFileLines");
            }
            content = Files.readString(path, StandardCharsets.UTF_8);
            linesRead = (int) content.lines().count();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", content);
        data.put("filepath", filepath);
        data.put("lines_read", linesRead);
        data.put("max_lines", maxLines);
        return ToolResult.success(data);
    }

    protected Path getWorkspaceRoot() {
        return workspaceRoot;
    }
}
