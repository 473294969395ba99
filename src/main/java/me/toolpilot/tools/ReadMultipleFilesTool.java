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
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolParameter;
import me.toolpilot.domain.model.ToolPermission;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads several text files in one call.
 *
 * <p>
 * Each entry of {@code files} is the per-file result of {@code readFile} plus
 * its own {@code success} flag and {@code error}. The call succeeds when at
 * least one file could be read.
 */
@Component
@Slf4j
public class ReadMultipleFilesTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("readMultipleFiles")
            .description("Read the contents of several text files.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("r"))
            .parameter(ToolParameter.required("filepaths", String.class,
                    "Comma-separated list of file paths to read"))
            .parameter(ToolParameter.optional("max_lines", Integer.class, null,
                    "Maximum number of lines to read per file"))
            .build();

    public ReadMultipleFilesTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        Integer maxLines = arguments.getInteger("max_lines");
        if (maxLines != null && maxLines < 0) {
            throw new IllegalArgumentException("max_lines must not be negative");
        }
        List<String> filepaths = new ArrayList<>();
        for (String token : arguments.getString("filepaths").split(",")) {
            if (!token.isBlank()) {
                filepaths.add(token.trim());
            }
        }
        if (filepaths.isEmpty()) {
            throw new IllegalArgumentException("No file paths provided");
        }

        List<Map<String, Object>> files = new ArrayList<>();
        int successful = 0;
        for (String filepath : filepaths) {
            Map<String, Object> entry = readEntry(filepath, maxLines);
            if (Boolean.TRUE.equals(entry.get("success"))) {
                successful++;
            }
            files.add(entry);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("files", files);
        data.put("total_files", filepaths.size());
        data.put("successful_files", successful);
        data.put("max_lines", maxLines);
        log.info("[readMultipleFiles] Read {}/{} file(s)", successful, filepaths.size());
        if (successful == 0) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Failed to read any of the " + filepaths.size() + " files", data);
        }
        return ToolResult.success(data);
    }

    private Map<String, Object> readEntry(String filepath, Integer maxLines) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("filepath", filepath);
        try {
            ToolResult result = readTextFile(filepath, maxLines);
            entry.put("success", result.isSuccess());
            if (result.isSuccess()) {
                entry.putAll(result.getData());
            } else {
                entry.put("error", result.getError());
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[readMultipleFiles] Failed to read {}: {}", filepath, e.getMessage());
            entry.put("success", false);
            entry.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return entry;
    }
}
