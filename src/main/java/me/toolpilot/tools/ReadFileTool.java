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

/**
 * Reads a UTF-8 text file, optionally only its first lines.
 */
@Component
@Slf4j
public class ReadFileTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("readFile")
            .description("Read the contents of a text file.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("r"))
            .parameter(ToolParameter.required("filepath", String.class, "Path of the file to read"))
            .parameter(ToolParameter.optional("max_lines", Integer.class, null,
                    "Maximum number of lines to read (for large files)"))
            .build();

    public ReadFileTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String filepath = arguments.getString("filepath");
        Integer maxLines = arguments.getInteger("max_lines");
        if (maxLines != null && maxLines < 0) {
            throw new IllegalArgumentException("max_lines must not be negative");
        }
        ToolResult result = readTextFile(filepath, maxLines);
        if (result.isSuccess()) {
            log.info("[readFile] Read {} line(s) from {}", result.getData().get("lines_read"), filepath);
        }
        return result;
    }
}
