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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an inclusive, 1-based line range of a text file.
 */
@Component
public class ReadFileLinesTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("readFileLines")
            .description("Read a range of lines from a text file (1-based, inclusive).")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("r"))
            .parameter(ToolParameter.required("filepath", String.class, "Path of the file to read"))
            .parameter(ToolParameter.optional("from_line", Integer.class, null,
                    "First line to read; defaults to the beginning of the file"))
            .parameter(ToolParameter.optional("to_line", Integer.class, null,
                    "Last line to read; defaults to the end of the file"))
            .build();

    public ReadFileLinesTool(ToolPilotProperties properties) {
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
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File does not exist: " + path);
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        int totalLines = lines.size();
        int from = arguments.isPresent("from_line") ? arguments.getInteger("from_line") : 1;
        int to = arguments.isPresent("to_line") ? arguments.getInteger("to_line") : Math.max(totalLines, from);

        if (from < 1) {
            throw new IllegalArgumentException("from_line must be >= 1");
        }
        if (to < from) {
            throw new IllegalArgumentException("to_line (" + to + ") must be >= from_line (" + from + ")");
        }
        if (from > totalLines && totalLines > 0) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("filepath", filepath);
            data.put("total_lines", totalLines);
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "from_line " + from + " exceeds file length (" + totalLines + " lines)", data);
        }

        int end = Math.min(to, totalLines);
        List<String> selected = totalLines == 0 ? List.of() : lines.subList(from - 1, end);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", String.join("\n", selected));
        data.put("filepath", filepath);
        data.put("from_line", from);
        data.put("to_line", end);
        data.put("lines_read", selected.size());
        data.put("total_lines", totalLines);
        return ToolResult.success(data);
    }
}
