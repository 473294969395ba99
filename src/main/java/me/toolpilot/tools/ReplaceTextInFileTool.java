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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces exact text in a file. Without {@code replace_all} the text must
 * occur exactly once.
 */
@Component
@Slf4j
public class ReplaceTextInFileTool extends AbstractFileTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("replaceTextInFile")
            .description("Replace exact text in a file. Unless replace_all is set, "
                    + "the text must occur exactly once.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("rw"))
            .parameter(ToolParameter.required("filepath", String.class, "Path of the file to modify"))
            .parameter(ToolParameter.required("old_str", String.class, "Exact text to search for"))
            .parameter(ToolParameter.required("new_str", String.class, "Replacement text"))
            .parameter(ToolParameter.optional("replace_all", Boolean.class, false,
                    "Replace every occurrence instead of requiring a unique match"))
            .build();

    public ReplaceTextInFileTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String filepath = arguments.getString("filepath");
        String oldStr = arguments.getString("old_str");
        String newStr = arguments.getString("new_str");
        boolean replaceAll = arguments.getBoolean("replace_all");
        if (oldStr.isEmpty()) {
            throw new IllegalArgumentException("old_str must not be empty");
        }

        Path path = resolvePath(filepath);
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File does not exist: " + path);
        }

        String content = Files.readString(path, StandardCharsets.UTF_8);
        int occurrences = countOccurrences(content, oldStr);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("filepath", filepath);
        data.put("occurrences", occurrences);

        if (occurrences == 0) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Text not found in " + filepath, data);
        }
        if (occurrences > 1 && !replaceAll) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Found " + occurrences + " occurrences in " + filepath
                            + "; provide more context or set replace_all=true",
                    data);
        }

        Files.writeString(path, content.replace(oldStr, newStr), StandardCharsets.UTF_8);
        log.info("[replaceTextInFile] Replaced {} occurrence(s) in {}", occurrences, path);
        data.put("replacements", occurrences);
        return ToolResult.success(data);
    }

    static int countOccurrences(String content, String text) {
        int count = 0;
        int index = content.indexOf(text);
        while (index >= 0) {
            count++;
            index = content.indexOf(text, index + text.length());
        }
        return count;
    }
}
