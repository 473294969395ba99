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
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Predicate;

@Component
public class SearchTextTool extends AbstractSearchTool {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("searchText")
            .description("Search files for lines containing an exact text.")
            .toolset(TOOLSET)
            .permissions(ToolPermission.parse("r"))
            .parameter(ToolParameter.required("paths", String.class,
                    "Space-separated files or directories to search"))
            .parameter(ToolParameter.required("query", String.class, "Exact text to search for"))
            .parameter(ToolParameter.optional("case_sensitive", Boolean.class, true, "Match case exactly"))
            .parameter(ToolParameter.optional("max_results", Integer.class, 100,
                    "Maximum number of matching lines to return"))
            .parameter(ToolParameter.optional("count_only", Boolean.class, false,
                    "Return per-file match counts instead of lines"))
            .build();

    public SearchTextTool(ToolPilotProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected Predicate<String> lineMatcher(ToolArguments arguments) {
        String query = arguments.getString("query");
        if (query.isEmpty()) {
            throw new IllegalArgumentException("query must not be empty");
        }
        if (arguments.getBoolean("case_sensitive")) {
            return line -> line.contains(query);
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return line -> line.toLowerCase(Locale.ROOT).contains(needle);
    }
}
