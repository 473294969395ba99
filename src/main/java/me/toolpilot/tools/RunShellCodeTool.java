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
import me.toolpilot.domain.process.ProcessExecutionEngine;
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a shell snippet: {@code /bin/sh -c} on POSIX hosts, PowerShell on
 * Windows.
 */
@Component
public class RunShellCodeTool extends AbstractCodeExecutionTool {

    private static final boolean WINDOWS = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT).startsWith("windows");

    private final ToolDefinition definition;

    public RunShellCodeTool(ProcessExecutionEngine engine, ToolPilotProperties properties) {
        super(engine, properties);
        this.definition = ToolDefinition.builder()
                .name("runShellCode")
                .description("Execute a shell script (sh on Unix, PowerShell on Windows) and return its output.")
                .toolset(TOOLSET)
                .permissions(ToolPermission.parse("x"))
                .parameter(ToolParameter.required("code", String.class, "Shell commands to execute"))
                .parameters(commonParameters(properties.getTools().getExec().getDefaultTimeout()))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    protected String getLanguage() {
        return "Shell";
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String code = arguments.getString("code");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be empty");
        }
        if (WINDOWS) {
            return runProcess(arguments, "powershell",
                    List.of("-NoProfile", "-NonInteractive", "-Command", code), Map.of());
        }
        return runProcess(arguments, "/bin/sh", List.of("-c", code), Map.of());
    }
}
