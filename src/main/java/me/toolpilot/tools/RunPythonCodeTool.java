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
import java.util.Map;

/**
 * Runs a Python snippet with {@code python -c}.
 */
@Component
public class RunPythonCodeTool extends AbstractCodeExecutionTool {

    static final String NAME = "runPythonCode";

    private final ToolDefinition definition;
    private final String defaultPython;

    public RunPythonCodeTool(ProcessExecutionEngine engine, ToolPilotProperties properties) {
        super(engine, properties);
        this.defaultPython = properties.getTools().getPython().getExecutable();
        this.definition = ToolDefinition.builder()
                .name(NAME)
                .description("Execute Python code and return its output.")
                .toolset(TOOLSET)
                .permissions(ToolPermission.parse("x"))
                .parameter(ToolParameter.required("code", String.class, "Python source code to execute"))
                .parameters(commonParameters(properties.getTools().getExec().getDefaultTimeout()))
                .parameter(ToolParameter.optional("python_executable", String.class, null,
                        "Python interpreter to use (default: " + defaultPython + ")"))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    protected String getLanguage() {
        return "Python";
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String code = arguments.getString("code");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be empty");
        }
        return runProcess(arguments, pythonExecutable(arguments, defaultPython), List.of("-c", code),
                Map.of("PYTHONIOENCODING", "utf-8"));
    }

    static String pythonExecutable(ToolArguments arguments, String defaultPython) {
        String requested = arguments.getString("python_executable");
        return requested != null && !requested.isBlank() ? requested.trim() : defaultPython;
    }
}
