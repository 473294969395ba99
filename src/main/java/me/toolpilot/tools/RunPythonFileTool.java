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

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Python script from the workspace.
 *
 * <p>
 * {@code additional_args} is split on whitespace and commas and appended after
 * the script path.
 */
@Component
public class RunPythonFileTool extends AbstractCodeExecutionTool {

    private final ToolDefinition definition;
    private final String defaultPython;

    public RunPythonFileTool(ProcessExecutionEngine engine, ToolPilotProperties properties) {
        super(engine, properties);
        this.defaultPython = properties.getTools().getPython().getExecutable();
        this.definition = ToolDefinition.builder()
                .name("runPythonFile")
                .description("Execute a Python script file and return its output.")
                .toolset(TOOLSET)
                .permissions(ToolPermission.parse("x"))
                .parameter(ToolParameter.required("file_path", String.class, "Path of the script to run"))
                .parameters(commonParameters(properties.getTools().getExec().getDefaultTimeout()))
                .parameter(ToolParameter.optional("python_executable", String.class, null,
                        "Python interpreter to use (default: " + defaultPython + ")"))
                .parameter(ToolParameter.optional("additional_args", String.class, null,
                        "Arguments passed to the script, separated by spaces or commas"))
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
        String filePath = arguments.getString("file_path");
        Path script;
        try {
            script = getWorkspaceRoot().resolve(filePath.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid file_path: " + filePath, e);
        }
        if (!Files.isRegularFile(script)) {
            return ToolResult.failure("Python file not found: " + script);
        }

        List<String> args = new ArrayList<>();
        args.add(script.toString());
        args.addAll(splitArguments(arguments.getString("additional_args")));
        return runProcess(arguments, RunPythonCodeTool.pythonExecutable(arguments, defaultPython), args,
                Map.of("PYTHONIOENCODING", "utf-8"));
    }
}
