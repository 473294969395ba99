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

import me.toolpilot.domain.model.ExecutionRequest;
import me.toolpilot.domain.model.ExecutionResult;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolParameter;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.process.ProcessExecutionEngine;
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for the {@code system} toolset: tools that run code through the
 * {@link ProcessExecutionEngine}.
 *
 * <p>
 * Common parameters:
 * <ul>
 * <li>{@code working_directory} - resolved against the workspace; defaults to
 * the workspace itself</li>
 * <li>{@code timeout} - seconds; values above
 * {@code toolpilot.tools.exec.max-timeout}, zero and negative values are
 * clamped to that maximum</li>
 * <li>{@code capture_output} / {@code capture_errors} - capture stdout /
 * stderr into the result</li>
 * </ul>
 *
 * <p>
 * Result payload: {@code exit_code}, {@code stdout} and {@code stderr} (only
 * when captured), {@code command}, {@code working_directory},
 * {@code execution_time_ms}, {@code timed_out}.
 */
@Slf4j
public abstract class AbstractCodeExecutionTool extends AbstractTool {

    protected static final String TOOLSET = "system";

    protected static final String PARAM_WORKING_DIRECTORY = "working_directory";
    protected static final String PARAM_TIMEOUT = "timeout";
    protected static final String PARAM_CAPTURE_OUTPUT = "capture_output";
    protected static final String PARAM_CAPTURE_ERRORS = "capture_errors";

    private final ProcessExecutionEngine engine;
    private final Path workspaceRoot;
    private final int maxTimeout;

    protected AbstractCodeExecutionTool(ProcessExecutionEngine engine, ToolPilotProperties properties) {
        this.engine = engine;
        this.workspaceRoot = Paths.get(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
        this.maxTimeout = properties.getTools().getExec().getMaxTimeout();
    }

    /**
     * Parameters shared by every execution tool, in schema order.
     */
    protected static List<ToolParameter> commonParameters(int defaultTimeout) {
        return List.of(
                ToolParameter.optional(PARAM_WORKING_DIRECTORY, String.class, null,
                        "Directory to run in; defaults to the workspace"),
                ToolParameter.optional(PARAM_TIMEOUT, Integer.class, defaultTimeout,
                        "Timeout in seconds"),
                ToolParameter.optional(PARAM_CAPTURE_OUTPUT, Boolean.class, true,
                        "Capture standard output"),
                ToolParameter.optional(PARAM_CAPTURE_ERRORS, Boolean.class, true,
                        "Capture standard error"));
    }

    /**
     * Human readable name of the language, used in error messages.
     */
    protected abstract String getLanguage();

    protected Path resolveWorkingDirectory(ToolArguments arguments) {
        String workingDirectory = arguments.getString(PARAM_WORKING_DIRECTORY);
        if (workingDirectory == null || workingDirectory.isBlank()) {
            return workspaceRoot;
        }
        return workspaceRoot.resolve(workingDirectory.trim()).normalize();
    }

    protected Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    protected ToolResult runProcess(ToolArguments arguments, String executable, List<String> args,
            Map<String, String> environment) {
        int timeout = effectiveTimeout(arguments.getInteger(PARAM_TIMEOUT));
        ExecutionRequest request = ExecutionRequest.builder()
                .executable(executable)
                .arguments(args)
                .workingDirectory(resolveWorkingDirectory(arguments))
                .timeout(Duration.ofSeconds(timeout))
                .captureStdout(arguments.getBoolean(PARAM_CAPTURE_OUTPUT))
                .captureStderr(arguments.getBoolean(PARAM_CAPTURE_ERRORS))
                .environment(environment)
                .build();

        log.info("[{}] Running {} (timeout {}s)", getToolName(), getLanguage(), timeout);
        ExecutionResult result = engine.execute(request);
        return toToolResult(result, timeout);
    }

    private int effectiveTimeout(Integer requested) {
        if (requested == null || requested <= 0 || requested > maxTimeout) {
            return maxTimeout;
        }
        return requested;
    }

    private ToolResult toToolResult(ExecutionResult result, int timeout) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exit_code", result.getExitCode());
        if (result.getStdout() != null) {
            data.put("stdout", result.getStdout());
        }
        if (result.getStderr() != null) {
            data.put("stderr", result.getStderr());
        }
        data.put("command", String.join(" ", result.getCommand()));
        data.put("working_directory", result.getWorkingDirectory());
        data.put("execution_time_ms", result.getElapsedMs());
        data.put("timed_out", result.isTimedOut());

        if (result.isSuccess()) {
            return ToolResult.success(data);
        }
        String error;
        if (result.isTimedOut()) {
            error = getLanguage() + " execution timed out after " + timeout + " seconds";
        } else if (result.getFailureKind() != null) {
            error = result.getError();
        } else {
            error = getLanguage() + " execution failed with exit code " + result.getExitCode();
        }
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, error, data);
    }

    protected static List<String> splitArguments(String additionalArgs) {
        List<String> args = new ArrayList<>();
        if (additionalArgs == null || additionalArgs.isBlank()) {
            return args;
        }
        for (String token : additionalArgs.trim().split("[\\s,]+")) {
            if (!token.isEmpty()) {
                args.add(token);
            }
        }
        return args;
    }
}
