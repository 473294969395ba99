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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs single-file Java source through the source launcher of the JVM hosting
 * this process ({@code java Main.java}).
 *
 * <p>
 * The code is written to a fresh temporary directory that is removed after the
 * run. The first top-level class is the entry point, so the file name does not
 * have to match it.
 */
@Component
@Slf4j
public class RunJavaCodeTool extends AbstractCodeExecutionTool {

    private final ToolDefinition definition;

    public RunJavaCodeTool(ProcessExecutionEngine engine, ToolPilotProperties properties) {
        super(engine, properties);
        this.definition = ToolDefinition.builder()
                .name("runJavaCode")
                .description("Execute single-file Java source code (a class with a main method) "
                        + "and return its output.")
                .toolset(TOOLSET)
                .permissions(ToolPermission.parse("x"))
                .parameter(ToolParameter.required("code", String.class, "Java source code to execute"))
                .parameters(commonParameters(properties.getTools().getExec().getDefaultTimeout()))
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    protected String getLanguage() {
        return "Java";
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String code = arguments.getString("code");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be empty");
        }
        Path tempDir = Files.createTempDirectory("toolpilot-java-");
        try {
            Path source = tempDir.resolve("Main.java");
            Files.writeString(source, code, StandardCharsets.UTF_8);
            return runProcess(arguments, javaLauncher(), List.of(source.toString()), Map.of());
        } finally {
            deleteQuietly(tempDir);
        }
    }

    static String javaLauncher() {
        return ProcessHandle.current().info().command()
                .filter(command -> Paths.get(command).getFileName().toString().startsWith("java"))
                .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }

    private static void deleteQuietly(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("[runJavaCode] Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("[runJavaCode] Failed to clean up {}: {}", directory, e.getMessage());
        }
    }
}
