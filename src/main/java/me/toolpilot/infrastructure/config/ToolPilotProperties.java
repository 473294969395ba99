package me.toolpilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code toolpilot.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model endpoint, key, model and sampling</li>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts and pool</li>
 * <li>{@link ToolsProperties} - autoloaded toolsets and tool defaults</li>
 * <li>{@link ExecProperties} - process execution engine</li>
 * <li>{@link TurnProperties} - tool loop limits</li>
 * <li>{@link SecurityProperties} - allowed tool permissions</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "toolpilot")
@Data
public class ToolPilotProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ExecProperties exec = new ExecProperties();
    private TurnProperties turn = new TurnProperties();
    private SecurityProperties security = new SecurityProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model;
        private double temperature = 1.0;
        private String toolChoice = "auto";
        private String systemPrompt = "You are a helpful assistant that can use tools to read and write files "
                + "and run code on the user's machine. Use tools when they help to answer the request.";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private List<String> autoload = new ArrayList<>(List.of("files", "system"));
        private String workspace = ".";
        private PythonProperties python = new PythonProperties();
        private ToolExecProperties exec = new ToolExecProperties();
    }

    @Data
    public static class PythonProperties {
        private String executable = "python3";
    }

    @Data
    public static class ToolExecProperties {
        private int defaultTimeout = 60;
        private int maxTimeout = 600;
    }

    // ==================== PROCESS ENGINE ====================

    @Data
    public static class ExecProperties {
        private Duration readerGrace = Duration.ofSeconds(1);
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        private int maxLlmCalls = 25;
        private int maxToolExecutions = 100;
        private int maxToolResultChars = 100000;
        private Duration toolTimeout = Duration.ofMinutes(15);
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        private String allowedPermissions = "rwxn";
    }
}
