package me.toolpilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for ToolPilot.
 *
 * <p>
 * ToolPilot lets a language model drive local actions through function
 * calling: the model requests named tools with JSON arguments, the host runs
 * them and feeds the results back until the model answers.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → PromptCommandRunner
 * Domain Layer       → ToolLoopSystem, ToolRegistry, ProcessExecutionEngine
 * Infrastructure     → OpenAI-compatible LLM adapter (Feign + OkHttp)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code toolpilot.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolPilotApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ToolPilotApplication.class, args)));
    }

}
