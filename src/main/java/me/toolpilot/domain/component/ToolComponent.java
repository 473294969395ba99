package me.toolpilot.domain.component;

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
import me.toolpilot.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for tools the model can invoke.
 *
 * <p>
 * Each tool supplies a static {@link ToolDefinition} (name, summary,
 * toolset, permissions, parameters) and a handler that receives the decoded
 * argument map. Failures may be reported either as a failed
 * {@link ToolResult}, by throwing, or by completing the future exceptionally;
 * the caller turns the latter two into failed results.
 */
public interface ToolComponent {

    ToolDefinition getDefinition();

    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }

    default boolean isEnabled() {
        return true;
    }
}
