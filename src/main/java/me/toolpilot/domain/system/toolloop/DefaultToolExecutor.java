package me.toolpilot.domain.system.toolloop;

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

import me.toolpilot.domain.model.Message;
import me.toolpilot.domain.service.ToolCallExecutionResult;
import me.toolpilot.domain.service.ToolCallExecutionService;

/**
 * {@link ToolExecutorPort} backed by {@link ToolCallExecutionService}.
 */
public class DefaultToolExecutor implements ToolExecutorPort {

    private final ToolCallExecutionService toolCallExecutionService;

    public DefaultToolExecutor(ToolCallExecutionService toolCallExecutionService) {
        this.toolCallExecutionService = toolCallExecutionService;
    }

    @Override
    public ToolExecutionOutcome execute(Message.ToolCall toolCall) {
        ToolCallExecutionResult result = toolCallExecutionService.execute(toolCall);
        return new ToolExecutionOutcome(
                result.toolCallId(),
                result.toolName(),
                result.toolResult(),
                result.toolMessageContent(),
                false);
    }
}
