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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.toolpilot.domain.model.Message;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolResult;

/**
 * Result of one tool call as seen by the loop. {@code synthetic} marks
 * outcomes produced by the loop itself rather than by a tool.
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        ToolResult result = ToolResult.failure(kind, reason);
        String content;
        try {
            content = JSON_MAPPER.writeValueAsString(result.toPayload());
        } catch (JsonProcessingException e) {
            content = "{\"success\":false}";
        }
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, true);
    }
}
