package me.toolpilot.domain.service;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.toolpilot.domain.exception.ToolNotFoundException;
import me.toolpilot.domain.model.Message;
import me.toolpilot.domain.model.ToolDescriptor;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pure tool-call execution service: argument decoding + registry lookup +
 * permission gating + invocation + truncation.
 *
 * <p>
 * Every failure along the way becomes a failed {@link ToolResult}; nothing is
 * thrown to the caller. Does NOT mutate conversation history.
 */
@Component
@Slf4j
public class ToolCallExecutionService {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final ToolPermissionPolicy permissionPolicy;
    private final ObjectMapper objectMapper;
    private final ToolPilotProperties.TurnProperties settings;

    public ToolCallExecutionService(ToolRegistry toolRegistry, ToolPermissionPolicy permissionPolicy,
            ObjectMapper objectMapper, ToolPilotProperties properties) {
        this.toolRegistry = toolRegistry;
        this.permissionPolicy = permissionPolicy;
        this.objectMapper = objectMapper;
        this.settings = properties.getTurn();
    }

    public ToolCallExecutionResult execute(Message.ToolCall toolCall) {
        String toolName = sanitizeToolName(toolCall.getName());
        ToolResult result = executeToolCall(toolName, toolCall.getArguments());
        if (!result.isSuccess()) {
            log.warn("[Tools] '{}' failed ({}): {}", toolName, result.getFailureKind(), result.getError());
        } else {
            log.debug("[Tools] '{}' succeeded", toolName);
        }
        String content = truncateToolResult(renderContent(result), toolName);
        return new ToolCallExecutionResult(toolCall.getId(), toolCall.getName(), result, content);
    }

    private ToolResult executeToolCall(String toolName, String rawArguments) {
        ToolDescriptor descriptor;
        try {
            descriptor = toolRegistry.resolve(toolName);
        } catch (ToolNotFoundException e) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, e.getMessage());
        }

        if (!permissionPolicy.isAllowed(descriptor)) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, permissionPolicy.describeDenial(descriptor));
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(rawArguments);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
        }

        log.info("[Tools] Executing {} {}", toolName, arguments.keySet());
        CompletableFuture<ToolResult> future = null;
        try {
            future = descriptor.getHandler().execute(arguments);
            Duration timeout = settings.getToolTimeout();
            ToolResult result = timeout != null
                    ? future.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
            }
            return result;
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IllegalArgumentException) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getCause().getMessage());
            }
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution timed out after " + settings.getToolTimeout().toSeconds() + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        } catch (RuntimeException e) {
            log.debug("[Tools] '{}' threw", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(rawArguments);
            if (node == null || node.isNull()) {
                return Map.of();
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("Tool arguments must be a JSON object");
            }
            return objectMapper.convertValue(node, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON arguments: " + e.getOriginalMessage(), e);
        }
    }

    private String renderContent(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result.toPayload());
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool result: {}", e.getOriginalMessage());
            return "{\"success\":false,\"error\":\"Tool result could not be serialized\"}";
        }
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = settings.getMaxToolResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
