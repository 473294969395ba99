package me.toolpilot.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import me.toolpilot.domain.exception.ConfigurationException;
import me.toolpilot.domain.exception.ModelCommunicationException;
import me.toolpilot.domain.model.LlmRequest;
import me.toolpilot.domain.model.LlmResponse;
import me.toolpilot.domain.model.LlmUsage;
import me.toolpilot.domain.model.Message;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import me.toolpilot.infrastructure.http.FeignClientFactory;
import me.toolpilot.port.outbound.LlmPort;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * LLM adapter for OpenAI-compatible chat completion APIs using Feign + OkHttp.
 *
 * <p>
 * Works with any server exposing {@code POST /chat/completions} with function
 * calling (OpenAI, local inference servers, proxies).
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolpilot.llm.base-url} - Base URL of the API, including the
 * version segment (e.g. {@code https://api.openai.com/v1})
 * <li>{@code toolpilot.llm.api-key} - API key sent as Bearer token
 * <li>{@code toolpilot.llm.model} - Model identifier
 * </ul>
 *
 * <p>
 * Lazy initialization: the Feign client is created on first use.
 *
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private final ToolPilotProperties properties;
    private final FeignClientFactory feignClientFactory;

    private ChatCompletionsApi client;
    private volatile boolean initialized = false;

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (!isAvailable()) {
            throw new ConfigurationException(
                    "Model endpoint is not configured: set toolpilot.llm.base-url, toolpilot.llm.api-key "
                            + "and toolpilot.llm.model");
        }
        String baseUrl = stripTrailingSlash(properties.getLlm().getBaseUrl());
        this.client = feignClientFactory.create(ChatCompletionsApi.class, baseUrl);
        initialized = true;
        log.info("[LLM] OpenAI-compatible adapter initialized with URL: {}, model: {}", baseUrl,
                getCurrentModel());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public LlmResponse chat(LlmRequest request) {
        ensureInitialized();
        ChatCompletionRequest apiRequest = buildRequest(request);
        ChatCompletionResponse apiResponse;
        try {
            apiResponse = client.chatCompletion(properties.getLlm().getApiKey(), apiRequest);
        } catch (FeignException e) {
            log.debug("[LLM] Chat completion failed", e);
            throw new ModelCommunicationException(describe(e), e);
        } catch (RuntimeException e) {
            log.debug("[LLM] Chat completion failed", e);
            throw new ModelCommunicationException("Model endpoint request failed: " + e.getMessage(), e);
        }
        return convertResponse(apiResponse);
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        ToolPilotProperties.LlmProperties llm = properties.getLlm();
        return isNotBlank(llm.getBaseUrl()) && isNotBlank(llm.getApiKey()) && isNotBlank(llm.getModel());
    }

    ChatCompletionRequest buildRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());

        List<ApiMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent());

            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(tc -> {
                            ApiToolCall atc = new ApiToolCall();
                            atc.setId(tc.getId());
                            atc.setType("function");
                            ApiFunction func = new ApiFunction();
                            func.setName(tc.getName());
                            func.setArguments(tc.getArguments() != null ? tc.getArguments() : "{}");
                            atc.setFunction(func);
                            return atc;
                        })
                        .toList());
            }

            if (msg.getToolCallId() != null) {
                apiMsg.setToolCallId(msg.getToolCallId());
            }

            messages.add(apiMsg);
        }
        apiRequest.setMessages(messages);

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(schema -> {
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        apiTool.setFunction(schema);
                        return apiTool;
                    })
                    .toList());
            apiRequest.setToolChoice(request.getToolChoice());
        }

        return apiRequest;
    }

    LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            throw new ModelCommunicationException("Model endpoint returned no choices");
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage();
        if (message == null) {
            throw new ModelCommunicationException("Model endpoint returned a choice without a message");
        }

        List<Message.ToolCall> toolCalls = null;
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            toolCalls = message.getToolCalls().stream()
                    .map(tc -> Message.ToolCall.builder()
                            .id(tc.getId() != null ? tc.getId() : "call_" + UUID.randomUUID())
                            .name(tc.getFunction() != null ? tc.getFunction().getName() : null)
                            .arguments(tc.getFunction() != null ? tc.getFunction().getArguments() : null)
                            .build())
                    .toList();
        }

        LlmUsage usage = null;
        if (apiResponse.getUsage() != null) {
            ApiUsage apiUsage = apiResponse.getUsage();
            usage = LlmUsage.builder()
                    .inputTokens(apiUsage.getPromptTokens())
                    .outputTokens(apiUsage.getCompletionTokens())
                    .totalTokens(apiUsage.getTotalTokens())
                    .build();
        }

        return LlmResponse.builder()
                .content(message.getContent())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private static String describe(FeignException e) {
        if (e.status() > 0) {
            String body = e.contentUTF8();
            return "Model endpoint returned HTTP " + e.status()
                    + (body != null && !body.isBlank() ? ": " + body : "");
        }
        return "Model endpoint request failed: " + e.getMessage();
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        @JsonProperty("tool_choice")
        private String toolChoice;
        private Double temperature;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private Map<String, Object> function;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
