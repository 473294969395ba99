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

import me.toolpilot.domain.exception.ModelCommunicationException;
import me.toolpilot.domain.model.ConversationState;
import me.toolpilot.domain.model.LlmRequest;
import me.toolpilot.domain.model.LlmResponse;
import me.toolpilot.domain.model.LlmUsage;
import me.toolpilot.domain.model.Message;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.service.ToolRegistry;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import me.toolpilot.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * State machine over {@link LoopState}:
 * <ul>
 * <li>{@code AWAITING_MODEL}: send the full history and all tool schemas. A
 * response without tool calls is the final answer; otherwise the assistant
 * message with its tool calls is appended.</li>
 * <li>{@code EXECUTING_TOOLS}: run the requested calls in order, one tool
 * message per call, then go back to the model.</li>
 * <li>{@code DONE}: terminal.</li>
 * </ul>
 *
 * <p>
 * Tool failures never leave the loop; they are fed back to the model as failed
 * results. Model failures propagate unchanged.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolPilotProperties.TurnProperties settings;
    private final ToolPilotProperties.LlmProperties llmSettings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            HistoryWriter historyWriter, ToolPilotProperties.TurnProperties settings,
            ToolPilotProperties.LlmProperties llmSettings) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.settings = settings;
        this.llmSettings = llmSettings;
    }

    @Override
    public ToolLoopTurnResult processTurn(ConversationState conversation) {
        int maxLlmCalls = settings != null ? settings.getMaxLlmCalls() : 25;
        int maxToolExecutions = settings != null ? settings.getMaxToolExecutions() : 100;

        LoopState state = LoopState.AWAITING_MODEL;
        int llmCalls = 0;
        int toolExecutions = 0;
        LlmUsage usage = LlmUsage.empty();
        LlmResponse pending = null;
        String finalAnswer = null;
        String stopReason = null;

        while (state != LoopState.DONE) {
            switch (state) {
            case AWAITING_MODEL -> {
                if (llmCalls >= maxLlmCalls) {
                    stopReason = "reached max internal LLM calls (" + maxLlmCalls + ")";
                    finalAnswer = stopTurn(conversation, stopReason);
                    state = LoopState.DONE;
                    break;
                }

                LlmResponse response = llmPort.chat(buildRequest(conversation));
                llmCalls++;
                if (response == null) {
                    throw new ModelCommunicationException("Model endpoint returned no response");
                }
                usage = usage.plus(response.getUsage());

                if (!response.hasToolCalls()) {
                    historyWriter.appendFinalAssistantAnswer(conversation, response.getContent());
                    finalAnswer = response.getContent() != null ? response.getContent() : "";
                    state = LoopState.DONE;
                } else {
                    historyWriter.appendAssistantToolCalls(conversation, response);
                    pending = response;
                    state = LoopState.EXECUTING_TOOLS;
                }
            }
            case EXECUTING_TOOLS -> {
                List<Message.ToolCall> toolCalls = pending.getToolCalls();
                for (int i = 0; i < toolCalls.size(); i++) {
                    Message.ToolCall toolCall = toolCalls.get(i);
                    if (toolExecutions >= maxToolExecutions) {
                        stopReason = "reached max tool executions (" + maxToolExecutions + ")";
                        skipRemaining(conversation, toolCalls.subList(i, toolCalls.size()), stopReason);
                        finalAnswer = stopTurn(conversation, stopReason);
                        break;
                    }
                    historyWriter.appendToolResult(conversation, executeTool(toolCall));
                    toolExecutions++;
                }
                pending = null;
                state = stopReason != null ? LoopState.DONE : LoopState.AWAITING_MODEL;
            }
            default -> throw new IllegalStateException("Unexpected loop state: " + state);
            }
        }

        log.info("[ToolLoop] Turn finished: {} LLM call(s), {} tool execution(s), {} message(s), "
                + "tokens in={} out={} total={}{}",
                llmCalls, toolExecutions, conversation.size(),
                usage.getInputTokens(), usage.getOutputTokens(), usage.getTotalTokens(),
                stopReason != null ? ", stopped: " + stopReason : "");
        return new ToolLoopTurnResult(finalAnswer, llmCalls, toolExecutions, usage, stopReason);
    }

    private ToolExecutionOutcome executeTool(Message.ToolCall toolCall) {
        ToolExecutionOutcome outcome;
        try {
            outcome = toolExecutor.execute(toolCall);
        } catch (Exception e) {
            log.warn("[ToolLoop] Tool '{}' raised: {}", toolCall.getName(), e.getMessage());
            outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }
        if (outcome == null) {
            outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution produced no result");
        }
        return outcome;
    }

    private void skipRemaining(ConversationState conversation, List<Message.ToolCall> remaining, String reason) {
        for (Message.ToolCall toolCall : remaining) {
            historyWriter.appendToolResult(conversation, ToolExecutionOutcome.synthetic(toolCall,
                    ToolFailureKind.EXECUTION_FAILED, "Tool loop stopped: " + reason));
        }
    }

    private String stopTurn(ConversationState conversation, String reason) {
        String text = "Tool loop stopped: " + reason + ".";
        log.warn("[ToolLoop] {}", text);
        historyWriter.appendFinalAssistantAnswer(conversation, text);
        return text;
    }

    private LlmRequest buildRequest(ConversationState conversation) {
        List<Map<String, Object>> tools = toolRegistry.listSchemas();
        return LlmRequest.builder()
                .model(llmSettings != null ? llmSettings.getModel() : null)
                .temperature(llmSettings != null ? llmSettings.getTemperature() : null)
                .toolChoice(llmSettings != null && !tools.isEmpty() ? llmSettings.getToolChoice() : null)
                .messages(List.copyOf(conversation.getMessages()))
                .tools(tools)
                .build();
    }
}
