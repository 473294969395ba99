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

import me.toolpilot.domain.exception.ConfigurationException;
import me.toolpilot.domain.model.ConversationState;
import me.toolpilot.domain.model.Message;
import me.toolpilot.domain.system.toolloop.ToolLoopSystem;
import me.toolpilot.domain.system.toolloop.ToolLoopTurnResult;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import me.toolpilot.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the conversation of the current run. History is kept in memory only;
 * each {@link #send} adds one user turn on top of what came before.
 */
@Service
@Slf4j
public class ConversationService {

    private final ToolLoopSystem toolLoopSystem;
    private final LlmPort llmPort;
    private final ConversationState conversation;

    public ConversationService(ToolLoopSystem toolLoopSystem, LlmPort llmPort, ToolPilotProperties properties) {
        this.toolLoopSystem = toolLoopSystem;
        this.llmPort = llmPort;
        this.conversation = new ConversationState(properties.getLlm().getSystemPrompt());
    }

    /**
     * Runs one turn for the prompt and returns the turn result.
     *
     * @throws ConfigurationException
     *             if the model endpoint is not configured
     * @throws me.toolpilot.domain.exception.ModelCommunicationException
     *             if the model endpoint fails
     */
    public ToolLoopTurnResult send(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        if (!llmPort.isAvailable()) {
            throw new ConfigurationException("Model endpoint is not configured: set toolpilot.llm.api-key "
                    + "(or OPENAI_API_KEY) and toolpilot.llm.model (or OPENAI_MODEL)");
        }
        conversation.append(Message.user(prompt));
        ToolLoopTurnResult result = toolLoopSystem.processTurn(conversation);
        log.debug("[Conversation] {} message(s) in history", conversation.size());
        return result;
    }

    public void reset() {
        conversation.reset();
        log.info("[Conversation] History cleared");
    }

    public ConversationState getConversation() {
        return conversation;
    }
}
