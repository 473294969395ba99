package me.toolpilot.port.outbound;

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

import me.toolpilot.domain.model.LlmRequest;
import me.toolpilot.domain.model.LlmResponse;

/**
 * Port for the model completion endpoint. Provides chat completion with
 * function calling support.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response. Blocks
     * until the endpoint answers.
     *
     * @throws me.toolpilot.domain.exception.ModelCommunicationException
     *             on transport, HTTP status or decoding failures
     */
    LlmResponse chat(LlmRequest request);

    /**
     * Returns the configured model identifier.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
