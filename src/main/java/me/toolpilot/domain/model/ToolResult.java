package me.toolpilot.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of tool execution: success flag, structured payload and error
 * information. Tool results are sent back to the model as tool messages whose
 * content is the JSON rendering of {@link #toPayload()}.
 */
@Data
@Builder
public class ToolResult {

    private boolean success;
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    private String error;
    private ToolFailureKind failureKind;

    /**
     * Creates a successful tool result with the given payload.
     */
    public static ToolResult success(Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return failure(kind, error, null);
    }

    /**
     * Creates a failed tool result that still carries a payload, e.g. the
     * captured output of a process that exited with a non-zero code.
     */
    public static ToolResult failure(ToolFailureKind kind, String error, Map<String, Object> data) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .build();
    }

    /**
     * Flattens the result into {@code {success, ...data, error?}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        if (data != null) {
            data.forEach((key, value) -> {
                if (!"success".equals(key) && !"error".equals(key)) {
                    payload.put(key, value);
                }
            });
        }
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
