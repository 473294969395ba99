package me.toolpilot.tools;

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

import me.toolpilot.domain.component.ToolComponent;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.service.ToolArguments;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for the built-in tools.
 *
 * <p>
 * Binds the raw argument map against the tool's definition and runs the tool
 * on the calling thread. I/O errors become failed results; binding errors and
 * other runtime exceptions complete the future exceptionally and are
 * classified by the caller.
 */
@Slf4j
public abstract class AbstractTool implements ToolComponent {

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        try {
            ToolArguments arguments = ToolArguments.bind(getDefinition(), parameters);
            return CompletableFuture.completedFuture(run(arguments));
        } catch (IOException e) {
            log.warn("[{}] I/O error: {}", getToolName(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, describe(e)));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract ToolResult run(ToolArguments arguments) throws IOException;

    protected static String describe(IOException e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
