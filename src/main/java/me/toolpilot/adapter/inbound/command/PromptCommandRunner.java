package me.toolpilot.adapter.inbound.command;

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
import me.toolpilot.domain.exception.ModelCommunicationException;
import me.toolpilot.domain.service.ConversationService;
import me.toolpilot.domain.system.toolloop.ToolLoopTurnResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Command-line entry point.
 *
 * <p>
 * Usage:
 * <ul>
 * <li>{@code toolpilot "prompt text"} - one turn, the answer goes to stdout</li>
 * <li>{@code echo "prompt" | toolpilot} - prompt read from stdin</li>
 * <li>{@code toolpilot --chat} - interactive session; {@code exit} or
 * {@code quit} ends it, {@code /reset} clears the history</li>
 * </ul>
 *
 * <p>
 * Configuration and model endpoint errors are printed to stderr and turn into
 * exit status 1.
 */
@Component
@Slf4j
public class PromptCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String CHAT_OPTION = "chat";
    static final String RESET_COMMAND = "/reset";

    private final ConversationService conversationService;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = 0;

    @Autowired
    public PromptCommandRunner(ConversationService conversationService) {
        this(conversationService, System.in, System.out, System.err);
    }

    PromptCommandRunner(ConversationService conversationService, InputStream in, PrintStream out,
            PrintStream err) {
        this.conversationService = conversationService;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (args.containsOption(CHAT_OPTION)) {
                runChat();
            } else {
                runSinglePrompt(String.join(" ", args.getNonOptionArgs()).trim());
            }
        } catch (ConfigurationException e) {
            fail("Configuration Error: " + e.getMessage());
        } catch (ModelCommunicationException e) {
            fail("Runtime Error: " + e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runSinglePrompt(String prompt) {
        String effective = prompt;
        if (effective.isEmpty() && System.console() == null) {
            effective = readAll().trim();
        }
        if (effective.isEmpty()) {
            printUsage();
            return;
        }
        printAnswer(conversationService.send(effective));
    }

    private void runChat() {
        out.println("Chat mode. Type 'exit' or 'quit' to leave, '" + RESET_COMMAND + "' to clear history.");
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print("> ");
            out.flush();
            String line = readLine(reader);
            if (line == null) {
                out.println();
                return;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            String command = input.toLowerCase(Locale.ROOT);
            if ("exit".equals(command) || "quit".equals(command)) {
                return;
            }
            if (RESET_COMMAND.equals(command)) {
                conversationService.reset();
                out.println("Conversation history cleared.");
                continue;
            }
            printAnswer(conversationService.send(input));
        }
    }

    private void printAnswer(ToolLoopTurnResult result) {
        out.println(result.finalAnswer());
        out.flush();
    }

    private void printUsage() {
        out.println("Usage: toolpilot \"<prompt>\"   run a single prompt");
        out.println("       toolpilot --chat       start an interactive session");
        out.println("The prompt can also be piped through stdin.");
    }

    private void fail(String message) {
        log.debug("[Command] {}", message);
        err.println(message);
        err.flush();
        exitCode = 1;
    }

    private String readAll() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        return reader.lines().collect(Collectors.joining("\n"));
    }

    private static String readLine(BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from stdin", e);
        }
    }
}
