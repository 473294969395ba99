package me.toolpilot.domain.process;

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

import me.toolpilot.domain.model.ExecutionRequest;
import me.toolpilot.domain.model.ExecutionResult;
import me.toolpilot.domain.model.ProcessFailureKind;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external programs and supervises them until they exit or time out.
 *
 * <p>
 * Each captured stream is read line by line on the engine's reader pool. The
 * readers and the process-exit hook publish {@link OutputEvent}s to one
 * {@link LinkedBlockingQueue}; the calling thread is the only consumer. It
 * blocks on the queue with the remaining time budget as poll timeout, appends
 * every line to the stream's accumulator and mirrors it to the
 * {@link OutputSink} right away.
 *
 * <p>
 * Guarantees:
 * <ul>
 * <li>line order within a stream is preserved; across streams lines appear in
 * arrival order</li>
 * <li>on timeout the process tree is killed and the result reports
 * {@code timedOut=true}, {@code exitCode=-1}</li>
 * <li>after exit the supervisor waits at most the reader grace period for the
 * streams to close, then drains what is left without blocking</li>
 * <li>spawn problems never throw; they are reported through
 * {@link ExecutionResult#getFailureKind()}</li>
 * </ul>
 */
@Component
@Slf4j
public class ProcessExecutionEngine {

    private static final Duration DEFAULT_READER_GRACE = Duration.ofSeconds(1);
    private static final AtomicInteger READER_THREADS = new AtomicInteger();

    private final Duration readerGrace;
    private final OutputSink defaultSink;
    private final ExecutorService readerPool;

    @Autowired
    public ProcessExecutionEngine(ToolPilotProperties properties) {
        this(properties.getExec().getReaderGrace(), ConsoleOutputSink.INSTANCE);
    }

    public ProcessExecutionEngine(Duration readerGrace, OutputSink defaultSink) {
        this.readerGrace = readerGrace != null ? readerGrace : DEFAULT_READER_GRACE;
        this.defaultSink = defaultSink != null ? defaultSink : OutputSink.NONE;
        this.readerPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "exec-reader-" + READER_THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        readerPool.shutdownNow();
    }

    public ExecutionResult execute(String executablePath, List<String> args, Path workingDirectory,
            Integer timeoutSeconds, boolean captureStdout, boolean captureStderr) {
        ExecutionRequest request = ExecutionRequest.builder()
                .executable(executablePath)
                .arguments(args != null ? args : List.of())
                .workingDirectory(workingDirectory)
                .timeout(timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null)
                .captureStdout(captureStdout)
                .captureStderr(captureStderr)
                .build();
        return execute(request);
    }

    public ExecutionResult execute(ExecutionRequest request) {
        return execute(request, defaultSink);
    }

    public ExecutionResult execute(ExecutionRequest request, OutputSink sink) {
        long started = System.nanoTime();
        List<String> command = request.getCommand();
        Path workingDirectory = request.getWorkingDirectory() != null
                ? request.getWorkingDirectory().toAbsolutePath()
                : Paths.get("").toAbsolutePath();

        if (request.getExecutable() == null || request.getExecutable().isBlank()) {
            return failure(command, workingDirectory, ProcessFailureKind.INVALID_ARGUMENT,
                    "Executable must not be empty", started);
        }
        if (request.getTimeout() != null && request.getTimeout().isNegative()) {
            return failure(command, workingDirectory, ProcessFailureKind.INVALID_ARGUMENT,
                    "Timeout must not be negative: " + request.getTimeout(), started);
        }
        if (!Files.isDirectory(workingDirectory)) {
            return failure(command, workingDirectory, ProcessFailureKind.INVALID_ARGUMENT,
                    "Working directory does not exist or is not a directory: " + workingDirectory, started);
        }
        if (isMissingAbsoluteExecutable(request.getExecutable())) {
            return failure(command, workingDirectory, ProcessFailureKind.NOT_FOUND,
                    "Executable not found: " + request.getExecutable(), started);
        }

        ProcessBuilder builder = new ProcessBuilder(command).directory(workingDirectory.toFile());
        builder.redirectOutput(request.isCaptureStdout() ? Redirect.PIPE : Redirect.DISCARD);
        builder.redirectError(request.isCaptureStderr() ? Redirect.PIPE : Redirect.DISCARD);
        builder.environment().putAll(request.getEnvironment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            ProcessFailureKind kind = isExecutableNotFound(e) ? ProcessFailureKind.NOT_FOUND
                    : ProcessFailureKind.SPAWN_FAILED;
            log.warn("[Exec] Failed to start {}: {}", request.getExecutable(), e.getMessage());
            return failure(command, workingDirectory, kind, e.getMessage(), started);
        }
        log.debug("[Exec] Started pid {}: {} (cwd={})", process.pid(), command, workingDirectory);
        closeStdin(process);

        BlockingQueue<OutputEvent> events = new LinkedBlockingQueue<>();
        Map<StreamType, List<String>> lines = new EnumMap<>(StreamType.class);
        Set<StreamType> open = EnumSet.noneOf(StreamType.class);
        if (request.isCaptureStdout()) {
            startReader(process.getInputStream(), StreamType.STDOUT, events, lines, open);
        }
        if (request.isCaptureStderr()) {
            startReader(process.getErrorStream(), StreamType.STDERR, events, lines, open);
        }
        process.onExit().thenRun(() -> events.add(OutputEvent.exited()));

        long deadline = deadlineOf(started, request.getTimeout());
        boolean exited = false;
        boolean timedOut = false;
        boolean interrupted = false;
        try {
            while (!exited) {
                OutputEvent event;
                if (deadline == Long.MAX_VALUE) {
                    event = events.take();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        exited = exitedByDeadline(process, events, lines, open, sink);
                        timedOut = !exited;
                        break;
                    }
                    event = events.poll(remaining, TimeUnit.NANOSECONDS);
                    if (event == null) {
                        continue;
                    }
                }
                exited = dispatch(event, lines, open, sink);
            }

            if (timedOut) {
                log.warn("[Exec] {} exceeded timeout of {}s, terminating", request.getExecutable(),
                        request.getTimeout().toSeconds());
                terminate(process);
            }
            awaitStreamsClosed(events, lines, open, sink);
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
            log.warn("[Exec] Interrupted while supervising {}, terminating", request.getExecutable());
            terminate(process);
        }
        drainPending(events, lines, open, sink);

        int exitCode = timedOut || interrupted || process.isAlive()
                ? ExecutionResult.FORCED_EXIT_CODE
                : process.exitValue();
        String error = null;
        if (interrupted) {
            error = "Execution interrupted";
        } else if (timedOut) {
            error = "Timed out after " + request.getTimeout().toSeconds() + " seconds";
        }

        ExecutionResult result = ExecutionResult.builder()
                .exitCode(exitCode)
                .stdout(joinLines(lines.get(StreamType.STDOUT)))
                .stderr(joinLines(lines.get(StreamType.STDERR)))
                .stdoutLines(copyOrNull(lines.get(StreamType.STDOUT)))
                .stderrLines(copyOrNull(lines.get(StreamType.STDERR)))
                .elapsedMs(elapsedMillis(started))
                .timedOut(timedOut)
                .failureKind(interrupted ? ProcessFailureKind.INTERRUPTED : null)
                .error(error)
                .command(command)
                .workingDirectory(workingDirectory.toString())
                .build();
        log.debug("[Exec] pid {} finished: exit={}, timedOut={}, {} ms", process.pid(), exitCode, timedOut,
                result.getElapsedMs());
        return result;
    }

    private void startReader(InputStream stream, StreamType type, BlockingQueue<OutputEvent> events,
            Map<StreamType, List<String>> lines, Set<StreamType> open) {
        lines.put(type, new ArrayList<>());
        open.add(type);
        readerPool.execute(() -> pump(stream, type, events));
    }

    private static void pump(InputStream stream, StreamType type, BlockingQueue<OutputEvent> events) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                events.add(OutputEvent.line(type, line));
            }
        } catch (IOException e) {
            log.debug("[Exec] {} reader stopped: {}", type, e.getMessage());
        } finally {
            events.add(OutputEvent.end(type));
        }
    }

    /**
     * Applies one event. Returns {@code true} for the process-exit event.
     */
    private static boolean dispatch(OutputEvent event, Map<StreamType, List<String>> lines,
            Set<StreamType> open, OutputSink sink) {
        switch (event.kind()) {
        case LINE -> {
            lines.get(event.stream()).add(event.line());
            mirror(sink, event);
            return false;
        }
        case END -> {
            open.remove(event.stream());
            return false;
        }
        default -> {
            return true;
        }
        }
    }

    private static void mirror(OutputSink sink, OutputEvent event) {
        try {
            sink.onLine(event.stream(), event.line());
        } catch (RuntimeException e) {
            log.warn("[Exec] Output sink failed: {}", e.getMessage());
        }
    }

    private void awaitStreamsClosed(BlockingQueue<OutputEvent> events, Map<StreamType, List<String>> lines,
            Set<StreamType> open, OutputSink sink) throws InterruptedException {
        long graceDeadline = System.nanoTime() + readerGrace.toNanos();
        while (!open.isEmpty()) {
            long remaining = graceDeadline - System.nanoTime();
            if (remaining <= 0) {
                log.debug("[Exec] Streams {} still open after {} ms grace", open, readerGrace.toMillis());
                return;
            }
            OutputEvent event = events.poll(remaining, TimeUnit.NANOSECONDS);
            if (event != null) {
                dispatch(event, lines, open, sink);
            }
        }
    }

    /**
     * Applies the queued events without blocking. Returns {@code true} if one of
     * them was the process-exit event.
     */
    private static boolean drainPending(BlockingQueue<OutputEvent> events, Map<StreamType, List<String>> lines,
            Set<StreamType> open, OutputSink sink) {
        List<OutputEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        boolean sawExit = false;
        for (OutputEvent event : pending) {
            sawExit |= dispatch(event, lines, open, sink);
        }
        return sawExit;
    }

    /**
     * Decides at the deadline whether the process already finished. Events that
     * arrived before the deadline are applied first, so an exit queued behind
     * output lines is not mistaken for a timeout.
     */
    static boolean exitedByDeadline(Process process, BlockingQueue<OutputEvent> events,
            Map<StreamType, List<String>> lines, Set<StreamType> open, OutputSink sink) {
        boolean sawExit = drainPending(events, lines, open, sink);
        return sawExit || !process.isAlive();
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(readerGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Exec] pid {} did not exit after forced termination", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("[Exec] Failed to close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static boolean isMissingAbsoluteExecutable(String executable) {
        try {
            Path path = Paths.get(executable);
            return path.isAbsolute() && !Files.exists(path);
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static boolean isExecutableNotFound(IOException e) {
        String message = e.getMessage();
        return message != null && (message.contains("error=2,") || message.contains("No such file")
                || message.contains("CreateProcess error=2"));
    }

    private static ExecutionResult failure(List<String> command, Path workingDirectory, ProcessFailureKind kind,
            String error, long started) {
        return ExecutionResult.builder()
                .exitCode(ExecutionResult.FORCED_EXIT_CODE)
                .elapsedMs(elapsedMillis(started))
                .failureKind(kind)
                .error(error)
                .command(command)
                .workingDirectory(workingDirectory.toString())
                .build();
    }

    private static long deadlineOf(long started, Duration timeout) {
        if (timeout == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.addExact(started, timeout.toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static long elapsedMillis(long started) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }

    private static String joinLines(List<String> lines) {
        if (lines == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private static List<String> copyOrNull(List<String> lines) {
        return lines != null ? List.copyOf(lines) : null;
    }
}
