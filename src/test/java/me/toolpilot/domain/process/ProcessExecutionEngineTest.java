package me.toolpilot.domain.process;

import me.toolpilot.domain.model.ExecutionRequest;
import me.toolpilot.domain.model.ExecutionResult;
import me.toolpilot.domain.model.ProcessFailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class ProcessExecutionEngineTest {

    private static final String SH = "/bin/sh";

    @TempDir
    Path tempDir;

    private ProcessExecutionEngine engine;
    private List<String> mirrored;

    @BeforeEach
    void setUp() {
        mirrored = Collections.synchronizedList(new ArrayList<>());
        engine = new ProcessExecutionEngine(Duration.ofSeconds(1),
                (stream, line) -> mirrored.add(stream + ":" + line));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private ExecutionResult sh(String script, Integer timeoutSeconds) {
        return engine.execute(SH, List.of("-c", script), tempDir, timeoutSeconds, true, true);
    }

    // ==================== Output capture ====================

    @Test
    void shouldCaptureStdoutLines() {
        ExecutionResult result = sh("printf 'line1\\nline2\\n'", 10);

        assertEquals(0, result.getExitCode());
        assertTrue(result.isSuccess());
        assertFalse(result.isTimedOut());
        assertEquals(List.of("line1", "line2"), result.getStdoutLines());
        assertEquals("line1\nline2\n", result.getStdout());
        assertEquals("", result.getStderr());
        assertTrue(result.getElapsedMs() >= 0);
    }

    @Test
    void shouldCaptureStderrAndExitCode() {
        ExecutionResult result = sh("echo oops >&2; exit 3", 10);

        assertEquals(3, result.getExitCode());
        assertFalse(result.isSuccess());
        assertNull(result.getFailureKind());
        assertEquals(List.of("oops"), result.getStderrLines());
        assertEquals(List.of(), result.getStdoutLines());
    }

    @Test
    void shouldReturnEmptyTextForSilentProgram() {
        ExecutionResult result = sh("true", 10);

        assertEquals("", result.getStdout());
        assertEquals(List.of(), result.getStdoutLines());
        assertTrue(result.isSuccess());
    }

    @Test
    void shouldKeepLastLineWithoutTrailingNewline() {
        ExecutionResult result = sh("printf 'a\\nb'", 10);

        assertEquals(List.of("a", "b"), result.getStdoutLines());
    }

    @Test
    void shouldLeaveDisabledStreamsNull() {
        ExecutionResult result = engine.execute(SH, List.of("-c", "echo out; echo err >&2"), tempDir, 10,
                false, false);

        assertEquals(0, result.getExitCode());
        assertNull(result.getStdout());
        assertNull(result.getStderr());
        assertNull(result.getStdoutLines());
        assertNull(result.getStderrLines());
        assertTrue(mirrored.isEmpty());
    }

    @Test
    void shouldMirrorLinesToSink() {
        sh("echo first; echo second >&2", 10);

        assertTrue(mirrored.contains("STDOUT:first"));
        assertTrue(mirrored.contains("STDERR:second"));
    }

    @Test
    void shouldPreserveOrderWithinStream() {
        ExecutionResult result = sh("for i in 1 2 3 4 5 6 7 8 9 10; do echo $i; done", 10);

        assertEquals(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10"), result.getStdoutLines());
    }

    @Test
    void shouldRunInWorkingDirectory() throws Exception {
        Path subdir = Files.createDirectory(tempDir.resolve("work"));

        ExecutionResult result = engine.execute(SH, List.of("-c", "pwd"), subdir, 10, true, true);

        assertEquals(subdir.toRealPath().toString(), Path.of(result.getStdoutLines().get(0)).toRealPath().toString());
        assertEquals(subdir.toAbsolutePath().toString(), result.getWorkingDirectory());
    }

    @Test
    void shouldPassEnvironment() {
        ExecutionRequest request = ExecutionRequest.builder()
                .executable(SH)
                .argument("-c")
                .argument("echo $GREETING")
                .workingDirectory(tempDir)
                .timeout(Duration.ofSeconds(10))
                .environmentVariable("GREETING", "hola")
                .build();

        ExecutionResult result = engine.execute(request);

        assertEquals(List.of("hola"), result.getStdoutLines());
        assertEquals(List.of(SH, "-c", "echo $GREETING"), result.getCommand());
    }

    // ==================== Timeout ====================

    @Test
    void shouldKillProcessOnTimeout() {
        ExecutionResult result = sh("echo started; sleep 30", 1);

        assertTrue(result.isTimedOut());
        assertEquals(ExecutionResult.FORCED_EXIT_CODE, result.getExitCode());
        assertFalse(result.isSuccess());
        assertTrue(result.getElapsedMs() >= 0);
        assertTrue(result.getElapsedMs() < 20_000, "elapsed " + result.getElapsedMs());
        assertEquals(List.of("started"), result.getStdoutLines());
    }

    @Test
    void shouldRunWithoutLimitWhenTimeoutIsNull() {
        ExecutionResult result = sh("echo ok", null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("ok"), result.getStdoutLines());
    }

    // ==================== Spawn failures ====================

    @Test
    void shouldRejectMissingWorkingDirectory() {
        ExecutionResult result = engine.execute(SH, List.of("-c", "true"), tempDir.resolve("missing"), 10,
                true, true);

        assertEquals(ProcessFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertEquals(ExecutionResult.FORCED_EXIT_CODE, result.getExitCode());
        assertFalse(result.isSuccess());
        assertTrue(result.getElapsedMs() >= 0);
    }

    @Test
    void shouldRejectFileAsWorkingDirectory() throws Exception {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

        ExecutionResult result = engine.execute(SH, List.of("-c", "true"), file, 10, true, true);

        assertEquals(ProcessFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }

    @Test
    void shouldReportMissingAbsoluteExecutable() {
        ExecutionResult result = engine.execute("/definitely/not/here/tool", List.of(), tempDir, 10, true, true);

        assertEquals(ProcessFailureKind.NOT_FOUND, result.getFailureKind());
        assertFalse(result.isSuccess());
    }

    @Test
    void shouldReportMissingExecutableOnPath() {
        ExecutionResult result = engine.execute("toolpilot-missing-binary-42", List.of(), tempDir, 10, true,
                true);

        assertEquals(ProcessFailureKind.NOT_FOUND, result.getFailureKind());
        assertNull(result.getStdout());
    }

    @Test
    void shouldRejectBlankExecutable() {
        ExecutionResult result = engine.execute(" ", List.of(), tempDir, 10, true, true);

        assertEquals(ProcessFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }

    @Test
    void shouldRejectNegativeTimeout() {
        ExecutionResult result = sh("true", -1);

        assertEquals(ProcessFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }

    // ==================== Interruption ====================

    @Test
    void shouldKillChildAndKeepInterruptFlagWhenInterrupted() throws Exception {
        Path pidFile = tempDir.resolve("child.pid");
        AtomicReference<ExecutionResult> result = new AtomicReference<>();
        AtomicBoolean interruptFlagKept = new AtomicBoolean();
        Thread supervisor = new Thread(() -> {
            result.set(sh("echo $$ > child.pid; exec sleep 30", 60));
            interruptFlagKept.set(Thread.currentThread().isInterrupted());
        });
        supervisor.start();

        long pid = awaitPid(pidFile);
        supervisor.interrupt();
        supervisor.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(supervisor.isAlive());
        assertNotNull(result.get());
        assertEquals(ProcessFailureKind.INTERRUPTED, result.get().getFailureKind());
        assertEquals(-1, result.get().getExitCode());
        assertFalse(result.get().isSuccess());
        assertTrue(interruptFlagKept.get());
        Optional<ProcessHandle> child = ProcessHandle.of(pid);
        if (child.isPresent()) {
            child.get().onExit().get(5, TimeUnit.SECONDS);
            assertFalse(child.get().isAlive());
        }
    }

    private static long awaitPid(Path pidFile) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            if (Files.exists(pidFile)) {
                String text = Files.readString(pidFile).trim();
                if (!text.isEmpty()) {
                    return Long.parseLong(text);
                }
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Child did not write its pid");
    }

    // ==================== Deadline ====================

    @Test
    void shouldTreatExitQueuedBehindOutputAsExitAtDeadline() throws Exception {
        Process process = new ProcessBuilder(SH, "-c", "exec sleep 30").start();
        try {
            BlockingQueue<OutputEvent> events = new LinkedBlockingQueue<>();
            events.add(OutputEvent.line(StreamType.STDOUT, "last line"));
            events.add(OutputEvent.exited());
            Map<StreamType, List<String>> lines = new EnumMap<>(StreamType.class);
            lines.put(StreamType.STDOUT, new ArrayList<>());
            Set<StreamType> open = EnumSet.of(StreamType.STDOUT);

            assertTrue(ProcessExecutionEngine.exitedByDeadline(process, events, lines, open, OutputSink.NONE));
            assertEquals(List.of("last line"), lines.get(StreamType.STDOUT));
            assertTrue(events.isEmpty());
        } finally {
            process.destroyForcibly();
        }
    }

    @Test
    void shouldTreatFinishedProcessAsExitAtDeadline() throws Exception {
        Process process = new ProcessBuilder(SH, "-c", "exit 0").start();
        assertTrue(process.waitFor(10, TimeUnit.SECONDS));

        assertTrue(ProcessExecutionEngine.exitedByDeadline(process, new LinkedBlockingQueue<>(),
                new EnumMap<>(StreamType.class), EnumSet.noneOf(StreamType.class), OutputSink.NONE));
    }

    @Test
    void shouldReportRunningProcessAsNotExitedAtDeadline() throws Exception {
        Process process = new ProcessBuilder(SH, "-c", "exec sleep 30").start();
        try {
            BlockingQueue<OutputEvent> events = new LinkedBlockingQueue<>();
            events.add(OutputEvent.line(StreamType.STDERR, "still working"));
            Map<StreamType, List<String>> lines = new EnumMap<>(StreamType.class);
            lines.put(StreamType.STDERR, new ArrayList<>());

            assertFalse(ProcessExecutionEngine.exitedByDeadline(process, events, lines,
                    EnumSet.of(StreamType.STDERR), OutputSink.NONE));
            assertEquals(List.of("still working"), lines.get(StreamType.STDERR));
        } finally {
            process.destroyForcibly();
        }
    }
}
