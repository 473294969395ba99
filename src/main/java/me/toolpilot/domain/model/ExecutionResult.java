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
import lombok.Value;

import java.util.List;

/**
 * Outcome of an external program run.
 *
 * <p>
 * Captured text is {@code null} when capture of that stream was disabled and
 * an empty string when the stream was captured but nothing was written. The
 * exit code {@value #FORCED_EXIT_CODE} is reserved for forced termination and
 * spawn failures.
 */
@Value
@Builder
public class ExecutionResult {

    public static final int FORCED_EXIT_CODE = -1;

    int exitCode;
    String stdout;
    String stderr;
    List<String> stdoutLines;
    List<String> stderrLines;
    long elapsedMs;
    boolean timedOut;
    ProcessFailureKind failureKind;
    String error;
    List<String> command;
    String workingDirectory;

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut && failureKind == null;
    }
}
