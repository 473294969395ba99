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
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Description of an external program run.
 *
 * <p>
 * A {@code null} working directory means the current directory of the host
 * process; a {@code null} timeout means no limit.
 */
@Value
@Builder
public class ExecutionRequest {

    String executable;
    @Singular
    List<String> arguments;
    Path workingDirectory;
    Duration timeout;
    @Builder.Default
    boolean captureStdout = true;
    @Builder.Default
    boolean captureStderr = true;
    @Singular("environmentVariable")
    Map<String, String> environment;

    public List<String> getCommand() {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable);
        command.addAll(arguments);
        return command;
    }
}
