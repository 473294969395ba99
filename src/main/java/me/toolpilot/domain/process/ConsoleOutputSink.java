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

import java.io.PrintStream;

/**
 * Mirrors program output to the host's {@code System.out} and
 * {@code System.err}. The streams are looked up on every line so that
 * redirection through {@link System#setOut} is honored.
 */
public final class ConsoleOutputSink implements OutputSink {

    public static final ConsoleOutputSink INSTANCE = new ConsoleOutputSink();

    private ConsoleOutputSink() {
    }

    @Override
    public void onLine(StreamType stream, String line) {
        PrintStream target = stream == StreamType.STDERR ? System.err : System.out;
        target.println(line);
        target.flush();
    }
}
