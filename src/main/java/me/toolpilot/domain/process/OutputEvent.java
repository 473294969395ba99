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

/**
 * Event on the queue shared by stream readers and the process-exit hook.
 */
record OutputEvent(Kind kind, StreamType stream, String line) {

    enum Kind {
        LINE,
        END,
        EXITED
    }

    static OutputEvent line(StreamType stream, String line) {
        return new OutputEvent(Kind.LINE, stream, line);
    }

    static OutputEvent end(StreamType stream) {
        return new OutputEvent(Kind.END, stream, null);
    }

    static OutputEvent exited() {
        return new OutputEvent(Kind.EXITED, null, null);
    }
}
