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

/**
 * Classification of failed tool results.
 */
public enum ToolFailureKind {

    /**
     * The model asked for a tool the registry does not know.
     */
    NOT_FOUND,

    /**
     * Arguments were not valid JSON, missed a required parameter or could not be
     * coerced to the declared type.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool requires a permission that is not allowed by configuration.
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED
}
