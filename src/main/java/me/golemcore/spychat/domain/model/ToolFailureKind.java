package me.golemcore.spychat.domain.model;

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
 * Classifies why a tool invocation produced an error result.
 */
public enum ToolFailureKind {

    /**
     * Arguments were missing or malformed.
     */
    INVALID_ARGUMENTS,

    /**
     * The looked-up record does not exist.
     */
    NOT_FOUND,

    /**
     * The tool did not settle within the configured timeout.
     */
    TIMEOUT,

    /**
     * Tool execution failed during runtime (exceptions, I/O errors, etc.).
     */
    EXECUTION_FAILED
}
