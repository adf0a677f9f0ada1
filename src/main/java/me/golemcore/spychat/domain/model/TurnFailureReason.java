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
 * Why a turn ended in {@link TurnStatus#FAILED}.
 */
public enum TurnFailureReason {

    /**
     * The LLM requested more tool invocations than the per-turn bound allows.
     */
    TOOL_BOUND_EXCEEDED,

    /**
     * The LLM provider timed out, refused the connection or was rate limited.
     */
    UPSTREAM_UNAVAILABLE,

    /**
     * The LLM provider failed for any other reason.
     */
    UPSTREAM_ERROR,

    /**
     * The turn ran past its wall-clock deadline.
     */
    DEADLINE_EXCEEDED
}
