package me.golemcore.spychat.domain.system.toolloop;

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

import me.golemcore.spychat.domain.model.TurnOutcome;
import me.golemcore.spychat.domain.model.TurnRequest;

/**
 * Bounded agent turn: alternates LLM decisions and tool invocations until the
 * LLM answers in text, a tool call is refused, or a bound is hit. Never throws
 * for upstream or tool failures; they are reported in the outcome.
 */
public interface ToolCallLoop {

    TurnOutcome run(TurnRequest request);
}
