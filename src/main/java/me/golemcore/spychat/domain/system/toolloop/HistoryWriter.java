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

import me.golemcore.spychat.domain.model.LlmResponse;
import me.golemcore.spychat.domain.model.Message;

import java.util.List;

/**
 * Records the messages a turn produces, in order.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(List<Message> turnMessages, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls);

    void appendToolResult(List<Message> turnMessages, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(List<Message> turnMessages, String finalText);
}
