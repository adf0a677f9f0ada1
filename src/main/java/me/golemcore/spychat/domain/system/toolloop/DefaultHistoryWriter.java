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
import me.golemcore.spychat.domain.model.MessageRole;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> turnMessages, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls) {
        String content = llmResponse != null ? llmResponse.getContent() : null;
        turnMessages.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.ASSISTANT)
                .content(content != null && !content.isBlank() ? content : null)
                .toolCalls(toolCalls)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> turnMessages, ToolExecutionOutcome outcome) {
        turnMessages.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> turnMessages, String finalText) {
        turnMessages.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
