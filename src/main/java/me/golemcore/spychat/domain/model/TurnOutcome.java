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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one agent turn. {@link #newMessages} holds everything the turn
 * produced after the user's message, in order, ready to be appended to the
 * conversation log.
 */
@Data
@Builder
public class TurnOutcome {

    private TurnStatus status;
    private String responseText;
    private int toolCallsMade;

    @Builder.Default
    private List<Message> newMessages = new ArrayList<>();

    private TurnFailureReason failureReason;

    public boolean isFailed() {
        return status == TurnStatus.FAILED;
    }

    /**
     * Tool invocations the turn executed, in order.
     */
    public List<Message.ToolCall> invocations() {
        if (newMessages == null) {
            return List.of();
        }
        return newMessages.stream()
                .filter(Message::hasToolCalls)
                .flatMap(message -> message.getToolCalls().stream())
                .toList();
    }
}
