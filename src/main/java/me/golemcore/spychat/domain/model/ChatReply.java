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

/**
 * What a chat session hands back to its caller. When {@link #status} is not
 * {@link ChatReplyStatus#COMPLETED}, {@link #response} carries a user-visible
 * explanation and no turn ran.
 */
@Data
@Builder
public class ChatReply {

    private ChatReplyStatus status;
    private String spyId;
    private String spyName;
    private String conversationId;
    private String message;
    private String response;
    private int toolCalls;
    private TurnStatus turnStatus;

    public boolean isCompleted() {
        return status == ChatReplyStatus.COMPLETED;
    }

    public static ChatReply rejected(ChatReplyStatus status, String spyId, String conversationId, String message,
            String explanation) {
        return ChatReply.builder()
                .status(status)
                .spyId(spyId)
                .conversationId(conversationId)
                .message(message)
                .response(explanation)
                .build();
    }
}
