package me.golemcore.spychat.port.inbound;

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

import me.golemcore.spychat.domain.model.ChatReply;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for chatting with a spy. Used by both the REST and WebSocket
 * adapters.
 */
public interface ChatPort {

    /**
     * Chats in the spy's canonical conversation, creating it on first use.
     */
    ChatReply chat(String spyId, String userText);

    /**
     * Chats in an explicit conversation, which must belong to the spy.
     */
    ChatReply chatInConversation(String spyId, String conversationId, String userText);

    /**
     * Runs {@link #chatInConversation} on the turn executor. The returned future
     * never completes exceptionally for turn-level failures; those are reported
     * in the reply.
     */
    CompletableFuture<ChatReply> chatInConversationAsync(String spyId, String conversationId, String userText);

    /**
     * Debriefs the spy on a mission in their canonical conversation. The mission
     * file is fetched through the tool cache before the turn and handed to the
     * model with the system prompt.
     */
    ChatReply debrief(String spyId, String missionId, String userText);
}
