package me.golemcore.spychat.port.outbound;

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

import me.golemcore.spychat.domain.model.ConversationLog;
import me.golemcore.spychat.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Port for append-only conversation logs. Missing owners or conversations are
 * reported through empty {@link Optional}s and {@code false} returns rather than
 * exceptions.
 */
public interface ConversationPort {

    /**
     * Creates a new, empty conversation for the owner.
     *
     * @return the new conversation id, or empty if the owner is unknown
     */
    Optional<String> create(String ownerId);

    Optional<ConversationLog> get(String conversationId);

    /**
     * Decoded messages of a conversation, oldest first.
     */
    default Optional<List<Message>> getMessages(String conversationId) {
        return get(conversationId).map(ConversationLog::getMessages);
    }

    /**
     * Returns the owner's most recently updated conversation, creating one if the
     * owner has none. Concurrent callers for the same owner never create two.
     */
    Optional<ConversationLog> getOrCreateForOwner(String ownerId);

    /**
     * Appends messages atomically to the end of the log.
     *
     * @return {@code false} if the conversation does not exist
     */
    boolean append(String conversationId, List<Message> messages);

    boolean delete(String conversationId);

    /**
     * Conversations of one owner, most recently updated first.
     */
    List<ConversationLog> listByOwner(String ownerId);

    /**
     * All conversations, most recently updated first.
     */
    List<ConversationLog> listAll(int offset, int limit);
}
