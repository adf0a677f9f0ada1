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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only message log owned by a single persona. Exactly one log per owner
 * is canonical for get-or-create (the most recently updated); older logs stay
 * retrievable by id.
 */
@Data
@Builder(toBuilder = true)
public class ConversationLog {

    private String id;
    private String ownerId;
    private String title;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public int messageCount() {
        return messages != null ? messages.size() : 0;
    }
}
