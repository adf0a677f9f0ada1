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

import lombok.Getter;
import me.golemcore.spychat.port.outbound.ConnectionHandle;

/**
 * Registry-side record of a live client connection. State and bindings are only
 * mutated by the connection registry while it holds its lock.
 */
@Getter
public class Connection {

    private final String id;
    private final ConnectionHandle handle;
    private final String personaId;
    private volatile String conversationId;
    private volatile ConnectionState state;

    public Connection(String id, ConnectionHandle handle, String personaId, String conversationId) {
        this.id = id;
        this.handle = handle;
        this.personaId = personaId;
        this.conversationId = conversationId;
        this.state = ConnectionState.CONNECTING;
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public void setState(ConnectionState state) {
        this.state = state;
    }
}
