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

import me.golemcore.spychat.domain.model.ChatEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Transport-side half of a live client connection. The registry owns the
 * mapping from connection id to handle; the transport itself belongs to the
 * network layer.
 */
public interface ConnectionHandle {

    /**
     * Sends an envelope to the client. Implementations must not block the caller
     * on network I/O.
     */
    CompletableFuture<Void> send(ChatEnvelope envelope);

    boolean isOpen();

    void close();
}
