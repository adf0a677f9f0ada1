package me.golemcore.spychat.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.ChatEnvelope;
import me.golemcore.spychat.domain.model.Connection;
import me.golemcore.spychat.domain.model.ConnectionState;
import me.golemcore.spychat.port.outbound.ConnectionHandle;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Registry of live client connections with persona and conversation indexes.
 *
 * <p>
 * All index mutations happen under a single registry lock. Broadcasts take a
 * snapshot of the target connections under the lock and send after releasing
 * it, so a slow client never blocks connects, disconnects or other
 * broadcasts. A connection that is open when the snapshot is taken receives
 * the envelope exactly once; one that disconnects before the snapshot does
 * not receive it.
 */
@Service
@Slf4j
public class ConnectionRegistry {

    private final Object lock = new Object();
    private final Map<String, Connection> connections = new HashMap<>();
    private final Map<String, Set<String>> byPersona = new HashMap<>();
    private final Map<String, Set<String>> byConversation = new HashMap<>();

    /**
     * Registers an open transport and indexes it.
     *
     * @return the new connection id
     */
    public String connect(ConnectionHandle handle, String personaId, String conversationId) {
        String connectionId = UUID.randomUUID().toString();
        Connection connection = new Connection(connectionId, handle, blankToNull(personaId),
                blankToNull(conversationId));
        synchronized (lock) {
            connections.put(connectionId, connection);
            index(byPersona, connection.getPersonaId(), connectionId);
            index(byConversation, connection.getConversationId(), connectionId);
            connection.setState(ConnectionState.OPEN);
        }
        log.info("[Registry] Connected {} (persona={}, conversation={})", connectionId, personaId, conversationId);
        return connectionId;
    }

    /**
     * Binds a connection to a conversation once it is known, replacing any
     * previous binding.
     *
     * @return {@code false} if the connection is unknown or closed
     */
    public boolean bindConversation(String connectionId, String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return false;
        }
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection == null || !connection.isOpen()) {
                return false;
            }
            if (conversationId.equals(connection.getConversationId())) {
                return true;
            }
            unindex(byConversation, connection.getConversationId(), connectionId);
            connection.setConversationId(conversationId);
            index(byConversation, conversationId, connectionId);
            return true;
        }
    }

    /**
     * Closes a connection and removes it from every index. Idempotent.
     */
    public void disconnect(String connectionId) {
        Connection removed;
        synchronized (lock) {
            removed = connections.remove(connectionId);
            if (removed == null) {
                return;
            }
            removed.setState(ConnectionState.CLOSED);
            unindex(byPersona, removed.getPersonaId(), connectionId);
            unindex(byConversation, removed.getConversationId(), connectionId);
        }
        log.info("[Registry] Disconnected {}", connectionId);
    }

    /**
     * Sends to one connection. No-op if it is closed or unknown.
     */
    public void sendTo(String connectionId, ChatEnvelope envelope) {
        Connection connection;
        synchronized (lock) {
            connection = connections.get(connectionId);
        }
        if (connection == null || !connection.isOpen()) {
            log.debug("[Registry] Skip send to closed connection {}", connectionId);
            return;
        }
        deliver(connection, envelope);
    }

    public int broadcastToPersona(String personaId, ChatEnvelope envelope) {
        return deliverAll(snapshot(byPersona, personaId), envelope);
    }

    public int broadcastToConversation(String conversationId, ChatEnvelope envelope) {
        return deliverAll(snapshot(byConversation, conversationId), envelope);
    }

    /**
     * Sends to every open connection.
     */
    public int broadcast(ChatEnvelope envelope) {
        List<Connection> targets;
        synchronized (lock) {
            targets = new ArrayList<>(connections.values());
        }
        return deliverAll(targets, envelope);
    }

    public Optional<Connection> get(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    public int connectionCount() {
        synchronized (lock) {
            return connections.size();
        }
    }

    public int personaBucketCount() {
        synchronized (lock) {
            return byPersona.size();
        }
    }

    public int conversationBucketCount() {
        synchronized (lock) {
            return byConversation.size();
        }
    }

    private List<Connection> snapshot(Map<String, Set<String>> index, String key) {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        synchronized (lock) {
            Set<String> ids = index.get(key);
            if (ids == null) {
                return List.of();
            }
            List<Connection> targets = new ArrayList<>(ids.size());
            for (String id : ids) {
                Connection connection = connections.get(id);
                if (connection != null) {
                    targets.add(connection);
                }
            }
            return targets;
        }
    }

    private int deliverAll(List<Connection> targets, ChatEnvelope envelope) {
        int delivered = 0;
        for (Connection connection : targets) {
            if (deliver(connection, envelope)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(Connection connection, ChatEnvelope envelope) {
        ConnectionHandle handle = connection.getHandle();
        if (handle == null || !handle.isOpen()) {
            log.debug("[Registry] Transport already closed for {}", connection.getId());
            return false;
        }
        try {
            handle.send(envelope).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("[Registry] Failed to send to {}: {}", connection.getId(), error.getMessage());
                }
            });
            return true;
        } catch (RuntimeException e) { // NOSONAR - one broken client must not abort a fan-out
            log.warn("[Registry] Failed to send to {}: {}", connection.getId(), e.getMessage());
            return false;
        }
    }

    private void index(Map<String, Set<String>> index, String key, String connectionId) {
        if (key == null) {
            return;
        }
        index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(connectionId);
    }

    private void unindex(Map<String, Set<String>> index, String key, String connectionId) {
        if (key == null) {
            return;
        }
        Set<String> ids = index.get(key);
        if (ids == null) {
            return;
        }
        ids.remove(connectionId);
        if (ids.isEmpty()) {
            index.remove(key);
        }
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
