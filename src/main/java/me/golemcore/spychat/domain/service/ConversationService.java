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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.ConversationLog;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.port.outbound.ConversationPort;
import me.golemcore.spychat.port.outbound.PersonaPort;
import me.golemcore.spychat.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation store backed by {@link StoragePort}. Each conversation is one
 * JSON row {@code conversations/<id>.json}:
 *
 * <pre>
 * {"id": .., "ownerId": .., "title": .., "createdAt": .., "updatedAt": ..,
 *  "messages": "&lt;HistoryCodec blob&gt;"}
 * </pre>
 *
 * <p>
 * Appends are a read-modify-write of the whole blob under a per-conversation
 * mutex, so concurrent appends to one conversation never lose a write while
 * appends to different conversations proceed in parallel. Get-or-create is
 * serialized per owner. Rows written by older versions (snake_case keys,
 * {@code messages} stored as a raw JSON array) are read through
 * {@link HistoryCodec} and rewritten canonically on their next append.
 */
@Service
@Slf4j
public class ConversationService implements ConversationPort {

    private static final String JSON_EXTENSION = ".json";
    private static final int TITLE_MAX_LEN = 64;

    private final StoragePort storagePort;
    private final PersonaPort personaPort;
    private final HistoryCodec historyCodec;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private final Map<String, ConversationLog> conversationCache = new ConcurrentHashMap<>();
    private final Map<String, Object> appendLocks = new ConcurrentHashMap<>();
    private final Map<String, Object> ownerLocks = new ConcurrentHashMap<>();

    public ConversationService(StoragePort storagePort, PersonaPort personaPort, HistoryCodec historyCodec,
            ObjectMapper objectMapper, Clock clock, SpyChatProperties properties) {
        this.storagePort = storagePort;
        this.personaPort = personaPort;
        this.historyCodec = historyCodec;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getConversations();
    }

    @PostConstruct
    public void loadConversationsAtStartup() {
        try {
            storagePort.ensureDirectory(directory).join();
            List<String> files = storagePort.listObjects(directory, "").join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                Optional<ConversationLog> conversation = readFromStorage(id);
                if (conversation.isPresent()) {
                    conversationCache.put(id, conversation.get());
                    loaded++;
                }
            }
            log.info("[Conversations] Loaded {} conversations from storage", loaded);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Conversations] Failed to load conversations at startup: {}", e.getMessage());
        }
    }

    @Override
    public Optional<String> create(String ownerId) {
        if (!isKnownOwner(ownerId)) {
            return Optional.empty();
        }
        return Optional.of(createConversation(ownerId).getId());
    }

    @Override
    public Optional<ConversationLog> get(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        ConversationLog cached = conversationCache.get(conversationId);
        if (cached != null) {
            return Optional.of(copyOf(cached));
        }
        Optional<ConversationLog> stored = readFromStorage(conversationId);
        stored.ifPresent(conversation -> conversationCache.put(conversationId, conversation));
        return stored.map(this::copyOf);
    }

    @Override
    public Optional<ConversationLog> getOrCreateForOwner(String ownerId) {
        if (!isKnownOwner(ownerId)) {
            return Optional.empty();
        }
        synchronized (ownerLock(ownerId)) {
            Optional<ConversationLog> latest = conversationCache.values().stream()
                    .filter(conversation -> ownerId.equals(conversation.getOwnerId()))
                    .max(recencyComparator());
            if (latest.isPresent()) {
                return Optional.of(copyOf(latest.get()));
            }
            return Optional.of(copyOf(createConversation(ownerId)));
        }
    }

    @Override
    public boolean append(String conversationId, List<Message> messages) {
        if (conversationId == null || conversationId.isBlank()) {
            return false;
        }
        synchronized (appendLock(conversationId)) {
            Optional<ConversationLog> stored = readFromStorage(conversationId);
            if (stored.isEmpty()) {
                conversationCache.remove(conversationId);
                return false;
            }
            ConversationLog current = stored.get();
            if (messages == null || messages.isEmpty()) {
                return true;
            }

            List<Message> combined = new ArrayList<>(current.getMessages());
            combined.addAll(messages);
            ConversationLog updated = current.toBuilder()
                    .messages(combined)
                    .title(current.getTitle() != null ? current.getTitle() : deriveTitle(combined))
                    .updatedAt(clock.instant())
                    .build();

            writeToStorage(updated);
            conversationCache.put(conversationId, updated);
            log.debug("[Conversations] Appended {} messages to {} (total {})", messages.size(), conversationId,
                    combined.size());
            return true;
        }
    }

    @Override
    public boolean delete(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return false;
        }
        synchronized (appendLock(conversationId)) {
            boolean exists = Boolean.TRUE.equals(storagePort.exists(directory, fileName(conversationId)).join());
            conversationCache.remove(conversationId);
            if (!exists) {
                return false;
            }
            storagePort.deleteObject(directory, fileName(conversationId)).join();
            appendLocks.remove(conversationId);
            log.info("[Conversations] Deleted conversation {}", conversationId);
            return true;
        }
    }

    @Override
    public List<ConversationLog> listByOwner(String ownerId) {
        return conversationCache.values().stream()
                .filter(conversation -> ownerId != null && ownerId.equals(conversation.getOwnerId()))
                .sorted(recencyComparator().reversed())
                .map(this::copyOf)
                .toList();
    }

    @Override
    public List<ConversationLog> listAll(int offset, int limit) {
        return conversationCache.values().stream()
                .sorted(recencyComparator().reversed())
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .map(this::copyOf)
                .toList();
    }

    private ConversationLog createConversation(String ownerId) {
        Instant now = clock.instant();
        ConversationLog conversation = ConversationLog.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .messages(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
        synchronized (appendLock(conversation.getId())) {
            writeToStorage(conversation);
            conversationCache.put(conversation.getId(), conversation);
        }
        log.info("[Conversations] Created conversation {} for owner {}", conversation.getId(), ownerId);
        return conversation;
    }

    private boolean isKnownOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return false;
        }
        return personaPort.resolvePersona(ownerId).isPresent();
    }

    private Object appendLock(String conversationId) {
        return appendLocks.computeIfAbsent(conversationId, id -> new Object());
    }

    private Object ownerLock(String ownerId) {
        return ownerLocks.computeIfAbsent(ownerId, id -> new Object());
    }

    private Comparator<ConversationLog> recencyComparator() {
        return Comparator
                .comparing(ConversationLog::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(ConversationLog::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(ConversationLog::getId, Comparator.nullsFirst(Comparator.naturalOrder()));
    }

    private ConversationLog copyOf(ConversationLog conversation) {
        return conversation.toBuilder()
                .messages(new ArrayList<>(conversation.getMessages()))
                .build();
    }

    private String deriveTitle(List<Message> messages) {
        return messages.stream()
                .filter(Message::isUserMessage)
                .map(Message::textContent)
                .filter(text -> !text.isBlank())
                .findFirst()
                .map(text -> {
                    String singleLine = text.strip().replaceAll("\\s+", " ");
                    return singleLine.length() > TITLE_MAX_LEN
                            ? singleLine.substring(0, TITLE_MAX_LEN - 3) + "..."
                            : singleLine;
                })
                .orElse(null);
    }

    private String fileName(String conversationId) {
        return conversationId + JSON_EXTENSION;
    }

    // ==================== row codec ====================

    private void writeToStorage(ConversationLog conversation) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("id", conversation.getId());
        row.put("ownerId", conversation.getOwnerId());
        if (conversation.getTitle() != null) {
            row.put("title", conversation.getTitle());
        }
        row.put("createdAt", conversation.getCreatedAt() != null ? conversation.getCreatedAt().toString() : null);
        row.put("updatedAt", conversation.getUpdatedAt() != null ? conversation.getUpdatedAt().toString() : null);
        row.put("messages", historyCodec.encode(conversation.getMessages()));
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(row);
            storagePort.putTextAtomic(directory, fileName(conversation.getId()), json, false).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation " + conversation.getId(), e);
        }
    }

    private Optional<ConversationLog> readFromStorage(String conversationId) {
        String json = storagePort.getText(directory, fileName(conversationId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode row = objectMapper.readTree(json);
            if (row == null || !row.isObject()) {
                log.warn("[Conversations] Row {} is not a JSON object, ignoring", conversationId);
                return Optional.empty();
            }
            return Optional.of(parseRow(conversationId, row));
        } catch (JsonProcessingException e) {
            log.warn("[Conversations] Unreadable row {}: {}", conversationId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private ConversationLog parseRow(String conversationId, JsonNode row) {
        JsonNode messagesNode = row.get("messages");
        List<Message> messages;
        if (messagesNode == null || messagesNode.isNull()) {
            messages = new ArrayList<>();
        } else if (messagesNode.isTextual()) {
            messages = historyCodec.decode(messagesNode.asText());
        } else {
            messages = historyCodec.decode(messagesNode.toString());
        }

        Instant createdAt = parseInstant(readText(row, "createdAt", "created_at"));
        Instant updatedAt = parseInstant(readText(row, "updatedAt", "updated_at"));
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        return ConversationLog.builder()
                .id(conversationId)
                .ownerId(readText(row, "ownerId", "owner_id", "spy_id", "spyId"))
                .title(readText(row, "title"))
                .messages(new ArrayList<>(messages))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    private String readText(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && value.isValueNode()) {
                return value.asText();
            }
        }
        return null;
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("[Conversations] Unparseable timestamp: {}", value);
            return null;
        }
    }
}
