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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.ContentPart;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.MessageRole;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decodes and encodes stored conversation histories.
 *
 * <p>
 * Three generations of stored payloads are accepted:
 * <ol>
 * <li>the canonical envelope written by {@link #encode(List)}:
 * {@code {"format":"spychat-history","version":1,"messages":[...]}}</li>
 * <li>the flat legacy list {@code [{"role":..,"content":..,"tool_calls":..}]},
 * including OpenAI-style {@code tool_calls[].function}</li>
 * <li>the parts legacy list
 * {@code [{"kind":"request|response","parts":[{"part_kind":..}]}]}</li>
 * </ol>
 * A single object of either legacy shape is accepted too. Anything else,
 * including non-JSON text, degrades to one assistant message holding the raw
 * payload. Decoding never throws.
 *
 * <p>
 * Malformed list entries are skipped. Tool messages that do not reference an
 * earlier tool call are folded into assistant text so every decoded
 * {@link MessageRole#TOOL} message has a resolvable {@code toolCallId}.
 */
@Component
@Slf4j
public class HistoryCodec {

    public static final String FORMAT = "spychat-history";
    public static final int VERSION = 1;

    private static final String KEY_FORMAT = "format";
    private static final String KEY_VERSION = "version";
    private static final String KEY_MESSAGES = "messages";
    private static final String KEY_ID = "id";
    private static final String KEY_ROLE = "role";
    private static final String KEY_CONTENT = "content";
    private static final String KEY_PARTS = "parts";
    private static final String KEY_TYPE = "type";
    private static final String KEY_TEXT = "text";
    private static final String KEY_TOOL_CALLS = "tool_calls";
    private static final String KEY_TOOL_CALL_ID = "tool_call_id";
    private static final String KEY_TOOL_NAME = "tool_name";
    private static final String KEY_NAME = "name";
    private static final String KEY_ARGUMENTS = "arguments";
    private static final String KEY_TIMESTAMP = "timestamp";
    private static final String KEY_KIND = "kind";
    private static final String KEY_PART_KIND = "part_kind";
    private static final String KEY_ARGS = "args";
    private static final String KIND_REQUEST = "request";
    private static final String KIND_RESPONSE = "response";
    private static final int MAX_NESTED_DECODE_DEPTH = 2;
    private static final int MAX_ORPHAN_RESULT_LENGTH = 2000;

    // ISO-8601 with either 'T' or a space between date and time, offset optional
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public HistoryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ==================== encode ====================

    /**
     * Encodes messages in the canonical format. Null fields are omitted so that
     * {@code decode(encode(x))} reproduces {@code x} exactly.
     */
    public String encode(List<Message> messages) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(KEY_FORMAT, FORMAT);
        root.put(KEY_VERSION, VERSION);
        ArrayNode array = root.putArray(KEY_MESSAGES);
        if (messages != null) {
            for (Message message : messages) {
                if (message != null && message.getRole() != null) {
                    array.add(encodeMessage(message));
                }
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode conversation history", e);
        }
    }

    public byte[] encodeBytes(List<Message> messages) {
        return encode(messages).getBytes(StandardCharsets.UTF_8);
    }

    private ObjectNode encodeMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        if (message.getId() != null) {
            node.put(KEY_ID, message.getId());
        }
        node.put(KEY_ROLE, message.getRole().wireName());
        if (message.getContent() != null) {
            node.put(KEY_CONTENT, message.getContent());
        }
        if (message.getParts() != null) {
            ArrayNode parts = node.putArray(KEY_PARTS);
            for (ContentPart part : message.getParts()) {
                ObjectNode partNode = parts.addObject();
                if (part.getType() != null) {
                    partNode.put(KEY_TYPE, part.getType());
                }
                if (part.getText() != null) {
                    partNode.put(KEY_TEXT, part.getText());
                }
            }
        }
        if (message.getToolCalls() != null) {
            ArrayNode calls = node.putArray(KEY_TOOL_CALLS);
            for (Message.ToolCall call : message.getToolCalls()) {
                ObjectNode callNode = calls.addObject();
                if (call.getId() != null) {
                    callNode.put(KEY_ID, call.getId());
                }
                if (call.getName() != null) {
                    callNode.put(KEY_NAME, call.getName());
                }
                if (call.getArguments() != null) {
                    callNode.set(KEY_ARGUMENTS, objectMapper.valueToTree(call.getArguments()));
                }
            }
        }
        if (message.getToolCallId() != null) {
            node.put(KEY_TOOL_CALL_ID, message.getToolCallId());
        }
        if (message.getToolName() != null) {
            node.put(KEY_TOOL_NAME, message.getToolName());
        }
        if (message.getTimestamp() != null) {
            node.put(KEY_TIMESTAMP, message.getTimestamp().toString());
        }
        return node;
    }

    // ==================== decode ====================

    public List<Message> decode(byte[] payload) {
        if (payload == null) {
            return new ArrayList<>();
        }
        return decode(new String(payload, StandardCharsets.UTF_8));
    }

    /**
     * Decodes a stored payload of any known generation. Never throws.
     */
    public List<Message> decode(String payload) {
        return decode(payload, 0);
    }

    private List<Message> decode(String payload, int depth) {
        if (payload == null || payload.isBlank()) {
            return new ArrayList<>();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR
            log.debug("[HistoryCodec] Payload is not JSON, keeping as raw text");
            return rawText(payload);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return rawText(payload);
        }

        if (isCanonical(root)) {
            return enforceToolReferences(decodeFlatEntries(root.get(KEY_MESSAGES)));
        }

        if (root.isArray()) {
            if (root.isEmpty()) {
                return new ArrayList<>();
            }
            List<Message> flat = decodeFlatEntries(root);
            if (!flat.isEmpty()) {
                return enforceToolReferences(flat);
            }
            List<Message> parts = decodePartsEntries(root);
            if (!parts.isEmpty()) {
                return enforceToolReferences(parts);
            }
            log.warn("[HistoryCodec] No decodable entries in legacy list of {} items, keeping raw payload",
                    root.size());
            return rawText(payload);
        }

        if (root.isObject()) {
            if (root.has(KEY_ROLE)) {
                List<Message> single = decodeFlatEntry(root, 0);
                if (!single.isEmpty()) {
                    return enforceToolReferences(single);
                }
            }
            if (root.has(KEY_PARTS)) {
                List<Message> single = decodePartsEntry(root, 0);
                if (!single.isEmpty()) {
                    return enforceToolReferences(single);
                }
            }
            return rawText(payload);
        }

        // Double-encoded blob: a JSON string whose value is itself a stored history
        if (root.isTextual() && depth < MAX_NESTED_DECODE_DEPTH) {
            String inner = root.asText();
            if (looksLikeJsonContainer(inner)) {
                return decode(inner, depth + 1);
            }
        }

        return rawText(payload);
    }

    private boolean isCanonical(JsonNode root) {
        if (!root.isObject()) {
            return false;
        }
        JsonNode messages = root.get(KEY_MESSAGES);
        if (messages == null || !messages.isArray()) {
            return false;
        }
        return FORMAT.equals(textOrNull(root.get(KEY_FORMAT))) || root.has(KEY_VERSION);
    }

    private boolean looksLikeJsonContainer(String text) {
        String trimmed = text.trim();
        return trimmed.startsWith("[") || trimmed.startsWith("{");
    }

    private List<Message> rawText(String payload) {
        List<Message> result = new ArrayList<>();
        result.add(Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(payload)
                .build());
        return result;
    }

    // ==================== flat shape ====================

    private List<Message> decodeFlatEntries(JsonNode array) {
        List<Message> result = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : array) {
            result.addAll(decodeFlatEntry(entry, index));
            index++;
        }
        return result;
    }

    private List<Message> decodeFlatEntry(JsonNode entry, int index) {
        if (entry == null || !entry.isObject()) {
            return List.of();
        }
        MessageRole role = MessageRole.fromWireName(textOrNull(entry.get(KEY_ROLE)));
        if (role == null) {
            return List.of();
        }

        Message.MessageBuilder builder = Message.builder()
                .id(textOrNull(entry.get(KEY_ID)))
                .role(role)
                .timestamp(parseInstant(entry.get(KEY_TIMESTAMP)));

        JsonNode content = entry.get(KEY_CONTENT);
        if (content != null && content.isArray()) {
            builder.parts(decodeContentParts(content));
        } else if (content != null && !content.isNull()) {
            builder.content(content.isTextual() ? content.asText() : content.toString());
        }

        JsonNode parts = entry.get(KEY_PARTS);
        if (parts != null && parts.isArray()) {
            builder.parts(decodeContentParts(parts));
        }

        JsonNode toolCalls = firstPresent(entry, KEY_TOOL_CALLS, "toolCalls");
        if (toolCalls != null && toolCalls.isArray()) {
            builder.toolCalls(decodeToolCalls(toolCalls, index));
        }

        builder.toolCallId(textOrNull(firstPresent(entry, KEY_TOOL_CALL_ID, "toolCallId")));
        builder.toolName(textOrNull(firstPresent(entry, KEY_TOOL_NAME, "toolName", KEY_NAME)));
        return List.of(builder.build());
    }

    private List<ContentPart> decodeContentParts(JsonNode array) {
        List<ContentPart> parts = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isTextual()) {
                parts.add(ContentPart.text(element.asText()));
            } else if (element.isObject() && (element.has(KEY_TEXT) || element.has(KEY_TYPE))) {
                String type = textOrNull(element.get(KEY_TYPE));
                parts.add(new ContentPart(type != null ? type : ContentPart.TYPE_TEXT,
                        textOrNull(element.get(KEY_TEXT))));
            }
        }
        return parts;
    }

    private List<Message.ToolCall> decodeToolCalls(JsonNode array, int messageIndex) {
        List<Message.ToolCall> calls = new ArrayList<>();
        int callIndex = 0;
        for (JsonNode call : array) {
            if (!call.isObject()) {
                continue;
            }
            JsonNode function = call.get("function");
            JsonNode source = function != null && function.isObject() ? function : call;
            String name = textOrNull(source.get(KEY_NAME));
            if (name == null || name.isBlank()) {
                continue;
            }
            String id = textOrNull(call.get(KEY_ID));
            if (id == null || id.isBlank()) {
                id = syntheticCallId(messageIndex, callIndex);
            }
            JsonNode arguments = firstPresent(source, KEY_ARGUMENTS, KEY_ARGS);
            calls.add(Message.ToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(parseArguments(arguments))
                    .build());
            callIndex++;
        }
        return calls;
    }

    // ==================== parts shape ====================

    private List<Message> decodePartsEntries(JsonNode array) {
        List<Message> result = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : array) {
            result.addAll(decodePartsEntry(entry, index));
            index++;
        }
        return result;
    }

    private List<Message> decodePartsEntry(JsonNode entry, int index) {
        if (entry == null || !entry.isObject()) {
            return List.of();
        }
        JsonNode parts = entry.get(KEY_PARTS);
        if (parts == null || !parts.isArray()) {
            return List.of();
        }
        String kind = textOrNull(entry.get(KEY_KIND));
        Instant entryTimestamp = parseInstant(entry.get(KEY_TIMESTAMP));

        if (KIND_RESPONSE.equals(kind) || (kind == null && hasResponseParts(parts))) {
            return decodeResponseParts(parts, entryTimestamp, index);
        }
        return decodeRequestParts(parts, entryTimestamp);
    }

    private boolean hasResponseParts(JsonNode parts) {
        for (JsonNode part : parts) {
            String partKind = textOrNull(part.get(KEY_PART_KIND));
            if (KEY_TEXT.equals(partKind) || "tool-call".equals(partKind)) {
                return true;
            }
        }
        return false;
    }

    private List<Message> decodeRequestParts(JsonNode parts, Instant entryTimestamp) {
        List<Message> result = new ArrayList<>();
        for (JsonNode part : parts) {
            if (!part.isObject()) {
                continue;
            }
            String partKind = textOrNull(part.get(KEY_PART_KIND));
            if (partKind == null) {
                continue;
            }
            Instant timestamp = timestampOr(part, entryTimestamp);
            JsonNode content = part.get(KEY_CONTENT);
            switch (partKind) {
            case "system-prompt" -> result.add(Message.builder()
                    .role(MessageRole.SYSTEM)
                    .content(contentText(content))
                    .timestamp(timestamp)
                    .build());
            case "user-prompt" -> {
                Message.MessageBuilder builder = Message.builder()
                        .role(MessageRole.USER)
                        .timestamp(timestamp);
                if (content != null && content.isArray()) {
                    builder.parts(decodeContentParts(content));
                } else {
                    builder.content(contentText(content));
                }
                result.add(builder.build());
            }
            case "tool-return" -> result.add(Message.builder()
                    .role(MessageRole.TOOL)
                    .toolCallId(textOrNull(part.get(KEY_TOOL_CALL_ID)))
                    .toolName(textOrNull(part.get(KEY_TOOL_NAME)))
                    .content(contentText(content))
                    .timestamp(timestamp)
                    .build());
            case "retry-prompt" -> {
                String toolName = textOrNull(part.get(KEY_TOOL_NAME));
                String retryText = "Retry requested: " + contentText(content);
                if (toolName != null) {
                    result.add(Message.builder()
                            .role(MessageRole.TOOL)
                            .toolCallId(textOrNull(part.get(KEY_TOOL_CALL_ID)))
                            .toolName(toolName)
                            .content(retryText)
                            .timestamp(timestamp)
                            .build());
                } else {
                    result.add(Message.builder()
                            .role(MessageRole.USER)
                            .content(retryText)
                            .timestamp(timestamp)
                            .build());
                }
            }
            default -> log.debug("[HistoryCodec] Skipping request part of kind {}", partKind);
            }
        }
        return result;
    }

    private List<Message> decodeResponseParts(JsonNode parts, Instant entryTimestamp, int index) {
        StringBuilder text = new StringBuilder();
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        Instant timestamp = entryTimestamp;
        int callIndex = 0;

        for (JsonNode part : parts) {
            if (!part.isObject()) {
                continue;
            }
            String partKind = textOrNull(part.get(KEY_PART_KIND));
            if (timestamp == null) {
                timestamp = parseInstant(part.get(KEY_TIMESTAMP));
            }
            if (KEY_TEXT.equals(partKind)) {
                String value = contentText(part.get(KEY_CONTENT));
                if (!value.isEmpty()) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(value);
                }
            } else if ("tool-call".equals(partKind)) {
                String name = textOrNull(part.get(KEY_TOOL_NAME));
                if (name == null || name.isBlank()) {
                    continue;
                }
                String id = textOrNull(part.get(KEY_TOOL_CALL_ID));
                if (id == null || id.isBlank()) {
                    id = syntheticCallId(index, callIndex);
                }
                toolCalls.add(Message.ToolCall.builder()
                        .id(id)
                        .name(name)
                        .arguments(parseArguments(part.get(KEY_ARGS)))
                        .build());
                callIndex++;
            }
        }

        if (text.length() == 0 && toolCalls.isEmpty()) {
            return List.of();
        }
        return List.of(Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(text.length() > 0 ? text.toString() : null)
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .timestamp(timestamp)
                .build());
    }

    // ==================== tool references ====================

    private List<Message> enforceToolReferences(List<Message> messages) {
        Set<String> knownCallIds = new HashSet<>();
        List<Message> result = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    if (call.getId() != null) {
                        knownCallIds.add(call.getId());
                    }
                }
            }
            if (message.isToolMessage()) {
                String callId = message.getToolCallId();
                if (callId == null || callId.isBlank() || !knownCallIds.contains(callId)) {
                    result.add(foldOrphanedToolMessage(message));
                    continue;
                }
            }
            result.add(message);
        }
        return result;
    }

    private Message foldOrphanedToolMessage(Message toolMessage) {
        String toolName = toolMessage.getToolName() != null ? toolMessage.getToolName() : "unknown";
        String content = toolMessage.textContent();
        if (content.isEmpty()) {
            content = "<empty>";
        } else if (content.length() > MAX_ORPHAN_RESULT_LENGTH) {
            content = content.substring(0, MAX_ORPHAN_RESULT_LENGTH) + "...";
        }
        return Message.builder()
                .id(toolMessage.getId())
                .role(MessageRole.ASSISTANT)
                .content("[Tool: " + toolName + "]\n[Result: " + content + "]")
                .timestamp(toolMessage.getTimestamp())
                .build();
    }

    // ==================== helpers ====================

    private String syntheticCallId(int messageIndex, int callIndex) {
        return "legacy-call-" + messageIndex + "-" + callIndex;
    }

    private JsonNode firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return null;
    }

    private String contentText(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> texts = new ArrayList<>();
            for (JsonNode element : content) {
                if (element.isTextual()) {
                    texts.add(element.asText());
                } else if (element.isObject() && element.has(KEY_TEXT)) {
                    texts.add(element.get(KEY_TEXT).asText());
                } else {
                    texts.add(element.toString());
                }
            }
            return String.join("\n", texts);
        }
        return content.toString();
    }

    private Instant timestampOr(JsonNode part, Instant fallback) {
        Instant own = parseInstant(part.get(KEY_TIMESTAMP));
        return own != null ? own : fallback;
    }

    private Instant parseInstant(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        String text = node.asText();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("[HistoryCodec] Unparseable timestamp: {}", text);
            return null;
        }
    }

    private Map<String, Object> parseArguments(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode source = node;
        if (node.isTextual()) {
            String raw = node.asText();
            if (raw.isBlank()) {
                return new LinkedHashMap<>();
            }
            try {
                source = objectMapper.readTree(raw);
            } catch (JsonProcessingException e) {
                log.debug("[HistoryCodec] Tool arguments are not JSON: {}", e.getOriginalMessage());
                return new LinkedHashMap<>(Collections.singletonMap("input", raw));
            }
        }
        if (source != null && source.isObject()) {
            // Older parts payloads wrap arguments as {"args_json": "..."} or {"args_dict": {...}}
            if (source.size() == 1) {
                Iterator<String> names = source.fieldNames();
                String only = names.next();
                if ("args_dict".equals(only.toLowerCase(Locale.ROOT))) {
                    return parseArguments(source.get(only));
                }
                if ("args_json".equals(only.toLowerCase(Locale.ROOT))) {
                    return parseArguments(source.get(only));
                }
            }
            return objectMapper.convertValue(source, MAP_TYPE_REF);
        }
        return new LinkedHashMap<>();
    }
}
