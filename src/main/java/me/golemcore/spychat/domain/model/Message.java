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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Represents a single message in a spy conversation. Body is either plain text
 * ({@link #content}) or an ordered list of {@link ContentPart}s ({@link #parts}).
 *
 * <p>
 * A {@link MessageRole#TOOL} message always carries a non-empty
 * {@link #toolCallId} referencing an earlier assistant {@link ToolCall}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;
    private MessageRole role;
    private String content;
    private List<ContentPart> parts;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Instant timestamp;

    public boolean isUserMessage() {
        return role == MessageRole.USER;
    }

    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    public boolean isToolMessage() {
        return role == MessageRole.TOOL;
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Returns the message body as text, joining parts with newlines when the body
     * is multi-part.
     */
    public String textContent() {
        if (content != null) {
            return content;
        }
        if (parts == null || parts.isEmpty()) {
            return "";
        }
        return parts.stream()
                .map(ContentPart::getText)
                .filter(text -> text != null && !text.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    public static Message user(String content, Instant timestamp) {
        return Message.builder()
                .role(MessageRole.USER)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static Message assistant(String content, Instant timestamp) {
        return Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    /**
     * A tool invocation requested by the LLM.
     */
    /**
     * A tool invocation requested by the LLM. Argument values are held in the
     * types a JSON round trip yields: {@code Integer} or {@code Long} by
     * magnitude, {@code Double}, {@code String}, {@code Boolean}, lists and
     * string-keyed maps.
     */
    @Data
    @NoArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;

        @Builder
        public ToolCall(String id, String name, Map<String, Object> arguments) {
            this.id = id;
            this.name = name;
            this.arguments = normalizeArguments(arguments);
        }

        public void setArguments(Map<String, Object> arguments) {
            this.arguments = normalizeArguments(arguments);
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> normalizeArguments(Map<String, Object> arguments) {
            return arguments != null ? (Map<String, Object>) normalizeValue(arguments) : null;
        }

        private static Object normalizeValue(Object value) {
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> normalized = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    normalized.put(String.valueOf(entry.getKey()), normalizeValue(entry.getValue()));
                }
                return normalized;
            }
            if (value instanceof Collection<?> collection) {
                List<Object> normalized = new ArrayList<>(collection.size());
                for (Object element : collection) {
                    normalized.add(normalizeValue(element));
                }
                return normalized;
            }
            if (value instanceof Byte || value instanceof Short) {
                return ((Number) value).intValue();
            }
            if (value instanceof Long longValue) {
                return longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE
                        ? (Object) longValue.intValue()
                        : longValue;
            }
            if (value instanceof BigInteger bigInteger) {
                if (bigInteger.bitLength() < Integer.SIZE) {
                    return bigInteger.intValue();
                }
                return bigInteger.bitLength() < Long.SIZE ? (Object) bigInteger.longValue() : bigInteger;
            }
            if (value instanceof Float floatValue) {
                return Double.valueOf(floatValue.toString());
            }
            if (value instanceof BigDecimal bigDecimal) {
                return bigDecimal.doubleValue();
            }
            if (value instanceof Character character) {
                return character.toString();
            }
            return value;
        }
    }
}
