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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event pushed to live clients. Serialized as
 * {@code {"type": "system"|"response"|"error", ...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEnvelope {

    public static final String TYPE_SYSTEM = "system";
    public static final String TYPE_RESPONSE = "response";
    public static final String TYPE_ERROR = "error";

    private String type;
    private String content;

    @JsonProperty("spy_id")
    private String spyId;

    @JsonProperty("spy_name")
    private String spyName;

    private String message;
    private String response;

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("tool_calls")
    private Integer toolCalls;

    public static ChatEnvelope system(String content) {
        return ChatEnvelope.builder().type(TYPE_SYSTEM).content(content).build();
    }

    public static ChatEnvelope error(String content) {
        return ChatEnvelope.builder().type(TYPE_ERROR).content(content).build();
    }
}
