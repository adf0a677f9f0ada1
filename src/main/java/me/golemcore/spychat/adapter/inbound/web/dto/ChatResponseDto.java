package me.golemcore.spychat.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one chat turn. {@code status} is {@code DONE} or {@code FAILED};
 * a failed turn still carries an in-character {@code response}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponseDto {
    private String spyId;
    private String spyName;
    private String conversationId;
    private String message;
    private String response;
    private int toolCalls;
    private String status;
}
