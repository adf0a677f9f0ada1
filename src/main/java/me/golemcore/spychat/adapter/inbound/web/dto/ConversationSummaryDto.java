package me.golemcore.spychat.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummaryDto {
    private String id;
    private String spyId;
    private String title;
    private int messageCount;
    private String createdAt;
    private String updatedAt;
}
