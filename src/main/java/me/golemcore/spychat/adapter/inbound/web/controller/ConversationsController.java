package me.golemcore.spychat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.adapter.inbound.web.dto.ConversationDetailDto;
import me.golemcore.spychat.adapter.inbound.web.dto.ConversationSummaryDto;
import me.golemcore.spychat.adapter.inbound.web.dto.CreateConversationRequest;
import me.golemcore.spychat.adapter.inbound.web.dto.CreateConversationResponse;
import me.golemcore.spychat.domain.model.ConversationLog;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.port.outbound.ConversationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Conversation browser and management endpoints.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationsController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ConversationPort conversationPort;

    @PostMapping
    public Mono<ResponseEntity<CreateConversationResponse>> createConversation(
            @RequestBody CreateConversationRequest request) {
        if (request == null || request.getSpyId() == null || request.getSpyId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "spyId is required");
        }
        String conversationId = conversationPort.create(request.getSpyId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Spy not found"));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED)
                .body(CreateConversationResponse.builder()
                        .spyId(request.getSpyId())
                        .conversationId(conversationId)
                        .build()));
    }

    @GetMapping
    public Mono<ResponseEntity<List<ConversationSummaryDto>>> listConversations(
            @RequestParam(required = false) String spyId,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {
        int normalizedOffset = Math.max(0, offset);
        int normalizedLimit = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        List<ConversationLog> conversations = spyId != null && !spyId.isBlank()
                ? conversationPort.listByOwner(spyId).stream()
                        .skip(normalizedOffset)
                        .limit(normalizedLimit)
                        .toList()
                : conversationPort.listAll(normalizedOffset, normalizedLimit);
        return Mono.just(ResponseEntity.ok(conversations.stream().map(this::toSummary).toList()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ConversationDetailDto>> getConversation(@PathVariable String id) {
        ConversationLog conversation = conversationPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
        return Mono.just(ResponseEntity.ok(toDetail(conversation)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteConversation(@PathVariable String id) {
        if (!conversationPort.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found");
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private ConversationSummaryDto toSummary(ConversationLog conversation) {
        return ConversationSummaryDto.builder()
                .id(conversation.getId())
                .spyId(conversation.getOwnerId())
                .title(conversation.getTitle())
                .messageCount(conversation.messageCount())
                .createdAt(conversation.getCreatedAt() != null ? conversation.getCreatedAt().toString() : null)
                .updatedAt(conversation.getUpdatedAt() != null ? conversation.getUpdatedAt().toString() : null)
                .build();
    }

    private ConversationDetailDto toDetail(ConversationLog conversation) {
        List<ConversationDetailDto.MessageDto> messages = conversation.getMessages() != null
                ? conversation.getMessages().stream().map(this::toMessageDto).toList()
                : List.of();
        return ConversationDetailDto.builder()
                .id(conversation.getId())
                .spyId(conversation.getOwnerId())
                .title(conversation.getTitle())
                .createdAt(conversation.getCreatedAt() != null ? conversation.getCreatedAt().toString() : null)
                .updatedAt(conversation.getUpdatedAt() != null ? conversation.getUpdatedAt().toString() : null)
                .messages(messages)
                .build();
    }

    private ConversationDetailDto.MessageDto toMessageDto(Message message) {
        List<ConversationDetailDto.ToolCallDto> toolCalls = message.hasToolCalls()
                ? message.getToolCalls().stream()
                        .map(call -> ConversationDetailDto.ToolCallDto.builder()
                                .id(call.getId())
                                .name(call.getName())
                                .arguments(call.getArguments())
                                .build())
                        .toList()
                : null;
        return ConversationDetailDto.MessageDto.builder()
                .id(message.getId())
                .role(message.getRole() != null ? message.getRole().wireName() : null)
                .content(message.textContent())
                .timestamp(message.getTimestamp() != null ? message.getTimestamp().toString() : null)
                .toolCallId(message.getToolCallId())
                .toolName(message.getToolName())
                .toolCalls(toolCalls)
                .build();
    }
}
