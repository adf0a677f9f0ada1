package me.golemcore.spychat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.spychat.adapter.inbound.web.dto.ChatResponseDto;
import me.golemcore.spychat.domain.model.ChatReply;
import me.golemcore.spychat.domain.model.ChatReplyStatus;
import me.golemcore.spychat.port.inbound.ChatPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Request/response chat. A turn blocks on the LLM, so it runs off the event
 * loop.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatPort chatPort;

    @PostMapping("/chat/{spyId}")
    public Mono<ResponseEntity<ChatResponseDto>> chat(@PathVariable String spyId,
            @RequestBody ChatRequest request) {
        String text = requireMessage(request);
        return Mono.fromCallable(() -> toResponse(chatPort.chat(spyId, text)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/chat/{spyId}/conversation/{conversationId}")
    public Mono<ResponseEntity<ChatResponseDto>> chatInConversation(@PathVariable String spyId,
            @PathVariable String conversationId, @RequestBody ChatRequest request) {
        String text = requireMessage(request);
        return Mono.fromCallable(() -> toResponse(chatPort.chatInConversation(spyId, conversationId, text)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/debrief/{spyId}/{missionId}")
    public Mono<ResponseEntity<ChatResponseDto>> debrief(@PathVariable String spyId, @PathVariable String missionId,
            @RequestBody ChatRequest request) {
        String text = requireMessage(request);
        return Mono.fromCallable(() -> toResponse(chatPort.debrief(spyId, missionId, text)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String requireMessage(ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        return request.getMessage();
    }

    private ResponseEntity<ChatResponseDto> toResponse(ChatReply reply) {
        if (reply.getStatus() == ChatReplyStatus.CONVERSATION_MISMATCH) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, reply.getResponse());
        }
        if (!reply.isCompleted()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, reply.getResponse());
        }
        return ResponseEntity.ok(ChatResponseDto.builder()
                .spyId(reply.getSpyId())
                .spyName(reply.getSpyName())
                .conversationId(reply.getConversationId())
                .message(reply.getMessage())
                .response(reply.getResponse())
                .toolCalls(reply.getToolCalls())
                .status(reply.getTurnStatus() != null ? reply.getTurnStatus().name() : null)
                .build());
    }
}
