package me.golemcore.spychat.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.ChatEnvelope;
import me.golemcore.spychat.domain.model.ChatReply;
import me.golemcore.spychat.domain.model.ConversationLog;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.domain.service.ConnectionRegistry;
import me.golemcore.spychat.infrastructure.i18n.MessageService;
import me.golemcore.spychat.port.inbound.ChatPort;
import me.golemcore.spychat.port.outbound.ConversationPort;
import me.golemcore.spychat.port.outbound.PersonaPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Reactive WebSocket handler for live spy chat.
 *
 * <p>
 * Paths: {@code /ws/chat/{spyId}} joins the spy's canonical conversation
 * (created on first use), {@code /ws/chat/{spyId}/conversation/{id}} joins an
 * explicit one. Client frames are {@code {"message": "..."}}. Turns run on the
 * turn executor; their response envelopes reach this socket through the
 * {@link ConnectionRegistry} conversation broadcast.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    static final String PATH_PREFIX = "/ws/chat/";
    private static final String CONVERSATION_SEGMENT = "conversation";
    private static final String KEY_MESSAGE = "message";

    private final ChatPort chatPort;
    private final PersonaPort personaPort;
    private final ConversationPort conversationPort;
    private final ConnectionRegistry connectionRegistry;
    private final MessageService messageService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Optional<ChatPath> path = ChatPath.parse(session.getHandshakeInfo().getUri().getPath());
        if (path.isEmpty()) {
            log.warn("[WebSocket] Connection rejected: unsupported path {}", session.getHandshakeInfo().getUri());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        String spyId = path.get().spyId();
        Optional<Persona> persona = personaPort.resolvePersona(spyId);
        if (persona.isEmpty()) {
            log.warn("[WebSocket] Connection rejected: unknown spy {}", spyId);
            return reject(session, messageService.getMessage("chat.persona.not-found", spyId));
        }

        String conversationId;
        String greeting;
        if (path.get().conversationId() == null) {
            Optional<ConversationLog> conversation = conversationPort.getOrCreateForOwner(spyId);
            if (conversation.isEmpty()) {
                return reject(session, messageService.getMessage("chat.persona.not-found", spyId));
            }
            conversationId = conversation.get().getId();
            greeting = messageService.getMessage("ws.connected", persona.get().getName(),
                    persona.get().getCodename());
        } else {
            conversationId = path.get().conversationId();
            Optional<ConversationLog> conversation = conversationPort.get(conversationId);
            if (conversation.isEmpty()) {
                return reject(session, messageService.getMessage("chat.conversation.not-found", conversationId));
            }
            if (!spyId.equals(conversation.get().getOwnerId())) {
                return reject(session, messageService.getMessage("chat.conversation.mismatch", spyId,
                        conversationId));
            }
            greeting = messageService.getMessage("ws.connected.conversation", persona.get().getName());
        }

        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(session, objectMapper);
        String connectionId = connectionRegistry.connect(handle, spyId, conversationId);
        log.info("[WebSocket] Connection established: spy={}, conversation={}, connectionId={}", spyId,
                conversationId, connectionId);
        connectionRegistry.sendTo(connectionId, ChatEnvelope.builder()
                .type(ChatEnvelope.TYPE_SYSTEM)
                .content(greeting)
                .spyId(spyId)
                .spyName(persona.get().getName())
                .conversationId(conversationId)
                .build());

        Mono<Void> input = session.receive()
                .doOnNext(wsMessage -> handleIncoming(wsMessage, connectionId, spyId, conversationId))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    connectionRegistry.disconnect(connectionId);
                    handle.complete();
                })
                .then();
        Mono<Void> output = session.send(handle.outbound().map(session::textMessage));
        return Mono.when(input, output);
    }

    private void handleIncoming(WebSocketMessage wsMessage, String connectionId, String spyId,
            String conversationId) {
        String text;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> json = objectMapper.readValue(wsMessage.getPayloadAsText(), Map.class);
            text = json != null && json.get(KEY_MESSAGE) instanceof String s ? s : null;
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[WebSocket] Failed to parse incoming frame on {}: {}", connectionId, e.getMessage());
            text = null;
        }
        if (text == null || text.isBlank()) {
            connectionRegistry.sendTo(connectionId,
                    ChatEnvelope.error(messageService.getMessage("ws.invalid-format")));
            return;
        }

        log.debug("[WebSocket] Message on {} for conversation {}", connectionId, conversationId);
        chatPort.chatInConversationAsync(spyId, conversationId, text)
                .whenComplete((reply, error) -> onTurnFinished(connectionId, reply, error));
    }

    private void onTurnFinished(String connectionId, ChatReply reply, Throwable error) {
        if (error != null) {
            log.error("[WebSocket] Turn failed on {}", connectionId, error);
            connectionRegistry.sendTo(connectionId,
                    ChatEnvelope.error(messageService.getMessage("ws.processing-failed")));
            return;
        }
        if (!reply.isCompleted()) {
            connectionRegistry.sendTo(connectionId, ChatEnvelope.error(reply.getResponse()));
        }
    }

    private Mono<Void> reject(WebSocketSession session, String reason) {
        String json;
        try {
            json = objectMapper.writeValueAsString(ChatEnvelope.error(reason));
        } catch (JsonProcessingException e) {
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        return session.send(Mono.just(session.textMessage(json)))
                .then(session.close(CloseStatus.POLICY_VIOLATION));
    }

    /**
     * Spy and optional conversation addressed by a chat socket path.
     */
    record ChatPath(String spyId, String conversationId) {

        static Optional<ChatPath> parse(String path) {
            if (path == null || !path.startsWith(PATH_PREFIX)) {
                return Optional.empty();
            }
            String[] segments = path.substring(PATH_PREFIX.length()).split("/");
            if (segments.length == 1 && !segments[0].isBlank()) {
                return Optional.of(new ChatPath(segments[0], null));
            }
            if (segments.length == 3 && !segments[0].isBlank() && CONVERSATION_SEGMENT.equals(segments[1])
                    && !segments[2].isBlank()) {
                return Optional.of(new ChatPath(segments[0], segments[2]));
            }
            return Optional.empty();
        }
    }
}
