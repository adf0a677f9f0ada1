package me.golemcore.spychat.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.spychat.domain.model.ChatEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketConnectionHandleTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WebSocketSession session;
    private WebSocketConnectionHandle handle;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("session-1");
        when(session.isOpen()).thenReturn(true);
        when(session.close(CloseStatus.NORMAL)).thenReturn(Mono.empty());
        handle = new WebSocketConnectionHandle(session, objectMapper);
    }

    @Test
    void shouldSerializeEnvelopesInSendOrder() {
        CompletableFuture<Void> first = handle.send(ChatEnvelope.system("Connected"));
        CompletableFuture<Void> second = handle.send(ChatEnvelope.builder()
                .type(ChatEnvelope.TYPE_RESPONSE)
                .spyId("spy-7")
                .toolCalls(0)
                .build());
        handle.complete();

        assertFalse(first.isCompletedExceptionally());
        assertFalse(second.isCompletedExceptionally());
        StepVerifier.create(handle.outbound().map(this::readTree))
                .expectNext(readTree("{\"type\":\"system\",\"content\":\"Connected\"}"))
                .expectNext(readTree("{\"type\":\"response\",\"spy_id\":\"spy-7\",\"tool_calls\":0}"))
                .verifyComplete();
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void shouldFailSendOnClosedSession() {
        when(session.isOpen()).thenReturn(false);

        CompletableFuture<Void> result = handle.send(ChatEnvelope.system("late"));

        assertTrue(result.isCompletedExceptionally());
        assertFalse(handle.isOpen());
    }

    @Test
    void shouldFailSendAfterOutboundCompleted() {
        handle.complete();

        assertTrue(handle.send(ChatEnvelope.system("late")).isCompletedExceptionally());
    }

    @Test
    void shouldCompleteOutboundAndCloseSession() {
        handle.close();

        StepVerifier.create(handle.outbound()).verifyComplete();
        verify(session).close(CloseStatus.NORMAL);
    }
}
