package me.golemcore.spychat.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.ChatEnvelope;
import me.golemcore.spychat.port.outbound.ConnectionHandle;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.CompletableFuture;

/**
 * {@link ConnectionHandle} over a reactive WebSocket session. Outgoing frames
 * go through a single unicast sink so sends from different turn threads are
 * serialized onto one outbound stream.
 */
@Slf4j
public class WebSocketConnectionHandle implements ConnectionHandle {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

    public WebSocketConnectionHandle(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    /**
     * Serialized frames to write to the session.
     */
    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    @Override
    public CompletableFuture<Void> send(ChatEnvelope envelope) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Session closed: " + session.getId()));
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(json);
        }
        if (result.isFailure()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Send rejected on " + session.getId() + ": " + result));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        complete();
        session.close(CloseStatus.NORMAL).subscribe(
                unused -> {
                },
                error -> log.debug("[WebSocket] Close failed for {}: {}", session.getId(), error.getMessage()));
    }

    /**
     * Ends the outbound stream once the inbound side is done.
     */
    public void complete() {
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
    }
}
