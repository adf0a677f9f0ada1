package me.golemcore.spychat.domain.service;

import me.golemcore.spychat.domain.model.ChatEnvelope;
import me.golemcore.spychat.domain.model.ConnectionState;
import me.golemcore.spychat.port.outbound.ConnectionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionRegistryTest {

    private static final String SPY_7 = "spy-7";
    private static final String CONV_1 = "conv-1";

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    // ==================== connect / disconnect ====================

    @Test
    void shouldRegisterOpenConnection() {
        RecordingHandle handle = new RecordingHandle();

        String id = registry.connect(handle, SPY_7, CONV_1);

        assertEquals(ConnectionState.OPEN, registry.get(id).orElseThrow().getState());
        assertEquals(1, registry.connectionCount());
        assertEquals(1, registry.personaBucketCount());
        assertEquals(1, registry.conversationBucketCount());
    }

    @Test
    void shouldDisconnectIdempotentlyAndDropEmptyBuckets() {
        String first = registry.connect(new RecordingHandle(), SPY_7, CONV_1);
        String second = registry.connect(new RecordingHandle(), SPY_7, CONV_1);

        registry.disconnect(first);
        registry.disconnect(first);

        assertEquals(1, registry.connectionCount());
        assertEquals(1, registry.conversationBucketCount());

        registry.disconnect(second);

        assertEquals(0, registry.connectionCount());
        assertEquals(0, registry.personaBucketCount());
        assertEquals(0, registry.conversationBucketCount());
    }

    @Test
    void shouldIgnoreDisconnectOfUnknownConnection() {
        registry.disconnect("unknown");

        assertEquals(0, registry.connectionCount());
    }

    @Test
    void shouldNotIndexBlankKeys() {
        registry.connect(new RecordingHandle(), SPY_7, " ");

        assertEquals(0, registry.conversationBucketCount());
        assertEquals(1, registry.personaBucketCount());
    }

    // ==================== bindConversation ====================

    @Test
    void shouldMoveConnectionBetweenConversations() {
        RecordingHandle handle = new RecordingHandle();
        String id = registry.connect(handle, SPY_7, CONV_1);

        assertTrue(registry.bindConversation(id, "conv-2"));

        assertEquals(0, registry.broadcastToConversation(CONV_1, ChatEnvelope.system("old")));
        assertEquals(1, registry.broadcastToConversation("conv-2", ChatEnvelope.system("new")));
        assertEquals(List.of("new"), handle.contents());
    }

    @Test
    void shouldRefuseToBindClosedConnection() {
        String id = registry.connect(new RecordingHandle(), SPY_7, null);
        registry.disconnect(id);

        assertFalse(registry.bindConversation(id, CONV_1));
        assertFalse(registry.bindConversation("unknown", CONV_1));
    }

    // ==================== send / broadcast ====================

    @Test
    void shouldSendToSingleConnection() {
        RecordingHandle target = new RecordingHandle();
        RecordingHandle other = new RecordingHandle();
        String id = registry.connect(target, SPY_7, CONV_1);
        registry.connect(other, SPY_7, CONV_1);

        registry.sendTo(id, ChatEnvelope.system("hello"));

        assertEquals(List.of("hello"), target.contents());
        assertTrue(other.contents().isEmpty());
    }

    @Test
    void shouldSkipSendToClosedConnection() {
        ConnectionHandle handle = mock(ConnectionHandle.class);
        when(handle.isOpen()).thenReturn(true);
        String id = registry.connect(handle, SPY_7, CONV_1);
        registry.disconnect(id);

        registry.sendTo(id, ChatEnvelope.system("late"));

        verify(handle, never()).send(any());
    }

    @Test
    void shouldBroadcastToEveryConnectionOfConversation() {
        RecordingHandle a = new RecordingHandle();
        RecordingHandle b = new RecordingHandle();
        RecordingHandle elsewhere = new RecordingHandle();
        registry.connect(a, SPY_7, CONV_1);
        registry.connect(b, SPY_7, CONV_1);
        registry.connect(elsewhere, SPY_7, "conv-2");

        int delivered = registry.broadcastToConversation(CONV_1, ChatEnvelope.system("reply"));

        assertEquals(2, delivered);
        assertEquals(List.of("reply"), a.contents());
        assertEquals(List.of("reply"), b.contents());
        assertTrue(elsewhere.contents().isEmpty());
    }

    @Test
    void shouldBroadcastToPersonaAndEveryone() {
        RecordingHandle spy7 = new RecordingHandle();
        RecordingHandle spy12 = new RecordingHandle();
        registry.connect(spy7, SPY_7, CONV_1);
        registry.connect(spy12, "spy-12", "conv-2");

        assertEquals(1, registry.broadcastToPersona(SPY_7, ChatEnvelope.system("only 7")));
        assertEquals(2, registry.broadcast(ChatEnvelope.system("all")));

        assertEquals(List.of("only 7", "all"), spy7.contents());
        assertEquals(List.of("all"), spy12.contents());
    }

    @Test
    void shouldCompleteBroadcastWhenConnectionDisconnectsMidway() {
        RecordingHandle second = new RecordingHandle();
        RecordingHandle first = new RecordingHandle();
        registry.connect(first, SPY_7, CONV_1);
        String secondId = registry.connect(second, SPY_7, CONV_1);
        first.onSend(envelope -> registry.disconnect(secondId));

        int delivered = registry.broadcastToConversation(CONV_1, ChatEnvelope.system("reply"));

        assertEquals(2, delivered);
        assertEquals(List.of("reply"), second.contents());
        assertEquals(1, registry.connectionCount());
    }

    @Test
    void shouldContinueFanOutWhenOneClientThrows() {
        ConnectionHandle broken = mock(ConnectionHandle.class);
        when(broken.isOpen()).thenReturn(true);
        when(broken.send(any())).thenThrow(new IllegalStateException("socket gone"));
        RecordingHandle healthy = new RecordingHandle();
        registry.connect(broken, SPY_7, CONV_1);
        registry.connect(healthy, SPY_7, CONV_1);

        int delivered = registry.broadcastToConversation(CONV_1, ChatEnvelope.system("reply"));

        assertEquals(1, delivered);
        assertEquals(List.of("reply"), healthy.contents());
    }

    @Test
    void shouldSkipTransportsThatAreAlreadyClosed() {
        RecordingHandle closed = new RecordingHandle();
        closed.close();
        registry.connect(closed, SPY_7, CONV_1);

        assertEquals(0, registry.broadcastToConversation(CONV_1, ChatEnvelope.system("reply")));
    }

    @Test
    void shouldDeliverNothingForUnknownConversation() {
        assertEquals(0, registry.broadcastToConversation("nobody", ChatEnvelope.system("x")));
        assertEquals(0, registry.broadcastToConversation(null, ChatEnvelope.system("x")));
    }

    private static final class RecordingHandle implements ConnectionHandle {

        private final List<ChatEnvelope> sent = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;
        private volatile Consumer<ChatEnvelope> sendHook = envelope -> {
        };

        @Override
        public CompletableFuture<Void> send(ChatEnvelope envelope) {
            sent.add(envelope);
            sendHook.accept(envelope);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        void onSend(Consumer<ChatEnvelope> hook) {
            this.sendHook = hook;
        }

        List<String> contents() {
            return sent.stream().map(ChatEnvelope::getContent).toList();
        }
    }
}
