package me.golemcore.spychat.adapter.inbound.web.controller;

import me.golemcore.spychat.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.spychat.domain.model.ChatReply;
import me.golemcore.spychat.domain.model.ChatReplyStatus;
import me.golemcore.spychat.domain.model.TurnStatus;
import me.golemcore.spychat.port.inbound.ChatPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private ChatPort chatPort;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        chatPort = mock(ChatPort.class);
        controller = new ChatController(chatPort);
    }

    private static ChatReply completed(String conversationId, String response) {
        return ChatReply.builder()
                .status(ChatReplyStatus.COMPLETED)
                .spyId("spy-7")
                .spyName("Natasha Volkova")
                .conversationId(conversationId)
                .message("hello")
                .response(response)
                .toolCalls(1)
                .turnStatus(TurnStatus.DONE)
                .build();
    }

    // ==================== chat ====================

    @Test
    void shouldChatWithSpy() {
        when(chatPort.chat("spy-7", "hello")).thenReturn(completed("conv-1", "Who sent you?"));

        StepVerifier.create(controller.chat("spy-7", new ChatRequest("hello")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Natasha Volkova", response.getBody().getSpyName());
                    assertEquals("conv-1", response.getBody().getConversationId());
                    assertEquals("Who sent you?", response.getBody().getResponse());
                    assertEquals(1, response.getBody().getToolCalls());
                    assertEquals("DONE", response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldChatInConversation() {
        when(chatPort.chatInConversation("spy-7", "conv-9", "hello")).thenReturn(completed("conv-9", "Go on."));

        StepVerifier.create(controller.chatInConversation("spy-7", "conv-9", new ChatRequest("hello")))
                .assertNext(response -> assertEquals("conv-9", response.getBody().getConversationId()))
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankMessage() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.chat("spy-7", new ChatRequest("  ")));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertThrows(ResponseStatusException.class, () -> controller.chat("spy-7", null));
        verify(chatPort, never()).chat(anyString(), anyString());
    }

    @Test
    void shouldMapUnknownSpyToNotFound() {
        when(chatPort.chat("spy-404", "hello")).thenReturn(ChatReply.rejected(ChatReplyStatus.PERSONA_NOT_FOUND,
                "spy-404", null, "hello", "Spy not found: spy-404"));

        StepVerifier.create(controller.chat("spy-404", new ChatRequest("hello")))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException rse = (ResponseStatusException) error;
                    assertEquals(HttpStatus.NOT_FOUND, rse.getStatusCode());
                    assertEquals("Spy not found: spy-404", rse.getReason());
                })
                .verify();
    }

    @Test
    void shouldMapConversationMismatchToForbidden() {
        when(chatPort.chatInConversation("spy-7", "conv-12", "hello")).thenReturn(ChatReply.rejected(
                ChatReplyStatus.CONVERSATION_MISMATCH, "spy-7", "conv-12", "hello",
                "Conversation conv-12 does not belong to spy spy-7"));

        StepVerifier.create(controller.chatInConversation("spy-7", "conv-12", new ChatRequest("hello")))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException rse = (ResponseStatusException) error;
                    assertEquals(HttpStatus.FORBIDDEN, rse.getStatusCode());
                    assertEquals("Conversation conv-12 does not belong to spy spy-7", rse.getReason());
                })
                .verify();
    }

    @Test
    void shouldMapMissingConversationToNotFound() {
        when(chatPort.chatInConversation("spy-7", "ghost", "hello")).thenReturn(ChatReply.rejected(
                ChatReplyStatus.CONVERSATION_NOT_FOUND, "spy-7", "ghost", "hello", "Conversation not found: ghost"));

        StepVerifier.create(controller.chatInConversation("spy-7", "ghost", new ChatRequest("hello")))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.NOT_FOUND,
                        ((ResponseStatusException) error).getStatusCode()))
                .verify();
    }

    // ==================== debrief ====================

    @Test
    void shouldDebriefSpyOnMission() {
        when(chatPort.debrief("spy-7", "atlas-9", "what happened in Prague?"))
                .thenReturn(completed("conv-1", "Prague went sideways."));

        StepVerifier.create(controller.debrief("spy-7", "atlas-9", new ChatRequest("what happened in Prague?")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("conv-1", response.getBody().getConversationId());
                    assertEquals("Prague went sideways.", response.getBody().getResponse());
                })
                .verifyComplete();
        verify(chatPort).debrief("spy-7", "atlas-9", "what happened in Prague?");
    }

    @Test
    void shouldMapDebriefOfUnknownSpyToNotFound() {
        when(chatPort.debrief("spy-404", "atlas-9", "report")).thenReturn(ChatReply.rejected(
                ChatReplyStatus.PERSONA_NOT_FOUND, "spy-404", null, "report", "Spy not found: spy-404"));

        StepVerifier.create(controller.debrief("spy-404", "atlas-9", new ChatRequest("report")))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.NOT_FOUND,
                        ((ResponseStatusException) error).getStatusCode()))
                .verify();
    }

    @Test
    void shouldRejectBlankDebriefMessage() {
        assertThrows(ResponseStatusException.class,
                () -> controller.debrief("spy-7", "atlas-9", new ChatRequest("")));
        verify(chatPort, never()).debrief(anyString(), anyString(), anyString());
    }
}
