package me.golemcore.spychat.domain.system.toolloop;

import me.golemcore.spychat.domain.component.ToolComponent;
import me.golemcore.spychat.domain.model.LlmRequest;
import me.golemcore.spychat.domain.model.LlmResponse;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.MessageRole;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.domain.model.TurnFailureReason;
import me.golemcore.spychat.domain.model.TurnOutcome;
import me.golemcore.spychat.domain.model.TurnRequest;
import me.golemcore.spychat.domain.model.TurnStatus;
import me.golemcore.spychat.domain.service.MissionContextCache;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.infrastructure.i18n.MessageService;
import me.golemcore.spychat.port.outbound.LlmPort;
import me.golemcore.spychat.port.outbound.MissionContextPort;
import me.golemcore.spychat.tools.MissionContextTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolCallLoopTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String TOOL = MissionContextTool.TOOL_NAME;

    private LlmPort llmPort;
    private MissionContextPort missionContextPort;
    private MissionContextTool missionTool;
    private SpyChatProperties.TurnProperties settings;
    private Clock clock;
    private DefaultToolCallLoop loop;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        missionContextPort = mock(MissionContextPort.class);
        when(missionContextPort.fetchMissionContext(anyString())).thenReturn(Optional.empty());
        missionTool = new MissionContextTool(missionContextPort);
        settings = new SpyChatProperties.TurnProperties();
        settings.setLlmTimeoutMs(2_000L);
        settings.setToolTimeoutMs(2_000L);
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        loop = newLoop(clock);
    }

    private DefaultToolCallLoop newLoop(Clock loopClock) {
        MissionContextCache cache = new MissionContextCache(clock, Duration.ZERO);
        return new DefaultToolCallLoop(llmPort, new CachingToolExecutor(cache, settings.getToolTimeoutMs()),
                new ExplicitReferencePolicy(), new DefaultHistoryWriter(clock), new MessageService(), settings,
                loopClock);
    }

    private TurnRequest request(String userText) {
        return request(userText, missionTool);
    }

    private TurnRequest request(String userText, ToolComponent tool) {
        List<Message> history = new ArrayList<>();
        history.add(Message.user(userText, NOW));
        return TurnRequest.builder()
                .persona(Persona.builder().id("spy-7").name("Natasha Volkova").codename("Nightingale").build())
                .systemPrompt("You are Natasha Volkova")
                .userText(userText)
                .history(history)
                .tools(List.of(tool))
                .build();
    }

    private static CompletableFuture<LlmResponse> text(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    private static CompletableFuture<LlmResponse> toolCall(String id, String name, Map<String, Object> args) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder().id(id).name(name).arguments(args).build()))
                .build());
    }

    private static CompletableFuture<LlmResponse> missionCall(String id, String missionId) {
        return toolCall(id, TOOL, Map.of(MissionContextTool.PARAM_MISSION_ID, missionId));
    }

    // ==================== plain answers ====================

    @Test
    void shouldReturnFinalAnswerWithoutTools() {
        when(llmPort.chat(any())).thenReturn(text("Who sent you?"));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals("Who sent you?", outcome.getResponseText());
        assertEquals(0, outcome.getToolCallsMade());
        assertEquals(1, outcome.getNewMessages().size());
        assertEquals(MessageRole.ASSISTANT, outcome.getNewMessages().get(0).getRole());
        assertNull(outcome.getFailureReason());
    }

    @Test
    void shouldSendSystemPromptHistoryAndToolDefinitions() {
        when(llmPort.chat(any())).thenReturn(text("ok"));

        loop.run(request("hello"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest sent = captor.getValue();
        assertEquals("You are Natasha Volkova", sent.getSystemPrompt());
        assertEquals(1, sent.getMessages().size());
        assertEquals(1, sent.getTools().size());
        assertEquals(TOOL, sent.getTools().get(0).getName());
    }

    @Test
    void shouldFallBackToSilenceOnEmptyAnswer() {
        when(llmPort.chat(any())).thenReturn(text("  "));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals("...Natasha Volkova looks at you in silence.", outcome.getResponseText());
    }

    // ==================== tool invocations ====================

    @Test
    void shouldInvokeToolAndFeedResultBack() {
        when(missionContextPort.fetchMissionContext("paris-63")).thenReturn(Optional.of("Dead drop at the Louvre."));
        when(llmPort.chat(any())).thenReturn(missionCall("c1", "paris-63"), text("The Louvre, as always."));

        TurnOutcome outcome = loop.run(request("What about mission paris-63?"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals(1, outcome.getToolCallsMade());
        List<Message> produced = outcome.getNewMessages();
        assertEquals(3, produced.size());
        assertTrue(produced.get(0).hasToolCalls());
        assertEquals(MessageRole.TOOL, produced.get(1).getRole());
        assertEquals("c1", produced.get(1).getToolCallId());
        assertEquals("Dead drop at the Louvre.", produced.get(1).getContent());
        assertEquals("The Louvre, as always.", produced.get(2).getContent());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        assertEquals(3, captor.getAllValues().get(1).getMessages().size());
    }

    @Test
    void shouldServeRepeatedFailedLookupFromCache() {
        when(llmPort.chat(any())).thenReturn(
                missionCall("c1", "atlas-9"),
                missionCall("c2", "atlas-9"),
                text("That file was never written."));

        TurnOutcome outcome = loop.run(request("Tell me about mission atlas-9"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals(2, outcome.getToolCallsMade());
        verify(missionContextPort, times(1)).fetchMissionContext("atlas-9");
        List<Message> toolMessages = outcome.getNewMessages().stream().filter(Message::isToolMessage).toList();
        assertEquals(2, toolMessages.size());
        for (Message toolMessage : toolMessages) {
            assertEquals("Error: No mission found with ID: atlas-9", toolMessage.getContent());
        }
        assertEquals(List.of("c1", "c2"), toolMessages.stream().map(Message::getToolCallId).toList());
    }

    @Test
    void shouldServeSameFailedLookupFromCacheInNextTurn() {
        when(llmPort.chat(any())).thenReturn(
                missionCall("c1", "atlas-9"),
                text("That file was never written."),
                missionCall("c2", "atlas-9"),
                text("That file was never written."));

        TurnOutcome first = loop.run(request("Tell me about mission atlas-9"));
        TurnOutcome second = loop.run(request("Tell me about mission atlas-9"));

        verify(missionContextPort, times(1)).fetchMissionContext("atlas-9");
        Message firstResult = first.getNewMessages().stream().filter(Message::isToolMessage).findFirst().orElseThrow();
        Message secondResult = second.getNewMessages().stream().filter(Message::isToolMessage).findFirst()
                .orElseThrow();
        assertEquals("Error: No mission found with ID: atlas-9", firstResult.getContent());
        assertEquals(firstResult.getContent(), secondResult.getContent());
        assertEquals(TurnStatus.DONE, second.getStatus());
        assertEquals(first.getResponseText(), second.getResponseText());
    }

    @Test
    void shouldFailTurnWhenToolNeverSettles() {
        settings.setToolTimeoutMs(200L);
        DefaultToolCallLoop timeoutLoop = newLoop(clock);
        ToolComponent stuckTool = mock(ToolComponent.class);
        when(stuckTool.getDefinition()).thenReturn(missionTool.getDefinition());
        when(stuckTool.getToolName()).thenReturn(TOOL);
        when(stuckTool.execute(any())).thenReturn(new CompletableFuture<>());
        when(llmPort.chat(any())).thenReturn(missionCall("c1", "atlas-9"), text("fine"));

        TurnOutcome outcome = timeoutLoop.run(request("mission atlas-9", stuckTool));

        assertEquals(TurnStatus.FAILED, outcome.getStatus());
        assertEquals(TurnFailureReason.UPSTREAM_UNAVAILABLE, outcome.getFailureReason());
        assertTrue(outcome.getResponseText().startsWith("Static on the line"));
        assertEquals(1, outcome.getToolCallsMade());
        verify(llmPort, times(1)).chat(any());
        assertEquals(3, outcome.getNewMessages().size());
        assertEquals("c1", outcome.getNewMessages().get(1).getToolCallId());
        assertEquals("Static on the line... my handler isn't answering right now. Try me again in a moment.",
                outcome.getNewMessages().get(2).getContent());
    }

    @Test
    void shouldStopAtToolBound() {
        when(missionContextPort.fetchMissionContext("atlas-9")).thenReturn(Optional.of("Berlin"));
        when(llmPort.chat(any())).thenReturn(
                missionCall("c1", "atlas-9"),
                missionCall("c2", "atlas-9"),
                missionCall("c3", "atlas-9"));

        TurnOutcome outcome = loop.run(request("mission atlas-9 please"));

        assertEquals(TurnStatus.FAILED, outcome.getStatus());
        assertEquals(TurnFailureReason.TOOL_BOUND_EXCEEDED, outcome.getFailureReason());
        assertEquals(2, outcome.getToolCallsMade());
        assertEquals(List.of("c1", "c2"), outcome.invocations().stream().map(Message.ToolCall::getId).toList());
        assertTrue(outcome.getResponseText().contains("2 requests"));
        verify(llmPort, times(3)).chat(any());
        Message last = outcome.getNewMessages().get(outcome.getNewMessages().size() - 1);
        assertEquals(MessageRole.ASSISTANT, last.getRole());
        assertFalse(last.hasToolCalls());
    }

    @Test
    void shouldRejectBatchThatWouldExceedBound() {
        settings.setMaxToolCalls(1);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .toolCalls(List.of(
                        Message.ToolCall.builder().id("a").name(TOOL)
                                .arguments(Map.of("mission_id", "atlas-9")).build(),
                        Message.ToolCall.builder().id("b").name(TOOL)
                                .arguments(Map.of("mission_id", "orion-2")).build()))
                .build()));

        TurnOutcome outcome = loop.run(request("compare atlas-9 with orion-2"));

        assertEquals(TurnFailureReason.TOOL_BOUND_EXCEEDED, outcome.getFailureReason());
        assertEquals(0, outcome.getToolCallsMade());
        assertTrue(outcome.invocations().isEmpty());
        verify(missionContextPort, never()).fetchMissionContext(anyString());
    }

    @Test
    void shouldReportUnknownToolAsError() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("x1", "launch_missiles", Map.of()),
                text("Forget I asked."));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals(1, outcome.getToolCallsMade());
        assertEquals("Error: Unknown tool: launch_missiles", outcome.getNewMessages().get(1).getContent());
    }

    @Test
    void shouldAssignIdsToCallsWithoutOne() {
        when(missionContextPort.fetchMissionContext("atlas-9")).thenReturn(Optional.of("Berlin"));
        when(llmPort.chat(any())).thenReturn(missionCall(null, "atlas-9"), text("Berlin."));

        TurnOutcome outcome = loop.run(request("mission atlas-9"));

        String callId = outcome.getNewMessages().get(0).getToolCalls().get(0).getId();
        assertTrue(callId.startsWith("call_"));
        assertEquals(callId, outcome.getNewMessages().get(1).getToolCallId());
    }

    // ==================== policy ====================

    @Test
    void shouldAskForMissionIdInsteadOfGuessing() {
        when(llmPort.chat(any())).thenReturn(missionCall("c1", "omega-1"));

        TurnOutcome outcome = loop.run(request("What was your last mission about?"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals(0, outcome.getToolCallsMade());
        assertEquals(1, outcome.getNewMessages().size());
        assertTrue(outcome.getResponseText().contains("mission ID"));
        verify(missionContextPort, never()).fetchMissionContext(anyString());
    }

    @Test
    void shouldRefusePlaceholderMissionId() {
        when(llmPort.chat(any())).thenReturn(missionCall("c1", "none"));

        TurnOutcome outcome = loop.run(request("Tell me about a mission"));

        assertEquals(TurnStatus.DONE, outcome.getStatus());
        assertEquals(0, outcome.getToolCallsMade());
        assertTrue(outcome.invocations().isEmpty());
        verify(missionContextPort, never()).fetchMissionContext(anyString());
    }

    // ==================== upstream failures ====================

    @Test
    void shouldFailAsUnavailableWhenLlmTimesOut() {
        settings.setLlmTimeoutMs(50L);
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnStatus.FAILED, outcome.getStatus());
        assertEquals(TurnFailureReason.UPSTREAM_UNAVAILABLE, outcome.getFailureReason());
        assertTrue(outcome.getResponseText().startsWith("Static on the line"));
        assertEquals(1, outcome.getNewMessages().size());
    }

    @Test
    void shouldFailAsUnavailableWhenConnectionRefused() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new ConnectException("refused")));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnFailureReason.UPSTREAM_UNAVAILABLE, outcome.getFailureReason());
    }

    @Test
    void shouldFailAsUpstreamErrorOnUnexpectedException() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bad")));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnFailureReason.UPSTREAM_ERROR, outcome.getFailureReason());
        assertTrue(outcome.getResponseText().startsWith("Something went wrong at headquarters"));
    }

    @Test
    void shouldFailAsUpstreamErrorWhenPortThrows() {
        when(llmPort.chat(any())).thenThrow(new IllegalArgumentException("bad request"));

        TurnOutcome outcome = loop.run(request("hello"));

        assertEquals(TurnFailureReason.UPSTREAM_ERROR, outcome.getFailureReason());
    }

    @Test
    void shouldKeepProducedMessagesWhenLaterCallFails() {
        when(missionContextPort.fetchMissionContext("atlas-9")).thenReturn(Optional.of("Berlin"));
        when(llmPort.chat(any())).thenReturn(
                missionCall("c1", "atlas-9"),
                CompletableFuture.failedFuture(new IllegalStateException("bad")));

        TurnOutcome outcome = loop.run(request("mission atlas-9"));

        assertEquals(TurnStatus.FAILED, outcome.getStatus());
        assertEquals(1, outcome.getToolCallsMade());
        assertEquals(3, outcome.getNewMessages().size());
    }

    // ==================== deadline ====================

    @Test
    void shouldStopWhenDeadlinePasses() {
        settings.setDeadlineMs(1_000L);
        Clock movingClock = mock(Clock.class);
        when(movingClock.instant()).thenReturn(NOW, NOW, NOW.plusSeconds(5));
        DefaultToolCallLoop deadlineLoop = newLoop(movingClock);
        when(missionContextPort.fetchMissionContext("atlas-9")).thenReturn(Optional.of("Berlin"));
        when(llmPort.chat(any())).thenReturn(missionCall("c1", "atlas-9"), text("never reached"));

        TurnOutcome outcome = deadlineLoop.run(request("mission atlas-9"));

        assertEquals(TurnStatus.FAILED, outcome.getStatus());
        assertEquals(TurnFailureReason.DEADLINE_EXCEEDED, outcome.getFailureReason());
        verify(llmPort, times(1)).chat(any());
    }
}
