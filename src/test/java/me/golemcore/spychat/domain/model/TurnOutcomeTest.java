package me.golemcore.spychat.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnOutcomeTest {

    private static Message.ToolCall call(String id) {
        return Message.ToolCall.builder()
                .id(id)
                .name("get_mission_context")
                .arguments(Map.of("mission_id", "atlas-9"))
                .build();
    }

    @Test
    void shouldListInvocationsInOrder() {
        TurnOutcome outcome = TurnOutcome.builder()
                .status(TurnStatus.DONE)
                .newMessages(List.of(
                        Message.builder().role(MessageRole.ASSISTANT).toolCalls(List.of(call("c1"), call("c2")))
                                .build(),
                        Message.builder().role(MessageRole.TOOL).toolCallId("c1").content("Berlin").build(),
                        Message.builder().role(MessageRole.TOOL).toolCallId("c2").content("Berlin").build(),
                        Message.builder().role(MessageRole.ASSISTANT).toolCalls(List.of(call("c3"))).build(),
                        Message.builder().role(MessageRole.TOOL).toolCallId("c3").content("Berlin").build(),
                        Message.assistant("The drop is in Berlin.", null)))
                .build();

        assertEquals(List.of("c1", "c2", "c3"), outcome.invocations().stream().map(Message.ToolCall::getId).toList());
        assertFalse(outcome.isFailed());
    }

    @Test
    void shouldHaveNoInvocationsWithoutMessages() {
        TurnOutcome outcome = TurnOutcome.builder().status(TurnStatus.FAILED).newMessages(null).build();

        assertTrue(outcome.invocations().isEmpty());
        assertTrue(outcome.isFailed());
    }
}
