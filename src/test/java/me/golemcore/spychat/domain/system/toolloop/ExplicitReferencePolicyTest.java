package me.golemcore.spychat.domain.system.toolloop;

import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExplicitReferencePolicyTest {

    private static final ToolDefinition MISSION_TOOL = ToolDefinition.builder()
            .name("get_mission_context")
            .inputSchema(Map.of(
                    "type", "object",
                    "properties", Map.of("mission_id", Map.of("type", "string")),
                    "required", List.of("mission_id")))
            .build();

    private final ExplicitReferencePolicy policy = new ExplicitReferencePolicy();

    private static Message.ToolCall call(Map<String, Object> arguments) {
        return Message.ToolCall.builder().id("c1").name("get_mission_context").arguments(arguments).build();
    }

    @Test
    void shouldAllowIdWrittenByUser() {
        ToolInvocationPolicy.Decision decision = policy.evaluate(MISSION_TOOL,
                call(Map.of("mission_id", "atlas-9")), "Tell me about mission atlas-9.");

        assertTrue(decision.allowed());
    }

    @Test
    void shouldMatchIgnoringCase() {
        assertTrue(policy.evaluate(MISSION_TOOL, call(Map.of("mission_id", "ATLAS-9")),
                "what happened on atlas-9?").allowed());
    }

    @Test
    void shouldDenyInventedId() {
        ToolInvocationPolicy.Decision decision = policy.evaluate(MISSION_TOOL,
                call(Map.of("mission_id", "omega-1")), "Tell me about your latest mission");

        assertFalse(decision.allowed());
        assertEquals("mission_id", decision.argument());
    }

    @Test
    void shouldDenyPartialTokenMatch() {
        assertFalse(policy.evaluate(MISSION_TOOL, call(Map.of("mission_id", "atlas")),
                "Tell me about atlas-9").allowed());
        assertFalse(policy.evaluate(MISSION_TOOL, call(Map.of("mission_id", "7")),
                "spy 17 reporting").allowed());
    }

    @Test
    void shouldDenyPlaceholdersAndMissingArguments() {
        assertFalse(policy.evaluate(MISSION_TOOL, call(Map.of("mission_id", "not specified")),
                "mission not specified").allowed());
        assertFalse(policy.evaluate(MISSION_TOOL, call(Map.of()), "mission atlas-9").allowed());
        assertFalse(policy.evaluate(MISSION_TOOL, call(null), "mission atlas-9").allowed());
        Map<String, Object> nullValue = new HashMap<>();
        nullValue.put("mission_id", null);
        assertFalse(policy.evaluate(MISSION_TOOL, call(nullValue), "mission atlas-9").allowed());
    }

    @Test
    void shouldAllowToolsWithoutRequiredArguments() {
        ToolDefinition free = ToolDefinition.builder().name("time").inputSchema(Map.of("type", "object")).build();

        assertTrue(policy.evaluate(free, call(Map.of()), "hello").allowed());
    }

    @Test
    void shouldTreatRegexCharactersLiterally() {
        assertTrue(ExplicitReferencePolicy.mentions("file a.b please", "a.b"));
        assertFalse(ExplicitReferencePolicy.mentions("file axb please", "a.b"));
        assertFalse(ExplicitReferencePolicy.mentions(null, "a"));
    }
}
