package me.golemcore.spychat.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    @Test
    void shouldPreferContentOverParts() {
        Message message = Message.builder()
                .role(MessageRole.ASSISTANT)
                .content("plain")
                .parts(List.of(ContentPart.text("ignored")))
                .build();

        assertEquals("plain", message.textContent());
    }

    @Test
    void shouldJoinTextParts() {
        Message message = Message.builder()
                .role(MessageRole.USER)
                .parts(List.of(ContentPart.text("first"), ContentPart.text(""), ContentPart.text("second")))
                .build();

        assertEquals("first\nsecond", message.textContent());
        assertEquals("", Message.builder().role(MessageRole.USER).build().textContent());
    }

    @Test
    void shouldExposeRoleChecks() {
        Message tool = Message.builder().role(MessageRole.TOOL).toolCallId("c1").build();

        assertTrue(tool.isToolMessage());
        assertFalse(tool.hasToolCalls());
        assertFalse(Message.builder().role(MessageRole.ASSISTANT).toolCalls(List.of()).build().hasToolCalls());
    }

    @Test
    void shouldParseWireRoles() {
        assertEquals("assistant", MessageRole.ASSISTANT.wireName());
        assertEquals(MessageRole.TOOL, MessageRole.fromWireName("TOOL"));
        assertNull(MessageRole.fromWireName("narrator"));
        assertNull(MessageRole.fromWireName(" "));
    }
}
