package me.golemcore.spychat.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.component.ToolComponent;
import me.golemcore.spychat.domain.model.ChatEnvelope;
import me.golemcore.spychat.domain.model.ChatReply;
import me.golemcore.spychat.domain.model.ChatReplyStatus;
import me.golemcore.spychat.domain.model.ConversationLog;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.ToolResult;
import me.golemcore.spychat.domain.model.TurnOutcome;
import me.golemcore.spychat.domain.model.TurnRequest;
import me.golemcore.spychat.domain.system.toolloop.ToolCallLoop;
import me.golemcore.spychat.domain.system.toolloop.ToolExecutionOutcome;
import me.golemcore.spychat.domain.system.toolloop.ToolExecutorPort;
import me.golemcore.spychat.infrastructure.i18n.MessageService;
import me.golemcore.spychat.port.inbound.ChatPort;
import me.golemcore.spychat.port.outbound.ConversationPort;
import me.golemcore.spychat.port.outbound.PersonaPort;
import me.golemcore.spychat.tools.MissionContextTool;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs one chat turn end to end.
 *
 * <p>
 * A turn holds its conversation's turn lock from the user append until the
 * loop's messages are appended, so two turns in the same conversation never
 * interleave. Locks come from a fixed stripe keyed by conversation id, so
 * their number does not grow with the conversation count. The response
 * envelope is broadcast to every connection watching the conversation after
 * the lock is released; a client that disconnected mid-turn does not affect
 * persistence.
 */
@Service
@Slf4j
public class ChatSessionService implements ChatPort {

    static final int TURN_LOCK_STRIPES = 64;

    private final PersonaPort personaPort;
    private final ConversationPort conversationPort;
    private final ToolCallLoop toolCallLoop;
    private final ToolExecutorPort toolExecutor;
    private final PromptComposer promptComposer;
    private final List<ToolComponent> tools;
    private final ConnectionRegistry connectionRegistry;
    private final MessageService messageService;
    private final Clock clock;
    private final ExecutorService turnExecutor;

    private final Object[] turnLocks = new Object[TURN_LOCK_STRIPES];

    public ChatSessionService(PersonaPort personaPort, ConversationPort conversationPort, ToolCallLoop toolCallLoop,
            ToolExecutorPort toolExecutor, PromptComposer promptComposer, List<ToolComponent> tools,
            ConnectionRegistry connectionRegistry, MessageService messageService, Clock clock,
            @Qualifier("turnExecutor") ExecutorService turnExecutor) {
        this.personaPort = personaPort;
        this.conversationPort = conversationPort;
        this.toolCallLoop = toolCallLoop;
        this.toolExecutor = toolExecutor;
        this.promptComposer = promptComposer;
        this.tools = List.copyOf(tools);
        this.connectionRegistry = connectionRegistry;
        this.messageService = messageService;
        this.clock = clock;
        this.turnExecutor = turnExecutor;
        for (int i = 0; i < turnLocks.length; i++) {
            turnLocks[i] = new Object();
        }
    }

    @Override
    public ChatReply chat(String spyId, String userText) {
        Optional<Persona> persona = personaPort.resolvePersona(spyId);
        if (persona.isEmpty()) {
            return personaNotFound(spyId, null, userText);
        }
        Optional<ConversationLog> conversation = conversationPort.getOrCreateForOwner(spyId);
        if (conversation.isEmpty()) {
            return personaNotFound(spyId, null, userText);
        }
        return runTurn(persona.get(), conversation.get().getId(), userText,
                promptComposer.compose(persona.get()));
    }

    @Override
    public ChatReply chatInConversation(String spyId, String conversationId, String userText) {
        Optional<Persona> persona = personaPort.resolvePersona(spyId);
        if (persona.isEmpty()) {
            return personaNotFound(spyId, conversationId, userText);
        }
        Optional<ConversationLog> conversation = conversationPort.get(conversationId);
        if (conversation.isEmpty()) {
            return ChatReply.rejected(ChatReplyStatus.CONVERSATION_NOT_FOUND, spyId, conversationId, userText,
                    messageService.getMessage("chat.conversation.not-found", conversationId));
        }
        if (!spyId.equals(conversation.get().getOwnerId())) {
            return ChatReply.rejected(ChatReplyStatus.CONVERSATION_MISMATCH, spyId, conversationId, userText,
                    messageService.getMessage("chat.conversation.mismatch", spyId, conversationId));
        }
        return runTurn(persona.get(), conversationId, userText, promptComposer.compose(persona.get()));
    }

    @Override
    public CompletableFuture<ChatReply> chatInConversationAsync(String spyId, String conversationId,
            String userText) {
        return CompletableFuture.supplyAsync(() -> chatInConversation(spyId, conversationId, userText),
                turnExecutor);
    }

    @Override
    public ChatReply debrief(String spyId, String missionId, String userText) {
        Optional<Persona> persona = personaPort.resolvePersona(spyId);
        if (persona.isEmpty()) {
            return personaNotFound(spyId, null, userText);
        }
        Optional<ConversationLog> conversation = conversationPort.getOrCreateForOwner(spyId);
        if (conversation.isEmpty()) {
            return personaNotFound(spyId, null, userText);
        }
        ToolResult briefing = fetchBriefing(missionId);
        log.info("[Chat] Debrief: spy={}, mission={}, briefing={}", spyId, missionId,
                briefing.isSuccess() ? "ok" : briefing.getFailureKind());
        return runTurn(persona.get(), conversation.get().getId(), userText,
                promptComposer.composeDebrief(persona.get(), missionId, briefing));
    }

    private ToolResult fetchBriefing(String missionId) {
        Optional<ToolComponent> missionTool = tools.stream()
                .filter(tool -> MissionContextTool.TOOL_NAME.equals(tool.getToolName()))
                .findFirst();
        if (missionTool.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Mission archive is not available");
        }
        Message.ToolCall call = Message.ToolCall.builder()
                .id("debrief-" + missionId)
                .name(MissionContextTool.TOOL_NAME)
                .arguments(Map.of(MissionContextTool.PARAM_MISSION_ID, missionId))
                .build();
        ToolExecutionOutcome outcome = toolExecutor.execute(missionTool.get(), call);
        return outcome.toolResult();
    }

    Object turnLock(String conversationId) {
        return turnLocks[Math.floorMod(conversationId.hashCode(), turnLocks.length)];
    }

    private ChatReply runTurn(Persona persona, String conversationId, String userText, String systemPrompt) {
        TurnOutcome outcome;
        synchronized (turnLock(conversationId)) {
            Message userMessage = Message.user(userText, clock.instant());
            if (!conversationPort.append(conversationId, List.of(userMessage))) {
                return ChatReply.rejected(ChatReplyStatus.CONVERSATION_NOT_FOUND, persona.getId(), conversationId,
                        userText, messageService.getMessage("chat.conversation.not-found", conversationId));
            }
            List<Message> history = conversationPort.getMessages(conversationId)
                    .map(ArrayList::new)
                    .orElseGet(() -> new ArrayList<>(List.of(userMessage)));

            log.debug("[Chat] Turn started: spy={}, conversation={}, history={}", persona.getId(), conversationId,
                    history.size());
            outcome = toolCallLoop.run(TurnRequest.builder()
                    .persona(persona)
                    .systemPrompt(systemPrompt)
                    .userText(userText)
                    .history(history)
                    .tools(tools)
                    .build());

            if (!conversationPort.append(conversationId, outcome.getNewMessages())) {
                log.warn("[Chat] Conversation {} disappeared before the turn was saved", conversationId);
            }
        }

        log.info("[Chat] Turn finished: spy={}, conversation={}, status={}, toolCalls={}", persona.getId(),
                conversationId, outcome.getStatus(), outcome.getToolCallsMade());

        ChatReply reply = ChatReply.builder()
                .status(ChatReplyStatus.COMPLETED)
                .spyId(persona.getId())
                .spyName(persona.getName())
                .conversationId(conversationId)
                .message(userText)
                .response(outcome.getResponseText())
                .toolCalls(outcome.getToolCallsMade())
                .turnStatus(outcome.getStatus())
                .build();
        connectionRegistry.broadcastToConversation(conversationId, toEnvelope(reply));
        return reply;
    }

    private ChatReply personaNotFound(String spyId, String conversationId, String userText) {
        return ChatReply.rejected(ChatReplyStatus.PERSONA_NOT_FOUND, spyId, conversationId, userText,
                messageService.getMessage("chat.persona.not-found", spyId));
    }

    static ChatEnvelope toEnvelope(ChatReply reply) {
        return ChatEnvelope.builder()
                .type(ChatEnvelope.TYPE_RESPONSE)
                .spyId(reply.getSpyId())
                .spyName(reply.getSpyName())
                .message(reply.getMessage())
                .response(reply.getResponse())
                .conversationId(reply.getConversationId())
                .toolCalls(reply.getToolCalls())
                .build();
    }
}
