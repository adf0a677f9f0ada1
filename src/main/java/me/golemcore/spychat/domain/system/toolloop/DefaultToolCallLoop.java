package me.golemcore.spychat.domain.system.toolloop;

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

import me.golemcore.spychat.domain.component.ToolComponent;
import me.golemcore.spychat.domain.model.LlmRequest;
import me.golemcore.spychat.domain.model.LlmResponse;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.ToolDefinition;
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.TurnFailureReason;
import me.golemcore.spychat.domain.model.TurnOutcome;
import me.golemcore.spychat.domain.model.TurnRequest;
import me.golemcore.spychat.domain.model.TurnStatus;
import me.golemcore.spychat.domain.system.LlmErrorClassifier;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.infrastructure.i18n.MessageService;
import me.golemcore.spychat.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * States: DECIDING (one LLM call) leads either to RESPONDING (text answer,
 * turn DONE) or to INVOKING/AWAITING (tool calls run, results folded back) and
 * then DECIDING again. Guards:
 * <ul>
 * <li>a tool call whose required arguments are not explicitly named by the
 * user is refused; the spy asks which record is meant and the turn is DONE</li>
 * <li>at most {@code maxToolCalls} invocations per turn; a request that would
 * exceed it ends the turn FAILED</li>
 * <li>each LLM call is bounded by {@code llmTimeoutMs}; the whole turn by
 * {@code deadlineMs}</li>
 * <li>a tool that does not settle within {@code toolTimeoutMs} ends the turn
 * FAILED once its batch is recorded</li>
 * </ul>
 * Upstream failures are classified by {@link LlmErrorClassifier} and answered
 * in character.
 */
public class DefaultToolCallLoop implements ToolCallLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolCallLoop.class);

    private static final String MISSION_ID_ARGUMENT = "mission_id";
    private static final int TOOL_CALLS_CEILING = 3;

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final ToolInvocationPolicy policy;
    private final HistoryWriter historyWriter;
    private final MessageService messageService;
    private final SpyChatProperties.TurnProperties settings;
    private final Clock clock;

    public DefaultToolCallLoop(LlmPort llmPort, ToolExecutorPort toolExecutor, ToolInvocationPolicy policy,
            HistoryWriter historyWriter, MessageService messageService, SpyChatProperties.TurnProperties settings,
            Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.policy = policy;
        this.historyWriter = historyWriter;
        this.messageService = messageService;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public TurnOutcome run(TurnRequest request) {
        List<Message> produced = new ArrayList<>();
        Map<String, ToolComponent> tools = indexTools(request.getTools());
        List<ToolDefinition> definitions = tools.values().stream().map(ToolComponent::getDefinition).toList();
        String spyName = request.getPersona() != null ? request.getPersona().getName() : "";

        int maxToolCalls = Math.min(TOOL_CALLS_CEILING, Math.max(1, settings.getMaxToolCalls()));
        int toolCallsMade = 0;
        int llmCalls = 0;
        Instant deadline = clock.instant().plusMillis(settings.getDeadlineMs());

        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                log.warn("[ToolLoop] Turn deadline exceeded after {} LLM calls", llmCalls);
                return failed(produced, toolCallsMade, TurnFailureReason.DEADLINE_EXCEEDED,
                        messageService.getMessage("turn.deadline", spyName));
            }

            // 1) DECIDING
            LlmResponse response;
            try {
                response = llmPort.chat(buildRequest(request, produced, definitions))
                        .get(settings.getLlmTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("[ToolLoop] LLM call timed out after {}ms", settings.getLlmTimeoutMs());
                return upstreamFailure(produced, toolCallsMade, TurnFailureReason.UPSTREAM_UNAVAILABLE, spyName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return upstreamFailure(produced, toolCallsMade, TurnFailureReason.UPSTREAM_UNAVAILABLE, spyName);
            } catch (ExecutionException | RuntimeException e) { // NOSONAR - classified below
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                String code = LlmErrorClassifier.classifyFromThrowable(cause);
                log.warn("[ToolLoop] LLM call failed ({}): {}", code, cause.getMessage());
                return upstreamFailure(produced, toolCallsMade, LlmErrorClassifier.toFailureReason(code), spyName);
            }
            llmCalls++;

            // 2) RESPONDING
            if (response == null || !response.hasToolCalls()) {
                String text = response != null ? response.getContent() : null;
                if (text == null || text.isBlank()) {
                    text = messageService.getMessage("turn.empty", spyName);
                }
                historyWriter.appendFinalAssistantAnswer(produced, text);
                return TurnOutcome.builder()
                        .status(TurnStatus.DONE)
                        .responseText(text)
                        .toolCallsMade(toolCallsMade)
                        .newMessages(produced)
                        .build();
            }

            List<Message.ToolCall> calls = withIds(response.getToolCalls());

            // 3) Policy: every call must reference explicitly named records
            for (Message.ToolCall call : calls) {
                ToolComponent tool = tools.get(call.getName());
                if (tool == null) {
                    continue;
                }
                ToolInvocationPolicy.Decision decision = policy.evaluate(tool.getDefinition(), call,
                        request.getUserText());
                if (!decision.allowed()) {
                    log.info("[ToolLoop] Refused {}: {}", call.getName(), decision.reason());
                    String clarification = clarify(spyName, decision.argument());
                    historyWriter.appendFinalAssistantAnswer(produced, clarification);
                    return TurnOutcome.builder()
                            .status(TurnStatus.DONE)
                            .responseText(clarification)
                            .toolCallsMade(toolCallsMade)
                            .newMessages(produced)
                            .build();
                }
            }

            // 4) Bound
            if (toolCallsMade + calls.size() > maxToolCalls) {
                log.warn("[ToolLoop] Tool bound reached: {} made, {} more requested, max {}", toolCallsMade,
                        calls.size(), maxToolCalls);
                return failed(produced, toolCallsMade, TurnFailureReason.TOOL_BOUND_EXCEEDED,
                        messageService.getMessage("turn.tool-bound", spyName, toolCallsMade));
            }

            // 5) INVOKING / AWAITING
            historyWriter.appendAssistantToolCalls(produced, response, calls);
            boolean toolTimedOut = false;
            for (Message.ToolCall call : calls) {
                ToolComponent tool = tools.get(call.getName());
                ToolExecutionOutcome outcome;
                if (tool == null) {
                    outcome = ToolExecutionOutcome.synthetic(call, ToolFailureKind.INVALID_ARGUMENTS,
                            "Unknown tool: " + call.getName());
                } else {
                    try {
                        outcome = toolExecutor.execute(tool, call);
                    } catch (RuntimeException e) { // NOSONAR - reported as a tool error
                        outcome = ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                                "Tool execution failed: " + e.getMessage());
                    }
                }
                toolCallsMade++;
                historyWriter.appendToolResult(produced, outcome);
                if (outcome.toolResult() != null
                        && outcome.toolResult().getFailureKind() == ToolFailureKind.TIMEOUT) {
                    toolTimedOut = true;
                }
            }
            if (toolTimedOut) {
                log.warn("[ToolLoop] Tool timed out after {} invocation(s), ending turn", toolCallsMade);
                return upstreamFailure(produced, toolCallsMade, TurnFailureReason.UPSTREAM_UNAVAILABLE, spyName);
            }
        }
    }

    private LlmRequest buildRequest(TurnRequest request, List<Message> produced, List<ToolDefinition> definitions) {
        List<Message> messages = new ArrayList<>(request.getHistory());
        messages.addAll(produced);
        return LlmRequest.builder()
                .systemPrompt(request.getSystemPrompt())
                .messages(messages)
                .tools(new ArrayList<>(definitions))
                .build();
    }

    private Map<String, ToolComponent> indexTools(List<ToolComponent> tools) {
        Map<String, ToolComponent> indexed = new LinkedHashMap<>();
        if (tools != null) {
            for (ToolComponent tool : tools) {
                indexed.put(tool.getToolName(), tool);
            }
        }
        return indexed;
    }

    private List<Message.ToolCall> withIds(List<Message.ToolCall> calls) {
        List<Message.ToolCall> result = new ArrayList<>(calls.size());
        for (Message.ToolCall call : calls) {
            if (call.getId() != null && !call.getId().isBlank()) {
                result.add(call);
            } else {
                result.add(Message.ToolCall.builder()
                        .id("call_" + UUID.randomUUID().toString().replace("-", ""))
                        .name(call.getName())
                        .arguments(call.getArguments())
                        .build());
            }
        }
        return result;
    }

    private String clarify(String spyName, String argument) {
        if (argument == null || MISSION_ID_ARGUMENT.equals(argument)) {
            return messageService.getMessage("turn.clarify.mission", spyName);
        }
        return messageService.getMessage("turn.clarify.arguments", spyName, argument.replace('_', ' '));
    }

    private TurnOutcome upstreamFailure(List<Message> produced, int toolCallsMade, TurnFailureReason reason,
            String spyName) {
        String key = reason == TurnFailureReason.UPSTREAM_UNAVAILABLE
                ? "turn.upstream.unavailable"
                : "turn.upstream.error";
        return failed(produced, toolCallsMade, reason, messageService.getMessage(key, spyName));
    }

    private TurnOutcome failed(List<Message> produced, int toolCallsMade, TurnFailureReason reason, String text) {
        historyWriter.appendFinalAssistantAnswer(produced, text);
        return TurnOutcome.builder()
                .status(TurnStatus.FAILED)
                .responseText(text)
                .toolCallsMade(toolCallsMade)
                .newMessages(produced)
                .failureReason(reason)
                .build();
    }
}
