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

package me.golemcore.spychat.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.LlmRequest;
import me.golemcore.spychat.domain.model.LlmResponse;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.ToolDefinition;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports any OpenAI-compatible endpoint (a local Ollama by default) and
 * Anthropic, selected by {@code spychat.llm.provider}. The model is created
 * lazily on the first call so the service starts without a reachable LLM.
 *
 * <p>
 * No retries happen here: a failed call surfaces as an exception and the tool
 * loop answers in character.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String EMPTY_TEXT = "(empty)";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final SpyChatProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jAdapter(SpyChatProperties properties, ObjectMapper objectMapper) {
        this(properties.getLlm(), objectMapper, null, ForkJoinPool.commonPool());
    }

    Langchain4jAdapter(SpyChatProperties.LlmProperties settings, ObjectMapper objectMapper, ChatModel chatModel,
            Executor executor) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @Override
    public String getProviderId() {
        return settings.getProvider();
    }

    @Override
    public String getCurrentModel() {
        return settings.getModel();
    }

    @Override
    public boolean isAvailable() {
        return PROVIDER_ANTHROPIC.equals(settings.getProvider())
                ? settings.getApiKey() != null && !settings.getApiKey().isBlank()
                : settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request.getTools());
            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
            }
            log.debug("[LLM] Calling {} with {} messages and {} tools", settings.getModel(), messages.size(),
                    tools.size());
            ChatResponse response = model().chat(chatRequest.build());
            return convertResponse(response);
        }, executor);
    }

    private ChatModel model() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                    log.info("[LLM] Initialized {} model: {}", settings.getProvider(), settings.getModel());
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equals(settings.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(settings.getModel())
                    .temperature(settings.getTemperature())
                    .maxTokens(settings.getMaxTokens())
                    .maxRetries(0)
                    .timeout(timeout);
            if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
                builder.baseUrl(settings.getBaseUrl());
            }
            return builder.build();
        }
        // Everything else speaks the OpenAI chat completions API
        var builder = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .maxRetries(0)
                .timeout(timeout);
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            if (msg.getRole() == null) {
                log.warn("[LLM] Skipping message without role: {}", msg.getId());
                continue;
            }
            String text = msg.textContent();
            switch (msg.getRole()) {
            case USER -> messages.add(UserMessage.from(nonBlank(text)));
            case ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(text.isBlank() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests));
                } else {
                    messages.add(AiMessage.from(nonBlank(text)));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(msg.getToolCallId(), msg.getToolName(),
                    nonBlank(text)));
            case SYSTEM -> messages.add(SystemMessage.from(nonBlank(text)));
            default -> log.warn("[LLM] Unknown message role: {}", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                Map<String, Object> paramSchema = entry.getValue() instanceof Map<?, ?>
                        ? (Map<String, Object>) entry.getValue()
                        : Map.of();
                schemaBuilder.addProperty(String.valueOf(entry.getKey()), toJsonSchemaElement(paramSchema));
            }
            List<String> required = tool.requiredArguments();
            if (!required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        Object type = paramSchema.get("type");
        String description = paramSchema.get("description") instanceof String d && !d.isBlank() ? d : null;
        String typeName = type instanceof String t ? t : "string";
        return switch (typeName) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.debug("[LLM] Response requested {} tool calls", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(settings.getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Map.of("input", json);
        }
    }

    private static String nonBlank(String text) {
        return text == null || text.isBlank() ? EMPTY_TEXT : text;
    }
}
