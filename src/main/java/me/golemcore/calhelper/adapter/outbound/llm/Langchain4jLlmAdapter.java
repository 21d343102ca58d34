package me.golemcore.calhelper.adapter.outbound.llm;

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
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.CapabilityDefinition;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.domain.model.LlmRequest;
import me.golemcore.calhelper.domain.model.LlmResponse;
import me.golemcore.calhelper.domain.model.Message;
import me.golemcore.calhelper.domain.model.MessageKind;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Language-model gateway using the langchain4j OpenAI chat model.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Function calling: capability definitions become tool specifications,
 * invocation requests and results become assistant tool calls and tool
 * results</li>
 * <li>Consecutive invocation requests of one round are sent as a single
 * assistant message</li>
 * <li>Automatic retry with exponential backoff for rate limits (provider
 * retry is disabled)</li>
 * </ul>
 *
 * <p>
 * Configuration via {@code calhelper.llm.*}. The adapter is stateless per call.
 */
@Component
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CalHelperProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;
    private long initialBackoffMs = INITIAL_BACKOFF_MS;

    public Langchain4jLlmAdapter(CalHelperProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    /**
     * Set the ChatModel instance. Package-private for testing.
     */
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    private synchronized ChatModel getOrCreateModel() {
        if (chatModel != null) {
            return chatModel;
        }
        if (!isAvailable()) {
            throw new IllegalStateException("Language model not configured. Set calhelper.llm.api-key");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .temperature(settings.getTemperature())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(settings.getRequestTimeout());
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getMaxTokens() != null) {
            builder.maxTokens(settings.getMaxTokens());
        }
        chatModel = builder.build();
        log.info("[LLM] OpenAI chat model initialized: {}", settings.getModel());
        return chatModel;
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
        return chatModel != null || settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> converse(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getOrCreateModel();
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.getMessages()))
                    .toolSpecifications(convertCapabilities(request.getCapabilities()))
                    .build();
            log.debug("[LLM] Thread {}: sending {} messages, {} capabilities", request.getThreadId(),
                    chatRequest.messages().size(), request.getCapabilities().size());

            for (int attempt = 0;; attempt++) {
                try {
                    return convertResponse(model.chat(chatRequest));
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt >= MAX_RETRIES) {
                        log.error("[LLM] Chat failed", e);
                        throw new CompletionException("LLM chat failed: " + e.getMessage(), e);
                    }
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1, MAX_RETRIES,
                            backoffMs);
                    try {
                        Thread.sleep(backoffMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException("LLM chat interrupted during retry backoff", ie);
                    }
                }
            }
        });
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    List<ChatMessage> convertMessages(List<Message> history) {
        List<ChatMessage> messages = new ArrayList<>();
        List<ToolExecutionRequest> round = new ArrayList<>();
        String roundText = null;

        for (Message msg : history) {
            if (msg.getKind() == MessageKind.INVOCATION_REQUEST) {
                if (round.isEmpty()) {
                    roundText = msg.getContent();
                }
                round.add(toToolRequest(msg.getInvocation()));
                continue;
            }
            if (!round.isEmpty()) {
                messages.add(toAiMessage(roundText, round));
                round = new ArrayList<>();
                roundText = null;
            }
            switch (msg.getKind()) {
            case SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            case USER -> messages.add(UserMessage.from(msg.getContent()));
            case ASSISTANT_TEXT -> messages.add(AiMessage.from(msg.getContent()));
            case INVOCATION_RESULT -> messages.add(ToolExecutionResultMessage.from(
                    msg.getInvocationId(), msg.getCapabilityName(), msg.getContent()));
            default -> log.warn("[LLM] Unknown message kind: {}, skipping", msg.getKind());
            }
        }
        if (!round.isEmpty()) {
            messages.add(toAiMessage(roundText, round));
        }
        return messages;
    }

    private AiMessage toAiMessage(String text, List<ToolExecutionRequest> requests) {
        if (text != null && !text.isBlank()) {
            return AiMessage.from(text, requests);
        }
        return AiMessage.from(requests);
    }

    private ToolExecutionRequest toToolRequest(InvocationRequest invocation) {
        return ToolExecutionRequest.builder()
                .id(invocation.getId())
                .name(invocation.getCapabilityName())
                .arguments(convertArgsToJson(invocation.getArguments()))
                .build();
    }

    List<ToolSpecification> convertCapabilities(List<CapabilityDefinition> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return Collections.emptyList();
        }
        return capabilities.stream().map(this::convertCapability).toList();
    }

    private ToolSpecification convertCapability(CapabilityDefinition capability) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(capability.getName())
                .description(capability.getDescription());

        Map<String, Object> schema = capability.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters(toObjectSchema(schema, null));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            if (enumValues.stream().allMatch(String.class::isInstance)) {
                return JsonEnumSchema.builder()
                        .enumValues(enumValues.stream().map(String.class::cast).toList())
                        .description(description)
                        .build();
            }
            // provider enums are string-only; keep the declared type and list the values
            description = (description != null ? description + " " : "") + "One of " + enumValues + ".";
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> toObjectSchema(paramSchema, description);
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    @SuppressWarnings("unchecked")
    private JsonObjectSchema toObjectSchema(Map<String, Object> objectSchema, String description) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        if (objectSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                builder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
        }
        if (objectSchema.get("required") instanceof List<?> required && !required.isEmpty()) {
            builder.required(required.stream().map(String::valueOf).toList());
        }
        if (objectSchema.get("additionalProperties") instanceof Boolean additional) {
            builder.additionalProperties(additional);
        }
        return builder.build();
    }

    LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<InvocationRequest> invocations = List.of();
        if (aiMessage.hasToolExecutionRequests()) {
            invocations = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> InvocationRequest.builder()
                            .id(ter.id())
                            .capabilityName(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.debug("[LLM] Model requested {} invocation(s)", invocations.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .invocations(invocations)
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
            log.warn("[LLM] Failed to serialize invocation arguments: {}", e.getMessage());
            return "{}";
        }
    }

    /**
     * Arguments that are not a JSON object become an empty map; schema
     * validation then reports the missing properties to the model.
     */
    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE_REF);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse invocation arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
