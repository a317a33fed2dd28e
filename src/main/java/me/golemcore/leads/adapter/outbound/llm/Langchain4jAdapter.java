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

package me.golemcore.leads.adapter.outbound.llm;

import me.golemcore.leads.domain.model.LlmRequest;
import me.golemcore.leads.domain.model.LlmResponse;
import me.golemcore.leads.domain.model.Message;
import me.golemcore.leads.infrastructure.config.LeadsProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter backed by the langchain4j library.
 *
 * <p>
 * Supports two backing APIs, chosen by {@code leads.llm.langchain4j.provider}:
 * <ul>
 * <li>anthropic - Claude models
 * <li>openai - OpenAI or any OpenAI-compatible endpoint (set
 * {@code base-url})
 * </ul>
 *
 * <p>
 * The chat model is created lazily on first use. Requests that override the
 * model, temperature or token limit get a one-off client. Rate limit errors
 * are retried with exponential backoff up to
 * {@code leads.llm.langchain4j.max-retries}; langchain4j's own retries are
 * disabled.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final LeadsProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        LeadsProperties.Langchain4jProperties config = config();
        this.currentModel = config.getModel();
        try {
            this.chatModel = createModel(config.getModel(), config.getTemperature(), config.getMaxTokens());
            initialized = true;
            log.info("Langchain4j adapter initialized with {} model: {}", config.getProvider(), currentModel);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private LeadsProperties.Langchain4jProperties config() {
        return properties.getLlm().getLangchain4j();
    }

    ChatModel createModel(String modelName, double temperature, int maxTokens) {
        String provider = config().getProvider();
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(provider)) {
            return createAnthropicModel(modelName, temperature, maxTokens);
        } else if (PROVIDER_OPENAI.equalsIgnoreCase(provider)) {
            return createOpenAiModel(modelName, temperature, maxTokens);
        }
        throw new IllegalStateException("Unsupported langchain4j provider: " + provider
                + ". Set leads.llm.langchain4j.provider to anthropic or openai");
    }

    private ChatModel createAnthropicModel(String modelName, double temperature, int maxTokens) {
        LeadsProperties.Langchain4jProperties config = config();
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, double temperature, int maxTokens) {
        LeadsProperties.Langchain4jProperties config = config();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatModel modelToUse = getModelForRequest(request);
            String modelName = request.getModel() != null ? request.getModel() : currentModel;
            List<ChatMessage> messages = convertMessages(request);
            int maxRetries = Math.max(config().getMaxRetries(), 0);

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response = modelToUse.chat(messages);
                    return convertResponse(response, modelName);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, maxRetries, backoffMs);
                        try {
                            Thread.sleep(backoffMs);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
                        }
                    } else {
                        log.error("LLM chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("overloaded_error"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private ChatModel getModelForRequest(LlmRequest request) {
        LeadsProperties.Langchain4jProperties config = config();
        String model = request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : currentModel;
        double temperature = request.getTemperature() != null ? request.getTemperature() : config.getTemperature();
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens();

        boolean overridden = !Objects.equals(model, currentModel)
                || temperature != config.getTemperature()
                || maxTokens != config.getMaxTokens();
        if (overridden) {
            log.trace("Creating one-off model for request: {}, temperature: {}, maxTokens: {}",
                    model, temperature, maxTokens);
            return createModel(model, temperature, maxTokens);
        }
        return chatModel;
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : config().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = config().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            if (msg.getContent() == null || msg.getContent().isBlank()) {
                continue;
            }
            String role = msg.getRole() != null ? msg.getRole() : "";
            switch (role) {
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }

        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String modelName) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
