package me.golemcore.router.adapter.outbound.llm;

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

import me.golemcore.router.domain.model.LlmRequest;
import me.golemcore.router.domain.model.LlmResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared request/retry plumbing for oracle backends built on langchain4j.
 *
 * <p>
 * Subclasses only build the provider-specific {@link ChatModel}. The two
 * backends differ in endpoint, authentication and envelope; everything else
 * (message conversion, rate-limit backoff, response mapping) lives here.
 */
@Slf4j
public abstract class AbstractLangchain4jAdapter implements LlmProviderAdapter {

    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    protected final RouterProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    protected AbstractLangchain4jAdapter(RouterProperties properties) {
        this.properties = properties;
    }

    /**
     * Build the backend model from its provider settings.
     */
    protected abstract ChatModel createModel(RouterProperties.ProviderProperties config);

    protected abstract RouterProperties.ProviderProperties providerConfig();

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        RouterProperties.ProviderProperties config = providerConfig();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[LLM:{}] API key not configured, adapter unavailable", getProviderId());
            return;
        }
        try {
            this.chatModel = createModel(config);
            initialized = true;
            log.info("[LLM:{}] Initialized with model: {}", getProviderId(), config.getModel());
        } catch (RuntimeException e) {
            log.warn("[LLM:{}] Failed to initialize: {}", getProviderId(), e.getMessage());
        }
    }

    // Visible for tests
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException(getProviderId() + " adapter not available (API key not set?)");
            }

            List<ChatMessage> messages = convertMessages(request);
            int maxRetries = Math.max(0, properties.getLlm().getMaxRetries());

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = computeBackoff(e, attempt);
                        log.warn("[LLM:{}] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                getProviderId(), attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM:{}] chat failed: {}", getProviderId(), e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public String getCurrentModel() {
        return providerConfig().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = providerConfig().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getPrompt() != null ? request.getPrompt() : ""));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private long computeBackoff(Throwable e, int attempt) {
        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
        long resetSeconds = extractResetSeconds(e);
        return resetSeconds > 0
                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                : exponentialBackoffMs;
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("overloaded"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }
}
