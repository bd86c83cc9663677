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

import me.golemcore.router.infrastructure.config.RouterProperties;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Anthropic messages API backend.
 *
 * <p>
 * Provider ID: {@code "anthropic"}
 */
@Component
public class AnthropicLlmAdapter extends AbstractLangchain4jAdapter {

    public AnthropicLlmAdapter(RouterProperties properties) {
        super(properties);
    }

    @Override
    public String getProviderId() {
        return "anthropic";
    }

    @Override
    protected RouterProperties.ProviderProperties providerConfig() {
        return properties.getLlm().getAnthropic();
    }

    @Override
    protected ChatModel createModel(RouterProperties.ProviderProperties config) {
        RouterProperties.LlmProperties llm = properties.getLlm();
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
