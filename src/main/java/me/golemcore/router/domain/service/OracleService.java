package me.golemcore.router.domain.service;

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

import me.golemcore.router.domain.exception.OracleUnavailableException;
import me.golemcore.router.domain.model.LlmRequest;
import me.golemcore.router.domain.model.LlmResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking facade over the text-generation oracle. Every failure to obtain a
 * text (backend unavailable, network or auth error, timeout, empty envelope)
 * becomes {@link OracleUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OracleService {

    private final LlmPort llmPort;
    private final RouterProperties properties;

    public String generate(String prompt) {
        return generate(null, prompt);
    }

    public String generate(String systemPrompt, String prompt) {
        if (!llmPort.isAvailable()) {
            throw new OracleUnavailableException("Oracle backend '" + llmPort.getProviderId() + "' is not available");
        }

        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .systemPrompt(systemPrompt)
                .prompt(prompt)
                .build();

        long timeoutMs = properties.getLlm().getTimeoutMs();
        log.debug("[Oracle] Prompt:\n{}", prompt);
        long startMs = System.currentTimeMillis();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || response.getContent() == null) {
                throw new OracleUnavailableException("Oracle returned an empty response");
            }
            log.debug("[Oracle] Responded in {}ms: {}", System.currentTimeMillis() - startMs, response.getContent());
            return response.getContent();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Oracle] Request failed: {}", cause.getMessage());
            throw new OracleUnavailableException("Oracle request failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            log.warn("[Oracle] No response within {}ms", timeoutMs);
            throw new OracleUnavailableException("Oracle did not respond within " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while waiting for the oracle", e);
        }
    }

    public boolean isAvailable() {
        return llmPort.isAvailable();
    }
}
