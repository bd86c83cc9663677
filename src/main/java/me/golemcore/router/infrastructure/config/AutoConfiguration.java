package me.golemcore.router.infrastructure.config;

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

import me.golemcore.router.domain.exception.RouterException;
import me.golemcore.router.domain.model.FlowDescriptor;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.service.ProviderRegistry;
import me.golemcore.router.domain.service.ToolExecutionService;
import me.golemcore.router.flow.FlowRegistry;
import me.golemcore.router.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * Spring configuration that logs the router's setup on startup and, once the
 * context is ready, introspects enabled providers whose tool list is still
 * unknown.
 *
 * <p>
 * Introspection is best-effort: a provider that cannot be started is logged
 * and keeps an empty tool list until it is first called.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RouterProperties properties;
    private final LlmPort llmPort;
    private final ProviderRegistry providerRegistry;
    private final FlowRegistry flowRegistry;
    private final ToolExecutionService toolExecutionService;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Router starting...");
        log.info("LLM Provider: {} (model: {}, available: {})", llmPort.getProviderId(),
                llmPort.getCurrentModel(), llmPort.isAvailable());
        log.info("Provider store: {}", properties.getRegistry().isPersist()
                ? properties.getRegistry().getStorePath()
                : "(in memory)");
        log.info("Registered providers: {}", providerRegistry.list().stream()
                .map(p -> p.getId() + (p.isEnabled() ? "" : " (disabled)"))
                .toList());
        log.info("Registered flows: {}", flowRegistry.descriptors().stream().map(FlowDescriptor::id).toList());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void introspectProviders() {
        if (!properties.getMcp().isIntrospectOnStartup()) {
            return;
        }
        List<ProviderDescriptor> pending = providerRegistry.listEnabled().stream()
                .filter(p -> p.getTools().isEmpty())
                .toList();
        for (ProviderDescriptor provider : pending) {
            try {
                int count = toolExecutionService.refreshTools(provider.getId()).size();
                log.info("[MCP:{}] Discovered {} tools", provider.getId(), count);
            } catch (RouterException e) {
                log.warn("[MCP:{}] Introspection skipped: {}", provider.getId(), e.getMessage());
            }
        }
    }
}
