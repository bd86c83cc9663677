package me.golemcore.router.adapter.outbound.mcp;

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

import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.domain.model.TransportType;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.McpSessionPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Creates and connects a session for the provider's transport kind. Sessions
 * are request-scoped: the caller closes them after one tool call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpSessionFactory implements McpSessionPort {

    private final ObjectMapper objectMapper;
    private final OkHttpClient okHttpClient;
    private final RouterProperties properties;

    @Override
    public McpSession open(ProviderDescriptor provider) {
        TransportSpec transport = provider.getTransport();
        TransportType type = transport != null && transport.getType() != null
                ? transport.getType()
                : TransportType.STDIO;

        AbstractMcpSession session = switch (type) {
        case STDIO -> new StdioMcpSession(provider, objectMapper, properties.getMcp());
        case SSE -> {
            if (transport.getUrl() == null || transport.getUrl().isBlank()) {
                throw new TransportFailureException("Provider " + provider.getId() + " has no SSE URL");
            }
            yield new SseMcpSession(provider.getId(), transport.getUrl(), okHttpClient, objectMapper,
                    properties.getMcp());
        }
        };

        log.debug("[MCP:{}] Opening {} session", provider.getId(), type);
        session.connect();
        return session;
    }
}
