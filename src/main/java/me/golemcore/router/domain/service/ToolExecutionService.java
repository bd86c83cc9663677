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

import me.golemcore.router.domain.exception.ProviderNotFoundException;
import me.golemcore.router.domain.exception.ToolNotFoundException;
import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.McpSessionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Executes one tool call against one provider, one session per call.
 *
 * <p>
 * Unknown or disabled providers, and tools absent from a non-empty static
 * catalog, fail before any session is opened. After the handshake the live
 * tool list is introspected and written back to the registry; the call is
 * then checked against the live list. With tool refresh disabled this still
 * happens for providers that declare no tools. The session is closed on every
 * path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolExecutionService {

    private final ProviderRegistry registry;
    private final McpSessionPort sessionPort;
    private final RouterProperties properties;

    /**
     * @throws ProviderNotFoundException
     *             if the provider is unknown or disabled
     * @throws ToolNotFoundException
     *             if the provider does not expose the tool
     * @throws TransportFailureException
     *             on spawn, connect, handshake or timeout failures
     */
    public ToolResult execute(String providerId, String toolName, Map<String, Object> arguments) {
        ProviderDescriptor provider = registry.get(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));
        if (!provider.isEnabled()) {
            throw new ProviderNotFoundException(providerId, "Provider " + providerId + " is disabled");
        }
        if (!provider.getTools().isEmpty() && provider.findTool(toolName).isEmpty()) {
            throw new ToolNotFoundException(providerId, toolName);
        }

        log.info("[Tools] Executing {}.{} with {} argument(s)", providerId, toolName,
                arguments != null ? arguments.size() : 0);
        long startMs = System.currentTimeMillis();

        try (McpSessionPort.McpSession session = sessionPort.open(provider)) {
            // an empty static catalog leaves nothing checked yet, so always introspect
            if (properties.getMcp().isRefreshToolsOnCall() || provider.getTools().isEmpty()) {
                List<ToolDescriptor> liveTools = introspect(session, providerId);
                if (liveTools.stream().noneMatch(t -> t.getName().equals(toolName))) {
                    throw new ToolNotFoundException(providerId, toolName);
                }
            }
            ToolResult result = session.callTool(toolName, arguments != null ? arguments : Map.of());
            log.info("[Tools] {}.{} finished in {}ms (success={})", providerId, toolName,
                    System.currentTimeMillis() - startMs, result.isSuccess());
            return result;
        }
    }

    /**
     * Open a session only to read the provider's live tool list and store it in
     * the registry.
     */
    public List<ToolDescriptor> refreshTools(String providerId) {
        ProviderDescriptor provider = registry.get(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));
        try (McpSessionPort.McpSession session = sessionPort.open(provider)) {
            return introspect(session, providerId);
        }
    }

    private List<ToolDescriptor> introspect(McpSessionPort.McpSession session, String providerId) {
        List<ToolDescriptor> liveTools = session.listTools();
        registry.updateTools(providerId, liveTools);
        return liveTools;
    }
}
