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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the router, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code router.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - oracle backend selection and credentials</li>
 * <li>{@link MemoryProperties} - conversation memory bounds</li>
 * <li>{@link RegistryProperties} - provider catalog persistence and install
 * step</li>
 * <li>{@link McpProperties} - tool-provider session timeouts</li>
 * <li>{@link ProvidersProperties} - default providers registered at
 * startup</li>
 * <li>{@link FlowsProperties} - guided flow settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "router")
@Data
public class RouterProperties {

    private LlmProperties llm = new LlmProperties();
    private MemoryProperties memory = new MemoryProperties();
    private RegistryProperties registry = new RegistryProperties();
    private McpProperties mcp = new McpProperties();
    private ProvidersProperties providers = new ProvidersProperties();
    private FlowsProperties flows = new FlowsProperties();
    private ConsoleProperties console = new ConsoleProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Active backend: openai, anthropic or none. */
        private String provider = "openai";
        private long timeoutMs = 60000;
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private int maxRetries = 3;
        private ProviderProperties openai = new ProviderProperties("gpt-4");
        private ProviderProperties anthropic = new ProviderProperties("claude-3-7-sonnet-20250219");
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String model;
        private String baseUrl;

        public ProviderProperties() {
        }

        public ProviderProperties(String model) {
            this.model = model;
        }
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private int maxTurns = 10;
        private boolean includeSystemTurns = true;
        /** Number of most recent turns rendered into oracle prompts. */
        private int promptHistoryTurns = 10;
    }

    // ==================== REGISTRY ====================

    @Data
    public static class RegistryProperties {
        private boolean persist = true;
        private String storePath = "./config/servers.json";
        private String installCommand = "npm install";
        private int installTimeoutSeconds = 300;
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private int startupTimeoutSeconds = 30;
        private int requestTimeoutSeconds = 60;
        private int shutdownGraceSeconds = 5;
        /**
         * Refresh the catalog's tool list from tools/list on every session.
         * Providers that declare no tools are introspected regardless.
         */
        private boolean refreshToolsOnCall = true;
        /** Introspect enabled providers that declare no tools once at startup. */
        private boolean introspectOnStartup = true;
        private String clientName = "golemcore-router";
        private String clientVersion = "1.0.0";
    }

    // ==================== DEFAULT PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private boolean defaultsEnabled = true;
        private List<DefaultProviderProperties> defaults = new ArrayList<>();
    }

    @Data
    public static class DefaultProviderProperties {
        private String id;
        private String name;
        private String description;
        private String command;
        private List<String> args = new ArrayList<>();
        private String url;
        private String path;
        private Map<String, String> config = new HashMap<>();
    }

    // ==================== FLOWS ====================

    @Data
    public static class FlowsProperties {
        private String outputDirectory = "mcp-servers";
        private String filesystemProviderId = "filesystem";
        /** Upper bound on stages executed back to back within one turn. */
        private int maxChainedStages = 3;
    }

    // ==================== CONSOLE ====================

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
        private String conversationId = "console";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 0;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
