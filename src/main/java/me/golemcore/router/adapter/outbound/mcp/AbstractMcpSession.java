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
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolParameter;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.McpSessionPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client side of a Model Context Protocol session.
 *
 * <p>
 * Subclasses move framed messages over a concrete transport; this class owns
 * request ids, response correlation, the {@code initialize} handshake and the
 * parsing of {@code tools/list} and {@code tools/call} results.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 */
@Slf4j
public abstract class AbstractMcpSession implements McpSessionPort.McpSession {

    static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";

    protected final String providerId;
    protected final ObjectMapper objectMapper;
    protected final RouterProperties.McpProperties settings;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    protected volatile boolean running;

    protected AbstractMcpSession(String providerId, ObjectMapper objectMapper,
            RouterProperties.McpProperties settings) {
        this.providerId = providerId;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /**
     * Write one serialized JSON-RPC message to the provider.
     */
    protected abstract void transmit(String json) throws IOException;

    /**
     * Release transport resources. Called once from {@link #close()}.
     */
    protected abstract void shutdown();

    /**
     * Bring the transport up and perform the protocol handshake. On any failure
     * the session is closed before the exception propagates.
     */
    public void connect() {
        try {
            openTransport();
            running = true;

            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", settings.getClientName(),
                            "version", settings.getClientVersion()))),
                    settings.getStartupTimeoutSeconds(), "initialize");
            log.info("[MCP:{}] Initialized: {}", providerId,
                    initResult != null && initResult.has("serverInfo") ? initResult.get("serverInfo") : "{}");

            sendNotification("notifications/initialized", Map.of());
        } catch (TransportFailureException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", providerId, e.getMessage());
            close();
            throw e;
        } catch (RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", providerId, e.getMessage());
            close();
            throw new TransportFailureException("Failed to start provider " + providerId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Start the underlying process or stream.
     *
     * @throws TransportFailureException
     *             if the provider cannot be reached
     */
    protected abstract void openTransport();

    @Override
    public List<ToolDescriptor> listTools() {
        JsonNode result = await(sendRequest("tools/list", Map.of()),
                settings.getRequestTimeoutSeconds(), "tools/list");
        List<ToolDescriptor> tools = parseToolDescriptors(result);
        log.debug("[MCP:{}] Available tools: {}", providerId, tools.stream().map(ToolDescriptor::getName).toList());
        return tools;
    }

    @Override
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        CompletableFuture<JsonNode> future = sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of()));
        try {
            JsonNode result = future.get(settings.getRequestTimeoutSeconds(), TimeUnit.SECONDS);
            return parseToolCallResult(toolName, result);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof McpRpcException rpcError) {
                log.warn("[MCP:{}] Tool '{}' returned error {}: {}", providerId, toolName,
                        rpcError.getCode(), rpcError.getMessage());
                return ToolResult.failure(rpcError.getMessage());
            }
            throw transportFailure("tools/call", e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            throw new TransportFailureException(
                    "Provider " + providerId + " did not answer tools/call within "
                            + settings.getRequestTimeoutSeconds() + "s",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Interrupted while calling " + toolName, e);
        }
    }

    @Override
    public void close() {
        log.debug("[MCP:{}] Closing session", providerId);
        running = false;
        failPending(new IOException("MCP session closing"));
        shutdown();
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] -> {}", providerId, json);
            transmit(json);
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] -> (notification) {}", providerId, json);
            transmit(json);
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", providerId, e.getMessage());
        }
    }

    /**
     * Route one inbound message to the request waiting for it. Server-initiated
     * notifications and requests are logged and ignored.
     */
    protected void handleMessage(String raw) {
        String line = raw != null ? raw.trim() : "";
        if (line.isEmpty()) {
            return;
        }
        log.debug("[MCP:{}] <- {}", providerId, line);
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            boolean isResponse = idNode != null && idNode.canConvertToInt()
                    && (message.has("result") || message.has("error"));
            if (!isResponse) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server message ignored: {}", providerId, method);
                return;
            }
            int id = idNode.asInt();
            CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
            if (pending == null) {
                log.warn("[MCP:{}] Received response for unknown id: {}", providerId, id);
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpRpcException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse message: {}", providerId, e.getMessage());
        }
    }

    protected void failPending(Throwable cause) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(cause);
        }
        pendingRequests.clear();
    }

    private JsonNode await(CompletableFuture<JsonNode> future, long timeoutSeconds, String method) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw transportFailure(method, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            throw new TransportFailureException(
                    "Provider " + providerId + " did not answer " + method + " within " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Interrupted while waiting for " + method, e);
        }
    }

    private TransportFailureException transportFailure(String method, Throwable cause) {
        return new TransportFailureException(
                "Provider " + providerId + " failed on " + method + ": " + cause.getMessage(), cause);
    }

    List<ToolDescriptor> parseToolDescriptors(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDescriptor> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";
            tools.add(ToolDescriptor.builder()
                    .name(name)
                    .description(description)
                    .parameters(parseParameters(toolNode.get("inputSchema")))
                    .build());
        }
        return tools;
    }

    private List<ToolParameter> parseParameters(JsonNode inputSchema) {
        if (inputSchema == null || !inputSchema.has("properties")) {
            return new ArrayList<>();
        }
        Set<String> required = new HashSet<>();
        JsonNode requiredNode = inputSchema.get("required");
        if (requiredNode != null && requiredNode.isArray()) {
            requiredNode.forEach(n -> required.add(n.asText()));
        }

        List<ToolParameter> parameters = new ArrayList<>();
        inputSchema.get("properties").fields().forEachRemaining(entry -> {
            JsonNode property = entry.getValue();
            parameters.add(ToolParameter.builder()
                    .name(entry.getKey())
                    .type(property.has("type") ? property.get("type").asText() : "string")
                    .description(property.has("description") ? property.get("description").asText() : null)
                    .required(required.contains(entry.getKey()))
                    .build());
        });
        return parameters;
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }
}
