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
import me.golemcore.router.infrastructure.config.RouterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * MCP session over the HTTP+SSE transport.
 *
 * <p>
 * A GET on the provider URL opens the event stream. The first {@code endpoint}
 * event names the URL (relative to the stream URL) that accepts JSON-RPC
 * messages via POST; responses come back on the stream as {@code message}
 * events.
 */
@Slf4j
public class SseMcpSession extends AbstractMcpSession {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String ENDPOINT_EVENT = "endpoint";
    private static final String MESSAGE_EVENT = "message";

    private final String url;
    private final OkHttpClient httpClient;
    private final CompletableFuture<HttpUrl> endpoint = new CompletableFuture<>();

    private EventSource eventSource;

    public SseMcpSession(String providerId, String url, OkHttpClient httpClient, ObjectMapper objectMapper,
            RouterProperties.McpProperties settings) {
        super(providerId, objectMapper, settings);
        this.url = url;
        this.httpClient = httpClient;
    }

    @Override
    protected void openTransport() {
        HttpUrl streamUrl = url != null ? HttpUrl.parse(url) : null;
        if (streamUrl == null) {
            throw new TransportFailureException("Invalid SSE URL for provider " + providerId + ": " + url);
        }
        log.info("[MCP:{}] Connecting to {}", providerId, streamUrl);

        Request request = new Request.Builder()
                .url(streamUrl)
                .header("Accept", "text/event-stream")
                .build();
        eventSource = EventSources.createFactory(httpClient).newEventSource(request, new Listener(streamUrl));

        try {
            HttpUrl postUrl = endpoint.get(settings.getStartupTimeoutSeconds(), TimeUnit.SECONDS);
            log.debug("[MCP:{}] Message endpoint: {}", providerId, postUrl);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportFailureException(
                    "Cannot connect to provider " + providerId + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportFailureException(
                    "Provider " + providerId + " sent no endpoint within " + settings.getStartupTimeoutSeconds() + "s",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Interrupted while connecting to " + providerId, e);
        }
    }

    @Override
    protected void transmit(String json) throws IOException {
        HttpUrl postUrl = endpoint.getNow(null);
        if (postUrl == null) {
            throw new IOException("SSE endpoint not established");
        }
        Request request = new Request.Builder()
                .url(postUrl)
                .post(RequestBody.create(json, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("POST " + postUrl + " returned HTTP " + response.code());
            }
        }
    }

    @Override
    protected void shutdown() {
        if (eventSource != null) {
            eventSource.cancel();
        }
    }

    private final class Listener extends EventSourceListener {

        private final HttpUrl streamUrl;

        private Listener(HttpUrl streamUrl) {
            this.streamUrl = streamUrl;
        }

        @Override
        public void onEvent(EventSource source, String id, String type, String data) {
            if (ENDPOINT_EVENT.equals(type)) {
                HttpUrl resolved = streamUrl.resolve(data.trim());
                if (resolved == null) {
                    endpoint.completeExceptionally(new IOException("Unusable endpoint: " + data));
                } else {
                    endpoint.complete(resolved);
                }
            } else if (type == null || MESSAGE_EVENT.equals(type)) {
                handleMessage(data);
            } else {
                log.debug("[MCP:{}] Ignoring SSE event '{}'", providerId, type);
            }
        }

        @Override
        public void onFailure(EventSource source, Throwable t, Response response) {
            String reason = t != null ? t.getMessage()
                    : response != null ? "HTTP " + response.code() : "stream failed";
            IOException failure = new IOException("SSE stream failed: " + reason, t);
            endpoint.completeExceptionally(failure);
            if (running) {
                log.warn("[MCP:{}] {}", providerId, failure.getMessage());
            }
            failPending(failure);
        }

        @Override
        public void onClosed(EventSource source) {
            IOException closed = new IOException("SSE stream closed by provider");
            endpoint.completeExceptionally(closed);
            failPending(closed);
        }
    }
}
