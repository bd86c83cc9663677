package me.golemcore.router.adapter.outbound.mcp;

import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.infrastructure.config.RouterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SseMcpSessionTest {

    private MockWebServer server;
    private OkHttpClient client;
    private RouterProperties.McpProperties settings;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient.Builder()
                .readTimeout(5, TimeUnit.SECONDS)
                .build();
        settings = new RouterProperties().getMcp();
        settings.setStartupTimeoutSeconds(2);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SseMcpSession session(String url) {
        return new SseMcpSession("remote", url, client, new ObjectMapper(), settings);
    }

    @Test
    void shouldFailOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(500));
        SseMcpSession session = session(server.url("/sse").toString());

        TransportFailureException e = assertThrows(TransportFailureException.class, session::connect);

        assertTrue(e.getMessage().contains("remote"));
    }

    @Test
    void shouldFailOnInvalidUrl() {
        SseMcpSession session = session("not a url");

        TransportFailureException e = assertThrows(TransportFailureException.class, session::connect);

        assertTrue(e.getMessage().contains("Invalid SSE URL"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldFailWhenStreamClosesWithoutEndpoint() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody(": keep-alive\n\n"));
        SseMcpSession session = session(server.url("/sse").toString());

        assertThrows(TransportFailureException.class, session::connect);
    }

    @Test
    void shouldPostInitializeToAnnouncedEndpoint() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("event: endpoint\ndata: /messages?sessionId=abc\n\n"));
        server.enqueue(new MockResponse().setResponseCode(202));
        SseMcpSession session = session(server.url("/sse").toString());

        // the stream ends right after the endpoint event, so the handshake cannot complete
        assertThrows(TransportFailureException.class, session::connect);

        RecordedRequest stream = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", stream.getMethod());
        assertEquals("text/event-stream", stream.getHeader("Accept"));
        RecordedRequest post = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(post);
        assertEquals("POST", post.getMethod());
        assertEquals("/messages?sessionId=abc", post.getPath());
        String body = post.getBody().readUtf8();
        assertTrue(body.contains("\"method\":\"initialize\""));
        assertTrue(body.contains("\"protocolVersion\":\"2024-11-05\""));
    }
}
