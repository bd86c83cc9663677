package me.golemcore.router.adapter.outbound.mcp;

import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.McpSessionPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class McpSessionFactoryTest {

    private McpSessionFactory factory;

    @BeforeEach
    void setUp() {
        RouterProperties properties = new RouterProperties();
        properties.getMcp().setStartupTimeoutSeconds(10);
        factory = new McpSessionFactory(new ObjectMapper(), new OkHttpClient(), properties);
    }

    @Test
    void shouldRejectSseProviderWithoutUrl() {
        ProviderDescriptor provider = ProviderDescriptor.builder()
                .id("remote")
                .transport(TransportSpec.sse(null))
                .build();

        TransportFailureException e = assertThrows(TransportFailureException.class, () -> factory.open(provider));

        assertEquals("Provider remote has no SSE URL", e.getMessage());
    }

    @Test
    void shouldReportUnstartableStdioProvider() {
        ProviderDescriptor provider = ProviderDescriptor.builder()
                .id("ghost")
                .transport(TransportSpec.stdio("definitely-not-an-installed-command-4711", List.of()))
                .build();

        assertThrows(TransportFailureException.class, () -> factory.open(provider));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldOpenConnectedStdioSession() throws Exception {
        Path script = Path.of(getClass().getResource("/mcp/fake-stdio-provider.sh").toURI());
        ProviderDescriptor provider = ProviderDescriptor.builder()
                .id("fake")
                .transport(TransportSpec.stdio("sh", List.of()))
                .path(script.toString())
                .build();

        try (McpSessionPort.McpSession session = factory.open(provider)) {
            assertInstanceOf(StdioMcpSession.class, session);
            assertEquals("add", session.listTools().get(0).getName());
        }
    }
}
