package me.golemcore.router.infrastructure.config;

import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.service.ProviderRegistry;
import me.golemcore.router.domain.service.ToolExecutionService;
import me.golemcore.router.flow.FlowRegistry;
import me.golemcore.router.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    private RouterProperties properties;
    private ProviderRegistry providerRegistry;
    private ToolExecutionService toolExecutionService;
    private AutoConfiguration configuration;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        providerRegistry = mock(ProviderRegistry.class);
        toolExecutionService = mock(ToolExecutionService.class);
        configuration = new AutoConfiguration(properties, mock(LlmPort.class), providerRegistry,
                new FlowRegistry(List.of()), toolExecutionService);
    }

    @Test
    void shouldConfigureLenientObjectMapper() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void shouldIntrospectEnabledProvidersWithoutTools() {
        ProviderDescriptor known = ProviderDescriptor.builder().id("calculator")
                .tools(new ArrayList<>(List.of(ToolDescriptor.builder().name("add").build()))).build();
        ProviderDescriptor unknown = ProviderDescriptor.builder().id("filesystem").build();
        ProviderDescriptor broken = ProviderDescriptor.builder().id("broken").build();
        when(providerRegistry.listEnabled()).thenReturn(List.of(known, broken, unknown));
        when(toolExecutionService.refreshTools("broken")).thenThrow(new TransportFailureException("spawn failed"));
        when(toolExecutionService.refreshTools("filesystem")).thenReturn(List.of());

        configuration.introspectProviders();

        verify(toolExecutionService).refreshTools("broken");
        verify(toolExecutionService).refreshTools("filesystem");
        verify(toolExecutionService, never()).refreshTools("calculator");
    }

    @Test
    void shouldSkipIntrospectionWhenDisabled() {
        properties.getMcp().setIntrospectOnStartup(false);

        configuration.introspectProviders();

        verify(toolExecutionService, never()).refreshTools(anyString());
        verifyNoInteractions(providerRegistry);
    }
}
