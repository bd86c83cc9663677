package me.golemcore.router.adapter.outbound.llm;

import me.golemcore.router.domain.model.LlmRequest;
import me.golemcore.router.domain.model.LlmResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private RouterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
    }

    private LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn(providerId + "-model");
        return adapter;
    }

    // ===== init() =====

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("anthropic");
        LlmProviderAdapter openai = createMockAdapter("openai", true);
        LlmProviderAdapter anthropic = createMockAdapter("anthropic", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openai, anthropic, noop));
        factory.init();

        assertEquals("anthropic", factory.getProviderId());
        assertSame(anthropic, factory.getActiveAdapter());
        assertEquals("anthropic-model", factory.getCurrentModel());
        verify(anthropic).initialize();
        verify(openai, never()).initialize();
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("gemini");
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldReportUnavailableWithoutAdapters() {
        properties.getLlm().setProvider("gemini");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
        CompletableFuture<LlmResponse> future = factory.chat(LlmRequest.builder().prompt("hi").build());
        assertThrows(ExecutionException.class, future::get);
    }

    // ===== chat() =====

    @Test
    void shouldDelegateChatToActiveAdapter() throws Exception {
        properties.getLlm().setProvider("openai");
        LlmProviderAdapter openai = createMockAdapter("openai", true);
        LlmRequest request = LlmRequest.builder().prompt("hello").build();
        when(openai.chat(request)).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("hi").build()));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openai));
        factory.init();

        assertEquals("hi", factory.chat(request).get().getContent());
    }

    // ===== NoOpLlmAdapter =====

    @Test
    void shouldFailEveryRequestOnNoopAdapter() {
        NoOpLlmAdapter noop = new NoOpLlmAdapter();

        assertFalse(noop.isAvailable());
        assertEquals("none", noop.getProviderId());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> noop.chat(LlmRequest.builder().prompt("hi").build()).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
