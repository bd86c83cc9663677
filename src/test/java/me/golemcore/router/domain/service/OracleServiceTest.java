package me.golemcore.router.domain.service;

import me.golemcore.router.domain.exception.OracleUnavailableException;
import me.golemcore.router.domain.model.LlmRequest;
import me.golemcore.router.domain.model.LlmResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OracleServiceTest {

    private LlmPort llmPort;
    private RouterProperties properties;
    private OracleService oracle;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new RouterProperties();
        oracle = new OracleService(llmPort, properties);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getProviderId()).thenReturn("openai");
        when(llmPort.getCurrentModel()).thenReturn("gpt-4");
    }

    @Test
    void shouldReturnGeneratedText() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Paris").build()));

        assertEquals("Paris", oracle.generate("Capital of France?"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("Capital of France?", captor.getValue().getPrompt());
        assertEquals("gpt-4", captor.getValue().getModel());
        assertNull(captor.getValue().getSystemPrompt());
    }

    @Test
    void shouldPassSystemPrompt() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("ok").build()));

        oracle.generate("You route requests.", "hello");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("You route requests.", captor.getValue().getSystemPrompt());
    }

    @Test
    void shouldFailFastWhenBackendIsUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertThrows(OracleUnavailableException.class, () -> oracle.generate("hi"));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldWrapBackendFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("401")));

        OracleUnavailableException e = assertThrows(OracleUnavailableException.class, () -> oracle.generate("hi"));

        assertTrue(e.getMessage().contains("401"));
    }

    @Test
    void shouldTreatEmptyEnvelopeAsUnavailable() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().build()));

        assertThrows(OracleUnavailableException.class, () -> oracle.generate("hi"));
    }

    @Test
    void shouldTimeOut() {
        properties.getLlm().setTimeoutMs(50);
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        OracleUnavailableException e = assertThrows(OracleUnavailableException.class, () -> oracle.generate("hi"));

        assertTrue(e.getMessage().contains("50ms"));
    }
}
