package me.golemcore.router.adapter.inbound.console;

import me.golemcore.router.domain.model.Conversation;
import me.golemcore.router.domain.service.ConversationService;
import me.golemcore.router.domain.service.RouterOrchestrator;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConsoleChatRunnerTest {

    private RouterOrchestrator orchestrator;
    private ConversationService conversationService;
    private ConsoleChatRunner runner;

    @BeforeEach
    void setUp() {
        RouterProperties properties = new RouterProperties();
        orchestrator = mock(RouterOrchestrator.class);
        conversationService = new ConversationService(properties);
        runner = new ConsoleChatRunner(orchestrator, conversationService, properties);
    }

    private String chat(String input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        runner.chat(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintRepliesForEachLine() throws IOException {
        when(orchestrator.processTurn(any(Conversation.class), eq("hello"))).thenReturn("Hi!");
        when(orchestrator.processTurn(any(Conversation.class), eq("what is 5 plus 3?"))).thenReturn("8");

        String output = chat("hello\nwhat is 5 plus 3?\n");

        assertTrue(output.contains("Hi!"));
        assertTrue(output.contains("8"));
        verify(orchestrator, times(2)).processTurn(same(conversationService.getOrCreate("console")), anyString());
    }

    @Test
    void shouldStopAtExit() throws IOException {
        chat("exit\nhello\n");

        verify(orchestrator, never()).processTurn(any(Conversation.class), anyString());
    }

    @Test
    void shouldResetConversation() throws IOException {
        String output = chat("reset\nquit\n");

        assertTrue(output.contains("Conversation cleared."));
        verify(orchestrator).reset(conversationService.getOrCreate("console"));
    }

    @Test
    void shouldSkipBlankLines() throws IOException {
        chat("\n   \n");

        verify(orchestrator, never()).processTurn(any(Conversation.class), anyString());
    }
}
