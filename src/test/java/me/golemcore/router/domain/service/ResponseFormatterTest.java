package me.golemcore.router.domain.service;

import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.domain.model.Turn;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.routing.ConversationPromptRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ResponseFormatterTest {

    private OracleService oracle;
    private ResponseFormatter formatter;
    private ConversationMemory memory;

    @BeforeEach
    void setUp() {
        oracle = mock(OracleService.class);
        formatter = new ResponseFormatter(oracle, new ConversationPromptRenderer(new RouterProperties()),
                new ObjectMapper());
        memory = new ConversationMemory();
        memory.append(Turn.user("What is 5 plus 3?"));
        when(oracle.generate(anyString())).thenReturn("formatted");
    }

    private String capturedPrompt() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(oracle).generate(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldIncludeToolResultAndHistory() {
        assertEquals("formatted", formatter.formatResult(ToolResult.success("8"), "What is 5 plus 3?", memory));

        String prompt = capturedPrompt();
        assertTrue(prompt.contains("user: What is 5 plus 3?"));
        assertTrue(prompt.contains("\"output\" : \"8\""));
        assertTrue(prompt.contains("\"success\" : true"));
    }

    @Test
    void shouldIncludeErrorMessage() {
        formatter.formatError("Provider with ID weather not found", "weather?", memory);

        assertTrue(capturedPrompt().contains("The system encountered an error:\nProvider with ID weather not found"));
    }

    @Test
    void shouldNameMissingParameters() {
        Decision.InvokeTool invoke = new Decision.InvokeTool("calculator", "add", Map.of("a", 5),
                List.of("b"), "What number should I add to 5?");

        formatter.formatMissingParameters(invoke, "add 5", memory);

        String prompt = capturedPrompt();
        assertTrue(prompt.contains("the tool \"add\" of provider \"calculator\""));
        assertTrue(prompt.contains("missing:\nb\n"));
        assertTrue(prompt.contains("Suggested wording: What number should I add to 5?"));
    }
}
