package me.golemcore.router.routing;

import me.golemcore.router.domain.exception.OracleUnavailableException;
import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolParameter;
import me.golemcore.router.domain.model.Turn;
import me.golemcore.router.domain.service.OracleService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class QueryRouterTest {

    private OracleService oracle;
    private QueryRouter router;
    private ConversationMemory memory;
    private ProviderDescriptor calculator;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        RouterProperties properties = new RouterProperties();
        oracle = mock(OracleService.class);
        router = new QueryRouter(oracle, new OracleJson(objectMapper), new DecisionParser(objectMapper),
                new ConversationPromptRenderer(properties));
        memory = new ConversationMemory();

        calculator = ProviderDescriptor.builder()
                .id("calculator")
                .name("Calculator")
                .description("Basic arithmetic")
                .tools(new ArrayList<>(List.of(ToolDescriptor.builder()
                        .name("add")
                        .description("Add two numbers together")
                        .parameters(new ArrayList<>(List.of(
                                ToolParameter.builder().name("a").type("number").description("First number").build(),
                                ToolParameter.builder().name("b").type("number").description("Second number")
                                        .build())))
                        .build())))
                .build();
    }

    private void oracleReplies(String reply) {
        when(oracle.generate(anyString(), anyString())).thenReturn(reply);
    }

    // ===== scenarios =====

    @Test
    void shouldRouteAdditionToCalculator() {
        oracleReplies("""
                {"action": "call_tool", "response": "I'll add 5 and 3.",
                 "reasoning": "Arithmetic request.",
                 "tool": {"serverId": "calculator", "name": "add", "parameters": {"a": 5, "b": 3},
                          "missing_parameters": []}}
                """);

        Decision decision = router.decide("What is 5 plus 3?", memory, List.of(calculator));

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals("calculator", invoke.providerId());
        assertEquals("add", invoke.toolName());
        assertEquals(Map.of("a", 5, "b", 3), invoke.arguments());
        assertTrue(invoke.missingParameters().isEmpty());
    }

    @Test
    void shouldAnswerGeneralKnowledgeDirectly() {
        oracleReplies("{\"action\": \"direct_response\", \"response\": \"The capital of France is Paris.\"}");

        Decision decision = router.decide("What is the capital of France?", memory, List.of());

        assertEquals(new Decision.DirectAnswer("The capital of France is Paris."), decision);
    }

    @Test
    void shouldReportMissingParametersInsteadOfGuessing() {
        oracleReplies("""
                {"action": "call_tool", "response": "Which numbers should I add?",
                 "tool": {"serverId": "calculator", "name": "add", "parameters": {},
                          "missing_parameters": ["a", "b"]}}
                """);

        Decision decision = router.decide("add two numbers", memory, List.of(calculator));

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals(List.of("a", "b"), invoke.missingParameters());
        assertTrue(invoke.hasMissingParameters());
    }

    @Test
    void shouldFallBackWhenProviderIsUnknown() {
        oracleReplies("""
                {"action": "call_tool", "tool": {"serverId": "weather", "name": "forecast", "parameters": {}}}
                """);

        Decision decision = router.decide("Weather in Oslo?", memory, List.of(calculator));

        Decision.DirectAnswer answer = assertInstanceOf(Decision.DirectAnswer.class, decision);
        assertEquals(String.format(QueryRouter.FALLBACK_TEMPLATE, "Weather in Oslo?"), answer.text());
    }

    // ===== fallback =====

    @Test
    void shouldSalvageResponseFromBrokenJson() {
        oracleReplies("{\"action\": \"direct_response\", \"response\": \"Paris is the capital.\", \"reasoning\": \"trunc");

        Decision decision = router.decide("Capital of France?", memory, List.of());

        Decision.DirectAnswer answer = assertInstanceOf(Decision.DirectAnswer.class, decision);
        assertTrue(answer.text().startsWith("I'm having trouble understanding how to process your request"));
        assertTrue(answer.text().endsWith("\n\nParis is the capital."));
    }

    @Test
    void shouldFallBackOnPlainProse() {
        oracleReplies("I am not sure what you mean.");

        Decision decision = router.decide("blorp", memory, List.of());

        assertEquals(new Decision.DirectAnswer(String.format(QueryRouter.FALLBACK_TEMPLATE, "blorp")), decision);
    }

    @Test
    void shouldPropagateOracleUnavailable() {
        when(oracle.generate(anyString(), anyString())).thenThrow(new OracleUnavailableException("down"));

        List<ProviderDescriptor> providers = List.of(calculator);
        assertThrows(OracleUnavailableException.class, () -> router.decide("hi", memory, providers));
    }

    // ===== prompt =====

    @Test
    void shouldRenderHistoryCatalogAndUserText() {
        memory.append(Turn.user("What is 2 plus 2?"));
        memory.append(Turn.assistant("4"));
        memory.append(Turn.system("internal note"));
        oracleReplies("{\"action\": \"direct_response\", \"response\": \"ok\"}");

        router.decide("and times 3?", memory, List.of(calculator));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).generate(anyString(), prompt.capture());
        String rendered = prompt.getValue();
        assertTrue(rendered.contains("Conversation History:\nuser: What is 2 plus 2?\nassistant: 4\n"));
        assertFalse(rendered.contains("internal note"));
        assertTrue(rendered.contains("Server: Calculator (ID: calculator)"));
        assertTrue(rendered.contains("- a (number, required): First number"));
        assertTrue(rendered.contains("User input: \"and times 3?\""));
    }
}
