package me.golemcore.router.routing;

import me.golemcore.router.domain.exception.DecisionMalformedException;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.DecisionKind;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolParameter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DecisionParser parser = new DecisionParser(objectMapper);

    private static final ProviderDescriptor CALCULATOR = ProviderDescriptor.builder()
            .id("calculator")
            .name("Calculator")
            .tools(new ArrayList<>(List.of(ToolDescriptor.builder()
                    .name("add")
                    .description("Add two numbers")
                    .parameters(new ArrayList<>(List.of(
                            ToolParameter.builder().name("a").type("number").build(),
                            ToolParameter.builder().name("b").type("number").build())))
                    .build())))
            .build();

    private static final ProviderDescriptor UNINTROSPECTED = ProviderDescriptor.builder()
            .id("weather")
            .build();

    private Decision parse(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return parser.parse(node, List.of(CALCULATOR, UNINTROSPECTED));
    }

    // ===== direct answer =====

    @Test
    void shouldDecodeDirectAnswer() throws Exception {
        Decision decision = parse("{\"action\": \"direct_response\", \"response\": \"Paris.\", \"reasoning\": \"x\"}");

        assertEquals(new Decision.DirectAnswer("Paris."), decision);
    }

    @Test
    void shouldRejectDirectAnswerWithoutResponse() {
        assertThrows(DecisionMalformedException.class, () -> parse("{\"action\": \"direct_response\"}"));
    }

    @Test
    void shouldRejectMissingOrUnknownAction() {
        assertThrows(DecisionMalformedException.class, () -> parse("{\"response\": \"hi\"}"));
        assertThrows(DecisionMalformedException.class, () -> parse("{\"action\": \"launch_rockets\"}"));
    }

    // ===== invoke tool =====

    @Test
    void shouldDecodeToolCallWithAllParameters() throws Exception {
        Decision decision = parse("""
                {"action": "call_tool", "response": "Adding.",
                 "tool": {"serverId": "calculator", "name": "add", "parameters": {"a": 5, "b": 3}}}
                """);

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals("calculator", invoke.providerId());
        assertEquals("add", invoke.toolName());
        assertEquals(Map.of("a", 5, "b", 3), invoke.arguments());
        assertFalse(invoke.hasMissingParameters());
        assertEquals(DecisionKind.INVOKE_TOOL, invoke.kind());
    }

    @Test
    void shouldComputeMissingRequiredParameters() throws Exception {
        Decision decision = parse("""
                {"action": "call_tool",
                 "tool": {"serverId": "calculator", "name": "add", "parameters": {}}}
                """);

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals(List.of("a", "b"), invoke.missingParameters());
    }

    @Test
    void shouldTreatNullArgumentAsMissingAndMergeReportedNames() throws Exception {
        Decision decision = parse("""
                {"action": "invoke_tool",
                 "tool": {"providerId": "calculator", "name": "add", "parameters": {"a": 1, "b": null},
                          "missing_parameters": ["b", "precision"]}}
                """);

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals(Map.of("a", 1), invoke.arguments());
        assertEquals(List.of("b", "precision"), invoke.missingParameters());
    }

    @Test
    void shouldRejectUnknownOrDisabledProvider() {
        DecisionMalformedException e = assertThrows(DecisionMalformedException.class, () -> parse("""
                {"action": "call_tool", "tool": {"serverId": "stocks", "name": "quote"}}
                """));
        assertTrue(e.getMessage().contains("stocks"));
    }

    @Test
    void shouldRejectUnknownToolOnIntrospectedProvider() {
        assertThrows(DecisionMalformedException.class, () -> parse("""
                {"action": "call_tool", "tool": {"serverId": "calculator", "name": "sqrt"}}
                """));
    }

    @Test
    void shouldAcceptToolOnProviderWithoutKnownTools() throws Exception {
        Decision decision = parse("""
                {"action": "call_tool", "tool": {"serverId": "weather", "name": "forecast",
                 "parameters": {"city": "Oslo"}}}
                """);

        Decision.InvokeTool invoke = assertInstanceOf(Decision.InvokeTool.class, decision);
        assertEquals("weather", invoke.providerId());
        assertFalse(invoke.hasMissingParameters());
    }

    @Test
    void shouldRejectToolCallWithoutToolObject() {
        assertThrows(DecisionMalformedException.class, () -> parse("{\"action\": \"call_tool\"}"));
        assertThrows(DecisionMalformedException.class, () -> parse("""
                {"action": "call_tool", "tool": {"serverId": "calculator", "name": "add", "parameters": [1, 2]}}
                """));
    }

    // ===== management =====

    @Test
    void shouldDecodeManagementActions() throws Exception {
        assertEquals(new Decision.ListProviders(), parse("{\"action\": \"list_servers\"}"));
        assertEquals(new Decision.ProviderStatus(), parse("{\"action\": \"server_status\"}"));
        assertEquals(new Decision.SetProviderEnabled("weather", true),
                parse("{\"action\": \"activate_server\", \"server\": {\"id\": \"weather\"}}"));
        assertEquals(new Decision.SetProviderEnabled("weather", false),
                parse("{\"action\": \"deactivate_server\", \"server\": {\"id\": \"weather\"}}"));
        assertEquals(new Decision.InstallProviderDependencies("weather"),
                parse("{\"action\": \"install_server\", \"server\": {\"id\": \"weather\"}}"));
    }

    @Test
    void shouldDecodeRemoveWithDeleteFilesFlag() throws Exception {
        assertEquals(new Decision.RemoveProvider("old", true),
                parse("{\"action\": \"remove_server\", \"server\": {\"id\": \"old\", \"deleteFiles\": true}}"));
        assertEquals(new Decision.RemoveProvider("old", false),
                parse("{\"action\": \"remove_server\", \"server\": {\"id\": \"old\"}}"));
    }

    @Test
    void shouldNotRequireManagedProviderToExist() throws Exception {
        assertEquals(new Decision.SetProviderEnabled("nonexistent", true),
                parse("{\"action\": \"activate_server\", \"server\": {\"id\": \"nonexistent\"}}"));
    }

    @Test
    void shouldRejectManagementWithoutServerId() {
        assertThrows(DecisionMalformedException.class, () -> parse("{\"action\": \"remove_server\"}"));
        assertThrows(DecisionMalformedException.class,
                () -> parse("{\"action\": \"activate_server\", \"server\": {}}"));
    }
}
