package me.golemcore.router.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OracleJsonTest {

    private final OracleJson oracleJson = new OracleJson(new ObjectMapper());

    // ===== parseObject =====

    @Test
    void shouldParseBareObject() {
        Optional<JsonNode> node = oracleJson.parseObject("{\"action\": \"direct_response\", \"response\": \"Hi\"}");

        assertTrue(node.isPresent());
        assertEquals("Hi", node.get().get("response").asText());
    }

    @Test
    void shouldFindObjectInsideProse() {
        String reply = "Sure! Here is my decision:\n{\"action\": \"list_servers\"}\nLet me know if that helps.";

        Optional<JsonNode> node = oracleJson.parseObject(reply);

        assertEquals("list_servers", node.orElseThrow().get("action").asText());
    }

    @Test
    void shouldPreferJsonFence() {
        String reply = "Example {\"a\": 1} then\n```json\n{\"action\": \"server_status\"}\n```";

        assertEquals("server_status", oracleJson.parseObject(reply).orElseThrow().get("action").asText());
    }

    @Test
    void shouldHandleNestedObjectsAndBracesInStrings() {
        String reply = "{\"action\": \"call_tool\", \"response\": \"use {braces}\", "
                + "\"tool\": {\"serverId\": \"calculator\", \"parameters\": {\"a\": 5}}} trailing }";

        JsonNode node = oracleJson.parseObject(reply).orElseThrow();

        assertEquals(5, node.get("tool").get("parameters").get("a").asInt());
        assertEquals("use {braces}", node.get("response").asText());
    }

    @Test
    void shouldStripControlCharacters() {
        String reply = "{\"response\": \"line\u0001one\"}";

        assertEquals("lineone", oracleJson.parseObject(reply).orElseThrow().get("response").asText());
    }

    @Test
    void shouldSkipUnbalancedPrefix() {
        String reply = "{ broken and then {\"ok\": true}";

        assertTrue(oracleJson.parseObject(reply).isPresent());
    }

    @Test
    void shouldReturnEmptyWithoutObject() {
        assertTrue(oracleJson.parseObject("I think the answer is 42.").isEmpty());
        assertTrue(oracleJson.parseObject("").isEmpty());
        assertTrue(oracleJson.parseObject(null).isEmpty());
    }

    @Test
    void shouldReturnEmptyForInvalidJson() {
        assertTrue(oracleJson.parseObject("{\"action\": direct_response}").isEmpty());
    }

    // ===== salvageString / withoutSignal / extractCodeBlock / readFlag =====

    @Test
    void shouldSalvageStringFromTruncatedObject() {
        String reply = "{\"action\": \"direct_response\", \"response\": \"Paris is the \\\"capital\\\"\", \"reas";

        assertEquals(Optional.of("Paris is the \"capital\""), oracleJson.salvageString(reply, "response"));
    }

    @Test
    void shouldRemoveObjectFromProse() {
        String reply = "Great, I have everything I need.\n{\"advance\": true}";

        assertEquals("Great, I have everything I need.", oracleJson.withoutSignal(reply, "advance"));
    }

    @Test
    void shouldKeepExampleObjectsWhenRemovingSignal() {
        String reply = "Input looks like {\"city\": \"Paris\"}. Which units?\n```json\n{\"advance\": false}\n```";

        assertEquals("Input looks like {\"city\": \"Paris\"}. Which units?",
                oracleJson.withoutSignal(reply, "advance"));
    }

    @Test
    void shouldExtractFirstCodeBlock() {
        String reply = "Here you go:\n```javascript\nconsole.log(1);\n```\nDone.";

        assertEquals(Optional.of("console.log(1);"), oracleJson.extractCodeBlock(reply));
        assertTrue(oracleJson.extractCodeBlock("no code here").isEmpty());
    }

    @Test
    void shouldReadBooleanAndTextualFlags() {
        assertEquals(Optional.of(true), oracleJson.readFlag("{\"advance\": true}", "advance"));
        assertEquals(Optional.of(false), oracleJson.readFlag("{\"advance\": \"no\"}", "advance"));
        assertTrue(oracleJson.readFlag("{\"advance\": \"maybe\"}", "advance").isEmpty());
        assertTrue(oracleJson.readFlag("{\"other\": true}", "advance").isEmpty());
        assertTrue(oracleJson.readFlag("yes, let's go", "advance").isEmpty());
    }

    @Test
    void shouldReadFlagFromTrailingObjectAfterExamples() {
        String reply = "Call it with {\"city\": \"Paris\"} or {\"advance\": \"later\", \"x\": 1}.\n{\"advance\": false}";

        assertEquals(Optional.of(false), oracleJson.readFlag(reply, "advance"));
        assertTrue(oracleJson.readFlag("Example: {\"city\": \"Paris\"}", "advance").isEmpty());
    }
}
