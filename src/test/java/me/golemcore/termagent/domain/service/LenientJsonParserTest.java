package me.golemcore.termagent.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LenientJsonParserTest {

    private final LenientJsonParser parser = new LenientJsonParser(new ObjectMapper());

    @Test
    void shouldExtractObjectSurroundedByProse() {
        // Act
        Optional<JsonNode> node = parser.parse("I'll check the disk now: {\"tool\": \"execute_command\"} ok?");

        // Assert
        assertEquals("execute_command", node.orElseThrow().get("tool").asText());
    }

    @Test
    void shouldRepairCommonSyntaxSlips() {
        // Act
        Optional<JsonNode> node = parser.parse("{tool: 'finish', // done\n 'arguments': {'summary': 'ok',},}");

        // Assert
        assertEquals("ok", node.orElseThrow().get("arguments").get("summary").asText());
    }

    @Test
    void shouldIgnoreBracesInsideStrings() {
        // Act
        Optional<String> block = LenientJsonParser.extractBalancedBlock(
                "before {\"command\": \"echo '}' && echo {\"} after");

        // Assert
        assertEquals("{\"command\": \"echo '}' && echo {\"}", block.orElseThrow());
    }

    @Test
    void shouldRejectScalarsAndEmptyInput() {
        assertTrue(parser.parse("42").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("{unterminated").isEmpty());
    }
}
