package com.pyflow.llm;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmResponseParserTest {

    @Test
    void plainObject() {
        ObjectNode node = LlmResponseParser.parse("{\"steps\": [], \"code_summary\": \"x\"}");
        assertEquals("x", node.get("code_summary").asText());
    }

    @Test
    void fencedBlock() {
        String raw = """
                Here is the analysis:
                ```json
                {"steps": [{"operation": "filter"}]}
                ```
                Let me know if you need more.""";
        assertEquals("filter", LlmResponseParser.parse(raw).get("steps").get(0).get("operation").asText());
    }

    @Test
    void objectInsideProse() {
        String raw = "Sure! {\"steps\": [{\"description\": \"keep rows where a } b\"}]} Hope that helps.";
        ObjectNode node = LlmResponseParser.parse(raw);
        assertEquals("keep rows where a } b", node.get("steps").get(0).get("description").asText());
    }

    @Test
    void doubleEncodedString() {
        String raw = "\"{\\\"steps\\\": [], \\\"complexity_score\\\": 4}\"";
        assertEquals(4, LlmResponseParser.parse(raw).get("complexity_score").asInt());
    }

    @Test
    void bareArrayBecomesSteps() {
        ObjectNode node = LlmResponseParser.parse("[{\"operation\": \"sort\"}, {\"operation\": \"join\"}]");
        assertEquals(2, node.get("steps").size());
    }

    @Test
    void noJsonAtAll() {
        ResponseParseException e = assertThrows(ResponseParseException.class,
                () -> LlmResponseParser.parse("I could not analyze this code."));
        assertTrue(e.getSnippet().startsWith("I could not"));
    }

    @Test
    void emptyReply() {
        assertThrows(ResponseParseException.class, () -> LlmResponseParser.parse("   "));
    }

    @Test
    void longRepliesAreTruncatedInSnippet() {
        String raw = "x".repeat(1000);
        ResponseParseException e = assertThrows(ResponseParseException.class, () -> LlmResponseParser.parse(raw));
        assertTrue(e.getSnippet().length() < 400);
        assertTrue(e.getSnippet().contains("length=1000"));
    }
}
