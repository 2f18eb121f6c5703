package com.pyflow.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the analysis JSON object from model output. Handles the quirks models produce:
 * markdown code fences, prose before or after the object, a JSON document encoded as a JSON
 * string, and a bare array of steps (wrapped as {@code {"steps": [...]}}).
 */
public final class LlmResponseParser {

    private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final int MAX_DECODE_DEPTH = 3;

    private LlmResponseParser() {
    }

    /**
     * @return a JSON object node
     * @throws ResponseParseException when the text holds no JSON object or array
     */
    public static ObjectNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseParseException("Model reply is empty", raw);
        }
        String trimmed = raw.strip();
        Matcher fence = FENCE.matcher(trimmed);
        String candidate = fence.find() ? fence.group(1).strip() : trimmed;

        JsonNode node = readLenient(candidate, 0);
        if (node == null && !candidate.equals(trimmed)) node = readLenient(trimmed, 0);
        if (node == null) node = readEmbedded(trimmed);
        if (node == null) {
            log.warn("LLM reply JSON parse failed | length={} | raw snippet=[{}]", trimmed.length(),
                    ProviderException.abbreviate(trimmed));
            throw new ResponseParseException("Model reply contains no JSON object", raw);
        }
        if (node.isArray()) {
            log.debug("LLM reply is a bare array; wrapping as steps | size={}", node.size());
            ObjectNode wrapped = MAPPER.createObjectNode();
            wrapped.set("steps", node);
            return wrapped;
        }
        return (ObjectNode) node;
    }

    /** Object or array parsed from the whole text, unwrapping string-encoded JSON; null otherwise. */
    private static JsonNode readLenient(String text, int depth) {
        if (depth > MAX_DECODE_DEPTH) return null;
        JsonNode node;
        try {
            node = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("LLM reply is not plain JSON | depth={} | error={}", depth, e.getOriginalMessage());
            return null;
        }
        if (node == null) return null;
        if (node.isObject() || node.isArray()) return node;
        if (node.isTextual()) {
            String inner = node.asText().strip();
            if (inner.startsWith("{") || inner.startsWith("[")) return readLenient(inner, depth + 1);
        }
        return null;
    }

    /** First balanced {@code {...}} or {@code [...]} inside surrounding prose that parses as JSON. */
    private static JsonNode readEmbedded(String text) {
        for (int start = 0; start < text.length(); start++) {
            char c = text.charAt(start);
            if (c != '{' && c != '[') continue;
            int end = matchingClose(text, start);
            if (end < 0) continue;
            JsonNode node = readLenient(text.substring(start, end + 1), 0);
            if (node != null) return node;
        }
        return null;
    }

    /** Index of the bracket closing the one at {@code start}, skipping string contents; -1 if unbalanced. */
    static int matchingClose(String text, int start) {
        char open = text.charAt(start);
        char close = open == '{' ? '}' : ']';
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (inString) {
                if (c == '\\') escape = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
