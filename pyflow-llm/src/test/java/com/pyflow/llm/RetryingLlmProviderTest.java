package com.pyflow.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryingLlmProviderTest {

    /** Replays scripted outcomes: a String is returned, a RuntimeException thrown. */
    private static final class ScriptedProvider implements LlmProvider {
        private final Deque<Object> outcomes;
        int calls;

        ScriptedProvider(Object... outcomes) {
            this.outcomes = new ArrayDeque<>(List.of(outcomes));
        }

        @Override
        public String complete(String prompt, String systemPrompt) {
            calls++;
            Object next = outcomes.poll();
            if (next instanceof RuntimeException e) throw e;
            return (String) next;
        }

        @Override
        public String modelName() {
            return "scripted";
        }
    }

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryingLlmProvider retrying(LlmProvider delegate, int attempts) {
        return new RetryingLlmProvider(delegate, attempts, Duration.ofMillis(100), sleeps::add);
    }

    @Test
    void retriesTransientFailuresWithDoublingBackoff() {
        ScriptedProvider delegate = new ScriptedProvider(
                ProviderException.httpStatus("p", 503, ""),
                ProviderException.unreachable("p", new java.io.IOException("reset")),
                "ok");
        assertEquals("ok", retrying(delegate, 3).complete("q", null));
        assertEquals(3, delegate.calls);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void uncheckedIoFailuresAreRetriedAsTransient() {
        ScriptedProvider delegate = new ScriptedProvider(
                new java.io.UncheckedIOException("connection reset", new java.io.IOException("connection reset")),
                "ok");
        assertEquals("ok", retrying(delegate, 2).complete("q", null));
        assertEquals(2, delegate.calls);
    }

    @Test
    void otherRuntimeFailuresAreWrappedAndNotRetried() {
        ScriptedProvider delegate = new ScriptedProvider(new IllegalStateException("client closed"), "never");
        ProviderException e = assertThrows(ProviderException.class, () -> retrying(delegate, 3).complete("q", null));
        assertFalse(e.isTransient());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, delegate.calls);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        ScriptedProvider delegate = new ScriptedProvider(
                ProviderException.httpStatus("p", 502, ""),
                ProviderException.httpStatus("p", 502, ""),
                "never");
        ProviderException e = assertThrows(ProviderException.class, () -> retrying(delegate, 2).complete("q", null));
        assertEquals(502, e.getStatusCode());
        assertEquals(2, delegate.calls);
        assertEquals(1, sleeps.size());
    }

    @Test
    void permanentFailuresAreNotRetried() {
        ScriptedProvider delegate = new ScriptedProvider(ProviderException.httpStatus("p", 401, "bad key"), "never");
        assertThrows(ProviderException.class, () -> retrying(delegate, 5).complete("q", null));
        assertEquals(1, delegate.calls);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void parseErrorsAreNotRetried() {
        ScriptedProvider delegate = new ScriptedProvider("no json here", "{\"steps\": []}");
        assertThrows(ResponseParseException.class, () -> retrying(delegate, 3).completeJson("q", "sys"));
        assertEquals(1, delegate.calls);
    }

    @Test
    void jsonCallsRetryToo() {
        ScriptedProvider delegate = new ScriptedProvider(ProviderException.httpStatus("p", 429, ""), "{\"steps\": []}");
        JsonNode node = retrying(delegate, 3).completeJson("q", "sys");
        assertTrue(node.get("steps").isArray());
        assertEquals("scripted", retrying(delegate, 3).modelName());
    }

    @Test
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> retrying(new ScriptedProvider(), 0));
    }
}
