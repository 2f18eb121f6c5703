package com.pyflow.provider.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.LlmProviders;
import com.pyflow.llm.ProviderException;
import com.pyflow.llm.ProviderSettings;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OllamaProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> reply = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/chat", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OllamaProvider provider() {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new OllamaProvider(new ProviderSettings("qwen2.5-coder", url, null, Duration.ofSeconds(5)));
    }

    private static String chatReply(String content) throws IOException {
        return MAPPER.writeValueAsString(MAPPER.createObjectNode()
                .put("model", "qwen2.5-coder")
                .put("done", true)
                .put("eval_count", 12)
                .set("message", MAPPER.createObjectNode().put("role", "assistant").put("content", content)));
    }

    @Test
    void sendsSystemAndUserMessages() throws IOException {
        reply.set(chatReply("hello back"));
        assertEquals("hello back", provider().complete("hello", "be brief"));

        JsonNode sent = MAPPER.readTree(requestBody.get());
        assertEquals("qwen2.5-coder", sent.get("model").asText());
        assertFalse(sent.get("stream").asBoolean());
        assertFalse(sent.has("format"));
        assertEquals("system", sent.get("messages").get(0).get("role").asText());
        assertEquals("be brief", sent.get("messages").get(0).get("content").asText());
        assertEquals("hello", sent.get("messages").get(1).get("content").asText());
    }

    @Test
    void jsonCallsRequestJsonFormat() throws IOException {
        reply.set(chatReply("```json\n{\"steps\": []}\n```"));
        JsonNode node = provider().completeJson("analyze", "sys");
        assertTrue(node.get("steps").isArray());

        JsonNode sent = MAPPER.readTree(requestBody.get());
        assertEquals("json", sent.get("format").asText());
        assertTrue(sent.get("messages").get(0).get("content").asText().endsWith(LlmProvider.JSON_INSTRUCTION));
    }

    @Test
    void serverErrorIsTransient() {
        status.set(503);
        reply.set("model is loading");
        ProviderException e = assertThrows(ProviderException.class, () -> provider().complete("x", null));
        assertEquals(503, e.getStatusCode());
        assertTrue(e.isTransient());
        assertTrue(e.getMessage().contains("model is loading"));
    }

    @Test
    void notFoundIsPermanent() {
        status.set(404);
        reply.set("{\"error\": \"model not found\"}");
        ProviderException e = assertThrows(ProviderException.class, () -> provider().complete("x", null));
        assertFalse(e.isTransient());
    }

    @Test
    void emptyContentIsNotRetried() throws IOException {
        reply.set(chatReply(""));
        ProviderException e = assertThrows(ProviderException.class, () -> provider().complete("x", null));
        assertFalse(e.isTransient());
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    void unreachableServerIsTransient() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        OllamaProvider provider = new OllamaProvider(
                new ProviderSettings(null, "http://127.0.0.1:" + port, null, Duration.ofSeconds(5)));
        ProviderException e = assertThrows(ProviderException.class, () -> provider.complete("x", null));
        assertTrue(e.isTransient());
    }

    @Test
    void discoveredThroughServiceLoader() {
        LlmProvider provider = LlmProviders.create("ollama", new ProviderSettings("mistral", null, null, null));
        assertInstanceOf(OllamaProvider.class, provider);
        assertEquals("mistral", provider.modelName());
    }
}
