package com.pyflow.provider.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.LlmResponseParser;
import com.pyflow.llm.ProviderException;
import com.pyflow.llm.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmProvider} that calls the Ollama API.
 * <p>
 * Uses {@code POST {baseUrl}/api/chat} with a system message (when given) and one user message,
 * {@code stream=false}. JSON calls also set {@code format=json}.
 */
public final class OllamaProvider implements LlmProvider {

    static final String NAME = "Ollama";
    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama3.2";

    private static final Logger log = LoggerFactory.getLogger(OllamaProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, Object> OPTIONS = Map.of("temperature", 0.1);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;

    public OllamaProvider(ProviderSettings settings) {
        this.baseUrl = settings.baseUrlOr(DEFAULT_BASE_URL);
        this.model = settings.modelOr(DEFAULT_MODEL);
        this.timeout = settings.timeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(String prompt, String systemPrompt) {
        return chat(prompt, systemPrompt, null);
    }

    @Override
    public JsonNode completeJson(String prompt, String systemPrompt) {
        String system = systemPrompt == null || systemPrompt.isBlank()
                ? JSON_INSTRUCTION : systemPrompt + "\n\n" + JSON_INSTRUCTION;
        return LlmResponseParser.parse(chat(prompt, system, "json"));
    }

    @Override
    public String modelName() {
        return model;
    }

    private String chat(String prompt, String systemPrompt, String format) {
        List<OllamaChatRequest.Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new OllamaChatRequest.Message("system", systemPrompt));
        }
        messages.add(new OllamaChatRequest.Message("user", prompt != null ? prompt : ""));
        OllamaChatRequest req = new OllamaChatRequest(model, messages, format, OPTIONS);

        String json;
        try {
            json = MAPPER.writeValueAsString(req);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Could not encode Ollama request: " + e.getOriginalMessage(), -1, false, e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/chat"))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        long started = System.nanoTime();
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw ProviderException.unreachable(NAME, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Ollama request interrupted", -1, false, e);
        }
        if (response.statusCode() != 200) {
            throw ProviderException.httpStatus(NAME, response.statusCode(), response.body());
        }

        OllamaChatResponse resp;
        try {
            resp = MAPPER.readValue(response.body(), OllamaChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Ollama returned a body that is not a chat response: " + e.getOriginalMessage(),
                    response.statusCode(), false, e);
        }
        String content = resp != null && resp.getMessage() != null ? resp.getMessage().getContent() : null;
        if (content == null || content.isBlank()) {
            throw ProviderException.emptyResponse(NAME);
        }
        log.debug("Ollama chat complete | model={} promptTokens={} completionTokens={} elapsedMs={}",
                resp.getModel() != null ? resp.getModel() : model, resp.getPromptEvalCount(), resp.getEvalCount(),
                (System.nanoTime() - started) / 1_000_000);
        return content;
    }
}
