package com.pyflow.provider.openai;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmProvider} for OpenAI-compatible APIs (OpenAI itself, a LiteLLM proxy, vLLM).
 * Uses {@code POST {baseUrl}/v1/chat/completions}; JSON calls ask for
 * {@code response_format: {type: json_object}}.
 */
public final class OpenAiProvider implements LlmProvider {

    static final String NAME = "OpenAI";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_MODEL = "gpt-4o";
    static final int MAX_TOKENS = 4096;

    private static final Logger log = LoggerFactory.getLogger(OpenAiProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;

    public OpenAiProvider(ProviderSettings settings) {
        this.baseUrl = settings.baseUrlOr(DEFAULT_BASE_URL);
        this.model = settings.modelOr(DEFAULT_MODEL);
        this.apiKey = settings.apiKey();
        this.timeout = settings.timeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(String prompt, String systemPrompt) {
        return chat(prompt, systemPrompt, false);
    }

    @Override
    public JsonNode completeJson(String prompt, String systemPrompt) {
        String system = systemPrompt == null || systemPrompt.isBlank()
                ? JSON_INSTRUCTION : systemPrompt + "\n\n" + JSON_INSTRUCTION;
        return LlmResponseParser.parse(chat(prompt, system, true));
    }

    @Override
    public String modelName() {
        return model;
    }

    private String chat(String prompt, String systemPrompt, boolean jsonMode) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", prompt != null ? prompt : ""));

        Map<String, Object> reqBody = new LinkedHashMap<>();
        reqBody.put("model", model);
        reqBody.put("messages", messages);
        reqBody.put("max_tokens", MAX_TOKENS);
        if (jsonMode) reqBody.put("response_format", Map.of("type", "json_object"));

        String json;
        try {
            json = MAPPER.writeValueAsString(reqBody);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Could not encode chat request: " + e.getOriginalMessage(), -1, false, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        if (apiKey != null) builder.header("Authorization", "Bearer " + apiKey);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw ProviderException.unreachable(NAME, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("OpenAI request interrupted", -1, false, e);
        }
        if (response.statusCode() != 200) {
            throw ProviderException.httpStatus(NAME, response.statusCode(), response.body());
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderException("OpenAI returned a body that is not a chat completion: " + e.getOriginalMessage(),
                    response.statusCode(), false, e);
        }
        String content = "";
        JsonNode choices = root.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            content = choices.get(0).path("message").path("content").asText("");
        }
        if (content.isBlank()) {
            throw ProviderException.emptyResponse(NAME);
        }
        if (!root.path("usage").isMissingNode()) {
            log.debug("Chat completion | model={} promptTokens={} completionTokens={}",
                    root.path("model").asText(model),
                    root.path("usage").path("prompt_tokens").asLong(0),
                    root.path("usage").path("completion_tokens").asLong(0));
        }
        return content;
    }
}
