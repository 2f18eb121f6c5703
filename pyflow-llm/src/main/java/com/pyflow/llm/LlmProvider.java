package com.pyflow.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Chat-completion capability used by the semantic analyzer. Implementations are discovered
 * through {@link LlmProviderFactory} or injected directly (tests use lambdas or anonymous classes).
 */
public interface LlmProvider {

    /** Appended to the system prompt when a JSON reply is required. */
    String JSON_INSTRUCTION = "You must respond with valid JSON only. No other text.";

    /**
     * Sends one prompt and returns the raw reply text.
     *
     * @param systemPrompt may be null
     * @throws ProviderException when the call fails or the reply is empty
     */
    String complete(String prompt, String systemPrompt);

    /**
     * Sends one prompt and parses the reply as a JSON object, tolerating code fences and prose
     * around it.
     *
     * @throws ProviderException       when the call fails
     * @throws ResponseParseException  when no JSON can be recovered from the reply
     */
    default JsonNode completeJson(String prompt, String systemPrompt) {
        String system = systemPrompt == null || systemPrompt.isBlank()
                ? JSON_INSTRUCTION : systemPrompt + "\n\n" + JSON_INSTRUCTION;
        return LlmResponseParser.parse(complete(prompt, system));
    }

    String modelName();
}
