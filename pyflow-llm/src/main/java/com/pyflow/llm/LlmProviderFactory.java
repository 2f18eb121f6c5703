package com.pyflow.llm;

/**
 * SPI for LLM providers. Implementations are discovered via {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.pyflow.llm.LlmProviderFactory}) and selected by {@link #name()};
 * adding a provider needs no change to the converter.
 */
public interface LlmProviderFactory {

    /** Lower-case selector, e.g. {@code ollama} or {@code openai}. */
    String name();

    /**
     * Creates a provider. Factories validate what they require (an API key, a model) and throw
     * {@link ProviderException} when it is missing.
     */
    LlmProvider create(ProviderSettings settings);
}
