package com.pyflow.provider.ollama;

import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.LlmProviderFactory;
import com.pyflow.llm.ProviderSettings;

/**
 * SPI factory for {@link OllamaProvider}. Falls back to OLLAMA_BASE_URL and OLLAMA_MODEL from the
 * environment when the settings leave them unset.
 */
public final class OllamaProviderFactory implements LlmProviderFactory {

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    public LlmProvider create(ProviderSettings settings) {
        String baseUrl = settings.baseUrl() != null ? settings.baseUrl() : System.getenv("OLLAMA_BASE_URL");
        String model = settings.model() != null ? settings.model() : System.getenv("OLLAMA_MODEL");
        return new OllamaProvider(new ProviderSettings(model, baseUrl, settings.apiKey(), settings.timeout()));
    }
}
