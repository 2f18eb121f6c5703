package com.pyflow.provider.openai;

import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.LlmProviderFactory;
import com.pyflow.llm.ProviderException;
import com.pyflow.llm.ProviderSettings;

/**
 * SPI factory for {@link OpenAiProvider}. The API key falls back to OPENAI_API_KEY; a key is
 * required for the public OpenAI endpoint but optional for a custom base URL (local proxies).
 */
public final class OpenAiProviderFactory implements LlmProviderFactory {

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public LlmProvider create(ProviderSettings settings) {
        return create(settings, System.getenv("OPENAI_API_KEY"));
    }

    LlmProvider create(ProviderSettings settings, String environmentKey) {
        String apiKey = settings.apiKey() != null ? settings.apiKey() : environmentKey;
        ProviderSettings effective = new ProviderSettings(settings.model(), settings.baseUrl(), apiKey, settings.timeout());
        if (effective.apiKey() == null && effective.baseUrl() == null) {
            throw ProviderException.configuration(
                    "OpenAI API key required. Set PYFLOW_LLM_API_KEY or OPENAI_API_KEY, or point PYFLOW_LLM_BASE_URL at a proxy");
        }
        return new OpenAiProvider(effective);
    }
}
