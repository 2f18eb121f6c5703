package com.pyflow.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/** Looks up {@link LlmProviderFactory} implementations on the class path. */
public final class LlmProviders {

    private static final Logger log = LoggerFactory.getLogger(LlmProviders.class);

    private LlmProviders() {
    }

    /**
     * Creates the provider registered under {@code name} (case-insensitive).
     *
     * @throws ProviderException when no factory has that name
     */
    public static LlmProvider create(String name, ProviderSettings settings) {
        return create(name, settings, Thread.currentThread().getContextClassLoader());
    }

    static LlmProvider create(String name, ProviderSettings settings, ClassLoader loader) {
        String wanted = name != null ? name.trim().toLowerCase(Locale.ROOT) : "";
        List<String> seen = new ArrayList<>();
        for (LlmProviderFactory factory : ServiceLoader.load(LlmProviderFactory.class, loader)) {
            String factoryName = factory.name().toLowerCase(Locale.ROOT);
            seen.add(factoryName);
            if (factoryName.equals(wanted)) {
                log.info("LLM provider selected | name={} | settings={}", factoryName, settings);
                return factory.create(settings != null ? settings : ProviderSettings.defaults());
            }
        }
        throw ProviderException.configuration(String.format("Unknown LLM provider '%s'; available: %s", name, seen));
    }

    /** Names of every factory visible to the context class loader, in discovery order. */
    public static List<String> available() {
        List<String> names = new ArrayList<>();
        for (LlmProviderFactory factory : ServiceLoader.load(LlmProviderFactory.class)) {
            names.add(factory.name().toLowerCase(Locale.ROOT));
        }
        return names;
    }
}
