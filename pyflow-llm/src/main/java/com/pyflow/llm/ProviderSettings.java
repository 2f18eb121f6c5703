package com.pyflow.llm;

import java.time.Duration;

/**
 * Connection settings handed to a {@link LlmProviderFactory}. Null model or base URL means the
 * provider's own default.
 */
public record ProviderSettings(String model, String baseUrl, String apiKey, Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public ProviderSettings {
        model = blankToNull(model);
        baseUrl = blankToNull(baseUrl);
        apiKey = blankToNull(apiKey);
        timeout = timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : DEFAULT_TIMEOUT;
    }

    public static ProviderSettings defaults() {
        return new ProviderSettings(null, null, null, DEFAULT_TIMEOUT);
    }

    public String modelOr(String fallback) {
        return model != null ? model : fallback;
    }

    /** Base URL without a trailing slash, or the fallback. */
    public String baseUrlOr(String fallback) {
        String url = baseUrl != null ? baseUrl : fallback;
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        return url;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override
    public String toString() {
        return "ProviderSettings{model=" + model + ", baseUrl=" + baseUrl + ", apiKey=" + (apiKey != null ? "***" : null)
                + ", timeout=" + timeout + "}";
    }
}
