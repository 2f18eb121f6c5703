package com.pyflow.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one converter, loaded from environment variables.
 * <p>
 * Analysis: PYFLOW_ANALYSIS_MODE ({@code STATIC} or {@code SEMANTIC}), PYFLOW_OPTIMIZE.
 * Naming: PYFLOW_FLOW_NAME, PYFLOW_RECIPE_PREFIX, PYFLOW_RECIPE_SUFFIX.
 * Model access: PYFLOW_LLM_PROVIDER, PYFLOW_LLM_MODEL, PYFLOW_LLM_BASE_URL, PYFLOW_LLM_API_KEY,
 * PYFLOW_LLM_TIMEOUT_SECONDS, PYFLOW_LLM_MAX_ATTEMPTS, PYFLOW_LLM_RETRY_BACKOFF_MILLIS.
 * <p>
 * Unset or blank variables take their default; a value that does not parse raises
 * {@link ConfigurationException} naming the variable.
 */
public final class ConverterConfig {

    static final String ENV_ANALYSIS_MODE = "PYFLOW_ANALYSIS_MODE";
    static final String ENV_OPTIMIZE = "PYFLOW_OPTIMIZE";
    static final String ENV_FLOW_NAME = "PYFLOW_FLOW_NAME";
    static final String ENV_RECIPE_PREFIX = "PYFLOW_RECIPE_PREFIX";
    static final String ENV_RECIPE_SUFFIX = "PYFLOW_RECIPE_SUFFIX";
    static final String ENV_LLM_PROVIDER = "PYFLOW_LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "PYFLOW_LLM_MODEL";
    static final String ENV_LLM_BASE_URL = "PYFLOW_LLM_BASE_URL";
    static final String ENV_LLM_API_KEY = "PYFLOW_LLM_API_KEY";
    static final String ENV_LLM_TIMEOUT_SECONDS = "PYFLOW_LLM_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_ATTEMPTS = "PYFLOW_LLM_MAX_ATTEMPTS";
    static final String ENV_LLM_RETRY_BACKOFF_MILLIS = "PYFLOW_LLM_RETRY_BACKOFF_MILLIS";

    public static final String DEFAULT_FLOW_NAME = "converted_flow";
    public static final String DEFAULT_LLM_PROVIDER = "ollama";
    private static final int DEFAULT_TIMEOUT_SECONDS = 120;
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_RETRY_BACKOFF_MILLIS = 500;

    private final AnalysisMode analysisMode;
    private final boolean optimize;
    private final String flowName;
    private final String recipePrefix;
    private final String recipeSuffix;
    private final String llmProvider;
    private final String llmModel;
    private final String llmBaseUrl;
    private final String llmApiKey;
    private final Duration llmTimeout;
    private final int llmMaxAttempts;
    private final Duration llmRetryBackoff;

    private ConverterConfig(Builder b) {
        this.analysisMode = b.analysisMode;
        this.optimize = b.optimize;
        this.flowName = b.flowName;
        this.recipePrefix = b.recipePrefix;
        this.recipeSuffix = b.recipeSuffix;
        this.llmProvider = b.llmProvider;
        this.llmModel = b.llmModel;
        this.llmBaseUrl = b.llmBaseUrl;
        this.llmApiKey = b.llmApiKey;
        this.llmTimeout = b.llmTimeout;
        this.llmMaxAttempts = b.llmMaxAttempts;
        this.llmRetryBackoff = b.llmRetryBackoff;
    }

    public static ConverterConfig defaults() {
        return builder().build();
    }

    public static ConverterConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} over an explicit variable map. */
    public static ConverterConfig fromVariables(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .analysisMode(parseMode(env.get(ENV_ANALYSIS_MODE)))
                .optimize(parseBoolean(ENV_OPTIMIZE, env.get(ENV_OPTIMIZE), true))
                .flowName(getEnv(env, ENV_FLOW_NAME, DEFAULT_FLOW_NAME))
                .recipePrefix(getEnv(env, ENV_RECIPE_PREFIX, ""))
                .recipeSuffix(getEnv(env, ENV_RECIPE_SUFFIX, ""))
                .llmProvider(getEnv(env, ENV_LLM_PROVIDER, DEFAULT_LLM_PROVIDER))
                .llmModel(getEnv(env, ENV_LLM_MODEL, null))
                .llmBaseUrl(getEnv(env, ENV_LLM_BASE_URL, null))
                .llmApiKey(getEnv(env, ENV_LLM_API_KEY, null))
                .llmTimeout(Duration.ofSeconds(parsePositive(ENV_LLM_TIMEOUT_SECONDS, env.get(ENV_LLM_TIMEOUT_SECONDS), DEFAULT_TIMEOUT_SECONDS)))
                .llmMaxAttempts((int) parsePositive(ENV_LLM_MAX_ATTEMPTS, env.get(ENV_LLM_MAX_ATTEMPTS), DEFAULT_MAX_ATTEMPTS))
                .llmRetryBackoff(Duration.ofMillis(parseNonNegative(ENV_LLM_RETRY_BACKOFF_MILLIS,
                        env.get(ENV_LLM_RETRY_BACKOFF_MILLIS), DEFAULT_RETRY_BACKOFF_MILLIS)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .analysisMode(analysisMode)
                .optimize(optimize)
                .flowName(flowName)
                .recipePrefix(recipePrefix)
                .recipeSuffix(recipeSuffix)
                .llmProvider(llmProvider)
                .llmModel(llmModel)
                .llmBaseUrl(llmBaseUrl)
                .llmApiKey(llmApiKey)
                .llmTimeout(llmTimeout)
                .llmMaxAttempts(llmMaxAttempts)
                .llmRetryBackoff(llmRetryBackoff);
    }

    public AnalysisMode getAnalysisMode() {
        return analysisMode;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public String getFlowName() {
        return flowName;
    }

    public String getRecipePrefix() {
        return recipePrefix;
    }

    public String getRecipeSuffix() {
        return recipeSuffix;
    }

    public String getLlmProvider() {
        return llmProvider;
    }

    /** Model name, or null for the provider's default. */
    public String getLlmModel() {
        return llmModel;
    }

    /** Base URL, or null for the provider's default. */
    public String getLlmBaseUrl() {
        return llmBaseUrl;
    }

    public String getLlmApiKey() {
        return llmApiKey;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    /** Attempts per model call, the first one included. */
    public int getLlmMaxAttempts() {
        return llmMaxAttempts;
    }

    public Duration getLlmRetryBackoff() {
        return llmRetryBackoff;
    }

    @Override
    public String toString() {
        return "ConverterConfig{mode=" + analysisMode + ", optimize=" + optimize + ", flowName=" + flowName
                + ", provider=" + llmProvider + ", model=" + llmModel + ", baseUrl=" + llmBaseUrl
                + ", apiKey=" + (llmApiKey != null ? "***" : null) + ", timeout=" + llmTimeout
                + ", maxAttempts=" + llmMaxAttempts + "}";
    }

    private static AnalysisMode parseMode(String value) {
        if (value == null || value.isBlank()) return AnalysisMode.STATIC;
        AnalysisMode mode = AnalysisMode.fromValue(value);
        if (mode == null) throw new ConfigurationException(ENV_ANALYSIS_MODE, value, "STATIC or SEMANTIC");
        return mode;
    }

    private static boolean parseBoolean(String variable, String value, boolean defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1") || v.equals("yes")) return true;
        if (v.equals("false") || v.equals("0") || v.equals("no")) return false;
        throw new ConfigurationException(variable, value, "true or false");
    }

    private static long parsePositive(String variable, String value, long defaultValue) {
        long parsed = parseLong(variable, value, defaultValue, "a positive integer");
        if (parsed < 1) throw new ConfigurationException(variable, value, "a positive integer");
        return parsed;
    }

    private static long parseNonNegative(String variable, String value, long defaultValue) {
        long parsed = parseLong(variable, value, defaultValue, "a non-negative integer");
        if (parsed < 0) throw new ConfigurationException(variable, value, "a non-negative integer");
        return parsed;
    }

    private static long parseLong(String variable, String value, long defaultValue, String expected) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(variable, value, expected, e);
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private AnalysisMode analysisMode = AnalysisMode.STATIC;
        private boolean optimize = true;
        private String flowName = DEFAULT_FLOW_NAME;
        private String recipePrefix = "";
        private String recipeSuffix = "";
        private String llmProvider = DEFAULT_LLM_PROVIDER;
        private String llmModel;
        private String llmBaseUrl;
        private String llmApiKey;
        private Duration llmTimeout = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        private int llmMaxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration llmRetryBackoff = Duration.ofMillis(DEFAULT_RETRY_BACKOFF_MILLIS);

        private Builder() {
        }

        public Builder analysisMode(AnalysisMode analysisMode) {
            this.analysisMode = analysisMode != null ? analysisMode : AnalysisMode.STATIC;
            return this;
        }

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder flowName(String flowName) {
            this.flowName = flowName != null && !flowName.isBlank() ? flowName : DEFAULT_FLOW_NAME;
            return this;
        }

        public Builder recipePrefix(String recipePrefix) {
            this.recipePrefix = recipePrefix != null ? recipePrefix : "";
            return this;
        }

        public Builder recipeSuffix(String recipeSuffix) {
            this.recipeSuffix = recipeSuffix != null ? recipeSuffix : "";
            return this;
        }

        public Builder llmProvider(String llmProvider) {
            this.llmProvider = llmProvider != null && !llmProvider.isBlank() ? llmProvider : DEFAULT_LLM_PROVIDER;
            return this;
        }

        public Builder llmModel(String llmModel) {
            this.llmModel = llmModel;
            return this;
        }

        public Builder llmBaseUrl(String llmBaseUrl) {
            this.llmBaseUrl = llmBaseUrl;
            return this;
        }

        public Builder llmApiKey(String llmApiKey) {
            this.llmApiKey = llmApiKey;
            return this;
        }

        public Builder llmTimeout(Duration llmTimeout) {
            this.llmTimeout = Objects.requireNonNull(llmTimeout, "llmTimeout");
            return this;
        }

        public Builder llmMaxAttempts(int llmMaxAttempts) {
            if (llmMaxAttempts < 1) throw new IllegalArgumentException("llmMaxAttempts must be >= 1: " + llmMaxAttempts);
            this.llmMaxAttempts = llmMaxAttempts;
            return this;
        }

        public Builder llmRetryBackoff(Duration llmRetryBackoff) {
            this.llmRetryBackoff = Objects.requireNonNull(llmRetryBackoff, "llmRetryBackoff");
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(this);
        }
    }
}
