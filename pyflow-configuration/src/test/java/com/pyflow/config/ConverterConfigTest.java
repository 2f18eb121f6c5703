package com.pyflow.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConverterConfigTest {

    @Test
    void emptyEnvironmentGivesDefaults() {
        ConverterConfig config = ConverterConfig.fromVariables(Map.of());

        assertEquals(AnalysisMode.STATIC, config.getAnalysisMode());
        assertTrue(config.isOptimize());
        assertEquals("converted_flow", config.getFlowName());
        assertEquals("", config.getRecipePrefix());
        assertEquals("ollama", config.getLlmProvider());
        assertNull(config.getLlmModel());
        assertNull(config.getLlmApiKey());
        assertEquals(Duration.ofSeconds(120), config.getLlmTimeout());
        assertEquals(3, config.getLlmMaxAttempts());
        assertEquals(Duration.ofMillis(500), config.getLlmRetryBackoff());
    }

    @Test
    void variablesOverrideDefaults() {
        ConverterConfig config = ConverterConfig.fromVariables(Map.of(
                "PYFLOW_ANALYSIS_MODE", "semantic",
                "PYFLOW_OPTIMIZE", "false",
                "PYFLOW_FLOW_NAME", "sales_flow",
                "PYFLOW_RECIPE_PREFIX", "etl_",
                "PYFLOW_LLM_PROVIDER", "openai",
                "PYFLOW_LLM_MODEL", "gpt-4o-mini",
                "PYFLOW_LLM_API_KEY", " sk-test ",
                "PYFLOW_LLM_TIMEOUT_SECONDS", "30",
                "PYFLOW_LLM_MAX_ATTEMPTS", "5",
                "PYFLOW_LLM_RETRY_BACKOFF_MILLIS", "0"));

        assertEquals(AnalysisMode.SEMANTIC, config.getAnalysisMode());
        assertFalse(config.isOptimize());
        assertEquals("sales_flow", config.getFlowName());
        assertEquals("etl_", config.getRecipePrefix());
        assertEquals("openai", config.getLlmProvider());
        assertEquals("gpt-4o-mini", config.getLlmModel());
        assertEquals("sk-test", config.getLlmApiKey());
        assertEquals(Duration.ofSeconds(30), config.getLlmTimeout());
        assertEquals(5, config.getLlmMaxAttempts());
        assertEquals(Duration.ZERO, config.getLlmRetryBackoff());
    }

    @Test
    void invalidValuesNameTheVariable() {
        ConfigurationException mode = assertThrows(ConfigurationException.class,
                () -> ConverterConfig.fromVariables(Map.of("PYFLOW_ANALYSIS_MODE", "magic")));
        assertEquals("PYFLOW_ANALYSIS_MODE", mode.getVariable());

        ConfigurationException timeout = assertThrows(ConfigurationException.class,
                () -> ConverterConfig.fromVariables(Map.of("PYFLOW_LLM_TIMEOUT_SECONDS", "soon")));
        assertEquals("PYFLOW_LLM_TIMEOUT_SECONDS", timeout.getVariable());
        assertTrue(timeout.getMessage().contains("'soon'"));

        assertThrows(ConfigurationException.class,
                () -> ConverterConfig.fromVariables(Map.of("PYFLOW_LLM_MAX_ATTEMPTS", "0")));
        assertThrows(ConfigurationException.class,
                () -> ConverterConfig.fromVariables(Map.of("PYFLOW_OPTIMIZE", "maybe")));
    }

    @Test
    void toStringMasksApiKey() {
        ConverterConfig config = ConverterConfig.builder().llmApiKey("secret").build();
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void toBuilderKeepsEverySetting() {
        ConverterConfig original = ConverterConfig.builder()
                .analysisMode(AnalysisMode.SEMANTIC)
                .flowName("f")
                .recipeSuffix("_v2")
                .llmMaxAttempts(7)
                .build();
        ConverterConfig copy = original.toBuilder().optimize(false).build();

        assertEquals(AnalysisMode.SEMANTIC, copy.getAnalysisMode());
        assertEquals("f", copy.getFlowName());
        assertEquals("_v2", copy.getRecipeSuffix());
        assertEquals(7, copy.getLlmMaxAttempts());
        assertFalse(copy.isOptimize());
    }
}
