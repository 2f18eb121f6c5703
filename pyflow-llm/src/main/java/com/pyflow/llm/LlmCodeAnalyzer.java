package com.pyflow.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.pyflow.model.ConversionException;
import com.pyflow.model.transform.DataStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Semantic analyzer: asks an {@link LlmProvider} to describe the data operations of a script
 * and maps the JSON reply onto {@link AnalysisResult}. Provider and parse failures propagate
 * as {@link ProviderException} and {@link ResponseParseException}; any other runtime failure of
 * the provider is wrapped in a {@link ProviderException}.
 */
public final class LlmCodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LlmCodeAnalyzer.class);

    private final LlmProvider provider;

    public LlmCodeAnalyzer(LlmProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public AnalysisResult analyze(String source) {
        return analyzeWithContext(source, null, List.of());
    }

    /**
     * @param context          free text prepended to the prompt (business meaning, naming rules); may be null
     * @param existingDatasets datasets already present in the target project; may be empty
     */
    public AnalysisResult analyzeWithContext(String source, String context, List<String> existingDatasets) {
        Objects.requireNonNull(source, "source");
        String prompt = AnalysisPrompts.analysisPrompt(source, context, existingDatasets);
        log.debug("Semantic analysis request | model={} promptChars={}", provider.modelName(), prompt.length());

        JsonNode reply;
        try {
            reply = provider.completeJson(prompt, AnalysisPrompts.SYSTEM_PROMPT);
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Provider call failed | model={} error={}", provider.modelName(), e.toString());
            throw ProviderException.unexpected(provider.modelName(), e);
        }
        if (reply == null || !reply.isObject()) {
            throw new ResponseParseException("Analysis reply is not a JSON object", String.valueOf(reply));
        }
        AnalysisResult result = postProcess(new AnalysisResultReader().read(reply, provider.modelName()));
        log.info("Semantic analysis complete | model={} steps={} datasets={} warnings={}",
                result.modelUsed(), result.steps().size(), result.datasets().size(), result.warnings().size());
        return result;
    }

    /** Renumbers steps from 1 and fills in a recipe where the model named none. */
    static AnalysisResult postProcess(AnalysisResult result) {
        List<DataStep> steps = new ArrayList<>(result.steps().size());
        int n = 0;
        for (DataStep step : result.steps()) {
            DataStep.Builder b = step.toBuilder().stepNumber(++n);
            if (step.suggestedRecipe() == null) b.suggestedRecipe(step.operation().defaultRecipe());
            steps.add(b.build());
        }
        return new AnalysisResult(steps, result.datasets(), result.codeSummary(), steps.size(),
                result.complexityScore(), result.recommendations(), result.warnings(), result.modelUsed());
    }
}
