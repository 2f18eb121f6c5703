package com.pyflow.llm;

import com.pyflow.model.RecipeType;
import com.pyflow.model.transform.DataStep;
import com.pyflow.model.transform.OperationType;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one semantic analysis: the ordered steps plus the model's own summary,
 * recommendations and warnings. Zero steps is a legitimate result.
 *
 * @param complexityScore the model's 1 to 10 estimate; 0 when it gave none
 * @param modelUsed       name reported by the provider that produced the reply
 */
public record AnalysisResult(List<DataStep> steps,
                             List<DatasetInfo> datasets,
                             String codeSummary,
                             int totalOperations,
                             int complexityScore,
                             List<String> recommendations,
                             List<String> warnings,
                             String modelUsed) {

    public AnalysisResult {
        steps = steps != null ? List.copyOf(steps) : List.of();
        datasets = datasets != null ? List.copyOf(datasets) : List.of();
        codeSummary = codeSummary != null ? codeSummary : "";
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public List<DatasetInfo> inputDatasets() {
        return datasets.stream().filter(DatasetInfo::isInput).toList();
    }

    public List<DatasetInfo> outputDatasets() {
        return datasets.stream().filter(DatasetInfo::isOutput).toList();
    }

    /**
     * Advisory hints derived from the step sequence: filters placed after a join, runs of
     * prepare-like steps that will share one recipe, and steps that need a code recipe.
     */
    public List<String> optimizationHints() {
        List<String> hints = new ArrayList<>();

        boolean joined = false;
        for (DataStep step : steps) {
            if (step.operation() == OperationType.JOIN) {
                joined = true;
            } else if (joined && step.operation() == OperationType.FILTER) {
                hints.add(String.format("Step %d filters after a join; filtering before the join reduces the rows joined",
                        step.stepNumber()));
            }
        }

        int streak = 0;
        int longest = 0;
        for (DataStep step : steps) {
            if (!step.requiresOpaqueRecipe() && step.effectiveRecipe() == RecipeType.PREPARE) {
                streak++;
                longest = Math.max(longest, streak);
            } else {
                streak = 0;
            }
        }
        if (longest > 1) {
            hints.add(String.format("%d consecutive prepare operations can be combined into a single Prepare recipe", longest));
        }

        long code = steps.stream().filter(DataStep::requiresOpaqueRecipe).count();
        if (code > 0) {
            hints.add(String.format("%d step(s) need a Python recipe; check whether a visual recipe can express them", code));
        }
        return hints;
    }
}
