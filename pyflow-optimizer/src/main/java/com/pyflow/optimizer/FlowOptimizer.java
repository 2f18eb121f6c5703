package com.pyflow.optimizer;

import com.pyflow.model.Dataset;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.FlowRecommendation;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.Severity;
import com.pyflow.model.prepare.PrepareStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites an assembled flow in place: folds chains of Prepare recipes together, drops orphaned
 * intermediate datasets, flags recipes with empty settings and adds advisory recommendations.
 * <p>
 * Running it twice gives the same flow as running it once; the second run reports
 * {@link OptimizationResult#isNoop()}.
 */
public final class FlowOptimizer {

    private static final Logger log = LoggerFactory.getLogger(FlowOptimizer.class);

    /** Code recipes tolerated before suggesting a different analysis. */
    static final int CODE_RECIPE_THRESHOLD = 3;

    public OptimizationResult optimize(Flow flow) {
        List<String> notes = new ArrayList<>();
        int merged = mergePrepareChains(flow, notes);
        int removed = merged + removeOrphans(flow, notes);
        flagEmptySettings(flow);
        int recommended = recommend(flow);
        notes.forEach(flow::addOptimizationNote);

        OptimizationResult result = new OptimizationResult(merged, removed, notes, recommended);
        log.info("Flow optimized | flow={} | merged={} | datasetsRemoved={} | recommendations={}",
                flow.getName(), merged, removed, recommended);
        return result;
    }

    // ------------------------------------------------------------------ merging

    /** Folds mergeable Prepare pairs until none is left; each pass restarts from the first recipe. */
    private static int mergePrepareChains(Flow flow, List<String> notes) {
        int merged = 0;
        int bound = flow.getRecipes().size();
        boolean changed = true;
        while (changed && merged < bound) {
            changed = false;
            for (Recipe upstream : flow.getRecipesOfType(RecipeType.PREPARE)) {
                Recipe downstream = mergeableSuccessor(flow, upstream);
                if (downstream == null) continue;
                if (downstream.getOutputs().stream().anyMatch(upstream.getInputs()::contains)) {
                    flow.addWarning(Severity.WARNING, String.format(
                            "Prepare recipes '%s' and '%s' were not merged: the merge would create a cycle",
                            upstream.getName(), downstream.getName()));
                    continue;
                }
                String intermediate = upstream.getOutputs().get(0);
                fold(upstream, downstream);
                flow.removeRecipe(downstream.getName());
                flow.removeDataset(intermediate);
                notes.add(String.format("Merged Prepare recipe '%s' into '%s' (%d steps); removed dataset '%s'",
                        downstream.getName(), upstream.getName(), upstream.getSteps().size(), intermediate));
                log.debug("Prepare recipes merged | into={} | from={} | removed={}",
                        upstream.getName(), downstream.getName(), intermediate);
                merged++;
                changed = true;
                break;
            }
        }
        return merged;
    }

    /**
     * The Prepare recipe that alone consumes the upstream recipe's sole output, when that output
     * is a plain intermediate dataset; null otherwise.
     */
    private static Recipe mergeableSuccessor(Flow flow, Recipe upstream) {
        if (upstream.getOutputs().size() != 1) return null;
        String intermediate = upstream.getOutputs().get(0);
        Dataset ds = flow.getDataset(intermediate);
        if (ds == null || ds.isRoleExplicit() || ds.getRole() != DatasetRole.INTERMEDIATE) return null;
        if (flow.producersOf(intermediate).size() != 1) return null;
        List<Recipe> consumers = flow.consumersOf(intermediate);
        if (consumers.size() != 1) return null;
        Recipe downstream = consumers.get(0);
        if (downstream.getType() != RecipeType.PREPARE || downstream == upstream) return null;
        if (!downstream.getInputs().equals(List.of(intermediate))) return null;
        return downstream;
    }

    private static void fold(Recipe upstream, Recipe downstream) {
        for (PrepareStep step : downstream.getSteps()) upstream.addStep(step);
        downstream.getSourceLines().forEach(upstream::addSourceLine);
        downstream.getNotes().forEach(upstream::addNote);
        upstream.setOutputs(downstream.getOutputs());
    }

    // ------------------------------------------------------------------ cleanup

    private static int removeOrphans(Flow flow, List<String> notes) {
        int removed = 0;
        for (Dataset ds : flow.getDatasets()) {
            if (ds.isRoleExplicit()) continue;
            if (!flow.producersOf(ds.getName()).isEmpty() || !flow.consumersOf(ds.getName()).isEmpty()) continue;
            flow.removeDataset(ds.getName());
            notes.add(String.format("Removed orphaned %s dataset '%s'", ds.getRole().toValue(), ds.getName()));
            removed++;
        }
        return removed;
    }

    private static void flagEmptySettings(Flow flow) {
        for (Recipe r : flow.getRecipes()) {
            if (r.getSettings() == null || r.getSettings().isEmpty()) {
                flow.addWarning(Severity.WARNING, String.format("Recipe '%s' (%s) has empty settings",
                        r.getName(), r.getType().toValue()));
            }
        }
    }

    // ------------------------------------------------------------------ recommendations

    private static int recommend(Flow flow) {
        int added = 0;
        for (Recipe r : flow.getRecipes()) {
            if (!filtersRows(r) || r.getInputs().isEmpty()) continue;
            for (Recipe producer : flow.producersOf(r.getInputs().get(0))) {
                if (producer.getType() != RecipeType.JOIN) continue;
                if (flow.addRecommendation(new FlowRecommendation("PERFORMANCE", "HIGH",
                        String.format("Filter in '%s' could be moved before Join '%s'", r.getName(), producer.getName()),
                        "Reduces data volume before the join",
                        "Apply the filter to the join inputs"))) {
                    added++;
                }
            }
        }

        int code = flow.getRecipesOfType(RecipeType.PYTHON).size();
        if (code >= CODE_RECIPE_THRESHOLD && flow.addRecommendation(new FlowRecommendation("RECIPE_CHOICE", "MEDIUM",
                String.format("%d of %d recipes run untranslated code", code, flow.getRecipes().size()),
                "Code recipes hide lineage and column-level changes",
                "Try semantic analysis or rewrite the custom functions with pandas operations"))) {
            added++;
        }

        int unmerged = 0;
        for (Recipe r : flow.getRecipesOfType(RecipeType.PREPARE)) {
            if (r.getSteps().size() != 1 || r.getOutputs().size() != 1) continue;
            for (Recipe next : flow.consumersOf(r.getOutputs().get(0))) {
                if (next.getType() == RecipeType.PREPARE && next.getSteps().size() == 1) unmerged++;
            }
        }
        if (unmerged > 0 && flow.addRecommendation(new FlowRecommendation("CONSOLIDATION", "LOW",
                String.format("Found %d chained single-step Prepare recipes kept apart by a shared dataset", unmerged),
                "More recipes and intermediate datasets than the logic needs",
                "Combine the steps into one Prepare recipe if the shared dataset need not be materialized"))) {
            added++;
        }
        return added;
    }

    private static boolean filtersRows(Recipe r) {
        if (r.getType() == RecipeType.SPLIT) return true;
        if (r.getType() != RecipeType.PREPARE) return false;
        return r.getSteps().stream().anyMatch(s -> s.processorType().isRowFilter());
    }
}
