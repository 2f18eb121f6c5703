package com.pyflow.optimizer;

import com.pyflow.model.Dataset;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.settings.CodeSettings;
import com.pyflow.model.settings.JoinKey;
import com.pyflow.model.settings.JoinSettings;
import com.pyflow.model.settings.JoinType;
import com.pyflow.model.settings.PrepareSettings;
import com.pyflow.model.settings.SortSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowOptimizerTest {

    private static Recipe prepare(String name, String in, String out, PrepareStep... steps) {
        Recipe r = new Recipe(name, RecipeType.PREPARE, List.of(in), List.of(out), PrepareSettings.empty());
        for (PrepareStep s : steps) r.addStep(s);
        return r;
    }

    private static Dataset dataset(String name, DatasetRole role) {
        return new Dataset(name, role);
    }

    /** raw -> p1 -> a -> p2 -> b -> p3 -> out */
    private static Flow threePrepares() {
        Flow flow = new Flow("chain");
        flow.addDataset(dataset("raw", DatasetRole.INPUT));
        flow.addDataset(dataset("a", DatasetRole.INTERMEDIATE));
        flow.addDataset(dataset("b", DatasetRole.INTERMEDIATE));
        flow.addDataset(dataset("out", DatasetRole.OUTPUT));
        flow.addRecipe(prepare("prepare_1", "raw", "a", PrepareStep.removeRowsOnEmpty(List.of("x"), 2)));
        flow.addRecipe(prepare("prepare_2", "a", "b", PrepareStep.fillEmpty("y", 0, 3)));
        flow.addRecipe(prepare("prepare_3", "b", "out", PrepareStep.deleteColumns(List.of("z"), 4)));
        return flow;
    }

    @Test
    void chainOfPreparesCollapsesIntoOne() {
        Flow flow = threePrepares();
        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertEquals(2, result.recipesMerged());
        assertEquals(2, result.datasetsRemoved());
        assertEquals(1, flow.getRecipes().size());
        Recipe merged = flow.getRecipes().get(0);
        assertEquals("prepare_1", merged.getName());
        assertEquals(3, merged.getSteps().size());
        assertEquals("RemoveRowsOnEmpty", merged.getSteps().get(0).processorType().toValue());
        assertEquals(List.of("raw"), merged.getInputs());
        assertEquals(List.of("out"), merged.getOutputs());
        assertEquals(List.of(2, 3, 4), merged.getSourceLines());
        assertFalse(flow.hasDataset("a"));
        assertFalse(flow.hasDataset("b"));
        assertEquals(2, flow.getOptimizationNotes().size());
        assertTrue(flow.detectCycles().isEmpty());
    }

    @Test
    void secondRunChangesNothing() {
        Flow flow = threePrepares();
        FlowOptimizer optimizer = new FlowOptimizer();
        optimizer.optimize(flow);
        int warnings = flow.getWarnings().size();
        int recommendations = flow.getRecommendations().size();

        OptimizationResult second = optimizer.optimize(flow);

        assertTrue(second.isNoop());
        assertEquals(1, flow.getRecipes().size());
        assertEquals(2, flow.getOptimizationNotes().size());
        assertEquals(warnings, flow.getWarnings().size());
        assertEquals(recommendations, flow.getRecommendations().size());
    }

    @Test
    void explicitOutputIsNotMergedAway() {
        Flow flow = threePrepares();
        flow.getDataset("a").declareRole(DatasetRole.OUTPUT);

        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertEquals(1, result.recipesMerged());
        assertTrue(flow.hasDataset("a"));
        assertEquals(2, flow.getRecipes().size());
    }

    @Test
    void fanOutKeepsPreparesApartAndRecommendsConsolidation() {
        Flow flow = new Flow("fan");
        flow.addDataset(dataset("raw", DatasetRole.INPUT));
        flow.addDataset(dataset("clean", DatasetRole.INTERMEDIATE));
        flow.addDataset(dataset("left", DatasetRole.OUTPUT));
        flow.addDataset(dataset("right", DatasetRole.OUTPUT));
        flow.addRecipe(prepare("prepare_1", "raw", "clean", PrepareStep.removeRowsOnEmpty(List.of(), 1)));
        flow.addRecipe(prepare("prepare_2", "clean", "left", PrepareStep.deleteColumns(List.of("a"), 2)));
        flow.addRecipe(prepare("prepare_3", "clean", "right", PrepareStep.deleteColumns(List.of("b"), 3)));

        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertEquals(0, result.recipesMerged());
        assertEquals(3, flow.getRecipes().size());
        assertEquals("CONSOLIDATION", flow.getRecommendations().get(0).type());
    }

    @Test
    void filterAfterJoinIsRecommendedEarlier() {
        Flow flow = new Flow("join");
        flow.addDataset(dataset("orders", DatasetRole.INPUT));
        flow.addDataset(dataset("customers", DatasetRole.INPUT));
        flow.addDataset(dataset("joined", DatasetRole.INTERMEDIATE));
        flow.addDataset(dataset("big", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("join_1", RecipeType.JOIN, List.of("orders", "customers"), List.of("joined"),
                new JoinSettings(JoinType.INNER, List.of(JoinKey.on("id")))));
        flow.addRecipe(prepare("prepare_2", "joined", "big", PrepareStep.filterOnFormula("amount > 100", 3)));

        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertEquals(1, result.recommendationsAdded());
        assertEquals("PERFORMANCE", flow.getRecommendations().get(0).type());
        assertEquals("HIGH", flow.getRecommendations().get(0).priority());
    }

    @Test
    void emptySettingsAreFlaggedNotRemoved() {
        Flow flow = new Flow("empty");
        flow.addDataset(dataset("raw", DatasetRole.INPUT));
        flow.addDataset(dataset("sorted", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("sort_1", RecipeType.SORT, List.of("raw"), List.of("sorted"), new SortSettings(List.of())));

        new FlowOptimizer().optimize(flow);

        assertEquals(1, flow.getRecipes().size());
        assertTrue(flow.getWarnings().get(0).message().contains("'sort_1' (sort) has empty settings"));
    }

    @Test
    void manyCodeRecipesSuggestAnotherApproach() {
        Flow flow = new Flow("code");
        flow.addDataset(dataset("raw", DatasetRole.INPUT));
        String previous = "raw";
        for (int i = 1; i <= FlowOptimizer.CODE_RECIPE_THRESHOLD; i++) {
            String out = "step" + i;
            flow.addDataset(dataset(out, DatasetRole.INTERMEDIATE));
            flow.addRecipe(new Recipe("python_" + i, RecipeType.PYTHON, List.of(previous), List.of(out),
                    new CodeSettings("df = f(df)")));
            previous = out;
        }

        new FlowOptimizer().optimize(flow);

        assertEquals("RECIPE_CHOICE", flow.getRecommendations().get(0).type());
    }

    @Test
    void orphanedIntermediateIsRemoved() {
        Flow flow = threePrepares();
        flow.addDataset(dataset("leftover", DatasetRole.INTERMEDIATE));

        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertFalse(flow.hasDataset("leftover"));
        assertEquals(3, result.datasetsRemoved());
        assertTrue(result.notes().contains("Removed orphaned intermediate dataset 'leftover'"));
    }

    @Test
    void orphansOfEveryInferredRoleAreRemoved() {
        Flow flow = threePrepares();
        flow.addDataset(dataset("orphan_in", DatasetRole.INPUT));
        flow.addDataset(dataset("orphan_out", DatasetRole.OUTPUT));
        flow.addDataset(Dataset.input("declared"));

        OptimizationResult result = new FlowOptimizer().optimize(flow);

        assertFalse(flow.hasDataset("orphan_in"));
        assertFalse(flow.hasDataset("orphan_out"));
        assertTrue(flow.hasDataset("declared"));
        assertEquals(4, result.datasetsRemoved());
        assertTrue(result.notes().contains("Removed orphaned input dataset 'orphan_in'"));
        assertTrue(result.notes().contains("Removed orphaned output dataset 'orphan_out'"));
    }
}
