package com.pyflow.model.graph;

import com.pyflow.model.Dataset;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.settings.CodeSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowValidatorTest {

    @Test
    void validFlowHasNoProblems() {
        Flow flow = new Flow("ok");
        flow.addDataset(Dataset.input("a"));
        flow.addDataset(Dataset.intermediate("b"));
        Recipe prepare = new Recipe("prepare_1", RecipeType.PREPARE, List.of("a"), List.of("b"), null);
        prepare.addStep(PrepareStep.removeRowsOnEmpty(List.of("x"), 2));
        flow.addRecipe(prepare);
        assertEquals(List.of(), FlowValidator.validate(flow));
    }

    @Test
    void reportsMissingInputsOutputsAndEmptySettings() {
        Flow flow = new Flow("bad");
        flow.addDataset(Dataset.input("a"));
        flow.addDataset(Dataset.intermediate("b"));
        flow.addRecipe(new Recipe("prepare_1", RecipeType.PREPARE, List.of(), List.of("b"), null));
        flow.addRecipe(new Recipe("python_2", RecipeType.PYTHON, List.of("a"), List.of(), new CodeSettings("x = 1")));

        List<String> problems = FlowValidator.validate(flow);
        assertTrue(problems.contains("Recipe 'prepare_1' has no input dataset"));
        assertTrue(problems.contains("Recipe 'python_2' has no output dataset"));
        assertTrue(problems.contains("Recipe 'prepare_1' has no prepare settings content"));
    }

    @Test
    void reportsDoubleProducer() {
        Flow flow = new Flow("twice");
        flow.addDataset(Dataset.input("a"));
        flow.addDataset(Dataset.intermediate("b"));
        flow.addRecipe(new Recipe("python_1", RecipeType.PYTHON, List.of("a"), List.of("b"), new CodeSettings("x")));
        flow.addRecipe(new Recipe("python_2", RecipeType.PYTHON, List.of("a"), List.of("b"), new CodeSettings("y")));
        assertTrue(FlowValidator.validate(flow).contains("Dataset 'b' is produced by more than one recipe"));
    }
}
