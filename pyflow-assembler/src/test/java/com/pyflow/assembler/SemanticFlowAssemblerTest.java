package com.pyflow.assembler;

import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.settings.CodeSettings;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.model.settings.JoinSettings;
import com.pyflow.model.settings.JoinType;
import com.pyflow.model.settings.SamplingSettings;
import com.pyflow.model.transform.AggregationSpec;
import com.pyflow.model.transform.ColumnTransform;
import com.pyflow.model.transform.DataStep;
import com.pyflow.model.transform.FilterCondition;
import com.pyflow.model.transform.JoinCondition;
import com.pyflow.model.transform.OperationType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticFlowAssemblerTest {

    private static SemanticFlowAssembler assembler(DeclaredDataset... declared) {
        return new SemanticFlowAssembler("semantic_flow", RecipeNamer.plain(), List.of(declared));
    }

    @Test
    void declaredDatasetsDriveRolesAndNames() {
        List<DataStep> steps = List.of(
                DataStep.builder(OperationType.READ_DATA).stepNumber(1).inputs("data/sales.csv").output("df")
                        .sourceLines(List.of(1)).build(),
                DataStep.builder(OperationType.FILTER).stepNumber(2).inputs("df").output("big_sales")
                        .filter(new FilterCondition("amount", "greater_than", 100))
                        .sourceLines(List.of(2)).build(),
                DataStep.builder(OperationType.GROUP_AGGREGATE).stepNumber(3).inputs("big_sales").output("summary")
                        .groupBy(List.of("region"))
                        .aggregation(new AggregationSpec("amount", "sum", "total"))
                        .sourceLines(List.of(3)).build(),
                DataStep.builder(OperationType.WRITE_DATA).stepNumber(4).inputs("summary").output("out/summary.csv")
                        .sourceLines(List.of(4)).build());

        Flow flow = assembler(
                new DeclaredDataset("df", DatasetRole.INPUT, "data/sales.csv", List.of("region", "amount")),
                new DeclaredDataset("summary", DatasetRole.OUTPUT, "derived", List.of()))
                .assemble(steps);

        assertEquals("semantic_flow", flow.getName());
        assertEquals(DatasetRole.INPUT, flow.getDataset("sales").getRole());
        assertTrue(flow.getDataset("sales").hasColumn("amount"));
        assertEquals(DatasetRole.INTERMEDIATE, flow.getDataset("big_sales").getRole());
        assertEquals(DatasetRole.OUTPUT, flow.getDataset("summary").getRole());
        assertEquals("out/summary.csv", flow.getDataset("summary").getLocation());

        Recipe prepare = flow.getRecipesOfType(RecipeType.PREPARE).get(0);
        PrepareStep filter = prepare.getSteps().get(0);
        assertEquals(ProcessorType.FILTER_ON_FORMULA, filter.processorType());
        assertEquals("amount > 100", filter.params().get("expression"));

        GroupingSettings grouping = flow.getRecipesOfType(RecipeType.GROUPING).get(0).getSettings(GroupingSettings.class);
        assertEquals(List.of("region"), grouping.keys());
        assertEquals("total", grouping.aggregations().get(0).outputColumn());
        assertEquals(3, flow.getDatasets().size());
    }

    @Test
    void fillStrategyNamesBecomeComputedOrNeighbourFills() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.FILL_MISSING).inputs("df").output("df")
                        .columns(List.of("price")).fillValue("median").build(),
                DataStep.builder(OperationType.FILL_MISSING).inputs("df").output("df")
                        .columns(List.of("city")).fillValue("ffill").build(),
                DataStep.builder(OperationType.FILL_MISSING).inputs("df").output("df")
                        .fillValue(Map.of("qty", 0)).build()));

        List<PrepareStep> steps = flow.getRecipesOfType(RecipeType.PREPARE).get(0).getSteps();
        assertEquals(3, steps.size());
        assertEquals(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE, steps.get(0).processorType());
        assertEquals("MEDIAN", steps.get(0).params().get("strategy"));
        assertEquals(ProcessorType.FILL_EMPTY_WITH_PREVIOUS_NEXT, steps.get(1).processorType());
        assertEquals("PREVIOUS", steps.get(1).params().get("direction"));
        assertEquals("0", steps.get(2).params().get("value"));
    }

    @Test
    void columnTransformsMapToProcessors() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.TRANSFORM_COLUMN).inputs("df").output("df")
                        .columnTransform(new ColumnTransform("name", "upper", null, null))
                        .columnTransform(new ColumnTransform("price", "round", "price_r", Map.of("decimals", 2)))
                        .columnTransform(new ColumnTransform("ts", "year", null, null))
                        .build()));

        List<ProcessorType> types = flow.getRecipesOfType(RecipeType.PREPARE).get(0).getSteps().stream()
                .map(PrepareStep::processorType).toList();
        assertEquals(List.of(ProcessorType.STRING_TRANSFORMER, ProcessorType.COLUMN_COPIER, ProcessorType.ROUND_COLUMN,
                ProcessorType.DATE_COMPONENTS_EXTRACTOR), types);
    }

    @Test
    void joinUsesReportedTypeAndKeys() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.JOIN).inputs("orders", "customers").output("enriched")
                        .join(new JoinCondition("customer_id", "id"))
                        .joinType("left")
                        .build()));

        JoinSettings join = flow.getRecipesOfType(RecipeType.JOIN).get(0).getSettings(JoinSettings.class);
        assertEquals(JoinType.LEFT, join.joinType());
        assertEquals("id", join.joins().get(0).rightColumn());
        assertEquals(2, flow.getWarnings().size());
    }

    @Test
    void unrecognizedJoinTypeFallsBackToInnerWithWarning() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.JOIN).inputs("orders", "customers").output("enriched")
                        .join(new JoinCondition("customer_id", "id"))
                        .joinType("banana")
                        .build()));

        JoinSettings join = flow.getRecipesOfType(RecipeType.JOIN).get(0).getSettings(JoinSettings.class);
        assertEquals(JoinType.INNER, join.joinType());
        assertTrue(flow.getWarnings().stream().anyMatch(w ->
                w.message().equals("Join type 'banana' of 'enriched' is not recognized; using INNER")));
    }

    @Test
    void unknownOperationBecomesCodeWithItsSource() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.UNKNOWN).rawOperation("explode_json").inputs("df").output("flat")
                        .sourceCode("flat = explode_json(df)").build()));

        Recipe python = flow.getRecipesOfType(RecipeType.PYTHON).get(0);
        assertEquals("flat = explode_json(df)", python.getSettings(CodeSettings.class).code());
        assertTrue(python.getNotes().contains("operation 'explode_json' not recognized"));
    }

    @Test
    void opaqueStepKeepsModelReasoning() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.CUSTOM_FUNCTION).inputs("df").output("scored")
                        .requiresOpaqueRecipe(true).reasoning("calls a fitted model").build()));

        Recipe python = flow.getRecipesOfType(RecipeType.PYTHON).get(0);
        assertTrue(python.getNotes().contains("calls a fitted model"));
        assertEquals("# calls a fitted model", python.getSettings(CodeSettings.class).code());
    }

    @Test
    void missingSampleSizeUsesDefaultRatio() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.SAMPLE).inputs("df").output("preview").build()));

        Recipe sampling = flow.getRecipesOfType(RecipeType.SAMPLING).get(0);
        assertEquals(0.1, sampling.getSettings(SamplingSettings.class).ratio());
        assertTrue(sampling.getNotes().get(0).startsWith("sample size not reported"));
    }

    @Test
    void prepareWithNothingDerivableFallsBackToCode() {
        Flow flow = assembler().assemble(List.of(
                DataStep.builder(OperationType.RENAME_COLUMNS).inputs("df").output("renamed").build()));

        assertTrue(flow.getRecipesOfType(RecipeType.PREPARE).isEmpty());
        assertEquals(1, flow.getRecipesOfType(RecipeType.PYTHON).size());
    }
}
