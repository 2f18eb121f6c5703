package com.pyflow.model;

import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.prepare.StringTransformMode;
import com.pyflow.model.settings.Aggregation;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.model.settings.JoinKey;
import com.pyflow.model.settings.JoinSettings;
import com.pyflow.model.settings.JoinType;
import com.pyflow.model.settings.PrepareSettings;
import com.pyflow.model.settings.SortColumn;
import com.pyflow.model.settings.SortSettings;
import com.pyflow.model.settings.SyncSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowSerializationTest {

    private static Flow sampleFlow() {
        Flow flow = new Flow("sales_flow");
        flow.setSourceName("sales.py");
        Dataset in = flow.addDataset(Dataset.input("sales"));
        in.setLocation("sales.csv");
        in.setSourceVariable("df");
        in.setSourceLine(3);
        in.annotateColumn(new ColumnSchema("region", "string", true));
        Dataset customers = flow.addDataset(Dataset.input("customers"));
        customers.addNote("placeholder");
        flow.addDataset(Dataset.intermediate("sales_prepared"));
        flow.addDataset(Dataset.intermediate("joined"));
        Dataset out = flow.addDataset(Dataset.intermediate("summary"));
        out.declareRole(DatasetRole.OUTPUT);
        flow.addDataset(Dataset.intermediate("sorted"));

        Recipe prepare = new Recipe("prepare_1", RecipeType.PREPARE, List.of("sales"), List.of("sales_prepared"), null);
        prepare.addStep(PrepareStep.removeRowsOnEmpty(List.of(), 4));
        prepare.addStep(PrepareStep.stringTransform("region", StringTransformMode.TO_UPPER, 5));
        prepare.addStep(PrepareStep.round("amount", 2, 6));
        flow.addRecipe(prepare);
        flow.addRecipe(new Recipe("join_2", RecipeType.JOIN, List.of("sales_prepared", "customers"), List.of("joined"),
                new JoinSettings(JoinType.LEFT, List.of(JoinKey.on("customer_id")))));
        flow.addRecipe(new Recipe("grouping_3", RecipeType.GROUPING, List.of("joined"), List.of("summary"),
                new GroupingSettings(List.of("region"), List.of(Aggregation.of("amount", "sum")), false)));
        Recipe sort = new Recipe("sort_4", RecipeType.SORT, List.of("summary"), List.of("sorted"),
                new SortSettings(List.of(SortColumn.of("amount", false))));
        sort.addSourceLine(9);
        sort.addNote("descending");
        flow.addRecipe(sort);

        flow.addWarning(FlowWarning.warning("Dataset 'customers' was referenced before being defined"));
        flow.addRecommendation(new FlowRecommendation("PERFORMANCE", "HIGH", "Filter before join", "less data", null));
        flow.addOptimizationNote("Merged 2 prepare recipes");
        return flow;
    }

    @Test
    void mapRoundTripIsFieldForFieldEqual() {
        Flow flow = sampleFlow();
        Flow restored = FlowSerialization.fromMap(FlowSerialization.toMap(flow));
        assertEquals(flow, restored);
        assertEquals(flow.getRecipe("prepare_1").getSteps(), restored.getRecipe("prepare_1").getSteps());
        assertEquals(DatasetRole.OUTPUT, restored.getDataset("summary").getRole());
        assertTrue(restored.getDataset("summary").isRoleExplicit());
    }

    @Test
    void jsonRoundTripIsFieldForFieldEqual() {
        Flow flow = sampleFlow();
        String json = FlowSerialization.toJson(flow);
        assertEquals(flow, FlowSerialization.fromJson(json));
    }

    @Test
    void exportUsesStableKeysAndOmitsAbsentFields() {
        Map<String, Object> map = FlowSerialization.toMap(sampleFlow());
        assertEquals(List.of("name", "source", "datasets", "recipes", "warnings", "recommendations", "optimization_notes"),
                List.copyOf(map.keySet()));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> datasets = (List<Map<String, Object>>) map.get("datasets");
        Map<String, Object> sales = datasets.get(0);
        assertEquals("input", sales.get("type"));
        assertEquals("sales.csv", sales.get("location"));
        Map<String, Object> joined = datasets.get(3);
        assertFalse(joined.containsKey("location"));
        assertFalse(joined.containsKey("source_variable"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> recipes = (List<Map<String, Object>>) map.get("recipes");
        assertEquals("prepare", recipes.get(0).get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> settings = (Map<String, Object>) recipes.get(0).get("settings");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> steps = (List<Map<String, Object>>) settings.get("steps");
        assertEquals("PROCESSOR", steps.get(0).get("metaType"));
        assertEquals("RemoveRowsOnEmpty", steps.get(0).get("type"));
    }

    @Test
    void untypedColumnExportsDefaultTypeNeverNull() {
        Flow flow = new Flow("f");
        Dataset raw = Dataset.input("raw");
        raw.annotateColumn(new ColumnSchema("x", null, true));
        flow.addDataset(raw);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> datasets = (List<Map<String, Object>>) FlowSerialization.toMap(flow).get("datasets");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> schema = (List<Map<String, Object>>) datasets.get(0).get("schema");
        assertEquals("string", schema.get(0).get("type"));
        assertFalse(schema.get(0).containsValue(null));
        assertFalse(FlowSerialization.toJson(flow).contains("null"));
    }

    @Test
    void syncSettingsExportAsEmptyObject() {
        Flow flow = new Flow("copy");
        flow.addDataset(Dataset.input("a"));
        flow.addDataset(Dataset.intermediate("b"));
        flow.addRecipe(new Recipe("sync_1", RecipeType.SYNC, List.of("a"), List.of("b"), new SyncSettings()));
        Flow restored = FlowSerialization.fromJson(FlowSerialization.toJson(flow));
        assertEquals(flow, restored);
    }

    @Test
    void unknownRecipeTypeFallsBackToUnknown() {
        Map<String, Object> map = Map.of(
                "name", "f",
                "datasets", List.of(Map.of("name", "a", "type", "input")),
                "recipes", List.of(Map.of("name", "r", "type", "mystery", "inputs", List.of("a"), "outputs", List.of())));
        Flow flow = FlowSerialization.fromMap(map);
        assertEquals(RecipeType.UNKNOWN, flow.getRecipe("r").getType());
    }

    @Test
    void malformedShapeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> FlowSerialization.fromMap(Map.of("name", "f", "datasets", "not a list")));
    }

    @Test
    void prepareSettingsKeepStepOrder() {
        Flow flow = sampleFlow();
        PrepareSettings settings = flow.getRecipe("prepare_1").getSettings(PrepareSettings.class);
        assertEquals(3, settings.steps().size());
        assertEquals(List.of(4, 5, 6), flow.getRecipe("prepare_1").getSourceLines());
    }
}
