package com.pyflow.assembler;

import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.Severity;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.settings.CodeSettings;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.model.settings.JoinSettings;
import com.pyflow.model.settings.JoinType;
import com.pyflow.model.settings.SortSettings;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.Transformation;
import com.pyflow.model.transform.TransformationKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StaticFlowAssemblerTest {

    private static Transformation read(String target, String path, int line) {
        return Transformation.builder(TransformationKind.READ_DATA)
                .target(target)
                .parameter(Params.PATH, path)
                .parameter(Params.FORMAT, "csv")
                .line(line)
                .build();
    }

    private static Transformation write(String source, String path, int line) {
        return Transformation.builder(TransformationKind.WRITE_DATA)
                .source(source)
                .parameter(Params.PATH, path)
                .parameter(Params.FORMAT, "csv")
                .line(line)
                .build();
    }

    private static Transformation sort(String source, String target, String column, int line) {
        return Transformation.builder(TransformationKind.SORT)
                .source(source)
                .target(target)
                .column(column)
                .parameter(Params.ASCENDING, false)
                .line(line)
                .build();
    }

    private static List<Transformation> salesScript() {
        return List.of(
                read("df", "data/sales.csv", 1),
                Transformation.builder(TransformationKind.DROP_NA).source("df").target("df").line(2).build(),
                Transformation.builder(TransformationKind.FILTER).source("df").target("df")
                        .column("amount")
                        .suggestedProcessor(ProcessorType.FILTER_ON_NUMERIC_RANGE)
                        .parameter(Params.COLUMN, "amount")
                        .parameter(Params.OPERATOR, ">=")
                        .parameter(Params.VALUE, 10)
                        .line(3)
                        .build(),
                Transformation.builder(TransformationKind.GROUPBY).source("df").target("summary")
                        .parameter(Params.KEYS, List.of("region"))
                        .parameter(Params.AGGREGATIONS, List.of(Map.of("column", "amount", "function", "sum")))
                        .line(4)
                        .build(),
                write("summary", "out/summary.csv", 5));
    }

    @Test
    void salesScriptBecomesPrepareAndGrouping() {
        Flow flow = new StaticFlowAssembler().assemble(salesScript());

        assertEquals(DatasetRole.INPUT, flow.getDataset("sales").getRole());
        assertEquals("data/sales.csv", flow.getDataset("sales").getLocation());
        assertEquals(DatasetRole.INTERMEDIATE, flow.getDataset("sales_prepared").getRole());
        assertEquals(DatasetRole.OUTPUT, flow.getDataset("summary").getRole());
        assertEquals("out/summary.csv", flow.getDataset("summary").getLocation());

        assertEquals(2, flow.getRecipes().size());
        Recipe prepare = flow.getRecipes().get(0);
        assertEquals("prepare_1", prepare.getName());
        assertEquals(List.of(ProcessorType.REMOVE_ROWS_ON_EMPTY, ProcessorType.FILTER_ON_NUMERIC_RANGE),
                prepare.getSteps().stream().map(s -> s.processorType()).toList());
        assertEquals(List.of(2, 3), prepare.getSourceLines());

        Recipe grouping = flow.getRecipes().get(1);
        assertEquals(RecipeType.GROUPING, grouping.getType());
        assertEquals(List.of("sales_prepared"), grouping.getInputs());
        GroupingSettings settings = grouping.getSettings(GroupingSettings.class);
        assertEquals(List.of("region"), settings.keys());
        assertEquals("SUM", settings.aggregations().get(0).type());

        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
        assertTrue(flow.getWarnings().isEmpty());
    }

    @Test
    void chainedCallsShareOnePrepareBeforeTheSort() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("raw", "raw.csv", 1),
                Transformation.builder(TransformationKind.FILL_NA).source("raw").target("_chain_1")
                        .parameter(Params.VALUE, 0).line(2).build(),
                Transformation.builder(TransformationKind.COLUMN_DROP).source("_chain_1").target("_chain_2")
                        .column("tmp").line(2).build(),
                sort("_chain_2", "out", "score", 2)));

        assertEquals(1, flow.getRecipesOfType(RecipeType.PREPARE).size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.SORT).size());
        Recipe prepare = flow.getRecipesOfType(RecipeType.PREPARE).get(0);
        assertEquals(2, prepare.getSteps().size());
        assertEquals(List.of("raw_prepared"), prepare.getOutputs());

        Recipe sort = flow.getRecipesOfType(RecipeType.SORT).get(0);
        assertEquals(List.of("raw_prepared"), sort.getInputs());
        assertEquals(List.of("out"), sort.getOutputs());
        assertEquals("DESC", sort.getSettings(SortSettings.class).sortColumns().get(0).order());
        assertEquals(DatasetRole.OUTPUT, flow.getDataset("out").getRole());
    }

    @Test
    void prepareIsNotExtendedWhileAnotherNameStillHoldsItsOutput() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("df", "df.csv", 1),
                Transformation.builder(TransformationKind.DROP_NA).source("df").target("clean").line(2).build(),
                Transformation.builder(TransformationKind.COLUMN_DROP).source("clean").target("slim")
                        .column("notes").line(3).build(),
                sort("clean", "ranked", "score", 4)));

        assertEquals(2, flow.getRecipesOfType(RecipeType.PREPARE).size());
        assertEquals(List.of("clean"), flow.getRecipesOfType(RecipeType.SORT).get(0).getInputs());
    }

    @Test
    void unknownSourceGetsPlaceholderInputAndWarning() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(sort("ghost", "ranked", "score", 7)));

        assertTrue(flow.hasDataset("ghost"));
        assertEquals(DatasetRole.INPUT, flow.getDataset("ghost").getRole());
        assertEquals(1, flow.getWarnings().size());
        assertEquals(Severity.WARNING, flow.getWarnings().get(0).severity());
        assertTrue(flow.getWarnings().get(0).message().contains("'ghost' is used before any step produces it"));
    }

    @Test
    void unrecognizedStatementBecomesCodeRecipe() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("df", "df.csv", 1),
                Transformation.builder(TransformationKind.UNKNOWN).source("df").target("out")
                        .code("out = custom_magic(df)").line(2).build()));

        Recipe python = flow.getRecipesOfType(RecipeType.PYTHON).get(0);
        assertEquals("out = custom_magic(df)", python.getSettings(CodeSettings.class).code());
        assertEquals(List.of("out"), python.getOutputs());
        assertTrue(flow.getWarnings().stream().anyMatch(w -> w.message().contains("runs untranslated code")));
        assertEquals(AbstractFlowAssembler.PYTHON_FALLBACK, flow.getRecommendations().get(0).type());
    }

    @Test
    void untranslatableParametersDegradeToCode() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("X", "x.csv", 1),
                read("y", "y.csv", 2),
                Transformation.builder(TransformationKind.SPLIT).source("X").additionalSource("y").target("X_train")
                        .parameter(Params.TEST_SIZE, 0.2)
                        .code("X_train, X_test, y_train, y_test = train_test_split(X, y, test_size=0.2)")
                        .line(3)
                        .build()));

        assertTrue(flow.getRecipesOfType(RecipeType.SPLIT).isEmpty());
        Recipe python = flow.getRecipesOfType(RecipeType.PYTHON).get(0);
        assertTrue(python.getNotes().get(0).startsWith("parameters could not be translated"));
    }

    @Test
    void wholeFrameGroupAggregationUsesKnownColumns() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                Transformation.builder(TransformationKind.READ_DATA).target("df")
                        .parameter(Params.PATH, "df.csv")
                        .parameter(Params.FORMAT, "csv")
                        .columns(List.of("k", "price", "qty"))
                        .line(1)
                        .build(),
                Transformation.builder(TransformationKind.GROUPBY).source("df").target("g")
                        .parameter(Params.KEYS, List.of("k"))
                        .parameter(Params.AGGREGATIONS, List.of(Map.of("function", "mean")))
                        .code("g = df.groupby('k').mean()")
                        .line(2)
                        .build()));

        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
        Recipe grouping = flow.getRecipesOfType(RecipeType.GROUPING).get(0);
        GroupingSettings settings = grouping.getSettings(GroupingSettings.class);
        assertEquals(List.of("k"), settings.keys());
        assertEquals(List.of("price", "qty"), settings.aggregations().stream().map(a -> a.column()).toList());
        assertTrue(settings.aggregations().stream().allMatch(a -> a.type().equals("AVG")));
    }

    @Test
    void wholeFrameGroupAggregationWithoutSchemaKeepsTheFunction() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("df", "df.csv", 1),
                Transformation.builder(TransformationKind.GROUPBY).source("df").target("g")
                        .parameter(Params.KEYS, List.of("a"))
                        .parameter(Params.AGGREGATIONS, List.of(Map.of("function", "sum")))
                        .code("g = df.groupby('a').sum()")
                        .line(2)
                        .build()));

        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
        Recipe grouping = flow.getRecipesOfType(RecipeType.GROUPING).get(0);
        GroupingSettings settings = grouping.getSettings(GroupingSettings.class);
        assertEquals(List.of("a"), settings.keys());
        assertEquals(1, settings.aggregations().size());
        assertNull(settings.aggregations().get(0).column());
        assertEquals("SUM", settings.aggregations().get(0).type());
        assertTrue(grouping.getNotes().contains("'sum' applies to every non-key column; the columns are not known"));
    }

    @Test
    void unrecognizedJoinTypeIsReported() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("a", "a.csv", 1),
                read("b", "b.csv", 2),
                Transformation.builder(TransformationKind.MERGE).source("a").additionalSource("b").target("m")
                        .parameter(Params.ON, "id")
                        .parameter(Params.HOW, "banana")
                        .line(3)
                        .build()));

        JoinSettings join = flow.getRecipesOfType(RecipeType.JOIN).get(0).getSettings(JoinSettings.class);
        assertEquals(JoinType.INNER, join.joinType());
        assertTrue(flow.getWarnings().stream().anyMatch(w -> w.severity() == Severity.WARNING
                && w.message().equals("Join type 'banana' (line 3) is not recognized; using INNER")));
    }

    @Test
    void writingAnInputUnchangedAddsSyncRecipe() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("df", "in/data.csv", 1),
                write("df", "out/data_copy.csv", 2)));

        Recipe sync = flow.getRecipesOfType(RecipeType.SYNC).get(0);
        assertEquals(List.of("data"), sync.getInputs());
        assertEquals(List.of("data_copy"), sync.getOutputs());
        assertEquals(DatasetRole.OUTPUT, flow.getDataset("data_copy").getRole());
        assertEquals(DatasetRole.INPUT, flow.getDataset("data").getRole());
    }

    @Test
    void sameFileReadTwiceIsOneDataset() {
        Flow flow = new StaticFlowAssembler().assemble(List.of(
                read("a", "shared.csv", 1),
                read("b", "shared.csv", 2),
                sort("b", "c", "x", 3)));

        assertEquals(List.of("shared"), flow.getRecipes().get(0).getInputs());
        assertEquals(2, flow.getDatasets().size());
    }
}
