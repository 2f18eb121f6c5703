package com.pyflow.converter;

import com.pyflow.config.AnalysisMode;
import com.pyflow.config.ConverterConfig;
import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.ProviderException;
import com.pyflow.llm.ResponseParseException;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.FlowSerialization;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.python.SourceSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowConverterTest {

    private static final String SALES_SCRIPT = """
            import pandas as pd

            df = pd.read_csv('sales.csv')
            df = df.dropna()
            df['region'] = df['region'].str.upper()
            summary = df.groupby('region').agg({'amount': 'sum'})
            summary.to_csv('summary.csv', index=False)
            """;

    private static final String SEMANTIC_REPLY = """
            {
              "code_summary": "Sums positive sales per region",
              "complexity_score": 2,
              "datasets": [
                {"name": "df", "source": "sales.csv", "is_input": true, "is_output": false, "inferred_columns": ["amount", "region"]},
                {"name": "out", "source": "derived", "is_input": false, "is_output": true}
              ],
              "steps": [
                {"operation": "read_data", "output_dataset": "df", "source_lines": [2]},
                {"operation": "filter", "input_datasets": ["df"], "output_dataset": "df_filtered",
                 "filter_conditions": [{"column": "amount", "operator": "greater_than", "value": 0}]},
                {"operation": "group_aggregate", "input_datasets": ["df_filtered"], "output_dataset": "out",
                 "group_by_columns": ["region"], "aggregations": [{"column": "amount", "function": "sum"}]}
              ],
              "recommendations": ["Partition the output by region"],
              "warnings": ["Column types were guessed"]
            }""";

    private static LlmProvider replying(String reply, AtomicInteger calls) {
        return new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                calls.incrementAndGet();
                return reply;
            }

            @Override
            public String modelName() {
                return "stub-model";
            }
        };
    }

    private static LlmProvider failing(ProviderException failure, AtomicInteger calls) {
        return new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                calls.incrementAndGet();
                throw failure;
            }

            @Override
            public String modelName() {
                return "stub-model";
            }
        };
    }

    private static ConverterConfig semantic() {
        return ConverterConfig.builder()
                .analysisMode(AnalysisMode.SEMANTIC)
                .llmMaxAttempts(2)
                .llmRetryBackoff(Duration.ZERO)
                .build();
    }

    @Test
    void staticConversionOfSalesScript() {
        ConversionResult result = new FlowConverter().convert(SALES_SCRIPT);
        Flow flow = result.flow();

        assertFalse(result.isSemantic());
        assertEquals(5, result.transformations().size());
        assertEquals(ConverterConfig.DEFAULT_FLOW_NAME, flow.getName());

        assertEquals(List.of("sales"), flow.getInputDatasets().stream().map(d -> d.getName()).toList());
        assertEquals(List.of("summary"), flow.getOutputDatasets().stream().map(d -> d.getName()).toList());
        assertEquals(1, flow.getIntermediateDatasets().size());
        assertEquals(3, flow.getDatasets().size());
        assertEquals(2, flow.getRecipes().size());

        List<Recipe> prepares = flow.getRecipesOfType(RecipeType.PREPARE);
        assertEquals(1, prepares.size());
        assertEquals(List.of(ProcessorType.REMOVE_ROWS_ON_EMPTY, ProcessorType.STRING_TRANSFORMER),
                prepares.get(0).getSteps().stream().map(s -> s.processorType()).toList());
        assertEquals(1, flow.getRecipesOfType(RecipeType.GROUPING).size());
        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
    }

    @Test
    void scriptWithoutImportsConvertsEndToEnd() {
        Flow flow = new FlowConverter().convert("""
                df = pd.read_csv('in.csv')
                df = df.dropna()
                df['x'] = df['x'].str.upper()
                result = df.groupby('cat').agg({'x': 'count'})
                result.to_csv('out.csv')
                """).flow();

        assertEquals(1, flow.getInputDatasets().size());
        assertEquals(1, flow.getIntermediateDatasets().size());
        assertEquals(1, flow.getOutputDatasets().size());
        assertEquals(3, flow.getDatasets().size());
        assertEquals(2, flow.getRecipes().size());
        assertEquals(2, flow.getRecipesOfType(RecipeType.PREPARE).get(0).getSteps().size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.GROUPING).size());
        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
    }

    @Test
    void bareUnassignedChainStillProducesRecipes() {
        ConversionResult result = new FlowConverter().convert("df.dropna().fillna(0).sort_values('x')");
        Flow flow = result.flow();

        assertEquals(3, result.transformations().size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.PREPARE).size());
        assertEquals(2, flow.getRecipesOfType(RecipeType.PREPARE).get(0).getSteps().size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.SORT).size());
        assertEquals(2, flow.getRecipes().size());
        assertTrue(result.warnings().stream().anyMatch(w -> w.message().contains("is not assigned")));
        assertTrue(flow.detectCycles().isEmpty());
    }

    @Test
    void groupedSumWithoutColumnsBecomesGrouping() {
        Flow flow = new FlowConverter().convert("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                g = df.groupby('a').sum()
                g.to_csv('g.csv')
                """).flow();

        assertEquals(1, flow.getRecipesOfType(RecipeType.GROUPING).size());
        assertTrue(flow.getRecipesOfType(RecipeType.PYTHON).isEmpty());
        GroupingSettings settings = flow.getRecipesOfType(RecipeType.GROUPING).get(0).getSettings(GroupingSettings.class);
        assertEquals(List.of("a"), settings.keys());
        assertEquals("SUM", settings.aggregations().get(0).type());
    }

    @Test
    void staticFlowIsAcyclicAndOrdered() {
        Flow flow = new FlowConverter().convert(SALES_SCRIPT).flow();

        assertTrue(flow.detectCycles().isEmpty());
        assertTrue(flow.validate().isEmpty());
        List<String> order = flow.topologicalSort();
        assertEquals(flow.getDatasets().size() + flow.getRecipes().size(), order.size());
        assertTrue(order.indexOf("sales") < order.indexOf("summary"));
    }

    @Test
    void chainedCallsShareOnePrepareRecipe() {
        ConversionResult result = new FlowConverter().convert("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                clean = df.dropna().fillna(0).sort_values('x')
                clean.to_csv('clean.csv')
                """);
        Flow flow = result.flow();

        assertEquals(1, flow.getRecipesOfType(RecipeType.PREPARE).size());
        assertEquals(2, flow.getRecipesOfType(RecipeType.PREPARE).get(0).getSteps().size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.SORT).size());
        assertTrue(flow.getDatasets().stream().noneMatch(d -> d.getName().startsWith("_")));
        assertNotNull(result.optimization());
    }

    @Test
    void optimizationCanBeDisabled() {
        ConverterConfig config = ConverterConfig.builder().optimize(false).recipePrefix("etl_").build();
        ConversionResult result = new FlowConverter(config).convert(SALES_SCRIPT);

        assertNull(result.optimization());
        assertTrue(result.flow().getRecipes().stream().allMatch(r -> r.getName().startsWith("etl_")));
    }

    @Test
    void syntaxErrorPropagates() {
        assertThrows(SourceSyntaxException.class, () -> new FlowConverter().convert("df = pd.read_csv(("));
    }

    @Test
    void serializedFlowRestoresEqual() {
        Flow flow = new FlowConverter().convert(SALES_SCRIPT).flow();
        assertEquals(flow, FlowSerialization.fromJson(FlowSerialization.toJson(flow)));
    }

    @Test
    void convertsFileAndRecordsItsName(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("report.py");
        Files.writeString(script, SALES_SCRIPT, StandardCharsets.UTF_8);

        Flow flow = new FlowConverter().convert(script).flow();

        assertEquals("report.py", flow.getSourceName());
        assertEquals(1, flow.getRecipesOfType(RecipeType.GROUPING).size());
    }

    @Test
    void missingFileIsUncheckedIoError(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> new FlowConverter().convert(dir.resolve("absent.py")));
    }

    @Test
    void semanticConversionUsesInjectedProvider() {
        AtomicInteger calls = new AtomicInteger();
        ConversionResult result = new FlowConverter(semantic(), replying(SEMANTIC_REPLY, calls)).convert(SALES_SCRIPT);
        Flow flow = result.flow();

        assertEquals(1, calls.get());
        assertTrue(result.isSemantic());
        assertTrue(result.transformations().isEmpty());
        assertEquals("stub-model", result.analysis().modelUsed());

        assertEquals(DatasetRole.INPUT, flow.getDataset("sales").getRole());
        assertEquals("sales.csv", flow.getDataset("sales").getLocation());
        assertEquals(1, flow.getRecipesOfType(RecipeType.PREPARE).size());
        assertEquals(1, flow.getRecipesOfType(RecipeType.GROUPING).size());
        assertTrue(flow.detectCycles().isEmpty());

        assertTrue(flow.getRecommendations().stream().anyMatch(r ->
                r.type().equals(FlowConverter.ANALYSIS_RECOMMENDATION)
                        && r.message().equals("Partition the output by region")));
        assertEquals("Column types were guessed", result.warnings().get(0).message());
    }

    @Test
    void permanentProviderFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        LlmProvider provider = failing(ProviderException.httpStatus("stub", 401, "denied"), calls);

        ProviderException e = assertThrows(ProviderException.class,
                () -> new FlowConverter(semantic(), provider).convert(SALES_SCRIPT));
        assertEquals(401, e.getStatusCode());
        assertEquals(1, calls.get());
    }

    @Test
    void transientProviderFailureIsRetriedUpToTheLimit() {
        AtomicInteger calls = new AtomicInteger();
        LlmProvider provider = failing(ProviderException.httpStatus("stub", 503, "busy"), calls);

        assertThrows(ProviderException.class, () -> new FlowConverter(semantic(), provider).convert(SALES_SCRIPT));
        assertEquals(2, calls.get());
    }

    @Test
    void unreadableReplyIsParseError() {
        LlmProvider provider = replying("I cannot help with that.", new AtomicInteger());
        assertThrows(ResponseParseException.class, () -> new FlowConverter(semantic(), provider).convert(SALES_SCRIPT));
    }
}
