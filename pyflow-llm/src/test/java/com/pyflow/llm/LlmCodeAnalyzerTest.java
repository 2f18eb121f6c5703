package com.pyflow.llm;

import com.pyflow.model.DatasetRole;
import com.pyflow.model.RecipeType;
import com.pyflow.model.transform.DataStep;
import com.pyflow.model.transform.OperationType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmCodeAnalyzerTest {

    private static final String SCRIPT = """
            import pandas as pd
            df = pd.read_csv('sales.csv')
            df = df[df['amount'] > 0]
            out = df.groupby('region').agg({'amount': 'sum'})
            out.to_csv('out.csv')
            """;

    private static final String REPLY = """
            ```json
            {
              "code_summary": "Sums positive sales per region",
              "total_operations": 99,
              "complexity_score": 3,
              "datasets": [
                {"name": "df", "source": "sales.csv", "is_input": true, "is_output": false, "inferred_columns": ["amount", "region"]},
                {"name": "out", "source": "derived", "is_input": false, "is_output": true}
              ],
              "steps": [
                {"step_number": 7, "operation": "read_data", "output_dataset": "df", "source_lines": [2]},
                {"step_number": 8, "operation": "filter", "input_datasets": ["df"], "output_dataset": "df_filtered",
                 "filter_conditions": [{"column": "amount", "operator": "greater_than", "value": 0}]},
                {"step_number": 9, "operation": "group_aggregate", "input_datasets": "df_filtered", "output_dataset": "out",
                 "group_by_columns": ["region"], "aggregations": [{"column": "amount", "function": "sum"}],
                 "suggested_recipe": "grouping"},
                {"step_number": 10, "operation": "write_data", "input_datasets": ["out"]}
              ],
              "recommendations": ["none"],
              "warnings": []
            }
            ```""";

    private static LlmProvider replying(String reply, List<String> prompts) {
        return new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                prompts.add(prompt);
                prompts.add(systemPrompt);
                return reply;
            }

            @Override
            public String modelName() {
                return "stub-model";
            }
        };
    }

    @Test
    void mapsRepliesOntoSteps() {
        List<String> prompts = new ArrayList<>();
        AnalysisResult result = new LlmCodeAnalyzer(replying(REPLY, prompts)).analyze(SCRIPT);

        assertEquals(4, result.steps().size());
        assertEquals(4, result.totalOperations());
        assertEquals(3, result.complexityScore());
        assertEquals("stub-model", result.modelUsed());
        assertEquals("Sums positive sales per region", result.codeSummary());
        assertEquals(List.of(1, 2, 3, 4), result.steps().stream().map(DataStep::stepNumber).toList());

        DataStep filter = result.steps().get(1);
        assertEquals(OperationType.FILTER, filter.operation());
        assertEquals(RecipeType.PREPARE, filter.suggestedRecipe());
        assertEquals("amount > 0", filter.filterConditions().get(0).toFormula());

        DataStep group = result.steps().get(2);
        assertEquals(List.of("df_filtered"), group.inputDatasets());
        assertEquals(List.of("region"), group.groupByColumns());
        assertEquals("sum", group.aggregations().get(0).function());
        assertEquals(RecipeType.GROUPING, group.suggestedRecipe());

        assertEquals(List.of(2), result.steps().get(0).sourceLines());
        assertNull(result.steps().get(3).outputDataset());

        assertEquals(DatasetRole.INPUT, result.datasets().get(0).role());
        assertEquals(List.of("amount", "region"), result.datasets().get(0).columns());
        assertEquals(List.of("out"), result.outputDatasets().stream().map(DatasetInfo::name).toList());
    }

    @Test
    void promptEmbedsSourceAndContext() {
        List<String> prompts = new ArrayList<>();
        new LlmCodeAnalyzer(replying(REPLY, prompts))
                .analyzeWithContext(SCRIPT, "monthly sales report", List.of("raw_sales"));

        String prompt = prompts.get(0);
        assertTrue(prompt.contains(SCRIPT));
        assertTrue(prompt.contains("Context: monthly sales report"));
        assertTrue(prompt.contains("Existing datasets: raw_sales"));
        assertTrue(prompt.contains("group_aggregate"));
        assertTrue(prompts.get(1).startsWith(AnalysisPrompts.SYSTEM_PROMPT));
        assertTrue(prompts.get(1).endsWith(LlmProvider.JSON_INSTRUCTION));
    }

    @Test
    void zeroStepsIsAnEmptyResult() {
        AnalysisResult result = new LlmCodeAnalyzer(replying("{\"steps\": [], \"code_summary\": \"nothing\"}", new ArrayList<>()))
                .analyze("print('hi')");
        assertTrue(result.isEmpty());
        assertEquals(0, result.totalOperations());
    }

    @Test
    void missingStepsIsParseError() {
        LlmCodeAnalyzer analyzer = new LlmCodeAnalyzer(replying("{\"code_summary\": \"x\"}", new ArrayList<>()));
        assertThrows(ResponseParseException.class, () -> analyzer.analyze("x = 1"));

        LlmCodeAnalyzer notArray = new LlmCodeAnalyzer(replying("{\"steps\": {\"operation\": \"sort\"}}", new ArrayList<>()));
        assertThrows(ResponseParseException.class, () -> notArray.analyze("x = 1"));
    }

    @Test
    void unknownOperationKeepsRawTextAndWarns() {
        String reply = """
                {"steps": [{"operation": "teleport_rows", "input_datasets": ["df"], "output_dataset": "df2"}]}""";
        AnalysisResult result = new LlmCodeAnalyzer(replying(reply, new ArrayList<>())).analyze("df2 = magic(df)");

        DataStep step = result.steps().get(0);
        assertEquals(OperationType.UNKNOWN, step.operation());
        assertEquals("teleport_rows", step.rawOperation());
        assertEquals(RecipeType.PYTHON, step.suggestedRecipe());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("teleport_rows")));
    }

    @Test
    void malformedStepsAreSkippedWithWarning() {
        String reply = """
                {"steps": [
                  "not a step",
                  {"operation": "sort", "input_datasets": ["df"], "output_dataset": "s",
                   "sort_columns": ["date", {"column": "amount", "order": "desc"}]},
                  {"operation": "filter", "filter_conditions": [{"column": ["bad"]}]}
                ]}""";
        AnalysisResult result = new LlmCodeAnalyzer(replying(reply, new ArrayList<>())).analyze("s = df.sort_values('date')");

        assertEquals(1, result.steps().size());
        DataStep sort = result.steps().get(0);
        assertEquals(1, sort.stepNumber());
        assertTrue(sort.sortColumns().get(0).ascending());
        assertFalse(sort.sortColumns().get(1).ascending());
        assertEquals(2, result.warnings().stream().filter(w -> w.contains("skipped")).count());
    }

    @Test
    void providerFailurePropagatesUnchanged() {
        LlmProvider failing = new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                throw ProviderException.httpStatus("stub", 500, "boom");
            }

            @Override
            public String modelName() {
                return "stub";
            }
        };
        ProviderException e = assertThrows(ProviderException.class, () -> new LlmCodeAnalyzer(failing).analyze("x = 1"));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void ioFailureOfProviderBecomesTransientProviderException() {
        LlmProvider failing = new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                throw new UncheckedIOException("connection reset", new IOException("connection reset"));
            }

            @Override
            public String modelName() {
                return "stub";
            }
        };
        ProviderException e = assertThrows(ProviderException.class, () -> new LlmCodeAnalyzer(failing).analyze("x = 1"));
        assertTrue(e.isTransient());
        assertEquals(-1, e.getStatusCode());
        assertInstanceOf(UncheckedIOException.class, e.getCause());
    }

    @Test
    void unexpectedProviderBugIsWrappedAsPermanentFailure() {
        LlmProvider failing = new LlmProvider() {
            @Override
            public String complete(String prompt, String systemPrompt) {
                throw new IllegalStateException("client closed");
            }

            @Override
            public String modelName() {
                return "stub";
            }
        };
        ProviderException e = assertThrows(ProviderException.class, () -> new LlmCodeAnalyzer(failing).analyze("x = 1"));
        assertFalse(e.isTransient());
        assertTrue(e.getMessage().contains("client closed"));
    }

    @Test
    void hintsFlagFilterAfterJoinPrepareRunsAndCodeSteps() {
        AnalysisResult result = new AnalysisResult(List.of(
                DataStep.builder(OperationType.JOIN).stepNumber(1).build(),
                DataStep.builder(OperationType.FILTER).stepNumber(2).build(),
                DataStep.builder(OperationType.RENAME_COLUMNS).stepNumber(3).build(),
                DataStep.builder(OperationType.CUSTOM_FUNCTION).stepNumber(4).requiresOpaqueRecipe(true).build()),
                null, null, 4, 0, null, null, "m");

        List<String> hints = result.optimizationHints();
        assertEquals(3, hints.size());
        assertTrue(hints.get(0).startsWith("Step 2 filters after a join"));
        assertTrue(hints.get(1).startsWith("2 consecutive prepare"));
        assertTrue(hints.get(2).startsWith("1 step(s) need a Python recipe"));
    }
}
