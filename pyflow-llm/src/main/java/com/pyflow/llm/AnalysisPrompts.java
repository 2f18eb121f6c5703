package com.pyflow.llm;

import com.pyflow.model.transform.OperationType;

import java.util.List;

/** Prompts sent to the model by {@link LlmCodeAnalyzer}. */
public final class AnalysisPrompts {

    public static final String SYSTEM_PROMPT = """
            You are a data engineer who maps Python data-processing code (pandas, numpy, scikit-learn) \
            onto visual data-flow recipes.

            Break the code into discrete data processing steps. For each step:
            1. Identify the operation type.
            2. Identify the input and output datasets (dataframe variable names).
            3. List every column involved.
            4. Extract operation details: filter conditions, aggregations, join keys, sort keys, renames.
            5. Suggest the recipe type that fits best.
            6. Say whether the step needs a Python code recipe because no visual recipe expresses it.

            Recipe types:
            - prepare: cleaning, column transforms, row filters, type conversion
            - join: combining datasets on matching keys
            - grouping: aggregations with group keys
            - window: running totals, lag, lead, rank
            - stack: vertical concatenation
            - split: one input into several outputs
            - pivot: long to wide and back
            - sort, distinct, topn, sampling
            - python: anything the visual recipes cannot express

            Prepare processors: FillEmptyWithValue, RemoveRowsOnEmpty, ColumnRenamer, ColumnDeleter, \
            ColumnsSelector, StringTransformer, TypeSetter, DateParser, FilterOnValue, FilterOnFormula, \
            CreateColumnWithGREL, Binner, Normalizer, RegexpExtractor, FindReplace, RemoveDuplicates.

            Extract every operation, including implicit ones.""";

    private static final String RESPONSE_TEMPLATE = """
            {
              "code_summary": "what the code does",
              "total_operations": 0,
              "complexity_score": 1,
              "datasets": [
                {"name": "variable_name", "source": "file path or 'derived'", "is_input": true, "is_output": false,
                 "inferred_columns": ["col1", "col2"]}
              ],
              "steps": [
                {
                  "step_number": 1,
                  "operation": "%s",
                  "description": "human-readable description",
                  "input_datasets": ["dataset_name"],
                  "output_dataset": "result_dataset",
                  "columns": ["affected_column"],
                  "filter_conditions": [{"column": "x", "operator": "greater_than", "value": 100}],
                  "aggregations": [{"column": "amount", "function": "sum", "output_column": "total"}],
                  "group_by_columns": ["category"],
                  "join_conditions": [{"left_column": "id", "right_column": "id"}],
                  "join_type": "left|inner|right|outer",
                  "column_transforms": [{"column": "name", "operation": "uppercase"}],
                  "rename_mapping": {"old_name": "new_name"},
                  "sort_columns": [{"column": "date", "order": "desc"}],
                  "fill_value": null,
                  "source_lines": [10, 11],
                  "suggested_recipe": "prepare|join|grouping|...",
                  "suggested_processors": ["StringTransformer"],
                  "requires_python_recipe": false,
                  "reasoning": "why this mapping was chosen"
                }
              ],
              "recommendations": ["optimization suggestions"],
              "warnings": ["potential issues"]
            }""";

    private AnalysisPrompts() {
    }

    /** User prompt embedding the source verbatim. */
    public static String analysisPrompt(String source) {
        return "Analyze the following Python code and extract all data manipulation steps.\n\n"
                + "Return a JSON object with this structure:\n"
                + String.format(RESPONSE_TEMPLATE, operationChoices())
                + "\n\nPython code to analyze:\n```python\n"
                + source
                + "\n```\n\nRespond with ONLY the JSON object, no other text.";
    }

    /**
     * Analysis prompt preceded by optional free-text context and the names of datasets that
     * already exist in the target project.
     */
    public static String analysisPrompt(String source, String context, List<String> existingDatasets) {
        StringBuilder sb = new StringBuilder();
        if (existingDatasets != null && !existingDatasets.isEmpty()) {
            sb.append("Existing datasets: ").append(String.join(", ", existingDatasets)).append("\n\n");
        }
        if (context != null && !context.isBlank()) {
            sb.append("Context: ").append(context.strip()).append("\n\n");
        }
        return sb.append(analysisPrompt(source)).toString();
    }

    private static String operationChoices() {
        StringBuilder sb = new StringBuilder();
        for (OperationType t : OperationType.values()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(t.toValue());
        }
        return sb.toString();
    }
}
