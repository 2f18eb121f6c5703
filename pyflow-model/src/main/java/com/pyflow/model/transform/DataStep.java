package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pyflow.model.RecipeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One logical data operation reported by the semantic analyzer. Immutable. {@code rawOperation}
 * keeps the model's original operation text so an {@link OperationType#UNKNOWN} step still says
 * what was asked for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataStep(int stepNumber,
                       OperationType operation,
                       String rawOperation,
                       String description,
                       List<String> inputDatasets,
                       String outputDataset,
                       List<String> columns,
                       List<FilterCondition> filterConditions,
                       List<AggregationSpec> aggregations,
                       List<String> groupByColumns,
                       List<JoinCondition> joinConditions,
                       String joinType,
                       List<ColumnTransform> columnTransforms,
                       Map<String, String> renameMapping,
                       List<SortSpec> sortColumns,
                       Object fillValue,
                       List<Integer> sourceLines,
                       String sourceCode,
                       RecipeType suggestedRecipe,
                       List<String> suggestedProcessors,
                       boolean requiresOpaqueRecipe,
                       String reasoning) implements FlowStep {

    public DataStep {
        operation = operation != null ? operation : OperationType.UNKNOWN;
        rawOperation = rawOperation != null ? rawOperation : operation.toValue();
        description = description != null ? description : "";
        inputDatasets = copy(inputDatasets);
        columns = copy(columns);
        filterConditions = copy(filterConditions);
        aggregations = copy(aggregations);
        groupByColumns = copy(groupByColumns);
        joinConditions = copy(joinConditions);
        columnTransforms = copy(columnTransforms);
        renameMapping = renameMapping != null ? Collections.unmodifiableMap(new LinkedHashMap<>(renameMapping)) : Map.of();
        sortColumns = copy(sortColumns);
        sourceLines = copy(sourceLines);
        suggestedProcessors = copy(suggestedProcessors);
    }

    private static <T> List<T> copy(List<T> list) {
        if (list == null) return List.of();
        List<T> out = new ArrayList<>();
        for (T t : list) {
            if (t != null) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    public static Builder builder(OperationType operation) {
        return new Builder(operation);
    }

    public Builder toBuilder() {
        Builder b = new Builder(operation);
        b.stepNumber = stepNumber;
        b.rawOperation = rawOperation;
        b.description = description;
        b.inputDatasets.addAll(inputDatasets);
        b.outputDataset = outputDataset;
        b.columns.addAll(columns);
        b.filterConditions.addAll(filterConditions);
        b.aggregations.addAll(aggregations);
        b.groupByColumns.addAll(groupByColumns);
        b.joinConditions.addAll(joinConditions);
        b.joinType = joinType;
        b.columnTransforms.addAll(columnTransforms);
        b.renameMapping.putAll(renameMapping);
        b.sortColumns.addAll(sortColumns);
        b.fillValue = fillValue;
        b.sourceLines.addAll(sourceLines);
        b.sourceCode = sourceCode;
        b.suggestedRecipe = suggestedRecipe;
        b.suggestedProcessors.addAll(suggestedProcessors);
        b.requiresOpaqueRecipe = requiresOpaqueRecipe;
        b.reasoning = reasoning;
        return b;
    }

    /** Recipe to build: the model's suggestion, or one inferred from the operation. */
    public RecipeType effectiveRecipe() {
        if (requiresOpaqueRecipe) return RecipeType.PYTHON;
        return suggestedRecipe != null && suggestedRecipe != RecipeType.UNKNOWN ? suggestedRecipe : operation.defaultRecipe();
    }

    @Override
    public List<String> sourceNames() {
        return inputDatasets;
    }

    @Override
    public String targetName() {
        return outputDataset;
    }

    @Override
    public boolean requiresCodeRecipe() {
        return requiresOpaqueRecipe;
    }

    @Override
    public String toString() {
        return "DataStep{" + stepNumber + ", " + rawOperation + ", " + inputDatasets + " -> " + outputDataset + "}";
    }

    public static final class Builder {
        private int stepNumber;
        private final OperationType operation;
        private String rawOperation;
        private String description;
        private final List<String> inputDatasets = new ArrayList<>();
        private String outputDataset;
        private final List<String> columns = new ArrayList<>();
        private final List<FilterCondition> filterConditions = new ArrayList<>();
        private final List<AggregationSpec> aggregations = new ArrayList<>();
        private final List<String> groupByColumns = new ArrayList<>();
        private final List<JoinCondition> joinConditions = new ArrayList<>();
        private String joinType;
        private final List<ColumnTransform> columnTransforms = new ArrayList<>();
        private final Map<String, String> renameMapping = new LinkedHashMap<>();
        private final List<SortSpec> sortColumns = new ArrayList<>();
        private Object fillValue;
        private final List<Integer> sourceLines = new ArrayList<>();
        private String sourceCode;
        private RecipeType suggestedRecipe;
        private final List<String> suggestedProcessors = new ArrayList<>();
        private boolean requiresOpaqueRecipe;
        private String reasoning;

        private Builder(OperationType operation) {
            this.operation = operation;
        }

        public Builder stepNumber(int n) {
            this.stepNumber = n;
            return this;
        }

        public Builder rawOperation(String raw) {
            this.rawOperation = raw;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputs(String... names) {
            inputDatasets.addAll(List.of(names));
            return this;
        }

        public Builder inputs(List<String> names) {
            inputDatasets.addAll(names);
            return this;
        }

        public Builder output(String name) {
            this.outputDataset = name;
            return this;
        }

        public Builder columns(List<String> names) {
            columns.addAll(names);
            return this;
        }

        public Builder filter(FilterCondition condition) {
            filterConditions.add(condition);
            return this;
        }

        public Builder aggregation(AggregationSpec spec) {
            aggregations.add(spec);
            return this;
        }

        public Builder groupBy(List<String> names) {
            groupByColumns.addAll(names);
            return this;
        }

        public Builder join(JoinCondition condition) {
            joinConditions.add(condition);
            return this;
        }

        public Builder joinType(String joinType) {
            this.joinType = joinType;
            return this;
        }

        public Builder columnTransform(ColumnTransform transform) {
            columnTransforms.add(transform);
            return this;
        }

        public Builder rename(String from, String to) {
            renameMapping.put(from, to);
            return this;
        }

        public Builder sort(SortSpec spec) {
            sortColumns.add(spec);
            return this;
        }

        public Builder fillValue(Object value) {
            this.fillValue = value;
            return this;
        }

        public Builder sourceLines(List<Integer> lines) {
            sourceLines.addAll(lines);
            return this;
        }

        public Builder sourceCode(String code) {
            this.sourceCode = code;
            return this;
        }

        public Builder suggestedRecipe(RecipeType recipe) {
            this.suggestedRecipe = recipe;
            return this;
        }

        public Builder suggestedProcessors(List<String> processors) {
            suggestedProcessors.addAll(processors);
            return this;
        }

        public Builder requiresOpaqueRecipe(boolean value) {
            this.requiresOpaqueRecipe = value;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public DataStep build() {
            return new DataStep(stepNumber, operation, rawOperation, description, inputDatasets, outputDataset,
                    columns, filterConditions, aggregations, groupByColumns, joinConditions, joinType,
                    columnTransforms, renameMapping, sortColumns, fillValue, sourceLines, sourceCode,
                    suggestedRecipe, suggestedProcessors, requiresOpaqueRecipe, reasoning);
        }
    }
}
