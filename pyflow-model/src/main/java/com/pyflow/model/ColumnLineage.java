package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.settings.Aggregation;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.model.settings.JoinSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Where a column of a dataset comes from: the dataset and column it started as, and the recipe
 * steps that touched it on the way, oldest first. Traced backwards along the first input of each
 * producing recipe.
 *
 * @param column        column that was traced
 * @param finalDataset  dataset the trace started from
 * @param originDataset dataset where the trace ended (no producer, or a loop)
 * @param originColumn  name of the column in the origin dataset
 * @param steps         operations applied between origin and final dataset
 */
public record ColumnLineage(String column, String finalDataset, String originDataset, String originColumn,
                            List<Step> steps) {

    /**
     * One operation in a lineage.
     *
     * @param type       {@code rename}, {@code copy}, {@code group_key}, {@code aggregation}, {@code join}
     *                   or the processor name of a column-level Prepare step
     * @param recipe     recipe the operation belongs to
     * @param fromColumn column before the operation
     * @param toColumn   column after the operation
     * @param detail     aggregation function or join type; null otherwise
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Step(String type, String recipe, String fromColumn, String toColumn, String detail) {
    }

    private static final Set<ProcessorType> IN_PLACE = EnumSet.of(
            ProcessorType.STRING_TRANSFORMER, ProcessorType.NUMERICAL_TRANSFORMER, ProcessorType.FILL_EMPTY_WITH_VALUE,
            ProcessorType.ROUND_COLUMN, ProcessorType.ABS_COLUMN, ProcessorType.CLIP_COLUMN);

    public ColumnLineage {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /** True when the column reached the final dataset unchanged. */
    public boolean isUnchanged() {
        return steps.isEmpty() && column.equals(originColumn);
    }

    /**
     * @param dataset dataset holding the column; null for the last output dataset, or the last
     *                dataset when the flow has no output
     * @throws IllegalArgumentException when the flow has no datasets or the dataset is unknown
     */
    static ColumnLineage trace(Flow flow, String column, String dataset) {
        if (column == null || column.isBlank()) throw new IllegalArgumentException("column is required");
        String start = dataset != null ? dataset : defaultDataset(flow);
        if (!flow.hasDataset(start)) {
            throw new IllegalArgumentException("Dataset '" + start + "' not found in flow '" + flow.getName() + "'");
        }
        Map<String, Recipe> producer = new HashMap<>();
        for (Recipe r : flow.getRecipes()) {
            for (String out : r.getOutputs()) producer.put(out, r);
        }

        String current = column;
        String at = start;
        List<Step> backwards = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (producer.containsKey(at) && visited.add(at)) {
            Recipe recipe = producer.get(at);
            current = switch (recipe.getType()) {
                case PREPARE -> throughPrepare(recipe, current, backwards);
                case GROUPING -> throughGrouping(recipe, current, backwards);
                case JOIN -> {
                    String joinType = recipe.getSettings() instanceof JoinSettings js ? js.joinType().name() : null;
                    backwards.add(new Step("join", recipe.getName(), current, current, joinType));
                    yield current;
                }
                default -> current;
            };
            if (recipe.getInputs().isEmpty()) break;
            at = recipe.getInputs().get(0);
        }
        Collections.reverse(backwards);
        return new ColumnLineage(column, start, at, current, backwards);
    }

    private static String defaultDataset(Flow flow) {
        List<Dataset> candidates = flow.getOutputDatasets();
        if (candidates.isEmpty()) candidates = flow.getDatasets();
        if (candidates.isEmpty()) throw new IllegalArgumentException("Flow '" + flow.getName() + "' has no datasets");
        return candidates.get(candidates.size() - 1).getName();
    }

    private static String throughPrepare(Recipe recipe, String column, List<Step> backwards) {
        String current = column;
        List<PrepareStep> steps = recipe.getSteps();
        for (int i = steps.size() - 1; i >= 0; i--) {
            PrepareStep step = steps.get(i);
            ProcessorType type = step.processorType();
            if (type == ProcessorType.COLUMN_RENAMER) {
                for (Object o : list(step.params().get("renamings"))) {
                    if (!(o instanceof Map<?, ?> m) || !current.equals(text(m.get("to")))) continue;
                    String from = text(m.get("from"));
                    backwards.add(new Step("rename", recipe.getName(), from, current, null));
                    current = from;
                    break;
                }
            } else if (type == ProcessorType.COLUMN_COPIER) {
                if (current.equals(text(step.params().get("outputColumn"))) && step.column() != null) {
                    backwards.add(new Step("copy", recipe.getName(), step.column(), current, null));
                    current = step.column();
                }
            } else if (IN_PLACE.contains(type) && step.column() != null) {
                String output = text(step.params().get("outputColumn"));
                if (current.equals(output != null ? output : step.column())) {
                    backwards.add(new Step(type.toValue(), recipe.getName(), step.column(), current, null));
                    current = step.column();
                }
            }
        }
        return current;
    }

    private static String throughGrouping(Recipe recipe, String column, List<Step> backwards) {
        if (!(recipe.getSettings() instanceof GroupingSettings gs)) return column;
        if (gs.keys().contains(column)) {
            backwards.add(new Step("group_key", recipe.getName(), column, column, null));
            return column;
        }
        for (Aggregation a : gs.aggregations()) {
            if (column.equals(a.outputColumn()) || column.equals(a.column())) {
                String source = a.column() != null ? a.column() : column;
                backwards.add(new Step("aggregation", recipe.getName(), source, column, a.type()));
                return source;
            }
        }
        return column;
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> l ? l : List.of();
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
