package com.pyflow.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.RecipeType;
import com.pyflow.model.transform.AggregationSpec;
import com.pyflow.model.transform.ColumnTransform;
import com.pyflow.model.transform.DataStep;
import com.pyflow.model.transform.FilterCondition;
import com.pyflow.model.transform.JoinCondition;
import com.pyflow.model.transform.OperationType;
import com.pyflow.model.transform.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps the analysis JSON object onto {@link AnalysisResult}. Field types are read leniently:
 * a single string where a list is expected becomes a one-element list, numbers given as text
 * are parsed. Entries that cannot be read at all are skipped with a warning.
 */
final class AnalysisResultReader {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> warnings = new ArrayList<>();

    /**
     * @throws ResponseParseException when {@code steps} is missing or not an array
     */
    AnalysisResult read(JsonNode root, String modelUsed) {
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new ResponseParseException(stepsNode == null
                    ? "Analysis JSON has no 'steps' field" : "Analysis JSON 'steps' is not an array", root.toString());
        }
        List<DataStep> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode node : stepsNode) {
            index++;
            DataStep step = readStep(node, index);
            if (step != null) steps.add(step);
        }

        List<DatasetInfo> datasets = new ArrayList<>();
        JsonNode datasetsNode = root.path("datasets");
        if (datasetsNode.isArray()) {
            for (JsonNode node : datasetsNode) {
                if (node.isObject()) datasets.add(readDataset(node));
                else if (node.isTextual()) datasets.add(new DatasetInfo(node.asText(), null, null, null));
            }
        }

        List<String> modelWarnings = strings(root.get("warnings"));
        List<String> allWarnings = new ArrayList<>(modelWarnings);
        allWarnings.addAll(warnings);

        return new AnalysisResult(steps, datasets, text(root.get("code_summary")), integer(root.get("total_operations"), steps.size()),
                integer(root.get("complexity_score"), 0), strings(root.get("recommendations")), allWarnings, modelUsed);
    }

    private DataStep readStep(JsonNode node, int index) {
        if (!node.isObject()) {
            skip(index, "entry is not an object: " + ProviderException.abbreviate(node.toString()));
            return null;
        }
        try {
            String raw = text(node.get("operation"));
            if (raw == null) raw = text(node.get("type"));
            OperationType operation = OperationType.fromValue(raw);
            if (operation == OperationType.UNKNOWN && raw != null && !raw.equalsIgnoreCase("unknown")) {
                warnings.add(String.format("Step %d: unknown operation '%s'", index, raw));
            }
            DataStep.Builder b = DataStep.builder(operation)
                    .stepNumber(integer(node.get("step_number"), index))
                    .rawOperation(raw)
                    .description(text(node.get("description")))
                    .inputs(strings(node.get("input_datasets")))
                    .output(text(node.get("output_dataset")))
                    .columns(strings(node.get("columns")))
                    .groupBy(strings(node.get("group_by_columns")))
                    .joinType(text(node.get("join_type")))
                    .sourceCode(text(node.get("source_code")))
                    .suggestedProcessors(strings(node.get("suggested_processors")))
                    .requiresOpaqueRecipe(node.path("requires_python_recipe").asBoolean(false))
                    .reasoning(text(node.get("reasoning")));

            for (JsonNode c : objects(node.get("filter_conditions"))) b.filter(MAPPER.treeToValue(c, FilterCondition.class));
            for (JsonNode a : objects(node.get("aggregations"))) b.aggregation(MAPPER.treeToValue(a, AggregationSpec.class));
            for (JsonNode j : objects(node.get("join_conditions"))) b.join(MAPPER.treeToValue(j, JoinCondition.class));
            for (JsonNode t : objects(node.get("column_transforms"))) {
                b.columnTransform(MAPPER.treeToValue(t, ColumnTransform.class));
            }
            JsonNode sorts = node.get("sort_columns");
            if (sorts != null && sorts.isArray()) {
                for (JsonNode s : sorts) {
                    if (s.isTextual()) b.sort(new SortSpec(s.asText(), true));
                    else if (s.isObject()) b.sort(MAPPER.treeToValue(s, SortSpec.class));
                }
            }
            JsonNode rename = node.get("rename_mapping");
            if (rename != null && rename.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = rename.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    if (e.getValue().isValueNode() && !e.getValue().isNull()) b.rename(e.getKey(), e.getValue().asText());
                }
            }
            JsonNode fill = node.get("fill_value");
            if (fill != null && !fill.isNull()) b.fillValue(MAPPER.treeToValue(fill, Object.class));

            List<Integer> lines = new ArrayList<>();
            JsonNode linesNode = node.get("source_lines");
            if (linesNode != null && linesNode.isArray()) {
                for (JsonNode l : linesNode) {
                    int line = integer(l, -1);
                    if (line > 0) lines.add(line);
                }
            } else if (linesNode != null && integer(linesNode, -1) > 0) {
                lines.add(integer(linesNode, -1));
            }
            b.sourceLines(lines);

            RecipeType recipe = RecipeType.fromValue(text(node.get("suggested_recipe")));
            if (recipe != RecipeType.UNKNOWN) b.suggestedRecipe(recipe);
            return b.build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            skip(index, e.getMessage());
            return null;
        }
    }

    private void skip(int index, String reason) {
        log.warn("Skipping malformed analysis step | index={} reason={}", index, reason);
        warnings.add(String.format("Step %d skipped: %s", index, reason));
    }

    private static DatasetInfo readDataset(JsonNode node) {
        DatasetRole role;
        if (node.has("role")) role = DatasetRole.fromValue(text(node.get("role")));
        else if (node.path("is_input").asBoolean(false)) role = DatasetRole.INPUT;
        else if (node.path("is_output").asBoolean(false)) role = DatasetRole.OUTPUT;
        else role = DatasetRole.INTERMEDIATE;
        List<String> columns = strings(node.has("inferred_columns") ? node.get("inferred_columns") : node.get("columns"));
        return new DatasetInfo(text(node.get("name")), role, text(node.get("source")), columns);
    }

    private static List<JsonNode> objects(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node == null) return out;
        if (node.isObject()) {
            out.add(node);
        } else if (node.isArray()) {
            for (JsonNode n : node) {
                if (n.isObject()) out.add(n);
            }
        }
        return out;
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isArray()) {
            for (JsonNode n : node) {
                if (n.isValueNode() && !n.isNull()) out.add(n.asText());
            }
        } else if (node.isValueNode()) {
            out.add(node.asText());
        }
        return out;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        return node.asText();
    }

    private static int integer(JsonNode node, int fallback) {
        if (node == null || node.isNull()) return fallback;
        if (node.isNumber()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
