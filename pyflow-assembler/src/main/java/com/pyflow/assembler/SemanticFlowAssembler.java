package com.pyflow.assembler;

import com.pyflow.model.ColumnSchema;
import com.pyflow.model.Dataset;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.NumericalTransformMode;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.prepare.StringTransformMode;
import com.pyflow.model.settings.Aggregation;
import com.pyflow.model.settings.DistinctSettings;
import com.pyflow.model.settings.GroupingSettings;
import com.pyflow.model.settings.JoinKey;
import com.pyflow.model.settings.JoinSettings;
import com.pyflow.model.settings.JoinType;
import com.pyflow.model.settings.PivotSettings;
import com.pyflow.model.settings.RecipeSettings;
import com.pyflow.model.settings.SamplingSettings;
import com.pyflow.model.settings.SortColumn;
import com.pyflow.model.settings.SortSettings;
import com.pyflow.model.settings.SplitSettings;
import com.pyflow.model.settings.StackSettings;
import com.pyflow.model.settings.SyncSettings;
import com.pyflow.model.settings.TopNSettings;
import com.pyflow.model.settings.WindowSettings;
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles the steps of the semantic (model-based) analyzer. Step details are whatever the
 * model reported, so every mapping has a fallback: an unmapped Prepare step tries the suggested
 * processors, and a step that still yields nothing becomes a code recipe with its source text.
 */
public final class SemanticFlowAssembler extends AbstractFlowAssembler<DataStep> {

    private static final Logger log = LoggerFactory.getLogger(SemanticFlowAssembler.class);

    private static final int DEFAULT_TOP_N = 10;
    private static final double DEFAULT_SAMPLE_RATIO = 0.1;
    private static final double DEFAULT_TRAIN_RATIO = 0.75;

    private static final Set<String> COMPUTED_FILLS = Set.of("mean", "median", "mode", "min", "max");
    private static final Set<String> DATE_COMPONENTS = Set.of(
            "year", "month", "day", "hour", "minute", "second", "quarter", "week", "dayofweek", "weekday", "dayofyear");

    private final List<DeclaredDataset> declared;

    public SemanticFlowAssembler() {
        this(DEFAULT_FLOW_NAME, RecipeNamer.plain(), List.of());
    }

    public SemanticFlowAssembler(String flowName, RecipeNamer namer, List<DeclaredDataset> declared) {
        super(flowName, namer);
        this.declared = declared != null ? List.copyOf(declared) : List.of();
    }

    @Override
    protected void beforeSteps(Flow flow) {
        for (DeclaredDataset d : declared) {
            if (d.role() != DatasetRole.INPUT || d.name().isBlank()) continue;
            String name = declareInput(d.name(), d.location() != null ? DatasetNames.fromPath(d.location()) : null, d.location());
            Dataset ds = flow.getDataset(name);
            d.columns().forEach(c -> ds.annotateColumn(new ColumnSchema(c, null, true)));
        }
    }

    @Override
    protected void afterSteps(Flow flow) {
        for (DeclaredDataset d : declared) {
            if (d.role() != DatasetRole.OUTPUT) continue;
            String bound = boundDataset(d.name());
            Dataset ds = bound != null ? flow.getDataset(bound) : null;
            if (ds == null || ds.isInput()) continue;
            ds.declareRole(DatasetRole.OUTPUT);
            if (ds.getLocation() == null) ds.setLocation(d.location());
        }
    }

    @Override
    protected RecipeDraft draft(DataStep s) {
        switch (s.operation()) {
            case READ_DATA:
                return read(s);
            case WRITE_DATA:
                return write(s);
            case UNKNOWN:
                return code(s, "operation '" + s.rawOperation() + "' not recognized");
            default:
                break;
        }
        RecipeType recipe = s.effectiveRecipe();
        if (recipe == null || recipe.isCode()) {
            return code(s, s.reasoning() != null && !s.reasoning().isBlank() ? s.reasoning() : "reported as needing a code recipe");
        }
        if (recipe == RecipeType.PREPARE) return prepare(s);

        RecipeDraft.Builder b = RecipeDraft.recipe(recipe, s.inputDatasets(), targets(s), null);
        RecipeSettings settings = settings(s, recipe, b);
        if (settings == null) return code(s, s.operation().toValue() + " has no " + recipe.toValue() + " equivalent");
        return b.settings(settings)
                .lines(s.sourceLines())
                .columns(s.columns())
                .build();
    }

    @Override
    protected RecipeDraft.Builder codeFallback(DataStep s, String reason) {
        String code = s.sourceCode() != null && !s.sourceCode().isBlank() ? s.sourceCode()
                : s.description().isBlank() ? null : "# " + s.description();
        return RecipeDraft.code(s.inputDatasets(), targets(s), code, reason)
                .lines(s.sourceLines())
                .columns(s.columns());
    }

    private RecipeDraft code(DataStep s, String reason) {
        return codeFallback(s, reason).build();
    }

    private static List<String> targets(DataStep s) {
        return s.outputDataset() != null && !s.outputDataset().isBlank() ? List.of(s.outputDataset()) : List.of();
    }

    // ------------------------------------------------------------------ io

    private RecipeDraft read(DataStep s) {
        String target = s.outputDataset() != null ? s.outputDataset() : first(s.inputDatasets());
        if (target == null) return RecipeDraft.skip("read without a dataset name");
        if (boundDataset(target) != null) return RecipeDraft.skip("input '" + target + "' already declared");
        String location = s.inputDatasets().stream().filter(n -> !n.equals(target)).findFirst().orElse(null);
        return RecipeDraft.read(target)
                .datasetName(location != null ? DatasetNames.fromPath(location) : null)
                .location(location)
                .lines(s.sourceLines())
                .columns(s.columns())
                .build();
    }

    private static RecipeDraft write(DataStep s) {
        String source = first(s.inputDatasets());
        String location = s.outputDataset() != null && !s.outputDataset().equals(source) ? s.outputDataset() : null;
        return RecipeDraft.write(source)
                .datasetName(location != null ? DatasetNames.fromPath(location) : null)
                .location(location)
                .lines(s.sourceLines())
                .build();
    }

    // ------------------------------------------------------------------ visual recipes

    private RecipeSettings settings(DataStep s, RecipeType recipe, RecipeDraft.Builder b) {
        return switch (recipe) {
            case GROUPING -> grouping(s, b);
            case WINDOW -> window(s);
            case JOIN -> join(s);
            case STACK -> StackSettings.union();
            case SPLIT -> split(s);
            case SORT -> sort(s);
            case DISTINCT -> new DistinctSettings(s.columns(), false);
            case TOP_N -> topN(s, b);
            case SAMPLING -> sampling(s, b);
            case PIVOT -> pivot(s);
            case SYNC, PREDICTION_SCORING -> new SyncSettings();
            default -> null;
        };
    }

    private static GroupingSettings grouping(DataStep s, RecipeDraft.Builder b) {
        List<Aggregation> aggregations = new ArrayList<>();
        boolean globalCount = false;
        for (AggregationSpec a : s.aggregations()) {
            String function = Aggregation.normalizeFunction(a.function());
            if (a.column() == null || a.column().isBlank()) {
                if (!function.equals("COUNT")) {
                    throw new IllegalArgumentException("aggregation " + a.function() + " without a column");
                }
                globalCount = true;
                continue;
            }
            aggregations.add(new Aggregation(a.column(), function, a.outputColumn()));
        }
        if (aggregations.isEmpty() && !globalCount) {
            globalCount = true;
            b.note("no aggregations reported; counting rows per group");
        }
        return new GroupingSettings(s.groupByColumns(), aggregations, globalCount);
    }

    private static WindowSettings window(DataStep s) {
        List<Aggregation> aggregations = new ArrayList<>();
        for (AggregationSpec a : s.aggregations()) {
            aggregations.add(new Aggregation(a.column(), Aggregation.normalizeFunction(a.function()), a.outputColumn()));
        }
        Integer frame = null;
        for (ColumnTransform ct : s.columnTransforms()) {
            if (s.aggregations().isEmpty()) {
                aggregations.add(new Aggregation(ct.column(), Aggregation.normalizeFunction(ct.operation()), ct.outputColumn()));
            }
            Object window = ct.parameters().get("window");
            if (window instanceof Number n) frame = n.intValue();
        }
        List<String> order = s.sortColumns().stream().map(SortSpec::column).collect(Collectors.toList());
        return new WindowSettings(s.groupByColumns(), order, aggregations, frame);
    }

    private JoinSettings join(DataStep s) {
        if (s.inputDatasets().size() < 2) throw new IllegalArgumentException("join with a single input");
        List<JoinKey> keys = new ArrayList<>();
        for (JoinCondition c : s.joinConditions()) {
            String left = c.leftColumn();
            String right = c.rightColumn() != null ? c.rightColumn() : left;
            if (left != null) keys.add(new JoinKey(left, right, "EQ"));
        }
        if (!JoinType.isRecognized(s.joinType())) {
            warn(String.format("Join type '%s' of '%s' is not recognized; using INNER", s.joinType(), s.outputDataset()));
        }
        return new JoinSettings(JoinType.fromValue(s.joinType()), keys);
    }

    private static SplitSettings split(DataStep s) {
        if (!s.filterConditions().isEmpty()) {
            return SplitSettings.filter(s.filterConditions().stream().map(FilterCondition::toFormula)
                    .collect(Collectors.joining(" and ")));
        }
        Double ratio = number(s.fillValue());
        return SplitSettings.random(ratio != null && ratio > 0 && ratio < 1 ? ratio : DEFAULT_TRAIN_RATIO);
    }

    private static SortSettings sort(DataStep s) {
        List<SortColumn> columns = new ArrayList<>();
        for (SortSpec spec : s.sortColumns()) columns.add(SortColumn.of(spec.column(), spec.ascending()));
        if (columns.isEmpty()) s.columns().forEach(c -> columns.add(SortColumn.of(c, true)));
        if (columns.isEmpty()) throw new IllegalArgumentException("sort without columns");
        return new SortSettings(columns);
    }

    private static TopNSettings topN(DataStep s, RecipeDraft.Builder b) {
        Double n = number(s.fillValue());
        if (n == null) b.note("row count not reported; using " + DEFAULT_TOP_N);
        List<String> ranking = s.sortColumns().stream().map(SortSpec::column).collect(Collectors.toList());
        boolean ascending = !s.sortColumns().isEmpty() && s.sortColumns().get(0).ascending();
        return new TopNSettings(n != null ? n.intValue() : DEFAULT_TOP_N, ranking, ascending);
    }

    private static SamplingSettings sampling(DataStep s, RecipeDraft.Builder b) {
        Double n = number(s.fillValue());
        if (n == null) {
            b.note("sample size not reported; using a ratio of " + DEFAULT_SAMPLE_RATIO);
            return new SamplingSettings("RANDOM_FIXED_RATIO", DEFAULT_SAMPLE_RATIO, null);
        }
        if (n < 1) return new SamplingSettings("RANDOM_FIXED_RATIO", n, null);
        return new SamplingSettings("RANDOM_FIXED_NUMBER", null, n.intValue());
    }

    private static PivotSettings pivot(DataStep s) {
        List<String> index = s.groupByColumns();
        if (s.operation() == OperationType.UNPIVOT) {
            List<String> values = s.columns().stream().filter(c -> !index.contains(c)).collect(Collectors.toList());
            return new PivotSettings("UNPIVOT", index, List.of(), values, null);
        }
        List<String> values = s.aggregations().stream().map(AggregationSpec::column)
                .filter(c -> c != null && !c.isBlank()).collect(Collectors.toList());
        List<String> pivotColumns = s.columns().stream()
                .filter(c -> !index.contains(c) && !values.contains(c)).collect(Collectors.toList());
        String function = s.aggregations().isEmpty() ? null : Aggregation.normalizeFunction(s.aggregations().get(0).function());
        return new PivotSettings("PIVOT", index, pivotColumns, values, function);
    }

    // ------------------------------------------------------------------ prepare steps

    private RecipeDraft prepare(DataStep s) {
        Integer line = first(s.sourceLines());
        RecipeDraft.Builder b = RecipeDraft.prepare(first(s.inputDatasets()), s.outputDataset(), List.of())
                .lines(s.sourceLines())
                .columns(s.columns());
        switch (s.operation()) {
            case FILL_MISSING -> fill(s, line, b);
            case DROP_MISSING -> b.step(PrepareStep.removeRowsOnEmpty(s.columns(), line));
            case RENAME_COLUMNS -> {
                if (!s.renameMapping().isEmpty()) b.step(PrepareStep.renameColumns(s.renameMapping(), line));
            }
            case DROP_COLUMNS -> {
                if (!s.columns().isEmpty()) b.step(PrepareStep.deleteColumns(s.columns(), line));
            }
            case SELECT_COLUMNS -> {
                if (!s.columns().isEmpty()) b.step(PrepareStep.selectColumns(s.columns(), line));
            }
            case FILTER -> s.filterConditions().forEach(c -> filter(c, line, b));
            case CAST_TYPE -> {
                for (ColumnTransform ct : s.columnTransforms()) {
                    String type = platformType(text(firstParam(ct, "type", "dtype", "to")));
                    b.step(PrepareStep.setType(ct.column(), type, line));
                    b.columnType(ct.column(), type);
                }
            }
            case PARSE_DATE -> {
                for (String column : transformedColumns(s)) {
                    b.step(PrepareStep.parseDate(column, text(formatOf(s, column)), line));
                    b.columnType(column, "date");
                }
            }
            case SPLIT_COLUMN -> {
                for (ColumnTransform ct : s.columnTransforms()) {
                    Object separator = firstParam(ct, "separator", "sep", "delimiter", "pat");
                    b.step(PrepareStep.splitColumn(ct.column(), separator != null ? separator.toString() : ",", line));
                }
            }
            case ENCODE_CATEGORICAL -> {
                for (String column : transformedColumns(s)) b.step(PrepareStep.encode(column, methodOf(s, column, "onehot"), line));
            }
            case NORMALIZE_SCALE -> {
                for (String column : transformedColumns(s)) b.step(PrepareStep.normalize(column, methodOf(s, column, "standard"), line));
            }
            case ADD_COLUMN, TRANSFORM_COLUMN -> s.columnTransforms().forEach(ct -> transform(ct, line, b));
            default -> {
                // other operations only reach here when the model suggested a Prepare recipe
            }
        }
        RecipeDraft draft = b.build();
        if (!draft.steps().isEmpty()) return draft;

        for (String name : s.suggestedProcessors()) {
            ProcessorType type = ProcessorType.fromValue(name);
            if (type == ProcessorType.UNKNOWN || type == ProcessorType.PYTHON_UDF) continue;
            Map<String, Object> params = new LinkedHashMap<>();
            if (!s.columns().isEmpty()) params.put("columns", s.columns());
            b.step(new PrepareStep(type, params, line));
            b.note(type.toValue() + " settings not reported; review the step");
        }
        draft = b.build();
        if (!draft.steps().isEmpty()) return draft;
        log.debug("No processor steps derived | step={} | operation={}", s.stepNumber(), s.operation().toValue());
        return code(s, "no processor could be derived from the reported details");
    }

    private static void fill(DataStep s, Integer line, RecipeDraft.Builder b) {
        Object value = s.fillValue();
        if (value instanceof Map<?, ?> m) {
            m.forEach((column, v) -> b.step(PrepareStep.fillEmpty(String.valueOf(column), v, line)));
            return;
        }
        if (value == null) {
            for (ColumnTransform ct : s.columnTransforms()) {
                Object v = firstParam(ct, "value", "fill_value");
                Object strategy = firstParam(ct, "strategy", "method");
                if (v != null) b.step(PrepareStep.fillEmpty(ct.column(), v, line));
                else if (strategy != null) fillByName(ct.column(), strategy.toString(), line, b);
            }
            return;
        }
        for (String column : orAll(s.columns())) {
            if (value instanceof String name && fillByName(column, name, line, b)) continue;
            b.step(PrepareStep.fillEmpty(column, value, line));
        }
    }

    /** Fill named by strategy ({@code mean}, {@code ffill}); false when the name is a literal value. */
    private static boolean fillByName(String column, String name, Integer line, RecipeDraft.Builder b) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (COMPUTED_FILLS.contains(key)) {
            b.step(PrepareStep.fillComputed(column, key.toUpperCase(Locale.ROOT), line));
            return true;
        }
        if (key.equals("ffill") || key.equals("forward") || key.equals("pad")) {
            b.step(PrepareStep.fillPreviousNext(column, "PREVIOUS", line));
            return true;
        }
        if (key.equals("bfill") || key.equals("backward") || key.equals("backfill")) {
            b.step(PrepareStep.fillPreviousNext(column, "NEXT", line));
            return true;
        }
        return false;
    }

    private static void filter(FilterCondition c, Integer line, RecipeDraft.Builder b) {
        String op = c.operator().trim().toLowerCase(Locale.ROOT);
        switch (op) {
            case "equals", "eq", "==", "not_equals", "ne", "!=", "in", "not_in" -> {
                List<?> values = c.value() instanceof List<?> l ? l : Collections.singletonList(c.value());
                boolean keep = op.equals("equals") || op.equals("eq") || op.equals("==") || op.equals("in");
                b.step(PrepareStep.filterOnValue(c.column(), values, "FULL_STRING", keep, line));
            }
            case "greater_than_or_equal", "gte", "ge", ">=" -> b.step(PrepareStep.filterOnRange(c.column(), c.value(), null, line));
            case "less_than_or_equal", "lte", "le", "<=" -> b.step(PrepareStep.filterOnRange(c.column(), null, c.value(), line));
            case "not_null", "notnull", "is_not_empty" -> b.step(PrepareStep.removeRowsOnEmpty(List.of(c.column()), line));
            default -> b.step(PrepareStep.filterOnFormula(c.toFormula(), line));
        }
    }

    private static void transform(ColumnTransform ct, Integer line, RecipeDraft.Builder b) {
        String op = ct.operation().trim().toLowerCase(Locale.ROOT);
        String column = ct.column();
        String output = ct.outputColumn() != null && !ct.outputColumn().isBlank() ? ct.outputColumn() : null;

        StringTransformMode stringMode = StringTransformMode.fromPythonName(op);
        if (stringMode != null) {
            b.step(PrepareStep.stringTransform(copyIfNeeded(column, output, line, b), stringMode, line));
            return;
        }
        if (DATE_COMPONENTS.contains(op)) {
            b.step(PrepareStep.dateComponent(column, op, output != null ? output : column + "_" + op, line));
            return;
        }
        switch (op) {
            case "round" -> b.step(PrepareStep.round(copyIfNeeded(column, output, line, b),
                    number(firstParam(ct, "decimals", "digits")) != null ? number(firstParam(ct, "decimals", "digits")).intValue() : 0, line));
            case "abs", "absolute" -> b.step(PrepareStep.abs(copyIfNeeded(column, output, line, b), line));
            case "fillna", "fill", "fill_missing" -> {
                Object v = firstParam(ct, "value", "fill_value");
                if (v == null || !(v instanceof String name && fillByName(column, name, line, b))) {
                    b.step(PrepareStep.fillEmpty(column, v != null ? v : "", line));
                }
            }
            case "replace", "find_replace" -> b.step(PrepareStep.findReplace(copyIfNeeded(column, output, line, b),
                    text(firstParam(ct, "find", "old", "pattern", "to_replace")),
                    text(firstParam(ct, "replace", "new", "value", "replacement")),
                    Boolean.TRUE.equals(ct.parameters().get("regex")), line));
            case "extract", "regex_extract" -> b.step(PrepareStep.regexpExtract(column,
                    text(firstParam(ct, "pattern", "regex")), output != null ? output : column + "_", line));
            case "split" -> b.step(PrepareStep.splitColumn(column,
                    firstParam(ct, "separator", "sep", "delimiter") != null ? text(firstParam(ct, "separator", "sep", "delimiter")) : ",", line));
            case "cast", "astype", "convert_type", "to_numeric" -> {
                String type = platformType(text(firstParam(ct, "type", "dtype", "to")) != null
                        ? text(firstParam(ct, "type", "dtype", "to")) : op.equals("to_numeric") ? "double" : null);
                String target = copyIfNeeded(column, output, line, b);
                b.step(PrepareStep.setType(target, type, line));
                b.columnType(target, type);
            }
            case "to_datetime", "parse_date", "date_parse" -> {
                String target = copyIfNeeded(column, output, line, b);
                b.step(PrepareStep.parseDate(target, text(firstParam(ct, "format")), line));
                b.columnType(target, "date");
            }
            case "strftime", "format_date" -> b.step(PrepareStep.formatDate(copyIfNeeded(column, output, line, b),
                    text(firstParam(ct, "format")), line));
            case "clip" -> b.step(PrepareStep.clip(copyIfNeeded(column, output, line, b),
                    firstParam(ct, "lower", "min"), firstParam(ct, "upper", "max"), line));
            case "bin", "cut", "qcut", "binning" -> b.step(PrepareStep.binner(column, firstParam(ct, "bins"), output, line));
            case "map", "translate", "translate_values" -> {
                if (!(firstParam(ct, "mapping", "values") instanceof Map<?, ?> m)) {
                    throw new IllegalArgumentException("value mapping for '" + column + "' not reported");
                }
                Map<String, Object> mapping = new LinkedHashMap<>();
                m.forEach((k, v) -> mapping.put(String.valueOf(k), v));
                b.step(PrepareStep.translateValues(column, mapping, output, line));
            }
            case "normalize", "scale", "standardize" -> b.step(PrepareStep.normalize(copyIfNeeded(column, output, line, b),
                    text(firstParam(ct, "method")) != null ? text(firstParam(ct, "method")) : "standard", line));
            case "encode", "one_hot", "onehot", "label_encode" -> b.step(PrepareStep.encode(column,
                    op.equals("label_encode") ? "label" : "onehot", line));
            case "rename" -> {
                if (output == null) throw new IllegalArgumentException("rename of '" + column + "' without a new name");
                b.step(PrepareStep.renameColumns(Map.of(column, output), line));
            }
            case "copy" -> b.step(PrepareStep.copyColumn(column, output != null ? output : column + "_copy", line));
            default -> {
                NumericalTransformMode mode = NumericalTransformMode.fromPythonName(op);
                Object expression = firstParam(ct, "expression", "formula");
                if (mode != null) {
                    b.step(PrepareStep.numerical(column, mode, output, line));
                } else if (expression != null) {
                    b.step(PrepareStep.createColumn(output != null ? output : column, expression.toString(), line));
                } else {
                    throw new IllegalArgumentException("column operation '" + ct.operation() + "' has no processor");
                }
            }
        }
    }

    private static String copyIfNeeded(String column, String output, Integer line, RecipeDraft.Builder b) {
        if (output == null || output.equals(column)) return column;
        b.step(PrepareStep.copyColumn(column, output, line));
        return output;
    }

    /** Columns of the column transforms, else the step's columns. */
    private static List<String> transformedColumns(DataStep s) {
        if (s.columnTransforms().isEmpty()) return s.columns();
        return s.columnTransforms().stream().map(ColumnTransform::column).filter(c -> !c.isBlank()).collect(Collectors.toList());
    }

    private static Object formatOf(DataStep s, String column) {
        return s.columnTransforms().stream().filter(ct -> ct.column().equals(column))
                .map(ct -> firstParam(ct, "format")).filter(v -> v != null).findFirst().orElse(null);
    }

    private static String methodOf(DataStep s, String column, String fallback) {
        return s.columnTransforms().stream().filter(ct -> ct.column().equals(column))
                .map(ct -> text(firstParam(ct, "method", "strategy"))).filter(v -> v != null).findFirst().orElse(fallback);
    }

    private static Object firstParam(ColumnTransform ct, String... keys) {
        for (String k : keys) {
            Object v = ct.parameters().get(k);
            if (v != null) return v;
        }
        return null;
    }

    private static List<String> orAll(List<String> columns) {
        return columns.isEmpty() ? Collections.singletonList(null) : columns;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static <V> V first(List<V> values) {
        return values.isEmpty() ? null : values.get(0);
    }
}
