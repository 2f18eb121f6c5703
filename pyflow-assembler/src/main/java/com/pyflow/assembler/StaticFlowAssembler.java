package com.pyflow.assembler;

import com.pyflow.model.ColumnSchema;
import com.pyflow.model.Dataset;
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
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.Transformation;
import com.pyflow.model.transform.TransformationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assembles the transformations of the static analyzer. Prepare-kind transformations become
 * processor steps; the rest become one recipe each, with settings read from the catalog's
 * parameters ({@link Params}). Anything the parameters cannot express becomes a code recipe.
 */
public final class StaticFlowAssembler extends AbstractFlowAssembler<Transformation> {

    private static final Logger log = LoggerFactory.getLogger(StaticFlowAssembler.class);

    private static final double DEFAULT_TRAIN_RATIO = 0.75;

    public StaticFlowAssembler() {
        this(DEFAULT_FLOW_NAME, RecipeNamer.plain());
    }

    public StaticFlowAssembler(String flowName, RecipeNamer namer) {
        super(flowName, namer);
    }

    @Override
    protected RecipeDraft draft(Transformation t) {
        switch (t.kind()) {
            case READ_DATA:
                return read(t);
            case WRITE_DATA:
                return write(t);
            case UNKNOWN:
                return code(t, "statement not recognized");
            default:
                break;
        }
        RecipeType recipe = t.effectiveRecipe();
        if (recipe == null || recipe.isCode()) return code(t, codeReason(t));
        if (recipe == RecipeType.PREPARE) return prepare(t);

        RecipeDraft.Builder b = RecipeDraft.recipe(recipe, t.sourceNames(), targets(t), null);
        RecipeSettings settings = settings(t, recipe, b);
        if (settings == null) return code(t, t.kind().toValue() + " with these arguments has no visual recipe");
        return b.settings(settings)
                .lines(t.sourceLines())
                .columns(t.columns())
                .notes(t.notes())
                .build();
    }

    @Override
    protected RecipeDraft.Builder codeFallback(Transformation t, String reason) {
        String code = t.parameter(Params.CODE) != null ? t.parameter(Params.CODE) : t.sourceCode();
        return RecipeDraft.code(t.sourceNames(), targets(t), code, reason)
                .lines(t.sourceLines())
                .columns(t.columns())
                .notes(t.notes());
    }

    private RecipeDraft code(Transformation t, String reason) {
        return codeFallback(t, reason).build();
    }

    private static String codeReason(Transformation t) {
        if (!t.notes().isEmpty()) return String.join("; ", t.notes());
        String estimator = t.parameter(Params.ESTIMATOR);
        if (t.kind() == TransformationKind.FIT) {
            return "model training" + (estimator != null ? " (" + estimator + ")" : "") + " has no visual recipe";
        }
        String function = t.parameter(Params.FUNCTION);
        return t.kind().toValue() + (function != null ? " (" + function + ")" : "") + " has no visual recipe";
    }

    private static List<String> targets(Transformation t) {
        if (t.kind() == TransformationKind.SPLIT && t.parameters().get(Params.OUTPUTS) != null) {
            return strings(t.parameters().get(Params.OUTPUTS));
        }
        return t.targetName() != null ? List.of(t.targetName()) : List.of();
    }

    // ------------------------------------------------------------------ io

    private static RecipeDraft read(Transformation t) {
        String format = t.parameter(Params.FORMAT);
        String path = t.parameter(Params.PATH);
        boolean inline = "inline".equals(format);
        boolean sql = "sql".equals(format);
        RecipeDraft.Builder b = RecipeDraft.read(t.targetName())
                .datasetName(inline || sql ? null : DatasetNames.fromPath(path))
                .location(inline ? null : path)
                .lines(t.sourceLines())
                .columns(t.columns())
                .notes(t.notes());
        if (inline) b.note("built inline in the script");
        if (sql) b.note("read with a SQL query");
        return b.build();
    }

    private static RecipeDraft write(Transformation t) {
        String path = t.parameter(Params.PATH);
        boolean sql = "sql".equals(t.parameter(Params.FORMAT));
        return RecipeDraft.write(t.sourceDataframe())
                .datasetName(sql ? path : DatasetNames.fromPath(path))
                .location(path)
                .lines(t.sourceLines())
                .build();
    }

    // ------------------------------------------------------------------ visual recipes

    private RecipeSettings settings(Transformation t, RecipeType recipe, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        switch (recipe) {
            case GROUPING:
                return grouping(t, b);
            case WINDOW:
                return window(t, b);
            case JOIN:
                return join(t, b);
            case STACK:
                return integer(p.get(Params.AXIS), 0) == 1 ? null : StackSettings.union();
            case SPLIT:
                return split(t);
            case SORT:
                return sort(t);
            case DISTINCT:
                if (p.get(Params.KEEP) != null && !"first".equals(p.get(Params.KEEP))) {
                    b.note("keeps one row per key; the script kept " + p.get(Params.KEEP));
                }
                return new DistinctSettings(t.columns(), false);
            case TOP_N:
                return topN(t, b);
            case SAMPLING:
                return sampling(t, b);
            case PIVOT:
                return pivot(t);
            case SYNC:
            case PREDICTION_SCORING:
                return scoring(t, b);
            default:
                return null;
        }
    }

    private static SyncSettings scoring(Transformation t, RecipeDraft.Builder b) {
        String function = t.parameter(Params.FUNCTION);
        if (function != null && !"predict".equals(function)) b.note("scores with " + function);
        return new SyncSettings();
    }

    private GroupingSettings grouping(Transformation t, RecipeDraft.Builder b) {
        List<String> keys = strings(t.parameters().get(Params.KEYS));
        List<Aggregation> aggregations = new ArrayList<>();
        boolean globalCount = false;
        for (Object o : list(t.parameters().get(Params.AGGREGATIONS))) {
            if (!(o instanceof Map<?, ?> m)) continue;
            String column = text(m.get("column"));
            String function = text(m.get("function"));
            if (column == null) {
                if ("count".equals(function) || "size".equals(function)) {
                    globalCount = true;
                    continue;
                }
                String type = Aggregation.normalizeFunction(function);
                List<String> others = nonKeyColumns(t.sourceDataframe(), keys);
                if (others.isEmpty()) {
                    aggregations.add(new Aggregation(null, type, null));
                    b.note("'" + function + "' applies to every non-key column; the columns are not known");
                } else {
                    others.forEach(c -> aggregations.add(new Aggregation(c, type, null)));
                    b.note("'" + function + "' expanded over the known non-key columns " + others);
                }
                continue;
            }
            aggregations.add(new Aggregation(column, Aggregation.normalizeFunction(function), text(m.get("output"))));
        }
        return new GroupingSettings(keys, aggregations, globalCount);
    }

    /** Schema columns of the dataset bound to the name, minus the group keys; empty when unknown. */
    private List<String> nonKeyColumns(String name, List<String> keys) {
        String bound = name != null ? boundDataset(name) : null;
        Dataset ds = bound != null ? flow().getDataset(bound) : null;
        if (ds == null) return List.of();
        return ds.getSchema().stream().map(ColumnSchema::name).filter(c -> !keys.contains(c)).toList();
    }

    private static WindowSettings window(Transformation t, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        String function = text(p.get(Params.FUNCTION));
        String mode = text(p.get(Params.WINDOW_MODE));
        List<String> outputs = outputs(t);
        List<Aggregation> aggregations = new ArrayList<>();
        List<String> columns = t.columns().isEmpty() ? Collections.singletonList(null) : t.columns();
        for (int i = 0; i < columns.size(); i++) {
            String output = i < outputs.size() ? outputs.get(i) : null;
            aggregations.add(new Aggregation(columns.get(i), Aggregation.normalizeFunction(function), output));
        }
        if ("ewm".equals(mode)) b.note("exponential weighting approximated by a sliding frame");
        if ("expanding".equals(mode)) b.note("expanding frame from the first row");
        Integer periods = integer(p.get(Params.PERIODS), null);
        if (periods != null) b.note("offset of " + periods + " rows");
        return new WindowSettings(strings(p.get(Params.KEYS)), List.of(), aggregations, integer(p.get(Params.WINDOW), null));
    }

    private JoinSettings join(Transformation t, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        String how = text(p.get(Params.HOW));
        if (!JoinType.isRecognized(how)) {
            warn(String.format("Join type '%s'%s is not recognized; using INNER", how,
                    t.sourceLine() != null ? " (line " + t.sourceLine() + ")" : ""));
        }
        JoinType type = JoinType.fromValue(how);
        List<JoinKey> keys = new ArrayList<>();
        List<String> on = strings(p.get(Params.ON));
        List<String> left = strings(p.get(Params.LEFT_ON));
        List<String> right = strings(p.get(Params.RIGHT_ON));
        if (!on.isEmpty()) {
            on.forEach(c -> keys.add(JoinKey.on(c)));
        } else if (!left.isEmpty()) {
            if (left.size() != right.size()) {
                throw new IllegalArgumentException("left_on and right_on differ in length");
            }
            for (int i = 0; i < left.size(); i++) keys.add(new JoinKey(left.get(i), right.get(i), "EQ"));
        } else if (type != JoinType.CROSS) {
            b.note("no join keys in the script; pandas joins on shared columns or the index");
        }
        return new JoinSettings(type, keys);
    }

    private static SplitSettings split(Transformation t) {
        if (t.sourceNames().size() > 1) {
            throw new IllegalArgumentException("splits " + t.sourceNames().size() + " arrays in lockstep");
        }
        Map<String, Object> p = t.parameters();
        Double test = decimal(p.get(Params.TEST_SIZE));
        Double train = decimal(p.get(Params.TRAIN_SIZE));
        double ratio = test != null && test < 1 ? 1 - test : train != null && train < 1 ? train : DEFAULT_TRAIN_RATIO;
        return SplitSettings.random(ratio);
    }

    private static SortSettings sort(Transformation t) {
        if (Boolean.TRUE.equals(t.parameters().get(Params.BY_INDEX))) return null;
        if (t.columns().isEmpty()) throw new IllegalArgumentException("sort without columns");
        Object ascending = t.parameters().get(Params.ASCENDING);
        List<SortColumn> columns = new ArrayList<>();
        for (int i = 0; i < t.columns().size(); i++) {
            boolean asc = true;
            if (ascending instanceof List<?> l) {
                if (i < l.size()) asc = !Boolean.FALSE.equals(l.get(i));
            } else if (ascending instanceof Boolean flag) {
                asc = flag;
            }
            columns.add(SortColumn.of(t.columns().get(i), asc));
        }
        return new SortSettings(columns);
    }

    private static TopNSettings topN(Transformation t, RecipeDraft.Builder b) {
        int n = integer(t.parameters().get(Params.N), 5);
        if (t.kind() == TransformationKind.HEAD) return new TopNSettings(n, List.of(), false);
        if (t.kind() == TransformationKind.TAIL) {
            b.note("takes the last " + n + " rows; set a ranking column to reproduce the order");
            return new TopNSettings(n, List.of(), false);
        }
        return new TopNSettings(n, t.columns(), Boolean.TRUE.equals(t.parameters().get(Params.ASCENDING)));
    }

    private static SamplingSettings sampling(Transformation t, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer seed = integer(p.get(Params.RANDOM_STATE), null);
        if (seed != null) b.note("random seed " + seed);
        Double fraction = decimal(p.get(Params.FRAC));
        if (fraction != null) return new SamplingSettings("RANDOM_FIXED_RATIO", fraction, null);
        return new SamplingSettings("RANDOM_FIXED_NUMBER", null, integer(p.get(Params.N), 1));
    }

    private static PivotSettings pivot(Transformation t) {
        Map<String, Object> p = t.parameters();
        if (t.kind() == TransformationKind.MELT) {
            return new PivotSettings("UNPIVOT", strings(p.get(Params.ID_VARS)), List.of(), strings(p.get(Params.VALUE_VARS)), null);
        }
        String aggfunc = text(p.get(Params.AGGFUNC));
        return new PivotSettings("PIVOT", strings(p.get(Params.INDEX)), strings(p.get(Params.PIVOT_COLUMNS)),
                strings(p.get(Params.VALUES)), aggfunc != null ? Aggregation.normalizeFunction(aggfunc) : null);
    }

    // ------------------------------------------------------------------ prepare steps

    private RecipeDraft prepare(Transformation t) {
        ProcessorType processor = t.suggestedProcessor() != null ? t.suggestedProcessor() : defaultProcessor(t.kind());
        RecipeDraft.Builder b = RecipeDraft.prepare(t.sourceDataframe(), t.targetName(), List.of())
                .lines(t.sourceLines())
                .columns(t.columns())
                .notes(t.notes());
        steps(t, processor, b);
        RecipeDraft draft = b.build();
        if (draft.steps().isEmpty()) {
            log.debug("No processor steps | transformation={} | processor={}", t, processor);
            return code(t, processor.toValue() + " step has nothing to apply");
        }
        return draft;
    }

    private static ProcessorType defaultProcessor(TransformationKind kind) {
        return switch (kind) {
            case COLUMN_RENAME -> ProcessorType.COLUMN_RENAMER;
            case COLUMN_DROP -> ProcessorType.COLUMN_DELETER;
            case COLUMN_SELECT -> ProcessorType.COLUMNS_SELECTOR;
            case COLUMN_COPY -> ProcessorType.COLUMN_COPIER;
            case COLUMN_CREATE -> ProcessorType.CREATE_COLUMN_WITH_GREL;
            case FILL_NA -> ProcessorType.FILL_EMPTY_WITH_VALUE;
            case DROP_NA -> ProcessorType.REMOVE_ROWS_ON_EMPTY;
            case TYPE_CAST -> ProcessorType.TYPE_SETTER;
            case STRING_TRANSFORM -> ProcessorType.STRING_TRANSFORMER;
            case NUMERIC_TRANSFORM -> ProcessorType.NUMERICAL_TRANSFORMER;
            case DATE_PARSE -> ProcessorType.DATE_PARSER;
            case VALUE_REPLACE -> ProcessorType.FIND_REPLACE;
            case CATEGORICAL_ENCODE -> ProcessorType.CATEGORICAL_ENCODER;
            case BINNING -> ProcessorType.BINNER;
            case FILTER -> ProcessorType.FILTER_ON_FORMULA;
            case DROP_DUPLICATES -> ProcessorType.REMOVE_DUPLICATES;
            default -> ProcessorType.UNKNOWN;
        };
    }

    private static void steps(Transformation t, ProcessorType processor, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer line = t.sourceLine();
        List<String> columns = t.columns();
        String method = text(p.get(Params.METHOD));
        switch (processor) {
            case FILL_EMPTY_WITH_VALUE -> {
                Map<String, Object> mapping = mapping(p.get(Params.MAPPING));
                if (!mapping.isEmpty()) {
                    mapping.forEach((column, value) -> b.step(PrepareStep.fillEmpty(column, value, line)));
                } else if (p.containsKey(Params.VALUE)) {
                    for (String column : orAll(columns)) b.step(PrepareStep.fillEmpty(column, p.get(Params.VALUE), line));
                } else {
                    throw new IllegalArgumentException("fill value is neither a literal nor a mapping");
                }
            }
            case FILL_EMPTY_WITH_PREVIOUS_NEXT -> {
                String direction = "bfill".equals(method) ? "NEXT" : "PREVIOUS";
                for (String column : orAll(columns)) b.step(PrepareStep.fillPreviousNext(column, direction, line));
            }
            case FILL_EMPTY_WITH_COMPUTED_VALUE -> computedFill(t, method, b);
            case REMOVE_ROWS_ON_EMPTY -> {
                b.step(PrepareStep.removeRowsOnEmpty(columns, line));
                if ("all".equals(p.get(Params.HOW))) b.note("the script drops only rows empty in every column");
            }
            case STRING_TRANSFORMER -> {
                StringTransformMode mode = StringTransformMode.fromPythonName(method);
                if (mode == null) throw new IllegalArgumentException("no string transform for '" + method + "'");
                if (p.get("width") != null) b.note(method + " to width " + p.get("width"));
                for (String[] io : inputOutputPairs(t)) {
                    b.step(PrepareStep.stringTransform(copyIfNeeded(io, line, b), mode, line));
                }
            }
            case FIND_REPLACE -> {
                if (p.get(Params.FIND) == null) throw new IllegalArgumentException("replace without a search value");
                boolean regex = Boolean.TRUE.equals(p.get(Params.REGEX));
                String replacement = p.get(Params.REPLACE) != null ? String.valueOf(p.get(Params.REPLACE)) : "";
                for (String[] io : inputOutputPairs(t)) {
                    b.step(PrepareStep.findReplace(copyIfNeeded(io, line, b), String.valueOf(p.get(Params.FIND)),
                            replacement, regex, line));
                }
            }
            case TRANSLATE_VALUES -> {
                Map<String, Object> mapping = mapping(p.get(Params.MAPPING));
                if (mapping.isEmpty()) throw new IllegalArgumentException("value mapping is empty");
                String output = text(p.get(Params.OUTPUT));
                for (String column : orAll(columns)) b.step(PrepareStep.translateValues(column, mapping, output, line));
            }
            case TYPE_SETTER -> {
                Map<String, Object> mapping = mapping(p.get(Params.MAPPING));
                if (!mapping.isEmpty()) {
                    mapping.forEach((column, dtype) -> typeStep(column, String.valueOf(dtype), line, b));
                } else {
                    String dtype = text(p.get(Params.DTYPE));
                    if (dtype == null) throw new IllegalArgumentException("type cast without a type");
                    for (String[] io : inputOutputPairs(t)) typeStep(copyIfNeeded(io, line, b), dtype, line, b);
                }
            }
            case DATE_PARSER -> {
                for (String[] io : inputOutputPairs(t)) {
                    String column = copyIfNeeded(io, line, b);
                    b.step(PrepareStep.parseDate(column, text(p.get(Params.FORMAT)), line));
                    b.columnType(column, "date");
                }
            }
            case DATE_FORMATTER -> {
                for (String[] io : inputOutputPairs(t)) {
                    b.step(PrepareStep.formatDate(copyIfNeeded(io, line, b), text(p.get(Params.FORMAT)), line));
                }
            }
            case DATE_COMPONENTS_EXTRACTOR -> {
                String component = text(p.get(Params.COMPONENT));
                for (String[] io : inputOutputPairs(t)) {
                    String output = io[1].equals(io[0]) ? io[0] + "_" + component : io[1];
                    b.step(PrepareStep.dateComponent(io[0], component, output, line));
                }
            }
            case NUMERICAL_TRANSFORMER -> numerical(t, method, b);
            case ROUND_COLUMN -> {
                int decimals = integer(p.get(Params.DECIMALS), 0);
                for (String[] io : inputOutputPairs(t)) b.step(PrepareStep.round(copyIfNeeded(io, line, b), decimals, line));
            }
            case ABS_COLUMN -> {
                for (String[] io : inputOutputPairs(t)) b.step(PrepareStep.abs(copyIfNeeded(io, line, b), line));
            }
            case CLIP_COLUMN -> {
                for (String[] io : inputOutputPairs(t)) {
                    b.step(PrepareStep.clip(copyIfNeeded(io, line, b), p.get(Params.LOWER), p.get(Params.UPPER), line));
                }
            }
            case BINNER -> {
                Object bins = p.get(Params.BINS);
                if (bins == null) throw new IllegalArgumentException("binning without bins");
                if (p.get(Params.LABELS) != null) b.note("bin labels " + p.get(Params.LABELS));
                if ("qcut".equals(method) || "quantile".equals(method)) b.note("quantile-based bins");
                for (String[] io : inputOutputPairs(t)) {
                    b.step(PrepareStep.binner(io[0], bins, io[1].equals(io[0]) ? null : io[1], line));
                }
            }
            case NORMALIZER -> {
                requireColumns(columns, "scaling");
                for (String[] io : inputOutputPairs(t)) b.step(PrepareStep.normalize(copyIfNeeded(io, line, b), method, line));
            }
            case CATEGORICAL_ENCODER -> {
                requireColumns(columns, "encoding");
                for (String column : columns) b.step(PrepareStep.encode(column, method, line));
            }
            case COLUMN_RENAMER -> {
                Map<String, String> renamings = new LinkedHashMap<>();
                mapping(p.get(Params.MAPPING)).forEach((from, to) -> renamings.put(from, String.valueOf(to)));
                if (renamings.isEmpty()) throw new IllegalArgumentException("rename without a column mapping");
                b.step(PrepareStep.renameColumns(renamings, line));
            }
            case COLUMN_DELETER -> {
                requireColumns(columns, "column removal");
                b.step(PrepareStep.deleteColumns(columns, line));
            }
            case COLUMNS_SELECTOR -> {
                requireColumns(columns, "column selection");
                b.step(PrepareStep.selectColumns(columns, line));
            }
            case COLUMN_COPIER -> {
                String output = text(p.get(Params.OUTPUT));
                if (output == null || columns.isEmpty()) throw new IllegalArgumentException("copy without source or output column");
                b.step(PrepareStep.copyColumn(columns.get(0), output, line));
            }
            case CREATE_COLUMN_WITH_GREL -> formula(t, method, b);
            case IF_THEN_ELSE -> {
                String output = firstNonNull(text(p.get(Params.OUTPUT)), text(p.get(Params.COLUMN)),
                        columns.isEmpty() ? null : columns.get(0));
                if (output == null || p.get(Params.CONDITION) == null) {
                    throw new IllegalArgumentException("conditional value without output or condition");
                }
                b.step(PrepareStep.ifThenElse(output, text(p.get(Params.CONDITION)), p.get(Params.THEN), p.get(Params.OTHERWISE), line));
            }
            case COALESCE -> {
                requireColumns(columns, "coalesce");
                b.step(PrepareStep.coalesce(columns, firstNonNull(text(p.get(Params.OUTPUT)), columns.get(0)), line));
            }
            case ARRAY_UNFOLD -> {
                requireColumns(columns, "unfold");
                b.step(PrepareStep.unfold(columns.get(0), line));
            }
            case REGEXP_EXTRACTOR -> {
                for (String[] io : inputOutputPairs(t)) {
                    String prefix = io[1].equals(io[0]) ? io[0] + "_" : io[1];
                    b.step(PrepareStep.regexpExtract(io[0], text(p.get(Params.PATTERN)), prefix, line));
                }
            }
            case SPLIT_COLUMN -> {
                for (String column : columns) b.step(PrepareStep.splitColumn(column, text(p.get(Params.SEPARATOR)), line));
            }
            case FILTER_ON_VALUE -> valueFilter(t, b);
            case FILTER_ON_NUMERIC_RANGE -> rangeFilter(t, b);
            case FILTER_ON_FORMULA -> {
                String condition = text(p.get(Params.CONDITION));
                if (condition == null) throw new IllegalArgumentException("filter without a condition");
                b.step(PrepareStep.filterOnFormula(condition, line));
            }
            case REMOVE_DUPLICATES -> b.step(PrepareStep.removeDuplicates(columns, line));
            case PYTHON_UDF -> {
                String code = firstNonNull(text(p.get(Params.CODE)), t.sourceCode());
                b.step(PrepareStep.pythonUdf(code, line));
                b.note("row-level Python function kept as a processor");
            }
            default -> throw new IllegalArgumentException("no processor step for " + processor.toValue());
        }
    }

    private static void computedFill(Transformation t, String method, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer line = t.sourceLine();
        String strategy = method == null ? "mean" : method.toLowerCase(Locale.ROOT);
        if (strategy.equals("constant")) {
            for (String column : orAll(t.columns())) b.step(PrepareStep.fillEmpty(column, p.get(Params.VALUE), line));
            return;
        }
        if (strategy.equals("expression")) {
            String expression = text(p.get(Params.EXPRESSION));
            if (expression == null) throw new IllegalArgumentException("computed fill without an expression");
            requireColumns(t.columns(), "fill from an expression");
            for (String column : t.columns()) {
                b.step(PrepareStep.ifThenElse(column, "isBlank(" + column + ")", expression, column, line));
            }
            return;
        }
        if (strategy.equals("most_frequent")) strategy = "mode";
        if (strategy.equals("interpolate")) {
            b.note("interpolation" + (p.get(Params.STRATEGY) != null ? " (" + p.get(Params.STRATEGY) + ")" : "")
                    + " approximated by the processor's interpolate mode");
        }
        for (String column : orAll(t.columns())) {
            b.step(PrepareStep.fillComputed(column, strategy.toUpperCase(Locale.ROOT), line));
        }
    }

    private static void numerical(Transformation t, String method, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer line = t.sourceLine();
        String output = text(p.get(Params.OUTPUT));
        String expression = text(p.get(Params.EXPRESSION));
        if (expression != null && t.columns().isEmpty()) {
            if (output == null) throw new IllegalArgumentException(method + " of an expression without an output column");
            b.step(PrepareStep.createColumn(output, method + "(" + expression + ")", line));
            return;
        }
        if ("power".equals(method)) {
            for (String[] io : inputOutputPairs(t)) {
                b.step(PrepareStep.createColumn(io[1], "pow(" + io[0] + ", " + p.get(Params.VALUE) + ")", line));
            }
            return;
        }
        NumericalTransformMode mode = NumericalTransformMode.fromPythonName(method);
        if (mode == null) throw new IllegalArgumentException("no numerical transform for '" + method + "'");
        if ("log1p".equals(method)) b.note("log1p applied as log");
        for (String[] io : inputOutputPairs(t)) {
            b.step(PrepareStep.numerical(io[0], mode, io[1].equals(io[0]) ? null : io[1], line));
        }
    }

    private static void formula(Transformation t, String method, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer line = t.sourceLine();
        String column = text(p.get(Params.COLUMN));
        String output = firstNonNull(text(p.get(Params.OUTPUT)), column);

        Map<String, Object> assignments = mapping(p.get(Params.ASSIGNMENTS));
        if (!assignments.isEmpty()) {
            assignments.forEach((name, expr) -> b.step(PrepareStep.createColumn(name, String.valueOf(expr), line)));
            return;
        }
        if (p.get(Params.OUTPUTS) != null) {
            throw new IllegalArgumentException("one expression assigned to several columns");
        }
        String expression = text(p.get(Params.EXPRESSION));
        if (expression == null && "in".equals(p.get(Params.OPERATOR))) {
            expression = column + " in " + p.get(Params.VALUES);
        } else if (expression == null && "select".equals(method)) {
            expression = "select(" + p.get("conditions") + ", " + p.get("choices") + ", " + p.get(Params.OTHERWISE) + ")";
        } else if (expression == null && method != null && column != null) {
            expression = accessorFormula(method, column, p.get(Params.PATTERN), p.get("stop"));
        }
        if (expression == null || output == null) {
            throw new IllegalArgumentException("formula column without expression or output");
        }
        b.step(PrepareStep.createColumn(output, expression, line));
    }

    /** Formula for the string accessor predicates and measures ({@code contains}, {@code len}, ...). */
    private static String accessorFormula(String method, String column, Object pattern, Object stop) {
        String quoted = pattern != null ? "'" + pattern + "'" : null;
        return switch (method) {
            case "len" -> "length(" + column + ")";
            case "slice" -> "substring(" + column + ", " + (pattern != null ? pattern : 0)
                    + (stop != null ? ", " + stop : "") + ")";
            case "contains", "match", "count", "find" -> method + "(" + column + ", " + quoted + ")";
            case "startswith" -> "startsWith(" + column + ", " + quoted + ")";
            case "endswith" -> "endsWith(" + column + ", " + quoted + ")";
            default -> null;
        };
    }

    private static void valueFilter(Transformation t, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        String column = text(p.get(Params.COLUMN));
        String operator = text(p.get(Params.OPERATOR));
        if (column == null || !p.containsKey(Params.VALUE)) {
            throw new IllegalArgumentException("value filter without column or value");
        }
        Object value = p.get(Params.VALUE);
        List<?> values = value instanceof List<?> l ? l : List.of(value);
        boolean keep = "==".equals(operator) || "in".equals(operator);
        b.step(PrepareStep.filterOnValue(column, values, "FULL_STRING", keep, t.sourceLine()));
    }

    /** Inclusive bounds map to a range filter; strict ones keep the formula. */
    private static void rangeFilter(Transformation t, RecipeDraft.Builder b) {
        Map<String, Object> p = t.parameters();
        Integer line = t.sourceLine();
        String column = text(p.get(Params.COLUMN));
        String operator = text(p.get(Params.OPERATOR));
        String condition = text(p.get(Params.CONDITION));
        if (column != null && "between".equals(operator)) {
            b.step(PrepareStep.filterOnRange(column, p.get(Params.LOWER), p.get(Params.UPPER), line));
        } else if (column != null && ">=".equals(operator)) {
            b.step(PrepareStep.filterOnRange(column, p.get(Params.VALUE), null, line));
        } else if (column != null && "<=".equals(operator)) {
            b.step(PrepareStep.filterOnRange(column, null, p.get(Params.VALUE), line));
        } else if (condition != null) {
            b.step(PrepareStep.filterOnFormula(condition, line));
        } else {
            throw new IllegalArgumentException("range filter without bounds");
        }
    }

    private static void typeStep(String column, String dtype, Integer line, RecipeDraft.Builder b) {
        String type = platformType(dtype);
        if ("date".equals(type)) {
            b.step(PrepareStep.parseDate(column, null, line));
        } else {
            b.step(PrepareStep.setType(column, type, line));
        }
        b.columnType(column, type);
    }

    /** Input/output column pairs of a column-level step; the output equals the input when unchanged. */
    private static List<String[]> inputOutputPairs(Transformation t) {
        requireColumns(t.columns(), t.kind().toValue());
        Map<String, Object> p = t.parameters();
        String output = text(p.get(Params.OUTPUT));
        List<String> outputs = strings(p.get(Params.OUTPUTS));
        List<String[]> pairs = new ArrayList<>();
        for (int i = 0; i < t.columns().size(); i++) {
            String in = t.columns().get(i);
            String out = in;
            if (output != null && t.columns().size() == 1) out = output;
            else if (outputs.size() == t.columns().size()) out = outputs.get(i);
            pairs.add(new String[]{in, out});
        }
        return pairs;
    }

    /** Copies the input into a new output column when they differ; returns the column to transform. */
    private static String copyIfNeeded(String[] io, Integer line, RecipeDraft.Builder b) {
        if (io[1].equals(io[0])) return io[0];
        b.step(PrepareStep.copyColumn(io[0], io[1], line));
        return io[1];
    }

    private static List<String> outputs(Transformation t) {
        String output = text(t.parameters().get(Params.OUTPUT));
        if (output != null) return List.of(output);
        return strings(t.parameters().get(Params.OUTPUTS));
    }

    private static void requireColumns(List<String> columns, String what) {
        if (columns.isEmpty()) throw new IllegalArgumentException(what + " over every column needs the column list");
    }

    /** The columns, or a single null meaning every column. */
    private static List<String> orAll(List<String> columns) {
        return columns.isEmpty() ? Collections.singletonList(null) : columns;
    }

    // ------------------------------------------------------------------ parameter values

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> l ? l : List.of();
    }

    private static List<String> strings(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> l) {
            List<String> out = new ArrayList<>();
            for (Object o : l) {
                if (o != null) out.add(o.toString());
            }
            return out;
        }
        return List.of(value.toString());
    }

    private static Map<String, Object> mapping(Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> m) m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static Integer integer(Object value, Integer fallback) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.valueOf(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integer: " + s, e);
            }
        }
        return fallback;
    }

    private static Double decimal(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        return null;
    }

    @SafeVarargs
    private static <V> V firstNonNull(V... values) {
        for (V v : values) {
            if (v != null) return v;
        }
        return null;
    }
}
