package com.pyflow.catalog;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.TransformationKind;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pyflow.catalog.ArgumentShape.firstIs;
import static com.pyflow.catalog.ArgumentShape.withKeyword;
import static com.pyflow.catalog.CallTarget.COLUMN_METHOD;
import static com.pyflow.catalog.CallTarget.DATAFRAME_METHOD;
import static com.pyflow.catalog.CallTarget.DATETIME_ACCESSOR;
import static com.pyflow.catalog.CallTarget.GROUPBY_METHOD;
import static com.pyflow.catalog.CallTarget.MODULE_FUNCTION;
import static com.pyflow.catalog.CallTarget.STRING_ACCESSOR;
import static com.pyflow.catalog.CallTarget.WINDOW_METHOD;

/** Built-in rules for pandas readers, writers, dataframe, column, accessor, groupby and window calls. */
final class PandasPatterns {

    private static final String[][] READERS = {
            {"read_csv", "csv", "filepath_or_buffer"},
            {"read_table", "csv", "filepath_or_buffer"},
            {"read_fwf", "fwf", "filepath_or_buffer"},
            {"read_excel", "excel", "io"},
            {"read_parquet", "parquet", "path"},
            {"read_json", "json", "path_or_buf"},
            {"read_feather", "feather", "path"},
            {"read_pickle", "pickle", "filepath_or_buffer"},
            {"read_hdf", "hdf", "path_or_buf"},
            {"read_orc", "orc", "path"},
            {"read_xml", "xml", "path_or_buffer"},
            {"read_html", "html", "io"},
            {"read_sql", "sql", "sql"},
            {"read_sql_query", "sql", "sql"},
            {"read_sql_table", "sql", "table_name"},
    };

    private static final String[][] WRITERS = {
            {"to_csv", "csv", "path_or_buf"},
            {"to_excel", "excel", "excel_writer"},
            {"to_parquet", "parquet", "path"},
            {"to_json", "json", "path_or_buf"},
            {"to_feather", "feather", "path"},
            {"to_pickle", "pickle", "path"},
            {"to_hdf", "hdf", "path_or_buf"},
            {"to_orc", "orc", "path"},
            {"to_xml", "xml", "path_or_buffer"},
            {"to_sql", "sql", "name"},
    };

    private static final List<String> GROUP_AGGREGATIONS = List.of(
            "sum", "mean", "count", "min", "max", "median", "std", "var", "first", "last",
            "nunique", "size", "prod");

    private static final List<String> RUNNING_FUNCTIONS = List.of(
            "cumsum", "cumprod", "cummax", "cummin", "diff", "shift", "rank", "pct_change");

    private static final List<String> WINDOW_AGGREGATIONS = List.of(
            "sum", "mean", "min", "max", "std", "var", "count", "median");

    private static final List<String> STRING_CASE_METHODS = List.of(
            "upper", "lower", "strip", "lstrip", "rstrip", "title", "capitalize", "swapcase", "casefold");

    private static final List<String> DATE_COMPONENTS = List.of(
            "year", "month", "day", "hour", "minute", "second", "dayofweek", "day_of_week", "weekday",
            "quarter", "dayofyear", "day_of_year", "week", "weekofyear", "date", "time", "day_name",
            "month_name", "is_month_end", "is_month_start");

    private static final List<String> FRAME_DISPLAY = List.of(
            "info", "describe", "plot", "hist", "boxplot", "memory_usage", "to_string", "to_markdown",
            "isna", "isnull", "notna", "notnull", "sum", "mean", "median", "min", "max", "std", "var",
            "count", "nunique", "corr", "cov", "quantile", "mode", "any", "all", "duplicated", "equals",
            "items", "iterrows", "itertuples", "to_dict", "to_numpy", "keys");

    private static final List<String> COLUMN_SCALARS = List.of(
            "sum", "mean", "median", "min", "max", "std", "var", "count", "nunique", "mode", "quantile",
            "unique", "tolist", "to_list", "to_numpy", "plot", "hist", "describe", "idxmax", "idxmin",
            "any", "all", "item");

    private static final List<String> PASSTHROUGH = List.of(
            "copy", "reset_index", "set_index", "rename_axis", "infer_objects", "to_frame", "squeeze");

    private PandasPatterns() {
    }

    static void register(PatternCatalog.Builder b) {
        readersAndWriters(b);
        cleaning(b);
        columns(b);
        rows(b);
        reshaping(b);
        grouping(b);
        accessors(b);
        passive(b);
    }

    private static void readersAndWriters(PatternCatalog.Builder b) {
        for (String[] r : READERS) {
            String format = r[1];
            String pathKeyword = r[2];
            b.add(PatternRule.on("pandas." + r[0], MODULE_FUNCTION)
                    .kind(TransformationKind.READ_DATA)
                    .extract(a -> ParamMap.create()
                            .put(Params.PATH, pathOrSource(a, pathKeyword))
                            .put(Params.FORMAT, format)
                            .map()));
        }
        b.add(PatternRule.on("pandas.DataFrame", MODULE_FUNCTION)
                .kind(TransformationKind.READ_DATA)
                .extract(a -> ParamMap.create().put(Params.FORMAT, "inline").put(Params.COLUMNS, a.strings(-1, "columns")).map()));
        for (String[] w : WRITERS) {
            String format = w[1];
            String pathKeyword = w[2];
            b.add(PatternRule.on(w[0], DATAFRAME_METHOD)
                    .kind(TransformationKind.WRITE_DATA)
                    .extract(a -> ParamMap.create()
                            .put(Params.PATH, pathOrSource(a, pathKeyword))
                            .put(Params.FORMAT, format)
                            .map()));
        }
    }

    private static String pathOrSource(CallArguments a, String keyword) {
        String path = a.string(0, keyword);
        return path != null ? path : a.source(0, keyword);
    }

    private static void cleaning(PatternCatalog.Builder b) {
        for (CallTarget t : List.of(DATAFRAME_METHOD, COLUMN_METHOD)) {
            b.add(PatternRule.on("fillna", t)
                    .when(withKeyword("method"))
                    .kind(TransformationKind.FILL_NA)
                    .processor(ProcessorType.FILL_EMPTY_WITH_PREVIOUS_NEXT)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.METHOD, a.string(-1, "method")).map()));
            b.add(PatternRule.on("fillna", t)
                    .when(firstIs(LiteralKind.EXPRESSION, LiteralKind.NAME))
                    .kind(TransformationKind.FILL_NA)
                    .processor(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE)
                    .extract(PandasPatterns::computedFill));
            b.add(PatternRule.on("fillna", t)
                    .kind(TransformationKind.FILL_NA)
                    .processor(ProcessorType.FILL_EMPTY_WITH_VALUE)
                    .extract(PandasPatterns::fillValue));
            for (String m : List.of("ffill", "pad", "bfill", "backfill")) {
                String direction = m.equals("ffill") || m.equals("pad") ? "ffill" : "bfill";
                b.add(PatternRule.on(m, t)
                        .kind(TransformationKind.FILL_NA)
                        .processor(ProcessorType.FILL_EMPTY_WITH_PREVIOUS_NEXT)
                        .extract(a -> ParamMap.create().receiver(a).put(Params.METHOD, direction).map()));
            }
            b.add(PatternRule.on("interpolate", t)
                    .kind(TransformationKind.FILL_NA)
                    .processor(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, "interpolate")
                            .put(Params.STRATEGY, a.string(0, "method"))
                            .map()));
            b.add(PatternRule.on("replace", t)
                    .when(s -> s.firstArgument() == LiteralKind.DICT && !s.hasKeyword("regex"))
                    .kind(TransformationKind.VALUE_REPLACE)
                    .processor(ProcessorType.TRANSLATE_VALUES)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.MAPPING, a.dict(0, "to_replace")).map()));
            b.add(PatternRule.on("replace", t)
                    .kind(TransformationKind.VALUE_REPLACE)
                    .processor(ProcessorType.FIND_REPLACE)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.FIND, a.literal(0, "to_replace"))
                            .put(Params.REPLACE, a.literal(1, "value"))
                            .put(Params.REGEX, a.bool(-1, "regex", false))
                            .map()));
            b.add(PatternRule.on("astype", t)
                    .when(firstIs(LiteralKind.DICT))
                    .kind(TransformationKind.TYPE_CAST)
                    .processor(ProcessorType.TYPE_SETTER)
                    .extract(a -> ParamMap.create().put(Params.MAPPING, a.dict(0, "dtype")).map()));
            b.add(PatternRule.on("astype", t)
                    .kind(TransformationKind.TYPE_CAST)
                    .processor(ProcessorType.TYPE_SETTER)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.DTYPE, dtype(a)).map()));
            b.add(PatternRule.on("clip", t)
                    .kind(TransformationKind.NUMERIC_TRANSFORM)
                    .processor(ProcessorType.CLIP_COLUMN)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, "clip")
                            .put(Params.LOWER, a.literal(0, "lower"))
                            .put(Params.UPPER, a.literal(1, "upper"))
                            .map()));
            b.add(PatternRule.on("round", t)
                    .kind(TransformationKind.NUMERIC_TRANSFORM)
                    .processor(ProcessorType.ROUND_COLUMN)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, "round")
                            .put(Params.DECIMALS, a.integer(0, "decimals") != null ? a.integer(0, "decimals") : Integer.valueOf(0))
                            .map()));
            b.add(PatternRule.on("abs", t)
                    .kind(TransformationKind.NUMERIC_TRANSFORM)
                    .processor(ProcessorType.ABS_COLUMN)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.METHOD, "abs").map()));
        }
        b.add(PatternRule.on("dropna", DATAFRAME_METHOD)
                .kind(TransformationKind.DROP_NA)
                .processor(ProcessorType.REMOVE_ROWS_ON_EMPTY)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMNS, a.strings(-1, "subset"))
                        .put(Params.HOW, a.string(-1, "how"))
                        .map()));
        b.add(PatternRule.on("dropna", COLUMN_METHOD)
                .kind(TransformationKind.DROP_NA)
                .processor(ProcessorType.REMOVE_ROWS_ON_EMPTY)
                .extract(a -> ParamMap.create().put(Params.COLUMNS, a.receiverColumns()).map()));
        b.add(PatternRule.on("pandas.to_numeric", MODULE_FUNCTION)
                .kind(TransformationKind.TYPE_CAST)
                .processor(ProcessorType.TYPE_SETTER)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMN, a.columnRef(0, "arg"))
                        .put(Params.DTYPE, "double")
                        .map()));
        b.add(PatternRule.on("pandas.to_datetime", MODULE_FUNCTION)
                .kind(TransformationKind.DATE_PARSE)
                .processor(ProcessorType.DATE_PARSER)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMN, a.columnRef(0, "arg"))
                        .put(Params.METHOD, "parse")
                        .put(Params.FORMAT, a.string(-1, "format"))
                        .map()));
    }

    private static Map<String, Object> fillValue(CallArguments a) {
        ParamMap p = ParamMap.create().receiver(a);
        Expr value = a.argument(0, "value");
        if (value instanceof Expr.Dict) {
            p.put(Params.MAPPING, a.dict(0, "value"));
        } else if (CallArguments.isLiteral(value)) {
            p.put(Params.VALUE, CallArguments.literal(value));
        } else if (value != null) {
            p.put(Params.EXPRESSION, a.formula(0, "value"));
        }
        return p.map();
    }

    /** {@code fillna(df['a'].mean())}: the statistic becomes the method, the source is kept. */
    private static Map<String, Object> computedFill(CallArguments a) {
        Expr value = a.argument(0, "value");
        String method = "expression";
        if (value instanceof Expr.Call call && call.func() instanceof Expr.Attribute attr
                && List.of("mean", "median", "mode", "min", "max").contains(attr.attr())) {
            method = attr.attr();
        }
        return ParamMap.create().receiver(a)
                .put(Params.METHOD, method)
                .put(Params.EXPRESSION, a.formula(0, "value"))
                .map();
    }

    private static String dtype(CallArguments a) {
        String s = a.string(0, "dtype");
        return s != null ? s : a.source(0, "dtype");
    }

    private static void columns(PatternCatalog.Builder b) {
        b.add(PatternRule.on("drop", DATAFRAME_METHOD)
                .when(withKeyword("columns"))
                .kind(TransformationKind.COLUMN_DROP)
                .processor(ProcessorType.COLUMN_DELETER)
                .extract(a -> ParamMap.create().put(Params.COLUMNS, a.strings(-1, "columns")).map()));
        b.add(PatternRule.on("drop", DATAFRAME_METHOD)
                .when(withKeyword("axis"))
                .kind(TransformationKind.COLUMN_DROP)
                .processor(ProcessorType.COLUMN_DELETER)
                .extract(a -> ParamMap.create().put(Params.COLUMNS, a.strings(0, "labels")).map()));
        b.add(PatternRule.on("drop", DATAFRAME_METHOD)
                .kind(TransformationKind.FILTER)
                .recipe(RecipeType.PYTHON)
                .requiresCode()
                .extract(a -> ParamMap.create().put(Params.INDEX, a.source(0, "index")).map()));
        b.add(PatternRule.on("rename", DATAFRAME_METHOD)
                .when(s -> s.hasKeyword("columns") || s.firstArgument() == LiteralKind.DICT)
                .kind(TransformationKind.COLUMN_RENAME)
                .processor(ProcessorType.COLUMN_RENAMER)
                .extract(a -> ParamMap.create()
                        .put(Params.MAPPING, a.dict(-1, "columns") != null ? a.dict(-1, "columns") : a.dict(0, "mapper"))
                        .map()));
        b.add(PatternRule.on("filter", DATAFRAME_METHOD)
                .when(s -> s.hasKeyword("items") || s.firstArgument() == LiteralKind.LIST)
                .kind(TransformationKind.COLUMN_SELECT)
                .processor(ProcessorType.COLUMNS_SELECTOR)
                .extract(a -> ParamMap.create().put(Params.COLUMNS, a.strings(0, "items")).map()));
        b.add(PatternRule.on("assign", DATAFRAME_METHOD)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                .extract(a -> {
                    Map<String, Object> assignments = new LinkedHashMap<>();
                    for (Map.Entry<String, Expr> e : a.keywords().entrySet()) {
                        assignments.put(e.getKey(), a.formula(-1, e.getKey()));
                    }
                    return ParamMap.create().put(Params.ASSIGNMENTS, assignments).map();
                }));
        b.add(PatternRule.on("explode", DATAFRAME_METHOD)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.ARRAY_UNFOLD)
                .extract(a -> ParamMap.create().put(Params.COLUMN, a.string(0, "column")).map()));
        b.add(PatternRule.on("explode", COLUMN_METHOD)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.ARRAY_UNFOLD)
                .extract(a -> ParamMap.create().receiver(a).map()));
        b.add(PatternRule.on("map", COLUMN_METHOD)
                .when(firstIs(LiteralKind.DICT))
                .kind(TransformationKind.VALUE_REPLACE)
                .processor(ProcessorType.TRANSLATE_VALUES)
                .extract(a -> ParamMap.create().receiver(a).put(Params.MAPPING, a.dict(0, "arg")).map()));
        for (String m : List.of("map", "apply", "transform")) {
            b.add(PatternRule.on(m, COLUMN_METHOD)
                    .kind(TransformationKind.COLUMN_CREATE)
                    .processor(ProcessorType.PYTHON_UDF)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.CODE, a.source(0, "func")).map()));
        }
        for (String m : List.of("where", "mask")) {
            boolean inverted = m.equals("mask");
            b.add(PatternRule.on(m, COLUMN_METHOD)
                    .kind(TransformationKind.COLUMN_CREATE)
                    .processor(ProcessorType.IF_THEN_ELSE)
                    .extract(a -> {
                        String column = a.receiverColumn();
                        Object other = a.value(1, "other");
                        String condition = a.formula(0, "cond");
                        return ParamMap.create()
                                .put(Params.COLUMN, column)
                                .put(Params.CONDITION, inverted && condition != null ? "not (" + condition + ")" : condition)
                                .put(Params.THEN, column)
                                .put(Params.OTHERWISE, other)
                                .map();
                    }));
        }
        b.add(PatternRule.on("combine_first", COLUMN_METHOD)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.COALESCE)
                .extract(a -> {
                    List<String> cols = new ArrayList<>(a.receiverColumns());
                    String other = a.columnRef(0, "other");
                    if (other != null) cols.add(other);
                    return ParamMap.create().put(Params.COLUMNS, cols).map();
                }));
        for (String m : List.of("isna", "isnull", "notna", "notnull")) {
            String prefix = m.startsWith("not") ? "!isNull(" : "isNull(";
            b.add(PatternRule.on(m, COLUMN_METHOD)
                    .kind(TransformationKind.COLUMN_CREATE)
                    .processor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.EXPRESSION, prefix + a.receiverColumn() + ")")
                            .map()));
        }
        b.add(PatternRule.on("isin", COLUMN_METHOD)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                .extract(a -> ParamMap.create().receiver(a)
                        .put(Params.OPERATOR, "in")
                        .put(Params.VALUES, a.literal(0, "values"))
                        .map()));
        b.add(PatternRule.on("pandas.get_dummies", MODULE_FUNCTION)
                .kind(TransformationKind.CATEGORICAL_ENCODE)
                .processor(ProcessorType.CATEGORICAL_ENCODER)
                .extract(a -> {
                    List<String> cols = a.strings(-1, "columns");
                    if (cols.isEmpty() && a.columnRef(0, "data") != null) cols = List.of(a.columnRef(0, "data"));
                    return ParamMap.create().put(Params.METHOD, "dummies").put(Params.COLUMNS, cols)
                            .put("prefix", a.string(-1, "prefix")).map();
                }));
        for (String m : List.of("cut", "qcut")) {
            b.add(PatternRule.on("pandas." + m, MODULE_FUNCTION)
                    .kind(TransformationKind.BINNING)
                    .processor(ProcessorType.BINNER)
                    .extract(a -> ParamMap.create()
                            .put(Params.COLUMN, a.columnRef(0, "x"))
                            .put(Params.METHOD, m)
                            .put(Params.BINS, a.literal(1, m.equals("cut") ? "bins" : "q"))
                            .put(Params.LABELS, a.literal(-1, "labels"))
                            .map()));
        }
    }

    private static void rows(PatternCatalog.Builder b) {
        b.add(PatternRule.on("query", DATAFRAME_METHOD)
                .kind(TransformationKind.FILTER)
                .processor(ProcessorType.FILTER_ON_FORMULA)
                .extract(a -> ParamMap.create().put(Params.CONDITION, a.string(0, "expr")).map()));
        b.add(PatternRule.on("drop_duplicates", DATAFRAME_METHOD)
                .kind(TransformationKind.DROP_DUPLICATES)
                .recipe(RecipeType.DISTINCT)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMNS, a.strings(0, "subset"))
                        .put(Params.KEEP, a.literal(1, "keep"))
                        .map()));
        b.add(PatternRule.on("drop_duplicates", COLUMN_METHOD)
                .kind(TransformationKind.DROP_DUPLICATES)
                .recipe(RecipeType.DISTINCT)
                .extract(a -> ParamMap.create().put(Params.COLUMNS, a.receiverColumns()).map()));
        b.add(PatternRule.on("sort_values", DATAFRAME_METHOD)
                .kind(TransformationKind.SORT)
                .recipe(RecipeType.SORT)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMNS, a.strings(0, "by"))
                        .put(Params.ASCENDING, a.has(-1, "ascending") ? a.literal(-1, "ascending") : Boolean.TRUE)
                        .map()));
        b.add(PatternRule.on("sort_values", COLUMN_METHOD)
                .kind(TransformationKind.SORT)
                .recipe(RecipeType.SORT)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMNS, a.receiverColumns())
                        .put(Params.ASCENDING, a.has(-1, "ascending") ? a.literal(-1, "ascending") : Boolean.TRUE)
                        .map()));
        b.add(PatternRule.on("sort_index", DATAFRAME_METHOD)
                .kind(TransformationKind.SORT)
                .recipe(RecipeType.SORT)
                .extract(a -> ParamMap.create()
                        .put(Params.BY_INDEX, Boolean.TRUE)
                        .put(Params.ASCENDING, a.bool(-1, "ascending", true))
                        .map()));
        for (CallTarget t : List.of(DATAFRAME_METHOD, COLUMN_METHOD)) {
            for (String m : List.of("head", "tail")) {
                b.add(PatternRule.on(m, t)
                        .kind(m.equals("head") ? TransformationKind.HEAD : TransformationKind.TAIL)
                        .recipe(RecipeType.TOP_N)
                        .extract(a -> ParamMap.create()
                                .put(Params.N, a.integer(0, "n") != null ? a.integer(0, "n") : Integer.valueOf(5))
                                .map()));
            }
            b.add(PatternRule.on("sample", t)
                    .kind(TransformationKind.SAMPLE)
                    .recipe(RecipeType.SAMPLING)
                    .extract(a -> ParamMap.create()
                            .put(Params.N, a.integer(0, "n"))
                            .put(Params.FRAC, a.decimal(1, "frac"))
                            .put(Params.RANDOM_STATE, a.integer(-1, "random_state"))
                            .map()));
        }
        for (String m : List.of("nlargest", "nsmallest")) {
            boolean ascending = m.equals("nsmallest");
            b.add(PatternRule.on(m, DATAFRAME_METHOD)
                    .kind(TransformationKind.TOP_N)
                    .recipe(RecipeType.TOP_N)
                    .extract(a -> ParamMap.create()
                            .put(Params.N, a.integer(0, "n"))
                            .put(Params.COLUMNS, a.strings(1, "columns"))
                            .put(Params.ASCENDING, ascending)
                            .map()));
            b.add(PatternRule.on(m, COLUMN_METHOD)
                    .kind(TransformationKind.TOP_N)
                    .recipe(RecipeType.TOP_N)
                    .extract(a -> ParamMap.create()
                            .put(Params.N, a.integer(0, "n") != null ? a.integer(0, "n") : Integer.valueOf(5))
                            .put(Params.COLUMNS, a.receiverColumns())
                            .put(Params.ASCENDING, ascending)
                            .map()));
        }
    }

    private static void reshaping(PatternCatalog.Builder b) {
        b.add(PatternRule.on("merge", DATAFRAME_METHOD)
                .kind(TransformationKind.MERGE)
                .recipe(RecipeType.JOIN)
                .extract(a -> joinParams(a, "inner")));
        b.add(PatternRule.on("join", DATAFRAME_METHOD)
                .kind(TransformationKind.MERGE)
                .recipe(RecipeType.JOIN)
                .extract(a -> joinParams(a, "left")));
        b.add(PatternRule.on("pandas.merge", MODULE_FUNCTION)
                .kind(TransformationKind.MERGE)
                .recipe(RecipeType.JOIN)
                .extract(a -> joinParams(a, "inner")));
        b.add(PatternRule.on("pandas.concat", MODULE_FUNCTION)
                .kind(TransformationKind.CONCAT)
                .recipe(RecipeType.STACK)
                .extract(a -> ParamMap.create().put(Params.AXIS, axis(a)).map()));
        b.add(PatternRule.on("append", DATAFRAME_METHOD)
                .kind(TransformationKind.CONCAT)
                .recipe(RecipeType.STACK));
        for (String m : List.of("pivot", "pivot_table")) {
            ParameterExtractor pivot = a -> ParamMap.create()
                    .put(Params.INDEX, a.strings(-1, "index"))
                    .put(Params.PIVOT_COLUMNS, a.strings(-1, "columns"))
                    .put(Params.VALUES, a.strings(-1, "values"))
                    .put(Params.AGGFUNC, a.string(-1, "aggfunc") != null ? a.string(-1, "aggfunc")
                            : m.equals("pivot_table") ? "mean" : null)
                    .map();
            b.add(PatternRule.on(m, DATAFRAME_METHOD).kind(TransformationKind.PIVOT).recipe(RecipeType.PIVOT).extract(pivot));
            b.add(PatternRule.on("pandas." + m, MODULE_FUNCTION).kind(TransformationKind.PIVOT).recipe(RecipeType.PIVOT).extract(pivot));
        }
        ParameterExtractor melt = a -> ParamMap.create()
                .put(Params.ID_VARS, a.strings(-1, "id_vars"))
                .put(Params.VALUE_VARS, a.strings(-1, "value_vars"))
                .put("var_name", a.string(-1, "var_name"))
                .put("value_name", a.string(-1, "value_name"))
                .map();
        b.add(PatternRule.on("melt", DATAFRAME_METHOD).kind(TransformationKind.MELT).recipe(RecipeType.PIVOT).extract(melt));
        b.add(PatternRule.on("pandas.melt", MODULE_FUNCTION).kind(TransformationKind.MELT).recipe(RecipeType.PIVOT).extract(melt));
        b.add(PatternRule.on("stack", DATAFRAME_METHOD).kind(TransformationKind.MELT).recipe(RecipeType.PYTHON).requiresCode());
        b.add(PatternRule.on("unstack", DATAFRAME_METHOD).kind(TransformationKind.PIVOT).recipe(RecipeType.PYTHON).requiresCode());
        b.add(PatternRule.on("unstack", COLUMN_METHOD).kind(TransformationKind.PIVOT).recipe(RecipeType.PYTHON).requiresCode());
        b.add(PatternRule.on("transpose", DATAFRAME_METHOD).kind(TransformationKind.TRANSPOSE).recipe(RecipeType.PYTHON).requiresCode());
        b.add(PatternRule.on("T", DATAFRAME_METHOD).kind(TransformationKind.TRANSPOSE).recipe(RecipeType.PYTHON).requiresCode());
        for (String m : List.of("apply", "applymap", "map", "pipe", "transform", "agg", "aggregate", "eval")) {
            b.add(PatternRule.on(m, DATAFRAME_METHOD)
                    .kind(TransformationKind.CUSTOM_FUNCTION)
                    .recipe(RecipeType.PYTHON)
                    .requiresCode()
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, a.source(0, "func")).map()));
        }
        for (CallTarget t : List.of(DATAFRAME_METHOD, COLUMN_METHOD)) {
            for (String m : RUNNING_FUNCTIONS) {
                b.add(PatternRule.on(m, t)
                        .kind(TransformationKind.WINDOW)
                        .recipe(RecipeType.WINDOW)
                        .extract(a -> ParamMap.create().receiver(a)
                                .put(Params.FUNCTION, m)
                                .put(Params.PERIODS, a.integer(0, "periods"))
                                .map()));
            }
            for (String m : List.of("rolling", "expanding", "ewm")) {
                b.add(PatternRule.on(m, t)
                        .kind(TransformationKind.WINDOW)
                        .recipe(RecipeType.WINDOW)
                        .effect(RuleEffect.PENDING_WINDOW)
                        .extract(a -> ParamMap.create().receiver(a)
                                .put(Params.WINDOW_MODE, m)
                                .put(Params.WINDOW, a.integer(0, m.equals("ewm") ? "span" : "window"))
                                .map()));
            }
        }
        for (String m : WINDOW_AGGREGATIONS) {
            b.add(PatternRule.on(m, WINDOW_METHOD)
                    .kind(TransformationKind.WINDOW)
                    .recipe(RecipeType.WINDOW)
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, m).map()));
        }
        for (String m : List.of("apply", "agg", "aggregate")) {
            b.add(PatternRule.on(m, WINDOW_METHOD)
                    .kind(TransformationKind.WINDOW)
                    .recipe(RecipeType.PYTHON)
                    .requiresCode()
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, a.source(0, "func")).map()));
        }
    }

    private static Map<String, Object> joinParams(CallArguments a, String defaultHow) {
        String how = a.string(-1, "how");
        return ParamMap.create()
                .put(Params.ON, a.strings(-1, "on"))
                .put(Params.LEFT_ON, a.strings(-1, "left_on"))
                .put(Params.RIGHT_ON, a.strings(-1, "right_on"))
                .put(Params.HOW, how != null ? how : defaultHow)
                .map();
    }

    private static Integer axis(CallArguments a) {
        Object axis = a.literal(-1, "axis");
        if (axis instanceof Number n) return n.intValue();
        if ("columns".equals(axis)) return 1;
        return 0;
    }

    private static void grouping(PatternCatalog.Builder b) {
        b.add(PatternRule.on("groupby", DATAFRAME_METHOD)
                .kind(TransformationKind.GROUPBY)
                .recipe(RecipeType.GROUPING)
                .effect(RuleEffect.PENDING_GROUP)
                .extract(a -> {
                    List<String> keys = a.strings(0, "by");
                    if (keys.isEmpty() && a.columnRef(0, "by") != null) keys = List.of(a.columnRef(0, "by"));
                    return ParamMap.create().put(Params.KEYS, keys).map();
                }));
        for (String m : List.of("agg", "aggregate")) {
            b.add(PatternRule.on(m, GROUPBY_METHOD)
                    .kind(TransformationKind.GROUPBY)
                    .recipe(RecipeType.GROUPING)
                    .extract(PandasPatterns::aggregations));
        }
        for (String m : GROUP_AGGREGATIONS) {
            b.add(PatternRule.on(m, GROUPBY_METHOD)
                    .kind(TransformationKind.GROUPBY)
                    .recipe(RecipeType.GROUPING)
                    .extract(a -> ParamMap.create().put(Params.AGGREGATIONS, List.of(aggregation(null, m, null))).map()));
        }
        for (String m : List.of("cumsum", "cumprod", "cummax", "cummin", "cumcount", "rank", "shift", "diff", "pct_change")) {
            b.add(PatternRule.on(m, GROUPBY_METHOD)
                    .kind(TransformationKind.WINDOW)
                    .recipe(RecipeType.WINDOW)
                    .extract(a -> ParamMap.create()
                            .put(Params.FUNCTION, m)
                            .put(Params.PERIODS, a.integer(0, "periods"))
                            .map()));
        }
        b.add(PatternRule.on("transform", GROUPBY_METHOD)
                .when(firstIs(LiteralKind.STRING))
                .kind(TransformationKind.WINDOW)
                .recipe(RecipeType.WINDOW)
                .extract(a -> ParamMap.create().put(Params.FUNCTION, a.string(0, "func")).map()));
        for (String m : List.of("apply", "transform", "filter", "pipe")) {
            b.add(PatternRule.on(m, GROUPBY_METHOD)
                    .kind(TransformationKind.CUSTOM_FUNCTION)
                    .recipe(RecipeType.PYTHON)
                    .requiresCode()
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, a.source(0, "func")).map()));
        }
        b.add(PatternRule.on("value_counts", COLUMN_METHOD)
                .kind(TransformationKind.GROUPBY)
                .recipe(RecipeType.GROUPING)
                .extract(a -> ParamMap.create()
                        .put(Params.KEYS, a.receiverColumns())
                        .put(Params.AGGREGATIONS, List.of(aggregation(null, "count", null)))
                        .map()));
    }

    /** Aggregations of {@code agg(...)}: dict, list, single name, or named aggregation keywords. */
    static Map<String, Object> aggregations(CallArguments a) {
        List<Map<String, Object>> out = new ArrayList<>();
        Expr spec = a.argument(0, "func");
        if (spec instanceof Expr.Dict d) {
            for (int i = 0; i < d.keys().size(); i++) {
                Object column = CallArguments.literal(d.keys().get(i));
                if (column == null) continue;
                for (String f : CallArguments.strings(d.values().get(i))) out.add(aggregation(column.toString(), f, null));
            }
        } else if (spec != null) {
            for (String f : CallArguments.strings(spec)) out.add(aggregation(null, f, null));
        }
        for (Map.Entry<String, Expr> e : a.keywords().entrySet()) {
            if (e.getKey().equals("func")) continue;
            Expr v = e.getValue();
            if (v instanceof Expr.Tuple t && t.elements().size() == 2) {
                out.add(aggregation(stringOf(t.elements().get(0)), stringOf(t.elements().get(1)), e.getKey()));
            } else if (v instanceof Expr.Call call) {
                String column = null;
                String function = null;
                for (Keyword k : call.keywords()) {
                    if ("column".equals(k.name())) column = stringOf(k.value());
                    if ("aggfunc".equals(k.name())) function = stringOf(k.value());
                }
                if (column == null && !call.args().isEmpty()) column = stringOf(call.args().get(0));
                if (function == null && call.args().size() > 1) function = stringOf(call.args().get(1));
                if (function != null) out.add(aggregation(column, function, e.getKey()));
            } else if (v instanceof Expr.Constant c && c.isString()) {
                out.add(aggregation(null, (String) c.value(), e.getKey()));
            }
        }
        return ParamMap.create().put(Params.AGGREGATIONS, out).map();
    }

    private static String stringOf(Expr e) {
        return e instanceof Expr.Constant c && c.isString() ? (String) c.value() : null;
    }

    static Map<String, Object> aggregation(String column, String function, String output) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (column != null) m.put("column", column);
        m.put("function", function);
        if (output != null) m.put("output", output);
        return m;
    }

    private static void accessors(PatternCatalog.Builder b) {
        for (String m : STRING_CASE_METHODS) {
            b.add(PatternRule.on(m, STRING_ACCESSOR)
                    .kind(TransformationKind.STRING_TRANSFORM)
                    .processor(ProcessorType.STRING_TRANSFORMER)
                    .extract(a -> ParamMap.create().receiver(a).put(Params.METHOD, m).map()));
        }
        for (String m : List.of("pad", "zfill", "ljust", "rjust", "center")) {
            b.add(PatternRule.on(m, STRING_ACCESSOR)
                    .kind(TransformationKind.STRING_TRANSFORM)
                    .processor(ProcessorType.STRING_TRANSFORMER)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, m)
                            .put("width", a.integer(0, "width"))
                            .map()));
        }
        b.add(PatternRule.on("replace", STRING_ACCESSOR)
                .kind(TransformationKind.STRING_TRANSFORM)
                .processor(ProcessorType.FIND_REPLACE)
                .extract(a -> ParamMap.create().receiver(a)
                        .put(Params.METHOD, "replace")
                        .put(Params.FIND, a.string(0, "pat"))
                        .put(Params.REPLACE, a.string(1, "repl"))
                        .put(Params.REGEX, a.bool(-1, "regex", false))
                        .map()));
        b.add(PatternRule.on("extract", STRING_ACCESSOR)
                .kind(TransformationKind.STRING_TRANSFORM)
                .processor(ProcessorType.REGEXP_EXTRACTOR)
                .extract(a -> ParamMap.create().receiver(a)
                        .put(Params.METHOD, "extract")
                        .put(Params.PATTERN, a.string(0, "pat"))
                        .map()));
        b.add(PatternRule.on("split", STRING_ACCESSOR)
                .kind(TransformationKind.STRING_TRANSFORM)
                .processor(ProcessorType.SPLIT_COLUMN)
                .extract(a -> ParamMap.create().receiver(a)
                        .put(Params.METHOD, "split")
                        .put(Params.SEPARATOR, a.string(0, "pat") != null ? a.string(0, "pat") : " ")
                        .map()));
        for (String m : List.of("contains", "startswith", "endswith", "match", "len", "slice", "count", "find")) {
            b.add(PatternRule.on(m, STRING_ACCESSOR)
                    .kind(TransformationKind.STRING_TRANSFORM)
                    .processor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, m)
                            .put(Params.PATTERN, a.literal(0, "pat"))
                            .put("stop", a.literal(1, "stop"))
                            .map()));
        }
        for (String m : DATE_COMPONENTS) {
            b.add(PatternRule.on(m, DATETIME_ACCESSOR)
                    .kind(TransformationKind.DATE_PARSE)
                    .processor(ProcessorType.DATE_COMPONENTS_EXTRACTOR)
                    .extract(a -> ParamMap.create().receiver(a)
                            .put(Params.METHOD, "component")
                            .put(Params.COMPONENT, m)
                            .map()));
        }
        b.add(PatternRule.on("strftime", DATETIME_ACCESSOR)
                .kind(TransformationKind.DATE_PARSE)
                .processor(ProcessorType.DATE_FORMATTER)
                .extract(a -> ParamMap.create().receiver(a)
                        .put(Params.METHOD, "format")
                        .put(Params.FORMAT, a.string(0, "date_format"))
                        .map()));
    }

    private static void passive(PatternCatalog.Builder b) {
        for (String m : PASSTHROUGH) {
            b.add(PatternRule.on(m, DATAFRAME_METHOD).effect(RuleEffect.PASSTHROUGH));
        }
        b.add(PatternRule.on("reset_index", COLUMN_METHOD).effect(RuleEffect.PASSTHROUGH));
        b.add(PatternRule.on("copy", COLUMN_METHOD).effect(RuleEffect.PASSTHROUGH));
        for (String m : FRAME_DISPLAY) {
            b.add(PatternRule.on(m, DATAFRAME_METHOD).display());
        }
        for (String m : COLUMN_SCALARS) {
            b.add(PatternRule.on(m, COLUMN_METHOD).display());
        }
        for (String m : List.of("print", "display", "len", "type", "repr", "str", "list", "isinstance", "sorted")) {
            b.add(PatternRule.on(m, MODULE_FUNCTION).display());
        }
        for (String m : List.of("show", "plot", "figure", "hist", "bar", "scatter", "title", "xlabel", "ylabel",
                "savefig", "legend", "subplots", "tight_layout", "boxplot")) {
            b.add(PatternRule.on("matplotlib.pyplot." + m, MODULE_FUNCTION).display());
        }
        for (String m : List.of("histplot", "boxplot", "heatmap", "countplot", "scatterplot", "lineplot", "barplot",
                "pairplot", "distplot", "set_theme")) {
            b.add(PatternRule.on("seaborn." + m, MODULE_FUNCTION).display());
        }
    }
}
