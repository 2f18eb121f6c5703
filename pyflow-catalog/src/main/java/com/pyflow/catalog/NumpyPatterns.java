package com.pyflow.catalog;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.TransformationKind;

import java.util.List;

import static com.pyflow.catalog.CallTarget.MODULE_FUNCTION;

/** Built-in rules for numpy functions applied to columns. */
final class NumpyPatterns {

    private static final List<String> UNARY_MATH = List.of(
            "log", "log10", "log2", "log1p", "exp", "expm1", "sqrt", "cbrt", "square", "abs", "absolute",
            "floor", "ceil", "trunc", "sign");

    private static final List<String> SCALARS = List.of(
            "mean", "sum", "std", "var", "min", "max", "median", "percentile", "quantile", "average",
            "nanmean", "nansum", "nanmedian", "count_nonzero", "corrcoef", "unique", "argmax", "argmin");

    private NumpyPatterns() {
    }

    static void register(PatternCatalog.Builder b) {
        b.add(PatternRule.on("numpy.where", MODULE_FUNCTION)
                .when(ArgumentShape.minPositional(3))
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.IF_THEN_ELSE)
                .extract(a -> ParamMap.create()
                        .put(Params.CONDITION, a.formula(0, "condition"))
                        .put(Params.THEN, a.value(1, "x"))
                        .put(Params.OTHERWISE, a.value(2, "y"))
                        .map()));
        b.add(PatternRule.on("numpy.select", MODULE_FUNCTION)
                .kind(TransformationKind.COLUMN_CREATE)
                .processor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                .extract(a -> ParamMap.create()
                        .put(Params.METHOD, "select")
                        .put("conditions", a.formula(0, "condlist"))
                        .put("choices", a.formula(1, "choicelist"))
                        .put(Params.OTHERWISE, a.value(2, "default"))
                        .map()));
        for (String f : UNARY_MATH) {
            String method = f.equals("absolute") ? "abs" : f;
            b.add(PatternRule.on("numpy." + f, MODULE_FUNCTION)
                    .kind(TransformationKind.NUMERIC_TRANSFORM)
                    .processor(method.equals("abs") ? ProcessorType.ABS_COLUMN : ProcessorType.NUMERICAL_TRANSFORMER)
                    .extract(a -> ParamMap.create()
                            .put(Params.COLUMN, a.columnRef(0, "x"))
                            .put(Params.METHOD, method)
                            .put(Params.EXPRESSION, a.columnRef(0, "x") == null ? a.formula(0, "x") : null)
                            .map()));
        }
        b.add(PatternRule.on("numpy.power", MODULE_FUNCTION)
                .kind(TransformationKind.NUMERIC_TRANSFORM)
                .processor(ProcessorType.NUMERICAL_TRANSFORMER)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMN, a.columnRef(0, "x1"))
                        .put(Params.METHOD, "power")
                        .put(Params.VALUE, a.value(1, "x2"))
                        .map()));
        for (String f : List.of("round", "around")) {
            b.add(PatternRule.on("numpy." + f, MODULE_FUNCTION)
                    .kind(TransformationKind.NUMERIC_TRANSFORM)
                    .processor(ProcessorType.ROUND_COLUMN)
                    .extract(a -> ParamMap.create()
                            .put(Params.COLUMN, a.columnRef(0, "a"))
                            .put(Params.METHOD, "round")
                            .put(Params.DECIMALS, a.integer(1, "decimals") != null ? a.integer(1, "decimals") : Integer.valueOf(0))
                            .map()));
        }
        b.add(PatternRule.on("numpy.clip", MODULE_FUNCTION)
                .kind(TransformationKind.NUMERIC_TRANSFORM)
                .processor(ProcessorType.CLIP_COLUMN)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMN, a.columnRef(0, "a"))
                        .put(Params.METHOD, "clip")
                        .put(Params.LOWER, a.literal(1, "a_min"))
                        .put(Params.UPPER, a.literal(2, "a_max"))
                        .map()));
        b.add(PatternRule.on("numpy.digitize", MODULE_FUNCTION)
                .kind(TransformationKind.BINNING)
                .processor(ProcessorType.BINNER)
                .extract(a -> ParamMap.create()
                        .put(Params.COLUMN, a.columnRef(0, "x"))
                        .put(Params.METHOD, "digitize")
                        .put(Params.BINS, a.literal(1, "bins"))
                        .map()));
        for (String f : List.of("cumsum", "cumprod", "diff")) {
            b.add(PatternRule.on("numpy." + f, MODULE_FUNCTION)
                    .kind(TransformationKind.WINDOW)
                    .recipe(RecipeType.WINDOW)
                    .extract(a -> ParamMap.create()
                            .put(Params.COLUMN, a.columnRef(0, "a"))
                            .put(Params.FUNCTION, f)
                            .map()));
        }
        for (String f : SCALARS) {
            b.add(PatternRule.on("numpy." + f, MODULE_FUNCTION).display());
        }
    }
}
