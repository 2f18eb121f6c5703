package com.pyflow.analyzer;

import com.pyflow.catalog.CallArguments;
import com.pyflow.catalog.Formulas;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.TransformationKind;
import com.pyflow.python.ast.Expr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Boolean-mask subscripts ({@code df[df['a'] > 1]}, {@code df.loc[df['b'].isin([...])]}) turned into
 * row filters. Simple masks keep a structured column / operator / value next to the formula.
 */
final class MaskFilters {

    /** Mask expression stored on a series variable ({@code mask = df['a'] > 1}). */
    static final String MASK_STATE = "mask";

    private static final Set<String> MASK_METHODS = Set.of(
            "isin", "notna", "notnull", "isna", "isnull", "between", "duplicated",
            "contains", "startswith", "endswith", "match", "fullmatch", "isnumeric", "isdigit", "isalpha");

    private static final Set<String> RANGE_OPERATORS = Set.of("<", "<=", ">", ">=");
    private static final Set<String> VALUE_OPERATORS = Set.of("==", "!=", "in", "not in");

    record Filter(TransformationKind kind, ProcessorType processor, Map<String, Object> params, List<String> columns) {
    }

    private MaskFilters() {
    }

    static boolean isMask(Expr e, Set<String> frames, SymbolTable symbols) {
        if (e instanceof Expr.Name n) {
            TracedValue v = symbols.lookup(n.id());
            return v.kind() == TracedValue.Kind.SERIES && v.stateValue(MASK_STATE) != null;
        }
        if (e instanceof Expr.Compare) return !Formulas.columnsOf(e, frames).isEmpty();
        if (e instanceof Expr.BoolOp b) return b.values().stream().anyMatch(x -> isMask(x, frames, symbols));
        if (e instanceof Expr.BinOp b && (b.op().equals("&") || b.op().equals("|") || b.op().equals("^"))) {
            return isMask(b.left(), frames, symbols) || isMask(b.right(), frames, symbols);
        }
        if (e instanceof Expr.UnaryOp u && (u.op().equals("~") || u.op().equals("not"))) {
            return isMask(u.operand(), frames, symbols);
        }
        if (e instanceof Expr.Call c && c.func() instanceof Expr.Attribute a && MASK_METHODS.contains(a.attr())) {
            return !Formulas.columnsOf(a.value(), frames).isEmpty() || referencesFrame(a.value(), frames);
        }
        return false;
    }

    private static boolean referencesFrame(Expr e, Set<String> frames) {
        for (String name : ExprNames.of(e)) {
            if (frames.contains(name)) return true;
        }
        return false;
    }

    /** Replaces a mask variable by the expression it was assigned. */
    static Expr expand(Expr e, SymbolTable symbols) {
        if (e instanceof Expr.Name n) {
            Object stored = symbols.lookup(n.id()).stateValue(MASK_STATE);
            if (stored instanceof Expr x) return x;
        }
        return e;
    }

    static Filter describe(Expr mask, Set<String> frames) {
        String condition = Formulas.render(mask, frames);
        List<String> columns = Formulas.columnsOf(mask, frames);

        if (mask instanceof Expr.Compare c && c.ops().size() == 1) {
            String column = Formulas.columnOf(c.left(), frames);
            Expr right = c.comparators().get(0);
            String op = c.ops().get(0);
            if (column != null && CallArguments.isLiteral(right)) {
                Object value = CallArguments.literal(right);
                if (VALUE_OPERATORS.contains(op)) {
                    return structured(ProcessorType.FILTER_ON_VALUE, condition, column, op, value, columns);
                }
                if (RANGE_OPERATORS.contains(op) && value instanceof Number) {
                    return structured(ProcessorType.FILTER_ON_NUMERIC_RANGE, condition, column, op, value, columns);
                }
            }
        }
        boolean negated = false;
        Expr inner = mask;
        if (mask instanceof Expr.UnaryOp u && (u.op().equals("~") || u.op().equals("not"))) {
            negated = true;
            inner = u.operand();
        }
        if (inner instanceof Expr.Call call && call.func() instanceof Expr.Attribute attr) {
            String column = Formulas.columnOf(attr.value(), frames);
            CallArguments args = CallArguments.of(call).withFrames(frames);
            String method = attr.attr();
            boolean notNull = (method.equals("notna") || method.equals("notnull")) && !negated
                    || (method.equals("isna") || method.equals("isnull")) && negated;
            if (column != null && notNull) {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put(Params.CONDITION, condition);
                return new Filter(TransformationKind.DROP_NA, ProcessorType.REMOVE_ROWS_ON_EMPTY, params, List.of(column));
            }
            if (column != null && method.equals("isin") && args.has(0, "values")) {
                return structured(ProcessorType.FILTER_ON_VALUE, condition, column, negated ? "not in" : "in",
                        args.literal(0, "values"), columns);
            }
            if (column != null && method.equals("between") && !negated) {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put(Params.CONDITION, condition);
                params.put(Params.COLUMN, column);
                params.put(Params.OPERATOR, "between");
                putIfPresent(params, Params.LOWER, args.literal(0, "left"));
                putIfPresent(params, Params.UPPER, args.literal(1, "right"));
                return new Filter(TransformationKind.FILTER, ProcessorType.FILTER_ON_NUMERIC_RANGE, params, columns);
            }
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(Params.CONDITION, condition);
        return new Filter(TransformationKind.FILTER, ProcessorType.FILTER_ON_FORMULA, params, columns);
    }

    private static Filter structured(ProcessorType processor, String condition, String column, String op, Object value,
                                     List<String> columns) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(Params.CONDITION, condition);
        params.put(Params.COLUMN, column);
        params.put(Params.OPERATOR, op);
        putIfPresent(params, Params.VALUE, value);
        return new Filter(TransformationKind.FILTER, processor, params, columns);
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) params.put(key, value);
    }
}
