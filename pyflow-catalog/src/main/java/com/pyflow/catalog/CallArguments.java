package com.pyflow.catalog;

import com.pyflow.python.ExpressionRenderer;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw arguments of one call plus the receiver columns when the call is made on a column or a
 * column selection. Accessors take a position and a keyword name because pandas accepts most
 * arguments either way; the keyword wins when both are present.
 */
public final class CallArguments {

    private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of(), List.of(), Set.of());

    private final List<Expr> positional;
    private final Map<String, Expr> keywords;
    private final List<String> receiverColumns;
    private final Set<String> frames;

    private CallArguments(List<Expr> positional, Map<String, Expr> keywords, List<String> receiverColumns,
                          Set<String> frames) {
        this.positional = positional;
        this.keywords = keywords;
        this.receiverColumns = receiverColumns;
        this.frames = frames;
    }

    public static CallArguments of(Expr.Call call) {
        return of(call, List.of());
    }

    public static CallArguments of(Expr.Call call, List<String> receiverColumns) {
        if (call == null) return empty(receiverColumns);
        Map<String, Expr> keywords = new LinkedHashMap<>();
        for (Keyword k : call.keywords()) {
            if (k.name() != null) keywords.put(k.name(), k.value());
        }
        return new CallArguments(List.copyOf(call.args()), Collections.unmodifiableMap(keywords),
                receiverColumns != null ? List.copyOf(receiverColumns) : List.of(), Set.of());
    }

    /** Arguments of an attribute access such as {@code .dt.year}: none, only the receiver. */
    public static CallArguments empty(List<String> receiverColumns) {
        if (receiverColumns == null || receiverColumns.isEmpty()) return EMPTY;
        return new CallArguments(List.of(), Map.of(), List.copyOf(receiverColumns), Set.of());
    }

    /** Copy that treats subscripts and attributes of these variables as column references. */
    public CallArguments withFrames(Set<String> frameNames) {
        return new CallArguments(positional, keywords, receiverColumns,
                frameNames != null ? Set.copyOf(frameNames) : Set.of());
    }

    public Set<String> frames() {
        return frames;
    }

    public List<Expr> positional() {
        return positional;
    }

    public Map<String, Expr> keywords() {
        return keywords;
    }

    public int positionalCount() {
        return positional.size();
    }

    public Expr positional(int index) {
        return index >= 0 && index < positional.size() ? positional.get(index) : null;
    }

    public Expr keyword(String name) {
        return keywords.get(name);
    }

    public boolean has(int position, String name) {
        return argument(position, name) != null;
    }

    /** Keyword {@code name} if given, else positional argument {@code position} (-1 for keyword-only). */
    public Expr argument(int position, String name) {
        Expr e = name != null ? keywords.get(name) : null;
        return e != null ? e : positional(position);
    }

    /** Columns of the receiver, empty for dataframe-level calls. */
    public List<String> receiverColumns() {
        return receiverColumns;
    }

    /** Single receiver column, or null. */
    public String receiverColumn() {
        return receiverColumns.isEmpty() ? null : receiverColumns.get(0);
    }

    public ArgumentShape shape() {
        return new ArgumentShape(positional.size(), keywords.keySet(), LiteralKind.of(positional(0)));
    }

    // typed access

    public Object literal(int position, String name) {
        return literal(argument(position, name));
    }

    public String string(int position, String name) {
        Expr e = argument(position, name);
        return e instanceof Expr.Constant c && c.isString() ? (String) c.value() : null;
    }

    /** A string or a list/tuple of strings as a list; anything else is empty. */
    public List<String> strings(int position, String name) {
        return strings(argument(position, name));
    }

    public Integer integer(int position, String name) {
        Object v = literal(position, name);
        return v instanceof Number n ? Integer.valueOf(n.intValue()) : null;
    }

    public Double decimal(int position, String name) {
        Object v = literal(position, name);
        return v instanceof Number n ? Double.valueOf(n.doubleValue()) : null;
    }

    public boolean bool(int position, String name, boolean defaultValue) {
        Object v = literal(position, name);
        return v instanceof Boolean b ? b : defaultValue;
    }

    /**
     * A dict literal with string keys; non-literal values are kept as rendered source. Null when
     * the argument is absent or not a dict.
     */
    public Map<String, Object> dict(int position, String name) {
        Expr e = argument(position, name);
        if (!(e instanceof Expr.Dict d)) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < d.keys().size(); i++) {
            Expr key = d.keys().get(i);
            if (key == null) continue;
            Object k = literal(key);
            if (k == null) continue;
            Expr value = d.values().get(i);
            out.put(k.toString(), isLiteral(value) ? literal(value) : ExpressionRenderer.render(value));
        }
        return out;
    }

    /** Normalized source text of the argument, or null when absent. */
    public String source(int position, String name) {
        Expr e = argument(position, name);
        return e != null ? ExpressionRenderer.render(e) : null;
    }

    /** Column named by a {@code frame['col']} or {@code frame.col} argument, or null. */
    public String columnRef(int position, String name) {
        Expr e = argument(position, name);
        String column = Formulas.columnOf(e, frames);
        return column != null ? column : columnRef(e);
    }

    /** The argument as a column formula ({@code df['a'] > 1} reads {@code a > 1}), or null. */
    public String formula(int position, String name) {
        return Formulas.render(argument(position, name), frames);
    }

    /** A literal argument's value, else its column formula. */
    public Object value(int position, String name) {
        Expr e = argument(position, name);
        return isLiteral(e) ? literal(e) : formula(position, name);
    }

    // static helpers

    public static boolean isLiteral(Expr e) {
        if (e instanceof Expr.Constant c) return c.kind() != Expr.ConstantKind.ELLIPSIS;
        if (e instanceof Expr.UnaryOp u) return u.op().equals("-") && u.operand() instanceof Expr.Constant c && c.isNumber();
        if (e instanceof Expr.ListExpr l) return l.elements().stream().allMatch(CallArguments::isLiteral);
        if (e instanceof Expr.Tuple t) return t.elements().stream().allMatch(CallArguments::isLiteral);
        if (e instanceof Expr.Dict d) {
            for (int i = 0; i < d.keys().size(); i++) {
                if (d.keys().get(i) == null || !isLiteral(d.keys().get(i)) || !isLiteral(d.values().get(i))) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * Java value of a literal expression: String, Integer/Long/BigInteger, Double, Boolean, List
     * or Map. Null for None and for anything that is not a literal.
     */
    public static Object literal(Expr e) {
        if (e instanceof Expr.Constant c) {
            return c.kind() == Expr.ConstantKind.COMPLEX || c.kind() == Expr.ConstantKind.ELLIPSIS ? null : c.value();
        }
        if (e instanceof Expr.UnaryOp u && u.op().equals("-") && u.operand() instanceof Expr.Constant c) {
            Object v = c.value();
            if (v instanceof Integer i) return -i;
            if (v instanceof Long l) return -l;
            if (v instanceof Double d) return -d;
            if (v instanceof BigInteger b) return b.negate();
            return null;
        }
        if (e instanceof Expr.ListExpr l) return literalList(l.elements());
        if (e instanceof Expr.Tuple t) return literalList(t.elements());
        if (e instanceof Expr.Dict d) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < d.keys().size(); i++) {
                if (d.keys().get(i) == null) continue;
                Object k = literal(d.keys().get(i));
                if (k != null) out.put(k.toString(), literal(d.values().get(i)));
            }
            return out;
        }
        return null;
    }

    private static List<Object> literalList(List<Expr> elements) {
        List<Object> out = new ArrayList<>();
        for (Expr x : elements) out.add(literal(x));
        return out;
    }

    public static List<String> strings(Expr e) {
        List<String> out = new ArrayList<>();
        if (e instanceof Expr.Constant c && c.isString()) {
            out.add((String) c.value());
        } else if (e instanceof Expr.ListExpr || e instanceof Expr.Tuple) {
            List<Expr> items = e instanceof Expr.ListExpr l ? l.elements() : ((Expr.Tuple) e).elements();
            for (Expr x : items) {
                if (x instanceof Expr.Constant c && c.isString()) out.add((String) c.value());
            }
        }
        return out;
    }

    public static String columnRef(Expr e) {
        if (e instanceof Expr.Subscript s && s.index() instanceof Expr.Constant c && c.isString()) {
            return (String) c.value();
        }
        return null;
    }
}
