package com.pyflow.catalog;

import com.pyflow.python.ExpressionRenderer;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Column formulas: pandas expressions with {@code frame['col']} and {@code frame.col}
 * references reduced to bare column names, so {@code df['price'] * df['qty']} reads
 * {@code price * qty}. Names that are not identifiers are written in backticks.
 */
public final class Formulas {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Formulas() {
    }

    /**
     * Renders the expression with column references of the given frames simplified.
     *
     * @param frames variable names whose subscripts and attributes are column references
     */
    public static String render(Expr e, Set<String> frames) {
        return e == null ? null : ExpressionRenderer.render(rewrite(e, frames));
    }

    /** Column names referenced on any of the frames, including list selections, in order of appearance. */
    public static List<String> columnsOf(Expr e, Set<String> frames) {
        Set<String> out = new LinkedHashSet<>();
        collect(e, frames, out);
        return new ArrayList<>(out);
    }

    /** Column referenced by {@code frame['col']} or {@code frame.col}, or null. */
    public static String columnOf(Expr e, Set<String> frames) {
        if (e instanceof Expr.Subscript s && s.value() instanceof Expr.Name n && frames.contains(n.id())
                && s.index() instanceof Expr.Constant c && c.isString()) {
            return (String) c.value();
        }
        if (e instanceof Expr.Attribute a && a.value() instanceof Expr.Name n && frames.contains(n.id())) {
            return a.attr();
        }
        return null;
    }

    private static void collect(Expr e, Set<String> frames, Set<String> out) {
        if (e == null) return;
        String column = columnOf(e, frames);
        if (column != null) {
            out.add(column);
            return;
        }
        if (e instanceof Expr.Subscript s && s.value() instanceof Expr.Name n && frames.contains(n.id())
                && s.index() instanceof Expr.ListExpr) {
            out.addAll(CallArguments.strings(s.index()));
            return;
        }
        for (Expr child : children(e)) {
            // df.mean() is a method call, not a column named mean
            if (e instanceof Expr.Call c && child == c.func() && child instanceof Expr.Attribute a) {
                collect(a.value(), frames, out);
                continue;
            }
            collect(child, frames, out);
        }
    }

    private static List<Expr> children(Expr e) {
        List<Expr> out = new ArrayList<>();
        if (e instanceof Expr.BinOp b) {
            out.add(b.left());
            out.add(b.right());
        } else if (e instanceof Expr.UnaryOp u) {
            out.add(u.operand());
        } else if (e instanceof Expr.BoolOp b) {
            out.addAll(b.values());
        } else if (e instanceof Expr.Compare c) {
            out.add(c.left());
            out.addAll(c.comparators());
        } else if (e instanceof Expr.Call c) {
            out.add(c.func());
            out.addAll(c.args());
            for (Keyword k : c.keywords()) out.add(k.value());
        } else if (e instanceof Expr.Attribute a) {
            out.add(a.value());
        } else if (e instanceof Expr.Subscript s) {
            out.add(s.value());
            out.add(s.index());
        } else if (e instanceof Expr.IfExp i) {
            out.add(i.test());
            out.add(i.body());
            out.add(i.orElse());
        } else if (e instanceof Expr.ListExpr l) {
            out.addAll(l.elements());
        } else if (e instanceof Expr.Tuple t) {
            out.addAll(t.elements());
        }
        return out;
    }

    private static Expr rewrite(Expr e, Set<String> frames) {
        String column = columnOf(e, frames);
        if (column != null) {
            return new Expr.Name(IDENTIFIER.matcher(column).matches() ? column : "`" + column + "`", e.line(), 0);
        }
        if (e instanceof Expr.BinOp b) {
            return new Expr.BinOp(rewrite(b.left(), frames), b.op(), rewrite(b.right(), frames), b.line());
        }
        if (e instanceof Expr.UnaryOp u) {
            return new Expr.UnaryOp(u.op(), rewrite(u.operand(), frames), u.line());
        }
        if (e instanceof Expr.BoolOp b) {
            return new Expr.BoolOp(b.op(), rewriteAll(b.values(), frames), b.line());
        }
        if (e instanceof Expr.Compare c) {
            return new Expr.Compare(rewrite(c.left(), frames), c.ops(), rewriteAll(c.comparators(), frames), c.line());
        }
        if (e instanceof Expr.Call c) {
            List<Keyword> keywords = new ArrayList<>();
            for (Keyword k : c.keywords()) keywords.add(new Keyword(k.name(), rewrite(k.value(), frames)));
            Expr func = columnOf(c.func(), frames) != null ? c.func() : rewrite(c.func(), frames);
            return new Expr.Call(func, rewriteAll(c.args(), frames), keywords, c.line());
        }
        if (e instanceof Expr.Attribute a) {
            return new Expr.Attribute(rewrite(a.value(), frames), a.attr(), a.line());
        }
        if (e instanceof Expr.IfExp i) {
            return new Expr.IfExp(rewrite(i.test(), frames), rewrite(i.body(), frames), rewrite(i.orElse(), frames), i.line());
        }
        if (e instanceof Expr.ListExpr l) {
            return new Expr.ListExpr(rewriteAll(l.elements(), frames), l.line());
        }
        if (e instanceof Expr.Tuple t) {
            return new Expr.Tuple(rewriteAll(t.elements(), frames), t.line());
        }
        return e;
    }

    private static List<Expr> rewriteAll(List<Expr> list, Set<String> frames) {
        List<Expr> out = new ArrayList<>(list.size());
        for (Expr x : list) out.add(rewrite(x, frames));
        return out;
    }
}
