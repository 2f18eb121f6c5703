package com.pyflow.analyzer;

import com.pyflow.python.ast.ComprehensionFor;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Identifier references inside expressions, in source order. */
final class ExprNames {

    private ExprNames() {
    }

    static Set<String> of(Expr e) {
        Set<String> out = new LinkedHashSet<>();
        collect(e, out);
        return out;
    }

    static Set<String> of(List<Expr> exprs) {
        Set<String> out = new LinkedHashSet<>();
        for (Expr e : exprs) collect(e, out);
        return out;
    }

    /** Names referenced by a call's positional and keyword arguments. */
    static Set<String> ofArguments(Expr.Call call) {
        Set<String> out = new LinkedHashSet<>();
        for (Expr a : call.args()) collect(a, out);
        for (Keyword k : call.keywords()) collect(k.value(), out);
        return out;
    }

    private static void collect(Expr e, Set<String> out) {
        if (e == null) return;
        if (e instanceof Expr.Name n) {
            out.add(n.id());
            return;
        }
        for (Expr child : children(e)) collect(child, out);
    }

    static List<Expr> children(Expr e) {
        List<Expr> out = new ArrayList<>();
        if (e instanceof Expr.Attribute a) {
            out.add(a.value());
        } else if (e instanceof Expr.Call c) {
            out.add(c.func());
            out.addAll(c.args());
            for (Keyword k : c.keywords()) out.add(k.value());
        } else if (e instanceof Expr.Subscript s) {
            out.add(s.value());
            out.add(s.index());
        } else if (e instanceof Expr.Slice s) {
            out.add(s.lower());
            out.add(s.upper());
            out.add(s.step());
        } else if (e instanceof Expr.Starred s) {
            out.add(s.value());
        } else if (e instanceof Expr.BinOp b) {
            out.add(b.left());
            out.add(b.right());
        } else if (e instanceof Expr.UnaryOp u) {
            out.add(u.operand());
        } else if (e instanceof Expr.BoolOp b) {
            out.addAll(b.values());
        } else if (e instanceof Expr.Compare c) {
            out.add(c.left());
            out.addAll(c.comparators());
        } else if (e instanceof Expr.ListExpr l) {
            out.addAll(l.elements());
        } else if (e instanceof Expr.Tuple t) {
            out.addAll(t.elements());
        } else if (e instanceof Expr.SetExpr s) {
            out.addAll(s.elements());
        } else if (e instanceof Expr.Dict d) {
            out.addAll(d.keys());
            out.addAll(d.values());
        } else if (e instanceof Expr.Lambda l) {
            out.add(l.body());
        } else if (e instanceof Expr.IfExp i) {
            out.add(i.test());
            out.add(i.body());
            out.add(i.orElse());
        } else if (e instanceof Expr.Comprehension c) {
            out.add(c.element());
            out.add(c.value());
            for (ComprehensionFor g : c.generators()) {
                out.add(g.iter());
                out.addAll(g.conditions());
            }
        } else if (e instanceof Expr.NamedExpr n) {
            out.add(n.value());
        } else if (e instanceof Expr.Yield y) {
            out.add(y.value());
        } else if (e instanceof Expr.Await a) {
            out.add(a.value());
        }
        out.removeIf(x -> x == null);
        return out;
    }
}
