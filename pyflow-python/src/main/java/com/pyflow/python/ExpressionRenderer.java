package com.pyflow.python;

import com.pyflow.python.ast.ComprehensionFor;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an expression back to normalized Python source. Parentheses are emitted only where
 * operator precedence needs them; strings use single-quoted repr form.
 */
public final class ExpressionRenderer {

    private static final int LAMBDA = 0;
    private static final int TERNARY = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARE = 5;
    private static final int BIT_OR = 6;
    private static final int BIT_XOR = 7;
    private static final int BIT_AND = 8;
    private static final int SHIFT = 9;
    private static final int ARITH = 10;
    private static final int TERM = 11;
    private static final int UNARY = 12;
    private static final int POWER = 13;
    private static final int AWAIT = 14;
    private static final int ATOM = 15;

    private ExpressionRenderer() {
    }

    public static String render(Expr e) {
        return e == null ? "" : render(e, LAMBDA);
    }

    /** Python repr of a string value. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    private static String render(Expr e, int context) {
        int own = precedence(e);
        String text = renderBare(e);
        return own < context ? "(" + text + ")" : text;
    }

    private static int precedence(Expr e) {
        if (e instanceof Expr.Lambda) return LAMBDA;
        if (e instanceof Expr.IfExp) return TERNARY;
        if (e instanceof Expr.NamedExpr) return LAMBDA;
        if (e instanceof Expr.BoolOp b) return b.op().equals("or") ? OR : AND;
        if (e instanceof Expr.UnaryOp u) return u.op().equals("not") ? NOT : UNARY;
        if (e instanceof Expr.Compare) return COMPARE;
        if (e instanceof Expr.BinOp b) return binaryPrecedence(b.op());
        if (e instanceof Expr.Await) return AWAIT;
        if (e instanceof Expr.Yield) return LAMBDA;
        if (e instanceof Expr.Starred) return BIT_OR;
        if (e instanceof Expr.Constant c && c.isNumber() && c.text() != null && c.text().startsWith("-")) return UNARY;
        return ATOM;
    }

    private static int binaryPrecedence(String op) {
        return switch (op) {
            case "|" -> BIT_OR;
            case "^" -> BIT_XOR;
            case "&" -> BIT_AND;
            case "<<", ">>" -> SHIFT;
            case "+", "-" -> ARITH;
            case "**" -> POWER;
            default -> TERM;
        };
    }

    private static String renderBare(Expr e) {
        if (e instanceof Expr.Name n) return n.id();
        if (e instanceof Expr.Constant c) return constant(c);
        if (e instanceof Expr.FormattedString f) return f.literal();
        if (e instanceof Expr.Attribute a) return render(a.value(), ATOM) + "." + a.attr();
        if (e instanceof Expr.Call c) return call(c);
        if (e instanceof Expr.Subscript s) return render(s.value(), ATOM) + "[" + subscript(s.index()) + "]";
        if (e instanceof Expr.Slice s) return slice(s);
        if (e instanceof Expr.Starred s) return "*" + render(s.value(), BIT_OR);
        if (e instanceof Expr.BinOp b) return binOp(b);
        if (e instanceof Expr.UnaryOp u) {
            if (u.op().equals("not")) return "not " + render(u.operand(), NOT);
            return u.op() + render(u.operand(), UNARY);
        }
        if (e instanceof Expr.BoolOp b) {
            int prec = precedence(b);
            List<String> parts = new ArrayList<>();
            for (Expr v : b.values()) parts.add(render(v, prec + 1));
            return String.join(" " + b.op() + " ", parts);
        }
        if (e instanceof Expr.Compare c) {
            StringBuilder sb = new StringBuilder(render(c.left(), BIT_OR));
            for (int i = 0; i < c.ops().size(); i++) {
                sb.append(' ').append(c.ops().get(i)).append(' ').append(render(c.comparators().get(i), BIT_OR));
            }
            return sb.toString();
        }
        if (e instanceof Expr.ListExpr l) return "[" + joined(l.elements()) + "]";
        if (e instanceof Expr.Tuple t) {
            if (t.elements().size() == 1) return "(" + render(t.elements().get(0), TERNARY) + ",)";
            return "(" + joined(t.elements()) + ")";
        }
        if (e instanceof Expr.SetExpr s) return "{" + joined(s.elements()) + "}";
        if (e instanceof Expr.Dict d) return dict(d);
        if (e instanceof Expr.Lambda l) {
            String params = String.join(", ", l.params());
            return (params.isEmpty() ? "lambda" : "lambda " + params) + ": " + render(l.body(), LAMBDA);
        }
        if (e instanceof Expr.IfExp i) {
            return render(i.body(), OR) + " if " + render(i.test(), OR) + " else " + render(i.orElse(), TERNARY);
        }
        if (e instanceof Expr.Comprehension c) return comprehension(c);
        if (e instanceof Expr.NamedExpr n) return render(n.target(), ATOM) + " := " + render(n.value(), TERNARY);
        if (e instanceof Expr.Yield y) {
            if (y.value() == null) return "yield";
            return (y.from() ? "yield from " : "yield ") + render(y.value(), LAMBDA);
        }
        if (e instanceof Expr.Await a) return "await " + render(a.value(), ATOM);
        throw new IllegalArgumentException("Unsupported expression: " + e.getClass().getSimpleName());
    }

    private static String constant(Expr.Constant c) {
        return switch (c.kind()) {
            case STRING -> quote((String) c.value());
            case BYTES -> "b" + quote((String) c.value());
            case BOOL -> Boolean.TRUE.equals(c.value()) ? "True" : "False";
            case NONE -> "None";
            case ELLIPSIS -> "...";
            default -> c.text() != null ? c.text() : String.valueOf(c.value());
        };
    }

    private static String binOp(Expr.BinOp b) {
        int prec = binaryPrecedence(b.op());
        // ** is right-associative, everything else left-associative
        int leftContext = b.op().equals("**") ? prec + 1 : prec;
        int rightContext = b.op().equals("**") ? UNARY : prec + 1;
        return render(b.left(), leftContext) + " " + b.op() + " " + render(b.right(), rightContext);
    }

    private static String call(Expr.Call c) {
        List<String> parts = new ArrayList<>();
        if (c.args().size() == 1 && c.keywords().isEmpty()
                && c.args().get(0) instanceof Expr.Comprehension comp
                && comp.kind() == Expr.ComprehensionKind.GENERATOR) {
            return render(c.func(), ATOM) + "(" + comprehensionBody(comp) + ")";
        }
        for (Expr a : c.args()) parts.add(render(a, TERNARY));
        for (Keyword k : c.keywords()) {
            parts.add(k.name() == null ? "**" + render(k.value(), BIT_OR) : k.name() + "=" + render(k.value(), TERNARY));
        }
        return render(c.func(), ATOM) + "(" + String.join(", ", parts) + ")";
    }

    private static String subscript(Expr index) {
        if (index instanceof Expr.Tuple t && !t.elements().isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (Expr e : t.elements()) parts.add(e instanceof Expr.Slice s ? slice(s) : render(e, TERNARY));
            return String.join(", ", parts) + (parts.size() == 1 ? "," : "");
        }
        return index instanceof Expr.Slice s ? slice(s) : render(index, TERNARY);
    }

    private static String slice(Expr.Slice s) {
        StringBuilder sb = new StringBuilder();
        if (s.lower() != null) sb.append(render(s.lower(), TERNARY));
        sb.append(':');
        if (s.upper() != null) sb.append(render(s.upper(), TERNARY));
        if (s.step() != null) sb.append(':').append(render(s.step(), TERNARY));
        return sb.toString();
    }

    private static String dict(Expr.Dict d) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < d.keys().size(); i++) {
            Expr key = d.keys().get(i);
            Expr value = d.values().get(i);
            parts.add(key == null ? "**" + render(value, BIT_OR) : render(key, TERNARY) + ": " + render(value, TERNARY));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    private static String comprehension(Expr.Comprehension c) {
        String body = comprehensionBody(c);
        return switch (c.kind()) {
            case LIST -> "[" + body + "]";
            case SET, DICT -> "{" + body + "}";
            case GENERATOR -> "(" + body + ")";
        };
    }

    private static String comprehensionBody(Expr.Comprehension c) {
        StringBuilder sb = new StringBuilder(render(c.element(), TERNARY));
        if (c.kind() == Expr.ComprehensionKind.DICT) sb.append(": ").append(render(c.value(), TERNARY));
        for (ComprehensionFor g : c.generators()) {
            sb.append(g.async() ? " async for " : " for ").append(g.target() instanceof Expr.Tuple t ? joined(t.elements()) : render(g.target(), LAMBDA))
                    .append(" in ").append(render(g.iter(), OR));
            for (Expr cond : g.conditions()) sb.append(" if ").append(render(cond, OR));
        }
        return sb.toString();
    }

    private static String joined(List<Expr> items) {
        List<String> parts = new ArrayList<>();
        for (Expr e : items) parts.add(render(e, TERNARY));
        return String.join(", ", parts);
    }
}
