package com.pyflow.catalog;

import com.pyflow.python.ast.Expr;

/** Syntactic kind of an argument expression, used by rule guards. */
public enum LiteralKind {
    ABSENT,
    STRING,
    NUMBER,
    BOOLEAN,
    NONE,
    LIST,
    DICT,
    NAME,
    CALLABLE,
    EXPRESSION;

    public static LiteralKind of(Expr e) {
        if (e == null) return ABSENT;
        if (e instanceof Expr.Constant c) {
            return switch (c.kind()) {
                case STRING, BYTES -> STRING;
                case INT, FLOAT, COMPLEX -> NUMBER;
                case BOOL -> BOOLEAN;
                case NONE -> NONE;
                default -> EXPRESSION;
            };
        }
        if (e instanceof Expr.UnaryOp u && u.op().equals("-") && u.operand() instanceof Expr.Constant c && c.isNumber()) {
            return NUMBER;
        }
        if (e instanceof Expr.ListExpr || e instanceof Expr.Tuple) return LIST;
        if (e instanceof Expr.Dict) return DICT;
        if (e instanceof Expr.Name) return NAME;
        if (e instanceof Expr.Lambda) return CALLABLE;
        return EXPRESSION;
    }
}
