package com.pyflow.python.ast;

import java.util.List;

/** One {@code for target in iter if ...} clause of a comprehension. */
public record ComprehensionFor(Expr target, Expr iter, List<Expr> conditions, boolean async) {

    public ComprehensionFor {
        conditions = List.copyOf(conditions);
    }
}
