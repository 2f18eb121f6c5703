package com.pyflow.python.ast;

import java.util.List;

/** {@code except type as name:} clause; type and name may be null. */
public record ExceptHandler(Expr type, String name, List<Stmt> body, int line) {

    public ExceptHandler {
        body = List.copyOf(body);
    }
}
