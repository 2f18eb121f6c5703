package com.pyflow.python.ast;

/** {@code context as target}; target may be null. */
public record WithItem(Expr context, Expr target) {
}
