package com.pyflow.python.ast;

/** Keyword argument of a call; {@code name} is null for {@code **kwargs}. */
public record Keyword(String name, Expr value) {
}
