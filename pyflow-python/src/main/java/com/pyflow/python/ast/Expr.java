package com.pyflow.python.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression node. Every node records the 1-based line it starts on; child lists are immutable.
 */
public interface Expr {

    int line();

    /** Identifier reference, e.g. {@code df}. */
    record Name(String id, int line, int column) implements Expr {
    }

    /**
     * Literal value. {@code value} is a {@link String}, {@link Integer}, {@link Long},
     * {@link java.math.BigInteger}, {@link Double}, {@link Boolean} or null; {@code text} is the
     * literal as written for numbers and is null otherwise.
     */
    record Constant(Object value, ConstantKind kind, String text, int line) implements Expr {

        public boolean isString() {
            return kind == ConstantKind.STRING;
        }

        public boolean isNumber() {
            return kind == ConstantKind.INT || kind == ConstantKind.FLOAT;
        }

        public boolean isNone() {
            return kind == ConstantKind.NONE;
        }
    }

    /** Literal kind of a {@link Constant}. */
    enum ConstantKind { STRING, BYTES, INT, FLOAT, COMPLEX, BOOL, NONE, ELLIPSIS }

    /** f-string kept as written (prefix and quotes included); placeholders are not parsed. */
    record FormattedString(String literal, int line) implements Expr {
    }

    /** {@code value.attr}. */
    record Attribute(Expr value, String attr, int line) implements Expr {
    }

    /** {@code func(args, keywords)}. Starred positional arguments appear as {@link Starred}. */
    record Call(Expr func, List<Expr> args, List<Keyword> keywords, int line) implements Expr {

        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        /** Value of the keyword argument, or null when not passed. */
        public Expr keyword(String name) {
            for (Keyword k : keywords) {
                if (name.equals(k.name())) return k.value();
            }
            return null;
        }

        public boolean hasKeyword(String name) {
            return keyword(name) != null;
        }
    }

    /** {@code value[index]}; a multi-item index is a {@link Tuple}. */
    record Subscript(Expr value, Expr index, int line) implements Expr {
    }

    /** {@code lower:upper:step} inside a subscript; any part may be null. */
    record Slice(Expr lower, Expr upper, Expr step, int line) implements Expr {
    }

    /** {@code *value}. */
    record Starred(Expr value, int line) implements Expr {
    }

    /** Binary arithmetic or bitwise operation; {@code op} is the operator text ({@code +}, {@code //}, {@code &}). */
    record BinOp(Expr left, String op, Expr right, int line) implements Expr {
    }

    /** Unary {@code -}, {@code +}, {@code ~} or {@code not}. */
    record UnaryOp(String op, Expr operand, int line) implements Expr {
    }

    /** {@code and} / {@code or} over two or more operands. */
    record BoolOp(String op, List<Expr> values, int line) implements Expr {

        public BoolOp {
            values = List.copyOf(values);
        }
    }

    /** Comparison chain, e.g. {@code a < b <= c}; ops include {@code in}, {@code not in}, {@code is}, {@code is not}. */
    record Compare(Expr left, List<String> ops, List<Expr> comparators, int line) implements Expr {

        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }
    }

    record ListExpr(List<Expr> elements, int line) implements Expr {

        public ListExpr {
            elements = List.copyOf(elements);
        }
    }

    record Tuple(List<Expr> elements, int line) implements Expr {

        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    record SetExpr(List<Expr> elements, int line) implements Expr {

        public SetExpr {
            elements = List.copyOf(elements);
        }
    }

    /** Dict display; a null key marks a {@code **mapping} entry. */
    record Dict(List<Expr> keys, List<Expr> values, int line) implements Expr {

        public Dict {
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }
    }

    /** {@code lambda params: body}; parameters are kept as written ({@code x}, {@code y=1}, {@code *args}). */
    record Lambda(List<String> params, Expr body, int line) implements Expr {

        public Lambda {
            params = List.copyOf(params);
        }
    }

    /** {@code body if test else orElse}. */
    record IfExp(Expr test, Expr body, Expr orElse, int line) implements Expr {
    }

    /** List, set, dict or generator comprehension. {@code value} is only set for dict comprehensions. */
    record Comprehension(ComprehensionKind kind, Expr element, Expr value, List<ComprehensionFor> generators, int line)
            implements Expr {

        public Comprehension {
            generators = List.copyOf(generators);
        }
    }

    enum ComprehensionKind { LIST, SET, DICT, GENERATOR }

    /** {@code target := value}. */
    record NamedExpr(Expr target, Expr value, int line) implements Expr {
    }

    /** {@code yield value} or {@code yield from value}. */
    record Yield(Expr value, boolean from, int line) implements Expr {
    }

    record Await(Expr value, int line) implements Expr {
    }
}
