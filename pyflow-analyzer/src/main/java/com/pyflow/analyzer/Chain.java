package com.pyflow.analyzer;

import com.pyflow.python.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A method chain flattened into its base expression and the links applied to it, innermost
 * first: {@code df.dropna().fillna(0)['a']} is base {@code df} with links
 * {@code METHOD dropna, METHOD fillna, SUBSCRIPT 'a'}.
 */
record Chain(Expr base, List<Link> links) {

    enum LinkType { METHOD, CALL, ATTRIBUTE, SUBSCRIPT }

    /**
     * One link. {@code name} is set for methods and attributes, {@code call} for methods and
     * plain calls, {@code index} for subscripts; {@code node} is the expression the link ends.
     */
    record Link(LinkType type, String name, Expr.Call call, Expr index, Expr node) {

        int line() {
            return node.line();
        }
    }

    static Chain unwind(Expr expr) {
        List<Link> reversed = new ArrayList<>();
        Expr current = expr;
        while (true) {
            if (current instanceof Expr.Call call) {
                if (call.func() instanceof Expr.Attribute attr) {
                    reversed.add(new Link(LinkType.METHOD, attr.attr(), call, null, call));
                    current = attr.value();
                } else {
                    reversed.add(new Link(LinkType.CALL, null, call, null, call));
                    current = call.func();
                }
            } else if (current instanceof Expr.Attribute attr) {
                reversed.add(new Link(LinkType.ATTRIBUTE, attr.attr(), null, null, attr));
                current = attr.value();
            } else if (current instanceof Expr.Subscript sub) {
                reversed.add(new Link(LinkType.SUBSCRIPT, null, null, sub.index(), sub));
                current = sub.value();
            } else {
                break;
            }
        }
        Collections.reverse(reversed);
        return new Chain(current, List.copyOf(reversed));
    }

    boolean isEmpty() {
        return links.isEmpty();
    }
}
