package com.pyflow.catalog;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Shape of a call's arguments as seen by rule guards: positional count, keyword names and the
 * literal kind of the first positional argument.
 */
public record ArgumentShape(int positionalCount, Set<String> keywordNames, LiteralKind firstArgument) {

    public static final ArgumentShape EMPTY = new ArgumentShape(0, Set.of(), LiteralKind.ABSENT);

    public ArgumentShape {
        keywordNames = keywordNames != null ? Set.copyOf(keywordNames) : Set.of();
        firstArgument = firstArgument != null ? firstArgument : LiteralKind.ABSENT;
    }

    public boolean hasKeyword(String name) {
        return keywordNames.contains(name);
    }

    // guards

    public static Predicate<ArgumentShape> any() {
        return s -> true;
    }

    public static Predicate<ArgumentShape> withKeyword(String name) {
        return s -> s.hasKeyword(name);
    }

    public static Predicate<ArgumentShape> withoutKeyword(String name) {
        return s -> !s.hasKeyword(name);
    }

    public static Predicate<ArgumentShape> firstIs(LiteralKind... kinds) {
        return s -> {
            for (LiteralKind k : kinds) {
                if (s.firstArgument() == k) return true;
            }
            return false;
        };
    }

    public static Predicate<ArgumentShape> minPositional(int count) {
        return s -> s.positionalCount() >= count;
    }
}
