package com.pyflow.analyzer;

import com.pyflow.catalog.PatternRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a variable (or an intermediate chain value) refers to during analysis.
 *
 * @param kind     the sort of value
 * @param name     dataframe variable for frame-like kinds, qualified name for modules, the
 *                 identifier for unbound names
 * @param columns  selected columns for series, accessors and grouped selections
 * @param state    pending parameters: groupby keys, window size, estimator settings
 * @param rule     constructor rule of an estimator, otherwise null
 * @param producer index of the transformation that produced the value, or -1
 */
public record TracedValue(Kind kind,
                          String name,
                          List<String> columns,
                          Map<String, Object> state,
                          PatternRule rule,
                          int producer) {

    public enum Kind {
        /** Imported module or a qualified function in it. */
        MODULE,
        DATAFRAME,
        /** One or more columns of a dataframe, or a boolean mask over one. */
        SERIES,
        /** {@code .loc} / {@code .iloc} of a dataframe. */
        INDEXER,
        STRING_ACCESSOR,
        DATETIME_ACCESSOR,
        /** Pending {@code groupby}: keys in state, selection in columns. */
        GROUPED,
        /** Pending {@code rolling} / {@code expanding} / {@code ewm}. */
        WINDOWED,
        ESTIMATOR,
        /** A name never assigned in the script. */
        UNBOUND,
        /** Anything else: numbers, strings, results of display calls. */
        OTHER
    }

    static final TracedValue OTHER = new TracedValue(Kind.OTHER, null, List.of(), Map.of(), null, -1);

    public TracedValue {
        columns = columns != null ? List.copyOf(columns) : List.of();
        state = state != null ? Collections.unmodifiableMap(new LinkedHashMap<>(state)) : Map.of();
    }

    static TracedValue module(String qualified) {
        return new TracedValue(Kind.MODULE, qualified, List.of(), Map.of(), null, -1);
    }

    static TracedValue frame(String name, int producer) {
        return new TracedValue(Kind.DATAFRAME, name, List.of(), Map.of(), null, producer);
    }

    static TracedValue unbound(String name) {
        return new TracedValue(Kind.UNBOUND, name, List.of(), Map.of(), null, -1);
    }

    TracedValue as(Kind newKind) {
        return new TracedValue(newKind, name, columns, state, rule, producer);
    }

    TracedValue withColumns(List<String> newColumns) {
        return new TracedValue(kind, name, newColumns, state, rule, producer);
    }

    TracedValue withState(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(state);
        if (value == null) next.remove(key);
        else next.put(key, value);
        return new TracedValue(kind, name, columns, next, rule, producer);
    }

    TracedValue withState(Map<String, Object> more) {
        Map<String, Object> next = new LinkedHashMap<>(state);
        next.putAll(more);
        return new TracedValue(kind, name, columns, next, rule, producer);
    }

    /** True for values backed by a dataframe variable. */
    public boolean isFrameLike() {
        return switch (kind) {
            case DATAFRAME, SERIES, INDEXER, STRING_ACCESSOR, DATETIME_ACCESSOR, GROUPED, WINDOWED -> true;
            default -> false;
        };
    }

    Object stateValue(String key) {
        return state.get(key);
    }

    @Override
    public String toString() {
        return kind + "(" + name + (columns.isEmpty() ? "" : ", " + columns) + ")";
    }
}
