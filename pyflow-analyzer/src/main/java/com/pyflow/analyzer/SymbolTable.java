package com.pyflow.analyzer;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Variable bindings of one analysis run. Names assigned to untraced values stay bound as
 * {@link TracedValue.Kind#OTHER}; names never assigned resolve as {@link TracedValue.Kind#UNBOUND},
 * except the conventional module aliases, which resolve to their module until rebound.
 */
final class SymbolTable {

    /** Aliases scripts and notebook cells commonly use without an import in view. */
    static final Map<String, String> CONVENTIONAL_ALIASES = Map.of("pd", "pandas", "np", "numpy");

    private final Map<String, TracedValue> values = new LinkedHashMap<>();

    void bind(String name, TracedValue value) {
        if (name == null) return;
        if (value == null) values.remove(name);
        else values.put(name, value);
    }

    void remove(String name) {
        values.remove(name);
    }

    TracedValue lookup(String name) {
        TracedValue v = values.get(name);
        if (v != null) return v;
        String module = CONVENTIONAL_ALIASES.get(name);
        return module != null ? TracedValue.module(module) : TracedValue.unbound(name);
    }

    boolean isBound(String name) {
        return values.containsKey(name);
    }

    /** Variables currently bound to dataframes. */
    Set<String> frames() {
        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, TracedValue> e : values.entrySet()) {
            if (e.getValue().kind() == TracedValue.Kind.DATAFRAME) out.add(e.getKey());
        }
        return out;
    }

    /** Dataframe a variable stands for: itself for frames, the underlying frame for series. */
    String frameOf(String name) {
        TracedValue v = values.get(name);
        if (v == null) return null;
        if (v.kind() == TracedValue.Kind.DATAFRAME) return v.name();
        if (v.kind() == TracedValue.Kind.SERIES) return v.name();
        return null;
    }

    void clear() {
        values.clear();
    }

    int size() {
        return values.size();
    }
}
