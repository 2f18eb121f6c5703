package com.pyflow.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from (callee name, call target, argument shape) to a {@link PatternRule}.
 * Several rules may share a name and target; they are tried in registration order and the first
 * whose guard accepts the arguments wins. Unknown callees resolve to an opaque rule.
 * <p>
 * Instances are independent: {@link #builder()} starts empty, {@link #toBuilder()} copies, and
 * {@link #defaults()} is a shared instance carrying the built-in pandas, numpy and scikit-learn
 * rules that callers use only when they ask for it.
 */
public final class PatternCatalog {

    private static final class DefaultHolder {
        private static final PatternCatalog DEFAULTS = createDefaults();
    }

    private final Map<Key, List<PatternRule>> rules;

    private PatternCatalog(Map<Key, List<PatternRule>> rules) {
        this.rules = rules;
    }

    /** Shared catalog with the built-in rules. */
    public static PatternCatalog defaults() {
        return DefaultHolder.DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        for (Map.Entry<Key, List<PatternRule>> e : rules.entrySet()) {
            b.rules.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        return b;
    }

    private static PatternCatalog createDefaults() {
        Builder b = builder();
        PandasPatterns.register(b);
        NumpyPatterns.register(b);
        SklearnPatterns.register(b);
        return b.build();
    }

    /**
     * First rule for the callee whose guard accepts the arguments.
     *
     * @return empty when the callee is unknown on that target or no guard matches
     */
    public Optional<PatternRule> find(String name, CallTarget target, ArgumentShape shape) {
        List<PatternRule> candidates = rules.get(new Key(name, target));
        if (candidates == null) return Optional.empty();
        for (PatternRule rule : candidates) {
            if (rule.matches(shape)) return Optional.of(rule);
        }
        return Optional.empty();
    }

    /** Like {@link #find} but falls back to {@link PatternRule#opaque(String, CallTarget)}. */
    public PatternRule resolve(String name, CallTarget target, ArgumentShape shape) {
        return find(name, target, shape).orElseGet(() -> PatternRule.opaque(name, target));
    }

    public boolean knows(String name, CallTarget target) {
        return rules.containsKey(new Key(name, target));
    }

    /** All rules registered for the callee on the target, in matching order. */
    public List<PatternRule> rulesFor(String name, CallTarget target) {
        return rules.getOrDefault(new Key(name, target), List.of());
    }

    public int size() {
        int n = 0;
        for (List<PatternRule> list : rules.values()) n += list.size();
        return n;
    }

    private record Key(String name, CallTarget target) {
    }

    public static final class Builder {
        private final Map<Key, List<PatternRule>> rules = new LinkedHashMap<>();

        private Builder() {
        }

        /** Appends a rule; earlier rules for the same callee keep priority. */
        public Builder add(PatternRule rule) {
            rules.computeIfAbsent(new Key(rule.name(), rule.target()), k -> new ArrayList<>()).add(rule);
            return this;
        }

        public Builder add(PatternRule.Builder rule) {
            return add(rule.build());
        }

        /** Replaces every rule for the callee on that target with this one. */
        public Builder override(PatternRule rule) {
            List<PatternRule> list = new ArrayList<>();
            list.add(rule);
            rules.put(new Key(rule.name(), rule.target()), list);
            return this;
        }

        /** Inserts a rule ahead of the existing ones for the same callee. */
        public Builder prepend(PatternRule rule) {
            rules.computeIfAbsent(new Key(rule.name(), rule.target()), k -> new ArrayList<>()).add(0, rule);
            return this;
        }

        public Builder remove(String name, CallTarget target) {
            rules.remove(new Key(name, target));
            return this;
        }

        public PatternCatalog build() {
            Map<Key, List<PatternRule>> copy = new LinkedHashMap<>();
            for (Map.Entry<Key, List<PatternRule>> e : rules.entrySet()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
            return new PatternCatalog(Collections.unmodifiableMap(copy));
        }
    }
}
