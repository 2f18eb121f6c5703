package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recognized statement or chain link from the static analyzer. Immutable, including the
 * lists and maps nested in {@link #parameters()}; consumed once by the assembler.
 *
 * @param kind               what the statement does
 * @param sourceDataframe    primary input variable (or synthetic chain name); null for reads
 * @param additionalSources  other inputs (right side of a merge, further frames of a concat)
 * @param targetDataframe    variable the result is bound to; null for writes and display calls
 * @param columns            columns the operation touches, in source order
 * @param parameters         kind-specific parameters in extraction order
 * @param suggestedRecipe    recipe the catalog suggests, or null to use the kind's default
 * @param suggestedProcessor Prepare processor the catalog suggests, or null
 * @param sourceLine         1-based line of the statement
 * @param sourceCode         source text of the statement or link
 * @param requiresCodeRecipe true when only a code recipe can express it
 * @param notes              analyzer remarks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Transformation(TransformationKind kind,
                             String sourceDataframe,
                             List<String> additionalSources,
                             String targetDataframe,
                             List<String> columns,
                             Map<String, Object> parameters,
                             RecipeType suggestedRecipe,
                             ProcessorType suggestedProcessor,
                             Integer sourceLine,
                             String sourceCode,
                             boolean requiresCodeRecipe,
                             List<String> notes) implements FlowStep {

    public Transformation {
        kind = kind != null ? kind : TransformationKind.UNKNOWN;
        additionalSources = additionalSources != null ? List.copyOf(additionalSources) : List.of();
        columns = columns != null ? List.copyOf(columns) : List.of();
        parameters = parameters != null ? copyParameters(parameters) : Map.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    private static Map<String, Object> copyParameters(Map<String, Object> parameters) {
        Map<String, Object> out = new LinkedHashMap<>();
        parameters.forEach((k, v) -> out.put(k, copyValue(v)));
        return Collections.unmodifiableMap(out);
    }

    /** Nested maps and lists become unmodifiable copies; null elements are kept. */
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<Object, Object> out = new LinkedHashMap<>();
            m.forEach((k, v) -> out.put(k, copyValue(v)));
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object v : l) out.add(copyValue(v));
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    public static Builder builder(TransformationKind kind) {
        return new Builder(kind);
    }

    /** Recipe to build: the catalog suggestion, or the kind's default. */
    @JsonIgnore
    public RecipeType effectiveRecipe() {
        if (requiresCodeRecipe) return RecipeType.PYTHON;
        return suggestedRecipe != null ? suggestedRecipe : kind.defaultRecipe();
    }

    /** Parameter as text, or null when absent. */
    public String parameter(String key) {
        Object v = parameters.get(key);
        return v != null ? v.toString() : null;
    }

    @Override
    public List<String> sourceNames() {
        List<String> out = new ArrayList<>();
        if (sourceDataframe != null) out.add(sourceDataframe);
        out.addAll(additionalSources);
        return out;
    }

    @Override
    public String targetName() {
        return targetDataframe;
    }

    @Override
    public List<Integer> sourceLines() {
        return sourceLine != null ? List.of(sourceLine) : List.of();
    }

    /** Returns a copy bound to a different target variable. */
    public Transformation withTarget(String target) {
        return new Transformation(kind, sourceDataframe, additionalSources, target, columns, parameters,
                suggestedRecipe, suggestedProcessor, sourceLine, sourceCode, requiresCodeRecipe, notes);
    }

    /** Returns a copy reading from a different primary source. */
    public Transformation withSource(String source) {
        return new Transformation(kind, source, additionalSources, targetDataframe, columns, parameters,
                suggestedRecipe, suggestedProcessor, sourceLine, sourceCode, requiresCodeRecipe, notes);
    }

    @Override
    public String toString() {
        return kind.toValue() + "(" + sourceNames() + " -> " + targetDataframe + ", line " + sourceLine + ")";
    }

    /** Builder used by the analyzer; every field is optional except the kind. */
    public static final class Builder {
        private final TransformationKind kind;
        private String source;
        private final List<String> additionalSources = new ArrayList<>();
        private String target;
        private final List<String> columns = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private RecipeType suggestedRecipe;
        private ProcessorType suggestedProcessor;
        private Integer line;
        private String code;
        private boolean requiresCodeRecipe;
        private final List<String> notes = new ArrayList<>();

        private Builder(TransformationKind kind) {
            this.kind = kind;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder additionalSource(String name) {
            if (name != null) additionalSources.add(name);
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder column(String column) {
            if (column != null && !columns.contains(column)) columns.add(column);
            return this;
        }

        public Builder columns(List<String> more) {
            if (more != null) more.forEach(this::column);
            return this;
        }

        public Builder parameter(String key, Object value) {
            if (value != null) parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, ?> more) {
            if (more != null) more.forEach(this::parameter);
            return this;
        }

        public Builder suggestedRecipe(RecipeType recipe) {
            this.suggestedRecipe = recipe;
            return this;
        }

        public Builder suggestedProcessor(ProcessorType processor) {
            this.suggestedProcessor = processor;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder requiresCodeRecipe(boolean value) {
            this.requiresCodeRecipe = value;
            return this;
        }

        public Builder note(String note) {
            if (note != null) notes.add(note);
            return this;
        }

        public Transformation build() {
            return new Transformation(kind, source, additionalSources, target, columns, parameters,
                    suggestedRecipe, suggestedProcessor, line, code, requiresCodeRecipe, notes);
        }
    }
}
