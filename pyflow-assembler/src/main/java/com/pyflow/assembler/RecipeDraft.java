package com.pyflow.assembler;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.settings.RecipeSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one analyzer step asks the assembler to do, independent of which analyzer produced it.
 * Sources and targets are analyzer-side names (variables or model-reported dataset names);
 * {@link AbstractFlowAssembler} resolves them to dataset names.
 */
public final class RecipeDraft {

    public enum Action {
        /** Register an external dataset the target name is bound to. */
        READ,
        /** Mark the source as an output written to a location. */
        WRITE,
        /** Append processor steps to the open Prepare recipe or open a new one. */
        PREPARE,
        /** Build one visual recipe of {@link #type()}. */
        RECIPE,
        /** Build a code recipe holding the untranslated snippet. */
        CODE,
        /** Nothing to build. */
        SKIP
    }

    private final Action action;
    private final RecipeType type;
    private final List<String> sources;
    private final List<String> targets;
    private final RecipeSettings settings;
    private final List<PrepareStep> steps;
    private final String datasetName;
    private final String location;
    private final String code;
    private final String reason;
    private final List<Integer> lines;
    private final List<String> columns;
    private final Map<String, String> columnTypes;
    private final List<String> notes;

    private RecipeDraft(Builder b) {
        this.action = b.action;
        this.type = b.type;
        this.sources = Collections.unmodifiableList(new ArrayList<>(b.sources));
        this.targets = Collections.unmodifiableList(new ArrayList<>(b.targets));
        this.settings = b.settings;
        this.steps = List.copyOf(b.steps);
        this.datasetName = b.datasetName;
        this.location = b.location;
        this.code = b.code;
        this.reason = b.reason;
        this.lines = List.copyOf(b.lines);
        this.columns = List.copyOf(b.columns);
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.columnTypes));
        this.notes = List.copyOf(b.notes);
    }

    public static Builder read(String target) {
        return new Builder(Action.READ).target(target);
    }

    public static Builder write(String source) {
        return new Builder(Action.WRITE).source(source);
    }

    public static Builder prepare(String source, String target, List<PrepareStep> steps) {
        Builder b = new Builder(Action.PREPARE).type(RecipeType.PREPARE).source(source).target(target);
        steps.forEach(b::step);
        return b;
    }

    public static Builder recipe(RecipeType type, List<String> sources, List<String> targets, RecipeSettings settings) {
        Builder b = new Builder(Action.RECIPE).type(type).settings(settings);
        sources.forEach(b::source);
        targets.forEach(b::target);
        return b;
    }

    public static Builder code(List<String> sources, List<String> targets, String code, String reason) {
        Builder b = new Builder(Action.CODE).type(RecipeType.PYTHON).code(code).reason(reason);
        sources.forEach(b::source);
        targets.forEach(b::target);
        return b;
    }

    public static RecipeDraft skip(String reason) {
        return new Builder(Action.SKIP).reason(reason).build();
    }

    public Action action() {
        return action;
    }

    public RecipeType type() {
        return type;
    }

    public List<String> sources() {
        return sources;
    }

    public List<String> targets() {
        return targets;
    }

    /** First source, or null. */
    public String primarySource() {
        return sources.isEmpty() ? null : sources.get(0);
    }

    /** First target, or null. */
    public String primaryTarget() {
        return targets.isEmpty() ? null : targets.get(0);
    }

    public RecipeSettings settings() {
        return settings;
    }

    public List<PrepareStep> steps() {
        return steps;
    }

    /** Preferred dataset name for reads and writes (usually derived from the file name). */
    public String datasetName() {
        return datasetName;
    }

    public String location() {
        return location;
    }

    public String code() {
        return code;
    }

    /** Why a step became code or was skipped. */
    public String reason() {
        return reason;
    }

    public List<Integer> lines() {
        return lines;
    }

    /** Columns the step reads from its primary source. */
    public List<String> columns() {
        return columns;
    }

    /** Platform types the step assigns to columns of its output. */
    public Map<String, String> columnTypes() {
        return columnTypes;
    }

    public List<String> notes() {
        return notes;
    }

    @Override
    public String toString() {
        return "RecipeDraft{" + action + (type != null ? " " + type.toValue() : "") + ", " + sources + " -> " + targets + "}";
    }

    public static final class Builder {
        private final Action action;
        private RecipeType type;
        private final List<String> sources = new ArrayList<>();
        private final List<String> targets = new ArrayList<>();
        private RecipeSettings settings;
        private final List<PrepareStep> steps = new ArrayList<>();
        private String datasetName;
        private String location;
        private String code;
        private String reason;
        private final List<Integer> lines = new ArrayList<>();
        private final List<String> columns = new ArrayList<>();
        private final Map<String, String> columnTypes = new LinkedHashMap<>();
        private final List<String> notes = new ArrayList<>();

        private Builder(Action action) {
            this.action = action;
        }

        Builder type(RecipeType type) {
            this.type = type;
            return this;
        }

        public Builder source(String source) {
            if (source != null && !sources.contains(source)) sources.add(source);
            return this;
        }

        public Builder target(String target) {
            if (target != null && !targets.contains(target)) targets.add(target);
            return this;
        }

        Builder settings(RecipeSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder step(PrepareStep step) {
            if (step != null) steps.add(step);
            return this;
        }

        public Builder datasetName(String name) {
            this.datasetName = name;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        Builder code(String code) {
            this.code = code;
            return this;
        }

        Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder lines(List<Integer> more) {
            if (more != null) {
                for (Integer l : more) {
                    if (l != null && !lines.contains(l)) lines.add(l);
                }
            }
            return this;
        }

        public Builder columns(List<String> more) {
            if (more != null) {
                for (String c : more) {
                    if (c != null && !c.isBlank() && !columns.contains(c)) columns.add(c);
                }
            }
            return this;
        }

        public Builder columnType(String column, String type) {
            if (column != null && type != null) columnTypes.put(column, type);
            return this;
        }

        public Builder note(String note) {
            if (note != null && !note.isBlank() && !notes.contains(note)) notes.add(note);
            return this;
        }

        public Builder notes(List<String> more) {
            if (more != null) more.forEach(this::note);
            return this;
        }

        public RecipeDraft build() {
            return new RecipeDraft(this);
        }
    }
}
