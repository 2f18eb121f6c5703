package com.pyflow.model;

import com.pyflow.model.prepare.PrepareStep;
import com.pyflow.model.settings.PrepareSettings;
import com.pyflow.model.settings.RecipeSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recipe node of a {@link Flow}: typed transformation with ordered input and output dataset names
 * and a settings payload whose variant matches {@link #getType()}.
 */
public final class Recipe {

    private final String name;
    private final RecipeType type;
    private final List<String> inputs = new ArrayList<>();
    private final List<String> outputs = new ArrayList<>();
    private RecipeSettings settings;
    private final List<Integer> sourceLines = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    public Recipe(String name, RecipeType type, List<String> inputs, List<String> outputs, RecipeSettings settings) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("recipe name is required");
        this.name = name;
        this.type = type != null ? type : RecipeType.UNKNOWN;
        if (inputs != null) this.inputs.addAll(inputs);
        if (outputs != null) this.outputs.addAll(outputs);
        this.settings = settings != null ? settings : RecipeSettings.emptyFor(this.type);
        Class<? extends RecipeSettings> expected = RecipeSettings.settingsClassFor(this.type);
        if (!expected.isInstance(this.settings)) {
            throw new IllegalArgumentException(String.format("Recipe '%s' of type %s needs %s, got %s",
                    name, this.type.toValue(), expected.getSimpleName(), this.settings.getClass().getSimpleName()));
        }
    }

    public String getName() {
        return name;
    }

    public RecipeType getType() {
        return type;
    }

    public List<String> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<String> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public RecipeSettings getSettings() {
        return settings;
    }

    /** Settings cast to the variant the caller expects; throws when the recipe type does not match. */
    public <S extends RecipeSettings> S getSettings(Class<S> variant) {
        if (!variant.isInstance(settings)) {
            throw new IllegalStateException(String.format("Recipe '%s' (%s) has no %s",
                    name, type.toValue(), variant.getSimpleName()));
        }
        return variant.cast(settings);
    }

    public void setSettings(RecipeSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (!RecipeSettings.settingsClassFor(type).isInstance(settings)) {
            throw new IllegalArgumentException("Settings " + settings.getClass().getSimpleName()
                    + " do not match recipe type " + type.toValue());
        }
        this.settings = settings;
    }

    /** Appends a processor step; only valid for Prepare recipes. */
    public void addStep(PrepareStep step) {
        if (type != RecipeType.PREPARE) {
            throw new IllegalStateException("Steps can only be added to Prepare recipes, not " + type.toValue());
        }
        settings = ((PrepareSettings) settings).withStep(step);
        if (step.sourceLine() != null) addSourceLine(step.sourceLine());
    }

    /** Prepare steps, or an empty list for other recipe types. */
    public List<PrepareStep> getSteps() {
        return settings instanceof PrepareSettings p ? p.steps() : List.of();
    }

    public void addInput(String dataset) {
        if (dataset != null && !inputs.contains(dataset)) inputs.add(dataset);
    }

    public void replaceInput(String from, String to) {
        inputs.replaceAll(in -> in.equals(from) ? to : in);
    }

    public void setOutputs(List<String> newOutputs) {
        outputs.clear();
        outputs.addAll(newOutputs);
    }

    public void replaceOutput(String from, String to) {
        outputs.replaceAll(out -> out.equals(from) ? to : out);
    }

    public List<Integer> getSourceLines() {
        return Collections.unmodifiableList(sourceLines);
    }

    public void addSourceLine(Integer line) {
        if (line != null && !sourceLines.contains(line)) sourceLines.add(line);
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public void addNote(String note) {
        if (note != null && !note.isBlank() && !notes.contains(note)) notes.add(note);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recipe other)) return false;
        return name.equals(other.name)
                && type == other.type
                && inputs.equals(other.inputs)
                && outputs.equals(other.outputs)
                && settings.equals(other.settings)
                && sourceLines.equals(other.sourceLines)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, inputs, outputs, settings, sourceLines, notes);
    }

    @Override
    public String toString() {
        return "Recipe{name='" + name + "', type=" + type.toValue() + ", inputs=" + inputs + ", outputs=" + outputs + "}";
    }
}
