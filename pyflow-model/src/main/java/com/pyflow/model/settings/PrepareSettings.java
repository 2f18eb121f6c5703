package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pyflow.model.prepare.PrepareStep;

import java.util.ArrayList;
import java.util.List;

/** Prepare recipe settings: ordered processor steps. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrepareSettings(String mode, List<PrepareStep> steps) implements RecipeSettings {

    @JsonCreator
    public PrepareSettings(@JsonProperty("mode") String mode,
                           @JsonProperty("steps") List<PrepareStep> steps) {
        this.mode = mode != null ? mode : "NORMAL";
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static PrepareSettings empty() {
        return new PrepareSettings("NORMAL", List.of());
    }

    /** Returns settings with the step appended. */
    public PrepareSettings withStep(PrepareStep step) {
        List<PrepareStep> next = new ArrayList<>(steps);
        next.add(step);
        return new PrepareSettings(mode, next);
    }

    /** Returns settings with the other recipe's steps appended in order. */
    public PrepareSettings concat(PrepareSettings other) {
        List<PrepareStep> next = new ArrayList<>(steps);
        next.addAll(other.steps);
        return new PrepareSettings(mode, next);
    }

    @Override
    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
