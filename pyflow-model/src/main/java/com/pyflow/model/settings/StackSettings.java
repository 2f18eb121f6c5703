package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Stack recipe settings ({@code UNION} of all inputs). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StackSettings(String mode) implements RecipeSettings {

    @JsonCreator
    public StackSettings(@JsonProperty("mode") String mode) {
        this.mode = mode != null ? mode : "UNION";
    }

    public static StackSettings union() {
        return new StackSettings("UNION");
    }

    @Override
    public boolean isEmpty() {
        return false;
    }
}
