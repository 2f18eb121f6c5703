package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Split recipe settings. Mode {@code FILTER} routes rows matching {@code condition} to the first
 * output; mode {@code RANDOM} splits by {@code ratio} (share of rows in the first output).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SplitSettings(String splitMode, String condition, Double ratio) implements RecipeSettings {

    @JsonCreator
    public SplitSettings(@JsonProperty("splitMode") String splitMode,
                         @JsonProperty("condition") String condition,
                         @JsonProperty("ratio") Double ratio) {
        this.splitMode = splitMode != null ? splitMode : (ratio != null ? "RANDOM" : "FILTER");
        this.condition = condition;
        this.ratio = ratio;
    }

    public static SplitSettings filter(String condition) {
        return new SplitSettings("FILTER", condition, null);
    }

    public static SplitSettings random(double ratio) {
        return new SplitSettings("RANDOM", null, ratio);
    }

    @Override
    public boolean isEmpty() {
        return (condition == null || condition.isBlank()) && ratio == null;
    }
}
