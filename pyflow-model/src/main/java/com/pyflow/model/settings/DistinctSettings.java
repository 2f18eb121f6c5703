package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Distinct recipe settings; empty {@code keyColumns} means all columns. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistinctSettings(List<String> keyColumns, boolean computeCount) implements RecipeSettings {

    @JsonCreator
    public DistinctSettings(@JsonProperty("keyColumns") List<String> keyColumns,
                            @JsonProperty("computeCount") boolean computeCount) {
        this.keyColumns = keyColumns != null ? List.copyOf(keyColumns) : List.of();
        this.computeCount = computeCount;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }
}
