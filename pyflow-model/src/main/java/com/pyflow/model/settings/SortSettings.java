package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Sort recipe settings. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SortSettings(List<SortColumn> sortColumns) implements RecipeSettings {

    @JsonCreator
    public SortSettings(@JsonProperty("sortColumns") List<SortColumn> sortColumns) {
        this.sortColumns = sortColumns != null ? List.copyOf(sortColumns) : List.of();
    }

    @Override
    public boolean isEmpty() {
        return sortColumns.isEmpty();
    }
}
