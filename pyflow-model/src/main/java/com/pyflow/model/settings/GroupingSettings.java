package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Grouping recipe settings: group keys plus aggregations. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupingSettings(List<String> keys, List<Aggregation> aggregations, boolean globalCount)
        implements RecipeSettings {

    @JsonCreator
    public GroupingSettings(@JsonProperty("keys") List<String> keys,
                            @JsonProperty("aggregations") List<Aggregation> aggregations,
                            @JsonProperty("globalCount") boolean globalCount) {
        this.keys = keys != null ? List.copyOf(keys) : List.of();
        this.aggregations = aggregations != null ? List.copyOf(aggregations) : List.of();
        this.globalCount = globalCount;
    }

    @Override
    public boolean isEmpty() {
        return keys.isEmpty() && aggregations.isEmpty() && !globalCount;
    }
}
