package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Window recipe settings. {@code frameSize} is the rolling window length; null means the whole
 * partition (cumulative functions, ranks, lags).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WindowSettings(List<String> partitionColumns, List<String> orderColumns,
                             List<Aggregation> aggregations, Integer frameSize) implements RecipeSettings {

    @JsonCreator
    public WindowSettings(@JsonProperty("partitionColumns") List<String> partitionColumns,
                          @JsonProperty("orderColumns") List<String> orderColumns,
                          @JsonProperty("aggregations") List<Aggregation> aggregations,
                          @JsonProperty("frameSize") Integer frameSize) {
        this.partitionColumns = partitionColumns != null ? List.copyOf(partitionColumns) : List.of();
        this.orderColumns = orderColumns != null ? List.copyOf(orderColumns) : List.of();
        this.aggregations = aggregations != null ? List.copyOf(aggregations) : List.of();
        this.frameSize = frameSize;
    }

    @Override
    public boolean isEmpty() {
        return aggregations.isEmpty();
    }
}
