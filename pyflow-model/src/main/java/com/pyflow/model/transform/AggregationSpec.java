package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Aggregation named by a semantic step: column, function ({@code sum}, {@code mean}) and optional output. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregationSpec(String column, String function, String outputColumn) {

    @JsonCreator
    public AggregationSpec(@JsonProperty("column") String column,
                           @JsonProperty("function") @JsonAlias({"agg", "type"}) String function,
                           @JsonProperty("output_column") @JsonAlias("outputColumn") String outputColumn) {
        this.column = column != null ? column : "";
        this.function = function != null && !function.isBlank() ? function : "count";
        this.outputColumn = outputColumn;
    }
}
