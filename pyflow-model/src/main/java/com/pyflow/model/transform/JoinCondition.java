package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Key pair of a join step. Accepts {@code left_column}/{@code left} and {@code right_column}/{@code right}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinCondition(String leftColumn, String rightColumn) {

    @JsonCreator
    public JoinCondition(@JsonProperty("left_column") @JsonAlias({"left", "leftColumn"}) String leftColumn,
                         @JsonProperty("right_column") @JsonAlias({"right", "rightColumn"}) String rightColumn) {
        this.leftColumn = leftColumn != null ? leftColumn : "";
        this.rightColumn = rightColumn != null && !rightColumn.isBlank() ? rightColumn : this.leftColumn;
    }
}
