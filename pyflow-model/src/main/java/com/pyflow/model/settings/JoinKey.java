package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One equality condition of a Join recipe. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinKey(String leftColumn, String rightColumn, String matchType) {

    @JsonCreator
    public JoinKey(@JsonProperty("leftColumn") String leftColumn,
                   @JsonProperty("rightColumn") String rightColumn,
                   @JsonProperty("matchType") String matchType) {
        this.leftColumn = leftColumn;
        this.rightColumn = rightColumn != null ? rightColumn : leftColumn;
        this.matchType = matchType != null ? matchType : "EXACT";
    }

    public static JoinKey on(String column) {
        return new JoinKey(column, column, "EXACT");
    }
}
