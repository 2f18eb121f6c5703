package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Join recipe settings: join type and key pairs (left input is the first recipe input). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinSettings(JoinType joinType, List<JoinKey> joins) implements RecipeSettings {

    @JsonCreator
    public JoinSettings(@JsonProperty("joinType") JoinType joinType,
                        @JsonProperty("joins") List<JoinKey> joins) {
        this.joinType = joinType != null ? joinType : JoinType.INNER;
        this.joins = joins != null ? List.copyOf(joins) : List.of();
    }

    @Override
    public boolean isEmpty() {
        return joins.isEmpty() && joinType != JoinType.CROSS;
    }
}
