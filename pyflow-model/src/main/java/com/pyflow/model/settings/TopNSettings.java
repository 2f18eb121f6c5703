package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Top-N recipe settings. Without ranking columns the recipe keeps the first rows in input order
 * ({@code head}); {@code ascending=true} with ranking columns keeps the smallest values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopNSettings(int topN, List<String> rankingColumns, boolean ascending) implements RecipeSettings {

    @JsonCreator
    public TopNSettings(@JsonProperty("topN") int topN,
                        @JsonProperty("rankingColumns") List<String> rankingColumns,
                        @JsonProperty("ascending") boolean ascending) {
        this.topN = topN;
        this.rankingColumns = rankingColumns != null ? List.copyOf(rankingColumns) : List.of();
        this.ascending = ascending;
    }

    @Override
    public boolean isEmpty() {
        return topN <= 0;
    }
}
