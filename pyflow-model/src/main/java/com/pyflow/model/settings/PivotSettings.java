package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pivot recipe settings. Mode {@code PIVOT} spreads {@code pivotColumns} values into columns;
 * mode {@code UNPIVOT} folds {@code valueColumns} into rows keyed by {@code indexColumns}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotSettings(String mode, List<String> indexColumns, List<String> pivotColumns,
                            List<String> valueColumns, String aggregation) implements RecipeSettings {

    @JsonCreator
    public PivotSettings(@JsonProperty("mode") String mode,
                         @JsonProperty("indexColumns") List<String> indexColumns,
                         @JsonProperty("pivotColumns") List<String> pivotColumns,
                         @JsonProperty("valueColumns") List<String> valueColumns,
                         @JsonProperty("aggregation") String aggregation) {
        this.mode = mode != null ? mode : "PIVOT";
        this.indexColumns = indexColumns != null ? List.copyOf(indexColumns) : List.of();
        this.pivotColumns = pivotColumns != null ? List.copyOf(pivotColumns) : List.of();
        this.valueColumns = valueColumns != null ? List.copyOf(valueColumns) : List.of();
        this.aggregation = aggregation;
    }

    @Override
    public boolean isEmpty() {
        if ("UNPIVOT".equals(mode)) return valueColumns.isEmpty() && indexColumns.isEmpty();
        return pivotColumns.isEmpty() && indexColumns.isEmpty();
    }
}
