package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;

/**
 * One aggregation of a Grouping or Window recipe: {@code column}, platform function {@code type}
 * (SUM, AVG, COUNT, ...) and optional {@code outputColumn}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Aggregation(String column, String type, String outputColumn) {

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("sum", "SUM"),
            Map.entry("mean", "AVG"),
            Map.entry("avg", "AVG"),
            Map.entry("average", "AVG"),
            Map.entry("count", "COUNT"),
            Map.entry("size", "COUNT"),
            Map.entry("nunique", "COUNTDISTINCT"),
            Map.entry("count_distinct", "COUNTDISTINCT"),
            Map.entry("min", "MIN"),
            Map.entry("max", "MAX"),
            Map.entry("median", "MEDIAN"),
            Map.entry("std", "STDDEV"),
            Map.entry("stddev", "STDDEV"),
            Map.entry("var", "VAR"),
            Map.entry("first", "FIRST"),
            Map.entry("last", "LAST"),
            Map.entry("cumsum", "RUNNING_SUM"),
            Map.entry("cumprod", "RUNNING_PRODUCT"),
            Map.entry("cummax", "RUNNING_MAX"),
            Map.entry("cummin", "RUNNING_MIN"),
            Map.entry("diff", "LAG_DIFF"),
            Map.entry("shift", "LAG"),
            Map.entry("rank", "RANK"),
            Map.entry("pct_change", "LAG_DIFF_PERCENT"));

    @JsonCreator
    public Aggregation(@JsonProperty("column") String column,
                       @JsonProperty("type") String type,
                       @JsonProperty("outputColumn") String outputColumn) {
        this.column = column;
        this.type = type != null ? type.toUpperCase(Locale.ROOT) : "COUNT";
        this.outputColumn = outputColumn;
    }

    /**
     * Normalizes a pandas/SQL function name ({@code mean}, {@code nunique}) to the platform name
     * ({@code AVG}, {@code COUNTDISTINCT}). Unknown names are upper-cased as given.
     */
    public static String normalizeFunction(String function) {
        if (function == null || function.isBlank()) return "COUNT";
        String key = function.trim().toLowerCase(Locale.ROOT);
        return FUNCTIONS.getOrDefault(key, key.toUpperCase(Locale.ROOT));
    }

    public static Aggregation of(String column, String function) {
        return new Aggregation(column, normalizeFunction(function), null);
    }
}
