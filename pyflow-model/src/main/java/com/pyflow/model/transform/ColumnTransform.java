package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Per-column operation of a semantic step, e.g. {@code (name, uppercase)} or {@code (price, round, {decimals: 2})}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnTransform(String column, String operation, String outputColumn, Map<String, Object> parameters) {

    @JsonCreator
    public ColumnTransform(@JsonProperty("column") String column,
                           @JsonProperty("operation") String operation,
                           @JsonProperty("output_column") @JsonAlias("outputColumn") String outputColumn,
                           @JsonProperty("parameters") Map<String, Object> parameters) {
        this.column = column != null ? column : "";
        this.operation = operation != null ? operation : "";
        this.outputColumn = outputColumn;
        this.parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }
}
