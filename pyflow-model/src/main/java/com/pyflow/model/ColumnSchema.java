package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column of a dataset schema. Type is a platform type name ({@code string}, {@code bigint},
 * {@code double}, {@code date}, {@code boolean}); unknown types stay as given.
 */
public record ColumnSchema(String name, String type, boolean nullable) {

    @JsonCreator
    public ColumnSchema(@JsonProperty("name") String name,
                        @JsonProperty("type") String type,
                        @JsonProperty("nullable") Boolean nullable) {
        this(name, type, nullable == null || nullable);
    }

    public ColumnSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("column name is required");
        type = type != null && !type.isBlank() ? type : "string";
    }
}
