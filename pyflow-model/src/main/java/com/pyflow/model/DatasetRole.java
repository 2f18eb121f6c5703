package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role of a dataset in the flow. Unknown strings deserialize as {@link #INTERMEDIATE}.
 */
public enum DatasetRole {
    INPUT("input"),
    INTERMEDIATE("intermediate"),
    OUTPUT("output");

    private final String value;

    DatasetRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static DatasetRole fromValue(String value) {
        if (value == null || value.isBlank()) return INTERMEDIATE;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DatasetRole r : values()) {
            if (r.value.equals(normalized)) return r;
        }
        return INTERMEDIATE;
    }
}
