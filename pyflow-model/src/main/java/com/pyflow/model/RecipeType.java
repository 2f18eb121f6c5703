package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Type of a recipe node in the flow. JSON uses the lower-case platform value (e.g. {@code "topn"});
 * unknown values deserialize as {@link #UNKNOWN}.
 */
public enum RecipeType {
    PREPARE("prepare"),
    SYNC("sync"),
    GROUPING("grouping"),
    WINDOW("window"),
    JOIN("join"),
    STACK("stack"),
    SPLIT("split"),
    SORT("sort"),
    DISTINCT("distinct"),
    TOP_N("topn"),
    PIVOT("pivot"),
    SAMPLING("sampling"),
    /** Code recipe holding untranslated source. */
    PYTHON("python"),
    PREDICTION_SCORING("prediction_scoring"),
    /** Used when an exported flow contains an unknown type string. */
    UNKNOWN("unknown");

    private final String value;

    RecipeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static RecipeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecipeType t : values()) {
            if (t != UNKNOWN && (t.value.equals(normalized) || t.name().equalsIgnoreCase(normalized))) return t;
        }
        return UNKNOWN;
    }

    /** True for code recipes (the fallback for anything the catalog does not recognize). */
    public boolean isCode() {
        return this == PYTHON;
    }

    /** Prefix used by recipe naming, e.g. {@code prepare} in {@code prepare_1}. */
    public String namePrefix() {
        return value;
    }
}
