package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pyflow.model.RecipeType;

import java.util.Locale;

/**
 * Kind of a statically detected transformation. JSON uses the lower-case name
 * ({@code "fill_na"}); unknown strings deserialize as {@link #UNKNOWN}.
 */
public enum TransformationKind {
    READ_DATA,
    WRITE_DATA,

    COLUMN_RENAME,
    COLUMN_DROP,
    COLUMN_SELECT,
    COLUMN_COPY,
    COLUMN_CREATE,

    FILL_NA,
    DROP_NA,
    TYPE_CAST,
    STRING_TRANSFORM,
    NUMERIC_TRANSFORM,
    DATE_PARSE,
    VALUE_REPLACE,
    CATEGORICAL_ENCODE,
    BINNING,

    FILTER,
    DROP_DUPLICATES,
    SORT,
    HEAD,
    TAIL,
    SAMPLE,
    TOP_N,
    SPLIT,

    GROUPBY,
    WINDOW,

    MERGE,
    CONCAT,

    PIVOT,
    MELT,
    TRANSPOSE,

    FIT,
    PREDICT,
    FIT_TRANSFORM,

    CUSTOM_FUNCTION,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TransformationKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TransformationKind k : values()) {
            if (k.name().equals(normalized)) return k;
        }
        return UNKNOWN;
    }

    /** Kinds that become one processor step inside a Prepare recipe. */
    public boolean isPrepareKind() {
        return switch (this) {
            case COLUMN_RENAME, COLUMN_DROP, COLUMN_SELECT, COLUMN_COPY, COLUMN_CREATE,
                 FILL_NA, DROP_NA, TYPE_CAST, STRING_TRANSFORM, NUMERIC_TRANSFORM, DATE_PARSE,
                 VALUE_REPLACE, CATEGORICAL_ENCODE, BINNING, FILTER -> true;
            default -> false;
        };
    }

    /** Recipe type used when a transformation carries no suggestion of its own; null for reads and writes. */
    public RecipeType defaultRecipe() {
        if (isPrepareKind()) return RecipeType.PREPARE;
        return switch (this) {
            case READ_DATA, WRITE_DATA -> null;
            case DROP_DUPLICATES -> RecipeType.DISTINCT;
            case SORT -> RecipeType.SORT;
            case HEAD, TAIL, TOP_N -> RecipeType.TOP_N;
            case SAMPLE -> RecipeType.SAMPLING;
            case SPLIT -> RecipeType.SPLIT;
            case GROUPBY -> RecipeType.GROUPING;
            case WINDOW -> RecipeType.WINDOW;
            case MERGE -> RecipeType.JOIN;
            case CONCAT -> RecipeType.STACK;
            case PIVOT, MELT -> RecipeType.PIVOT;
            case PREDICT -> RecipeType.PREDICTION_SCORING;
            default -> RecipeType.PYTHON;
        };
    }
}
