package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pyflow.model.RecipeType;

import java.util.Locale;

/**
 * Operation of a semantic {@link DataStep}. JSON uses the lower-case name; strings that match no
 * constant become {@link #UNKNOWN} (the step keeps the original text in {@code rawOperation}).
 */
public enum OperationType {
    READ_DATA,
    WRITE_DATA,
    FILTER,
    SELECT_COLUMNS,
    DROP_COLUMNS,
    RENAME_COLUMNS,
    ADD_COLUMN,
    TRANSFORM_COLUMN,
    FILL_MISSING,
    DROP_MISSING,
    DROP_DUPLICATES,
    GROUP_AGGREGATE,
    WINDOW_FUNCTION,
    JOIN,
    UNION,
    PIVOT,
    UNPIVOT,
    SORT,
    TOP_N,
    SAMPLE,
    CAST_TYPE,
    PARSE_DATE,
    SPLIT_COLUMN,
    ENCODE_CATEGORICAL,
    NORMALIZE_SCALE,
    CUSTOM_FUNCTION,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OperationType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (OperationType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }

    /** True for operations that become a Prepare processor step. */
    public boolean isPrepareOperation() {
        return switch (this) {
            case FILTER, SELECT_COLUMNS, DROP_COLUMNS, RENAME_COLUMNS, ADD_COLUMN, TRANSFORM_COLUMN,
                 FILL_MISSING, DROP_MISSING, CAST_TYPE, PARSE_DATE, SPLIT_COLUMN, ENCODE_CATEGORICAL,
                 NORMALIZE_SCALE -> true;
            default -> false;
        };
    }

    /** Recipe inferred for a step whose model reply names none; null for reads and writes. */
    public RecipeType defaultRecipe() {
        if (isPrepareOperation()) return RecipeType.PREPARE;
        return switch (this) {
            case READ_DATA, WRITE_DATA -> null;
            case DROP_DUPLICATES -> RecipeType.DISTINCT;
            case GROUP_AGGREGATE -> RecipeType.GROUPING;
            case WINDOW_FUNCTION -> RecipeType.WINDOW;
            case JOIN -> RecipeType.JOIN;
            case UNION -> RecipeType.STACK;
            case PIVOT, UNPIVOT -> RecipeType.PIVOT;
            case SORT -> RecipeType.SORT;
            case TOP_N -> RecipeType.TOP_N;
            case SAMPLE -> RecipeType.SAMPLING;
            default -> RecipeType.PYTHON;
        };
    }
}
