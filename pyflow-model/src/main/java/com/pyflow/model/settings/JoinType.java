package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/** Join types of a Join recipe. */
public enum JoinType {
    INNER,
    LEFT,
    RIGHT,
    OUTER,
    CROSS;

    /**
     * Maps pandas {@code how=} values and loose names ({@code full}, {@code left_outer}) to a join type.
     * Unknown values fall back to {@link #INNER}, matching pandas' {@code merge} default;
     * callers that must report the fallback check {@link #isRecognized(String)} first.
     */
    @JsonCreator
    public static JoinType fromValue(String value) {
        JoinType type = parse(value);
        return type != null ? type : INNER;
    }

    /** True when the value is blank or names a join type; false when {@link #fromValue} would guess. */
    public static boolean isRecognized(String value) {
        return value == null || value.isBlank() || parse(value) != null;
    }

    private static JoinType parse(String value) {
        if (value == null || value.isBlank()) return INNER;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "inner", "inner_join" -> INNER;
            case "left", "left_outer", "leftouter" -> LEFT;
            case "right", "right_outer", "rightouter" -> RIGHT;
            case "outer", "full", "full_outer", "fullouter" -> OUTER;
            case "cross" -> CROSS;
            default -> null;
        };
    }
}
