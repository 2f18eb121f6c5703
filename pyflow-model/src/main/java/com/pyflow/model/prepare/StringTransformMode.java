package com.pyflow.model.prepare;

import java.util.Locale;
import java.util.Map;

/** Modes of the {@link ProcessorType#STRING_TRANSFORMER} processor. */
public enum StringTransformMode {
    TO_UPPER,
    TO_LOWER,
    TITLECASE,
    CAPITALIZE,
    SWAPCASE,
    TRIM,
    TRIM_LEFT,
    TRIM_RIGHT,
    NORMALIZE_WHITESPACE,
    REMOVE_ACCENTS,
    PAD_LEFT,
    PAD_RIGHT,
    REVERSE;

    private static final Map<String, StringTransformMode> BY_PYTHON_NAME = Map.ofEntries(
            Map.entry("upper", TO_UPPER),
            Map.entry("lower", TO_LOWER),
            Map.entry("casefold", TO_LOWER),
            Map.entry("title", TITLECASE),
            Map.entry("capitalize", CAPITALIZE),
            Map.entry("swapcase", SWAPCASE),
            Map.entry("strip", TRIM),
            Map.entry("trim", TRIM),
            Map.entry("lstrip", TRIM_LEFT),
            Map.entry("rstrip", TRIM_RIGHT),
            Map.entry("normalize", NORMALIZE_WHITESPACE),
            Map.entry("pad", PAD_LEFT),
            Map.entry("zfill", PAD_LEFT),
            Map.entry("ljust", PAD_RIGHT),
            Map.entry("rjust", PAD_LEFT),
            Map.entry("uppercase", TO_UPPER),
            Map.entry("lowercase", TO_LOWER),
            Map.entry("titlecase", TITLECASE));

    /**
     * Maps a Python string method (or a loose operation name such as {@code "uppercase"}) to a mode.
     * Returns null when there is no equivalent.
     */
    public static StringTransformMode fromPythonName(String name) {
        if (name == null) return null;
        return BY_PYTHON_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
