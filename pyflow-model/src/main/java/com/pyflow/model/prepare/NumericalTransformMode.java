package com.pyflow.model.prepare;

import java.util.Locale;
import java.util.Map;

/** Modes of the {@link ProcessorType#NUMERICAL_TRANSFORMER} processor. */
public enum NumericalTransformMode {
    LOG,
    LOG10,
    LOG2,
    EXP,
    SQRT,
    ABS,
    ROUND,
    FLOOR,
    CEIL,
    NEGATE,
    POWER;

    private static final Map<String, NumericalTransformMode> BY_PYTHON_NAME = Map.ofEntries(
            Map.entry("log", LOG),
            Map.entry("log1p", LOG),
            Map.entry("log10", LOG10),
            Map.entry("log2", LOG2),
            Map.entry("exp", EXP),
            Map.entry("sqrt", SQRT),
            Map.entry("abs", ABS),
            Map.entry("absolute", ABS),
            Map.entry("round", ROUND),
            Map.entry("floor", FLOOR),
            Map.entry("ceil", CEIL),
            Map.entry("negative", NEGATE),
            Map.entry("power", POWER));

    /** Maps a numpy function name to a mode; null when there is no equivalent. */
    public static NumericalTransformMode fromPythonName(String name) {
        if (name == null) return null;
        return BY_PYTHON_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
