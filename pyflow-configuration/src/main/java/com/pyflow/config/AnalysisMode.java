package com.pyflow.config;

import java.util.Locale;

/** Which analyzer reads the script. */
public enum AnalysisMode {
    /** Syntax-tree walk with the pattern catalog; deterministic, no network. */
    STATIC,
    /** Model-based analysis through an LLM provider. */
    SEMANTIC;

    /** Case-insensitive lookup; null when the text names no mode. */
    public static AnalysisMode fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AnalysisMode m : values()) {
            if (m.name().equals(normalized)) return m;
        }
        if (normalized.equals("LLM")) return SEMANTIC;
        return null;
    }
}
