package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Severity of a {@link FlowWarning}. */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) return WARNING;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        return WARNING;
    }
}
