package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A (severity, message) note accumulated during analysis, assembly or optimization.
 * Callers decide how to surface it (log, print, raise).
 */
public record FlowWarning(Severity severity, String message) {

    @JsonCreator
    public FlowWarning(@JsonProperty("severity") Severity severity,
                       @JsonProperty("message") String message) {
        this.severity = severity != null ? severity : Severity.WARNING;
        this.message = Objects.requireNonNullElse(message, "");
    }

    public static FlowWarning info(String message) {
        return new FlowWarning(Severity.INFO, message);
    }

    public static FlowWarning warning(String message) {
        return new FlowWarning(Severity.WARNING, message);
    }

    public static FlowWarning error(String message) {
        return new FlowWarning(Severity.ERROR, message);
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
