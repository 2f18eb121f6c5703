package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory note about the flow (e.g. "filter could be moved before join"). Descriptive only;
 * nothing in the pipeline depends on recommendations being applied.
 *
 * @param type     category such as {@code PERFORMANCE}, {@code RECIPE_CHOICE}, {@code PYTHON_FALLBACK}
 * @param priority {@code HIGH}, {@code MEDIUM} or {@code LOW}
 * @param message  human-readable text
 * @param impact   optional expected effect
 * @param action   optional suggested action
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowRecommendation(String type, String priority, String message, String impact, String action) {

    @JsonCreator
    public FlowRecommendation(@JsonProperty("type") String type,
                              @JsonProperty("priority") String priority,
                              @JsonProperty("message") String message,
                              @JsonProperty("impact") String impact,
                              @JsonProperty("action") String action) {
        this.type = type != null ? type : "GENERAL";
        this.priority = priority != null ? priority : "MEDIUM";
        this.message = message != null ? message : "";
        this.impact = impact;
        this.action = action;
    }

    public FlowRecommendation(String type, String priority, String message) {
        this(type, priority, message, null, null);
    }
}
