package com.pyflow.model;

import java.util.List;

/**
 * Thrown by {@link Flow#requireValid()} when a finished flow breaks a structural invariant
 * (recipe without inputs, dangling dataset reference, duplicate names, empty settings).
 */
public final class FlowValidationException extends ConversionException {

    private final List<String> problems;

    public FlowValidationException(String flowName, List<String> problems) {
        super(String.format("Flow '%s' failed validation with %d problem(s): %s",
                flowName, problems.size(), String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
