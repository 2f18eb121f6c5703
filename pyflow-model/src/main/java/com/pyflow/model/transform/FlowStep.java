package com.pyflow.model.transform;

import java.util.List;

/**
 * A unit of analyzer output that the flow assembler turns into at most one recipe (or one
 * Prepare step). Implemented by {@link Transformation} (static path) and {@link DataStep}
 * (semantic path).
 */
public interface FlowStep {

    /** Prefix of the names given to unassigned intermediate results of a method chain. */
    String SYNTHETIC_PREFIX = "_chain_";

    /** True for analyzer-generated intermediate names, which never become dataset names. */
    static boolean isSyntheticName(String name) {
        return name != null && name.startsWith(SYNTHETIC_PREFIX);
    }

    /** Variable or dataset names read by this step, primary source first. */
    List<String> sourceNames();

    /** Variable or dataset name written by this step; null when the step has no result. */
    String targetName();

    List<Integer> sourceLines();

    /** True when no visual recipe expresses the step and it must run as code. */
    boolean requiresCodeRecipe();

    /** Source snippet the step was derived from, when known. */
    String sourceCode();
}
