package com.pyflow.optimizer;

import java.util.List;

/**
 * What one optimizer run changed.
 *
 * @param recipesMerged        Prepare recipes folded into their upstream recipe
 * @param datasetsRemoved      intermediate datasets dropped (merged away or orphaned)
 * @param notes                the optimization notes this run added to the flow
 * @param recommendationsAdded recommendations this run added (duplicates are not counted)
 */
public record OptimizationResult(int recipesMerged, int datasetsRemoved, List<String> notes, int recommendationsAdded) {

    public OptimizationResult {
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    /** True when the run left the flow untouched. */
    public boolean isNoop() {
        return recipesMerged == 0 && datasetsRemoved == 0 && notes.isEmpty() && recommendationsAdded == 0;
    }
}
