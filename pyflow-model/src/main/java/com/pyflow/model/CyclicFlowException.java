package com.pyflow.model;

import java.util.List;

/**
 * Thrown when the dataset/recipe graph contains a cycle. Always indicates an assembler defect;
 * never worked around.
 */
public final class CyclicFlowException extends ConversionException {

    private final List<List<String>> cycles;

    public CyclicFlowException(String flowName, List<List<String>> cycles) {
        super(String.format("Flow '%s' contains %d cycle(s): %s", flowName, cycles.size(), cycles));
        this.cycles = List.copyOf(cycles);
    }

    public List<List<String>> getCycles() {
        return cycles;
    }
}
