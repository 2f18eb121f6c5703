package com.pyflow.model.graph;

import com.pyflow.model.Dataset;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a finished flow. Returns problems as text; {@link Flow#requireValid()}
 * turns a non-empty result into a {@link com.pyflow.model.FlowValidationException}.
 */
public final class FlowValidator {

    private FlowValidator() {
    }

    public static List<String> validate(Flow flow) {
        List<String> problems = new ArrayList<>();
        Set<String> datasetNames = new HashSet<>();
        for (Dataset d : flow.getDatasets()) {
            if (!datasetNames.add(d.getName())) problems.add("Duplicate dataset name '" + d.getName() + "'");
        }
        Set<String> recipeNames = new HashSet<>();
        Set<String> produced = new HashSet<>();
        for (Recipe r : flow.getRecipes()) {
            if (!recipeNames.add(r.getName())) problems.add("Duplicate recipe name '" + r.getName() + "'");
            if (r.getInputs().isEmpty()) problems.add("Recipe '" + r.getName() + "' has no input dataset");
            if (r.getOutputs().isEmpty()) problems.add("Recipe '" + r.getName() + "' has no output dataset");
            for (String in : r.getInputs()) {
                if (in == null || in.isBlank()) {
                    problems.add("Recipe '" + r.getName() + "' has a blank input name");
                } else if (!datasetNames.contains(in)) {
                    problems.add("Recipe '" + r.getName() + "': input '" + in + "' not found in datasets");
                }
            }
            for (String out : r.getOutputs()) {
                if (out == null || out.isBlank()) {
                    problems.add("Recipe '" + r.getName() + "' has a blank output name");
                } else if (!datasetNames.contains(out)) {
                    problems.add("Recipe '" + r.getName() + "': output '" + out + "' not found in datasets");
                } else if (!produced.add(out)) {
                    problems.add("Dataset '" + out + "' is produced by more than one recipe");
                }
            }
            if (r.getSettings().isEmpty()) {
                problems.add("Recipe '" + r.getName() + "' has no " + r.getType().toValue() + " settings content");
            }
        }
        List<List<String>> cycles = FlowGraph.of(flow).detectCycles();
        for (List<String> cycle : cycles) problems.add("Cycle: " + String.join(" -> ", cycle));
        return problems;
    }
}
