package com.pyflow.model;

import com.pyflow.model.graph.FlowGraph;
import com.pyflow.model.graph.FlowValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A complete dataset + recipe graph produced for one source script. Datasets and recipes keep
 * insertion order; adjacency is derived on demand through {@link FlowGraph}.
 * <p>
 * Mutated by the assembler while it is built and in place by the optimizer; treated as read-only
 * afterwards.
 */
public final class Flow {

    private final String name;
    private String sourceName;
    private final Map<String, Dataset> datasets = new LinkedHashMap<>();
    private final List<Recipe> recipes = new ArrayList<>();
    private final List<FlowWarning> warnings = new ArrayList<>();
    private final List<FlowRecommendation> recommendations = new ArrayList<>();
    private final List<String> optimizationNotes = new ArrayList<>();

    public Flow(String name) {
        this.name = name != null && !name.isBlank() ? name : "converted_flow";
    }

    public String getName() {
        return name;
    }

    /** File name or label of the analyzed script, when known. */
    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    // datasets

    /** Adds the dataset unless one with the same name exists; returns the dataset held by the flow. */
    public Dataset addDataset(Dataset dataset) {
        Dataset existing = datasets.putIfAbsent(dataset.getName(), dataset);
        return existing != null ? existing : dataset;
    }

    public Dataset getDataset(String datasetName) {
        return datasetName == null ? null : datasets.get(datasetName);
    }

    public boolean hasDataset(String datasetName) {
        return datasetName != null && datasets.containsKey(datasetName);
    }

    public boolean removeDataset(String datasetName) {
        return datasets.remove(datasetName) != null;
    }

    public List<Dataset> getDatasets() {
        return List.copyOf(datasets.values());
    }

    public List<Dataset> getDatasets(DatasetRole role) {
        List<Dataset> out = new ArrayList<>();
        for (Dataset d : datasets.values()) {
            if (d.getRole() == role) out.add(d);
        }
        return out;
    }

    public List<Dataset> getInputDatasets() {
        return getDatasets(DatasetRole.INPUT);
    }

    public List<Dataset> getIntermediateDatasets() {
        return getDatasets(DatasetRole.INTERMEDIATE);
    }

    public List<Dataset> getOutputDatasets() {
        return getDatasets(DatasetRole.OUTPUT);
    }

    // recipes

    public void addRecipe(Recipe recipe) {
        Objects.requireNonNull(recipe, "recipe");
        if (getRecipe(recipe.getName()) != null) {
            throw new IllegalArgumentException("Recipe '" + recipe.getName() + "' already exists in flow '" + name + "'");
        }
        recipes.add(recipe);
    }

    public Recipe getRecipe(String recipeName) {
        for (Recipe r : recipes) {
            if (r.getName().equals(recipeName)) return r;
        }
        return null;
    }

    public boolean removeRecipe(String recipeName) {
        return recipes.removeIf(r -> r.getName().equals(recipeName));
    }

    public List<Recipe> getRecipes() {
        return List.copyOf(recipes);
    }

    public List<Recipe> getRecipesOfType(RecipeType type) {
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : recipes) {
            if (r.getType() == type) out.add(r);
        }
        return out;
    }

    /** Recipes listing the dataset among their outputs. */
    public List<Recipe> producersOf(String datasetName) {
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : recipes) {
            if (r.getOutputs().contains(datasetName)) out.add(r);
        }
        return out;
    }

    /** Recipes listing the dataset among their inputs. */
    public List<Recipe> consumersOf(String datasetName) {
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : recipes) {
            if (r.getInputs().contains(datasetName)) out.add(r);
        }
        return out;
    }

    // notes

    public void addWarning(FlowWarning warning) {
        if (warning != null && !warnings.contains(warning)) warnings.add(warning);
    }

    public void addWarning(Severity severity, String message) {
        addWarning(new FlowWarning(severity, message));
    }

    public List<FlowWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Adds the recommendation unless one with the same type and message is already present.
     *
     * @return true when it was added
     */
    public boolean addRecommendation(FlowRecommendation recommendation) {
        for (FlowRecommendation r : recommendations) {
            if (r.type().equals(recommendation.type()) && r.message().equals(recommendation.message())) return false;
        }
        recommendations.add(recommendation);
        return true;
    }

    public List<FlowRecommendation> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public void addOptimizationNote(String note) {
        if (note != null && !note.isBlank()) optimizationNotes.add(note);
    }

    public List<String> getOptimizationNotes() {
        return Collections.unmodifiableList(optimizationNotes);
    }

    // graph

    public FlowGraph graph() {
        return FlowGraph.of(this);
    }

    /** Cycles in the dataset/recipe graph; empty for a DAG. */
    public List<List<String>> detectCycles() {
        return graph().detectCycles();
    }

    /**
     * All dataset and recipe names in an order where every edge points forward.
     *
     * @throws CyclicFlowException when the graph has a cycle
     */
    public List<String> topologicalSort() {
        FlowGraph g = graph();
        List<String> order = g.topologicalOrder();
        if (order == null) throw new CyclicFlowException(name, g.detectCycles());
        return order;
    }

    /**
     * Traces a column back to the dataset it originates from.
     *
     * @param dataset dataset holding the column; null for the last output dataset
     * @throws IllegalArgumentException when the dataset is not in the flow
     */
    public ColumnLineage columnLineage(String column, String dataset) {
        return ColumnLineage.trace(this, column, dataset);
    }

    /** Structural problems of this flow; empty when valid. */
    public List<String> validate() {
        return FlowValidator.validate(this);
    }

    /** @throws FlowValidationException listing every problem when the flow is not valid */
    public void requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) throw new FlowValidationException(name, problems);
    }

    /** One-line summary, e.g. {@code "converted_flow: 3 datasets (1 input, 1 output), 2 recipes"}. */
    public String summary() {
        return String.format("%s: %d datasets (%d input, %d output), %d recipes",
                name, datasets.size(), getInputDatasets().size(), getOutputDatasets().size(), recipes.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Flow other)) return false;
        return name.equals(other.name)
                && Objects.equals(sourceName, other.sourceName)
                && getDatasets().equals(other.getDatasets())
                && recipes.equals(other.recipes)
                && warnings.equals(other.warnings)
                && recommendations.equals(other.recommendations)
                && optimizationNotes.equals(other.optimizationNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sourceName, datasets.keySet(), recipes);
    }

    @Override
    public String toString() {
        return "Flow{" + summary() + "}";
    }
}
