package com.pyflow.assembler;

import com.pyflow.model.ColumnSchema;
import com.pyflow.model.CyclicFlowException;
import com.pyflow.model.Dataset;
import com.pyflow.model.DatasetRole;
import com.pyflow.model.Flow;
import com.pyflow.model.FlowRecommendation;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.Severity;
import com.pyflow.model.settings.CodeSettings;
import com.pyflow.model.settings.PrepareSettings;
import com.pyflow.model.settings.RecipeSettings;
import com.pyflow.model.settings.SyncSettings;
import com.pyflow.model.transform.FlowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Graph construction shared by the static and semantic assemblers. Subclasses translate one
 * analyzer step into a {@link RecipeDraft}; this class owns everything that must behave the same
 * on both paths:
 * <ul>
 *   <li>binding analyzer names to datasets and naming new datasets ({@link DatasetNames})</li>
 *   <li>recipe naming ({@link RecipeNamer})</li>
 *   <li>appending consecutive Prepare steps to the open Prepare recipe</li>
 *   <li>code recipes for untranslatable steps, with a warning and a {@code PYTHON_FALLBACK} recommendation</li>
 *   <li>placeholder inputs for names no earlier step produced</li>
 *   <li>dataset roles and the cycle check at the end</li>
 * </ul>
 * Not thread-safe; one instance per conversion. {@link #assemble(List)} resets all per-run state.
 *
 * @param <T> step record of the analyzer path
 */
public abstract class AbstractFlowAssembler<T extends FlowStep> implements FlowAssembler<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractFlowAssembler.class);

    public static final String DEFAULT_FLOW_NAME = "converted_flow";
    public static final String PYTHON_FALLBACK = "PYTHON_FALLBACK";

    private static final Map<RecipeType, String> OUTPUT_SUFFIXES = Map.ofEntries(
            Map.entry(RecipeType.PREPARE, "prepared"),
            Map.entry(RecipeType.SYNC, "copy"),
            Map.entry(RecipeType.GROUPING, "grouped"),
            Map.entry(RecipeType.WINDOW, "windowed"),
            Map.entry(RecipeType.JOIN, "joined"),
            Map.entry(RecipeType.STACK, "stacked"),
            Map.entry(RecipeType.SPLIT, "split"),
            Map.entry(RecipeType.SORT, "sorted"),
            Map.entry(RecipeType.DISTINCT, "distinct"),
            Map.entry(RecipeType.TOP_N, "top"),
            Map.entry(RecipeType.PIVOT, "pivoted"),
            Map.entry(RecipeType.SAMPLING, "sampled"),
            Map.entry(RecipeType.PYTHON, "processed"),
            Map.entry(RecipeType.PREDICTION_SCORING, "scored"));

    private static final Map<String, String> PLATFORM_TYPES = Map.ofEntries(
            Map.entry("int", "bigint"),
            Map.entry("int8", "tinyint"),
            Map.entry("int16", "smallint"),
            Map.entry("int32", "int"),
            Map.entry("int64", "bigint"),
            Map.entry("integer", "bigint"),
            Map.entry("bigint", "bigint"),
            Map.entry("float", "double"),
            Map.entry("float32", "float"),
            Map.entry("float64", "double"),
            Map.entry("double", "double"),
            Map.entry("numeric", "double"),
            Map.entry("decimal", "double"),
            Map.entry("str", "string"),
            Map.entry("string", "string"),
            Map.entry("object", "string"),
            Map.entry("category", "string"),
            Map.entry("text", "string"),
            Map.entry("bool", "boolean"),
            Map.entry("boolean", "boolean"),
            Map.entry("datetime", "date"),
            Map.entry("datetime64", "date"),
            Map.entry("datetime64[ns]", "date"),
            Map.entry("date", "date"),
            Map.entry("timestamp", "date"));

    private final String flowName;
    private final RecipeNamer namer;

    private Flow flow;
    private final Map<String, String> bindings = new LinkedHashMap<>();
    private Recipe openPrepare;
    private boolean provisionalOutput;

    protected AbstractFlowAssembler(String flowName, RecipeNamer namer) {
        this.flowName = flowName != null && !flowName.isBlank() ? flowName : DEFAULT_FLOW_NAME;
        this.namer = namer != null ? namer : RecipeNamer.plain();
    }

    /** Translates one step; called in step order while the flow is being built. */
    protected abstract RecipeDraft draft(T step);

    /** Called on the empty flow before the first step. */
    protected void beforeSteps(Flow flow) {
    }

    /** Called after the last step, before roles are resolved. */
    protected void afterSteps(Flow flow) {
    }

    @Override
    public final Flow assemble(List<T> steps) {
        Objects.requireNonNull(steps, "steps");
        flow = new Flow(flowName);
        bindings.clear();
        namer.reset();
        closePrepare();

        beforeSteps(flow);
        for (T step : steps) {
            apply(draftSafely(step), step);
        }
        closePrepare();
        afterSteps(flow);
        resolveRoles();

        List<List<String>> cycles = flow.detectCycles();
        if (!cycles.isEmpty()) throw new CyclicFlowException(flow.getName(), cycles);
        log.info("Flow assembled | flow={} | steps={} | datasets={} | recipes={} | warnings={}",
                flow.getName(), steps.size(), flow.getDatasets().size(), flow.getRecipes().size(), flow.getWarnings().size());
        return flow;
    }

    /** Flow under construction; only valid while {@link #assemble(List)} runs. */
    protected final Flow flow() {
        return flow;
    }

    /** Code draft carrying the step's own source text. */
    protected RecipeDraft.Builder codeFallback(T step, String reason) {
        List<String> targets = step.targetName() != null ? List.of(step.targetName()) : List.of();
        String code = step.sourceCode() != null ? step.sourceCode() : "";
        return RecipeDraft.code(step.sourceNames(), targets, code, reason).lines(step.sourceLines());
    }

    /** Records a WARNING on the flow. */
    protected final void warn(String message) {
        flow.addWarning(Severity.WARNING, message);
    }

    /**
     * Platform column type for a pandas dtype or loose type name ({@code int64} to {@code bigint},
     * {@code float} to {@code double}, {@code datetime64[ns]} to {@code date}). Unknown names are
     * returned lower-cased.
     */
    protected static String platformType(String dtype) {
        if (dtype == null || dtype.isBlank()) return "string";
        String key = dtype.trim().toLowerCase(Locale.ROOT)
                .replace("np.", "").replace("numpy.", "").replace("pd.", "").replace("'", "").replace("\"", "");
        String mapped = PLATFORM_TYPES.get(key);
        if (mapped != null) return mapped;
        if (key.startsWith("datetime")) return "date";
        if (key.startsWith("int") || key.startsWith("uint")) return "bigint";
        if (key.startsWith("float")) return "double";
        return key;
    }

    /** Suffix for outputs named after their input, e.g. {@code sorted} in {@code sales_sorted}. */
    static String outputSuffix(RecipeType type) {
        return OUTPUT_SUFFIXES.getOrDefault(type, "output");
    }

    private RecipeDraft draftSafely(T step) {
        try {
            return draft(step);
        } catch (IllegalArgumentException | ClassCastException e) {
            log.warn("Step parameters not translatable | step={} | error={} | using a code recipe", step, e.getMessage());
            return codeFallback(step, "parameters could not be translated (" + e.getMessage() + ")").build();
        }
    }

    private void apply(RecipeDraft draft, T step) {
        switch (draft.action()) {
            case READ -> read(draft);
            case WRITE -> write(draft);
            case PREPARE -> prepare(draft);
            case RECIPE -> recipe(draft);
            case CODE -> code(draft);
            case SKIP -> log.debug("Step skipped | step={} | reason={}", step, draft.reason());
        }
    }

    // ------------------------------------------------------------------ datasets

    private void read(RecipeDraft d) {
        String target = d.primaryTarget();
        String base = d.datasetName() != null ? d.datasetName() : target;
        String name = DatasetNames.sanitize(base);
        Dataset existing = flow.getDataset(name);
        boolean sameSource = existing != null && existing.isInput() && d.location() != null
                && d.location().equals(existing.getLocation());
        if (!sameSource) {
            name = uniqueName(base);
            Dataset ds = Dataset.input(name);
            ds.setLocation(d.location());
            ds.setSourceVariable(target);
            ds.setSourceLine(firstLine(d));
            d.notes().forEach(ds::addNote);
            flow.addDataset(ds);
        }
        annotate(name, d.columns());
        if (target != null) bind(target, name);
        log.debug("Input dataset | name={} | location={} | variable={}", name, d.location(), target);
    }

    private void write(RecipeDraft d) {
        closePrepare();
        if (d.primarySource() == null) {
            warn("Write" + lineSuffix(d) + " has no traced source; ignored");
            return;
        }
        String input = resolve(d.primarySource());
        Dataset ds = flow.getDataset(input);
        if (ds.isInput()) {
            String output = uniqueName(d.datasetName() != null ? d.datasetName() : input + "_" + outputSuffix(RecipeType.SYNC));
            Recipe sync = new Recipe(namer.next(RecipeType.SYNC), RecipeType.SYNC, List.of(input), List.of(output), new SyncSettings());
            Dataset written = new Dataset(output, DatasetRole.OUTPUT);
            written.declareRole(DatasetRole.OUTPUT);
            written.setLocation(d.location());
            written.setSourceLine(firstLine(d));
            flow.addDataset(written);
            d.lines().forEach(sync::addSourceLine);
            sync.addNote("input written out unchanged");
            flow.addRecipe(sync);
            log.debug("Input copied to output | recipe={} | {} -> {}", sync.getName(), input, output);
            return;
        }
        ds.declareRole(DatasetRole.OUTPUT);
        if (ds.getLocation() == null) {
            ds.setLocation(d.location());
        } else if (d.location() != null && !d.location().equals(ds.getLocation())) {
            ds.addNote("also written to " + d.location());
        }
        log.debug("Output dataset | name={} | location={}", input, d.location());
    }

    /** Dataset bound to the name; unknown names get a placeholder input and a warning. */
    private String resolve(String name) {
        String bound = bindings.get(name);
        if (bound != null && flow.hasDataset(bound)) return bound;
        String placeholder = uniqueName(FlowStep.isSyntheticName(name) ? "unresolved_input" : name);
        Dataset ds = Dataset.input(placeholder);
        ds.setSourceVariable(name);
        ds.addNote("placeholder for a source no earlier step produced");
        flow.addDataset(ds);
        bind(name, placeholder);
        warn(String.format("'%s' is used before any step produces it; added placeholder input dataset '%s'", name, placeholder));
        log.warn("Unresolved source | name={} | placeholder={}", name, placeholder);
        return placeholder;
    }

    private List<String> resolveAll(List<String> names) {
        List<String> out = new ArrayList<>();
        for (String n : names) {
            String ds = resolve(n);
            if (!out.contains(ds)) out.add(ds);
        }
        return out;
    }

    private void bind(String name, String dataset) {
        bindings.put(name, dataset);
    }

    /** Sanitized base name, suffixed {@code _2}, {@code _3}... while taken. */
    protected final String uniqueName(String base) {
        return uniqueName(base, Set.of());
    }

    private String uniqueName(String base, Collection<String> pending) {
        String name = DatasetNames.sanitize(base);
        if (!flow.hasDataset(name) && !pending.contains(name)) return name;
        for (int i = 2; ; i++) {
            String candidate = name + "_" + i;
            if (!flow.hasDataset(candidate) && !pending.contains(candidate)) return candidate;
        }
    }

    private String outputName(String target, String source, String input, RecipeType type, Collection<String> pending) {
        if (isUserName(target) && !target.equals(source)) return uniqueName(target, pending);
        return uniqueName(input + "_" + outputSuffix(type), pending);
    }

    private static boolean isUserName(String name) {
        return name != null && !FlowStep.isSyntheticName(name);
    }

    /**
     * Declares an external input dataset up front and binds the analyzer name to it.
     *
     * @param name        analyzer-side name
     * @param datasetName preferred dataset name, or null to use {@code name}
     * @param location    file or table the data comes from, or null
     * @return the dataset name actually used
     */
    protected final String declareInput(String name, String datasetName, String location) {
        String dataset = uniqueName(datasetName != null ? datasetName : name);
        Dataset ds = Dataset.input(dataset);
        ds.setLocation(location);
        ds.setSourceVariable(name);
        flow.addDataset(ds);
        bind(name, dataset);
        log.debug("Declared input | name={} | dataset={} | location={}", name, dataset, location);
        return dataset;
    }

    /** Dataset currently bound to an analyzer name, or null. */
    protected final String boundDataset(String name) {
        return bindings.get(name);
    }

    // ------------------------------------------------------------------ recipes

    private void prepare(RecipeDraft d) {
        if (d.primarySource() == null) {
            sourceless(d);
            return;
        }
        String sourceName = d.primarySource();
        String input = resolve(sourceName);
        String target = d.primaryTarget() != null ? d.primaryTarget() : sourceName;
        annotate(input, d.columns());

        if (canAppend(input, target)) {
            d.steps().forEach(openPrepare::addStep);
            d.lines().forEach(openPrepare::addSourceLine);
            d.notes().forEach(openPrepare::addNote);
            String output = input;
            if (provisionalOutput && isUserName(target) && !target.equals(sourceName)
                    && !DatasetNames.sanitize(target).equals(input)) {
                output = renameDataset(input, uniqueName(target), target);
                provisionalOutput = false;
            }
            bind(target, output);
            annotateTypes(output, d.columnTypes());
            log.debug("Prepare steps appended | recipe={} | added={} | total={}",
                    openPrepare.getName(), d.steps().size(), openPrepare.getSteps().size());
            return;
        }

        closePrepare();
        String output = outputName(target, sourceName, input, RecipeType.PREPARE, Set.of());
        Recipe recipe = new Recipe(namer.next(RecipeType.PREPARE), RecipeType.PREPARE, List.of(input), List.of(output),
                PrepareSettings.empty());
        d.steps().forEach(recipe::addStep);
        register(recipe, d, List.of(output), List.of(target));
        openPrepare = recipe;
        provisionalOutput = !isUserName(target) || target.equals(sourceName);
        log.debug("Prepare recipe opened | recipe={} | {} -> {}", recipe.getName(), input, output);
    }

    /**
     * True when the open Prepare recipe produces the input and no other user-visible name still
     * refers to that dataset (appending would change what that name holds).
     */
    private boolean canAppend(String input, String target) {
        if (openPrepare == null || !openPrepare.getOutputs().equals(List.of(input))) return false;
        for (Map.Entry<String, String> e : bindings.entrySet()) {
            if (e.getValue().equals(input) && isUserName(e.getKey()) && !e.getKey().equals(target)) return false;
        }
        return true;
    }

    private String renameDataset(String from, String to, String variable) {
        Dataset old = flow.getDataset(from);
        Dataset renamed = new Dataset(to, old.getRole());
        if (old.isRoleExplicit()) renamed.declareRole(old.getRole());
        renamed.setSourceVariable(variable);
        renamed.setSourceLine(old.getSourceLine());
        renamed.setLocation(old.getLocation());
        old.getSchema().forEach(renamed::annotateColumn);
        old.getNotes().forEach(renamed::addNote);
        flow.removeDataset(from);
        flow.addDataset(renamed);
        for (Recipe r : flow.getRecipes()) {
            r.replaceInput(from, to);
            r.replaceOutput(from, to);
        }
        bindings.replaceAll((name, ds) -> ds.equals(from) ? to : ds);
        log.debug("Dataset renamed | {} -> {}", from, to);
        return to;
    }

    private void closePrepare() {
        openPrepare = null;
        provisionalOutput = false;
    }

    private void recipe(RecipeDraft d) {
        closePrepare();
        RecipeType type = d.type() != null ? d.type() : RecipeType.PYTHON;
        RecipeSettings settings = d.settings() != null ? d.settings() : RecipeSettings.emptyFor(type);
        if (!RecipeSettings.settingsClassFor(type).isInstance(settings)) {
            log.warn("Settings do not fit recipe type | type={} | settings={}", type.toValue(), settings.getClass().getSimpleName());
            code(RecipeDraft.code(d.sources(), d.targets(), null, type.toValue() + " settings could not be built")
                    .lines(d.lines()).columns(d.columns()).notes(d.notes()).build());
            return;
        }
        build(d, type, settings);
    }

    private void code(RecipeDraft d) {
        closePrepare();
        String reason = d.reason() != null ? d.reason() : "no visual recipe expresses this step";
        String code = d.code() != null && !d.code().isBlank() ? d.code() : "# " + reason;
        Recipe recipe = build(d, RecipeType.PYTHON, new CodeSettings(code));
        if (recipe == null) return;
        recipe.addNote(reason);
        warn(String.format("Recipe '%s'%s runs untranslated code: %s", recipe.getName(), lineSuffix(d), reason));
        flow.addRecommendation(new FlowRecommendation(PYTHON_FALLBACK, "MEDIUM",
                String.format("Code recipe '%s' could not be expressed visually: %s", recipe.getName(), reason),
                "Code recipes are opaque to lineage and harder to maintain",
                "Review the code and replace it with visual recipes where possible"));
        log.warn("Code recipe | recipe={} | lines={} | reason={}", recipe.getName(), d.lines(), reason);
    }

    /** Resolves inputs, names outputs and adds the recipe; null when the draft has no input. */
    private Recipe build(RecipeDraft d, RecipeType type, RecipeSettings settings) {
        List<String> inputs = resolveAll(d.sources());
        if (inputs.isEmpty()) {
            sourceless(d);
            return null;
        }
        annotate(inputs.get(0), d.columns());
        List<String> targets = new ArrayList<>(d.targets());
        if (targets.isEmpty()) targets.add(null);
        List<String> outputs = new ArrayList<>();
        for (String t : targets) outputs.add(outputName(t, d.primarySource(), inputs.get(0), type, outputs));

        Recipe recipe = new Recipe(namer.next(type), type, inputs, outputs, settings);
        register(recipe, d, outputs, targets);
        log.debug("Recipe | name={} | type={} | {} -> {}", recipe.getName(), type.toValue(), inputs, outputs);
        return recipe;
    }

    private void register(Recipe recipe, RecipeDraft d, List<String> outputs, List<String> targets) {
        for (int i = 0; i < outputs.size(); i++) {
            String target = targets.get(i);
            Dataset ds = Dataset.intermediate(outputs.get(i));
            if (isUserName(target)) ds.setSourceVariable(target);
            ds.setSourceLine(firstLine(d));
            flow.addDataset(ds);
            annotateTypes(ds.getName(), d.columnTypes());
            if (target != null) bind(target, ds.getName());
        }
        d.lines().forEach(recipe::addSourceLine);
        d.notes().forEach(recipe::addNote);
        flow.addRecipe(recipe);
    }

    /** A step whose result comes from nothing traced becomes an input dataset. */
    private void sourceless(RecipeDraft d) {
        String target = d.primaryTarget();
        if (target == null) {
            warn("Step" + lineSuffix(d) + " has neither a traced input nor a result; dropped");
            return;
        }
        String name = uniqueName(FlowStep.isSyntheticName(target) ? "unresolved_input" : target);
        Dataset ds = Dataset.input(name);
        ds.setSourceVariable(target);
        ds.setSourceLine(firstLine(d));
        ds.addNote("created without a traced input" + (d.code() != null ? ": " + d.code() : ""));
        flow.addDataset(ds);
        bind(target, name);
        warn(String.format("'%s'%s is created without a traced input; treated as input dataset '%s'",
                target, lineSuffix(d), name));
    }

    // ------------------------------------------------------------------ schema and roles

    private void annotate(String dataset, List<String> columns) {
        Dataset ds = flow.getDataset(dataset);
        if (ds == null) return;
        for (String c : columns) {
            if (!ds.hasColumn(c)) ds.annotateColumn(new ColumnSchema(c, null, true));
        }
    }

    private void annotateTypes(String dataset, Map<String, String> types) {
        Dataset ds = flow.getDataset(dataset);
        if (ds == null) return;
        types.forEach((column, type) -> ds.annotateColumn(new ColumnSchema(column, type, true)));
    }

    /** Unproduced datasets are inputs, unconsumed ones outputs; roles declared by reads and writes stay. */
    private void resolveRoles() {
        Set<String> produced = new HashSet<>();
        Set<String> consumed = new HashSet<>();
        for (Recipe r : flow.getRecipes()) {
            produced.addAll(r.getOutputs());
            consumed.addAll(r.getInputs());
        }
        for (Dataset d : flow.getDatasets()) {
            DatasetRole role = !produced.contains(d.getName()) ? DatasetRole.INPUT
                    : !consumed.contains(d.getName()) ? DatasetRole.OUTPUT
                    : DatasetRole.INTERMEDIATE;
            d.inferRole(role);
        }
    }

    private static Integer firstLine(RecipeDraft d) {
        return d.lines().isEmpty() ? null : d.lines().get(0);
    }

    private static String lineSuffix(RecipeDraft d) {
        return d.lines().isEmpty() ? "" : " (line " + d.lines().get(0) + ")";
    }
}
