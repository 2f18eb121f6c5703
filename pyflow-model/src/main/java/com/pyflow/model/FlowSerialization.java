package com.pyflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pyflow.model.settings.RecipeSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Export and import of a {@link Flow} as a nested map with stable keys, and as JSON over the same
 * shape. Optional fields are omitted rather than written as null. {@code fromMap(toMap(flow))}
 * equals the original flow.
 */
public final class FlowSerialization {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private FlowSerialization() {
    }

    /** Nested-map form of the flow. */
    public static Map<String, Object> toMap(Flow flow) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("name", flow.getName());
        if (flow.getSourceName() != null) root.put("source", flow.getSourceName());
        List<Object> datasets = new ArrayList<>();
        for (Dataset d : flow.getDatasets()) datasets.add(datasetToMap(d));
        root.put("datasets", datasets);
        List<Object> recipes = new ArrayList<>();
        for (Recipe r : flow.getRecipes()) recipes.add(recipeToMap(r));
        root.put("recipes", recipes);
        List<Object> warnings = new ArrayList<>();
        for (FlowWarning w : flow.getWarnings()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("severity", w.severity().toValue());
            m.put("message", w.message());
            warnings.add(m);
        }
        root.put("warnings", warnings);
        List<Object> recommendations = new ArrayList<>();
        for (FlowRecommendation rec : flow.getRecommendations()) recommendations.add(MAPPER.convertValue(rec, MAP_TYPE));
        root.put("recommendations", recommendations);
        root.put("optimization_notes", new ArrayList<>(flow.getOptimizationNotes()));
        return root;
    }

    private static Map<String, Object> datasetToMap(Dataset d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", d.getName());
        m.put("type", d.getRole().toValue());
        List<Object> schema = new ArrayList<>();
        for (ColumnSchema c : d.getSchema()) {
            Map<String, Object> col = new LinkedHashMap<>();
            col.put("name", c.name());
            col.put("type", c.type());
            col.put("nullable", c.nullable());
            schema.add(col);
        }
        m.put("schema", schema);
        if (d.getSourceVariable() != null) m.put("source_variable", d.getSourceVariable());
        if (d.getSourceLine() != null) m.put("source_line", d.getSourceLine());
        if (d.getLocation() != null) m.put("location", d.getLocation());
        m.put("notes", new ArrayList<>(d.getNotes()));
        return m;
    }

    private static Map<String, Object> recipeToMap(Recipe r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", r.getName());
        m.put("type", r.getType().toValue());
        m.put("inputs", new ArrayList<>(r.getInputs()));
        m.put("outputs", new ArrayList<>(r.getOutputs()));
        m.put("settings", MAPPER.convertValue(r.getSettings(), MAP_TYPE));
        m.put("source_lines", new ArrayList<>(r.getSourceLines()));
        m.put("notes", new ArrayList<>(r.getNotes()));
        return m;
    }

    /**
     * Rebuilds a flow from its nested-map form. Input and output roles are restored as declared
     * roles so a later finalization keeps them.
     *
     * @throws IllegalArgumentException when a required key is missing or has the wrong shape
     */
    public static Flow fromMap(Map<String, ?> map) {
        if (map == null) throw new IllegalArgumentException("flow map is required");
        Flow flow = new Flow(asString(map.get("name")));
        flow.setSourceName(asString(map.get("source")));
        for (Map<String, ?> dm : asMapList(map.get("datasets"), "datasets")) flow.addDataset(datasetFromMap(dm));
        for (Map<String, ?> rm : asMapList(map.get("recipes"), "recipes")) flow.addRecipe(recipeFromMap(rm));
        for (Map<String, ?> wm : asMapList(map.get("warnings"), "warnings")) {
            flow.addWarning(new FlowWarning(Severity.fromValue(asString(wm.get("severity"))), asString(wm.get("message"))));
        }
        for (Map<String, ?> rec : asMapList(map.get("recommendations"), "recommendations")) {
            flow.addRecommendation(MAPPER.convertValue(rec, FlowRecommendation.class));
        }
        for (String note : asStringList(map.get("optimization_notes"))) flow.addOptimizationNote(note);
        return flow;
    }

    private static Dataset datasetFromMap(Map<String, ?> m) {
        DatasetRole role = DatasetRole.fromValue(asString(m.get("type")));
        Dataset d = new Dataset(asString(m.get("name")), DatasetRole.INTERMEDIATE);
        if (role == DatasetRole.INTERMEDIATE) d.inferRole(role);
        else d.declareRole(role);
        for (Map<String, ?> col : asMapList(m.get("schema"), "schema")) {
            Object nullable = col.get("nullable");
            d.annotateColumn(new ColumnSchema(asString(col.get("name")), asString(col.get("type")),
                    nullable == null || Boolean.parseBoolean(nullable.toString())));
        }
        d.setSourceVariable(asString(m.get("source_variable")));
        d.setSourceLine(asInteger(m.get("source_line")));
        d.setLocation(asString(m.get("location")));
        for (String note : asStringList(m.get("notes"))) d.addNote(note);
        return d;
    }

    private static Recipe recipeFromMap(Map<String, ?> m) {
        RecipeType type = RecipeType.fromValue(asString(m.get("type")));
        Object rawSettings = m.get("settings");
        RecipeSettings settings = rawSettings == null
                ? RecipeSettings.emptyFor(type)
                : MAPPER.convertValue(rawSettings, RecipeSettings.settingsClassFor(type));
        Recipe r = new Recipe(asString(m.get("name")), type, asStringList(m.get("inputs")),
                asStringList(m.get("outputs")), settings);
        Object lines = m.get("source_lines");
        if (lines instanceof List<?> list) {
            for (Object line : list) r.addSourceLine(asInteger(line));
        }
        for (String note : asStringList(m.get("notes"))) r.addNote(note);
        return r;
    }

    /**
     * Serializes the flow's nested-map form to JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Flow flow) {
        try {
            return MAPPER.writeValueAsString(toMap(flow));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Same as {@link #toJson(Flow)} with indentation. */
    public static String toJsonPretty(Flow flow) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toMap(flow));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Reads a flow from JSON produced by {@link #toJson(Flow)}.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static Flow fromJson(String json) {
        try {
            return fromMap(MAPPER.readValue(json, MAP_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s && !s.isBlank()) return Integer.valueOf(s.trim());
        return null;
    }

    private static List<String> asStringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                if (o != null) out.add(o.toString());
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, ?>> asMapList(Object value, String key) {
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list, got " + value.getClass().getSimpleName());
        }
        List<Map<String, ?>> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?>)) throw new IllegalArgumentException("'" + key + "' entries must be objects");
            out.add((Map<String, ?>) o);
        }
        return out;
    }
}
