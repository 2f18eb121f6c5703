package com.pyflow.model.prepare;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One processor step of a Prepare recipe. Params keep insertion order so exports are stable.
 * Factory methods mirror the processors the assemblers emit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrepareStep(ProcessorType processorType, Map<String, Object> params, boolean disabled, Integer sourceLine) {

    private static final String META_TYPE = "PROCESSOR";

    @JsonCreator
    public PrepareStep(@JsonProperty("type") ProcessorType processorType,
                       @JsonProperty("params") Map<String, Object> params,
                       @JsonProperty("disabled") boolean disabled,
                       @JsonProperty("sourceLine") Integer sourceLine) {
        this.processorType = processorType != null ? processorType : ProcessorType.UNKNOWN;
        this.params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        this.disabled = disabled;
        this.sourceLine = sourceLine;
    }

    public PrepareStep(ProcessorType processorType, Map<String, Object> params, Integer sourceLine) {
        this(processorType, params, false, sourceLine);
    }

    @JsonProperty("type")
    public ProcessorType processorType() {
        return processorType;
    }

    @JsonProperty("metaType")
    public String metaType() {
        return META_TYPE;
    }

    /** Column the step operates on, or null when the step spans several columns. */
    @JsonIgnore
    public String column() {
        Object c = params.get("column");
        return c != null ? c.toString() : null;
    }

    /** Short description for summaries and notes, e.g. {@code "FillEmptyWithValue on 'age'"}. */
    @JsonIgnore
    public String description() {
        String column = column();
        if (column != null) return processorType.toValue() + " on '" + column + "'";
        Object columns = params.get("columns");
        if (columns instanceof List<?> list && !list.isEmpty()) return processorType.toValue() + " on " + list;
        return processorType.toValue();
    }

    public static PrepareStep fillEmpty(String column, Object value, Integer line) {
        return of(ProcessorType.FILL_EMPTY_WITH_VALUE, line, "column", column, "value", String.valueOf(value));
    }

    public static PrepareStep fillPreviousNext(String column, String direction, Integer line) {
        return of(ProcessorType.FILL_EMPTY_WITH_PREVIOUS_NEXT, line, "column", column, "direction", direction);
    }

    public static PrepareStep fillComputed(String column, String strategy, Integer line) {
        return of(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE, line, "column", column, "strategy", strategy);
    }

    /** Drops rows with an empty value in any of the columns ({@code appliesTo=ALL} when none given). */
    public static PrepareStep removeRowsOnEmpty(List<String> columns, Integer line) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("columns", columns != null ? List.copyOf(columns) : List.of());
        params.put("appliesTo", columns == null || columns.isEmpty() ? "ALL" : "COLUMNS");
        params.put("keep", false);
        return new PrepareStep(ProcessorType.REMOVE_ROWS_ON_EMPTY, params, line);
    }

    public static PrepareStep renameColumns(Map<String, String> renamings, Integer line) {
        List<Object> out = new ArrayList<>();
        renamings.forEach((from, to) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("from", from);
            entry.put("to", to);
            out.add(entry);
        });
        return of(ProcessorType.COLUMN_RENAMER, line, "renamings", out);
    }

    public static PrepareStep deleteColumns(List<String> columns, Integer line) {
        return of(ProcessorType.COLUMN_DELETER, line, "columns", List.copyOf(columns));
    }

    public static PrepareStep selectColumns(List<String> columns, Integer line) {
        return of(ProcessorType.COLUMNS_SELECTOR, line, "columns", List.copyOf(columns), "keep", true);
    }

    public static PrepareStep copyColumn(String column, String output, Integer line) {
        return of(ProcessorType.COLUMN_COPIER, line, "column", column, "outputColumn", output);
    }

    public static PrepareStep stringTransform(String column, StringTransformMode mode, Integer line) {
        return of(ProcessorType.STRING_TRANSFORMER, line, "column", column, "mode", mode.name());
    }

    public static PrepareStep findReplace(String column, String find, String replace, boolean regex, Integer line) {
        return of(ProcessorType.FIND_REPLACE, line, "column", column, "find", find, "replace", replace,
                "matching", regex ? "REGEX" : "SUBSTRING");
    }

    public static PrepareStep regexpExtract(String column, String pattern, String outputPrefix, Integer line) {
        return of(ProcessorType.REGEXP_EXTRACTOR, line, "column", column, "pattern", pattern, "prefix", outputPrefix);
    }

    public static PrepareStep splitColumn(String column, String separator, Integer line) {
        return of(ProcessorType.SPLIT_COLUMN, line, "column", column, "separator", separator);
    }

    public static PrepareStep numerical(String column, NumericalTransformMode mode, String output, Integer line) {
        return of(ProcessorType.NUMERICAL_TRANSFORMER, line, "column", column, "mode", mode.name(), "outputColumn", output);
    }

    public static PrepareStep round(String column, int decimals, Integer line) {
        return of(ProcessorType.ROUND_COLUMN, line, "column", column, "decimals", decimals);
    }

    public static PrepareStep abs(String column, Integer line) {
        return of(ProcessorType.ABS_COLUMN, line, "column", column);
    }

    public static PrepareStep clip(String column, Object lower, Object upper, Integer line) {
        return of(ProcessorType.CLIP_COLUMN, line, "column", column, "lower", lower, "upper", upper);
    }

    public static PrepareStep binner(String column, Object bins, String output, Integer line) {
        return of(ProcessorType.BINNER, line, "column", column, "bins", bins, "outputColumn", output);
    }

    public static PrepareStep normalize(String column, String method, Integer line) {
        return of(ProcessorType.NORMALIZER, line, "column", column, "mode", method);
    }

    public static PrepareStep setType(String column, String type, Integer line) {
        return of(ProcessorType.TYPE_SETTER, line, "column", column, "type", type);
    }

    public static PrepareStep parseDate(String column, String format, Integer line) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("column", column);
        if (format != null) params.put("formats", List.of(format));
        return new PrepareStep(ProcessorType.DATE_PARSER, params, line);
    }

    public static PrepareStep formatDate(String column, String format, Integer line) {
        return of(ProcessorType.DATE_FORMATTER, line, "column", column, "format", format);
    }

    public static PrepareStep dateComponent(String column, String component, String output, Integer line) {
        return of(ProcessorType.DATE_COMPONENTS_EXTRACTOR, line, "column", column, "component", component,
                "outputColumn", output);
    }

    /** Keeps (or removes) rows whose column matches one of the values. */
    public static PrepareStep filterOnValue(String column, List<?> values, String matchingMode, boolean keep, Integer line) {
        List<String> asText = new ArrayList<>();
        for (Object v : values) asText.add(String.valueOf(v));
        return of(ProcessorType.FILTER_ON_VALUE, line, "column", column, "values", asText,
                "matchingMode", matchingMode, "action", keep ? "KEEP_ROW" : "REMOVE_ROW");
    }

    public static PrepareStep filterOnRange(String column, Object min, Object max, Integer line) {
        return of(ProcessorType.FILTER_ON_NUMERIC_RANGE, line, "column", column, "min", min, "max", max,
                "action", "KEEP_ROW");
    }

    public static PrepareStep filterOnFormula(String expression, Integer line) {
        return of(ProcessorType.FILTER_ON_FORMULA, line, "expression", expression, "action", "KEEP_ROW");
    }

    public static PrepareStep removeDuplicates(List<String> columns, Integer line) {
        return of(ProcessorType.REMOVE_DUPLICATES, line, "columns", columns != null ? List.copyOf(columns) : List.of());
    }

    public static PrepareStep createColumn(String column, String expression, Integer line) {
        return of(ProcessorType.CREATE_COLUMN_WITH_GREL, line, "column", column, "expression", expression);
    }

    public static PrepareStep translateValues(String column, Map<String, Object> mapping, String output, Integer line) {
        return of(ProcessorType.TRANSLATE_VALUES, line, "column", column, "mapping", new LinkedHashMap<>(mapping),
                "outputColumn", output);
    }

    public static PrepareStep ifThenElse(String output, String condition, Object then, Object otherwise, Integer line) {
        return of(ProcessorType.IF_THEN_ELSE, line, "outputColumn", output, "condition", condition,
                "then", then, "else", otherwise);
    }

    public static PrepareStep coalesce(List<String> columns, String output, Integer line) {
        return of(ProcessorType.COALESCE, line, "columns", List.copyOf(columns), "outputColumn", output);
    }

    public static PrepareStep encode(String column, String method, Integer line) {
        return of(ProcessorType.CATEGORICAL_ENCODER, line, "column", column, "method", method);
    }

    public static PrepareStep unfold(String column, Integer line) {
        return of(ProcessorType.ARRAY_UNFOLD, line, "column", column);
    }

    public static PrepareStep pythonUdf(String code, Integer line) {
        return of(ProcessorType.PYTHON_UDF, line, "code", code, "mode", "ROW");
    }

    /** Builds a step from alternating key/value pairs, skipping null values. */
    private static PrepareStep of(ProcessorType type, Integer line, Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new PrepareStep(type, params, line);
    }
}
