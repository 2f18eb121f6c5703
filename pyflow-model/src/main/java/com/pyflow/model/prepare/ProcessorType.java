package com.pyflow.model.prepare;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processor types a Prepare recipe step can have. JSON uses the platform processor name
 * (e.g. {@code "FillEmptyWithValue"}); unknown names deserialize as {@link #UNKNOWN}.
 */
public enum ProcessorType {
    // columns
    COLUMN_RENAMER("ColumnRenamer"),
    COLUMN_COPIER("ColumnCopier"),
    COLUMN_DELETER("ColumnDeleter"),
    COLUMNS_SELECTOR("ColumnsSelector"),

    // missing values
    FILL_EMPTY_WITH_VALUE("FillEmptyWithValue"),
    FILL_EMPTY_WITH_PREVIOUS_NEXT("FillEmptyWithPreviousNext"),
    FILL_EMPTY_WITH_COMPUTED_VALUE("FillEmptyWithComputedValue"),
    REMOVE_ROWS_ON_EMPTY("RemoveRowsOnEmpty"),

    // strings
    STRING_TRANSFORMER("StringTransformer"),
    REGEXP_EXTRACTOR("RegexpExtractor"),
    FIND_REPLACE("FindReplace"),
    SPLIT_COLUMN("SplitColumn"),

    // numbers
    NUMERICAL_TRANSFORMER("NumericalTransformer"),
    ROUND_COLUMN("RoundColumn"),
    ABS_COLUMN("AbsColumn"),
    CLIP_COLUMN("ClipColumn"),
    BINNER("Binner"),
    NORMALIZER("Normalizer"),

    // types and dates
    TYPE_SETTER("TypeSetter"),
    DATE_PARSER("DateParser"),
    DATE_FORMATTER("DateFormatter"),
    DATE_COMPONENTS_EXTRACTOR("DateComponentsExtractor"),

    // rows
    FILTER_ON_VALUE("FilterOnValue"),
    FILTER_ON_FORMULA("FilterOnFormula"),
    FILTER_ON_NUMERIC_RANGE("FilterOnNumericRange"),
    REMOVE_DUPLICATES("RemoveDuplicates"),

    // computed
    CREATE_COLUMN_WITH_GREL("CreateColumnWithGREL"),
    TRANSLATE_VALUES("TranslateValues"),
    IF_THEN_ELSE("IfThenElse"),
    COALESCE("Coalesce"),
    CATEGORICAL_ENCODER("CategoricalEncoder"),
    ARRAY_UNFOLD("ArrayUnfold"),

    PYTHON_UDF("PythonUDF"),
    UNKNOWN("Unknown");

    private final String value;

    ProcessorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static ProcessorType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String trimmed = value.trim();
        for (ProcessorType t : values()) {
            if (t != UNKNOWN && (t.value.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))) return t;
        }
        return UNKNOWN;
    }

    /** True for processors that remove rows (used by filter-placement recommendations). */
    public boolean isRowFilter() {
        return this == FILTER_ON_VALUE || this == FILTER_ON_FORMULA || this == FILTER_ON_NUMERIC_RANGE
                || this == REMOVE_ROWS_ON_EMPTY;
    }
}
