package com.pyflow.model.transform;

/**
 * Keys of {@link Transformation#parameters()}. Pattern rules write them, the static assembler
 * reads them; values are plain JSON-compatible objects (strings, numbers, booleans, lists, maps).
 */
public final class Params {

    // io
    public static final String PATH = "path";
    public static final String FORMAT = "format";

    // columns
    public static final String COLUMN = "column";
    public static final String COLUMNS = "columns";
    public static final String OUTPUT = "output";
    public static final String MAPPING = "mapping";
    public static final String ASSIGNMENTS = "assignments";

    // values and expressions
    public static final String VALUE = "value";
    public static final String METHOD = "method";
    public static final String DTYPE = "dtype";
    public static final String EXPRESSION = "expression";
    public static final String CONDITION = "condition";
    public static final String OPERATOR = "operator";
    public static final String THEN = "then";
    public static final String OTHERWISE = "otherwise";
    public static final String FIND = "find";
    public static final String REPLACE = "replace";
    public static final String PATTERN = "pattern";
    public static final String REGEX = "regex";
    public static final String SEPARATOR = "separator";
    public static final String DECIMALS = "decimals";
    public static final String LOWER = "lower";
    public static final String UPPER = "upper";
    public static final String BINS = "bins";
    public static final String LABELS = "labels";
    public static final String COMPONENT = "component";
    public static final String HOW = "how";
    public static final String KEEP = "keep";

    // reshaping and ordering
    public static final String KEYS = "keys";
    public static final String AGGREGATIONS = "aggregations";
    public static final String FUNCTION = "function";
    public static final String WINDOW = "window";
    public static final String WINDOW_MODE = "window_mode";
    public static final String PERIODS = "periods";
    public static final String ON = "on";
    public static final String LEFT_ON = "left_on";
    public static final String RIGHT_ON = "right_on";
    public static final String AXIS = "axis";
    public static final String ASCENDING = "ascending";
    public static final String BY_INDEX = "by_index";
    public static final String N = "n";
    public static final String FRAC = "frac";
    public static final String RANDOM_STATE = "random_state";
    public static final String TEST_SIZE = "test_size";
    public static final String TRAIN_SIZE = "train_size";
    public static final String OUTPUTS = "outputs";
    public static final String INDEX = "index";
    public static final String PIVOT_COLUMNS = "pivot_columns";
    public static final String VALUES = "values";
    public static final String AGGFUNC = "aggfunc";
    public static final String ID_VARS = "id_vars";
    public static final String VALUE_VARS = "value_vars";

    // models and code
    public static final String ESTIMATOR = "estimator";
    public static final String STRATEGY = "strategy";
    public static final String CODE = "code";

    private Params() {
    }
}
