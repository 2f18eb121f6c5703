package com.pyflow.catalog;

/**
 * What a call is made on. The same callee name means different things on different targets:
 * {@code fillna} on a dataframe fills every column, on a column only that column.
 */
public enum CallTarget {
    /** Method of a traced dataframe ({@code df.dropna()}). */
    DATAFRAME_METHOD,
    /** Method of one column or a column selection ({@code df['a'].fillna(0)}). */
    COLUMN_METHOD,
    /** {@code .str} accessor member of a column. */
    STRING_ACCESSOR,
    /** {@code .dt} accessor member of a column. */
    DATETIME_ACCESSOR,
    /** Method of a pending {@code groupby}. */
    GROUPBY_METHOD,
    /** Method of a pending {@code rolling} / {@code expanding} window. */
    WINDOW_METHOD,
    /** Module-level function or class, by qualified name ({@code pandas.read_csv}). */
    MODULE_FUNCTION,
    /** Method of an estimator instance ({@code scaler.fit_transform(X)}). */
    ESTIMATOR_METHOD
}
