package com.pyflow.catalog;

/** What the analyzer does with a matched call besides reading its parameters. */
public enum RuleEffect {
    /** Emit one transformation; the result is a dataframe (or column). */
    EMIT,
    /** Hold a {@code groupby} until its aggregation link arrives. */
    PENDING_GROUP,
    /** Hold a {@code rolling} / {@code expanding} window until its aggregation link arrives. */
    PENDING_WINDOW,
    /** Result is the receiver itself ({@code copy}, {@code reset_index}); nothing is emitted. */
    PASSTHROUGH,
    /** Constructor of an estimator; binds the target as an estimator instance. */
    ESTIMATOR,
    /** Display or inspection only ({@code info}, {@code describe}, {@code plot}); skipped. */
    DISPLAY
}
