package com.pyflow.python;

import com.pyflow.model.ConversionException;

/**
 * Thrown when the analyzed source is not valid Python (for the supported subset). Carries the
 * 1-based line and column of the offending token.
 */
public final class SourceSyntaxException extends ConversionException {

    private final int line;
    private final int column;
    private final String detail;

    public SourceSyntaxException(String detail, int line, int column) {
        super(String.format("Syntax error at line %d, column %d: %s", line, column, detail));
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Message without the position prefix. */
    public String getDetail() {
        return detail;
    }
}
