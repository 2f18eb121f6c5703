package com.pyflow.model;

/**
 * Base type for every failure surfaced by the conversion pipeline. Subtypes distinguish
 * syntax errors, provider failures, unparseable model replies, cyclic flows and validation
 * failures so callers can react to each separately.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
