package com.pyflow.config;

import com.pyflow.model.ConversionException;

/**
 * Thrown when an environment variable holds a value the converter cannot use.
 */
public final class ConfigurationException extends ConversionException {

    private final String variable;
    private final String value;

    public ConfigurationException(String variable, String value, String expected) {
        super(String.format("Invalid value for %s: '%s' (expected %s)", variable, value, expected));
        this.variable = variable;
        this.value = value;
    }

    public ConfigurationException(String variable, String value, String expected, Throwable cause) {
        super(String.format("Invalid value for %s: '%s' (expected %s)", variable, value, expected), cause);
        this.variable = variable;
        this.value = value;
    }

    public String getVariable() {
        return variable;
    }

    public String getValue() {
        return value;
    }
}
