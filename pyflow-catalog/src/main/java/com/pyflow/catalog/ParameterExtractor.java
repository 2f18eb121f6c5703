package com.pyflow.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw call arguments into the ordered parameter map of a transformation. A {@code columns}
 * entry holding a list of names is lifted by the analyzer into the transformation's columns.
 */
@FunctionalInterface
public interface ParameterExtractor {

    ParameterExtractor NONE = args -> new LinkedHashMap<>();

    Map<String, Object> extract(CallArguments args);
}
