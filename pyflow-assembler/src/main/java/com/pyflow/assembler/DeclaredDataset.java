package com.pyflow.assembler;

import com.pyflow.model.DatasetRole;

import java.util.List;

/**
 * Dataset the semantic analysis reported up front, before any step.
 *
 * @param name     analyzer-side name, usually the dataframe variable
 * @param role     role the model reported
 * @param location file path or table, or null for derived data
 * @param columns  columns the model inferred
 */
public record DeclaredDataset(String name, DatasetRole role, String location, List<String> columns) {

    public DeclaredDataset {
        role = role != null ? role : DatasetRole.INTERMEDIATE;
        columns = columns != null ? List.copyOf(columns) : List.of();
        if (location != null && (location.isBlank() || location.equalsIgnoreCase("derived"))) location = null;
    }
}
