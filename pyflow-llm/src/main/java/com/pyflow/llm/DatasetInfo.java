package com.pyflow.llm;

import com.pyflow.model.DatasetRole;

import java.util.List;

/**
 * Dataset the model identified in the code.
 *
 * @param source file path or table the data comes from, or {@code derived}
 */
public record DatasetInfo(String name, DatasetRole role, String source, List<String> columns) {

    public DatasetInfo {
        name = name != null ? name : "";
        role = role != null ? role : DatasetRole.INTERMEDIATE;
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public boolean isInput() {
        return role == DatasetRole.INPUT;
    }

    public boolean isOutput() {
        return role == DatasetRole.OUTPUT;
    }
}
