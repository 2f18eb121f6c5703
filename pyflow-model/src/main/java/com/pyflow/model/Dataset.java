package com.pyflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dataset node of a {@link Flow}. Created by the assembler the first time a name is seen;
 * afterwards only its role (finalization), schema (column annotations) and notes change.
 */
public final class Dataset {

    private final String name;
    private DatasetRole role;
    private boolean roleExplicit;
    private final List<ColumnSchema> schema = new ArrayList<>();
    private String sourceVariable;
    private Integer sourceLine;
    private String location;
    private final List<String> notes = new ArrayList<>();

    public Dataset(String name, DatasetRole role) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("dataset name is required");
        this.name = name;
        this.role = role != null ? role : DatasetRole.INTERMEDIATE;
    }

    public static Dataset input(String name) {
        Dataset d = new Dataset(name, DatasetRole.INPUT);
        d.roleExplicit = true;
        return d;
    }

    public static Dataset intermediate(String name) {
        return new Dataset(name, DatasetRole.INTERMEDIATE);
    }

    public String getName() {
        return name;
    }

    public DatasetRole getRole() {
        return role;
    }

    /**
     * Sets the role inferred at finalization. Does not override a role declared by
     * {@link #declareRole(DatasetRole)} (external reads, explicit writes).
     */
    public void inferRole(DatasetRole inferred) {
        if (!roleExplicit && inferred != null) this.role = inferred;
    }

    /** Declares the role from the source (e.g. a {@code read_csv} or {@code to_csv}); sticks through finalization. */
    public void declareRole(DatasetRole declared) {
        if (declared == null) return;
        this.role = declared;
        this.roleExplicit = true;
    }

    public boolean isRoleExplicit() {
        return roleExplicit;
    }

    public boolean isInput() {
        return role == DatasetRole.INPUT;
    }

    public boolean isOutput() {
        return role == DatasetRole.OUTPUT;
    }

    public List<ColumnSchema> getSchema() {
        return Collections.unmodifiableList(schema);
    }

    /** Adds or replaces the schema entry for the column. */
    public void annotateColumn(ColumnSchema column) {
        for (int i = 0; i < schema.size(); i++) {
            if (schema.get(i).name().equals(column.name())) {
                schema.set(i, column);
                return;
            }
        }
        schema.add(column);
    }

    public boolean hasColumn(String column) {
        return schema.stream().anyMatch(c -> c.name().equals(column));
    }

    public String getSourceVariable() {
        return sourceVariable;
    }

    public void setSourceVariable(String sourceVariable) {
        this.sourceVariable = sourceVariable;
    }

    public Integer getSourceLine() {
        return sourceLine;
    }

    public void setSourceLine(Integer sourceLine) {
        this.sourceLine = sourceLine;
    }

    /** File path or table the dataset is read from / written to, when known. */
    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public void addNote(String note) {
        if (note != null && !note.isBlank() && !notes.contains(note)) notes.add(note);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return name.equals(other.name)
                && role == other.role
                && schema.equals(other.schema)
                && Objects.equals(sourceVariable, other.sourceVariable)
                && Objects.equals(sourceLine, other.sourceLine)
                && Objects.equals(location, other.location)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, role, schema, sourceVariable, sourceLine, location, notes);
    }

    @Override
    public String toString() {
        return "Dataset{name='" + name + "', role=" + role.toValue() + "}";
    }
}
