package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Sort key with order {@code ASC} or {@code DESC}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SortColumn(String column, String order) {

    @JsonCreator
    public SortColumn(@JsonProperty("column") String column, @JsonProperty("order") String order) {
        this.column = column;
        this.order = "DESC".equalsIgnoreCase(order) ? "DESC" : "ASC";
    }

    public static SortColumn of(String column, boolean ascending) {
        return new SortColumn(column, ascending ? "ASC" : "DESC");
    }
}
