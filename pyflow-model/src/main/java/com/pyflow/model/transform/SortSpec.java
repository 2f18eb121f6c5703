package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/** Sort key of a semantic step. Accepts {@code {"column": "x", "order": "desc"}} or an {@code ascending} flag. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SortSpec(String column, boolean ascending) {

    @JsonCreator
    public static SortSpec fromJson(@JsonProperty("column") String column,
                                    @JsonProperty("order") String order,
                                    @JsonProperty("ascending") Boolean ascending) {
        boolean asc = ascending != null ? ascending : order == null || !order.trim().toLowerCase(Locale.ROOT).startsWith("desc");
        return new SortSpec(column != null ? column : "", asc);
    }
}
