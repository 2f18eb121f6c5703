package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Code recipe settings: the raw, untranslated source. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeSettings(String code) implements RecipeSettings {

    @JsonCreator
    public CodeSettings(@JsonProperty("code") String code) {
        this.code = code != null ? code : "";
    }

    @Override
    public boolean isEmpty() {
        return code.isBlank();
    }
}
