package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Settings of recipes that carry no configuration of their own (sync, scoring). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings() implements RecipeSettings {

    @Override
    public boolean isEmpty() {
        return false;
    }
}
