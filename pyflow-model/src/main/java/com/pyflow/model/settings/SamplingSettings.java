package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Sampling recipe settings: a fixed ratio or a fixed number of records. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SamplingSettings(String samplingMethod, Double ratio, Integer maxRecords) implements RecipeSettings {

    @JsonCreator
    public SamplingSettings(@JsonProperty("samplingMethod") String samplingMethod,
                            @JsonProperty("ratio") Double ratio,
                            @JsonProperty("maxRecords") Integer maxRecords) {
        this.samplingMethod = samplingMethod != null ? samplingMethod
                : (maxRecords != null ? "RANDOM_FIXED_NUMBER" : "RANDOM_FIXED_RATIO");
        this.ratio = ratio;
        this.maxRecords = maxRecords;
    }

    @Override
    public boolean isEmpty() {
        return ratio == null && maxRecords == null;
    }
}
