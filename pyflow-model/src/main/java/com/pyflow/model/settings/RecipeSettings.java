package com.pyflow.model.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pyflow.model.RecipeType;

/**
 * Settings payload of a recipe. One variant per {@link RecipeType}; the variant is chosen by the
 * recipe's type, never stored as a separate discriminator.
 */
public interface RecipeSettings {

    /**
     * True when the settings carry no meaningful content for their recipe type
     * (e.g. a Prepare recipe with zero steps). Such recipes are flagged, not silently accepted.
     */
    @JsonIgnore
    boolean isEmpty();

    /** Settings class used for the given recipe type when reading an exported flow. */
    static Class<? extends RecipeSettings> settingsClassFor(RecipeType type) {
        if (type == null) return CodeSettings.class;
        return switch (type) {
            case PREPARE -> PrepareSettings.class;
            case GROUPING -> GroupingSettings.class;
            case WINDOW -> WindowSettings.class;
            case JOIN -> JoinSettings.class;
            case STACK -> StackSettings.class;
            case SPLIT -> SplitSettings.class;
            case SORT -> SortSettings.class;
            case DISTINCT -> DistinctSettings.class;
            case TOP_N -> TopNSettings.class;
            case PIVOT -> PivotSettings.class;
            case SAMPLING -> SamplingSettings.class;
            case SYNC, PREDICTION_SCORING -> SyncSettings.class;
            case PYTHON, UNKNOWN -> CodeSettings.class;
        };
    }

    /** Empty settings of the right variant for a freshly created recipe. */
    static RecipeSettings emptyFor(RecipeType type) {
        if (type == null) return new CodeSettings("");
        return switch (type) {
            case PREPARE -> PrepareSettings.empty();
            case GROUPING -> new GroupingSettings(null, null, false);
            case WINDOW -> new WindowSettings(null, null, null, null);
            case JOIN -> new JoinSettings(JoinType.LEFT, null);
            case STACK -> StackSettings.union();
            case SPLIT -> new SplitSettings(null, null, null);
            case SORT -> new SortSettings(null);
            case DISTINCT -> new DistinctSettings(null, false);
            case TOP_N -> new TopNSettings(10, null, false);
            case PIVOT -> new PivotSettings(null, null, null, null, null);
            case SAMPLING -> new SamplingSettings(null, null, null);
            case SYNC, PREDICTION_SCORING -> new SyncSettings();
            case PYTHON, UNKNOWN -> new CodeSettings("");
        };
    }
}
