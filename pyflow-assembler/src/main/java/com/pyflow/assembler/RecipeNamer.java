package com.pyflow.assembler;

import com.pyflow.model.RecipeType;

import java.util.HashSet;
import java.util.Set;

/**
 * Issues recipe names of the form {@code {prefix}{type}_{ordinal}{suffix}} from one ordinal
 * shared by all types ({@code prepare_1}, {@code grouping_2}, {@code prepare_3}).
 */
public final class RecipeNamer {

    private final String prefix;
    private final String suffix;
    private final Set<String> issued = new HashSet<>();
    private int ordinal;

    public RecipeNamer(String prefix, String suffix) {
        this.prefix = prefix != null ? prefix : "";
        this.suffix = suffix != null ? suffix : "";
    }

    public static RecipeNamer plain() {
        return new RecipeNamer("", "");
    }

    public String next(RecipeType type) {
        String name;
        do {
            name = prefix + type.namePrefix() + "_" + (++ordinal) + suffix;
        } while (!issued.add(name));
        return name;
    }

    /** Marks a name as taken, e.g. one that already exists in the flow being extended. */
    public void reserve(String name) {
        if (name != null) issued.add(name);
    }

    void reset() {
        issued.clear();
        ordinal = 0;
    }
}
