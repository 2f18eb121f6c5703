package com.pyflow.python.ast;

/** Imported name with optional {@code as} alias. */
public record Alias(String name, String asName) {

    /**
     * Name bound in the importing scope: the alias when given, otherwise the first dotted segment
     * for {@code import a.b} or the name itself for {@code from m import name}.
     */
    public String boundName(boolean fromImport) {
        if (asName != null) return asName;
        if (fromImport) return name;
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
