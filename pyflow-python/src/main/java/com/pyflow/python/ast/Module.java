package com.pyflow.python.ast;

import java.util.List;

/** Parsed source file: top-level statements plus the original text. */
public record Module(List<Stmt> body, String source) {

    public Module {
        body = List.copyOf(body);
    }

    /**
     * Source text of lines {@code from}..{@code to} (1-based, inclusive), joined with newlines and
     * stripped of common trailing whitespace.
     */
    public String lines(int from, int to) {
        String[] all = source.split("\r?\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = Math.max(1, from); i <= Math.min(to, all.length); i++) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(all[i - 1].stripTrailing());
        }
        return sb.toString();
    }

    /** Source text of a statement. */
    public String textOf(Stmt stmt) {
        return lines(stmt.line(), stmt.endLine()).strip();
    }
}
