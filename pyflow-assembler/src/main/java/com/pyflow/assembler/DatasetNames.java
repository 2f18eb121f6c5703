package com.pyflow.assembler;

/**
 * Canonical dataset naming shared by both assembler paths, so the same logical dataset gets
 * the same name whichever analyzer reported it.
 */
public final class DatasetNames {

    static final String FALLBACK = "dataset";

    private DatasetNames() {
    }

    /**
     * Drops quotes, replaces every character outside {@code [A-Za-z0-9_]} with an underscore and
     * prefixes a leading digit with {@code ds_}. Blank input yields {@code dataset}.
     */
    public static String sanitize(String raw) {
        if (raw == null) return FALLBACK;
        String trimmed = raw.replace("'", "").replace("\"", "").trim();
        if (trimmed.isEmpty()) return FALLBACK;
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(allowed ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) sb.insert(0, "ds_");
        return sb.toString();
    }

    /**
     * Dataset name for a file location: the file name up to its first dot, sanitized
     * ({@code data/raw/sales.2024.csv} gives {@code sales}). Null when the path has no usable file name.
     */
    public static String fromPath(String path) {
        if (path == null || path.isBlank()) return null;
        String p = path.trim().replace('\\', '/');
        int query = p.indexOf('?');
        if (query >= 0) p = p.substring(0, query);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        String file = p.substring(p.lastIndexOf('/') + 1);
        int dot = file.indexOf('.');
        if (dot == 0) return null;
        if (dot > 0) file = file.substring(0, dot);
        if (file.isBlank()) return null;
        return sanitize(file);
    }
}
