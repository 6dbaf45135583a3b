package com.phillippitts.streamscribe.util;

/** Helpers for keeping transcript text and filesystem paths out of logs at full length. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Like {@link #truncate(String, int)} but marks the cut with a trailing ellipsis.
     * Single-line: newlines are folded to spaces so one transcript never spans log lines.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        return flat.substring(0, max) + ELLIPSIS;
    }

    /**
     * Returns only the last path element, so API responses and INFO logs never leak
     * absolute model locations.
     */
    public static String fileNameOnly(String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int idx = normalized.lastIndexOf('/');
        return idx >= 0 ? normalized.substring(idx + 1) : normalized;
    }
}
