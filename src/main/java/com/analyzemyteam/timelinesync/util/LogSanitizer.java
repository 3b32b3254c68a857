package com.analyzemyteam.timelinesync.util;

/** Utility for log-safe previews of remote payloads. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: control characters replaced, truncated with an ellipsis marker.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("[\\r\\n\\t]+", " ");
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "...";
    }
}
