package com.phillippitts.presetgraph.util;

/** Utility for privacy-safe logging of prompt and result previews. */
public final class LogSanitizer {

    /** Default preview length used in INFO logs. */
    public static final int DEFAULT_PREVIEW = 40;

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
     * Single-line preview: whitespace runs collapse to one space, then the text is truncated
     * and suffixed with "..." if it was longer than {@code max}.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
