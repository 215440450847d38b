package com.phillippitts.messagebridge.util;

/** Utility for privacy-safe logging of message bodies and raw log lines. */
public final class LogSanitizer {

    /** Default preview length for message bodies and log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 80;

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
     * Single-line preview: control characters replaced by spaces, then truncated with an ellipsis marker.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ").strip();
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
