package com.phillippitts.cvtailor.util;

/** Utility for privacy-safe logging of job descriptions, prompts and generated text. */
public final class LogSanitizer {

    /** Preview length used for chat messages and prompt logging. */
    public static final int PREVIEW_LENGTH = 500;

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
     * Like {@link #truncate(String, int)} but marks truncation with a trailing ellipsis.
     */
    public static String preview(String s, int max) {
        String cut = truncate(s, max);
        return s != null && s.length() > max ? cut + "..." : cut;
    }

    /**
     * Collapses line breaks so multi-line tool output stays on one log line.
     */
    public static String singleLine(String s) {
        return s == null ? "" : s.replaceAll("\\s*\\R\\s*", " ").trim();
    }
}
