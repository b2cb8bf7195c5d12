package com.phillippitts.parlcorpus.util;

/** Utility for short, single-line previews of transcript text in logs. */
public final class LogSanitizer {

    /** Preview length used when callers have no specific limit. */
    public static final int DEFAULT_PREVIEW = 60;

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
     * Collapses line breaks and runs of whitespace, then truncates to {@link #DEFAULT_PREVIEW}
     * characters with a trailing "..." when shortened.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= DEFAULT_PREVIEW) {
            return oneLine;
        }
        return truncate(oneLine, DEFAULT_PREVIEW) + "...";
    }
}
