package com.phillippitts.capturesync.util;

/** Utility for bounded, privacy-safe logging of process output and file names. */
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
     * Keeps the last max characters, where process diagnostics usually end with the actual error.
     */
    public static String tail(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(s.length() - max);
    }
}
