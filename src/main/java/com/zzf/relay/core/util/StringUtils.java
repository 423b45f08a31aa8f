package com.zzf.relay.core.util;

public final class StringUtils {
    public static final String ELLIPSIS = "...";

    private StringUtils() {}

    public static String truncate(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }

    /**
     * Like {@link #truncate} but marks the cut with {@value #ELLIPSIS}.
     */
    public static String ellipsize(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxChars ? s : s.substring(0, maxChars) + ELLIPSIS;
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
