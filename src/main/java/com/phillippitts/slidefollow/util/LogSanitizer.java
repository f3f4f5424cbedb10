package com.phillippitts.slidefollow.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Default preview length for transcript text in logs. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /** Truncated transcript preview using {@link #PREVIEW_CHARS}. */
    public static String preview(String transcript) {
        return truncate(transcript, PREVIEW_CHARS);
    }

    /** Masks a credential, keeping the last four characters. */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<empty>";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
