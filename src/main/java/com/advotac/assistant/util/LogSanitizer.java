package com.advotac.assistant.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LOGGED_CHARS = 200;

    private LogSanitizer() {
    }

    /**
     * Length and hash digest of a user query; the query itself is never logged.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters and folds newlines so model or store supplied text
     * cannot forge log lines. Long values are cut.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LOGGED_CHARS ? cleaned.substring(0, MAX_LOGGED_CHARS) + "..." : cleaned;
    }
}
