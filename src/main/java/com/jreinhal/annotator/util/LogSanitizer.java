package com.jreinhal.annotator.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // control characters let a crafted record id or username forge log lines
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 128;

    private LogSanitizer() {
    }

    /**
     * Strips control characters and truncates long values before they enter log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            return cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return cleaned;
    }

    /**
     * Short stable reference for a session token, so logs can correlate calls without
     * leaking the bearer value.
     */
    public static String tokenRef(String token) {
        if (token == null || token.isBlank()) {
            return "[token=none]";
        }
        return "[token=" + Integer.toHexString(token.hashCode()) + "]";
    }
}
