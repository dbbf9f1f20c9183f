package com.qualitylens.core.util;

import java.util.regex.Pattern;

/**
 * Sanitizers applied at every boundary where untrusted text reaches a log line, a
 * finding message or a report.
 *
 * <p>Raw paths and exception messages never leave the engine unsanitized.
 */
public final class Sanitizers {

    public static final String UNKNOWN_FILE = "unknown-file";
    public static final String UNKNOWN_ERROR = "Unknown analysis error";

    private static final int MAX_PATH_DISPLAY_LENGTH = 50;
    private static final int MAX_ERROR_LENGTH = 200;

    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\\\]");
    private static final Pattern UNSAFE_PATH_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final Pattern UNSAFE_IDENTIFIER_CHARS = Pattern.compile("[^a-zA-Z0-9_$]");
    private static final Pattern EMBEDDED_PATH = Pattern.compile("(?:[A-Za-z]:)?[/\\\\][^\\s]*[/\\\\][^\\s]*");

    private Sanitizers() {
        // Utility class
    }

    /**
     * Reduces a path to a short, display-safe base name.
     *
     * @param path raw path, possibly null
     * @return base name restricted to {@code [a-zA-Z0-9._-]}, at most 50 characters
     */
    public static String sanitizePath(String path) {
        if (path == null || path.isEmpty()) {
            return UNKNOWN_FILE;
        }
        String[] segments = PATH_SEPARATORS.split(path);
        String baseName = segments.length == 0 ? "" : segments[segments.length - 1];
        String cleaned = truncate(UNSAFE_PATH_CHARS.matcher(baseName).replaceAll(""), MAX_PATH_DISPLAY_LENGTH);
        return cleaned.isEmpty() ? UNKNOWN_FILE : cleaned;
    }

    /**
     * Restricts an identifier to {@code [a-zA-Z0-9_$]} and a maximum length.
     *
     * @param raw captured identifier text
     * @param maxLength maximum length
     * @param fallback value returned when nothing safe remains
     * @return sanitized identifier or the fallback
     */
    public static String sanitizeIdentifier(String raw, int maxLength, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String cleaned = truncate(UNSAFE_IDENTIFIER_CHARS.matcher(raw).replaceAll(""), maxLength);
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    /**
     * Redacts embedded paths from an error message and caps its length.
     *
     * @param message raw message
     * @return sanitized message
     */
    public static String sanitizeMessage(String message) {
        if (message == null || message.isEmpty()) {
            return UNKNOWN_ERROR;
        }
        String redacted = EMBEDDED_PATH.matcher(message).replaceAll("[PATH]");
        return truncate(redacted, MAX_ERROR_LENGTH);
    }

    /**
     * Maps any throwable to a sanitized, single-line description.
     *
     * @param error caught throwable
     * @return sanitized message
     */
    public static String sanitizeError(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        String message = error.getMessage();
        if (message == null || message.isEmpty()) {
            return error.getClass().getSimpleName();
        }
        return sanitizeMessage(message.replace('\n', ' ').replace('\r', ' '));
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
