package com.qualitylens.core.guard;

/**
 * Reason codes for files the input guard refuses to analyze.
 *
 * @since 1.0.0
 */
public enum RejectionReason {
    /** Path missing, blank or otherwise unusable. */
    INVALID_PATH,
    /** Path contains an embedded NUL character. */
    NULL_BYTE,
    /** Path normalizes to something containing a parent-directory segment. */
    PATH_TRAVERSAL,
    /** Path is longer than the configured ceiling. */
    PATH_TOO_LONG,
    /** Path does not denote a readable regular file. */
    NOT_A_FILE,
    /** File or content exceeds the byte ceiling. */
    FILE_TOO_LARGE,
    /** File exists but could not be read. */
    UNREADABLE,
    /** Content matches a high-risk pattern. */
    SUSPICIOUS_CONTENT
}
