package com.qualitylens.core.engine;

/**
 * How a file's analysis ended.
 */
public enum FileOutcome {
    ANALYZED,
    REJECTED,
    SKIPPED,
    FAILED,
    TIMED_OUT
}
