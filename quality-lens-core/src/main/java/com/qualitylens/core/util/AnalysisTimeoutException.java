package com.qualitylens.core.util;

/**
 * Thrown when a file's analysis exceeds its wall-clock budget.
 *
 * <p>Caught only at the file boundary; the file then yields an empty result.
 */
public class AnalysisTimeoutException extends RuntimeException {

    public AnalysisTimeoutException(String message) {
        super(message);
    }
}
