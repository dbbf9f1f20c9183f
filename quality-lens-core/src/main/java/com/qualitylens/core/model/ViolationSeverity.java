package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a design-principle {@link Violation}, ordered from least to most severe.
 *
 * <p>Each level carries the penalty it contributes to a file's principle score.
 *
 * @since 1.0.0
 */
public enum ViolationSeverity {
    LOW("low", 1),
    MEDIUM("medium", 3),
    HIGH("high", 6),
    CRITICAL("critical", 10);

    private final String id;
    private final int penalty;

    ViolationSeverity(String id, int penalty) {
        this.id = id;
        this.penalty = penalty;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Returns the score penalty applied for one violation of this severity.
     *
     * @return penalty points
     */
    public int penalty() {
        return penalty;
    }

    /**
     * Returns the more severe of two severities.
     *
     * @param a first severity
     * @param b second severity
     * @return the worst of both
     */
    public static ViolationSeverity worst(ViolationSeverity a, ViolationSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Returns true if this severity is {@link #HIGH} or {@link #CRITICAL}.
     *
     * @return true for the two upper buckets
     */
    public boolean isSevere() {
        return this == HIGH || this == CRITICAL;
    }
}
