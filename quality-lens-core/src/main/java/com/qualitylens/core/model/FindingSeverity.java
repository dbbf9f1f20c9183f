package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a single {@link Finding}.
 *
 * @since 1.0.0
 */
public enum FindingSeverity {
    /**
     * Informational - worth knowing, rarely worth blocking on.
     */
    INFO("info"),

    /**
     * Warning - should be reviewed before release.
     */
    WARNING("warning"),

    /**
     * Error - a clear quality defect.
     */
    ERROR("error");

    private final String id;

    FindingSeverity(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
