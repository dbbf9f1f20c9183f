package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single anti-pattern occurrence at a location in an analyzed file.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = new Finding(
 *     FindingType.WEAK_EQUALITY,
 *     "Use strict equality \"===\" instead of \"==\"",
 *     FindingSeverity.WARNING,
 *     12, 9,
 *     "eqeqeq",
 *     "Replace \"==\" with \"===\""
 * );
 * }</pre>
 *
 * @param type rule family
 * @param message rendered, human-readable message
 * @param severity severity level
 * @param line 1-based line number
 * @param column 1-based column number
 * @param ruleId lint rule identifier (serialized as {@code rule})
 * @param suggestion remediation text
 */
@JsonPropertyOrder({"type", "message", "severity", "line", "column", "rule", "suggestion"})
public record Finding(
    @JsonProperty("type") FindingType type,
    @JsonProperty("message") String message,
    @JsonProperty("severity") FindingSeverity severity,
    @JsonProperty("line") int line,
    @JsonProperty("column") int column,
    @JsonProperty("rule") String ruleId,
    @JsonProperty("suggestion") String suggestion
) {
    /**
     * Compact constructor with validation.
     *
     * <p>Locations are clamped to 1 so that every finding points at a real position.
     */
    public Finding {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (message == null) {
            message = "";
        }
        if (ruleId == null) {
            ruleId = type.defaultRuleId();
        }
        if (suggestion == null) {
            suggestion = "";
        }
        line = Math.max(1, line);
        column = Math.max(1, column);
    }
}
