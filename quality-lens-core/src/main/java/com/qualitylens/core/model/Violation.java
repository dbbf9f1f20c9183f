package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A design-principle breach detected by a principle checker.
 *
 * <p>Violations are created exclusively through
 * {@code AbstractPrincipleChecker#createViolation}, which guarantees that principle,
 * severity, file and an actionable suggestion are always present.
 *
 * @param principle breached principle
 * @param severity severity level
 * @param file sanitized file name
 * @param line 1-based line of the offending container or unit, if known
 * @param className container name (serialized as {@code class}), if scoped to a container
 * @param unitName unit name (serialized as {@code method}), if scoped to a unit
 * @param description what was detected
 * @param explanation why it breaches the principle
 * @param impact consequences of leaving it as is
 * @param suggestion how to fix it
 * @param metrics supporting measurements, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"principle", "severity", "file", "line", "class", "method",
    "description", "explanation", "impact", "suggestion", "metrics"})
public record Violation(
    @JsonProperty("principle") Principle principle,
    @JsonProperty("severity") ViolationSeverity severity,
    @JsonProperty("file") String file,
    @JsonProperty("line") Integer line,
    @JsonProperty("class") String className,
    @JsonProperty("method") String unitName,
    @JsonProperty("description") String description,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("impact") String impact,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("metrics") ViolationMetrics metrics
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(principle, "principle must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(suggestion, "suggestion must not be null");
        if (suggestion.isBlank()) {
            throw new IllegalArgumentException("suggestion must not be blank");
        }
        if (line != null && line < 1) {
            line = 1;
        }
        if (description == null) {
            description = "";
        }
        if (explanation == null) {
            explanation = "";
        }
        if (impact == null) {
            impact = "";
        }
    }
}
