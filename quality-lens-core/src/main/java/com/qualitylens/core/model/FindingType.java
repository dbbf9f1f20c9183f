package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rule families a {@link Finding} can belong to.
 *
 * <p>The first four are line-level anti-patterns produced by pattern detectors; the
 * remaining four are threshold breaches produced by metric calculators.
 *
 * @since 1.0.0
 */
public enum FindingType {
    DEPRECATED_DECLARATION("deprecated-declaration", "no-var"),
    WEAK_EQUALITY("weak-equality", "eqeqeq"),
    DEBUG_STATEMENT("debug-statement", "no-console"),
    UNNAMED_CONSTANT("unnamed-constant", "no-magic-numbers"),
    COMPLEXITY("complexity", "complexity"),
    UNIT_LENGTH("unit-length", "max-lines-per-function"),
    PARAMETER_COUNT("parameter-count", "max-params"),
    NESTING_DEPTH("nesting-depth", "max-depth");

    private final String id;
    private final String defaultRuleId;

    FindingType(String id, String defaultRuleId) {
        this.id = id;
        this.defaultRuleId = defaultRuleId;
    }

    /**
     * Returns the kebab-case identifier used in serialized output.
     *
     * @return rule family identifier
     */
    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Returns the lint rule identifier conventionally associated with this family.
     *
     * @return rule identifier
     */
    public String defaultRuleId() {
        return defaultRuleId;
    }
}
