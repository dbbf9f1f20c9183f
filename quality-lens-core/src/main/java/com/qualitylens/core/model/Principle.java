package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Design principles a {@link Violation} can breach.
 *
 * @since 1.0.0
 */
public enum Principle {
    SINGLE_RESPONSIBILITY("SRP", "Single Responsibility"),
    OPEN_CLOSED("OCP", "Open/Closed"),
    LISKOV_SUBSTITUTION("LSP", "Liskov Substitution"),
    INTERFACE_SEGREGATION("ISP", "Interface Segregation"),
    DEPENDENCY_INVERSION("DIP", "Dependency Inversion");

    private final String code;
    private final String displayName;

    Principle(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
