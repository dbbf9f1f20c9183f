package com.qualitylens.core.principle;

import com.qualitylens.core.model.Violation;

import java.util.List;
import java.util.Objects;

/**
 * Principle check outcome for one file.
 *
 * @param path sanitized display path
 * @param language canonical language tag
 * @param violations violations from every applicable checker
 * @param score 0-100, 100 meaning no violations
 * @param suggestions deduplicated improvement suggestions
 */
public record FilePrincipleResult(
    String path,
    String language,
    List<Violation> violations,
    int score,
    List<String> suggestions
) {
    public FilePrincipleResult {
        Objects.requireNonNull(path, "path must not be null");
        violations = violations == null ? List.of() : List.copyOf(violations);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static FilePrincipleResult clean(String path, String language) {
        return new FilePrincipleResult(path, language, List.of(), 100, List.of());
    }
}
