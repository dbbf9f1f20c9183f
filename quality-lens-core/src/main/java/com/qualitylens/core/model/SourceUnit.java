package com.qualitylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A function-like construct recovered from source text without full parsing.
 *
 * <p>Name and parameters are sanitized before construction; the body is the raw text
 * span from the declaration line to the line where the brace balance returned to zero.
 *
 * @param name sanitized identifier, or {@code anonymous}
 * @param parameters sanitized parameter tokens in declaration order
 * @param body raw text of the unit
 * @param startLine 1-based line of the declaration
 * @param startColumn 1-based column of the declaration
 * @param endLine 1-based last line of the body
 */
public record SourceUnit(
    String name,
    List<String> parameters,
    String body,
    int startLine,
    int startColumn,
    int endLine
) {
    public static final String ANONYMOUS = "anonymous";

    /**
     * Compact constructor with validation.
     */
    public SourceUnit {
        Objects.requireNonNull(body, "body must not be null");
        if (name == null || name.isEmpty()) {
            name = ANONYMOUS;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        startLine = Math.max(1, startLine);
        startColumn = Math.max(1, startColumn);
        endLine = Math.max(startLine, endLine);
    }

    /**
     * Returns the number of lines spanned by the body.
     *
     * @return body line count
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Returns the number of sanitized parameters.
     *
     * @return parameter count
     */
    public int parameterCount() {
        return parameters.size();
    }

    /**
     * Returns true if the given 1-based line falls inside this unit.
     *
     * @param line line number
     * @return true if contained
     */
    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
