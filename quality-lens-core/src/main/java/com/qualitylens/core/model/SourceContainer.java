package com.qualitylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A class-like grouping of units, or the whole module when a file declares no classes.
 *
 * @param name sanitized container name
 * @param kind whether this is a declared class or an implicit module
 * @param startLine 1-based first line
 * @param endLine 1-based last line
 * @param units units declared inside the container
 * @param body raw text of the container
 */
public record SourceContainer(
    String name,
    Kind kind,
    int startLine,
    int endLine,
    List<SourceUnit> units,
    String body
) {
    /**
     * Origin of a container.
     */
    public enum Kind {
        CLASS,
        MODULE
    }

    public SourceContainer {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        units = units == null ? List.of() : List.copyOf(units);
        if (body == null) {
            body = "";
        }
        startLine = Math.max(1, startLine);
        endLine = Math.max(startLine, endLine);
    }

    /**
     * Returns the number of lines spanned by the container.
     *
     * @return line count
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }
}
