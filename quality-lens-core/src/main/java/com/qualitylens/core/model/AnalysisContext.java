package com.qualitylens.core.model;

import java.util.Objects;

/**
 * Per-file record produced by the input guard and owned by the coordinator for the
 * duration of one file's analysis.
 *
 * @param path sanitized display path (base name only)
 * @param language canonical language tag
 * @param content sanitized content
 * @param contentLength content length in characters
 * @param safe whether the content passed every safety check
 */
public record AnalysisContext(
    String path,
    String language,
    String content,
    int contentLength,
    boolean safe
) {
    public AnalysisContext {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
