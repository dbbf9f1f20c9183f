package com.qualitylens.core.detector;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.util.Deadline;

import java.util.Objects;

/**
 * Immutable per-file input shared by all pattern detectors.
 *
 * @param path sanitized display path
 * @param source raw and masked lines
 * @param config active configuration
 * @param messages message renderer
 * @param deadline analysis deadline
 */
public record DetectionContext(
    String path,
    SourceText source,
    AnalyzerConfig config,
    Messages messages,
    Deadline deadline
) {
    public DetectionContext {
        Objects.requireNonNull(path, "path must not be null");
        source = source == null ? SourceText.of("") : source;
        config = config == null ? AnalyzerConfig.defaults() : config;
        messages = messages == null ? Messages.keysOnly() : messages;
        deadline = deadline == null ? Deadline.none() : deadline;
    }

    /**
     * Creates a context for standalone use with default configuration and no deadline.
     *
     * @param path display path
     * @param content file content
     * @return detection context
     */
    public static DetectionContext of(String path, String content) {
        return new DetectionContext(path, SourceText.of(content), null, null, null);
    }
}
