package com.qualitylens.core.metric;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.util.Deadline;

import java.util.List;
import java.util.Objects;

/**
 * Immutable per-file input shared by all metric calculators.
 *
 * @param path sanitized display path
 * @param source raw and masked lines
 * @param units units extracted from the source
 * @param config active configuration
 * @param messages message renderer
 * @param deadline analysis deadline
 */
public record MetricContext(
    String path,
    SourceText source,
    List<SourceUnit> units,
    AnalyzerConfig config,
    Messages messages,
    Deadline deadline
) {
    public MetricContext {
        Objects.requireNonNull(path, "path must not be null");
        source = source == null ? SourceText.of("") : source;
        units = units == null ? List.of() : List.copyOf(units);
        config = config == null ? AnalyzerConfig.defaults() : config;
        messages = messages == null ? Messages.keysOnly() : messages;
        deadline = deadline == null ? Deadline.none() : deadline;
    }

    public AnalyzerConfig.Thresholds thresholds() {
        return config.thresholds();
    }
}
