package com.qualitylens.core.principle;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.util.Deadline;

import java.util.List;
import java.util.Objects;

/**
 * Immutable per-file input shared by all principle checkers.
 *
 * @param path sanitized display path
 * @param language canonical language tag
 * @param source raw and masked lines
 * @param units extracted units
 * @param containers extracted containers
 * @param imports module specifiers the file depends on
 * @param config active configuration
 * @param messages message renderer
 * @param deadline analysis deadline
 */
public record PrincipleContext(
    String path,
    String language,
    SourceText source,
    List<SourceUnit> units,
    List<SourceContainer> containers,
    List<String> imports,
    AnalyzerConfig config,
    Messages messages,
    Deadline deadline
) {
    public PrincipleContext {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
        source = source == null ? SourceText.of("") : source;
        units = units == null ? List.of() : List.copyOf(units);
        containers = containers == null ? List.of() : List.copyOf(containers);
        imports = imports == null ? List.of() : List.copyOf(imports);
        config = config == null ? AnalyzerConfig.defaults() : config;
        messages = messages == null ? Messages.keysOnly() : messages;
        deadline = deadline == null ? Deadline.none() : deadline;
    }

    public AnalyzerConfig.PrincipleThresholds thresholds() {
        return config.principles();
    }
}
