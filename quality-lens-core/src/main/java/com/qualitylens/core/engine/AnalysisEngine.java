package com.qualitylens.core.engine;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.detector.DetectionContext;
import com.qualitylens.core.detector.PatternDetector;
import com.qualitylens.core.extract.ContainerExtractor;
import com.qualitylens.core.extract.ImportExtractor;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.extract.StructuralExtractor;
import com.qualitylens.core.guard.GuardResult;
import com.qualitylens.core.guard.InputGuard;
import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.i18n.ResourceBundleMessages;
import com.qualitylens.core.metric.MetricCalculator;
import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.model.AnalysisContext;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.principle.FilePrincipleResult;
import com.qualitylens.core.principle.PrincipleAnalyzer;
import com.qualitylens.core.principle.PrincipleChecker;
import com.qualitylens.core.principle.PrincipleContext;
import com.qualitylens.core.principle.PrincipleReport;
import com.qualitylens.core.util.AnalysisTimeoutException;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.FileUtils;
import com.qualitylens.core.util.Languages;
import com.qualitylens.core.util.Sanitizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Coordinates the analysis of files and projects.
 *
 * <p>Per file, the engine runs the input guard, then extraction, pattern detectors and
 * metric calculators (and, for project runs, principle checkers) inside one cooperative
 * time budget. Findings are ordered by location and capped per file.
 *
 * <p>No public method throws: rejected, failed and timed-out files yield empty results
 * and are counted in {@link AnalysisMetrics}. Per-file state lives on the stack, so the
 * same engine may be used from several threads.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * AnalysisEngine engine = AnalysisEngine.builder()
 *     .config(ConfigLoader.loadFromDirectory(projectRoot))
 *     .build();
 *
 * List<Finding> findings = engine.analyzeFile(Path.of("src/app.js"), "javascript");
 * ProjectAnalysisResult result = engine.analyzeProject(projectRoot, "typescript");
 * }</pre>
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private static final Comparator<Finding> BY_LOCATION = Comparator
        .comparingInt(Finding::line)
        .thenComparingInt(Finding::column);

    private final AnalyzerConfig config;
    private final AnalysisMetrics metrics;
    private final InputGuard guard;
    private final StructuralExtractor structuralExtractor;
    private final ImportExtractor importExtractor;
    private final ContainerExtractor containerExtractor;
    private final List<PatternDetector> detectors;
    private final List<MetricCalculator> calculators;
    private final List<PrincipleChecker> checkers;
    private final Supplier<Messages> messagesLoader;

    private volatile Messages messages;
    private volatile PrincipleAnalyzer principleAnalyzer;

    private AnalysisEngine(Builder builder) {
        this.config = builder.config;
        this.metrics = builder.metrics;
        this.guard = new InputGuard(config.limits(), reason -> metrics.recordRejection());
        this.structuralExtractor = new StructuralExtractor(config.limits());
        this.importExtractor = new ImportExtractor(config.limits());
        this.containerExtractor = new ContainerExtractor(config.limits());
        this.detectors = List.copyOf(builder.detectors != null ? builder.detectors : ServiceDiscovery.detectors());
        this.calculators = List.copyOf(builder.calculators != null ? builder.calculators : ServiceDiscovery.calculators());
        this.checkers = List.copyOf(builder.checkers != null ? builder.checkers : ServiceDiscovery.checkers());
        this.messages = builder.messages;
        this.messagesLoader = builder.messagesLoader;
    }

    /**
     * Creates an engine with default configuration and all registered components.
     */
    public AnalysisEngine() {
        this(new Builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Public API ====================

    /**
     * Reads and analyzes one file.
     *
     * @param file file to analyze
     * @param language declared language tag
     * @return findings ordered by location; empty if the file was unsupported,
     *     rejected, failed or timed out
     */
    public List<Finding> analyzeFile(Path file, String language) {
        try {
            if (!Languages.isSupported(language)) {
                log.debug("Skipping {}: unsupported language", sanitizedName(file));
                metrics.recordSkipped();
                return List.of();
            }
            return guardAndAnalyze(sanitizedName(file),
                deadline -> guard.validateAndRead(file, language, deadline), false).findings();
        } catch (RuntimeException e) {
            return unexpected(sanitizedName(file), e);
        }
    }

    /**
     * Analyzes content supplied by the caller.
     *
     * @param path path the content was read from, used for validation and display
     * @param language declared language tag
     * @param content file content
     * @return findings ordered by location; empty if unsupported, rejected, failed or timed out
     */
    public List<Finding> analyzeContent(String path, String language, String content) {
        try {
            if (!Languages.isSupported(language)) {
                log.debug("Skipping {}: unsupported language", Sanitizers.sanitizePath(path));
                metrics.recordSkipped();
                return List.of();
            }
            return guardAndAnalyze(Sanitizers.sanitizePath(path),
                deadline -> guard.validate(path, language, content, deadline), false).findings();
        } catch (RuntimeException e) {
            return unexpected(Sanitizers.sanitizePath(path), e);
        }
    }

    /**
     * Analyzes every source file of a language below a directory and checks design
     * principles.
     *
     * <p>The run always completes; files that could not be analyzed are enumerated in
     * {@link ProjectAnalysisResult#statistics()}.
     *
     * @param root project root directory
     * @param language declared language tag
     * @return violations, findings per file, principle report and statistics
     */
    public ProjectAnalysisResult analyzeProject(Path root, String language) {
        RunStatistics.Builder stats = RunStatistics.builder();
        List<FilePrincipleResult> principleResults = new ArrayList<>();
        Map<String, List<Finding>> findingsByFile = new LinkedHashMap<>();

        Optional<String> canonical = Languages.canonical(language);
        if (canonical.isEmpty() || root == null || !Files.isDirectory(root)) {
            log.warn("Project run skipped: unsupported language or missing directory");
            return projectResult(principleResults, findingsByFile, stats);
        }

        List<Path> files;
        try {
            files = FileUtils.findSourceFiles(root, Languages.glob(canonical.get()));
        } catch (IOException | UncheckedIOException | SecurityException e) {
            log.error("Project walk failed: {}", Sanitizers.sanitizeError(e));
            return projectResult(principleResults, findingsByFile, stats);
        }
        stats.filesDiscovered(files.size());
        log.info("Analyzing {} {} files", files.size(), canonical.get());

        for (Path file : files) {
            String relative = root.relativize(file).toString().replace('\\', '/');
            try {
                FileAnalysis analysis = guardAndAnalyze(Sanitizers.sanitizePath(relative),
                    deadline -> guard.validateAndRead(file, canonical.get(), deadline), true);
                switch (analysis.outcome()) {
                    case ANALYZED -> {
                        stats.recordAnalyzed();
                        findingsByFile.put(relative, analysis.findings());
                        principleResults.add(analysis.principles());
                    }
                    case REJECTED -> stats.recordRejected(relative, analysis.rejection());
                    case SKIPPED -> stats.recordSkipped(relative, analysis.detail());
                    case TIMED_OUT -> stats.recordTimedOut(relative, analysis.detail());
                    default -> stats.recordFailed(relative, analysis.detail());
                }
            } catch (RuntimeException e) {
                unexpected(Sanitizers.sanitizePath(relative), e);
                stats.recordFailed(relative, Sanitizers.sanitizeError(e));
            }
        }

        ProjectAnalysisResult result = projectResult(principleResults, findingsByFile, stats);
        log.info("Project run finished. {}", result.statistics().getSummary());
        return result;
    }

    /**
     * Returns a snapshot of the run-level counters.
     *
     * @return metrics snapshot
     */
    public AnalysisMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    // ==================== Per-file analysis ====================

    /**
     * Guards and analyzes one file under a single budget. The deadline and the latency
     * clock start before the input guard scans the content.
     */
    private FileAnalysis guardAndAnalyze(String displayPath, Function<Deadline, GuardResult> guardStep,
                                         boolean checkPrinciples) {
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(Duration.ofMillis(config.limits().analysisTimeoutMillis()));
        GuardResult guarded;
        try {
            guarded = guardStep.apply(deadline);
        } catch (AnalysisTimeoutException e) {
            return timedOut(displayPath, e);
        }
        if (guarded.isRejected()) {
            return FileAnalysis.rejected(displayPath, guarded.reason(), guarded.detail());
        }
        return analyze(guarded.context(), checkPrinciples, started, deadline);
    }

    private FileAnalysis analyze(AnalysisContext context, boolean checkPrinciples, long started, Deadline deadline) {
        String path = context.path();
        try {
            SourceText source = SourceText.of(context.content());
            if (source.lineCount() > config.limits().maxLines()) {
                log.warn("Skipping {}: {} lines exceed the ceiling of {}", path, source.lineCount(), config.limits().maxLines());
                metrics.recordSkipped();
                return FileAnalysis.aborted(path, FileOutcome.SKIPPED, "too many lines");
            }

            Messages renderer = messages();
            List<SourceUnit> units = structuralExtractor.extract(source, deadline);
            List<Finding> findings = new ArrayList<>();
            findings.addAll(runDetectors(new DetectionContext(path, source, config, renderer, deadline)));
            findings.addAll(runCalculators(new MetricContext(path, source, units, config, renderer, deadline)));
            findings.sort(BY_LOCATION);
            findings = cap(path, findings);

            FilePrincipleResult principles = null;
            if (checkPrinciples) {
                List<String> imports = importExtractor.extract(source);
                List<SourceContainer> containers = containerExtractor.extract(path, source, units, deadline);
                principles = principleAnalyzer().analyzeFile(new PrincipleContext(path, context.language(),
                    source, units, containers, imports, config, renderer, deadline));
            }

            metrics.recordAnalysis(findings.size(), System.nanoTime() - started);
            log.debug("Analyzed {}: {} units, {} findings", path, units.size(), findings.size());
            return FileAnalysis.analyzed(path, findings, principles);
        } catch (AnalysisTimeoutException e) {
            return timedOut(path, e);
        } catch (RuntimeException e) {
            log.error("Analysis of {} failed: {}", path, Sanitizers.sanitizeError(e));
            metrics.recordFailure();
            return FileAnalysis.aborted(path, FileOutcome.FAILED, Sanitizers.sanitizeError(e));
        }
    }

    private FileAnalysis timedOut(String path, AnalysisTimeoutException e) {
        log.warn("Analysis of {} aborted: {}", path, Sanitizers.sanitizeError(e));
        metrics.recordTimeout();
        return FileAnalysis.aborted(path, FileOutcome.TIMED_OUT, Sanitizers.sanitizeError(e));
    }

    private List<Finding> runDetectors(DetectionContext context) {
        List<Finding> findings = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            try {
                findings.addAll(detector.detect(context));
            } catch (AnalysisTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Detector {} failed on {}: {}", detector.getId(), context.path(), Sanitizers.sanitizeError(e));
            }
        }
        return findings;
    }

    private List<Finding> runCalculators(MetricContext context) {
        List<Finding> findings = new ArrayList<>();
        for (MetricCalculator calculator : calculators) {
            if (calculator.requiresUnits() && context.units().isEmpty()) {
                continue;
            }
            try {
                findings.addAll(calculator.calculate(context));
            } catch (AnalysisTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Calculator {} failed on {}: {}", calculator.getId(), context.path(), Sanitizers.sanitizeError(e));
            }
        }
        return findings;
    }

    private List<Finding> cap(String path, List<Finding> findings) {
        int max = config.limits().maxFindingsPerFile();
        if (findings.size() <= max) {
            return findings;
        }
        log.warn("Truncating {} findings for {} to {}", findings.size(), path, max);
        return new ArrayList<>(findings.subList(0, max));
    }

    private ProjectAnalysisResult projectResult(List<FilePrincipleResult> principleResults,
                                                Map<String, List<Finding>> findingsByFile,
                                                RunStatistics.Builder stats) {
        List<Violation> violations = principleResults.stream()
            .flatMap(result -> result.violations().stream())
            .toList();
        PrincipleReport report = principleAnalyzer().summarize(principleResults);
        return new ProjectAnalysisResult(violations, findingsByFile, report, stats.build());
    }

    private List<Finding> unexpected(String name, RuntimeException e) {
        log.error("Unexpected error while analyzing {}: {}", name, Sanitizers.sanitizeError(e));
        metrics.recordFailure();
        return List.of();
    }

    // ==================== Lazy collaborators ====================

    private Messages messages() {
        Messages current = messages;
        if (current == null) {
            synchronized (this) {
                current = messages;
                if (current == null) {
                    current = loadMessages();
                    messages = current;
                }
            }
        }
        return current;
    }

    private Messages loadMessages() {
        try {
            Messages loaded = messagesLoader.get();
            return loaded != null ? loaded : Messages.keysOnly();
        } catch (RuntimeException e) {
            log.warn("Message bundle unavailable, using message keys: {}", Sanitizers.sanitizeError(e));
            return Messages.keysOnly();
        }
    }

    private PrincipleAnalyzer principleAnalyzer() {
        PrincipleAnalyzer current = principleAnalyzer;
        if (current == null) {
            synchronized (this) {
                current = principleAnalyzer;
                if (current == null) {
                    current = new PrincipleAnalyzer(checkers, messages());
                    principleAnalyzer = current;
                }
            }
        }
        return current;
    }

    private static String sanitizedName(Path file) {
        return Sanitizers.sanitizePath(file == null ? null : file.toString());
    }

    /**
     * Builder for {@link AnalysisEngine}.
     *
     * <p>Components left unset are discovered via {@link java.util.ServiceLoader}; messages
     * left unset are loaded from the default bundle on first use.
     */
    public static class Builder {
        private AnalyzerConfig config = AnalyzerConfig.defaults();
        private AnalysisMetrics metrics = new AnalysisMetrics();
        private List<PatternDetector> detectors;
        private List<MetricCalculator> calculators;
        private List<PrincipleChecker> checkers;
        private Messages messages;
        private Supplier<Messages> messagesLoader = ResourceBundleMessages::loadDefault;

        public Builder config(AnalyzerConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder metrics(AnalysisMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
            return this;
        }

        public Builder detectors(List<PatternDetector> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder calculators(List<MetricCalculator> calculators) {
            this.calculators = calculators;
            return this;
        }

        public Builder checkers(List<PrincipleChecker> checkers) {
            this.checkers = checkers;
            return this;
        }

        public Builder messages(Messages messages) {
            this.messages = messages;
            return this;
        }

        public Builder messagesLoader(Supplier<Messages> messagesLoader) {
            this.messagesLoader = Objects.requireNonNull(messagesLoader, "messagesLoader must not be null");
            return this;
        }

        public AnalysisEngine build() {
            return new AnalysisEngine(this);
        }
    }
}
