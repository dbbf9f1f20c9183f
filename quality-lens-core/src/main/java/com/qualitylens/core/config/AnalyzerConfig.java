package com.qualitylens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for the analysis engine.
 *
 * <p>Loaded from {@code quality-lens.yaml}. Every section and every field is optional;
 * anything missing falls back to the value in {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * limits:
 *   maxFileBytes: 500000
 *   analysisTimeoutMillis: 10000
 *
 * thresholds:
 *   complexity: 12
 *   nestingDepth: 5
 *
 * magicNumberAllowList:
 *   - port
 *   - timeout
 *   - retries
 *
 * principles:
 *   methodCount: { low: 10, medium: 20, high: 30 }
 * }</pre>
 *
 * @param limits resource ceilings applied to untrusted input
 * @param thresholds metric thresholds that turn measurements into findings
 * @param magicNumberAllowList contextual words that justify a numeric literal on a line
 * @param principles threshold bands for principle checkers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("limits") Limits limits,
    @JsonProperty("thresholds") Thresholds thresholds,
    @JsonProperty("magicNumberAllowList") List<String> magicNumberAllowList,
    @JsonProperty("principles") PrincipleThresholds principles
) {
    public static final List<String> DEFAULT_MAGIC_NUMBER_ALLOW_LIST =
        List.of("line", "port", "timeout", "version", "http");

    public AnalyzerConfig {
        limits = limits == null ? Limits.defaults() : limits;
        thresholds = thresholds == null ? Thresholds.defaults() : thresholds;
        magicNumberAllowList = magicNumberAllowList == null
            ? DEFAULT_MAGIC_NUMBER_ALLOW_LIST
            : List.copyOf(magicNumberAllowList);
        principles = principles == null ? PrincipleThresholds.defaults() : principles;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(null, null, null, null);
    }

    /**
     * Returns a copy of this configuration with different metric thresholds.
     *
     * @param newThresholds thresholds to use
     * @return new configuration
     */
    public AnalyzerConfig withThresholds(Thresholds newThresholds) {
        return new AnalyzerConfig(limits, newThresholds, magicNumberAllowList, principles);
    }

    /**
     * Returns a copy of this configuration with different limits.
     *
     * @param newLimits limits to use
     * @return new configuration
     */
    public AnalyzerConfig withLimits(Limits newLimits) {
        return new AnalyzerConfig(newLimits, thresholds, magicNumberAllowList, principles);
    }

    /**
     * Resource ceilings. Every dimension of untrusted input is bounded by one of these.
     *
     * @param maxFileBytes largest accepted file, in bytes (inclusive)
     * @param maxPathLength longest accepted path, in characters
     * @param maxLineLength lines longer than this are skipped for matching
     * @param maxLines files with more lines are skipped for detailed analysis
     * @param maxUnits cap on extracted units per file
     * @param maxUnitBodyChars units with a larger body are omitted
     * @param maxUnitBodyLines body scan stops after this many lines
     * @param maxBraceDepth brace balance is clamped to this depth
     * @param maxFindingsPerFile findings beyond this count are dropped
     * @param maxParameters cap on parameters kept per unit
     * @param maxIdentifierLength sanitized identifiers are truncated to this length
     * @param maxParameterLength sanitized parameter tokens are truncated to this length
     * @param maxParameterText raw parameter lists longer than this are ignored
     * @param analysisTimeoutMillis wall-clock budget for one file
     * @throws IllegalArgumentException if a ceiling is zero or negative, or
     *     {@code maxFileBytes} exceeds {@link #MAX_FILE_BYTES_CEILING}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Limits(
        @JsonProperty("maxFileBytes") Integer maxFileBytes,
        @JsonProperty("maxPathLength") Integer maxPathLength,
        @JsonProperty("maxLineLength") Integer maxLineLength,
        @JsonProperty("maxLines") Integer maxLines,
        @JsonProperty("maxUnits") Integer maxUnits,
        @JsonProperty("maxUnitBodyChars") Integer maxUnitBodyChars,
        @JsonProperty("maxUnitBodyLines") Integer maxUnitBodyLines,
        @JsonProperty("maxBraceDepth") Integer maxBraceDepth,
        @JsonProperty("maxFindingsPerFile") Integer maxFindingsPerFile,
        @JsonProperty("maxParameters") Integer maxParameters,
        @JsonProperty("maxIdentifierLength") Integer maxIdentifierLength,
        @JsonProperty("maxParameterLength") Integer maxParameterLength,
        @JsonProperty("maxParameterText") Integer maxParameterText,
        @JsonProperty("analysisTimeoutMillis") Long analysisTimeoutMillis
    ) {
        /** Largest configurable file ceiling; bounded reads allocate one byte past it. */
        public static final int MAX_FILE_BYTES_CEILING = Integer.MAX_VALUE - 8;

        public Limits {
            maxFileBytes = orDefault(maxFileBytes, 1_000_000);
            maxPathLength = orDefault(maxPathLength, 500);
            maxLineLength = orDefault(maxLineLength, 1_000);
            maxLines = orDefault(maxLines, 10_000);
            maxUnits = orDefault(maxUnits, 100);
            maxUnitBodyChars = orDefault(maxUnitBodyChars, 50_000);
            maxUnitBodyLines = orDefault(maxUnitBodyLines, 1_000);
            maxBraceDepth = orDefault(maxBraceDepth, 50);
            maxFindingsPerFile = orDefault(maxFindingsPerFile, 1_000);
            maxParameters = orDefault(maxParameters, 20);
            maxIdentifierLength = orDefault(maxIdentifierLength, 100);
            maxParameterLength = orDefault(maxParameterLength, 50);
            maxParameterText = orDefault(maxParameterText, 500);
            analysisTimeoutMillis = analysisTimeoutMillis == null || analysisTimeoutMillis <= 0
                ? 30_000L
                : analysisTimeoutMillis;

            requirePositive("maxFileBytes", maxFileBytes);
            requirePositive("maxPathLength", maxPathLength);
            requirePositive("maxLineLength", maxLineLength);
            requirePositive("maxLines", maxLines);
            requirePositive("maxUnits", maxUnits);
            requirePositive("maxUnitBodyChars", maxUnitBodyChars);
            requirePositive("maxUnitBodyLines", maxUnitBodyLines);
            requirePositive("maxBraceDepth", maxBraceDepth);
            requirePositive("maxFindingsPerFile", maxFindingsPerFile);
            requirePositive("maxParameters", maxParameters);
            requirePositive("maxIdentifierLength", maxIdentifierLength);
            requirePositive("maxParameterLength", maxParameterLength);
            requirePositive("maxParameterText", maxParameterText);
            if (maxFileBytes > MAX_FILE_BYTES_CEILING) {
                throw new IllegalArgumentException(
                    "maxFileBytes must not exceed " + MAX_FILE_BYTES_CEILING + ": " + maxFileBytes);
            }
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }

        public static Limits defaults() {
            return new Limits(null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
        }

        /**
         * Returns a copy with a different file size ceiling.
         *
         * @param bytes new ceiling in bytes
         * @return new limits
         */
        public Limits withMaxFileBytes(int bytes) {
            return new Limits(bytes, maxPathLength, maxLineLength, maxLines, maxUnits,
                maxUnitBodyChars, maxUnitBodyLines, maxBraceDepth, maxFindingsPerFile,
                maxParameters, maxIdentifierLength, maxParameterLength, maxParameterText,
                analysisTimeoutMillis);
        }

        /**
         * Returns a copy with a different per-file time budget.
         *
         * @param millis new budget in milliseconds
         * @return new limits
         */
        public Limits withAnalysisTimeoutMillis(long millis) {
            return new Limits(maxFileBytes, maxPathLength, maxLineLength, maxLines, maxUnits,
                maxUnitBodyChars, maxUnitBodyLines, maxBraceDepth, maxFindingsPerFile,
                maxParameters, maxIdentifierLength, maxParameterLength, maxParameterText,
                millis);
        }
    }

    /**
     * Metric thresholds. A measurement strictly greater than a threshold is a breach.
     *
     * @param complexity complexity above this yields a warning
     * @param complexityError complexity above this yields an error
     * @param complexityCeiling complexity is capped at this value
     * @param unitLength units longer than this many lines yield a warning
     * @param parameterCount units with more parameters yield a warning
     * @param nestingDepth files nested deeper yield a warning
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Thresholds(
        @JsonProperty("complexity") Integer complexity,
        @JsonProperty("complexityError") Integer complexityError,
        @JsonProperty("complexityCeiling") Integer complexityCeiling,
        @JsonProperty("unitLength") Integer unitLength,
        @JsonProperty("parameterCount") Integer parameterCount,
        @JsonProperty("nestingDepth") Integer nestingDepth
    ) {
        public Thresholds {
            complexity = orDefault(complexity, 10);
            complexityError = orDefault(complexityError, 15);
            complexityCeiling = orDefault(complexityCeiling, 999);
            unitLength = orDefault(unitLength, 50);
            parameterCount = orDefault(parameterCount, 5);
            nestingDepth = orDefault(nestingDepth, 4);
        }

        public static Thresholds defaults() {
            return new Thresholds(null, null, null, null, null, null);
        }

        public Thresholds withNestingDepth(int depth) {
            return new Thresholds(complexity, complexityError, complexityCeiling,
                unitLength, parameterCount, depth);
        }
    }

    /**
     * Inclusive lower bounds of the medium, high and critical severity buckets.
     *
     * @param low values at or above this are at least medium
     * @param medium values at or above this are at least high
     * @param high values at or above this are critical
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThresholdBand(
        @JsonProperty("low") int low,
        @JsonProperty("medium") int medium,
        @JsonProperty("high") int high
    ) {
        public ThresholdBand {
            if (low > medium || medium > high) {
                throw new IllegalArgumentException(
                    "threshold band must be ascending: " + low + "/" + medium + "/" + high);
            }
        }

        public static ThresholdBand of(int low, int medium, int high) {
            return new ThresholdBand(low, medium, high);
        }
    }

    /**
     * Threshold bands used by principle checkers.
     *
     * @param methodCount units per container
     * @param combinedComplexity summed unit complexity per container
     * @param concerns distinct concerns per file
     * @param containerSize lines per container
     * @param unitParameters parameters per unit
     * @param containersPerFile containers declared in one file
     * @param concreteDependencies distinct concrete types instantiated per container
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PrincipleThresholds(
        @JsonProperty("methodCount") ThresholdBand methodCount,
        @JsonProperty("combinedComplexity") ThresholdBand combinedComplexity,
        @JsonProperty("concerns") ThresholdBand concerns,
        @JsonProperty("containerSize") ThresholdBand containerSize,
        @JsonProperty("unitParameters") ThresholdBand unitParameters,
        @JsonProperty("containersPerFile") ThresholdBand containersPerFile,
        @JsonProperty("concreteDependencies") ThresholdBand concreteDependencies
    ) {
        public PrincipleThresholds {
            methodCount = orDefault(methodCount, ThresholdBand.of(8, 15, 25));
            combinedComplexity = orDefault(combinedComplexity, ThresholdBand.of(25, 50, 100));
            concerns = orDefault(concerns, ThresholdBand.of(3, 4, 5));
            containerSize = orDefault(containerSize, ThresholdBand.of(200, 400, 800));
            unitParameters = orDefault(unitParameters, ThresholdBand.of(6, 8, 10));
            containersPerFile = orDefault(containersPerFile, ThresholdBand.of(3, 5, 8));
            concreteDependencies = orDefault(concreteDependencies, ThresholdBand.of(4, 6, 10));
        }

        public static PrincipleThresholds defaults() {
            return new PrincipleThresholds(null, null, null, null, null, null, null);
        }
    }

    private static <T> T orDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }
}
