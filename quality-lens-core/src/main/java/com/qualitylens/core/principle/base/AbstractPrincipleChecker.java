package com.qualitylens.core.principle.base;

import com.qualitylens.core.config.AnalyzerConfig.ThresholdBand;
import com.qualitylens.core.model.Concern;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.model.ViolationMetrics;
import com.qualitylens.core.model.ViolationSeverity;
import com.qualitylens.core.principle.PrincipleChecker;
import com.qualitylens.core.principle.PrincipleContext;
import com.qualitylens.core.util.Languages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Abstract base class for principle checkers providing the shared scoring helpers.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per checker class)</li>
 *   <li>Language support for every tag in {@link Languages}</li>
 *   <li>Threshold bucketing into {@link ViolationSeverity}</li>
 *   <li>Concern classification of import specifiers</li>
 *   <li>Violation construction that always carries a suggestion</li>
 * </ul>
 */
public abstract class AbstractPrincipleChecker implements PrincipleChecker {

    private static final String FALLBACK_SUGGESTION_KEY = "principle.suggestion.review";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public boolean supportsLanguage(String language) {
        return Languages.isSupported(language);
    }

    // ==================== Scoring Helpers ====================

    /**
     * Buckets a measurement into a severity.
     *
     * <p>Boundaries are inclusive and the highest matching bucket wins: a value at or above
     * {@code high} is critical, at or above {@code medium} is high, at or above {@code low}
     * is medium, anything lower is low.
     *
     * @param value measurement
     * @param band thresholds
     * @return severity
     */
    protected ViolationSeverity severityFromThresholds(int value, ThresholdBand band) {
        if (value >= band.high()) {
            return ViolationSeverity.CRITICAL;
        }
        if (value >= band.medium()) {
            return ViolationSeverity.HIGH;
        }
        if (value >= band.low()) {
            return ViolationSeverity.MEDIUM;
        }
        return ViolationSeverity.LOW;
    }

    /**
     * Maps import specifiers to coarse concerns. One import may contribute several.
     *
     * @param imports import specifiers
     * @return distinct concerns, in declaration order of {@link Concern}
     */
    protected Set<Concern> classifyImportConcerns(Collection<String> imports) {
        Set<Concern> concerns = EnumSet.noneOf(Concern.class);
        if (imports == null) {
            return concerns;
        }
        for (String dependency : imports) {
            for (Concern concern : Concern.values()) {
                if (concern.matches(dependency)) {
                    concerns.add(concern);
                }
            }
        }
        return concerns;
    }

    // ==================== Violation Construction ====================

    /**
     * Builds a violation whose texts are rendered from {@code <keyPrefix>.description},
     * {@code .explanation}, {@code .impact} and {@code .suggestion}.
     *
     * <p>A blank rendered suggestion falls back to a generic review suggestion.
     *
     * @param context principle context
     * @param location where and in what the violation sits
     * @param severity severity
     * @param keyPrefix message key prefix
     * @param params message placeholders
     * @param metrics measurements behind the violation, or null
     * @return violation
     */
    protected Violation createViolation(PrincipleContext context, Location location, ViolationSeverity severity,
                                        String keyPrefix, Map<String, ?> params, ViolationMetrics metrics) {
        String suggestion = context.messages().t(keyPrefix + ".suggestion", params);
        if (suggestion == null || suggestion.isBlank()) {
            suggestion = context.messages().t(FALLBACK_SUGGESTION_KEY);
        }
        if (suggestion == null || suggestion.isBlank()) {
            suggestion = FALLBACK_SUGGESTION_KEY;
        }
        return new Violation(
            getPrinciple(),
            severity,
            context.path(),
            location.line(),
            location.className(),
            location.unitName(),
            context.messages().t(keyPrefix + ".description", params),
            context.messages().t(keyPrefix + ".explanation", params),
            context.messages().t(keyPrefix + ".impact", params),
            suggestion,
            metrics
        );
    }

    /**
     * Position of a violation inside a file.
     *
     * @param line 1-based line, or null for file-scoped violations
     * @param className enclosing container, or null
     * @param unitName unit, or null
     */
    protected record Location(Integer line, String className, String unitName) {

        public static Location file() {
            return new Location(null, null, null);
        }

        public static Location container(int line, String className) {
            return new Location(line, className, null);
        }

        public static Location unit(int line, String className, String unitName) {
            return new Location(line, className, unitName);
        }
    }
}
