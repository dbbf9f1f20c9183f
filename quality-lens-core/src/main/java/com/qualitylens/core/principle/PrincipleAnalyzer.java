package com.qualitylens.core.principle;

import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.model.Principle;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.model.ViolationMetrics;
import com.qualitylens.core.util.AnalysisTimeoutException;
import com.qualitylens.core.util.Sanitizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every applicable principle checker on a file and scores the outcome.
 *
 * <p>File score is {@code max(0, 100 - sum of severity penalties)}. The project score is
 * the rounded mean of file scores. Each principle's breakdown score drops by five per
 * violation.
 */
public class PrincipleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PrincipleAnalyzer.class);

    private static final int MAX_SCORE = 100;
    private static final int BREAKDOWN_PENALTY = 5;
    private static final int FACADE_METHOD_COUNT = 20;
    private static final int HOTSPOT_VIOLATIONS = 5;
    private static final int REFACTORING_SCORE = 70;

    private final List<PrincipleChecker> checkers;
    private final Messages messages;

    public PrincipleAnalyzer(List<PrincipleChecker> checkers, Messages messages) {
        this.checkers = List.copyOf(checkers);
        this.messages = messages;
    }

    /**
     * Checks one file with every checker that supports its language.
     *
     * <p>A checker that fails is logged and skipped; the others still run.
     *
     * @param context file structure
     * @return violations, score and suggestions
     * @throws AnalysisTimeoutException if the file's deadline expires
     */
    public FilePrincipleResult analyzeFile(PrincipleContext context) {
        List<Violation> violations = new ArrayList<>();
        for (PrincipleChecker checker : checkers) {
            if (!checker.supportsLanguage(context.language())) {
                continue;
            }
            try {
                violations.addAll(checker.check(context));
            } catch (AnalysisTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("{} check failed for {}: {}", checker.getPrinciple().code(), context.path(),
                    Sanitizers.sanitizeError(e));
            }
        }
        return new FilePrincipleResult(context.path(), context.language(), violations,
            fileScore(violations), fileSuggestions(violations));
    }

    /**
     * Summarizes the file results of a project run.
     *
     * @param results per-file results
     * @return project report
     */
    public PrincipleReport summarize(Collection<FilePrincipleResult> results) {
        List<Violation> all = results.stream().flatMap(result -> result.violations().stream()).toList();
        Map<Principle, PrincipleReport.PrincipleScore> breakdown = breakdown(all);
        int overall = overallScore(results);
        return new PrincipleReport(results.size(), all.size(), overall, breakdown,
            recommendations(results, breakdown, overall));
    }

    // ==================== Scoring ====================

    static int fileScore(Collection<Violation> violations) {
        int penalty = violations.stream().mapToInt(violation -> violation.severity().penalty()).sum();
        return Math.max(0, MAX_SCORE - penalty);
    }

    static int overallScore(Collection<FilePrincipleResult> results) {
        if (results.isEmpty()) {
            return MAX_SCORE;
        }
        double mean = results.stream().mapToInt(FilePrincipleResult::score).average().orElse(MAX_SCORE);
        return (int) Math.round(mean);
    }

    static Map<Principle, PrincipleReport.PrincipleScore> breakdown(Collection<Violation> violations) {
        Map<Principle, PrincipleReport.PrincipleScore> breakdown = new EnumMap<>(Principle.class);
        for (Principle principle : Principle.values()) {
            int count = (int) violations.stream().filter(violation -> violation.principle() == principle).count();
            breakdown.put(principle, new PrincipleReport.PrincipleScore(count,
                Math.max(0, MAX_SCORE - count * BREAKDOWN_PENALTY)));
        }
        return breakdown;
    }

    // ==================== Suggestions ====================

    private List<String> fileSuggestions(List<Violation> violations) {
        Set<String> suggestions = new LinkedHashSet<>();
        for (Violation violation : violations) {
            switch (violation.principle()) {
                case SINGLE_RESPONSIBILITY -> {
                    if (violation.severity().isSevere()) {
                        suggestions.add(messages.t("principle.suggestion.split_units"));
                        suggestions.add(messages.t("principle.suggestion.separate_concerns"));
                    }
                    ViolationMetrics metrics = violation.metrics();
                    if (metrics != null && metrics.methodCount() != null
                        && metrics.methodCount() > FACADE_METHOD_COUNT) {
                        suggestions.add(messages.t("principle.suggestion.facade"));
                    }
                }
                case DEPENDENCY_INVERSION -> suggestions.add(messages.t("principle.suggestion.inject_dependencies"));
                default -> {
                    // Only the principles above have dedicated suggestions
                }
            }
        }
        if (suggestions.isEmpty() && !violations.isEmpty()) {
            suggestions.add(messages.t("principle.suggestion.review"));
        }
        return new ArrayList<>(suggestions);
    }

    private List<String> recommendations(Collection<FilePrincipleResult> results,
                                         Map<Principle, PrincipleReport.PrincipleScore> breakdown,
                                         int overallScore) {
        List<String> recommendations = new ArrayList<>();
        boolean anyViolations = false;
        for (Map.Entry<Principle, PrincipleReport.PrincipleScore> entry : breakdown.entrySet()) {
            int count = entry.getValue().violations();
            if (count > 0) {
                anyViolations = true;
                recommendations.add(messages.t("principle.recommendation.principle_violations",
                    Map.of("count", count, "principle", entry.getKey().code())));
            }
        }
        if (anyViolations && overallScore < REFACTORING_SCORE) {
            recommendations.add(messages.t("principle.recommendation.systematic_refactoring"));
        }

        long hotspots = results.stream().filter(result -> result.violations().size() > HOTSPOT_VIOLATIONS).count();
        if (hotspots > 0) {
            recommendations.add(messages.t("principle.recommendation.hotspots", Map.of("count", hotspots)));
        }
        long clean = results.stream().filter(result -> result.violations().isEmpty()).count();
        if (clean > 0) {
            recommendations.add(messages.t("principle.recommendation.clean_files", Map.of("count", clean)));
        }
        return recommendations;
    }
}
