package com.qualitylens.core.principle;

import com.qualitylens.core.model.Principle;

import java.util.List;
import java.util.Map;

/**
 * Project-wide principle summary.
 *
 * @param totalFiles files that were checked
 * @param totalViolations violations across all files
 * @param overallScore rounded mean of file scores, 100 when no file was checked
 * @param breakdown violation count and score per principle
 * @param recommendations project-level recommendations
 */
public record PrincipleReport(
    int totalFiles,
    int totalViolations,
    int overallScore,
    Map<Principle, PrincipleScore> breakdown,
    List<String> recommendations
) {
    public PrincipleReport {
        breakdown = breakdown == null ? Map.of() : Map.copyOf(breakdown);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Violations and score for one principle.
     *
     * @param violations number of violations
     * @param score 0-100, reduced by five per violation
     */
    public record PrincipleScore(int violations, int score) {
    }
}
