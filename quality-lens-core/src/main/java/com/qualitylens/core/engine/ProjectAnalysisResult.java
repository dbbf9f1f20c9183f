package com.qualitylens.core.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.principle.PrincipleReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a project run.
 *
 * @param violations principle violations across all analyzed files, in file order
 * @param findings findings per analyzed file, keyed by path relative to the project root
 * @param principles principle scores and recommendations
 * @param statistics per-outcome file counts
 */
@JsonPropertyOrder({"statistics", "principles", "violations", "findings"})
public record ProjectAnalysisResult(
    List<Violation> violations,
    Map<String, List<Finding>> findings,
    PrincipleReport principles,
    RunStatistics statistics
) {
    public ProjectAnalysisResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        // Keep insertion order, which follows the sorted file walk
        findings = findings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(findings));
        statistics = statistics == null ? RunStatistics.empty() : statistics;
    }

    /**
     * Returns the total number of findings across all files.
     *
     * @return finding count
     */
    public int totalFindings() {
        return findings.values().stream().mapToInt(List::size).sum();
    }
}
