package com.qualitylens.core.engine;

import com.qualitylens.core.guard.RejectionReason;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.principle.FilePrincipleResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of guarding and analyzing one file.
 *
 * @param path sanitized display path
 * @param outcome how the analysis ended
 * @param findings findings, empty unless analyzed
 * @param principles principle result, null unless principles were checked
 * @param detail sanitized reason for a non-analyzed outcome
 * @param rejection guard rejection reason, null unless rejected
 */
record FileAnalysis(
    String path,
    FileOutcome outcome,
    List<Finding> findings,
    FilePrincipleResult principles,
    String detail,
    RejectionReason rejection
) {
    FileAnalysis {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    static FileAnalysis analyzed(String path, List<Finding> findings, FilePrincipleResult principles) {
        return new FileAnalysis(path, FileOutcome.ANALYZED, findings, principles, null, null);
    }

    static FileAnalysis rejected(String path, RejectionReason reason, String detail) {
        return new FileAnalysis(path, FileOutcome.REJECTED, List.of(), null, detail,
            Objects.requireNonNull(reason, "reason must not be null"));
    }

    static FileAnalysis aborted(String path, FileOutcome outcome, String detail) {
        return new FileAnalysis(path, outcome, List.of(), null, detail, null);
    }
}
