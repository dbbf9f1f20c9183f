package com.qualitylens.core.engine;

import com.qualitylens.core.guard.RejectionReason;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during a project run.
 *
 * <p>Every discovered file ends up in exactly one bucket, so skipped and rejected files
 * are enumerated rather than silently dropped.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * RunStatistics stats = RunStatistics.builder()
 *     .filesDiscovered(3)
 *     .recordAnalyzed()
 *     .recordRejected("bundle.js", RejectionReason.FILE_TOO_LARGE)
 *     .recordFailed("broken.js", "Unexpected state")
 *     .build();
 * }</pre>
 *
 * @param filesDiscovered files matching the language's extensions
 * @param filesAnalyzed files analyzed completely
 * @param filesRejected files rejected by the input guard
 * @param filesSkipped files skipped for exceeding the line ceiling
 * @param filesFailed files whose analysis failed
 * @param filesTimedOut files whose analysis exceeded the time budget
 * @param rejectionCounts rejections per reason
 * @param notAnalyzed "file: reason" entries for every file not analyzed (max 50)
 */
public record RunStatistics(
    int filesDiscovered,
    int filesAnalyzed,
    int filesRejected,
    int filesSkipped,
    int filesFailed,
    int filesTimedOut,
    Map<RejectionReason, Integer> rejectionCounts,
    List<String> notAnalyzed
) {
    static final int MAX_LISTED_FILES = 50;

    /**
     * Compact constructor with validation and defaults.
     */
    public RunStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesAnalyzed = Math.max(0, filesAnalyzed);
        filesRejected = Math.max(0, filesRejected);
        filesSkipped = Math.max(0, filesSkipped);
        filesFailed = Math.max(0, filesFailed);
        filesTimedOut = Math.max(0, filesTimedOut);
        rejectionCounts = rejectionCounts == null ? Map.of() : Map.copyOf(rejectionCounts);
        notAnalyzed = notAnalyzed == null ? List.of() : List.copyOf(notAnalyzed);
    }

    public static RunStatistics empty() {
        return new RunStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if any discovered file was not analyzed.
     *
     * @return true if at least one file was rejected, skipped, failed or timed out
     */
    public boolean hasIncompleteFiles() {
        return filesRejected + filesSkipped + filesFailed + filesTimedOut > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Analyzed: %d, Rejected: %d, Skipped: %d, Failed: %d, Timed out: %d",
            filesDiscovered, filesAnalyzed, filesRejected, filesSkipped, filesFailed, filesTimedOut);
    }

    /**
     * Builder for constructing RunStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesAnalyzed = 0;
        private int filesRejected = 0;
        private int filesSkipped = 0;
        private int filesFailed = 0;
        private int filesTimedOut = 0;
        private final Map<RejectionReason, Integer> rejectionCounts = new EnumMap<>(RejectionReason.class);
        private final List<String> notAnalyzed = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder recordAnalyzed() {
            this.filesAnalyzed++;
            return this;
        }

        public Builder recordRejected(String file, RejectionReason reason) {
            this.filesRejected++;
            rejectionCounts.merge(reason, 1, Integer::sum);
            return list(file, reason.name());
        }

        public Builder recordSkipped(String file, String detail) {
            this.filesSkipped++;
            return list(file, detail);
        }

        public Builder recordFailed(String file, String detail) {
            this.filesFailed++;
            return list(file, detail);
        }

        public Builder recordTimedOut(String file, String detail) {
            this.filesTimedOut++;
            return list(file, detail);
        }

        private Builder list(String file, String detail) {
            if (notAnalyzed.size() < MAX_LISTED_FILES) {
                notAnalyzed.add(file + ": " + detail);
            }
            return this;
        }

        public RunStatistics build() {
            return new RunStatistics(filesDiscovered, filesAnalyzed, filesRejected, filesSkipped,
                filesFailed, filesTimedOut, rejectionCounts, notAnalyzed);
        }
    }
}
