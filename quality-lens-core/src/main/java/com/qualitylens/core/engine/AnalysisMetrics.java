package com.qualitylens.core.engine;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-level counters owned by one {@link AnalysisEngine}.
 *
 * <p>All counters are atomic, so files may be analyzed concurrently by the caller.
 * Average latency is the true mean over analyzed files.
 */
public class AnalysisMetrics {

    private final AtomicLong filesAnalyzed = new AtomicLong();
    private final AtomicLong totalFindings = new AtomicLong();
    private final AtomicLong securityRejections = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();

    /**
     * Records a completed file analysis.
     *
     * @param findings number of findings returned for the file
     * @param latencyNanos elapsed time
     */
    public void recordAnalysis(int findings, long latencyNanos) {
        filesAnalyzed.incrementAndGet();
        totalFindings.addAndGet(findings);
        totalLatencyNanos.addAndGet(Math.max(0, latencyNanos));
    }

    public void recordRejection() {
        securityRejections.incrementAndGet();
    }

    public void recordFailure() {
        failures.incrementAndGet();
    }

    public void recordTimeout() {
        timeouts.incrementAndGet();
    }

    /**
     * Records a file that was accepted but not analyzed: unsupported language or too many lines.
     */
    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    /**
     * Zeroes every counter.
     */
    public void reset() {
        filesAnalyzed.set(0);
        totalFindings.set(0);
        securityRejections.set(0);
        failures.set(0);
        timeouts.set(0);
        skipped.set(0);
        totalLatencyNanos.set(0);
    }

    /**
     * Returns a point-in-time copy of the counters.
     *
     * @return snapshot
     */
    public Snapshot snapshot() {
        long analyzed = filesAnalyzed.get();
        double averageMillis = analyzed == 0 ? 0.0 : totalLatencyNanos.get() / (double) analyzed / 1_000_000.0;
        return new Snapshot(analyzed, totalFindings.get(), securityRejections.get(),
            failures.get(), timeouts.get(), skipped.get(), averageMillis);
    }

    /**
     * Immutable view of the counters.
     *
     * @param filesAnalyzed files that completed analysis
     * @param totalFindings findings returned across those files
     * @param securityRejections files rejected by the input guard
     * @param failures files whose analysis failed unexpectedly
     * @param timeouts files whose analysis exceeded its budget
     * @param skipped files not analyzed because of their language or line count
     * @param averageLatencyMillis mean analysis time of completed files
     */
    public record Snapshot(
        long filesAnalyzed,
        long totalFindings,
        long securityRejections,
        long failures,
        long timeouts,
        long skipped,
        double averageLatencyMillis
    ) {
    }
}
