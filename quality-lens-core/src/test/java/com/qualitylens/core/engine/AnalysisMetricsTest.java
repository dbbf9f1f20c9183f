package com.qualitylens.core.engine;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnalysisMetricsTest {

    @Test
    void snapshot_averageLatency_isTrueMean() {
        AnalysisMetrics metrics = new AnalysisMetrics();

        metrics.recordAnalysis(2, 2_000_000);
        metrics.recordAnalysis(3, 4_000_000);

        AnalysisMetrics.Snapshot snapshot = metrics.snapshot();
        assertThat(snapshot.filesAnalyzed()).isEqualTo(2);
        assertThat(snapshot.totalFindings()).isEqualTo(5);
        assertThat(snapshot.averageLatencyMillis()).isCloseTo(3.0, within(0.0001));
    }

    @Test
    void snapshot_noAnalyses_hasZeroLatency() {
        assertThat(new AnalysisMetrics().snapshot().averageLatencyMillis()).isZero();
    }

    @Test
    void counters_areIndependent() {
        AnalysisMetrics metrics = new AnalysisMetrics();

        metrics.recordRejection();
        metrics.recordRejection();
        metrics.recordFailure();
        metrics.recordTimeout();
        metrics.recordSkipped();

        AnalysisMetrics.Snapshot snapshot = metrics.snapshot();
        assertThat(snapshot.securityRejections()).isEqualTo(2);
        assertThat(snapshot.failures()).isEqualTo(1);
        assertThat(snapshot.timeouts()).isEqualTo(1);
        assertThat(snapshot.skipped()).isEqualTo(1);
        assertThat(snapshot.filesAnalyzed()).isZero();
    }

    @Test
    void reset_clearsSkippedCounter() {
        AnalysisMetrics metrics = new AnalysisMetrics();
        metrics.recordSkipped();

        metrics.reset();

        assertThat(metrics.snapshot().skipped()).isZero();
    }

    @Test
    void recordAnalysis_concurrentUpdates_areNotLost() throws InterruptedException {
        AnalysisMetrics metrics = new AnalysisMetrics();
        ExecutorService executor = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 1_000; i++) {
            executor.submit(() -> metrics.recordAnalysis(1, 1_000));
        }
        executor.shutdown();

        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(metrics.snapshot().filesAnalyzed()).isEqualTo(1_000);
        assertThat(metrics.snapshot().totalFindings()).isEqualTo(1_000);
    }
}
