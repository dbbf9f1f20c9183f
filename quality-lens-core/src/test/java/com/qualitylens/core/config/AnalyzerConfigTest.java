package com.qualitylens.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalyzerConfig} validation.
 */
class AnalyzerConfigTest {

    @Test
    void limits_zeroCeiling_isRejected() {
        assertThatThrownBy(() -> AnalyzerConfig.Limits.defaults().withMaxFileBytes(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxFileBytes");
    }

    @Test
    void limits_negativeCeiling_isRejected() {
        assertThatThrownBy(() -> new AnalyzerConfig.Limits(null, null, null, null, null, null, null,
            -1, null, null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBraceDepth");
    }

    @Test
    void limits_fileCeilingAtIntegerMaximum_isRejected() {
        assertThatThrownBy(() -> AnalyzerConfig.Limits.defaults().withMaxFileBytes(Integer.MAX_VALUE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not exceed");
    }

    @Test
    void limits_fileCeilingAtLargestAllowedValue_isAccepted() {
        AnalyzerConfig.Limits limits = AnalyzerConfig.Limits.defaults()
            .withMaxFileBytes(AnalyzerConfig.Limits.MAX_FILE_BYTES_CEILING);

        assertThat(limits.maxFileBytes()).isEqualTo(AnalyzerConfig.Limits.MAX_FILE_BYTES_CEILING);
    }

    @Test
    void limits_nonPositiveTimeout_fallsBackToDefault() {
        assertThat(AnalyzerConfig.Limits.defaults().withAnalysisTimeoutMillis(0).analysisTimeoutMillis())
            .isEqualTo(30_000L);
    }
}
