package com.qualitylens.core.guard;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.util.AnalysisTimeoutException;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.Languages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InputGuard}.
 */
class InputGuardTest {

    @TempDir
    Path tempDir;

    private List<RejectionReason> rejections;
    private InputGuard guard;

    @BeforeEach
    void setUp() {
        rejections = new ArrayList<>();
        guard = new InputGuard(AnalyzerConfig.Limits.defaults().withMaxFileBytes(100), rejections::add);
    }

    // ==================== Content checks ====================

    @Test
    void validate_ordinaryContent_isAccepted() {
        GuardResult result = guard.validate("src/app.js", "js", "const a = 1;");

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.context().path()).isEqualTo("app.js");
        assertThat(result.context().language()).isEqualTo(Languages.JAVASCRIPT);
        assertThat(result.context().contentLength()).isEqualTo(12);
        assertThat(result.context().safe()).isTrue();
        assertThat(rejections).isEmpty();
    }

    @Test
    void validate_contentExactlyAtCeiling_isAccepted() {
        GuardResult result = guard.validate("app.js", "javascript", "x".repeat(100));

        assertThat(result.isAccepted()).isTrue();
    }

    @Test
    void validate_contentOneByteOverCeiling_isRejected() {
        GuardResult result = guard.validate("app.js", "javascript", "x".repeat(101));

        assertThat(result.reason()).isEqualTo(RejectionReason.FILE_TOO_LARGE);
        assertThat(rejections).containsExactly(RejectionReason.FILE_TOO_LARGE);
    }

    @Test
    void validate_multiByteContent_isMeasuredInUtf8Bytes() {
        // 40 characters, 120 bytes
        GuardResult result = guard.validate("app.js", "javascript", "€".repeat(40));

        assertThat(result.reason()).isEqualTo(RejectionReason.FILE_TOO_LARGE);
    }

    @Test
    void validate_evalCall_isRejectedAsSuspicious() {
        GuardResult result = guard.validate("app.js", "javascript", "eval('x')");

        assertThat(result.reason()).isEqualTo(RejectionReason.SUSPICIOUS_CONTENT);
        assertThat(result.acceptedContext()).isEmpty();
    }

    @Test
    void validate_suspiciousPatterns_areRejected() {
        assertThat(guard.validate("a.js", "js", "<SCRIPT src=x>").reason())
            .isEqualTo(RejectionReason.SUSPICIOUS_CONTENT);
        assertThat(guard.validate("a.js", "js", "new Function('return 1')").reason())
            .isEqualTo(RejectionReason.SUSPICIOUS_CONTENT);
        assertThat(guard.validate("a.js", "js", "setTimeout(\"tick()\", 10)").reason())
            .isEqualTo(RejectionReason.SUSPICIOUS_CONTENT);
        assertThat(rejections).hasSize(3);
    }

    @Test
    void validate_similarButHarmlessIdentifiers_areAccepted() {
        String content = """
            myFunction(1);
            retrieval(2);
            setTimeout(() => run(), 10);
            """;

        assertThat(guard.validate("a.js", "js", content).isAccepted()).isTrue();
    }

    @Test
    void validate_manyUnclosedScriptOpenings_isRejectedQuickly() {
        // Given
        InputGuard defaultGuard = new InputGuard(AnalyzerConfig.Limits.defaults(), rejections::add);
        String content = "<script".repeat(140_000);

        // When
        long started = System.nanoTime();
        GuardResult result = defaultGuard.validate("a.js", "js", content);

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        assertThat(result.reason()).isEqualTo(RejectionReason.SUSPICIOUS_CONTENT);
    }

    @Test
    void validate_scriptPrefixOfLongerWord_isScannedLinearlyAndAccepted() {
        // Given
        InputGuard defaultGuard = new InputGuard(AnalyzerConfig.Limits.defaults(), rejections::add);
        String content = "<scripts".repeat(120_000);

        // When
        long started = System.nanoTime();
        GuardResult result = defaultGuard.validate("a.js", "js", content);

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        assertThat(result.isAccepted()).isTrue();
    }

    @Test
    void validate_expiredDeadline_abortsContentScan() {
        Deadline expired = Deadline.after(Duration.ZERO);

        assertThatThrownBy(() -> guard.validate("a.js", "js", "const a = 1;", expired))
            .isInstanceOf(AnalysisTimeoutException.class);
        assertThat(rejections).isEmpty();
    }

    @Test
    void validate_nullContent_isUnreadable() {
        assertThat(guard.validate("a.js", "js", null).reason()).isEqualTo(RejectionReason.UNREADABLE);
    }

    // ==================== Path checks ====================

    @Test
    void validate_blankPath_isInvalid() {
        assertThat(guard.validate("  ", "js", "x").reason()).isEqualTo(RejectionReason.INVALID_PATH);
        assertThat(guard.validate(null, "js", "x").reason()).isEqualTo(RejectionReason.INVALID_PATH);
    }

    @Test
    void validate_nulInPath_isRejected() {
        assertThat(guard.validate("a\0.js", "js", "x").reason()).isEqualTo(RejectionReason.NULL_BYTE);
    }

    @Test
    void validate_traversalPath_isRejected() {
        assertThat(guard.validate("../../etc/passwd", "js", "x").reason())
            .isEqualTo(RejectionReason.PATH_TRAVERSAL);
    }

    @Test
    void validate_traversalThatNormalizesAway_isAccepted() {
        assertThat(guard.validate("src/../lib/a.js", "js", "x").isAccepted()).isTrue();
    }

    @Test
    void validate_overlongPath_isRejected() {
        String path = "a".repeat(501) + ".js";

        assertThat(guard.validate(path, "js", "x").reason()).isEqualTo(RejectionReason.PATH_TOO_LONG);
    }

    // ==================== File reads ====================

    @Test
    void validateAndRead_regularFile_readsContent() throws IOException {
        Path file = tempDir.resolve("app.js");
        Files.writeString(file, "let a = 1;");

        GuardResult result = guard.validateAndRead(file, "javascript");

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.context().content()).isEqualTo("let a = 1;");
    }

    @Test
    void validateAndRead_missingFile_isNotAFile() {
        GuardResult result = guard.validateAndRead(tempDir.resolve("missing.js"), "javascript");

        assertThat(result.reason()).isEqualTo(RejectionReason.NOT_A_FILE);
        assertThat(rejections).containsExactly(RejectionReason.NOT_A_FILE);
    }

    @Test
    void validateAndRead_directory_isNotAFile() {
        assertThat(guard.validateAndRead(tempDir, "javascript").reason()).isEqualTo(RejectionReason.NOT_A_FILE);
    }

    @Test
    void validateAndRead_oversizedFile_isRejectedBeforeReading() throws IOException {
        Path file = tempDir.resolve("big.js");
        Files.writeString(file, "x".repeat(101));

        assertThat(guard.validateAndRead(file, "javascript").reason()).isEqualTo(RejectionReason.FILE_TOO_LARGE);
    }

    @Test
    void validateAndRead_nullPath_isInvalid() {
        assertThat(guard.validateAndRead(null, "javascript").reason()).isEqualTo(RejectionReason.INVALID_PATH);
    }
}
