package com.qualitylens.core.guard;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.model.AnalysisContext;
import com.qualitylens.core.util.AnalysisTimeoutException;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.Languages;
import com.qualitylens.core.util.Sanitizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Validates a candidate file path and its content before any analysis touches it.
 *
 * <p>Rejections are outcomes, not errors: every method returns a {@link GuardResult}
 * and never throws for malformed input. Each rejection is logged with the sanitized
 * file name and reported to the rejection listener exactly once.
 *
 * <p>The content scan runs under the caller's {@link Deadline}, so it counts against the
 * same per-file budget as the analysis that follows. Every pattern is linear in the
 * content length.
 *
 * <p><b>Checks, in order:</b>
 * <ol>
 *   <li>path present and non-blank</li>
 *   <li>no embedded NUL character</li>
 *   <li>path length within the ceiling</li>
 *   <li>normalized path free of {@code ..} segments</li>
 *   <li>content size within the byte ceiling (inclusive)</li>
 *   <li>content free of high-risk patterns</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class InputGuard {

    private static final Logger log = LoggerFactory.getLogger(InputGuard.class);

    /**
     * Content patterns treated as unsafe to analyze: embedded script tags, dynamic
     * evaluation and string-based timer callbacks.
     */
    static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
        Pattern.compile("<script\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\beval\\s*\\("),
        Pattern.compile("\\bFunction\\s*\\("),
        Pattern.compile("\\bsetTimeout\\s*\\(\\s*['\"`]"),
        Pattern.compile("\\bsetInterval\\s*\\(\\s*['\"`]")
    );

    private final AnalyzerConfig.Limits limits;
    private final Consumer<RejectionReason> rejectionListener;

    /**
     * Creates a guard that reports rejections to the given listener.
     *
     * @param limits resource ceilings
     * @param rejectionListener called once per rejection, e.g. to bump a counter
     */
    public InputGuard(AnalyzerConfig.Limits limits, Consumer<RejectionReason> rejectionListener) {
        this.limits = limits;
        this.rejectionListener = rejectionListener != null ? rejectionListener : reason -> { };
    }

    /**
     * Validates a path and content supplied by the caller.
     *
     * @param path file path as given by the caller
     * @param language canonical or alias language tag
     * @param rawContent file content
     * @return accepted context or rejection
     */
    public GuardResult validate(String path, String language, String rawContent) {
        return validate(path, language, rawContent, Deadline.none());
    }

    /**
     * Validates a path and content supplied by the caller within a time budget.
     *
     * @param path file path as given by the caller
     * @param language canonical or alias language tag
     * @param rawContent file content
     * @param deadline budget shared with the analysis of this file
     * @return accepted context or rejection
     * @throws AnalysisTimeoutException if the budget runs out during the content scan
     */
    public GuardResult validate(String path, String language, String rawContent, Deadline deadline) {
        GuardResult pathResult = checkPath(path);
        if (pathResult != null) {
            return pathResult;
        }
        if (rawContent == null) {
            return reject(path, RejectionReason.UNREADABLE, "no content supplied");
        }
        long byteLength = utf8Length(rawContent);
        if (byteLength > limits.maxFileBytes()) {
            return reject(path, RejectionReason.FILE_TOO_LARGE,
                "content is " + byteLength + " bytes, ceiling is " + limits.maxFileBytes());
        }
        return checkContent(path, language, rawContent, deadline);
    }

    /**
     * Validates a path and reads its content with a bounded read.
     *
     * @param file file to read
     * @param language canonical or alias language tag
     * @return accepted context or rejection
     */
    public GuardResult validateAndRead(Path file, String language) {
        return validateAndRead(file, language, Deadline.none());
    }

    /**
     * Validates a path and reads its content with a bounded read, within a time budget.
     *
     * @param file file to read
     * @param language canonical or alias language tag
     * @param deadline budget shared with the analysis of this file
     * @return accepted context or rejection
     * @throws AnalysisTimeoutException if the budget runs out during the content scan
     */
    public GuardResult validateAndRead(Path file, String language, Deadline deadline) {
        String rawPath = file == null ? null : file.toString();
        GuardResult pathResult = checkPath(rawPath);
        if (pathResult != null) {
            return pathResult;
        }
        try {
            if (!Files.isRegularFile(file)) {
                return reject(rawPath, RejectionReason.NOT_A_FILE, "not a regular file");
            }
            long size = Files.size(file);
            if (size > limits.maxFileBytes()) {
                return reject(rawPath, RejectionReason.FILE_TOO_LARGE,
                    "file is " + size + " bytes, ceiling is " + limits.maxFileBytes());
            }
            byte[] bytes = readBounded(file, limits.maxFileBytes());
            if (bytes.length > limits.maxFileBytes()) {
                return reject(rawPath, RejectionReason.FILE_TOO_LARGE,
                    "file grew beyond the ceiling while reading");
            }
            return checkContent(rawPath, language, new String(bytes, StandardCharsets.UTF_8), deadline);
        } catch (IOException | SecurityException e) {
            return reject(rawPath, RejectionReason.UNREADABLE, Sanitizers.sanitizeError(e));
        }
    }

    private GuardResult checkPath(String path) {
        if (path == null || path.isBlank()) {
            return reject(path, RejectionReason.INVALID_PATH, "path is empty");
        }
        if (path.indexOf('\0') >= 0) {
            return reject(path, RejectionReason.NULL_BYTE, "path contains a NUL character");
        }
        if (path.length() > limits.maxPathLength()) {
            return reject(path, RejectionReason.PATH_TOO_LONG,
                "path is " + path.length() + " characters, ceiling is " + limits.maxPathLength());
        }
        try {
            Path normalized = Path.of(path).normalize();
            for (Path segment : normalized) {
                if ("..".equals(segment.toString())) {
                    return reject(path, RejectionReason.PATH_TRAVERSAL, "path escapes its root");
                }
            }
        } catch (InvalidPathException e) {
            return reject(path, RejectionReason.INVALID_PATH, Sanitizers.sanitizeError(e));
        }
        return null;
    }

    private GuardResult checkContent(String path, String language, String content, Deadline deadline) {
        for (Pattern pattern : SUSPICIOUS_PATTERNS) {
            deadline.checkpoint();
            if (pattern.matcher(content).find()) {
                return reject(path, RejectionReason.SUSPICIOUS_CONTENT,
                    "content matches high-risk pattern " + pattern.pattern());
            }
        }
        String canonical = Languages.canonical(language).orElse(Languages.SCRIPT);
        return GuardResult.accepted(new AnalysisContext(
            Sanitizers.sanitizePath(path),
            canonical,
            content,
            content.length(),
            true
        ));
    }

    private GuardResult reject(String path, RejectionReason reason, String detail) {
        log.warn("Skipping {}: {} ({})", Sanitizers.sanitizePath(path), reason, detail);
        rejectionListener.accept(reason);
        return GuardResult.rejected(reason, detail);
    }

    private static byte[] readBounded(Path file, int maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            // one byte past the ceiling detects growth; Limits caps maxBytes at MAX_FILE_BYTES_CEILING
            return in.readNBytes(maxBytes + 1);
        }
    }

    private static long utf8Length(String text) {
        long bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()
                && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
