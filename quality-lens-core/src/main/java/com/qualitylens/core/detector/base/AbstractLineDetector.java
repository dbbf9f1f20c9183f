package com.qualitylens.core.detector.base;

import com.qualitylens.core.detector.DetectionContext;
import com.qualitylens.core.detector.PatternDetector;
import com.qualitylens.core.i18n.FindingFactory;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for detectors that match regular expressions line by line.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per detector class)</li>
 *   <li>The line loop, including the line-length ceiling and the deadline checkpoint</li>
 *   <li>Match collection over masked lines, so comments and literals never match</li>
 *   <li>Finding construction with localized message and suggestion</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #detectLine(int, String, String, DetectionContext, List)}.
 */
public abstract class AbstractLineDetector implements PatternDetector {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public List<Finding> detect(DetectionContext context) {
        if (context == null) {
            return List.of();
        }
        List<String> raw = context.source().rawLines();
        List<String> masked = context.source().maskedLines();
        int maxLineLength = context.config().limits().maxLineLength();

        List<Finding> findings = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < raw.size(); i++) {
            context.deadline().checkpoint();
            String rawLine = raw.get(i);
            String maskedLine = masked.get(i);
            if (rawLine == null || maskedLine == null || maskedLine.isBlank()) {
                continue;
            }
            if (rawLine.length() > maxLineLength) {
                skipped++;
                continue;
            }
            detectLine(i + 1, rawLine, maskedLine, context, findings);
        }
        if (skipped > 0) {
            log.debug("{} skipped {} lines longer than {} characters in {}", getId(), skipped, maxLineLength, context.path());
        }
        return findings;
    }

    /**
     * Scans a single line.
     *
     * @param lineNumber 1-based line number
     * @param rawLine line as written
     * @param maskedLine line with comments and literal contents blanked
     * @param context detection context
     * @param findings sink for findings
     */
    protected abstract void detectLine(int lineNumber, String rawLine, String maskedLine,
                                       DetectionContext context, List<Finding> findings);

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return snapshots of every match
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    // ==================== Finding Construction ====================

    /**
     * Builds a finding whose message and suggestion come from the localization bundle.
     *
     * <p>Keys are {@code finding.<type>.message} and {@code finding.<type>.suggestion}.
     *
     * @param context detection context
     * @param severity severity
     * @param line 1-based line
     * @param column 1-based column
     * @param params message placeholders
     * @return finding
     */
    protected Finding createFinding(DetectionContext context, FindingSeverity severity,
                                    int line, int column, Map<String, ?> params) {
        return FindingFactory.create(context.messages(), getFindingType(), severity, line, column, params);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
