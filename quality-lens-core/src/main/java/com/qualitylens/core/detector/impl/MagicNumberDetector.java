package com.qualitylens.core.detector.impl;

import com.qualitylens.core.detector.DetectionContext;
import com.qualitylens.core.detector.base.AbstractLineDetector;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Flags bare integer literals that should be named constants.
 *
 * <p>Matches integers from 20 upwards and any integer of three or more digits; the
 * numbers 0 to 19 are treated as self-explanatory. Decimals and digits inside
 * identifiers are not matched. A line that mentions any word of the configured
 * allow-list (case-insensitive) is skipped entirely.
 */
public class MagicNumberDetector extends AbstractLineDetector {

    private static final Pattern BARE_INTEGER = Pattern.compile("(?:[^.\\w]|^)([2-9]\\d+|\\d{3,})(?![.\\w])");

    @Override
    public String getId() {
        return "unnamed-constant";
    }

    @Override
    public String getDisplayName() {
        return "Magic Number Detector";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.UNNAMED_CONSTANT;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    protected void detectLine(int lineNumber, String rawLine, String maskedLine,
                              DetectionContext context, List<Finding> findings) {
        if (isAllowListed(rawLine, context.config().magicNumberAllowList())) {
            return;
        }
        for (MatchResult match : findMatches(BARE_INTEGER, maskedLine)) {
            findings.add(createFinding(context, FindingSeverity.INFO, lineNumber, match.start(1) + 1,
                Map.of("number", match.group(1))));
        }
    }

    private static boolean isAllowListed(String line, List<String> allowList) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String word : allowList) {
            if (word != null && !word.isBlank() && lower.contains(word.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
