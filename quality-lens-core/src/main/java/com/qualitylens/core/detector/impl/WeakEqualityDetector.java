package com.qualitylens.core.detector.impl;

import com.qualitylens.core.detector.DetectionContext;
import com.qualitylens.core.detector.base.AbstractLineDetector;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;

import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Flags loose {@code ==} and {@code !=} comparisons.
 *
 * <p>Strict forms ({@code ===}, {@code !==}) are excluded by the surrounding lookarounds.
 */
public class WeakEqualityDetector extends AbstractLineDetector {

    private static final Pattern LOOSE_OPERATOR = Pattern.compile("(?<![=!<>])([!=]=)(?!=)");

    @Override
    public String getId() {
        return "weak-equality";
    }

    @Override
    public String getDisplayName() {
        return "Weak Equality Detector";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.WEAK_EQUALITY;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    protected void detectLine(int lineNumber, String rawLine, String maskedLine,
                              DetectionContext context, List<Finding> findings) {
        for (MatchResult match : findMatches(LOOSE_OPERATOR, maskedLine)) {
            String operator = match.group(1);
            findings.add(createFinding(context, FindingSeverity.WARNING, lineNumber, match.start(1) + 1,
                Map.of("operator", operator, "strictOperator", operator + "=")));
        }
    }
}
