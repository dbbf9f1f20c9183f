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
 * Flags {@code var} declarations, which lack block scoping.
 *
 * <p>The keyword must sit at a statement boundary (line start, after a separator or an
 * opening delimiter) and be followed by a binding, so identifiers such as
 * {@code variable} or property accesses like {@code obj.var} are not reported.
 */
public class DeprecatedDeclarationDetector extends AbstractLineDetector {

    private static final Pattern VAR_DECLARATION = Pattern.compile(
        "(?:^|[\\s;(){}])(var)\\s+[A-Za-z_$\\[{]");

    @Override
    public String getId() {
        return "deprecated-declaration";
    }

    @Override
    public String getDisplayName() {
        return "Deprecated Declaration Detector";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.DEPRECATED_DECLARATION;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected void detectLine(int lineNumber, String rawLine, String maskedLine,
                              DetectionContext context, List<Finding> findings) {
        for (MatchResult match : findMatches(VAR_DECLARATION, maskedLine)) {
            findings.add(createFinding(context, FindingSeverity.WARNING,
                lineNumber, match.start(1) + 1, Map.of()));
        }
    }
}
