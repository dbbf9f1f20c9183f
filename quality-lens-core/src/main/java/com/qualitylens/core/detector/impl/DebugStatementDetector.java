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
 * Flags console output calls left in code.
 */
public class DebugStatementDetector extends AbstractLineDetector {

    private static final Pattern CONSOLE_CALL = Pattern.compile(
        "(?<![\\w$.])console\\s*\\.\\s*(log|warn|error|info|debug|trace)\\s*\\(");

    @Override
    public String getId() {
        return "debug-statement";
    }

    @Override
    public String getDisplayName() {
        return "Debug Statement Detector";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.DEBUG_STATEMENT;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    protected void detectLine(int lineNumber, String rawLine, String maskedLine,
                              DetectionContext context, List<Finding> findings) {
        for (MatchResult match : findMatches(CONSOLE_CALL, maskedLine)) {
            findings.add(createFinding(context, FindingSeverity.WARNING, lineNumber, match.start() + 1,
                Map.of("method", match.group(1))));
        }
    }
}
