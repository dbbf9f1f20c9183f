package com.qualitylens.core.metric.impl;

import com.qualitylens.core.i18n.FindingFactory;
import com.qualitylens.core.metric.MetricCalculator;
import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Reports the deepest brace nesting of a whole file.
 *
 * <p>The running depth is computed over masked lines, floored at zero and clamped at the
 * brace depth ceiling, so unbalanced or adversarial input can never produce a negative
 * or unbounded value. At most one finding is emitted, located at the brace where the
 * maximum depth was first reached.
 */
public class NestingDepthCalculator implements MetricCalculator {

    private static final Logger log = LoggerFactory.getLogger(NestingDepthCalculator.class);

    @Override
    public String getId() {
        return "nesting-depth";
    }

    @Override
    public String getDisplayName() {
        return "Nesting Depth Calculator";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.NESTING_DEPTH;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public boolean requiresUnits() {
        return false;
    }

    @Override
    public List<Finding> calculate(MetricContext context) {
        DepthProfile profile = profile(context.source().maskedLines(),
            context.config().limits().maxBraceDepth(), context);
        int threshold = context.thresholds().nestingDepth();
        if (profile.maxDepth() <= threshold) {
            return List.of();
        }
        log.debug("Maximum nesting depth {} exceeds {} in {}", profile.maxDepth(), threshold, context.path());
        return List.of(FindingFactory.create(context.messages(), getFindingType(), FindingSeverity.WARNING,
            profile.line(), profile.column(), Map.of("maxDepth", profile.maxDepth())));
    }

    /**
     * Computes the maximum brace depth of masked lines.
     *
     * @param maskedLines masked lines
     * @param ceiling depth ceiling
     * @param context metric context, for deadline checks
     * @return maximum depth and the 1-based location where it was first reached
     */
    static DepthProfile profile(List<String> maskedLines, int ceiling, MetricContext context) {
        int depth = 0;
        int maxDepth = 0;
        int maxLine = 1;
        int maxColumn = 1;
        for (int i = 0; i < maskedLines.size(); i++) {
            context.deadline().checkpoint();
            String line = maskedLines.get(i);
            for (int c = 0; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    depth = Math.min(ceiling, depth + 1);
                    if (depth > maxDepth) {
                        maxDepth = depth;
                        maxLine = i + 1;
                        maxColumn = c + 1;
                    }
                } else if (ch == '}') {
                    depth = Math.max(0, depth - 1);
                }
            }
        }
        return new DepthProfile(maxDepth, maxLine, maxColumn);
    }

    /**
     * Maximum depth and where it was first reached.
     *
     * @param maxDepth maximum depth, between 0 and the ceiling
     * @param line 1-based line
     * @param column 1-based column
     */
    record DepthProfile(int maxDepth, int line, int column) {
    }
}
