package com.qualitylens.core.metric.impl;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.metric.ComplexityCounter;
import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.metric.base.AbstractMetricCalculator;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;
import com.qualitylens.core.model.SourceUnit;

import java.util.Map;

/**
 * Reports units whose cyclomatic complexity proxy exceeds the configured threshold.
 *
 * <p>Severity is a warning above {@code complexity} and an error above
 * {@code complexityError}.
 */
public class CyclomaticComplexityCalculator extends AbstractMetricCalculator {

    @Override
    public String getId() {
        return "complexity";
    }

    @Override
    public String getDisplayName() {
        return "Cyclomatic Complexity Calculator";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.COMPLEXITY;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected Finding measure(SourceUnit unit, MetricContext context) {
        AnalyzerConfig.Thresholds thresholds = context.thresholds();
        String maskedBody = context.source().maskedSpan(unit.startLine(), unit.endLine());
        int complexity = ComplexityCounter.complexity(maskedBody, thresholds.complexityCeiling());
        if (complexity <= thresholds.complexity()) {
            return null;
        }
        FindingSeverity severity = complexity > thresholds.complexityError()
            ? FindingSeverity.ERROR
            : FindingSeverity.WARNING;
        return createFinding(context, unit, severity,
            Map.of("unitName", unit.name(), "complexity", complexity));
    }
}
