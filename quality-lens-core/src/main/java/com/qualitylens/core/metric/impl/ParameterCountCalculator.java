package com.qualitylens.core.metric.impl;

import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.metric.base.AbstractMetricCalculator;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;
import com.qualitylens.core.model.SourceUnit;

import java.util.Map;

/**
 * Reports units that take more parameters than allowed, suggesting a parameter object.
 *
 * <p>Counts the sanitized parameter list, which the extractor already caps.
 */
public class ParameterCountCalculator extends AbstractMetricCalculator {

    @Override
    public String getId() {
        return "parameter-count";
    }

    @Override
    public String getDisplayName() {
        return "Parameter Count Calculator";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.PARAMETER_COUNT;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    protected Finding measure(SourceUnit unit, MetricContext context) {
        int count = unit.parameterCount();
        if (count <= context.thresholds().parameterCount()) {
            return null;
        }
        return createFinding(context, unit, FindingSeverity.WARNING,
            Map.of("unitName", unit.name(), "parameterCount", count));
    }
}
