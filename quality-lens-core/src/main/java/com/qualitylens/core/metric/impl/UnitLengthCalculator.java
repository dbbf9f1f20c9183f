package com.qualitylens.core.metric.impl;

import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.metric.base.AbstractMetricCalculator;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;
import com.qualitylens.core.model.SourceUnit;

import java.util.Map;

/**
 * Reports units whose body spans more lines than allowed.
 */
public class UnitLengthCalculator extends AbstractMetricCalculator {

    @Override
    public String getId() {
        return "unit-length";
    }

    @Override
    public String getDisplayName() {
        return "Unit Length Calculator";
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.UNIT_LENGTH;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    protected Finding measure(SourceUnit unit, MetricContext context) {
        int length = unit.lineCount();
        if (length <= context.thresholds().unitLength()) {
            return null;
        }
        return createFinding(context, unit, FindingSeverity.WARNING,
            Map.of("unitName", unit.name(), "length", length));
    }
}
