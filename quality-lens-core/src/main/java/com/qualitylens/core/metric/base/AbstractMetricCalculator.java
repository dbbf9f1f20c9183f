package com.qualitylens.core.metric.base;

import com.qualitylens.core.i18n.FindingFactory;
import com.qualitylens.core.metric.MetricCalculator;
import com.qualitylens.core.metric.MetricContext;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for calculators that measure each unit independently.
 *
 * <p>Subclasses implement {@link #measure(SourceUnit, MetricContext)} and return a
 * finding for a breach, or null.
 */
public abstract class AbstractMetricCalculator implements MetricCalculator {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public List<Finding> calculate(MetricContext context) {
        List<Finding> findings = new ArrayList<>();
        for (SourceUnit unit : context.units()) {
            context.deadline().checkpoint();
            Finding finding = measure(unit, context);
            if (finding != null) {
                findings.add(finding);
            }
        }
        log.trace("{} produced {} findings for {}", getId(), findings.size(), context.path());
        return findings;
    }

    /**
     * Measures one unit.
     *
     * @param unit unit to measure
     * @param context metric context
     * @return finding for a threshold breach, or null
     */
    protected abstract Finding measure(SourceUnit unit, MetricContext context);

    /**
     * Builds a finding located at the unit's declaration.
     *
     * @param context metric context
     * @param unit measured unit
     * @param severity severity
     * @param params message placeholders
     * @return finding
     */
    protected Finding createFinding(MetricContext context, SourceUnit unit,
                                    FindingSeverity severity, Map<String, ?> params) {
        return FindingFactory.create(context.messages(), getFindingType(), severity,
            unit.startLine(), unit.startColumn(), params);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
