package com.qualitylens.core.metric;

import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingType;

import java.util.List;

/**
 * Derives one quality metric and reports threshold breaches as findings.
 *
 * <p>Calculators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.qualitylens.core.metric.MetricCalculator}
 *
 * @see MetricContext
 */
public interface MetricCalculator {

    String getId();

    String getDisplayName();

    FindingType getFindingType();

    /**
     * Returns execution priority. Lower values execute first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Returns true if this calculator measures extracted units and can be skipped when a
     * file yields none.
     *
     * @return whether units are required
     */
    default boolean requiresUnits() {
        return true;
    }

    /**
     * Measures the file and returns findings for every breach.
     *
     * @param context per-file metric context
     * @return findings
     */
    List<Finding> calculate(MetricContext context);
}
