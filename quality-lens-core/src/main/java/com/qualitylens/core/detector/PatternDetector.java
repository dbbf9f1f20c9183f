package com.qualitylens.core.detector;

import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingType;

import java.util.List;

/**
 * A scanner for one anti-pattern family.
 *
 * <p>Detectors are discovered via Java Service Provider Interface (SPI) and run in
 * priority order (lower numbers first). They are independent of each other: a detector
 * never sees another detector's findings, and a failure in one does not stop the rest.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.qualitylens.core.detector.PatternDetector}
 *
 * @see DetectionContext
 */
public interface PatternDetector {

    /**
     * Returns unique identifier for this detector, in kebab-case.
     *
     * @return detector identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the rule family this detector reports.
     *
     * @return finding type
     */
    FindingType getFindingType();

    /**
     * Returns execution priority. Lower values execute first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Scans the file and returns one finding per occurrence.
     *
     * <p>Must return an empty list, never throw, for input it cannot interpret.
     * Only {@link com.qualitylens.core.util.AnalysisTimeoutException} may escape.
     *
     * @param context per-file detection context
     * @return findings in line order
     */
    List<Finding> detect(DetectionContext context);
}
