package com.qualitylens.core.engine;

import com.qualitylens.core.detector.PatternDetector;
import com.qualitylens.core.metric.MetricCalculator;
import com.qualitylens.core.principle.PrincipleChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers detectors, calculators and checkers via {@link ServiceLoader}.
 *
 * <p>Results are sorted so that execution order, and therefore output order, does not
 * depend on classpath order.
 */
final class ServiceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ServiceDiscovery.class);

    private ServiceDiscovery() {
        // Utility class
    }

    static List<PatternDetector> detectors() {
        List<PatternDetector> detectors = load(PatternDetector.class);
        detectors.sort(Comparator.comparingInt(PatternDetector::getPriority).thenComparing(PatternDetector::getId));
        log.debug("Discovered {} pattern detectors", detectors.size());
        if (log.isTraceEnabled()) {
            detectors.forEach(d -> log.trace("  - {} ({})", d.getId(), d.getDisplayName()));
        }
        return detectors;
    }

    static List<MetricCalculator> calculators() {
        List<MetricCalculator> calculators = load(MetricCalculator.class);
        calculators.sort(Comparator.comparingInt(MetricCalculator::getPriority).thenComparing(MetricCalculator::getId));
        log.debug("Discovered {} metric calculators", calculators.size());
        return calculators;
    }

    static List<PrincipleChecker> checkers() {
        List<PrincipleChecker> checkers = load(PrincipleChecker.class);
        checkers.sort(Comparator.comparing(PrincipleChecker::getPrinciple));
        log.debug("Discovered {} principle checkers", checkers.size());
        return checkers;
    }

    private static <T> List<T> load(Class<T> type) {
        ServiceLoader<T> loader = ServiceLoader.load(type, ServiceDiscovery.class.getClassLoader());
        List<T> services = new ArrayList<>();
        loader.forEach(services::add);
        return services;
    }
}
