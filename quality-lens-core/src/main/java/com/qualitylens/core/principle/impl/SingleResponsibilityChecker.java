package com.qualitylens.core.principle.impl;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.metric.ComplexityCounter;
import com.qualitylens.core.model.Concern;
import com.qualitylens.core.model.Principle;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.model.ViolationMetrics;
import com.qualitylens.core.model.ViolationSeverity;
import com.qualitylens.core.principle.PrincipleContext;
import com.qualitylens.core.principle.base.AbstractPrincipleChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the single-responsibility principle.
 *
 * <p>Four sub-checks run per file:
 * <ol>
 *   <li><b>Overload</b>: per container, the method count, combined unit complexity and
 *       distinct import concerns are bucketed; any value at or above its low bound yields
 *       one violation with the worst of the three severities.</li>
 *   <li><b>Size</b>: per container, the number of lines.</li>
 *   <li><b>Parameters</b>: per unit, the number of parameters.</li>
 *   <li><b>Containers</b>: the number of classes declared in the file.</li>
 * </ol>
 */
public class SingleResponsibilityChecker extends AbstractPrincipleChecker {

    @Override
    public Principle getPrinciple() {
        return Principle.SINGLE_RESPONSIBILITY;
    }

    @Override
    public List<Violation> check(PrincipleContext context) {
        List<Violation> violations = new ArrayList<>();
        Set<Concern> concerns = classifyImportConcerns(context.imports());

        for (SourceContainer container : context.containers()) {
            context.deadline().checkpoint();
            checkOverload(context, container, concerns, violations);
            checkSize(context, container, violations);
        }
        checkParameters(context, violations);
        checkContainerCount(context, violations);

        log.debug("{} SRP violations in {}", violations.size(), context.path());
        return violations;
    }

    private void checkOverload(PrincipleContext context, SourceContainer container,
                               Set<Concern> concerns, List<Violation> violations) {
        AnalyzerConfig.PrincipleThresholds thresholds = context.thresholds();
        int methodCount = container.units().size();
        int complexity = combinedComplexity(context, container);
        int concernCount = concerns.size();

        boolean breached = methodCount >= thresholds.methodCount().low()
            || complexity >= thresholds.combinedComplexity().low()
            || concernCount >= thresholds.concerns().low();
        if (!breached) {
            return;
        }

        ViolationSeverity severity = ViolationSeverity.worst(
            severityFromThresholds(methodCount, thresholds.methodCount()),
            ViolationSeverity.worst(
                severityFromThresholds(complexity, thresholds.combinedComplexity()),
                severityFromThresholds(concernCount, thresholds.concerns())));

        List<String> concernIds = concerns.stream().map(Concern::id).toList();
        Map<String, Object> params = Map.of(
            "containerName", container.name(),
            "methodCount", methodCount,
            "complexity", complexity,
            "concernCount", concernCount,
            "concerns", concernIds.isEmpty() ? "-" : String.join(", ", concernIds),
            "concernServices", serviceNames(concerns, container.name()));

        violations.add(createViolation(context, Location.container(container.startLine(), container.name()),
            severity, "principle.srp.overload", params,
            ViolationMetrics.builder()
                .methodCount(methodCount)
                .complexity(complexity)
                .concerns(concernIds)
                .lineCount(container.lineCount())
                .build()));
    }

    private void checkSize(PrincipleContext context, SourceContainer container, List<Violation> violations) {
        AnalyzerConfig.ThresholdBand band = context.thresholds().containerSize();
        int lineCount = container.lineCount();
        if (lineCount < band.low()) {
            return;
        }
        violations.add(createViolation(context, Location.container(container.startLine(), container.name()),
            severityFromThresholds(lineCount, band), "principle.srp.size",
            Map.of("containerName", container.name(), "lineCount", lineCount),
            ViolationMetrics.builder().lineCount(lineCount).methodCount(container.units().size()).build()));
    }

    private void checkParameters(PrincipleContext context, List<Violation> violations) {
        AnalyzerConfig.ThresholdBand band = context.thresholds().unitParameters();
        for (SourceUnit unit : context.units()) {
            int count = unit.parameterCount();
            if (count < band.low()) {
                continue;
            }
            String owner = ownerOf(context, unit);
            violations.add(createViolation(context, Location.unit(unit.startLine(), owner, unit.name()),
                severityFromThresholds(count, band), "principle.srp.parameters",
                Map.of("unitName", unit.name(), "parameterCount", count),
                ViolationMetrics.builder().parameterCount(count).build()));
        }
    }

    private void checkContainerCount(PrincipleContext context, List<Violation> violations) {
        AnalyzerConfig.ThresholdBand band = context.thresholds().containersPerFile();
        List<String> classNames = context.containers().stream()
            .filter(container -> container.kind() == SourceContainer.Kind.CLASS)
            .map(SourceContainer::name)
            .toList();
        if (classNames.size() < band.low()) {
            return;
        }
        violations.add(createViolation(context, Location.file(),
            severityFromThresholds(classNames.size(), band), "principle.srp.containers",
            Map.of("containerCount", classNames.size(),
                "containerNames", String.join(", ", classNames),
                "fileName", context.path()),
            ViolationMetrics.builder().containerCount(classNames.size()).build()));
    }

    private static int combinedComplexity(PrincipleContext context, SourceContainer container) {
        int ceiling = context.config().thresholds().complexityCeiling();
        long total = 0;
        for (SourceUnit unit : container.units()) {
            total += ComplexityCounter.complexity(
                context.source().maskedSpan(unit.startLine(), unit.endLine()), ceiling);
        }
        return (int) Math.min(Integer.MAX_VALUE, total);
    }

    private static String ownerOf(PrincipleContext context, SourceUnit unit) {
        return context.containers().stream()
            .filter(container -> container.kind() == SourceContainer.Kind.CLASS)
            .filter(container -> container.units().contains(unit))
            .map(SourceContainer::name)
            .reduce((outer, inner) -> inner)
            .orElse(null);
    }

    private static String serviceNames(Set<Concern> concerns, String containerName) {
        if (concerns.size() < 2) {
            return containerName + "Core, " + containerName + "Helpers";
        }
        return concerns.stream()
            .map(SingleResponsibilityChecker::toServiceName)
            .collect(Collectors.joining(", "));
    }

    private static String toServiceName(Concern concern) {
        StringBuilder name = new StringBuilder();
        for (String part : concern.id().split("-")) {
            name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return name.append("Service").toString();
    }
}
