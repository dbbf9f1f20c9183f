package com.qualitylens.core.principle.impl;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.model.Principle;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.model.ViolationMetrics;
import com.qualitylens.core.principle.PrincipleContext;
import com.qualitylens.core.principle.base.AbstractPrincipleChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the dependency-inversion principle.
 *
 * <p>Counts the distinct concrete types a container instantiates with {@code new}.
 * Language built-ins and error types are not collaborators and are ignored.
 */
public class DependencyInversionChecker extends AbstractPrincipleChecker {

    private static final Pattern INSTANTIATION = Pattern.compile("\\bnew\\s+([A-Z][\\w$]*)\\s*[(<]");

    private static final Set<String> BUILT_IN_TYPES = Set.of(
        "Array", "ArrayBuffer", "Blob", "Boolean", "DataView", "Date", "Error", "Event",
        "Float32Array", "Float64Array", "FormData", "Function", "Headers", "Int32Array",
        "Intl", "Map", "Number", "Object", "Promise", "Proxy", "RegExp", "Set", "String",
        "Symbol", "TextDecoder", "TextEncoder", "Uint8Array", "URL", "URLSearchParams",
        "WeakMap", "WeakRef", "WeakSet", "AbortController", "Buffer"
    );

    @Override
    public Principle getPrinciple() {
        return Principle.DEPENDENCY_INVERSION;
    }

    @Override
    public List<Violation> check(PrincipleContext context) {
        AnalyzerConfig.ThresholdBand band = context.thresholds().concreteDependencies();
        List<Violation> violations = new ArrayList<>();

        for (SourceContainer container : context.containers()) {
            context.deadline().checkpoint();
            Set<String> types = concreteTypes(context.source().maskedSpan(container.startLine(), container.endLine()));
            if (types.size() < band.low()) {
                continue;
            }
            violations.add(createViolation(context, Location.container(container.startLine(), container.name()),
                severityFromThresholds(types.size(), band), "principle.dip.concrete",
                Map.of("containerName", container.name(),
                    "dependencyCount", types.size(),
                    "types", String.join(", ", types)),
                ViolationMetrics.builder().dependencyCount(types.size()).build()));
        }
        return violations;
    }

    /**
     * Collects distinct instantiated type names, sorted.
     *
     * @param maskedText masked source text
     * @return concrete type names
     */
    static Set<String> concreteTypes(String maskedText) {
        Set<String> types = new TreeSet<>();
        Matcher matcher = INSTANTIATION.matcher(maskedText);
        while (matcher.find()) {
            String type = matcher.group(1);
            if (!BUILT_IN_TYPES.contains(type) && !type.endsWith("Error") && !type.endsWith("Exception")) {
                types.add(type);
            }
        }
        return types;
    }
}
