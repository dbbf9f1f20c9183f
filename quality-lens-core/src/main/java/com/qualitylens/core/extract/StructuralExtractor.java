package com.qualitylens.core.extract;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.Sanitizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers function-like units from source text by pattern matching and brace balance.
 *
 * <p>Recognized declaration forms:
 * <ul>
 *   <li>Named function declarations: {@code function load(a, b) {}}</li>
 *   <li>Assignment-style bindings: {@code const load = (a, b) => {}},
 *       {@code load: function (a) {}}</li>
 *   <li>Bare declarations followed by a brace: {@code load(a, b) {}}</li>
 * </ul>
 *
 * <p>Matching runs on masked lines, so declarations inside comments or string literals
 * are never recognized. Every dimension of the scan is bounded by {@link AnalyzerConfig.Limits}.
 */
public class StructuralExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuralExtractor.class);

    // Parameter lists exclude parentheses and type annotations exclude delimiters, so
    // every quantifier is followed by a disjoint character and matching stays linear.
    private static final Pattern UNIT_PATTERN = Pattern.compile(
        "\\bfunction\\b\\s*\\*?\\s*(?<fn>[A-Za-z_$][\\w$]*)?\\s*\\((?<fnParams>[^()]*)\\)"
            + "|(?<bound>[A-Za-z_$][\\w$]*)\\s*[:=]\\s*(?:async\\s+)?"
            + "(?:function\\b\\s*\\*?\\s*(?:[A-Za-z_$][\\w$]*)?\\s*)?"
            + "\\((?<boundParams>[^()]*)\\)\\s*(?::[^{};=()]{1,200})?(?:=>|\\{)"
            + "|(?<bare>[A-Za-z_$][\\w$]*)\\s*\\((?<bareParams>[^()]*)\\)\\s*(?::[^{};=()]{1,200})?\\{"
    );

    private static final Set<String> CONTROL_KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "with", "return", "function",
        "typeof", "new", "else", "do", "await", "yield", "delete", "void", "super"
    );

    private final AnalyzerConfig.Limits limits;

    public StructuralExtractor(AnalyzerConfig.Limits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /**
     * Extracts units from raw content without a time budget.
     *
     * @param content file content
     * @return extracted units in source order
     */
    public List<SourceUnit> extract(String content) {
        return extract(SourceText.of(content), Deadline.none());
    }

    /**
     * Extracts units from prepared source text.
     *
     * @param source split and masked source
     * @param deadline analysis deadline, checked once per line
     * @return extracted units in source order, at most {@code maxUnits}
     */
    public List<SourceUnit> extract(SourceText source, Deadline deadline) {
        List<String> raw = source.rawLines();
        List<String> masked = source.maskedLines();
        List<SourceUnit> units = new ArrayList<>();

        for (int i = 0; i < masked.size(); i++) {
            deadline.checkpoint();
            String line = masked.get(i);
            if (line.length() > limits.maxLineLength() || line.isBlank()) {
                continue;
            }

            Matcher matcher = UNIT_PATTERN.matcher(line);
            while (matcher.find()) {
                if (units.size() >= limits.maxUnits()) {
                    log.warn("Unit limit of {} reached, remaining declarations ignored", limits.maxUnits());
                    return units;
                }
                SourceUnit unit = toUnit(matcher, raw, masked, i, deadline);
                if (unit != null) {
                    units.add(unit);
                }
            }
        }
        return units;
    }

    private SourceUnit toUnit(Matcher matcher, List<String> raw, List<String> masked,
                              int lineIndex, Deadline deadline) {
        String name;
        String params;
        int nameStart;
        if (matcher.group("bound") != null) {
            name = matcher.group("bound");
            params = matcher.group("boundParams");
            nameStart = matcher.start("bound");
        } else if (matcher.group("bare") != null) {
            name = matcher.group("bare");
            params = matcher.group("bareParams");
            nameStart = matcher.start("bare");
            if (CONTROL_KEYWORDS.contains(name)) {
                return null;
            }
        } else {
            name = matcher.group("fn");
            params = matcher.group("fnParams");
            nameStart = matcher.start();
        }
        if (name != null && CONTROL_KEYWORDS.contains(name)) {
            name = null;
        }

        int endIndex = lineIndex;
        int[] brace = BraceBalance.findOpeningBrace(masked, lineIndex, matcher.end() - 1);
        if (brace != null) {
            endIndex = BraceBalance.findBlockEnd(masked, brace[0], brace[1],
                limits.maxUnitBodyLines(), limits.maxBraceDepth(), deadline);
        }

        String body = String.join("\n", raw.subList(lineIndex, endIndex + 1));
        if (body.length() > limits.maxUnitBodyChars()) {
            log.debug("Omitting unit at line {} with oversized body ({} chars)", lineIndex + 1, body.length());
            return null;
        }

        return new SourceUnit(
            Sanitizers.sanitizeIdentifier(name, limits.maxIdentifierLength(), SourceUnit.ANONYMOUS),
            parseParameters(params),
            body,
            lineIndex + 1,
            nameStart + 1,
            endIndex + 1
        );
    }

    /**
     * Splits raw parameter text into sanitized tokens.
     *
     * <p>Default values and type annotations are dropped, rest markers are stripped, and
     * empty tokens are skipped.
     *
     * @param parameterText text between the declaration's parentheses
     * @return sanitized parameter names, at most {@code maxParameters}
     */
    List<String> parseParameters(String parameterText) {
        if (parameterText == null || parameterText.isBlank()
            || parameterText.length() > limits.maxParameterText()) {
            return List.of();
        }
        List<String> parameters = new ArrayList<>();
        for (String token : parameterText.split(",")) {
            if (parameters.size() >= limits.maxParameters()) {
                break;
            }
            String candidate = token.strip();
            int cut = indexOfAny(candidate, '=', ':');
            if (cut >= 0) {
                candidate = candidate.substring(0, cut);
            }
            String sanitized = Sanitizers.sanitizeIdentifier(candidate, limits.maxParameterLength(), "");
            if (!sanitized.isEmpty()) {
                parameters.add(sanitized);
            }
        }
        return parameters;
    }

    private static int indexOfAny(String text, char first, char second) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == first || c == second) {
                return i;
            }
        }
        return -1;
    }
}
