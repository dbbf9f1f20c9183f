package com.qualitylens.core.extract;

import com.qualitylens.core.config.AnalyzerConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects module specifiers a file depends on.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code import x from 'module'} and side-effect {@code import 'module'}</li>
 *   <li>{@code export { x } from 'module'}</li>
 *   <li>{@code require('module')}</li>
 *   <li>dynamic {@code import('module')}</li>
 * </ul>
 *
 * <p>Specifiers are read from the raw line because masking blanks string contents; the
 * masked line decides whether the statement is live code at all.
 */
public class ImportExtractor {

    private static final int MAX_IMPORTS = 200;
    private static final int MAX_SPECIFIER_LENGTH = 200;

    private static final Pattern STATIC_IMPORT = Pattern.compile(
        "^\\s*import\\s+(?:type\\s+)?(?:[\\w$*{},\\s]+?\\s+from\\s+)?['\"]([^'\"]+)['\"]");
    private static final Pattern EXPORT_FROM = Pattern.compile(
        "^\\s*export\\s+(?:type\\s+)?[\\w$*{},\\s]+?\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REQUIRE = Pattern.compile(
        "\\brequire\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final Pattern DYNAMIC_IMPORT = Pattern.compile(
        "\\bimport\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    private static final List<Pattern> PATTERNS = List.of(STATIC_IMPORT, EXPORT_FROM, REQUIRE, DYNAMIC_IMPORT);

    private final AnalyzerConfig.Limits limits;

    public ImportExtractor(AnalyzerConfig.Limits limits) {
        this.limits = limits;
    }

    /**
     * Extracts distinct import specifiers in order of first appearance.
     *
     * @param source split and masked source
     * @return import specifiers
     */
    public List<String> extract(SourceText source) {
        Set<String> imports = new LinkedHashSet<>();
        List<String> raw = source.rawLines();
        List<String> masked = source.maskedLines();

        for (int i = 0; i < raw.size() && imports.size() < MAX_IMPORTS; i++) {
            String line = raw.get(i);
            if (line.length() > limits.maxLineLength() || masked.get(i).isBlank()) {
                continue;
            }
            for (Pattern pattern : PATTERNS) {
                Matcher matcher = pattern.matcher(line);
                while (matcher.find()) {
                    // The keyword itself must survive masking, otherwise it sits in a comment or string
                    int keyword = firstNonBlank(line, matcher.start());
                    if (keyword < masked.get(i).length() && masked.get(i).charAt(keyword) != ' ') {
                        imports.add(truncate(matcher.group(1).strip()));
                    }
                }
            }
        }
        return new ArrayList<>(imports);
    }

    private static int firstNonBlank(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String truncate(String specifier) {
        return specifier.length() <= MAX_SPECIFIER_LENGTH
            ? specifier
            : specifier.substring(0, MAX_SPECIFIER_LENGTH);
    }
}
