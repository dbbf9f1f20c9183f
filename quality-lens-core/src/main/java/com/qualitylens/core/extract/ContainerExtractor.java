package com.qualitylens.core.extract;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.Sanitizers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups extracted units into class-like containers.
 *
 * <p>A class body is found by brace balance from its opening brace; units whose
 * declaration line falls inside the body are its methods. A file that declares no class
 * but does declare units becomes a single {@link SourceContainer.Kind#MODULE} container
 * named after the file.
 */
public class ContainerExtractor {

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
        "(?:^|[^\\w$.])class\\s+([A-Za-z_$][\\w$]*)");

    private final AnalyzerConfig.Limits limits;

    public ContainerExtractor(AnalyzerConfig.Limits limits) {
        this.limits = limits;
    }

    /**
     * Finds containers and assigns units to them.
     *
     * @param fileName sanitized display name of the file
     * @param source split and masked source
     * @param units units extracted from the same source
     * @param deadline analysis deadline
     * @return containers in source order
     */
    public List<SourceContainer> extract(String fileName, SourceText source, List<SourceUnit> units, Deadline deadline) {
        List<String> masked = source.maskedLines();
        List<SourceContainer> containers = new ArrayList<>();

        for (int i = 0; i < masked.size(); i++) {
            deadline.checkpoint();
            String line = masked.get(i);
            if (line.length() > limits.maxLineLength()) {
                continue;
            }
            Matcher matcher = CLASS_DECLARATION.matcher(line);
            while (matcher.find()) {
                containers.add(toContainer(matcher, source, units, i, deadline));
            }
        }

        if (containers.isEmpty() && !units.isEmpty()) {
            String name = Sanitizers.sanitizeIdentifier(stripExtension(fileName), limits.maxIdentifierLength(), "module");
            containers.add(new SourceContainer(name, SourceContainer.Kind.MODULE,
                1, source.lineCount(), units, source.content()));
        }
        return containers;
    }

    private SourceContainer toContainer(Matcher matcher, SourceText source, List<SourceUnit> units,
                                        int lineIndex, Deadline deadline) {
        List<String> masked = source.maskedLines();
        int endIndex = lineIndex;
        // Class headers may wrap across a few lines before the brace
        int[] brace = findBraceWithin(masked, lineIndex, matcher.end(1));
        if (brace != null) {
            endIndex = BraceBalance.findBlockEnd(masked, brace[0], brace[1],
                limits.maxLines(), limits.maxBraceDepth(), deadline);
        }

        int startLine = lineIndex + 1;
        int endLine = endIndex + 1;
        List<SourceUnit> members = units.stream()
            .filter(unit -> unit.startLine() >= startLine && unit.startLine() <= endLine)
            .toList();

        String name = Sanitizers.sanitizeIdentifier(matcher.group(1), limits.maxIdentifierLength(), SourceUnit.ANONYMOUS);
        return new SourceContainer(name, SourceContainer.Kind.CLASS, startLine, endLine,
            members, source.rawSpan(startLine, endLine));
    }

    private static int[] findBraceWithin(List<String> masked, int lineIndex, int fromColumn) {
        int last = Math.min(masked.size() - 1, lineIndex + 3);
        for (int i = lineIndex; i <= last; i++) {
            String line = masked.get(i);
            int start = i == lineIndex ? fromColumn : 0;
            for (int c = start; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    return new int[] {i, c};
                }
                if (ch == ';' || ch == '}') {
                    return null;
                }
            }
        }
        return null;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
