package com.qualitylens.core.extract;

import com.qualitylens.core.util.Deadline;

import java.util.List;

/**
 * Locates the end of a brace-delimited block by counting delimiters on masked lines.
 *
 * <p>The running depth is floored at zero and the scan stops when the depth returns to
 * zero, when it exceeds the depth ceiling, or after the line ceiling.
 */
final class BraceBalance {

    private BraceBalance() {
        // Utility class
    }

    /**
     * Scans forward from an opening brace.
     *
     * @param maskedLines masked file lines
     * @param lineIndex 0-based line of the opening brace
     * @param column 0-based column of the opening brace
     * @param maxLines maximum number of lines to scan
     * @param maxDepth depth ceiling
     * @param deadline analysis deadline
     * @return 0-based index of the last line of the block
     */
    static int findBlockEnd(List<String> maskedLines, int lineIndex, int column,
                            int maxLines, int maxDepth, Deadline deadline) {
        int depth = 0;
        int lastLine = Math.min(maskedLines.size(), lineIndex + Math.max(1, maxLines)) - 1;
        for (int i = lineIndex; i <= lastLine; i++) {
            deadline.checkpoint();
            String line = maskedLines.get(i);
            int start = i == lineIndex ? column : 0;
            for (int c = start; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    depth++;
                    if (depth > maxDepth) {
                        return i;
                    }
                } else if (ch == '}') {
                    depth = Math.max(0, depth - 1);
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return lastLine;
    }

    /**
     * Finds the brace that opens a declaration's body.
     *
     * <p>The brace must follow the declaration on the same line with no statement
     * terminator in between, or open the next non-blank line.
     *
     * @param maskedLines masked file lines
     * @param lineIndex 0-based declaration line
     * @param fromColumn 0-based column of the last character of the declaration header
     * @return {line, column} of the brace, or null for an expression-bodied declaration
     */
    static int[] findOpeningBrace(List<String> maskedLines, int lineIndex, int fromColumn) {
        String line = maskedLines.get(lineIndex);
        for (int c = Math.max(0, fromColumn); c < line.length(); c++) {
            char ch = line.charAt(c);
            if (ch == '{') {
                return new int[] {lineIndex, c};
            }
            if (ch == ';') {
                return null;
            }
        }
        if (!line.substring(Math.min(line.length(), Math.max(0, fromColumn + 1))).isBlank()) {
            return null;
        }
        for (int i = lineIndex + 1; i < maskedLines.size() && i <= lineIndex + 2; i++) {
            String candidate = maskedLines.get(i);
            String trimmed = candidate.stripLeading();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.charAt(0) == '{') {
                return new int[] {i, candidate.indexOf('{')};
            }
            return null;
        }
        return null;
    }
}
