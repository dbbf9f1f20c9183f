package com.qualitylens.core.extract;

import java.util.List;
import java.util.Objects;

/**
 * A file split into raw lines alongside their masked counterparts.
 *
 * <p>Built once per file and shared by the extractor, the detectors and the calculators.
 *
 * @param content raw content
 * @param rawLines lines as written, without line terminators
 * @param maskedLines lines with comments and literal contents blanked out
 */
public record SourceText(
    String content,
    List<String> rawLines,
    List<String> maskedLines
) {
    public SourceText {
        Objects.requireNonNull(content, "content must not be null");
        rawLines = List.copyOf(rawLines);
        maskedLines = List.copyOf(maskedLines);
        if (rawLines.size() != maskedLines.size()) {
            throw new IllegalArgumentException("raw and masked line counts differ");
        }
    }

    /**
     * Splits and masks file content.
     *
     * @param content raw content; null is treated as empty
     * @return source text
     */
    public static SourceText of(String content) {
        String text = content == null ? "" : content;
        List<String> lines = splitLines(text);
        return new SourceText(text, lines, LexicalMasker.mask(lines));
    }

    /**
     * Splits text on {@code \n}, dropping a trailing {@code \r} from each line.
     *
     * @param text text to split
     * @return lines
     */
    public static List<String> splitLines(String text) {
        String[] parts = text.split("\n", -1);
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].endsWith("\r")) {
                parts[i] = parts[i].substring(0, parts[i].length() - 1);
            }
        }
        return List.of(parts);
    }

    public int lineCount() {
        return rawLines.size();
    }

    /**
     * Joins raw lines between two 1-based line numbers, inclusive.
     *
     * @param fromLine first line
     * @param toLine last line
     * @return joined text
     */
    public String rawSpan(int fromLine, int toLine) {
        int from = Math.max(1, fromLine) - 1;
        int to = Math.min(rawLines.size(), toLine);
        if (from >= to) {
            return "";
        }
        return String.join("\n", rawLines.subList(from, to));
    }

    /**
     * Joins masked lines between two 1-based line numbers, inclusive.
     *
     * @param fromLine first line
     * @param toLine last line
     * @return joined masked text
     */
    public String maskedSpan(int fromLine, int toLine) {
        int from = Math.max(1, fromLine) - 1;
        int to = Math.min(maskedLines.size(), toLine);
        if (from >= to) {
            return "";
        }
        return String.join("\n", maskedLines.subList(from, to));
    }
}
