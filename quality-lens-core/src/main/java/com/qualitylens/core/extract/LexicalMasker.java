package com.qualitylens.core.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Blanks out comments and the contents of string and template literals.
 *
 * <p>Masked characters are replaced by spaces, so every column in the masked text maps
 * to the same column in the raw text. Quote characters themselves are kept. Block
 * comments and template literals are tracked across lines; single and double quoted
 * strings end at the end of a line.
 *
 * <p>This is a lexical heuristic, not a grammar: regular expression literals are not
 * recognized.
 */
public final class LexicalMasker {

    private enum State {
        CODE,
        BLOCK_COMMENT,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        TEMPLATE
    }

    private LexicalMasker() {
        // Utility class
    }

    /**
     * Masks every line of a file, carrying state across lines.
     *
     * @param lines raw lines
     * @return masked lines, same count and same lengths
     */
    public static List<String> mask(List<String> lines) {
        List<String> masked = new ArrayList<>(lines.size());
        State state = State.CODE;
        for (String line : lines) {
            StringBuilder out = new StringBuilder(line.length());
            state = maskLine(line, state, out);
            masked.add(out.toString());
            if (state == State.SINGLE_QUOTED || state == State.DOUBLE_QUOTED) {
                state = State.CODE;
            }
        }
        return masked;
    }

    /**
     * Masks a standalone text block.
     *
     * @param text raw text
     * @return masked text with identical line structure
     */
    public static String mask(String text) {
        return String.join("\n", mask(List.of(text.split("\n", -1))));
    }

    private static State maskLine(String line, State initial, StringBuilder out) {
        State state = initial;
        int length = line.length();
        int i = 0;
        while (i < length) {
            char c = line.charAt(i);
            char next = i + 1 < length ? line.charAt(i + 1) : '\0';
            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        blank(out, length - i);
                        return State.CODE;
                    } else if (c == '/' && next == '*') {
                        blank(out, 2);
                        i += 2;
                        state = State.BLOCK_COMMENT;
                        continue;
                    } else if (c == '\'') {
                        state = State.SINGLE_QUOTED;
                    } else if (c == '"') {
                        state = State.DOUBLE_QUOTED;
                    } else if (c == '`') {
                        state = State.TEMPLATE;
                    }
                    out.append(c);
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        blank(out, 2);
                        i += 2;
                        state = State.CODE;
                        continue;
                    }
                    out.append(' ');
                }
                case SINGLE_QUOTED, DOUBLE_QUOTED, TEMPLATE -> {
                    char quote = state == State.SINGLE_QUOTED ? '\'' : state == State.DOUBLE_QUOTED ? '"' : '`';
                    if (c == '\\' && i + 1 < length) {
                        blank(out, 2);
                        i += 2;
                        continue;
                    }
                    if (c == quote) {
                        out.append(c);
                        state = State.CODE;
                    } else {
                        out.append(' ');
                    }
                }
                default -> out.append(c);
            }
            i++;
        }
        return state;
    }

    private static void blank(StringBuilder out, int count) {
        for (int k = 0; k < count; k++) {
            out.append(' ');
        }
    }
}
