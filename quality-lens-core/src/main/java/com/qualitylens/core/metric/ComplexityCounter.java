package com.qualitylens.core.metric;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cyclomatic complexity proxy computed from decision tokens in a unit body.
 *
 * <p>The score starts at 1 and grows by one per conditional, loop, switch case, catch
 * clause, logical and/or operator and ternary operator. Optional chaining and
 * nullish coalescing are not counted. Bodies must be masked first so that tokens inside
 * comments and string literals are ignored.
 */
public final class ComplexityCounter {

    private static final Pattern DECISION_TOKEN = Pattern.compile(
        "\\b(?:if|for|while|case|catch)\\b|&&|\\|\\||(?<![?.])\\?(?![.?:=])");

    private ComplexityCounter() {
        // Utility class
    }

    /**
     * Computes the complexity of a masked body.
     *
     * @param maskedBody body with comments and literal contents blanked
     * @param ceiling maximum value returned
     * @return complexity between 1 and {@code ceiling}
     */
    public static int complexity(String maskedBody, int ceiling) {
        int limit = Math.max(1, ceiling);
        if (maskedBody == null || maskedBody.isEmpty()) {
            return 1;
        }
        int score = 1;
        Matcher matcher = DECISION_TOKEN.matcher(maskedBody);
        while (score < limit && matcher.find()) {
            score++;
        }
        return score;
    }
}
