package com.qualitylens.core.i18n;

import com.qualitylens.core.model.Finding;
import com.qualitylens.core.model.FindingSeverity;
import com.qualitylens.core.model.FindingType;

import java.util.Locale;
import java.util.Map;

/**
 * Builds findings whose message and suggestion are rendered through {@link Messages}.
 *
 * <p>Keys follow {@code finding.<type>.message} and {@code finding.<type>.suggestion},
 * where {@code <type>} is the lower-cased enum constant name.
 */
public final class FindingFactory {

    private FindingFactory() {
        // Utility class
    }

    public static Finding create(Messages messages, FindingType type, FindingSeverity severity,
                                 int line, int column, Map<String, ?> params) {
        String prefix = keyPrefix(type);
        return new Finding(
            type,
            messages.t(prefix + ".message", params),
            severity,
            line,
            column,
            type.defaultRuleId(),
            messages.t(prefix + ".suggestion", params)
        );
    }

    static String keyPrefix(FindingType type) {
        return "finding." + type.name().toLowerCase(Locale.ROOT);
    }
}
