package com.qualitylens.core.i18n;

import java.util.Map;

/**
 * Localization collaborator used to render every user-facing message.
 *
 * <p>The engine stays fully functional without a translation source:
 * {@link #keysOnly()} returns the key itself for every lookup.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Messages {

    /**
     * Renders a message.
     *
     * @param key message key, e.g. {@code finding.weak_equality.message}
     * @param params named values substituted for {@code {name}} placeholders
     * @return rendered message, or the key when no translation exists
     */
    String t(String key, Map<String, ?> params);

    /**
     * Renders a message without parameters.
     *
     * @param key message key
     * @return rendered message, or the key when no translation exists
     */
    default String t(String key) {
        return t(key, Map.of());
    }

    /**
     * Returns the fallback used when localization is not initialized.
     *
     * @return messages that echo the key
     */
    static Messages keysOnly() {
        return (key, params) -> key;
    }
}
