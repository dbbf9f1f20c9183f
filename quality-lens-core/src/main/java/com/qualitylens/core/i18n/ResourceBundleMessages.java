package com.qualitylens.core.i18n;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * {@link Messages} backed by a {@link ResourceBundle} of {@code {name}}-style templates.
 *
 * <p>A missing bundle degrades to {@link Messages#keysOnly()} behavior; a missing key
 * renders as the key itself.
 */
public class ResourceBundleMessages implements Messages {

    public static final String DEFAULT_BUNDLE = "quality-lens-messages";

    private static final Logger log = LoggerFactory.getLogger(ResourceBundleMessages.class);

    private final ResourceBundle bundle;

    ResourceBundleMessages(ResourceBundle bundle) {
        this.bundle = bundle;
    }

    /**
     * Loads the default bundle for the root locale.
     *
     * @return messages, falling back to keys if the bundle is missing
     */
    public static Messages loadDefault() {
        return load(DEFAULT_BUNDLE, Locale.ROOT);
    }

    /**
     * Loads a named bundle for a locale.
     *
     * @param baseName bundle base name on the classpath
     * @param locale requested locale
     * @return messages, falling back to keys if the bundle is missing
     */
    public static Messages load(String baseName, Locale locale) {
        try {
            return new ResourceBundleMessages(ResourceBundle.getBundle(baseName, locale));
        } catch (MissingResourceException e) {
            log.warn("Message bundle '{}' not found, messages will render as keys", baseName);
            return Messages.keysOnly();
        }
    }

    @Override
    public String t(String key, Map<String, ?> params) {
        if (key == null) {
            return "";
        }
        if (!bundle.containsKey(key)) {
            return key;
        }
        String template = bundle.getString(key);
        if (params == null || params.isEmpty()) {
            return template;
        }
        String rendered = template;
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return rendered;
    }
}
