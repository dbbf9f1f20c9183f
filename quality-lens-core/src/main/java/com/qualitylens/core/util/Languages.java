package com.qualitylens.core.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Constants and lookups for supported language tags.
 * <p>
 * Callers may pass any alias (case-insensitive); the engine works with the canonical
 * tag returned by {@link #canonical(String)}.
 * </p>
 */
public final class Languages {
    /** Canonical tag for JavaScript. */
    public static final String JAVASCRIPT = "javascript";

    /** Canonical tag for TypeScript. */
    public static final String TYPESCRIPT = "typescript";

    /** Canonical tag for any brace-delimited script source (JavaScript or TypeScript). */
    public static final String SCRIPT = "script";

    private static final Map<String, String> ALIASES = Map.of(
        "javascript", JAVASCRIPT,
        "js", JAVASCRIPT,
        "jsx", JAVASCRIPT,
        "mjs", JAVASCRIPT,
        "cjs", JAVASCRIPT,
        "typescript", TYPESCRIPT,
        "ts", TYPESCRIPT,
        "tsx", TYPESCRIPT,
        "script", SCRIPT
    );

    private static final Map<String, List<String>> EXTENSIONS = Map.of(
        JAVASCRIPT, List.of("js", "jsx", "mjs", "cjs"),
        TYPESCRIPT, List.of("ts", "tsx"),
        SCRIPT, List.of("js", "jsx", "mjs", "cjs", "ts", "tsx")
    );

    private Languages() {
        // Prevent instantiation
    }

    /**
     * Resolves a language tag or alias to its canonical tag.
     *
     * @param tag declared language tag
     * @return canonical tag, or empty if unsupported
     */
    public static Optional<String> canonical(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(tag.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns true if the tag or alias is supported.
     *
     * @param tag declared language tag
     * @return true if supported
     */
    public static boolean isSupported(String tag) {
        return canonical(tag).isPresent();
    }

    /**
     * Returns every accepted tag and alias.
     *
     * @return supported tags
     */
    public static Set<String> supportedTags() {
        return ALIASES.keySet();
    }

    /**
     * Returns the file extensions (without dot) analyzed for a canonical tag.
     *
     * @param canonicalTag canonical language tag
     * @return extensions, empty if the tag is unknown
     */
    public static List<String> extensions(String canonicalTag) {
        return EXTENSIONS.getOrDefault(canonicalTag, List.of());
    }

    /**
     * Builds the glob that matches source files of a canonical tag at any depth.
     *
     * @param canonicalTag canonical language tag
     * @return glob pattern, e.g. {@code **.{js,jsx}}
     */
    public static String glob(String canonicalTag) {
        return "**.{" + String.join(",", extensions(canonicalTag)) + "}";
    }
}
