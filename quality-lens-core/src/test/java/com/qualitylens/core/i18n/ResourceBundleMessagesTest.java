package com.qualitylens.core.i18n;

import com.qualitylens.core.model.FindingType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResourceBundleMessages}.
 */
class ResourceBundleMessagesTest {

    private final Messages messages = ResourceBundleMessages.loadDefault();

    @Test
    void t_substitutesNamedPlaceholders() {
        String rendered = messages.t("finding.parameter_count.message",
            Map.of("unitName", "createUser", "parameterCount", 8));

        assertThat(rendered).isEqualTo("Function \"createUser\" has too many parameters (8)");
    }

    @Test
    void t_unknownKey_rendersKey() {
        assertThat(messages.t("finding.unknown.message")).isEqualTo("finding.unknown.message");
    }

    @Test
    void t_nullKey_rendersEmpty() {
        assertThat(messages.t(null, Map.of())).isEmpty();
    }

    @Test
    void load_missingBundle_fallsBackToKeys() {
        Messages missing = ResourceBundleMessages.load("no-such-bundle", Locale.ROOT);

        assertThat(missing.t("finding.complexity.message")).isEqualTo("finding.complexity.message");
    }

    @Test
    void defaultBundle_coversEveryFindingType() {
        Arrays.stream(FindingType.values()).forEach(type -> {
            String prefix = FindingFactory.keyPrefix(type);
            assertThat(messages.t(prefix + ".message")).isNotEqualTo(prefix + ".message");
            assertThat(messages.t(prefix + ".suggestion")).isNotEqualTo(prefix + ".suggestion");
        });
    }
}
