package com.qualitylens.core.principle;

import com.qualitylens.core.model.Principle;
import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration for {@link PrincipleChecker} implementations.
 */
class PrincipleCheckerServiceLoaderTest {

    @Test
    void serviceLoader_discoversOneCheckerPerImplementedPrinciple() {
        assertThat(ServiceLoader.load(PrincipleChecker.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(PrincipleChecker::getPrinciple))
            .containsExactlyInAnyOrder(Principle.SINGLE_RESPONSIBILITY, Principle.DEPENDENCY_INVERSION);
    }

    @Test
    void serviceLoader_checkersSupportScriptLanguages() {
        ServiceLoader.load(PrincipleChecker.class).stream()
            .map(ServiceLoader.Provider::get)
            .forEach(checker -> {
                assertThat(checker.supportsLanguage("TypeScript")).isTrue();
                assertThat(checker.supportsLanguage("python")).isFalse();
            });
    }
}
