package com.qualitylens.core.principle;

import com.qualitylens.core.model.Principle;
import com.qualitylens.core.model.Violation;

import java.util.List;

/**
 * Checks one design principle against the structure recovered from a file.
 *
 * <p>Checkers are discovered via Java Service Provider Interface (SPI). Each checker only
 * produces its own violations and never sees or alters another checker's output.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.qualitylens.core.principle.PrincipleChecker}
 *
 * @see com.qualitylens.core.principle.base.AbstractPrincipleChecker
 */
public interface PrincipleChecker {

    /**
     * Returns the principle this checker covers.
     *
     * @return principle
     */
    Principle getPrinciple();

    /**
     * Returns true if this checker understands the given language tag.
     *
     * @param language language tag, any case
     * @return whether {@link #check(PrincipleContext)} applies
     */
    boolean supportsLanguage(String language);

    /**
     * Checks a file.
     *
     * @param context file structure, imports and configuration
     * @return violations in source order
     */
    List<Violation> check(PrincipleContext context);
}
