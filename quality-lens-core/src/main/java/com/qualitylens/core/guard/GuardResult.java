package com.qualitylens.core.guard;

import com.qualitylens.core.model.AnalysisContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link InputGuard#validate}: either an accepted {@link AnalysisContext}
 * or a rejection with a reason code.
 *
 * @param context accepted context, null when rejected
 * @param reason rejection reason, null when accepted
 * @param detail sanitized, human-readable detail of the rejection
 */
public record GuardResult(
    AnalysisContext context,
    RejectionReason reason,
    String detail
) {
    public GuardResult {
        if ((context == null) == (reason == null)) {
            throw new IllegalArgumentException("exactly one of context and reason must be set");
        }
        if (detail == null) {
            detail = "";
        }
    }

    /**
     * Creates an accepted result.
     *
     * @param context validated context
     * @return accepted result
     */
    public static GuardResult accepted(AnalysisContext context) {
        return new GuardResult(Objects.requireNonNull(context, "context must not be null"), null, "");
    }

    /**
     * Creates a rejected result.
     *
     * @param reason rejection reason
     * @param detail sanitized detail
     * @return rejected result
     */
    public static GuardResult rejected(RejectionReason reason, String detail) {
        return new GuardResult(null, Objects.requireNonNull(reason, "reason must not be null"), detail);
    }

    public boolean isAccepted() {
        return context != null;
    }

    public boolean isRejected() {
        return reason != null;
    }

    /**
     * Returns the accepted context, if any.
     *
     * @return context or empty when rejected
     */
    public Optional<AnalysisContext> acceptedContext() {
        return Optional.ofNullable(context);
    }
}
