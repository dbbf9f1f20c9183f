package com.qualitylens.core.util;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Cooperative wall-clock budget for one file's analysis.
 *
 * <p>Scanners call {@link #checkpoint()} at line or unit granularity, so an expired
 * budget aborts the analysis on the calling thread without spawning a watchdog.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, System::nanoTime, Duration.ZERO);

    private final long expiresAtNanos;
    private final LongSupplier clock;
    private final Duration budget;

    private Deadline(long expiresAtNanos, LongSupplier clock, Duration budget) {
        this.expiresAtNanos = expiresAtNanos;
        this.clock = clock;
        this.budget = budget;
    }

    /**
     * Creates a deadline that expires after the given budget.
     *
     * @param budget wall-clock budget
     * @return new deadline
     */
    public static Deadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    static Deadline after(Duration budget, LongSupplier clock) {
        long now = clock.getAsLong();
        long nanos = budget.toNanos();
        long expiresAt = Long.MAX_VALUE - now < nanos ? Long.MAX_VALUE : now + nanos;
        return new Deadline(expiresAt, clock, budget);
    }

    /**
     * Returns a deadline that never expires.
     *
     * @return unbounded deadline
     */
    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return this != NONE && clock.getAsLong() - expiresAtNanos >= 0;
    }

    /**
     * Aborts the current analysis if the budget is spent.
     *
     * @throws AnalysisTimeoutException if expired
     */
    public void checkpoint() {
        if (isExpired()) {
            throw new AnalysisTimeoutException("Analysis exceeded its budget of " + budget.toMillis() + " ms");
        }
    }
}
