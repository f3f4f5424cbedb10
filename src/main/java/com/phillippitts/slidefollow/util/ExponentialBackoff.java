package com.phillippitts.slidefollow.util;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) waits {@code min(initial * 2^n, max)},
 * so the first retry already waits twice the initial delay. No delay is offered past
 * {@code maxAttempts}.
 *
 * <p>Immutable; callers keep their own attempt counter.
 */
public final class ExponentialBackoff {

    private final long initialMs;
    private final long maxMs;
    private final int maxAttempts;

    public ExponentialBackoff(long initialMs, long maxMs, int maxAttempts) {
        if (initialMs <= 0 || maxMs < initialMs) {
            throw new IllegalArgumentException("require 0 < initialMs <= maxMs");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        this.initialMs = initialMs;
        this.maxMs = maxMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the given attempt.
     *
     * @param attempt 1-based attempt number
     * @throws IllegalArgumentException if attempt is not in [1, maxAttempts]
     */
    public Duration delayFor(int attempt) {
        if (!allows(attempt)) {
            throw new IllegalArgumentException("attempt " + attempt + " outside [1, " + maxAttempts + "]");
        }
        int shift = Math.min(attempt, 62);
        long factor = 1L << shift;
        long delay = initialMs > maxMs / factor ? maxMs : initialMs * factor;
        return Duration.ofMillis(Math.min(delay, maxMs));
    }

    public boolean allows(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
