package com.clapgrow.push.common.retry;

/**
 * Exponential backoff configuration for retry rounds.
 * 
 * Each round sleeps between {@code (100 - jitterPercent)%} and
 * {@code 100%} of the current delay, then the delay doubles up to
 * {@code maxDelayMs}.
 *
 * @param initialDelayMs delay before the first retry round, without jitter
 * @param maxDelayMs cap for the doubling delay
 * @param jitterPercent share of the delay that is randomized, 0 to 100
 */
public record BackoffPolicy(
    long initialDelayMs,
    long maxDelayMs,
    int jitterPercent
) {

    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 1_024_000;
    public static final int DEFAULT_JITTER_PERCENT = 50;
    public static final long MAX_DELAY_LIMIT_MS = 86_400_000;

    public BackoffPolicy {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative");
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs");
        }
        if (maxDelayMs > MAX_DELAY_LIMIT_MS) {
            throw new IllegalArgumentException("maxDelayMs must not exceed " + MAX_DELAY_LIMIT_MS);
        }
        if (jitterPercent < 0 || jitterPercent > 100) {
            throw new IllegalArgumentException("jitterPercent must be between 0 and 100");
        }
    }

    /**
     * Standard policy: 1s initial delay, 50% jitter, capped at 1024s.
     */
    public static BackoffPolicy standard() {
        return new BackoffPolicy(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_JITTER_PERCENT);
    }

    /**
     * Policy without any delay, for dry runs and tests.
     */
    public static BackoffPolicy noDelay() {
        return new BackoffPolicy(0, 0, 0);
    }
}
