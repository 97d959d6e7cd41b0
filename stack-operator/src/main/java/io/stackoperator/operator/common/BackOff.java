/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

/**
 * Exponential back off: each delay is the previous one multiplied by the multiplier, up to a maximum delay
 */
public class BackOff {
    public static final long DEFAULT_INITIAL_DELAY_MS = 200L;
    public static final int DEFAULT_MULTIPLIER = 2;
    public static final long DEFAULT_MAX_DELAY_MS = 300_000L;

    private final long initialDelayMs;
    private final int multiplier;
    private final long maxDelayMs;
    private int attempt = 0;

    /**
     * Back off with the default settings
     */
    public BackOff() {
        this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY_MS);
    }

    /**
     * Constructor
     *
     * @param initialDelayMs    Delay before the first retry
     * @param multiplier        Factor applied to the delay after every attempt
     * @param maxDelayMs        Upper bound of the delay
     */
    public BackOff(long initialDelayMs, int multiplier, long maxDelayMs) {
        if (initialDelayMs <= 0 || multiplier < 1 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Invalid back off settings: initialDelayMs=" + initialDelayMs
                    + ", multiplier=" + multiplier + ", maxDelayMs=" + maxDelayMs);
        }

        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Returns the delay of the next attempt and moves to the attempt after it
     *
     * @return  The delay in milliseconds
     */
    public long delayMs() {
        long delay = initialDelayMs;

        for (int i = 0; i < attempt && delay < maxDelayMs; i++) {
            delay = delay * multiplier;
        }

        attempt++;
        return Math.min(delay, maxDelayMs);
    }

    /**
     * @return  Number of delays handed out since the last reset
     */
    public int attempts() {
        return attempt;
    }

    /**
     * Starts again from the initial delay
     */
    public void reset() {
        attempt = 0;
    }

    @Override
    public String toString() {
        return "BackOff(initialDelayMs=" + initialDelayMs + ", multiplier=" + multiplier + ", maxDelayMs=" + maxDelayMs + ", attempt=" + attempt + ")";
    }
}
