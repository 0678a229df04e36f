package com.mailreactor.session;

import lombok.Value;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff applied when a session reconnects after a failure
 */
@Value
public class ReconnectPolicy {

    /** Connection attempts per acquisition before giving up */
    int maxAttempts;
    long baseDelayMs;
    long maxDelayMs;
    boolean jitter;

    public ReconnectPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    /**
     * No waiting between attempts
     */
    public static ReconnectPolicy immediate(int maxAttempts) {
        return new ReconnectPolicy(maxAttempts, 0, 0, false);
    }

    /**
     * Delay before the next connection attempt.
     * delay = min(base * 2^(failures-1) + jitter, max); zero when nothing failed yet.
     *
     * @param consecutiveFailures failures since the last successful connection
     */
    public long delayFor(int consecutiveFailures) {
        if (consecutiveFailures <= 0 || baseDelayMs == 0) {
            return 0;
        }
        int exponent = Math.min(consecutiveFailures - 1, 20);
        long delay = baseDelayMs * (1L << exponent);
        if (jitter) {
            delay += ThreadLocalRandom.current().nextLong(baseDelayMs / 2 + 1);
        }
        return Math.min(delay, maxDelayMs);
    }
}
