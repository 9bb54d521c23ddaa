package com.maestro.agent;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a cap and optional full jitter.
 * <p>
 * Delay before retry {@code n} (1-based) is {@code min(initial * multiplier^(n-1), max)}.
 * With jitter the delay is drawn uniformly from {@code [0.1 * initial, delay]}.
 */
public final class BackoffPolicy {

    private final long initialMs;
    private final long maxMs;
    private final double multiplier;
    private final boolean jitter;

    public BackoffPolicy(Duration initial, Duration max, double multiplier, boolean jitter) {
        this.initialMs = Math.max(0, initial.toMillis());
        this.maxMs = Math.max(initialMs, max.toMillis());
        this.multiplier = Math.max(1.0, multiplier);
        this.jitter = jitter;
    }

    public static BackoffPolicy from(DispatchProperties properties) {
        return new BackoffPolicy(properties.getInitialBackoff(), properties.getMaxBackoff(),
                properties.getBackoffMultiplier(), properties.isJitter());
    }

    public Duration delayFor(int retry) {
        double raw = initialMs * Math.pow(multiplier, Math.max(0, retry - 1));
        long capped = (long) Math.min(raw, maxMs);
        if (!jitter || capped == 0) {
            return Duration.ofMillis(capped);
        }
        long floor = Math.min(capped, Math.max(0, initialMs / 10));
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(floor, capped + 1));
    }
}
