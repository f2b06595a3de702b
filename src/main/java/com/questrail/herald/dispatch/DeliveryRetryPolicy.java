package com.questrail.herald.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * DeliveryRetryPolicy
 * -----------------------------------------------------------------------------
 * Bounded exponential backoff applied per sink, per alert.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxAttempts</b>: total tries including the first one.</li>
 *   <li><b>initialBackoff</b>: wait before the second try.</li>
 *   <li><b>multiplier</b>: growth factor between consecutive waits.</li>
 *   <li><b>maxBackoff</b>: cap on any single wait.</li>
 * </ul>
 */
public record DeliveryRetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff
) {
    public DeliveryRetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Wait before the given attempt (1-based). The first attempt never waits.
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Five attempts, 1 s doubling up to 30 s.
     */
    public static DeliveryRetryPolicy defaults() {
        return new DeliveryRetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
    }

    /**
     * Retries without waiting; for tests and in-process sinks.
     */
    public static DeliveryRetryPolicy immediate(int maxAttempts) {
        return new DeliveryRetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }
}
