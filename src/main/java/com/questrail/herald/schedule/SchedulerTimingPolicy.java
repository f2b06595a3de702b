package com.questrail.herald.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs shared by the milestone schedulers and watch pollers.
 *
 * @param maxSleep          longest single wait; a milestone further away is
 *                          approached in steps so wall-clock jumps are noticed
 * @param retryDelay        wait before retrying after a provider or
 *                          persistence failure
 * @param watchPollInterval interval between departure board polls per watch
 */
public record SchedulerTimingPolicy(Duration maxSleep, Duration retryDelay, Duration watchPollInterval)
{
    public SchedulerTimingPolicy {
        requirePositive(maxSleep, "maxSleep");
        requirePositive(retryDelay, "retryDelay");
        requirePositive(watchPollInterval, "watchPollInterval");
    }

    public static SchedulerTimingPolicy defaults() {
        return new SchedulerTimingPolicy(Duration.ofHours(1), Duration.ofMinutes(15), Duration.ofSeconds(30));
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
