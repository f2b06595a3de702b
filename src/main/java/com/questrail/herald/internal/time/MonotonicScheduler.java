package com.questrail.herald.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Cancellable "sleep, then run" surface shared by the milestone schedulers and
 * the watch pollers.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic ticks. Callers convert a wall-clock milestone into a
 * relative delay at scheduling time and re-check the wall clock when the task
 * runs; the scheduler itself never sees an {@code Instant}.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a relative delay measured on the given clock.
     * Negative delays are clamped to zero so overdue work runs immediately.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        long delayNanos = delay.isNegative() ? 0L : delay.toNanos();
        return scheduleAtNanos(clock.nowNanos() + delayNanos, task);
    }
}
