package com.questrail.herald.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source used to turn a computed delay into a scheduler deadline.
 *
 * <h2>Binding invariant</h2>
 * Sleep deadlines (milestone wake-ups, watch poll cadence, delivery backoff)
 * are expressed in monotonic ticks. Whether a milestone is actually due is
 * always decided against the {@link WallClock}, re-read after every wake-up.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
