package com.questrail.herald.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time source. Milestones (a collection evening, a weekly accrual)
 * are calendar instants, so due-ness is decided here, not on monotonic ticks.
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
