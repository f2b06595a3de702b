package com.questrail.herald.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>May jump forward (host suspend, NTP step) or backward. Milestone logic
 * tolerates both: a forward jump makes milestones overdue and they drain with
 * zero delay, a backward jump makes a woken scheduler re-arm for the
 * remainder.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
