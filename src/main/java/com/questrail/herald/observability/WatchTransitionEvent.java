package com.questrail.herald.observability;

import com.questrail.herald.domain.train.WatchEvent;
import com.questrail.herald.domain.train.WatchState;

import java.time.Instant;

/**
 * Record of one watch reducer step for a user context.
 */
public record WatchTransitionEvent(
    Instant timestamp,
    String contextId,
    WatchState oldState,
    WatchState newState,
    WatchEvent trigger,
    boolean alerted
) {
    /**
     * Checks whether the step moved between Inactive and Active.
     */
    public boolean isActivationChange() {
        return oldState.isActive() != newState.isActive();
    }
}
