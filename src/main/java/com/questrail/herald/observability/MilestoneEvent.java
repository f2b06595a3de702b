package com.questrail.herald.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * A domain's milestone was evaluated and its result committed.
 *
 * @param timestamp    wall-clock time of the evaluation
 * @param domain       domain name
 * @param milestoneAt  the instant the scheduler slept towards
 * @param stateChanged whether a new state revision was written
 * @param alertCount   number of alerts handed to the dispatcher
 */
public record MilestoneEvent(
    Instant timestamp,
    String domain,
    Instant milestoneAt,
    boolean stateChanged,
    int alertCount
) {
    /**
     * How late the evaluation ran relative to its milestone.
     */
    public Duration lateness() {
        return Duration.between(milestoneAt, timestamp);
    }
}
