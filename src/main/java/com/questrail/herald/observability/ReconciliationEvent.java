package com.questrail.herald.observability;

import com.questrail.herald.domain.CatchUpPolicy;

import java.time.Instant;

/**
 * Result of one domain's startup catch-up.
 */
public record ReconciliationEvent(
    Instant timestamp,
    String domain,
    CatchUpPolicy policy,
    boolean stateChanged,
    int alertCount
) {
}
