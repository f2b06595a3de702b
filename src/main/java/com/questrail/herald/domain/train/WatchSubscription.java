package com.questrail.herald.domain.train;

import java.time.Instant;
import java.util.Objects;

/**
 * What one user context is watching, plus the last observed values used to
 * detect change. Never persisted.
 *
 * @param contextId         owning user context
 * @param recipientId       where alerts go, or {@code null} to route by domain
 * @param trainIdentifier   scheduled departure time, {@code HH:mm}
 * @param origin            station code the train departs from
 * @param destination       optional destination filter
 * @param lastKnownPlatform platform at the last observation
 * @param lastKnownStatus   expected time or status at the last observation;
 *                          {@code null} until the first observation
 * @param createdAt         when the watch was requested
 */
public record WatchSubscription(String contextId,
                                String recipientId,
                                String trainIdentifier,
                                String origin,
                                String destination,
                                String lastKnownPlatform,
                                String lastKnownStatus,
                                Instant createdAt)
{
    public WatchSubscription {
        Objects.requireNonNull(contextId, "contextId");
        Objects.requireNonNull(trainIdentifier, "trainIdentifier");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Whether any value has been observed yet.
     */
    public boolean hasObservation() {
        return lastKnownPlatform != null || lastKnownStatus != null;
    }

    public WatchSubscription observed(Departure departure) {
        return new WatchSubscription(contextId, recipientId, trainIdentifier, origin, destination,
                departure.platform(), departure.expected(), createdAt);
    }

    public String describe() {
        return destination == null
                ? "the " + trainIdentifier + " from " + origin
                : "the " + trainIdentifier + " from " + origin + " to " + destination;
    }
}
