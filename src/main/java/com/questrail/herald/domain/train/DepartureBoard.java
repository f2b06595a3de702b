package com.questrail.herald.domain.train;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of departures from one station.
 *
 * @param crs         three-letter station code
 * @param stationName display name
 * @param departures  rows in board order
 * @param generatedAt when the provider produced the snapshot
 */
public record DepartureBoard(String crs, String stationName, List<Departure> departures, Instant generatedAt)
{
    public DepartureBoard {
        Objects.requireNonNull(crs, "crs");
        stationName = stationName == null ? crs : stationName;
        departures = List.copyOf(departures);
        Objects.requireNonNull(generatedAt, "generatedAt");
    }

    /**
     * The row a subscription refers to: same scheduled time and, when the
     * subscription names one, the same destination (case-insensitive).
     */
    public Optional<Departure> find(WatchSubscription subscription) {
        return departures.stream()
                .filter(d -> d.scheduledTime().equals(subscription.trainIdentifier()))
                .filter(d -> subscription.destination() == null
                        || d.destination().equalsIgnoreCase(subscription.destination()))
                .findFirst();
    }
}
