package com.questrail.herald.domain.train;

import java.time.Instant;
import java.util.Objects;

/**
 * Inputs to {@link WatchStateMachine}.
 */
public sealed interface WatchEvent
{
    Instant timestamp();

    /**
     * Start watching, replacing any current watch.
     */
    record WatchRequested(Instant timestamp, WatchSubscription subscription) implements WatchEvent {
        public WatchRequested {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(subscription, "subscription");
        }
    }

    record UnwatchRequested(Instant timestamp) implements WatchEvent {
        public UnwatchRequested {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * The watched train was found on the latest board.
     */
    record DepartureObserved(Instant timestamp, Departure departure) implements WatchEvent {
        public DepartureObserved {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(departure, "departure");
        }
    }

    /**
     * The latest board no longer lists the watched train.
     */
    record DepartureMissing(Instant timestamp) implements WatchEvent {
        public DepartureMissing {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
