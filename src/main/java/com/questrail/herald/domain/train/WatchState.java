package com.questrail.herald.domain.train;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-context watch state. A context watches at most one train.
 */
public sealed interface WatchState
{
    boolean isActive();

    Optional<WatchSubscription> subscription();

    static WatchState inactive() {
        return Inactive.INSTANCE;
    }

    static WatchState active(WatchSubscription subscription) {
        return new Active(subscription);
    }

    enum Inactive implements WatchState {
        INSTANCE;

        @Override
        public boolean isActive() {
            return false;
        }

        @Override
        public Optional<WatchSubscription> subscription() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Inactive";
        }
    }

    record Active(WatchSubscription current) implements WatchState {

        public Active {
            Objects.requireNonNull(current, "current");
        }

        @Override
        public boolean isActive() {
            return true;
        }

        @Override
        public Optional<WatchSubscription> subscription() {
            return Optional.of(current);
        }
    }
}
