package com.questrail.herald.domain.bins;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persisted bin reminder state.
 *
 * @param schedule              cached collection calendar, ordered by date
 * @param lastNotifiedMilestone instant of the last milestone handled (sent,
 *                              skipped or refreshed); {@code null} before the first
 * @param lastRefreshedAt       last successful calendar fetch, or {@code null}
 */
public record BinState(List<BinCollection> schedule, Instant lastNotifiedMilestone, Instant lastRefreshedAt)
{
    public BinState {
        schedule = schedule == null
                ? List.of()
                : schedule.stream()
                        .sorted(Comparator.comparing(BinCollection::date).thenComparing(BinCollection::type))
                        .toList();
    }

    public static BinState empty() {
        return new BinState(List.of(), null, null);
    }

    public Optional<Instant> lastNotified() {
        return Optional.ofNullable(lastNotifiedMilestone);
    }

    public Optional<Instant> lastRefreshed() {
        return Optional.ofNullable(lastRefreshedAt);
    }

    public boolean hasCollectionOnOrAfter(LocalDate date) {
        return schedule.stream().anyMatch(c -> !c.date().isBefore(date));
    }

    public BinState withSchedule(List<BinCollection> newSchedule, Instant refreshedAt) {
        return new BinState(newSchedule, lastNotifiedMilestone, refreshedAt);
    }

    public BinState withLastNotified(Instant milestone) {
        return new BinState(schedule, milestone, lastRefreshedAt);
    }
}
