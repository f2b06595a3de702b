package com.questrail.herald.domain.bins;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A point in time derived from the cached collection calendar.
 *
 * @param kind           what happens at this point
 * @param collectionDate collection the milestone belongs to
 * @param at             absolute instant of the milestone
 * @param types          every bin type due on {@code collectionDate}
 */
public record BinMilestone(Kind kind, LocalDate collectionDate, Instant at, List<String> types)
{
    public enum Kind {
        NIGHT_BEFORE,
        MORNING_OF,
        REFRESH;

        public boolean isReminder() {
            return this != REFRESH;
        }
    }

    public BinMilestone {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(collectionDate, "collectionDate");
        Objects.requireNonNull(at, "at");
        types = List.copyOf(types);
    }

    /**
     * Expands a calendar into its milestones, ordered by instant. Types due on
     * the same date are grouped into one reminder.
     */
    public static List<BinMilestone> derive(List<BinCollection> schedule, BinReminderTimes times, ZoneId zone) {
        Map<LocalDate, List<String>> byDate = new TreeMap<>();
        for (BinCollection collection : schedule) {
            List<String> types = byDate.computeIfAbsent(collection.date(), d -> new ArrayList<>());
            if (!types.contains(collection.type())) {
                types.add(collection.type());
            }
        }

        List<BinMilestone> milestones = new ArrayList<>();
        byDate.forEach((date, types) -> {
            milestones.add(new BinMilestone(Kind.NIGHT_BEFORE, date,
                    date.minusDays(1).atTime(times.nightBefore()).atZone(zone).toInstant(), types));
            milestones.add(new BinMilestone(Kind.MORNING_OF, date,
                    date.atTime(times.morningOf()).atZone(zone).toInstant(), types));
            milestones.add(new BinMilestone(Kind.REFRESH, date,
                    date.plusDays(1).atTime(times.refresh()).atZone(zone).toInstant(), types));
        });
        milestones.sort(Comparator.comparing(BinMilestone::at).thenComparing(BinMilestone::kind));
        return milestones;
    }
}
