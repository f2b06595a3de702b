package com.questrail.herald.domain.bins;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Local times of the three milestones around a collection date.
 *
 * @param nightBefore reminder on the evening before collection
 * @param morningOf   reminder on the collection morning
 * @param refresh     re-fetch of the calendar on the day after collection
 */
public record BinReminderTimes(LocalTime nightBefore, LocalTime morningOf, LocalTime refresh)
{
    public BinReminderTimes {
        Objects.requireNonNull(nightBefore, "nightBefore");
        Objects.requireNonNull(morningOf, "morningOf");
        Objects.requireNonNull(refresh, "refresh");
    }

    public static BinReminderTimes defaults() {
        return new BinReminderTimes(LocalTime.of(18, 0), LocalTime.of(7, 0), LocalTime.of(9, 0));
    }
}
