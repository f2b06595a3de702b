package com.questrail.herald.domain.train;

import java.util.Locale;
import java.util.Objects;

/**
 * One row of a departure board.
 *
 * @param scheduledTime timetabled departure, {@code HH:mm}
 * @param destination   destination name as shown on the board
 * @param platform      platform, or {@code null} when not yet announced
 * @param expected      expected time or status ({@code "On time"},
 *                      {@code "17:46"}, {@code "Delayed"}, {@code "Cancelled"},
 *                      {@code "Departed"})
 */
public record Departure(String scheduledTime, String destination, String platform, String expected)
{
    public Departure {
        Objects.requireNonNull(scheduledTime, "scheduledTime");
        Objects.requireNonNull(destination, "destination");
        expected = expected == null ? "" : expected;
    }

    /**
     * True once the train has left or will not run.
     */
    public boolean isTerminal() {
        String status = expected.trim().toLowerCase(Locale.ROOT);
        return status.equals("departed") || status.equals("cancelled");
    }
}
