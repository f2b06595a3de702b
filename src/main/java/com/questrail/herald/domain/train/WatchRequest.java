package com.questrail.herald.domain.train;

/**
 * A user's request to watch one train.
 *
 * @param trainIdentifier scheduled departure time, {@code HH:mm}
 * @param station         station code or shortcut; {@code null} to use the
 *                        session's last queried station
 * @param destination     optional destination filter
 */
public record WatchRequest(String trainIdentifier, String station, String destination)
{
    public static WatchRequest of(String trainIdentifier) {
        return new WatchRequest(trainIdentifier, null, null);
    }
}
