package com.questrail.herald.domain.train;

import com.questrail.herald.api.ProviderUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scriptable departure board for tests.
 */
final class FakeDepartureBoardProvider implements DepartureBoardProvider {

    private final Map<String, List<Departure>> boards = new HashMap<>();
    private boolean down;
    private Runnable duringFetch = () -> { };
    final List<String> queries = new ArrayList<>();

    synchronized void board(String crs, Departure... departures) {
        boards.put(crs, List.of(departures));
    }

    synchronized void down(boolean down) {
        this.down = down;
    }

    /**
     * Runs inside the next fetch, after the query is recorded.
     */
    synchronized void duringNextFetch(Runnable action) {
        this.duringFetch = action;
    }

    @Override
    public DepartureBoard fetch(String crs) throws ProviderUnavailableException {
        Runnable action;
        List<Departure> departures;
        synchronized (this) {
            queries.add(crs);
            if (down) {
                throw new ProviderUnavailableException("Darwin feed timed out");
            }
            action = duringFetch;
            duringFetch = () -> { };
            departures = boards.getOrDefault(crs, List.of());
        }
        action.run();
        return new DepartureBoard(crs, crs + " station", departures, Instant.EPOCH);
    }
}
