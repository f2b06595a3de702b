package com.questrail.herald.domain.bins;

import com.questrail.herald.api.CommandReply;
import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.domain.BinReminderDriver;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * User commands for bin collections.
 */
public final class BinCommands {

    private static final Logger log = LoggerFactory.getLogger(BinCommands.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEE d MMM", Locale.UK);

    private final StateStore<BinState> store;
    private final BinReminderDriver driver;
    private final CollectionScheduleProvider provider;
    private final WallClock wallClock;
    private final Runnable onScheduleChanged;

    /**
     * @param onScheduleChanged invoked after a command replaced the cached
     *                          calendar, so the scheduler can replan
     */
    public BinCommands(StateStore<BinState> store,
                       BinReminderDriver driver,
                       CollectionScheduleProvider provider,
                       WallClock wallClock,
                       Runnable onScheduleChanged)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.onScheduleChanged = Objects.requireNonNull(onScheduleChanged, "onScheduleChanged");
    }

    /**
     * Lists upcoming collections from the cache, fetching the calendar first
     * when nothing upcoming is cached.
     */
    public CommandReply upcomingCollections() {
        List<BinCollection> upcoming = driver.upcoming(store.read(), wallClock.now());

        if (upcoming.isEmpty()) {
            List<BinCollection> fetched;
            try {
                fetched = provider.fetchSchedule();
            } catch (ProviderUnavailableException e) {
                log.warn("Collection calendar unavailable: {}", e.getMessage());
                return CommandReply.of("The collection calendar is unavailable right now. Try again later.");
            }
            BinState next = store.update(state -> state.withSchedule(fetched, wallClock.now()));
            onScheduleChanged.run();
            upcoming = driver.upcoming(next, wallClock.now());
        }

        if (upcoming.isEmpty()) {
            return CommandReply.of("No upcoming collections found.");
        }

        Map<LocalDate, StringBuilder> byDate = new LinkedHashMap<>();
        for (BinCollection collection : upcoming) {
            StringBuilder types = byDate.computeIfAbsent(collection.date(), d -> new StringBuilder());
            if (types.length() > 0) {
                types.append(", ");
            }
            types.append(collection.type());
        }

        StringBuilder reply = new StringBuilder("Upcoming collections:");
        byDate.forEach((date, types) -> reply.append('\n').append(DAY.format(date)).append(": ").append(types));
        return CommandReply.of(reply.toString());
    }
}
