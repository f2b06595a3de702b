package com.questrail.herald.domain.train;

import com.questrail.herald.api.CommandException;
import com.questrail.herald.api.CommandReply;
import com.questrail.herald.api.InvalidSubscriptionException;
import com.questrail.herald.api.NoContextException;
import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.dispatch.AlertChannel;
import com.questrail.herald.domain.TrainWatchDriver;
import com.questrail.herald.internal.time.MonotonicClock;
import com.questrail.herald.internal.time.MonotonicScheduler;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TrainCommands
 * -----------------------------------------------------------------------------
 * User commands for departures, watches and station shortcuts.
 *
 * <h2>Station resolution</h2>
 * Commands that need a station accept a shortcut name or a station code.
 * When none is given the session's last queried station is used, then the
 * configured default station; with neither, {@link NoContextException} is
 * thrown.
 *
 * <h2>Watches</h2>
 * A context gets a {@link WatchPoller} when it starts a watch. The poller is
 * dropped again once the watch ends, whether by unwatch or because the train
 * departed, was cancelled or left the board. A new watch replaces the
 * previous one for that context.
 */
public final class TrainCommands {

    private static final Logger log = LoggerFactory.getLogger(TrainCommands.class);

    private static final int BOARD_ROWS = 10;

    private final StateStore<TrainState> store;
    private final TrainWatchDriver driver;
    private final DepartureBoardProvider provider;
    private final AlertChannel alerts;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration pollInterval;
    private final HeraldObservabilitySink observabilitySink;
    private final String defaultStation;

    private final WatchStateMachine machine = new WatchStateMachine();
    private final Map<String, WatchPoller> pollers = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    public TrainCommands(StateStore<TrainState> store,
                         TrainWatchDriver driver,
                         DepartureBoardProvider provider,
                         AlertChannel alerts,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         WallClock wallClock,
                         Duration pollInterval,
                         HeraldObservabilitySink observabilitySink)
    {
        this(store, driver, provider, alerts, scheduler, clock, wallClock, pollInterval, observabilitySink, null);
    }

    /**
     * @param defaultStation station code used when neither the command nor the
     *                       session names one, or {@code null} for none
     */
    public TrainCommands(StateStore<TrainState> store,
                         TrainWatchDriver driver,
                         DepartureBoardProvider provider,
                         AlertChannel alerts,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         WallClock wallClock,
                         Duration pollInterval,
                         HeraldObservabilitySink observabilitySink,
                         String defaultStation)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (defaultStation != null && !TrainWatchDriver.isStationCode(defaultStation)) {
            throw new IllegalArgumentException("defaultStation must be a three-letter station code: " + defaultStation);
        }
        this.defaultStation = defaultStation == null ? null : defaultStation.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Shows the live board for a station and remembers it in the session.
     *
     * @param station station code or shortcut, or {@code null} for the
     *                session's last queried station
     */
    public CommandReply departures(SessionContext session, String station) throws CommandException {
        String crs = resolve(session, station);

        DepartureBoard board;
        try {
            board = provider.fetch(crs);
        } catch (ProviderUnavailableException e) {
            log.warn("Departure board for {} unavailable: {}", crs, e.getMessage());
            return CommandReply.of("Departures for " + crs + " are unavailable right now. Try again shortly.");
        }
        session.rememberStation(crs);

        List<Departure> rows = board.departures();
        if (rows.isEmpty()) {
            return CommandReply.of("No departures listed for " + board.stationName() + ".");
        }

        StringBuilder reply = new StringBuilder("Departures from ").append(board.stationName()).append(':');
        rows.stream().limit(BOARD_ROWS).forEach(d -> {
            reply.append('\n').append(d.scheduledTime()).append(' ').append(d.destination());
            if (d.platform() != null && !d.platform().isBlank()) {
                reply.append("  Plat ").append(d.platform());
            }
            reply.append("  ").append(d.expected());
        });
        return CommandReply.of(reply.toString());
    }

    /**
     * Starts watching a train for this session, replacing any current watch.
     *
     * @throws InvalidSubscriptionException no train identifier, or an unknown station
     * @throws NoContextException           no station given and none remembered
     */
    public CommandReply watch(SessionContext session, WatchRequest request) throws CommandException {
        Objects.requireNonNull(request, "request");
        if (request.trainIdentifier() == null || request.trainIdentifier().isBlank()) {
            throw new InvalidSubscriptionException("Say which train to watch, e.g. 08:15");
        }
        String crs = resolve(session, request.station());
        String destination = request.destination() == null || request.destination().isBlank()
                ? null
                : request.destination().trim();

        WatchSubscription subscription = new WatchSubscription(
                session.contextId(),
                session.recipientId().orElse(null),
                request.trainIdentifier().trim(),
                crs,
                destination,
                null,
                null,
                wallClock.now());
        if (stopped) {
            throw new IllegalStateException("train commands are stopped");
        }
        pollers.compute(session.contextId(), (id, existing) -> {
            WatchPoller poller = existing != null ? existing : newPoller(id);
            poller.watch(subscription);
            return poller;
        });
        return CommandReply.of("Watching " + subscription.describe() + ".");
    }

    public CommandReply unwatch(SessionContext session) {
        WatchPoller poller = pollers.get(session.contextId());
        if (poller == null) {
            return CommandReply.of("Not watching any train.");
        }
        boolean wasWatching = poller.unwatch();
        retire(poller);
        return CommandReply.of(wasWatching ? "Stopped watching." : "Not watching any train.");
    }

    public WatchState watchState(SessionContext session) {
        WatchPoller poller = pollers.get(session.contextId());
        return poller == null ? WatchState.inactive() : poller.state();
    }

    public CommandReply addShortcut(String name, String crs) throws CommandException {
        if (name == null || name.isBlank()) {
            throw new CommandException("Shortcut name must not be empty");
        }
        if (!TrainWatchDriver.isStationCode(crs)) {
            throw new CommandException("'" + crs + "' is not a three-letter station code");
        }
        String code = crs.trim().toUpperCase(Locale.ROOT);
        store.update(state -> state.withShortcut(name, code));
        return CommandReply.of("Saved shortcut " + name.trim() + " → " + code + ".");
    }

    public CommandReply removeShortcut(String name) throws CommandException {
        if (name == null || store.read().shortcut(name).isEmpty()) {
            throw new CommandException("No shortcut named '" + name + "'");
        }
        store.update(state -> state.withoutShortcut(name));
        return CommandReply.of("Removed shortcut " + name.trim() + ".");
    }

    public CommandReply shortcuts() {
        Map<String, String> shortcuts = store.read().shortcuts();
        if (shortcuts.isEmpty()) {
            return CommandReply.of("No station shortcuts saved.");
        }
        StringBuilder reply = new StringBuilder("Station shortcuts:");
        shortcuts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> reply.append('\n').append(e.getKey()).append(" → ").append(e.getValue()));
        return CommandReply.of(reply.toString());
    }

    /**
     * Contexts with a watch in progress.
     */
    public int activeWatchCount() {
        return pollers.size();
    }

    /**
     * Stops every poller and refuses new watches. Watches are not persisted,
     * so they end here.
     */
    public void stopAll() {
        stopped = true;
        pollers.values().forEach(WatchPoller::stop);
        pollers.clear();
    }

    private String resolve(SessionContext session, String station) throws CommandException {
        Objects.requireNonNull(session, "session");
        if (station != null && !station.isBlank()) {
            return driver.resolveStation(store.read(), station);
        }
        Optional<String> remembered = session.lastQueriedStation();
        if (remembered.isPresent()) {
            return remembered.get();
        }
        if (defaultStation != null) {
            return defaultStation;
        }
        throw new NoContextException("No station given and none queried yet. Try /trains <station> first.");
    }

    private WatchPoller newPoller(String contextId) {
        return new WatchPoller(contextId, machine, provider, alerts, scheduler, clock, wallClock, pollInterval,
                observabilitySink, this::retire);
    }

    // Only an idle poller is removed, so a watch started meanwhile keeps its poller.
    private void retire(WatchPoller poller) {
        pollers.computeIfPresent(poller.contextId(),
                (id, current) -> current == poller && !current.state().isActive() ? null : current);
    }
}
