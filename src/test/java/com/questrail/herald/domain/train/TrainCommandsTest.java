package com.questrail.herald.domain.train;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.CommandException;
import com.questrail.herald.api.InvalidSubscriptionException;
import com.questrail.herald.api.NoContextException;
import com.questrail.herald.domain.TrainWatchDriver;
import com.questrail.herald.observability.NullObservabilitySink;
import com.questrail.herald.store.InMemoryStateStore;
import com.questrail.herald.time.DeterministicScheduler;
import com.questrail.herald.time.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainCommandsTest {

    private static final Instant T0 = Instant.parse("2026-03-02T07:50:00Z");

    private final ManualClock clock = new ManualClock(T0);
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeDepartureBoardProvider provider = new FakeDepartureBoardProvider();
    private final InMemoryStateStore<TrainState> store = new InMemoryStateStore<>("train", TrainState.empty());
    private final List<Alert> alerts = new ArrayList<>();

    private final TrainCommands commands = new TrainCommands(store, new TrainWatchDriver(), provider, alerts::add,
            scheduler, clock, clock, Duration.ofSeconds(30), NullObservabilitySink.INSTANCE);

    private final SessionContext session = new SessionContext("ctx-1", "chat-1");

    @Test
    void departuresRenderBoardAndRememberStation() throws CommandException {
        provider.board("NEM",
                new Departure("08:15", "London Euston", "4", "On time"),
                new Departure("08:40", "Birmingham New Street", null, "Delayed"));

        String reply = commands.departures(session, "nem").text();

        assertEquals("Departures from NEM station:\n"
                + "08:15 London Euston  Plat 4  On time\n"
                + "08:40 Birmingham New Street  Delayed", reply);
        assertEquals("NEM", session.lastQueriedStation().orElseThrow());
    }

    @Test
    void watchUsesLastQueriedStation() throws CommandException {
        provider.board("NEM", new Departure("08:15", "London Euston", "4", "On time"));
        commands.departures(session, "NEM");

        assertEquals("Watching the 08:15 from NEM.", commands.watch(session, WatchRequest.of("08:15")).text());
        scheduler.runDueTasks();

        WatchSubscription watched = commands.watchState(session).subscription().orElseThrow();
        assertEquals("NEM", watched.origin());
        assertEquals("chat-1", watched.recipientId());
        assertEquals("4", watched.lastKnownPlatform());
    }

    @Test
    void watchWithoutAnyStationFails() {
        assertThrows(NoContextException.class, () -> commands.watch(session, WatchRequest.of("08:15")));
        assertThrows(NoContextException.class, () -> commands.departures(session, null));
    }

    @Test
    void watchWithoutTrainFails() {
        assertThrows(InvalidSubscriptionException.class,
                () -> commands.watch(session, new WatchRequest("  ", "NEM", null)));
    }

    @Test
    void unknownStationTokenFails() {
        assertThrows(InvalidSubscriptionException.class,
                () -> commands.watch(session, new WatchRequest("08:15", "home sweet home", null)));
    }

    @Test
    void shortcutsResolveAndPersist() throws CommandException {
        commands.addShortcut("Work", "eus");
        provider.board("EUS", new Departure("17:30", "Northampton", "12", "On time"));

        commands.watch(session, new WatchRequest("17:30", "work", null));

        assertEquals("EUS", store.read().shortcut("WORK").orElseThrow());
        assertEquals("EUS", commands.watchState(session).subscription().orElseThrow().origin());
        assertEquals("Station shortcuts:\nwork → EUS", commands.shortcuts().text());

        commands.removeShortcut("work");
        assertEquals("No station shortcuts saved.", commands.shortcuts().text());
        assertThrows(CommandException.class, () -> commands.removeShortcut("work"));
    }

    @Test
    void shortcutMustPointAtStationCode() {
        assertThrows(CommandException.class, () -> commands.addShortcut("home", "Northampton"));
        assertEquals(0, store.writes.get());
    }

    @Test
    void unwatchReportsWhetherAnythingWasWatched() throws CommandException {
        assertEquals("Not watching any train.", commands.unwatch(session).text());

        commands.watch(session, new WatchRequest("08:15", "NEM", null));
        assertEquals("Stopped watching.", commands.unwatch(session).text());
        assertFalse(commands.watchState(session).isActive());
    }

    @Test
    void contextsAreIndependent() throws CommandException {
        SessionContext other = SessionContext.of("ctx-2");
        provider.board("NEM", new Departure("08:15", "London Euston", "4", "On time"));

        commands.watch(session, new WatchRequest("08:15", "NEM", null));
        commands.watch(other, new WatchRequest("08:15", "NEM", null));
        commands.unwatch(session);

        assertFalse(commands.watchState(session).isActive());
        assertTrue(commands.watchState(other).isActive());
    }

    @Test
    void defaultStationUsedWhenSessionHasNone() throws CommandException {
        TrainCommands withDefault = withDefaultStation("nem");
        provider.board("NEM", new Departure("08:15", "London Euston", "4", "On time"));

        assertEquals("Watching the 08:15 from NEM.", withDefault.watch(session, WatchRequest.of("08:15")).text());
        assertTrue(withDefault.departures(session, null).text().startsWith("Departures from NEM station:"));
        assertEquals("NEM", withDefault.watchState(session).subscription().orElseThrow().origin());
    }

    @Test
    void explicitAndRememberedStationsBeatTheDefault() throws CommandException {
        TrainCommands withDefault = withDefaultStation("NEM");
        provider.board("EUS", new Departure("17:30", "Northampton", "12", "On time"));
        provider.board("MKC", new Departure("18:02", "Crewe", "3", "On time"));

        withDefault.watch(session, new WatchRequest("17:30", "EUS", null));
        assertEquals("EUS", withDefault.watchState(session).subscription().orElseThrow().origin());

        withDefault.departures(session, "MKC");
        withDefault.watch(session, WatchRequest.of("18:02"));
        assertEquals("MKC", withDefault.watchState(session).subscription().orElseThrow().origin());
    }

    @Test
    void defaultStationMustBeAStationCode() {
        assertThrows(IllegalArgumentException.class, () -> withDefaultStation("Northampton"));
    }

    @Test
    void endedWatchesAreForgotten() throws CommandException {
        SessionContext other = SessionContext.of("ctx-2");
        provider.board("NEM", new Departure("08:15", "London Euston", "4", "On time"));
        commands.watch(session, new WatchRequest("08:15", "NEM", null));
        commands.watch(other, new WatchRequest("08:15", "NEM", null));
        scheduler.runDueTasks();
        assertEquals(2, commands.activeWatchCount());

        commands.unwatch(other);
        assertEquals(1, commands.activeWatchCount());

        provider.board("NEM", new Departure("08:15", "London Euston", "4", "Departed"));
        clock.advance(Duration.ofSeconds(30));
        scheduler.runDueTasks();

        assertEquals(0, commands.activeWatchCount());
        assertFalse(commands.watchState(session).isActive());
    }

    @Test
    void watchAfterStopAllIsRefused() {
        commands.stopAll();

        assertThrows(IllegalStateException.class,
                () -> commands.watch(session, new WatchRequest("08:15", "NEM", null)));
        assertEquals(0, commands.activeWatchCount());
    }

    @Test
    void unavailableBoardGivesFriendlyReply() throws CommandException {
        provider.down(true);

        String reply = commands.departures(session, "NEM").text();

        assertTrue(reply.contains("unavailable"));
        assertTrue(session.lastQueriedStation().isEmpty());
    }

    private TrainCommands withDefaultStation(String crs) {
        return new TrainCommands(store, new TrainWatchDriver(), provider, alerts::add,
                scheduler, clock, clock, Duration.ofSeconds(30), NullObservabilitySink.INSTANCE, crs);
    }
}
