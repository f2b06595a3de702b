package com.questrail.herald.domain.train;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.AlertSeverity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WatchStateMachineTest
 * -----------------------------------------------------------------------------
 * Pure reducer tests: no scheduler, no provider.
 */
class WatchStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-02T07:50:00Z");

    private final WatchStateMachine machine = new WatchStateMachine();

    private final WatchSubscription subscription =
            new WatchSubscription("ctx-1", "chat-9", "08:15", "NEM", null, null, null, T0);

    private static Departure departure(String platform, String expected) {
        return new Departure("08:15", "London Euston", platform, expected);
    }

    private WatchState watching() {
        return machine.apply(WatchState.inactive(), new WatchEvent.WatchRequested(T0, subscription)).newState();
    }

    private WatchState observed(String platform, String expected) {
        return machine.apply(watching(),
                new WatchEvent.DepartureObserved(T0, departure(platform, expected))).newState();
    }

    @Test
    void watchRequestActivatesSilently() {
        WatchStateMachine.Transition t =
                machine.apply(WatchState.inactive(), new WatchEvent.WatchRequested(T0, subscription));

        assertTrue(t.newState().isActive());
        assertTrue(t.alert().isEmpty());
    }

    @Test
    void firstObservationConfirmsCurrentValues() {
        WatchStateMachine.Transition t = machine.apply(watching(),
                new WatchEvent.DepartureObserved(T0, departure("4", "On time")));

        Alert alert = t.alert().orElseThrow();
        assertEquals("The 08:15 from NEM: platform ? → 4. expected ? → On time.", alert.payload());
        assertEquals(AlertSeverity.NOTICE, alert.severity());
        WatchSubscription recorded = t.newState().subscription().orElseThrow();
        assertEquals("4", recorded.lastKnownPlatform());
        assertEquals("On time", recorded.lastKnownStatus());
    }

    @Test
    void knownPlatformWithUnknownStatusStillDetectsPlatformChange() {
        WatchSubscription platformOnly = new WatchSubscription("ctx-1", "chat-9", "08:15", "NEM", null, "4", null, T0);
        WatchState state = machine.apply(WatchState.inactive(), new WatchEvent.WatchRequested(T0, platformOnly)).newState();

        WatchStateMachine.Transition t = machine.apply(state,
                new WatchEvent.DepartureObserved(T0, departure("9", "On time")));

        Alert alert = t.alert().orElseThrow();
        assertTrue(alert.payload().contains("platform 4 → 9"), alert.payload());
        assertEquals(AlertSeverity.WARNING, alert.severity());
    }

    @Test
    void platformChangeAlertsExactlyOnce() {
        WatchState state = observed("4", "On time");

        WatchStateMachine.Transition changed = machine.apply(state,
                new WatchEvent.DepartureObserved(T0.plusSeconds(30), departure("9", "On time")));
        WatchStateMachine.Transition repeated = machine.apply(changed.newState(),
                new WatchEvent.DepartureObserved(T0.plusSeconds(60), departure("9", "On time")));

        Alert alert = changed.alert().orElseThrow();
        assertEquals("The 08:15 from NEM: platform 4 → 9.", alert.payload());
        assertEquals(AlertSeverity.WARNING, alert.severity());
        assertEquals("chat-9", alert.recipientId());
        assertEquals("train", alert.domain());
        assertTrue(repeated.alert().isEmpty());
        assertSame(changed.newState(), repeated.newState());
    }

    @Test
    void platformAndStatusChangeShareOneAlert() {
        WatchStateMachine.Transition t = machine.apply(observed("4", "On time"),
                new WatchEvent.DepartureObserved(T0, departure("9", "08:22")));

        assertEquals("The 08:15 from NEM: platform 4 → 9. expected On time → 08:22.", t.alert().orElseThrow().payload());
    }

    @Test
    void departedEndsWatchWithOneFinalAlert() {
        WatchStateMachine.Transition departed = machine.apply(observed("4", "On time"),
                new WatchEvent.DepartureObserved(T0, departure("4", "Departed")));

        assertFalse(departed.newState().isActive());
        assertEquals("The 08:15 from NEM: Departed. Watch ended.", departed.alert().orElseThrow().payload());
        assertEquals(AlertSeverity.NOTICE, departed.alert().get().severity());

        WatchStateMachine.Transition after = machine.apply(departed.newState(),
                new WatchEvent.DepartureObserved(T0, departure("4", "Departed")));
        assertTrue(after.alert().isEmpty(), "inactive watches never alert");
    }

    @Test
    void cancellationIsTerminalEvenBeforeFirstObservation() {
        WatchStateMachine.Transition t = machine.apply(watching(),
                new WatchEvent.DepartureObserved(T0, departure(null, "CANCELLED")));

        assertFalse(t.newState().isActive());
        assertEquals(AlertSeverity.WARNING, t.alert().orElseThrow().severity());
    }

    @Test
    void trainLeavingTheBoardEndsWatch() {
        WatchStateMachine.Transition t = machine.apply(observed("4", "On time"), new WatchEvent.DepartureMissing(T0));

        assertFalse(t.newState().isActive());
        assertEquals("The 08:15 from NEM is no longer on the departure board. Watch ended.",
                t.alert().orElseThrow().payload());
    }

    @Test
    void tickWhileInactiveDoesNothing() {
        WatchStateMachine.Transition observed = machine.apply(WatchState.inactive(),
                new WatchEvent.DepartureObserved(T0, departure("4", "On time")));
        WatchStateMachine.Transition missing = machine.apply(WatchState.inactive(), new WatchEvent.DepartureMissing(T0));

        assertSame(WatchState.inactive(), observed.newState());
        assertTrue(observed.alert().isEmpty());
        assertTrue(missing.alert().isEmpty());
    }

    @Test
    void newWatchReplacesOldSilently() {
        WatchSubscription other = new WatchSubscription("ctx-1", null, "09:02", "EUS", "Glasgow Central", null, null, T0);

        WatchStateMachine.Transition t = machine.apply(observed("4", "On time"), new WatchEvent.WatchRequested(T0, other));

        assertTrue(t.alert().isEmpty());
        assertEquals(other, t.newState().subscription().orElseThrow());
    }

    @Test
    void unwatchDeactivatesSilently() {
        WatchStateMachine.Transition t = machine.apply(observed("4", "On time"), new WatchEvent.UnwatchRequested(T0));

        assertFalse(t.newState().isActive());
        assertTrue(t.alert().isEmpty());
    }
}
