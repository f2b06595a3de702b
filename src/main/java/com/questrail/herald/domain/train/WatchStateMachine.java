package com.questrail.herald.domain.train;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.AlertSeverity;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * WatchStateMachine
 * =============================================================================
 * Pure reducer for one context's train watch.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   Inactive --WatchRequested-----------------&gt; Active
 *   Active   --WatchRequested-----------------&gt; Active (replaced, silent)
 *   Active   --UnwatchRequested---------------&gt; Inactive
 *   Active   --DepartureObserved (first)------&gt; Active + confirmation alert
 *   Active   --DepartureObserved (changed)----&gt; Active + alert
 *   Active   --DepartureObserved (terminal)---&gt; Inactive + final alert
 *   Active   --DepartureMissing---------------&gt; Inactive + final alert
 *   Inactive --anything else------------------&gt; Inactive
 * </pre>
 *
 * <h2>Change detection</h2>
 * Platform and status are each compared with the last known value; an
 * unknown value counts as "?". The first observation therefore always
 * alerts, confirming what the board says when the watch starts.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>No I/O, no clocks, no threads</li>
 *   <li>At most one alert per event</li>
 *   <li>A terminal status produces exactly one alert: the watch is inactive
 *       afterwards and inactive watches never alert</li>
 * </ul>
 */
public final class WatchStateMachine {

    public static final String DOMAIN = "train";

    public record Transition(WatchState newState, Optional<Alert> alert) {
        public Transition {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(alert, "alert");
        }

        static Transition to(WatchState state) {
            return new Transition(state, Optional.empty());
        }
    }

    public Transition apply(WatchState state, WatchEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof WatchEvent.WatchRequested requested) {
            return Transition.to(WatchState.active(requested.subscription()));
        }
        if (event instanceof WatchEvent.UnwatchRequested) {
            return Transition.to(WatchState.inactive());
        }
        if (!(state instanceof WatchState.Active active)) {
            return Transition.to(state);
        }

        WatchSubscription subscription = active.current();

        if (event instanceof WatchEvent.DepartureMissing missing) {
            String text = capitalise(subscription.describe()) + " is no longer on the departure board. Watch ended.";
            return new Transition(WatchState.inactive(),
                    Optional.of(alert(subscription, AlertSeverity.NOTICE, text, missing)));
        }

        WatchEvent.DepartureObserved observed = (WatchEvent.DepartureObserved) event;
        Departure departure = observed.departure();

        if (departure.isTerminal()) {
            boolean cancelled = departure.expected().trim().equalsIgnoreCase("cancelled");
            String text = capitalise(subscription.describe()) + ": " + departure.expected().trim() + ". Watch ended.";
            return new Transition(WatchState.inactive(),
                    Optional.of(alert(subscription,
                            cancelled ? AlertSeverity.WARNING : AlertSeverity.NOTICE, text, observed)));
        }

        WatchSubscription updated = subscription.observed(departure);
        boolean platformChanged = !Objects.equals(subscription.lastKnownPlatform(), departure.platform());
        boolean statusChanged = !Objects.equals(subscription.lastKnownStatus(), departure.expected());
        if (!platformChanged && !statusChanged) {
            return Transition.to(state);
        }

        StringBuilder text = new StringBuilder(capitalise(subscription.describe())).append(':');
        if (platformChanged) {
            text.append(" platform ")
                    .append(orUnknown(subscription.lastKnownPlatform()))
                    .append(" → ")
                    .append(orUnknown(departure.platform()))
                    .append('.');
        }
        if (statusChanged) {
            text.append(" expected ")
                    .append(orUnknown(subscription.lastKnownStatus()))
                    .append(" → ")
                    .append(orUnknown(departure.expected()))
                    .append('.');
        }
        AlertSeverity severity = subscription.hasObservation() ? AlertSeverity.WARNING : AlertSeverity.NOTICE;
        return new Transition(WatchState.active(updated),
                Optional.of(alert(subscription, severity, text.toString(), observed)));
    }

    private static Alert alert(WatchSubscription subscription, AlertSeverity severity, String text, WatchEvent event) {
        return new Alert(DOMAIN, severity, text, subscription.recipientId(), event.timestamp());
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "?" : value;
    }

    private static String capitalise(String text) {
        return text.isEmpty() ? text : text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }
}
