package com.questrail.herald.domain.train;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.dispatch.AlertChannel;
import com.questrail.herald.internal.time.Cancellable;
import com.questrail.herald.internal.time.MonotonicClock;
import com.questrail.herald.internal.time.MonotonicScheduler;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.WatchTransitionEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * WatchPoller
 * =============================================================================
 * Owns the watch of one user context and the periodic poll that drives it.
 *
 * <h2>One poll at a time</h2>
 * Each tick schedules the next one, so a context never has more than one
 * pending or running poll. A tick carries the generation it was armed under;
 * {@link #watch} and {@link #unwatch} bump the generation, so a tick that was
 * already fetching when the subscription changed discards its observation
 * instead of applying it to the new watch.
 *
 * <h2>Locking</h2>
 * The board is fetched without holding the lock. Only the reduction through
 * {@link WatchStateMachine} and the re-arm happen under it. Alerts are handed
 * to the {@link AlertChannel} after the lock is released.
 *
 * <h2>Provider failures</h2>
 * A failed fetch leaves the watch untouched and the next tick simply tries
 * again; the last known values stay as they were.
 */
public final class WatchPoller {

    private final String contextId;
    private final WatchStateMachine machine;
    private final DepartureBoardProvider provider;
    private final AlertChannel alerts;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration pollInterval;
    private final HeraldObservabilitySink observabilitySink;
    private final Consumer<WatchPoller> onFinished;

    private final Object lock = new Object();

    // Guarded by lock
    private WatchState state = WatchState.inactive();
    private Cancellable pendingTick;
    private long generation;
    private boolean stopped;

    public WatchPoller(String contextId,
                       WatchStateMachine machine,
                       DepartureBoardProvider provider,
                       AlertChannel alerts,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       WallClock wallClock,
                       Duration pollInterval,
                       HeraldObservabilitySink observabilitySink)
    {
        this(contextId, machine, provider, alerts, scheduler, clock, wallClock, pollInterval, observabilitySink,
                poller -> { });
    }

    /**
     * @param onFinished called, without the poller's lock held, when a watch
     *                   ends by itself (departed, cancelled or gone from the
     *                   board)
     */
    public WatchPoller(String contextId,
                       WatchStateMachine machine,
                       DepartureBoardProvider provider,
                       AlertChannel alerts,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       WallClock wallClock,
                       Duration pollInterval,
                       HeraldObservabilitySink observabilitySink,
                       Consumer<WatchPoller> onFinished)
    {
        this.contextId = Objects.requireNonNull(contextId, "contextId");
        this.machine = Objects.requireNonNull(machine, "machine");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
    }

    public String contextId() {
        return contextId;
    }

    public WatchState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Starts watching, replacing any current watch. The first poll runs
     * immediately and confirms the train's current platform and status.
     */
    public void watch(WatchSubscription subscription) {
        synchronized (lock) {
            if (stopped) {
                throw new IllegalStateException("watch poller for '" + contextId + "' is stopped");
            }
            applyLocked(new WatchEvent.WatchRequested(wallClock.now(), subscription));
            long gen = ++generation;
            cancelPendingLocked();
            armLocked(gen, Duration.ZERO);
        }
    }

    /**
     * Stops watching. Returns {@code false} if nothing was being watched.
     */
    public boolean unwatch() {
        synchronized (lock) {
            boolean wasActive = state.isActive();
            applyLocked(new WatchEvent.UnwatchRequested(wallClock.now()));
            generation++;
            cancelPendingLocked();
            return wasActive;
        }
    }

    /**
     * Cancels polling for good. Used on shutdown.
     */
    public void stop() {
        synchronized (lock) {
            stopped = true;
            generation++;
            cancelPendingLocked();
        }
    }

    private void tick(long gen) {
        WatchSubscription subscription;
        synchronized (lock) {
            if (stopped || gen != generation || !(state instanceof WatchState.Active active)) {
                return;
            }
            pendingTick = null;
            subscription = active.current();
        }

        DepartureBoard board;
        try {
            board = provider.fetch(subscription.origin());
        } catch (ProviderUnavailableException e) {
            reportError(HeraldErrorEvent.Kind.TRANSIENT_PROVIDER, "Departure board unavailable for " + subscription.origin(), e);
            rearm(gen);
            return;
        } catch (RuntimeException e) {
            reportError(HeraldErrorEvent.Kind.UNEXPECTED, "Departure board fetch failed for " + subscription.origin(), e);
            rearm(gen);
            return;
        }

        WatchEvent event = board.find(subscription)
                .<WatchEvent>map(d -> new WatchEvent.DepartureObserved(wallClock.now(), d))
                .orElseGet(() -> new WatchEvent.DepartureMissing(wallClock.now()));

        Optional<Alert> alert;
        boolean finished;
        synchronized (lock) {
            if (stopped || gen != generation) {
                return;
            }
            alert = applyLocked(event);
            finished = !state.isActive();
            if (!finished) {
                armLocked(gen, pollInterval);
            }
        }
        alert.ifPresent(alerts::dispatch);
        if (finished) {
            onFinished.accept(this);
        }
    }

    private void rearm(long gen) {
        synchronized (lock) {
            if (!stopped && gen == generation && state.isActive()) {
                armLocked(gen, pollInterval);
            }
        }
    }

    private Optional<Alert> applyLocked(WatchEvent event) {
        WatchState old = state;
        WatchStateMachine.Transition transition = machine.apply(old, event);
        state = transition.newState();

        if (old != state || transition.alert().isPresent()) {
            observabilitySink.onWatchTransition(new WatchTransitionEvent(
                    event.timestamp(), contextId, old, state, event, transition.alert().isPresent()));
        }
        return transition.alert();
    }

    private void armLocked(long gen, Duration delay) {
        pendingTick = scheduler.scheduleAfter(delay, clock, () -> tick(gen));
    }

    private void cancelPendingLocked() {
        if (pendingTick != null) {
            pendingTick.cancel();
            pendingTick = null;
        }
    }

    private void reportError(HeraldErrorEvent.Kind kind, String message, Throwable cause) {
        observabilitySink.onError(new HeraldErrorEvent(wallClock.now(), WatchStateMachine.DOMAIN, kind,
                "[" + contextId + "] " + message, cause));
    }
}
