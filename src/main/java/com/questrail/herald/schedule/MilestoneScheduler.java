package com.questrail.herald.schedule;

import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.dispatch.AlertChannel;
import com.questrail.herald.domain.DomainDriver;
import com.questrail.herald.domain.DomainOutcome;
import com.questrail.herald.internal.time.Cancellable;
import com.questrail.herald.internal.time.MonotonicClock;
import com.questrail.herald.internal.time.MonotonicScheduler;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.MilestoneEvent;
import com.questrail.herald.store.PersistenceException;
import com.questrail.herald.store.StateStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * MilestoneScheduler
 * =============================================================================
 * Wakes one domain at its next milestone, evaluates it and re-arms.
 *
 * <h2>Timing model</h2>
 * Milestones are wall-clock instants; waiting is done on the monotonic
 * scheduler. Each wait is capped at {@link SchedulerTimingPolicy#maxSleep()}
 * and the wall clock is re-read on every wake, so a far milestone survives
 * clock adjustments and an early wake just re-arms. A milestone already in
 * the past is evaluated without delay.
 *
 * <h2>Sequencing</h2>
 * At most one wake is armed per domain, and evaluations never overlap. Every
 * armed wake carries the generation it was armed under; {@link #replan()} and
 * {@link #stop()} bump the generation so superseded wakes do nothing.
 *
 * <h2>Commit, then alert</h2>
 * {@link DomainDriver#prefetch} runs first, without the store lock, so a slow
 * provider never holds up commands on the same domain.
 * {@link DomainDriver#onMilestone} then runs inside {@link StateStore#transact}.
 * Its alerts reach the {@link AlertChannel} only after the new state is
 * durable. Failures are handled as follows:
 * <ul>
 *   <li>Provider unavailable: nothing committed, retried after
 *       {@link SchedulerTimingPolicy#retryDelay()}</li>
 *   <li>Persistence failure: alerts withheld, retried after the retry
 *       delay</li>
 *   <li>Anything else, errors included: reported, retried after the retry
 *       delay</li>
 * </ul>
 *
 * @param <S> domain state type
 */
public final class MilestoneScheduler<S> {

    private final DomainDriver<S> driver;
    private final StateStore<S> store;
    private final AlertChannel alerts;
    private final WallClock wallClock;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final SchedulerTimingPolicy timing;
    private final HeraldObservabilitySink observabilitySink;

    private final Object planLock = new Object();
    private final ReentrantLock evaluationLock = new ReentrantLock();

    // Guarded by planLock
    private boolean running;
    private long generation;
    private Cancellable pending;
    private Instant armedFor;

    public MilestoneScheduler(DomainDriver<S> driver,
                              StateStore<S> store,
                              AlertChannel alerts,
                              WallClock wallClock,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              SchedulerTimingPolicy timing,
                              HeraldObservabilitySink observabilitySink)
    {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.store = Objects.requireNonNull(store, "store");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public String domain() {
        return driver.domain();
    }

    /**
     * Arms the first wake. Idempotent.
     */
    public void start() {
        synchronized (planLock) {
            if (running) {
                return;
            }
            running = true;
            planLocked(false);
        }
    }

    /**
     * Cancels the armed wake. An evaluation already in progress completes,
     * but does not re-arm.
     */
    public void stop() {
        synchronized (planLock) {
            running = false;
            generation++;
            cancelPendingLocked();
        }
    }

    /**
     * Recomputes the next milestone from the current state. Call after a
     * command changed something the schedule depends on.
     */
    public void replan() {
        synchronized (planLock) {
            if (!running) {
                return;
            }
            generation++;
            cancelPendingLocked();
            planLocked(false);
        }
    }

    /**
     * Milestone the armed wake is heading for, if any.
     */
    public Optional<Instant> armedMilestone() {
        synchronized (planLock) {
            return Optional.ofNullable(armedFor);
        }
    }

    public boolean isRunning() {
        synchronized (planLock) {
            return running;
        }
    }

    // -------------------------------------------------------------------------
    // Planning
    // -------------------------------------------------------------------------

    /**
     * @param afterNoProgress the last evaluation changed nothing; an overdue
     *                        milestone then waits the retry delay instead of
     *                        spinning
     */
    private void planLocked(boolean afterNoProgress) {
        long gen = generation;
        Instant now = wallClock.now();

        Optional<Instant> next;
        try {
            next = driver.nextMilestoneAt(store.read(), now);
        } catch (RuntimeException | Error e) {
            report(HeraldErrorEvent.Kind.UNEXPECTED, "Could not compute next milestone", e);
            armLocked(gen, now, timing.retryDelay());
            return;
        }

        if (next.isEmpty()) {
            armedFor = null;
            pending = null;
            return;
        }

        Instant target = next.get();
        Duration delay = Duration.between(now, target);
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
        if (afterNoProgress && delay.isZero()) {
            delay = timing.retryDelay();
        }
        if (delay.compareTo(timing.maxSleep()) > 0) {
            delay = timing.maxSleep();
        }
        armLocked(gen, target, delay);
    }

    private void armLocked(long gen, Instant target, Duration delay) {
        armedFor = target;
        pending = scheduler.scheduleAfter(delay, clock, () -> wake(gen, target));
    }

    private void cancelPendingLocked() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        armedFor = null;
    }

    // -------------------------------------------------------------------------
    // Evaluation
    // -------------------------------------------------------------------------

    private void wake(long gen, Instant target) {
        evaluationLock.lock();
        try {
            synchronized (planLock) {
                if (!running || gen != generation) {
                    return;
                }
                pending = null;
            }

            Instant now = wallClock.now();
            if (now.isBefore(target)) {
                synchronized (planLock) {
                    if (running && gen == generation) {
                        planLocked(false);
                    }
                }
                return;
            }

            Duration retry = null;
            boolean progressed = true;
            try {
                UnaryOperator<S> prefetched = driver.prefetch(store.read(), now);
                Evaluation<S> evaluation = store.transact(state -> {
                    DomainOutcome<S> outcome = driver.onMilestone(state, now).mapState(prefetched);
                    boolean changed = !outcome.newState().equals(state);
                    return new StateStore.Commit<>(outcome.newState(), new Evaluation<>(outcome, changed));
                });

                evaluation.outcome().alerts().forEach(alerts::dispatch);
                progressed = evaluation.changed() || !evaluation.outcome().alerts().isEmpty();

                observabilitySink.onMilestone(new MilestoneEvent(
                        now, driver.domain(), target, evaluation.changed(), evaluation.outcome().alerts().size()));
            } catch (ProviderUnavailableException e) {
                report(HeraldErrorEvent.Kind.TRANSIENT_PROVIDER, "Provider unavailable; retrying in " + timing.retryDelay(), e);
                retry = timing.retryDelay();
            } catch (PersistenceException e) {
                report(HeraldErrorEvent.Kind.PERSISTENCE, "State not saved; alerts withheld, retrying in " + timing.retryDelay(), e);
                retry = timing.retryDelay();
            } catch (RuntimeException | Error e) {
                report(HeraldErrorEvent.Kind.UNEXPECTED, "Milestone evaluation failed; retrying in " + timing.retryDelay(), e);
                retry = timing.retryDelay();
            }

            synchronized (planLock) {
                if (!running || gen != generation) {
                    return;
                }
                if (retry != null) {
                    armLocked(gen, target, retry);
                } else {
                    planLocked(!progressed);
                }
            }
        } finally {
            evaluationLock.unlock();
        }
    }

    private void report(HeraldErrorEvent.Kind kind, String message, Throwable cause) {
        observabilitySink.onError(new HeraldErrorEvent(wallClock.now(), driver.domain(), kind, message, cause));
    }

    private record Evaluation<S>(DomainOutcome<S> outcome, boolean changed) {
    }
}
