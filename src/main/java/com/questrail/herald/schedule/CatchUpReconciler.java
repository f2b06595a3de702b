package com.questrail.herald.schedule;

import com.questrail.herald.dispatch.AlertChannel;
import com.questrail.herald.domain.DomainDriver;
import com.questrail.herald.domain.DomainOutcome;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.ReconciliationEvent;
import com.questrail.herald.store.PersistenceException;
import com.questrail.herald.store.StateStore;

import java.time.Instant;
import java.util.Objects;

/**
 * Runs each domain's catch-up once at startup, before its scheduler starts.
 *
 * <p>The driver's {@link DomainDriver#reconcile} runs under the store lock
 * and its alerts are dispatched only after the result is saved. If saving
 * fails the alerts are dropped with the state change; the scheduler picks the
 * milestone up again from the unchanged state.</p>
 */
public final class CatchUpReconciler {

    private final AlertChannel alerts;
    private final WallClock wallClock;
    private final HeraldObservabilitySink observabilitySink;

    public CatchUpReconciler(AlertChannel alerts, WallClock wallClock, HeraldObservabilitySink observabilitySink) {
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * @return the committed outcome, or the current state with no alerts when
     *         catch-up failed
     */
    public <S> DomainOutcome<S> reconcile(DomainDriver<S> driver, StateStore<S> store) {
        Instant now = wallClock.now();
        try {
            Reconciled<S> reconciled = store.transact(state -> {
                DomainOutcome<S> outcome = driver.reconcile(state, now);
                return new StateStore.Commit<>(outcome.newState(),
                        new Reconciled<>(outcome, !outcome.newState().equals(state)));
            });

            reconciled.outcome().alerts().forEach(alerts::dispatch);
            observabilitySink.onReconciliation(new ReconciliationEvent(
                    now, driver.domain(), driver.catchUpPolicy(), reconciled.changed(),
                    reconciled.outcome().alerts().size()));
            return reconciled.outcome();
        } catch (PersistenceException e) {
            observabilitySink.onError(new HeraldErrorEvent(
                    now, driver.domain(), HeraldErrorEvent.Kind.PERSISTENCE, "Catch-up not saved", e));
        } catch (RuntimeException e) {
            observabilitySink.onError(new HeraldErrorEvent(
                    now, driver.domain(), HeraldErrorEvent.Kind.UNEXPECTED, "Catch-up failed", e));
        }
        return DomainOutcome.unchanged(store.read());
    }

    private record Reconciled<S>(DomainOutcome<S> outcome, boolean changed) {
    }
}
