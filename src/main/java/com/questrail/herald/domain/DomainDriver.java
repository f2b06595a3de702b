package com.questrail.herald.domain;

import com.questrail.herald.api.ProviderUnavailableException;

import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * DomainDriver
 * -----------------------------------------------------------------------------
 * Scheduling and recovery policy for one feature.
 *
 * <h2>Role in the architecture</h2>
 * A driver is the only place that knows what a domain's milestones are and
 * what happens when one is reached. The kernel (milestone scheduler, catch-up
 * reconciler) knows nothing else about the domain.
 * <p>
 * Drivers are:
 * <ul>
 *   <li>Stateless (all state is passed in and returned)</li>
 *   <li>Free of locking (the state store serialises calls)</li>
 *   <li>Only allowed to call their data provider from {@link #prefetch},
 *       which runs before the store lock is taken</li>
 * </ul>
 *
 * <h2>Closed set</h2>
 * The variants are fixed: allowance accrual, bin reminders and train watches.
 *
 * @param <S> immutable persisted state type
 */
public sealed interface DomainDriver<S>
        permits BudgetAccrualDriver, BinReminderDriver, TrainWatchDriver
{
    /**
     * Domain name; also the state file name and the routing key.
     */
    String domain();

    Class<S> stateType();

    /**
     * State used on first start and after an unreadable state file.
     */
    S initialState(Instant now);

    CatchUpPolicy catchUpPolicy();

    /**
     * Next instant the scheduler should wake for, or empty to stay idle until
     * explicitly replanned. May lie in the past; the scheduler then runs
     * {@link #onMilestone} without delay.
     */
    Optional<Instant> nextMilestoneAt(S state, Instant now);

    /**
     * Fetches the external data the milestone due at {@code now} needs, given
     * a snapshot of the state. Runs without the store lock. The returned
     * update is applied to the state {@link #onMilestone} produces, inside the
     * same transaction.
     *
     * @throws ProviderUnavailableException the data is unavailable; nothing is
     *         committed and the scheduler retries later
     */
    default UnaryOperator<S> prefetch(S state, Instant now) throws ProviderUnavailableException {
        return UnaryOperator.identity();
    }

    /**
     * Evaluates the milestone that is due at {@code now}. Runs under the store
     * lock and must not block.
     */
    DomainOutcome<S> onMilestone(S state, Instant now);

    /**
     * Startup catch-up following {@link #catchUpPolicy()}. Must be idempotent:
     * a second call with the same {@code now} returns the state unchanged and
     * no alerts.
     */
    DomainOutcome<S> reconcile(S state, Instant now);
}
