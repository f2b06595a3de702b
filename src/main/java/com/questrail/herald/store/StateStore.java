package com.questrail.herald.store;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * StateStore
 * =============================================================================
 * Durable, per-domain home of a single {@code DomainState} value.
 *
 * <h2>Lock discipline</h2>
 * Every mutation goes through {@link #transact(Transaction)}: the store takes
 * its lock, hands the current value to the transaction, writes the returned
 * value if it differs, and only then releases the lock. Scheduled milestone
 * evaluations and user commands use the same path, so a command and a
 * milestone firing together cannot lose each other's update.
 *
 * <h2>Commit-before-effect</h2>
 * A transaction returns its side effects (alerts, replies) as the
 * {@link Commit#result()}. Callers act on them only after
 * {@code transact} has returned normally, that is after the write is durable.
 * If the write fails a {@link PersistenceException} is thrown, the in-memory
 * value is left untouched and the result is never seen.
 *
 * @param <S> immutable state type
 */
public interface StateStore<S> extends AutoCloseable
{
    /**
     * Domain this store belongs to.
     */
    String domain();

    /**
     * Last committed value. Safe to call from any thread.
     */
    S read();

    /**
     * Runs a read-modify-write under the store lock.
     *
     * @throws X                   whatever the transaction throws; nothing is written
     * @throws PersistenceException the new value could not be written
     */
    <R, X extends Exception> R transact(Transaction<S, R, X> transaction) throws X;

    /**
     * Convenience read-modify-write without a side result.
     */
    default S update(UnaryOperator<S> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        return transact(current -> {
            S next = mutation.apply(current);
            return new Commit<>(next, next);
        });
    }

    /**
     * Waits for any in-flight write and refuses further transactions.
     */
    @Override
    void close();

    /**
     * One read-modify-write step.
     */
    @FunctionalInterface
    interface Transaction<S, R, X extends Exception>
    {
        Commit<S, R> apply(S current) throws X;
    }

    /**
     * New state to persist plus the result released to the caller after the
     * write.
     */
    record Commit<S, R>(S newState, R result)
    {
        public Commit {
            Objects.requireNonNull(newState, "newState");
        }
    }
}
