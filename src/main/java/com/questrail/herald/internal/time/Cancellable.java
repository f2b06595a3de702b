package com.questrail.herald.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a pending sleep: a milestone wake-up, a watch poll tick or a
 * replan.
 *
 * <p>
 * Implemented by the executor-backed scheduler in production and by the
 * deterministic scheduler in tests.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the pending task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
