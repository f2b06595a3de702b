package com.questrail.herald.observability;

/**
 * Receives kernel observability events: milestone evaluations, catch-up
 * results, watch transitions, delivery failures and errors.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface HeraldObservabilitySink {
    /**
     * Called after a milestone evaluation has been committed.
     */
    void onMilestone(MilestoneEvent event);

    /**
     * Called after a domain's startup reconciliation has been committed.
     */
    void onReconciliation(ReconciliationEvent event);

    /**
     * Called whenever a watch reducer step runs, including no-op steps.
     */
    void onWatchTransition(WatchTransitionEvent event);

    /**
     * Called when a sink has exhausted its retry budget for an alert.
     */
    void onDeliveryFailure(DeliveryFailureEvent event);

    /**
     * Called for any failure handled inside a domain task.
     */
    void onError(HeraldErrorEvent event);
}
