package com.questrail.herald.observability;

/**
 * No-op implementation of HeraldObservabilitySink.
 */
public final class NullObservabilitySink implements HeraldObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMilestone(MilestoneEvent event) {}

    @Override
    public void onReconciliation(ReconciliationEvent event) {}

    @Override
    public void onWatchTransition(WatchTransitionEvent event) {}

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {}

    @Override
    public void onError(HeraldErrorEvent event) {}
}
