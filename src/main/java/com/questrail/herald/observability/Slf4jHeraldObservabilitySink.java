package com.questrail.herald.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HeraldObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHeraldObservabilitySink implements HeraldObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHeraldObservabilitySink.class);

    @Override
    public void onMilestone(MilestoneEvent event) {
        log.info("[{}] milestone {} evaluated ({} late): stateChanged={}, alerts={}",
            event.domain(),
            event.milestoneAt(),
            event.lateness(),
            event.stateChanged(),
            event.alertCount());
    }

    @Override
    public void onReconciliation(ReconciliationEvent event) {
        if (event.stateChanged() || event.alertCount() > 0) {
            log.info("[{}] catch-up ({}) applied: alerts={}",
                event.domain(), event.policy(), event.alertCount());
        } else {
            log.debug("[{}] catch-up ({}) found nothing to do", event.domain(), event.policy());
        }
    }

    @Override
    public void onWatchTransition(WatchTransitionEvent event) {
        if (event.isActivationChange()) {
            log.info("Watch {}: {} -> {} on {}",
                event.contextId(),
                event.oldState(),
                event.newState(),
                event.trigger().getClass().getSimpleName());
        } else if (event.alerted()) {
            log.info("Watch {}: change alerted for {}", event.contextId(), event.newState());
        } else {
            log.debug("Watch {}: no change", event.contextId());
        }
    }

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {
        log.error("Delivery to sink '{}' failed after {} attempt(s), alert dropped: domain={}, reason={}",
            event.sink(),
            event.attempts(),
            event.alert().domain(),
            event.reason(),
            event.cause());
    }

    @Override
    public void onError(HeraldErrorEvent event) {
        switch (event.kind()) {
            case TRANSIENT_PROVIDER -> log.warn("[{}] {}: {}", event.domain(), event.message(),
                event.cause() != null ? event.cause().getMessage() : "");
            case PERSISTENCE, STATE_CORRUPTION -> log.error("[{}] {} ({})",
                event.domain(), event.message(), event.kind(), event.cause());
            default -> log.error("[{}] {}", event.domain(), event.message(), event.cause());
        }
    }
}
