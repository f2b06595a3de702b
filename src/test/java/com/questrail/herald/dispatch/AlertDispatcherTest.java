package com.questrail.herald.dispatch;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.AlertSeverity;
import com.questrail.herald.api.DeliveryResult;
import com.questrail.herald.api.DeliverySink;
import com.questrail.herald.observability.DeliveryFailureEvent;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.MilestoneEvent;
import com.questrail.herald.observability.ReconciliationEvent;
import com.questrail.herald.observability.WatchTransitionEvent;
import com.questrail.herald.observability.RecordingObservabilitySink;
import com.questrail.herald.time.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AlertDispatcherTest
 * -----------------------------------------------------------------------------
 * Delivery retry, routing and drain behaviour. Backoff waits are recorded
 * instead of slept.
 */
class AlertDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private final ManualClock clock = new ManualClock(T0);
    private final RecordingObservabilitySink observability = new RecordingObservabilitySink();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private AlertDispatcher dispatcher;

    private AlertDispatcher dispatcher(AlertRouting routing, DeliveryRetryPolicy policy) {
        dispatcher = new AlertDispatcher(routing, policy, sleeps::add, clock, observability);
        return dispatcher;
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.stop(Duration.ofSeconds(2));
        }
    }

    @Test
    void sinkThatFailsThenSucceedsDeliversExactlyOnce() {
        FlakySink sink = new FlakySink(2);
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("budget", "family").build(),
                new DeliveryRetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30)));
        d.register(sink);
        d.start();

        d.dispatch(Alert.of("budget", AlertSeverity.INFO, "Weekly allowance added", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(3, sink.calls.get());
        assertEquals(List.of("family:Weekly allowance added"), sink.delivered);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertFalse(observability.hasEventOfType(DeliveryFailureEvent.class));
    }

    @Test
    void exhaustedRetriesAreReportedNotDropped() {
        FlakySink sink = new FlakySink(Integer.MAX_VALUE);
        AlertDispatcher d = dispatcher(AlertRouting.of(java.util.Map.of("bins", "house")),
                DeliveryRetryPolicy.immediate(3));
        d.register(sink);
        d.start();

        Alert alert = Alert.of("bins", AlertSeverity.NOTICE, "Bins out tonight", T0);
        d.dispatch(alert);
        d.stop(Duration.ofSeconds(5));

        assertEquals(3, sink.calls.get());
        List<DeliveryFailureEvent> failures = observability.eventsOfType(DeliveryFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals("flaky", failures.get(0).sink());
        assertEquals(alert, failures.get(0).alert());
        assertEquals(3, failures.get(0).attempts());
    }

    @Test
    void thrownExceptionCountsAsFailedAttempt() {
        AtomicInteger calls = new AtomicInteger();
        DeliverySink throwing = new DeliverySink() {
            @Override
            public String name() {
                return "throwing";
            }

            @Override
            public DeliveryResult send(String recipientId, String payload) {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("socket closed");
                }
                return DeliveryResult.ok();
            }
        };
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("train", "me").build(),
                DeliveryRetryPolicy.immediate(2));
        d.register(throwing);
        d.start();

        d.dispatch(Alert.of("train", AlertSeverity.WARNING, "Platform 4 → 9", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(2, calls.get());
        assertFalse(observability.hasEventOfType(DeliveryFailureEvent.class));
    }

    @Test
    void explicitRecipientOverridesRouting() {
        FlakySink sink = new FlakySink(0);
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("train", "default-chat").build(),
                DeliveryRetryPolicy.immediate(1));
        d.register(sink);
        d.start();

        d.dispatch(Alert.of("train", AlertSeverity.WARNING, "Delayed", T0).withRecipient("session-42"));
        d.stop(Duration.ofSeconds(5));

        assertEquals(List.of("session-42:Delayed"), sink.delivered);
    }

    @Test
    void unroutedAlertIsReported() {
        FlakySink sink = new FlakySink(0);
        AlertDispatcher d = dispatcher(AlertRouting.empty(), DeliveryRetryPolicy.immediate(1));
        d.register(sink);
        d.start();

        d.dispatch(Alert.of("budget", AlertSeverity.INFO, "nobody hears this", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(0, sink.calls.get());
        assertEquals(1, observability.eventsOfType(DeliveryFailureEvent.class).size());
    }

    @Test
    void alertsQueuedBeforeStartAreDeliveredInOrder() {
        FlakySink sink = new FlakySink(0);
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("bins", "house").build(),
                DeliveryRetryPolicy.immediate(1));
        d.register(sink);

        d.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "one", T0));
        d.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "two", T0));
        assertEquals(2, d.pending());

        d.start();
        d.stop(Duration.ofSeconds(5));

        assertEquals(List.of("house:one", "house:two"), sink.delivered);
        assertEquals(0, d.pending());
    }

    @Test
    void everySinkReceivesEachAlert() {
        FlakySink first = new FlakySink(0);
        FlakySink second = new FlakySink(1);
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("budget", "family").build(),
                DeliveryRetryPolicy.immediate(2));
        d.register(first);
        d.register(second);
        d.start();

        d.dispatch(Alert.of("budget", AlertSeverity.INFO, "hello", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(List.of("family:hello"), first.delivered);
        assertEquals(List.of("family:hello"), second.delivered);
    }

    @Test
    void errorThrownBySinkIsRetriedAndLaterAlertsStillFlow() {
        AtomicInteger calls = new AtomicInteger();
        List<String> delivered = new CopyOnWriteArrayList<>();
        DeliverySink overflowing = new DeliverySink() {
            @Override
            public String name() {
                return "overflowing";
            }

            @Override
            public DeliveryResult send(String recipientId, String payload) {
                if (calls.incrementAndGet() == 1) {
                    throw new StackOverflowError();
                }
                delivered.add(payload);
                return DeliveryResult.ok();
            }
        };
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("bins", "house").build(),
                DeliveryRetryPolicy.immediate(2));
        d.register(overflowing);
        d.start();

        d.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "first", T0));
        d.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "second", T0));
        d.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "third", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(List.of("first", "second", "third"), delivered);
        assertFalse(observability.hasEventOfType(DeliveryFailureEvent.class));
    }

    @Test
    void brokenSinkNameAbortsOnlyThatAlert() {
        FlakySink good = new FlakySink(0);
        DeliverySink nameless = new DeliverySink() {
            @Override
            public String name() {
                throw new IllegalStateException("not configured");
            }

            @Override
            public DeliveryResult send(String recipientId, String payload) {
                return DeliveryResult.failed("HTTP 500");
            }
        };
        AlertDispatcher d = dispatcher(AlertRouting.builder().route("budget", "family").build(),
                DeliveryRetryPolicy.immediate(1));
        d.register(good);
        d.register(nameless);
        d.start();

        d.dispatch(Alert.of("budget", AlertSeverity.INFO, "one", T0));
        d.dispatch(Alert.of("budget", AlertSeverity.INFO, "two", T0));
        d.stop(Duration.ofSeconds(5));

        assertEquals(List.of("family:one", "family:two"), good.delivered);
        List<DeliveryFailureEvent> failures = observability.eventsOfType(DeliveryFailureEvent.class);
        assertEquals(2, failures.size());
        assertEquals("*", failures.get(0).sink());
        assertTrue(failures.get(0).reason().startsWith("delivery aborted"), failures.get(0).reason());
    }

    @Test
    void failingObservabilitySinkDoesNotStopDelivery() {
        FlakySink sink = new FlakySink(0);
        HeraldObservabilitySink broken = new HeraldObservabilitySink() {
            @Override
            public void onMilestone(MilestoneEvent event) {
            }

            @Override
            public void onReconciliation(ReconciliationEvent event) {
            }

            @Override
            public void onWatchTransition(WatchTransitionEvent event) {
            }

            @Override
            public void onDeliveryFailure(DeliveryFailureEvent event) {
                throw new IllegalStateException("metrics backend down");
            }

            @Override
            public void onError(HeraldErrorEvent event) {
            }
        };
        dispatcher = new AlertDispatcher(AlertRouting.empty(), DeliveryRetryPolicy.immediate(1), sleeps::add, clock, broken);
        dispatcher.register(sink);
        dispatcher.start();

        dispatcher.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "unrouted", T0));
        dispatcher.dispatch(Alert.of("bins", AlertSeverity.NOTICE, "routed", T0).withRecipient("house"));
        dispatcher.stop(Duration.ofSeconds(5));

        assertEquals(List.of("house:routed"), sink.delivered);
    }

    /**
     * Fails the first {@code failures} sends, then accepts.
     */
    private static final class FlakySink implements DeliverySink {
        private final int failures;
        final AtomicInteger calls = new AtomicInteger();
        final List<String> delivered = new ArrayList<>();

        FlakySink(int failures) {
            this.failures = failures;
        }

        @Override
        public String name() {
            return "flaky";
        }

        @Override
        public synchronized DeliveryResult send(String recipientId, String payload) {
            if (calls.incrementAndGet() <= failures) {
                return DeliveryResult.failed("HTTP 502");
            }
            delivered.add(recipientId + ":" + payload);
            return DeliveryResult.ok();
        }
    }
}
