package com.questrail.herald.dispatch;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.DeliveryResult;
import com.questrail.herald.api.DeliverySink;
import com.questrail.herald.internal.time.SystemWallClock;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.DeliveryFailureEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AlertDispatcher
 * =============================================================================
 * Registry of {@link DeliverySink}s and the single task that delivers alerts
 * to them.
 *
 * <h2>Threading Model</h2>
 * Producers call {@link #dispatch(Alert)}, which only enqueues. One delivery
 * thread takes alerts off the queue in order and hands each to every
 * registered sink. This ensures:
 * <ul>
 *   <li>A slow or failing sink never stalls a milestone scheduler or a watch</li>
 *   <li>No sink call ever runs on a producer's call stack</li>
 *   <li>Alerts reach each sink in dispatch order</li>
 * </ul>
 *
 * <h2>Delivery guarantee</h2>
 * Each sink gets up to {@link DeliveryRetryPolicy#maxAttempts()} tries with
 * exponential backoff. A failed result and a thrown exception are treated
 * alike. Once a sink accepts the payload it is not sent again. When the budget
 * is exhausted the failure is reported through
 * {@link HeraldObservabilitySink#onDeliveryFailure(DeliveryFailureEvent)};
 * nothing is dropped silently and nothing is re-run upstream.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   dispatcher.register(sink)
 *   dispatcher.start()          → starts delivery thread
 *   dispatcher.dispatch(alert)  → enqueues
 *   dispatcher.stop(timeout)    → drains the queue, then stops
 * </pre>
 */
public final class AlertDispatcher implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    /**
     * Backoff wait; replaced in tests to avoid real sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final List<DeliverySink> sinks = new CopyOnWriteArrayList<>();
    private final AlertRouting routing;
    private final DeliveryRetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final HeraldObservabilitySink observabilitySink;

    private final BlockingQueue<Alert> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread deliveryThread;

    public AlertDispatcher(AlertRouting routing,
                           DeliveryRetryPolicy retryPolicy,
                           Sleeper sleeper,
                           WallClock wallClock,
                           HeraldObservabilitySink observabilitySink)
    {
        this.routing = Objects.requireNonNull(routing, "routing");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public AlertDispatcher(AlertRouting routing, DeliveryRetryPolicy retryPolicy)
    {
        this(routing, retryPolicy, Sleeper.SYSTEM, SystemWallClock.INSTANCE, null);
    }

    /**
     * Adds a sink. Alerts already queued are delivered to it as well.
     */
    public void register(DeliverySink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public boolean unregister(DeliverySink sink) {
        return sinks.remove(sink);
    }

    /**
     * Enqueues an alert. Never blocks and never throws for a non-null alert.
     * Alerts dispatched before {@link #start()} wait in the queue.
     */
    @Override
    public void dispatch(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        queue.offer(alert);
    }

    /**
     * Number of alerts waiting for the delivery thread.
     */
    public int pending() {
        return queue.size();
    }

    /**
     * Starts the delivery thread. Idempotent. The thread is a daemon; alerts
     * still queued when the host exits without {@link #stop} are lost.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::runDeliveryLoop, "herald-alert-dispatcher");
            thread.setDaemon(true);
            deliveryThread = thread;
            thread.start();
        }
    }

    /**
     * Stops accepting work once the queue is empty, waiting up to
     * {@code drainTimeout}. If the queue cannot be drained in time the thread
     * is interrupted and every undelivered alert is reported as failed.
     */
    public void stop(Duration drainTimeout) {
        if (running.compareAndSet(true, false)) {
            Thread thread = deliveryThread;
            if (thread == null) {
                return;
            }
            try {
                thread.join(Math.max(1, drainTimeout.toMillis()));
                if (thread.isAlive()) {
                    thread.interrupt();
                    thread.join(1000);
                }
            } catch (InterruptedException e) {
                thread.interrupt();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runDeliveryLoop() {
        try {
            while (running.get() || !queue.isEmpty()) {
                Alert alert = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                if (alert != null) {
                    deliverIsolated(alert);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            reportUndelivered();
        }
    }

    /**
     * Whatever escapes one alert's delivery is reported against that alert;
     * the loop carries on with the next.
     */
    private void deliverIsolated(Alert alert) throws InterruptedException {
        try {
            deliver(alert);
        } catch (InterruptedException e) {
            throw e;
        } catch (Throwable t) {
            try {
                observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                        wallClock.now(), "*", alert, 0, "delivery aborted: " + describe(t), t));
            } catch (RuntimeException reportFailure) {
                log.error("Delivery of {} alert aborted and could not be reported", alert.domain(), t);
            }
        }
    }

    private void reportUndelivered() {
        List<Alert> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        for (Alert alert : remaining) {
            observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                    wallClock.now(), "*", alert, 0, "dispatcher stopped before delivery", null));
        }
    }

    /**
     * Delivers one alert to every registered sink with retry.
     */
    private void deliver(Alert alert) throws InterruptedException {
        Optional<String> recipient = alert.recipient().or(() -> routing.recipientFor(alert.domain()));
        if (recipient.isEmpty()) {
            observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                    wallClock.now(), "*", alert, 0, "no recipient routed for domain '" + alert.domain() + "'", null));
            return;
        }
        for (DeliverySink sink : sinks) {
            deliverToSink(sink, recipient.get(), alert);
        }
    }

    private void deliverToSink(DeliverySink sink, String recipient, Alert alert) throws InterruptedException {
        String reason = "";
        Throwable cause = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            Duration backoff = retryPolicy.backoffBefore(attempt);
            if (!backoff.isZero()) {
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                            wallClock.now(), sink.name(), alert, attempt - 1,
                            "interrupted while backing off: " + reason, cause));
                    throw e;
                }
            }

            try {
                DeliveryResult result = sink.send(recipient, alert.payload());
                if (result != null && result.delivered()) {
                    return;
                }
                reason = result == null ? "sink returned no result" : result.detail();
                cause = null;
            } catch (RuntimeException | Error e) {
                reason = describe(e);
                cause = e;
            }
        }

        observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                wallClock.now(), sink.name(), alert, retryPolicy.maxAttempts(), reason, cause));
    }

    private static String describe(Throwable t) {
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
