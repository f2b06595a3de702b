package com.questrail.herald.runtime;

import com.questrail.herald.api.DeliverySink;
import com.questrail.herald.config.HeraldConfig;
import com.questrail.herald.dispatch.AlertDispatcher;
import com.questrail.herald.domain.BinReminderDriver;
import com.questrail.herald.domain.BudgetAccrualDriver;
import com.questrail.herald.domain.DomainDriver;
import com.questrail.herald.domain.TrainWatchDriver;
import com.questrail.herald.domain.bins.BinCommands;
import com.questrail.herald.domain.bins.BinState;
import com.questrail.herald.domain.bins.CollectionScheduleProvider;
import com.questrail.herald.domain.budget.BudgetCommands;
import com.questrail.herald.domain.budget.BudgetState;
import com.questrail.herald.domain.train.DepartureBoardProvider;
import com.questrail.herald.domain.train.TrainCommands;
import com.questrail.herald.domain.train.TrainState;
import com.questrail.herald.internal.time.MonotonicClock;
import com.questrail.herald.internal.time.MonotonicScheduler;
import com.questrail.herald.internal.time.ScheduledExecutorScheduler;
import com.questrail.herald.internal.time.SystemMonotonicClock;
import com.questrail.herald.internal.time.SystemWallClock;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.Slf4jHeraldObservabilitySink;
import com.questrail.herald.schedule.CatchUpReconciler;
import com.questrail.herald.schedule.MilestoneScheduler;
import com.questrail.herald.store.FileStateStore;
import com.questrail.herald.store.PersistenceException;
import com.questrail.herald.store.StateStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HeraldRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the notification kernel.
 *
 * <h2>Startup order</h2>
 * <ol>
 *   <li>Open each enabled domain's state store</li>
 *   <li>Start the alert dispatcher</li>
 *   <li>Run each domain's catch-up</li>
 *   <li>Start each domain's milestone scheduler</li>
 * </ol>
 * A domain whose store cannot be opened is reported and left out; the
 * others run normally.
 *
 * <h2>Threads</h2>
 * Each domain's milestone scheduler has its own single timer thread, and
 * train watches poll on a separate pool. A provider call that hangs therefore
 * only holds up its own domain (or other watches), never the budget or bin
 * milestones. The dispatcher has its own delivery thread.
 *
 * <h2>Shutdown order</h2>
 * Schedulers and watches first, then the timer threads, then the stores, and
 * finally the dispatcher, which drains what is still queued.
 */
public final class HeraldRuntime {

    private static final int WATCH_THREADS = 2;

    private final HeraldConfig config;
    private final AlertDispatcher dispatcher;
    private final CatchUpReconciler reconciler;
    private final List<ScheduledExecutorService> executors;

    private final List<DomainRuntime<?>> domains;
    private final BudgetCommands budget;
    private final BinCommands bins;
    private final TrainCommands trains;

    private HeraldRuntime(HeraldConfig config,
                          AlertDispatcher dispatcher,
                          CatchUpReconciler reconciler,
                          List<ScheduledExecutorService> executors,
                          List<DomainRuntime<?>> domains,
                          BudgetCommands budget,
                          BinCommands bins,
                          TrainCommands trains)
    {
        this.config = config;
        this.dispatcher = dispatcher;
        this.reconciler = reconciler;
        this.executors = List.copyOf(executors);
        this.domains = List.copyOf(domains);
        this.budget = budget;
        this.bins = bins;
        this.trains = trains;
    }

    public void start() {
        dispatcher.start();
        for (DomainRuntime<?> domain : domains) {
            domain.reconcile(reconciler);
            domain.scheduler().start();
        }
    }

    public void stop() {
        domains.forEach(d -> d.scheduler().stop());
        if (trains != null) {
            trains.stopAll();
        }

        executors.forEach(ScheduledExecutorService::shutdown);
        try {
            for (ScheduledExecutorService executor : executors) {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            executors.forEach(ScheduledExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
        }

        domains.forEach(d -> d.store().close());
        dispatcher.stop(config.drainTimeout());
    }

    public BudgetCommands budget() {
        return require(budget, BudgetAccrualDriver.DOMAIN);
    }

    public BinCommands bins() {
        return require(bins, BinReminderDriver.DOMAIN);
    }

    public TrainCommands trains() {
        return require(trains, TrainWatchDriver.DOMAIN);
    }

    public AlertDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Scheduler for a running domain, if that domain was enabled and its store
     * opened.
     */
    public Optional<MilestoneScheduler<?>> scheduler(String domain) {
        return domains.stream()
                .filter(d -> d.driver().domain().equals(domain))
                .<MilestoneScheduler<?>>map(DomainRuntime::scheduler)
                .findFirst();
    }

    public List<String> runningDomains() {
        return domains.stream().map(d -> d.driver().domain()).toList();
    }

    private <T> T require(T commands, String domain) {
        if (commands == null) {
            throw new IllegalStateException("The " + domain + " domain is not running");
        }
        return commands;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One enabled domain: its driver, store and scheduler.
     */
    private record DomainRuntime<S>(DomainDriver<S> driver, StateStore<S> store, MilestoneScheduler<S> scheduler) {
        void reconcile(CatchUpReconciler reconciler) {
            reconciler.reconcile(driver, store);
        }
    }

    public static final class Builder {
        private HeraldConfig config = HeraldConfig.defaults();
        private final List<DeliverySink> sinks = new ArrayList<>();
        private HeraldObservabilitySink observabilitySink = new Slf4jHeraldObservabilitySink();
        private boolean budgetEnabled;
        private CollectionScheduleProvider collectionScheduleProvider;
        private DepartureBoardProvider departureBoardProvider;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private AlertDispatcher.Sleeper sleeper = AlertDispatcher.Sleeper.SYSTEM;

        public Builder withConfig(HeraldConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDeliverySink(DeliverySink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public Builder withObservabilitySink(HeraldObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withBudget() {
            this.budgetEnabled = true;
            return this;
        }

        public Builder withBins(CollectionScheduleProvider provider) {
            this.collectionScheduleProvider = provider;
            return this;
        }

        public Builder withTrains(DepartureBoardProvider provider) {
            this.departureBoardProvider = provider;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        /**
         * Replaces every timer thread with one shared scheduler; the runtime
         * then owns no executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withDeliverySleeper(AlertDispatcher.Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public HeraldRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(monotonicClock, "monotonicClock");

            // 1. Timers, created per domain as each one opens
            List<ScheduledExecutorService> executors = new ArrayList<>();

            // 2. Delivery
            AlertDispatcher dispatcher = new AlertDispatcher(
                    config.routing(), config.deliveryRetry(), sleeper, wallClock, observabilitySink);
            sinks.forEach(dispatcher::register);
            CatchUpReconciler reconciler = new CatchUpReconciler(dispatcher, wallClock, observabilitySink);

            // 3. Domains
            List<DomainRuntime<?>> domains = new ArrayList<>();
            BudgetCommands budget = null;
            BinCommands bins = null;
            TrainCommands trains = null;

            if (budgetEnabled) {
                BudgetAccrualDriver driver = new BudgetAccrualDriver(config.weeklyAllowance(), config.historyLimit());
                Optional<DomainRuntime<BudgetState>> domain = open(driver, dispatcher, executors);
                if (domain.isPresent()) {
                    domains.add(domain.get());
                    budget = new BudgetCommands(domain.get().store(), driver, wallClock, config.zone());
                }
            }

            if (collectionScheduleProvider != null) {
                BinReminderDriver driver = new BinReminderDriver(
                        collectionScheduleProvider, config.binTimes(), config.zone(), config.binRecheckInterval());
                Optional<DomainRuntime<BinState>> domain = open(driver, dispatcher, executors);
                if (domain.isPresent()) {
                    domains.add(domain.get());
                    bins = new BinCommands(domain.get().store(), driver, collectionScheduleProvider, wallClock,
                            domain.get().scheduler()::replan);
                }
            }

            if (departureBoardProvider != null) {
                TrainWatchDriver driver = new TrainWatchDriver();
                Optional<DomainRuntime<TrainState>> domain = open(driver, dispatcher, executors);
                if (domain.isPresent()) {
                    domains.add(domain.get());
                    MonotonicScheduler watchTimers = timers("herald-watch", WATCH_THREADS, executors);
                    trains = new TrainCommands(domain.get().store(), driver, departureBoardProvider, dispatcher,
                            watchTimers, monotonicClock, wallClock, config.timing().watchPollInterval(),
                            observabilitySink, config.defaultStation().orElse(null));
                }
            }

            return new HeraldRuntime(config, dispatcher, reconciler, executors, domains, budget, bins, trains);
        }

        private <S> Optional<DomainRuntime<S>> open(DomainDriver<S> driver,
                                                    AlertDispatcher dispatcher,
                                                    List<ScheduledExecutorService> executors)
        {
            FileStateStore<S> store;
            try {
                store = FileStateStore.builder(driver.domain(), driver.stateType())
                        .withDirectory(config.stateDirectory())
                        .withDefaults(() -> driver.initialState(wallClock.now()))
                        .withWriteAttempts(config.writeAttempts())
                        .withWallClock(wallClock)
                        .withObservabilitySink(observabilitySink)
                        .open();
            } catch (PersistenceException e) {
                observabilitySink.onError(new HeraldErrorEvent(wallClock.now(), driver.domain(),
                        HeraldErrorEvent.Kind.PERSISTENCE, "State store unavailable; domain disabled", e));
                return Optional.empty();
            }

            MonotonicScheduler timers = timers("herald-" + driver.domain(), 1, executors);
            MilestoneScheduler<S> milestoneScheduler = new MilestoneScheduler<>(
                    driver, store, dispatcher, wallClock, monotonicClock, timers, config.timing(), observabilitySink);
            return Optional.of(new DomainRuntime<>(driver, store, milestoneScheduler));
        }

        private MonotonicScheduler timers(String name, int threads, List<ScheduledExecutorService> executors) {
            if (scheduler != null) {
                return scheduler;
            }
            ScheduledExecutorService executor = Executors.newScheduledThreadPool(threads, new NamedThreadFactory(name));
            executors.add(executor);
            return new ScheduledExecutorScheduler(executor, monotonicClock);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
