package com.questrail.herald.domain;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.AlertSeverity;
import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.domain.bins.BinCollection;
import com.questrail.herald.domain.bins.BinMilestone;
import com.questrail.herald.domain.bins.BinReminderTimes;
import com.questrail.herald.domain.bins.BinState;
import com.questrail.herald.domain.bins.CollectionScheduleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * BinReminderDriver
 * =============================================================================
 * Turns the cached council calendar into reminders.
 *
 * <h2>Milestones</h2>
 * For every collection date three milestones are derived (see
 * {@link BinMilestone#derive}): a reminder the evening before, a reminder on
 * the morning, and a calendar refresh on the day after. Bin types due on the
 * same date share one reminder.
 *
 * <h2>Pointer</h2>
 * {@link BinState#lastNotifiedMilestone()} is the instant of the last handled
 * milestone. Everything at or before it is done and never fires again, even
 * after a restart.
 *
 * <h2>Late wake-ups</h2>
 * When several milestones are due at once only the latest counts, and a
 * reminder is sent only while it is still current (before the milestone that
 * follows it). Earlier ones are skipped silently. Missed milestones found at
 * startup are always discarded.
 *
 * <h2>Calendar refresh</h2>
 * A due {@link BinMilestone.Kind#REFRESH} fetches the calendar in
 * {@link #prefetch}, before the store is locked, so bin commands never wait
 * on the council site. If the fetch fails nothing is committed and the
 * scheduler retries. When no milestone is pending the driver asks to refresh
 * every {@code recheckInterval}.
 */
public final class BinReminderDriver implements DomainDriver<BinState> {

    private static final Logger log = LoggerFactory.getLogger(BinReminderDriver.class);

    public static final String DOMAIN = "bins";

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEE d MMM", Locale.UK);

    private final CollectionScheduleProvider provider;
    private final BinReminderTimes times;
    private final ZoneId zone;
    private final Duration recheckInterval;

    public BinReminderDriver(CollectionScheduleProvider provider,
                             BinReminderTimes times,
                             ZoneId zone,
                             Duration recheckInterval)
    {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.times = Objects.requireNonNull(times, "times");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.recheckInterval = Objects.requireNonNull(recheckInterval, "recheckInterval");
        if (recheckInterval.isNegative() || recheckInterval.isZero()) {
            throw new IllegalArgumentException("recheckInterval must be > 0");
        }
    }

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public Class<BinState> stateType() {
        return BinState.class;
    }

    @Override
    public BinState initialState(Instant now) {
        return BinState.empty();
    }

    @Override
    public CatchUpPolicy catchUpPolicy() {
        return CatchUpPolicy.DISCARD;
    }

    public ZoneId zone() {
        return zone;
    }

    public List<BinMilestone> milestones(BinState state) {
        return BinMilestone.derive(state.schedule(), times, zone);
    }

    @Override
    public Optional<Instant> nextMilestoneAt(BinState state, Instant now) {
        Optional<BinMilestone> pending = firstPending(state);
        if (pending.isPresent()) {
            return Optional.of(pending.get().at());
        }
        return Optional.of(state.lastRefreshed()
                .map(at -> at.plus(recheckInterval))
                .orElse(now));
    }

    /**
     * Fetches the calendar when a due milestone is a refresh, or when nothing
     * is pending at all.
     */
    @Override
    public UnaryOperator<BinState> prefetch(BinState state, Instant now) throws ProviderUnavailableException {
        List<BinMilestone> due = due(state, milestones(state), now);
        boolean refresh = due.isEmpty()
                ? firstPending(state).isEmpty()
                : due.stream().anyMatch(m -> m.kind() == BinMilestone.Kind.REFRESH);
        if (!refresh) {
            return UnaryOperator.identity();
        }
        List<BinCollection> fetched = provider.fetchSchedule();
        return current -> current.withSchedule(fetched, now);
    }

    @Override
    public DomainOutcome<BinState> onMilestone(BinState state, Instant now) {
        List<BinMilestone> all = milestones(state);
        List<BinMilestone> due = due(state, all, now);
        if (due.isEmpty()) {
            return DomainOutcome.unchanged(state);
        }

        BinMilestone latest = due.get(due.size() - 1);
        BinState next = state.withLastNotified(latest.at());
        if (!latest.kind().isReminder() || !isCurrent(all, latest, now)) {
            return DomainOutcome.silent(next);
        }
        return DomainOutcome.of(next, Alert.of(DOMAIN, AlertSeverity.NOTICE, render(latest), now));
    }

    @Override
    public DomainOutcome<BinState> reconcile(BinState state, Instant now) {
        BinState next = state;

        LocalDate today = now.atZone(zone).toLocalDate();
        boolean refreshAllowed = state.lastRefreshed()
                .map(at -> !at.plus(recheckInterval).isAfter(now))
                .orElse(true);
        if (!state.hasCollectionOnOrAfter(today) && refreshAllowed) {
            try {
                next = next.withSchedule(provider.fetchSchedule(), now);
            } catch (ProviderUnavailableException e) {
                log.warn("Collection calendar unavailable during startup; keeping cached schedule: {}", e.getMessage());
            }
        }

        BinState current = next;
        Optional<Instant> lastMissed = milestones(current).stream()
                .filter(m -> m.at().isBefore(now) && isPending(current, m))
                .map(BinMilestone::at)
                .reduce((a, b) -> b);
        if (lastMissed.isPresent()) {
            next = next.withLastNotified(lastMissed.get());
        }
        return DomainOutcome.silent(next);
    }

    /**
     * Upcoming collections on or after today's date in the configured zone.
     */
    public List<BinCollection> upcoming(BinState state, Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        return state.schedule().stream()
                .filter(c -> !c.date().isBefore(today))
                .toList();
    }

    private static List<BinMilestone> due(BinState state, List<BinMilestone> all, Instant now) {
        return all.stream()
                .filter(m -> isPending(state, m) && !m.at().isAfter(now))
                .toList();
    }

    private Optional<BinMilestone> firstPending(BinState state) {
        return milestones(state).stream().filter(m -> isPending(state, m)).findFirst();
    }

    private static boolean isPending(BinState state, BinMilestone milestone) {
        return state.lastNotified().map(milestone.at()::isAfter).orElse(true);
    }

    // A reminder stays current until the next milestone begins.
    private static boolean isCurrent(List<BinMilestone> all, BinMilestone milestone, Instant now) {
        return all.stream()
                .filter(m -> m.at().isAfter(milestone.at()))
                .findFirst()
                .map(following -> now.isBefore(following.at()))
                .orElse(true);
    }

    private String render(BinMilestone milestone) {
        String types = String.join(", ", milestone.types());
        String day = DAY.format(milestone.collectionDate());
        if (milestone.kind() == BinMilestone.Kind.NIGHT_BEFORE) {
            return "Bins out tonight: " + types + " (collection " + day + ")";
        }
        return "Bin collection today: " + types + " (" + day + ")";
    }
}
