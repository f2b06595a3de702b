package com.questrail.herald.domain;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.ProviderUnavailableException;
import com.questrail.herald.domain.bins.BinCollection;
import com.questrail.herald.domain.bins.BinMilestone;
import com.questrail.herald.domain.bins.BinReminderTimes;
import com.questrail.herald.domain.bins.BinState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BinReminderDriverTest
 * -----------------------------------------------------------------------------
 * Collection on Wednesday 4 March 2026; all times UTC unless stated.
 */
class BinReminderDriverTest {

    private static final Instant MON_0900 = Instant.parse("2026-03-02T09:00:00Z");
    private static final Instant TUE_1800 = Instant.parse("2026-03-03T18:00:00Z");
    private static final Instant WED_0700 = Instant.parse("2026-03-04T07:00:00Z");
    private static final Instant THU_0900 = Instant.parse("2026-03-05T09:00:00Z");
    private static final LocalDate WEDNESDAY = LocalDate.of(2026, 3, 4);
    private static final LocalDate NEXT_WEDNESDAY = LocalDate.of(2026, 3, 11);

    private List<BinCollection> calendar = List.of(new BinCollection(NEXT_WEDNESDAY, "General"));
    private boolean down;
    private int fetches;

    private final BinReminderDriver driver = new BinReminderDriver(() -> {
        fetches++;
        if (down) {
            throw new ProviderUnavailableException("council site returned 503");
        }
        return calendar;
    }, BinReminderTimes.defaults(), ZoneOffset.UTC, Duration.ofHours(12));

    private final BinState cached = new BinState(
            List.of(new BinCollection(WEDNESDAY, "Recycling"), new BinCollection(WEDNESDAY, "Garden")),
            null,
            MON_0900);

    @Test
    void typesDueTheSameDayShareMilestones() {
        List<BinMilestone> milestones = driver.milestones(cached);

        assertEquals(3, milestones.size());
        assertEquals(List.of(TUE_1800, WED_0700, THU_0900), milestones.stream().map(BinMilestone::at).toList());
        assertEquals(List.of("Garden", "Recycling"), milestones.get(0).types());
        assertEquals(BinMilestone.Kind.REFRESH, milestones.get(2).kind());
    }

    @Test
    void milestonesFollowLocalTimeAcrossDaylightSaving() {
        // UK clocks go forward on Sunday 29 March 2026.
        BinState state = new BinState(List.of(new BinCollection(LocalDate.of(2026, 3, 30), "Recycling")), null, null);
        BinReminderDriver london = new BinReminderDriver(
                () -> List.of(), BinReminderTimes.defaults(), ZoneId.of("Europe/London"), Duration.ofHours(12));

        List<BinMilestone> milestones = london.milestones(state);

        assertEquals(Instant.parse("2026-03-29T17:00:00Z"), milestones.get(0).at());
        assertEquals(Instant.parse("2026-03-30T06:00:00Z"), milestones.get(1).at());
    }

    @Test
    void nightBeforeReminderFiresOnce() throws ProviderUnavailableException {
        assertEquals(TUE_1800, driver.nextMilestoneAt(cached, MON_0900).orElseThrow());

        DomainOutcome<BinState> fired = evaluate(cached, TUE_1800);

        assertEquals(1, fired.alerts().size());
        Alert alert = fired.alerts().get(0);
        assertEquals("bins", alert.domain());
        assertEquals("Bins out tonight: Garden, Recycling (collection Wed 4 Mar)", alert.payload());
        assertEquals(TUE_1800, fired.newState().lastNotifiedMilestone());

        DomainOutcome<BinState> again = evaluate(fired.newState(), TUE_1800.plus(Duration.ofMinutes(30)));
        assertTrue(again.alerts().isEmpty(), "a handled milestone never fires again");
        assertEquals(fired.newState(), again.newState());
        assertEquals(WED_0700, driver.nextMilestoneAt(fired.newState(), TUE_1800).orElseThrow());
    }

    @Test
    void lateWakeSendsOnlyTheCurrentReminder() throws ProviderUnavailableException {
        DomainOutcome<BinState> outcome = evaluate(cached, WED_0700.plus(Duration.ofHours(1)));

        assertEquals(1, outcome.alerts().size());
        assertEquals("Bin collection today: Garden, Recycling (Wed 4 Mar)", outcome.alerts().get(0).payload());
        assertEquals(WED_0700, outcome.newState().lastNotifiedMilestone());
        assertEquals(0, fetches);
    }

    @Test
    void wakeAfterCollectionDaySkipsRemindersAndRefreshes() throws ProviderUnavailableException {
        Instant now = THU_0900.plus(Duration.ofHours(1));

        DomainOutcome<BinState> outcome = evaluate(cached, now);

        assertTrue(outcome.alerts().isEmpty());
        assertEquals(calendar, outcome.newState().schedule());
        assertEquals(now, outcome.newState().lastRefreshedAt());
        assertEquals(THU_0900, outcome.newState().lastNotifiedMilestone());
        assertEquals(Instant.parse("2026-03-10T18:00:00Z"), driver.nextMilestoneAt(outcome.newState(), now).orElseThrow());
    }

    @Test
    void failedRefreshCommitsNothing() {
        down = true;
        BinState afterMorning = cached.withLastNotified(WED_0700);

        assertThrows(ProviderUnavailableException.class, () -> driver.prefetch(afterMorning, THU_0900));
    }

    @Test
    void evaluationUnderTheLockNeverCallsTheProvider() {
        down = true;
        BinState afterMorning = cached.withLastNotified(WED_0700);

        DomainOutcome<BinState> outcome = driver.onMilestone(afterMorning, THU_0900);

        assertEquals(0, fetches);
        assertTrue(outcome.alerts().isEmpty());
        assertEquals(THU_0900, outcome.newState().lastNotifiedMilestone());
        assertEquals(cached.schedule(), outcome.newState().schedule());
    }

    @Test
    void reminderDueNeedsNoFetch() throws ProviderUnavailableException {
        BinState unchanged = driver.prefetch(cached, TUE_1800).apply(cached);

        assertEquals(cached, unchanged);
        assertEquals(0, fetches);
    }

    @Test
    void reconcileDiscardsMissedReminders() {
        DomainOutcome<BinState> outcome = driver.reconcile(cached, WED_0700.plus(Duration.ofHours(5)));

        assertTrue(outcome.alerts().isEmpty());
        assertEquals(WED_0700, outcome.newState().lastNotifiedMilestone());
        assertEquals(0, fetches, "collection today still counts as upcoming");
    }

    @Test
    void milestoneExactlyAtStartupStaysPending() throws ProviderUnavailableException {
        BinState reconciled = driver.reconcile(cached, TUE_1800).newState();

        assertNull(reconciled.lastNotifiedMilestone());
        assertEquals(1, evaluate(reconciled, TUE_1800).alerts().size());
    }

    @Test
    void reconcileFetchesWhenNothingUpcomingAndIsIdempotent() {
        BinState stale = new BinState(List.of(new BinCollection(LocalDate.of(2026, 2, 25), "General")),
                Instant.parse("2026-02-26T09:00:00Z"), MON_0900.minus(Duration.ofDays(4)));

        BinState first = driver.reconcile(stale, MON_0900).newState();
        BinState second = driver.reconcile(first, MON_0900).newState();

        assertEquals(calendar, first.schedule());
        assertEquals(MON_0900, first.lastRefreshedAt());
        assertEquals(first, second);
        assertEquals(1, fetches);
    }

    @Test
    void reconcileKeepsCacheWhenProviderIsDown() {
        down = true;

        DomainOutcome<BinState> outcome = driver.reconcile(BinState.empty(), MON_0900);

        assertEquals(BinState.empty(), outcome.newState());
        assertTrue(outcome.alerts().isEmpty());
    }

    @Test
    void emptyCalendarIsRecheckedPeriodically() throws ProviderUnavailableException {
        assertEquals(MON_0900, driver.nextMilestoneAt(BinState.empty(), MON_0900).orElseThrow());

        calendar = List.of();
        BinState refreshed = evaluate(BinState.empty(), MON_0900).newState();

        assertEquals(MON_0900, refreshed.lastRefreshedAt());
        assertEquals(MON_0900.plus(Duration.ofHours(12)), driver.nextMilestoneAt(refreshed, MON_0900).orElseThrow());
    }

    @Test
    void declaresDiscardPolicy() {
        assertEquals(CatchUpPolicy.DISCARD, driver.catchUpPolicy());
    }

    private DomainOutcome<BinState> evaluate(BinState state, Instant now) throws ProviderUnavailableException {
        return driver.onMilestone(state, now).mapState(driver.prefetch(state, now));
    }
}
