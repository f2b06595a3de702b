package com.questrail.herald.domain;

import com.questrail.herald.api.Alert;
import com.questrail.herald.api.AlertSeverity;
import com.questrail.herald.domain.budget.BudgetState;
import com.questrail.herald.domain.budget.Transaction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * BudgetAccrualDriver
 * -----------------------------------------------------------------------------
 * Credits a fixed allowance for every whole week since the last accrual.
 *
 * <h2>Replay semantics</h2>
 * Missed weeks are never lost and never double counted: however many weeks
 * have elapsed, a single evaluation books all of them as one
 * {@link Transaction.Kind#ACCRUAL} entry, raises one alert and moves
 * {@code lastAccrualAt} forward by exactly that many weeks. The remainder
 * (less than a week) carries over to the next milestone.
 */
public final class BudgetAccrualDriver implements DomainDriver<BudgetState> {

    public static final String DOMAIN = "budget";
    public static final Duration WEEK = Duration.ofDays(7);
    public static final String CURRENCY = "£";

    private final BigDecimal defaultWeeklyAmount;
    private final int historyLimit;

    public BudgetAccrualDriver(BigDecimal defaultWeeklyAmount, int historyLimit) {
        this.defaultWeeklyAmount = Objects.requireNonNull(defaultWeeklyAmount, "defaultWeeklyAmount");
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be > 0");
        }
        this.historyLimit = historyLimit;
    }

    public int historyLimit() {
        return historyLimit;
    }

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public Class<BudgetState> stateType() {
        return BudgetState.class;
    }

    @Override
    public BudgetState initialState(Instant now) {
        return BudgetState.initial(defaultWeeklyAmount, now);
    }

    @Override
    public CatchUpPolicy catchUpPolicy() {
        return CatchUpPolicy.REPLAY;
    }

    @Override
    public Optional<Instant> nextMilestoneAt(BudgetState state, Instant now) {
        return Optional.of(state.lastAccrualAt().plus(WEEK));
    }

    @Override
    public DomainOutcome<BudgetState> onMilestone(BudgetState state, Instant now) {
        return accrue(state, now);
    }

    @Override
    public DomainOutcome<BudgetState> reconcile(BudgetState state, Instant now) {
        return accrue(state, now);
    }

    private DomainOutcome<BudgetState> accrue(BudgetState state, Instant now) {
        long weeks = elapsedWeeks(state.lastAccrualAt(), now);
        if (weeks < 1) {
            return DomainOutcome.unchanged(state);
        }

        BigDecimal total = state.weeklyAmount().multiply(BigDecimal.valueOf(weeks));
        BudgetState next = state
                .record(Transaction.accrual(now, total, Math.toIntExact(weeks)), historyLimit)
                .withLastAccrualAt(state.lastAccrualAt().plus(WEEK.multipliedBy(weeks)));

        String text = "Weekly allowance: added " + format(total)
                + " (" + weeks + (weeks == 1 ? " week" : " weeks") + "). Balance: " + format(next.balance());
        return DomainOutcome.of(next, Alert.of(DOMAIN, AlertSeverity.INFO, text, now));
    }

    /**
     * Whole weeks between {@code since} and {@code now}, rounded down; zero
     * when {@code now} is not after {@code since}.
     */
    public static long elapsedWeeks(Instant since, Instant now) {
        if (!now.isAfter(since)) {
            return 0;
        }
        return Duration.between(since, now).getSeconds() / WEEK.getSeconds();
    }

    public static String format(BigDecimal amount) {
        return CURRENCY + amount.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
