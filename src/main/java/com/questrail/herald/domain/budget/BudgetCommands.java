package com.questrail.herald.domain.budget;

import com.questrail.herald.api.CommandException;
import com.questrail.herald.api.CommandReply;
import com.questrail.herald.domain.BudgetAccrualDriver;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.store.StateStore;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * User commands for the allowance ledger.
 *
 * <p>Every mutation runs inside {@link StateStore#transact} so it cannot race
 * the weekly accrual. Replies are rendered only after the write succeeded.</p>
 */
public final class BudgetCommands {

    private static final DateTimeFormatter HISTORY_DATE = DateTimeFormatter.ofPattern("dd MMM", Locale.UK);

    private final StateStore<BudgetState> store;
    private final BudgetAccrualDriver driver;
    private final WallClock wallClock;
    private final ZoneId zone;

    public BudgetCommands(StateStore<BudgetState> store, BudgetAccrualDriver driver, WallClock wallClock, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public CommandReply balance() {
        BudgetState state = store.read();
        return CommandReply.of("Balance: " + BudgetAccrualDriver.format(state.balance())
                + " (weekly allowance " + BudgetAccrualDriver.format(state.weeklyAmount()) + ")");
    }

    public CommandReply deposit(BigDecimal amount, String comment) throws CommandException {
        requirePositive(amount);
        BudgetState next = store.update(state ->
                state.record(Transaction.deposit(wallClock.now(), amount, comment), driver.historyLimit()));
        return CommandReply.of("Added " + BudgetAccrualDriver.format(amount)
                + ". Balance: " + BudgetAccrualDriver.format(next.balance()));
    }

    public CommandReply withdraw(BigDecimal amount, String comment) throws CommandException {
        requirePositive(amount);
        BudgetState next = store.update(state ->
                state.record(Transaction.withdrawal(wallClock.now(), amount, comment), driver.historyLimit()));
        return CommandReply.of("Took " + BudgetAccrualDriver.format(amount)
                + ". Balance: " + BudgetAccrualDriver.format(next.balance()));
    }

    public CommandReply history() {
        List<Transaction> transactions = store.read().transactions();
        if (transactions.isEmpty()) {
            return CommandReply.of("No transactions yet.");
        }
        StringBuilder reply = new StringBuilder("Recent transactions:");
        for (int i = transactions.size() - 1; i >= 0; i--) {
            Transaction tx = transactions.get(i);
            reply.append('\n')
                    .append(HISTORY_DATE.format(tx.at().atZone(zone)))
                    .append("  ")
                    .append(tx.amount().signum() >= 0 ? "+" : "-")
                    .append(BudgetAccrualDriver.format(tx.amount().abs()));
            if (!tx.comment().isBlank()) {
                reply.append("  ").append(tx.comment());
            }
        }
        return CommandReply.of(reply.toString());
    }

    /**
     * Changes the weekly allowance. Weeks already accrued keep the old amount.
     */
    public CommandReply setWeeklyAmount(BigDecimal amount) throws CommandException {
        requirePositive(amount);
        store.update(state -> state.withWeeklyAmount(amount));
        return CommandReply.of("Weekly allowance set to " + BudgetAccrualDriver.format(amount));
    }

    private static void requirePositive(BigDecimal amount) throws CommandException {
        if (amount == null || amount.signum() <= 0) {
            throw new CommandException("Amount must be a positive number");
        }
    }
}
