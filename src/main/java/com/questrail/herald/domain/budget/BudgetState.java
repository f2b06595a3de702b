package com.questrail.herald.domain.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BudgetState
 * -----------------------------------------------------------------------------
 * Persisted allowance ledger.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Amounts are held at two decimal places, so equal balances compare equal
 *       after a round trip through the state file</li>
 *   <li>{@code lastAccrualAt} only ever moves forward, in whole weeks</li>
 *   <li>{@code transactions} is oldest first and bounded by the history limit
 *       applied in {@link #record(Transaction, int)}</li>
 * </ul>
 */
public record BudgetState(BigDecimal balance,
                          BigDecimal weeklyAmount,
                          Instant lastAccrualAt,
                          List<Transaction> transactions)
{
    public BudgetState {
        balance = money(Objects.requireNonNull(balance, "balance"));
        weeklyAmount = money(Objects.requireNonNull(weeklyAmount, "weeklyAmount"));
        Objects.requireNonNull(lastAccrualAt, "lastAccrualAt");
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static BudgetState initial(BigDecimal weeklyAmount, Instant now) {
        return new BudgetState(BigDecimal.ZERO, weeklyAmount, now, List.of());
    }

    /**
     * Applies a transaction to the balance and appends it to the history,
     * keeping at most {@code historyLimit} entries.
     */
    public BudgetState record(Transaction transaction, int historyLimit) {
        List<Transaction> history = new ArrayList<>(transactions);
        history.add(transaction);
        while (history.size() > historyLimit) {
            history.remove(0);
        }
        return new BudgetState(balance.add(transaction.amount()), weeklyAmount, lastAccrualAt, history);
    }

    public BudgetState withLastAccrualAt(Instant at) {
        return new BudgetState(balance, weeklyAmount, at, transactions);
    }

    public BudgetState withWeeklyAmount(BigDecimal amount) {
        return new BudgetState(balance, amount, lastAccrualAt, transactions);
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN);
    }
}
