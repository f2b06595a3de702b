package com.questrail.herald.domain.budget;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One ledger entry.
 *
 * @param at      when the entry was recorded
 * @param kind    what produced it
 * @param amount  signed change to the balance (negative for withdrawals)
 * @param weeks   number of weeks covered by an accrual; zero otherwise
 * @param comment free text shown in the history
 */
public record Transaction(Instant at, Kind kind, BigDecimal amount, int weeks, String comment)
{
    public enum Kind {
        ACCRUAL,
        DEPOSIT,
        WITHDRAWAL
    }

    public Transaction {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(kind, "kind");
        amount = BudgetState.money(Objects.requireNonNull(amount, "amount"));
        if (weeks < 0) {
            throw new IllegalArgumentException("weeks must be >= 0");
        }
        comment = comment == null ? "" : comment;
    }

    public static Transaction accrual(Instant at, BigDecimal total, int weeks) {
        return new Transaction(at, Kind.ACCRUAL, total, weeks,
                weeks + (weeks == 1 ? " week accrued" : " weeks accrued"));
    }

    public static Transaction deposit(Instant at, BigDecimal amount, String comment) {
        return new Transaction(at, Kind.DEPOSIT, amount, 0, comment);
    }

    public static Transaction withdrawal(Instant at, BigDecimal amount, String comment) {
        return new Transaction(at, Kind.WITHDRAWAL, amount.negate(), 0, comment);
    }
}
