package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.money.Money;
import lombok.Value;

/**
 * Audit view of the base units an expense left uncredited by floor-division splitting.
 * Informational only; the remainder is never redistributed.
 */
@Value
public class RoundingRemainder {
    Long expenseId;
    Money amount;
    int participantCount;
    Money share;
    Money remainder;

    public static RoundingRemainder of(Expense expense) {
        return new RoundingRemainder(
            expense.getId(),
            expense.getAmount(),
            expense.getParticipants().size(),
            expense.share(),
            expense.roundingRemainder()
        );
    }
}
