package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

/**
 * One transfer of a simplified settlement plan: {@code from} (debtor) pays {@code to}
 * (creditor). Recomputed on every request, never persisted.
 */
@Value
public class SimplifiedDebt {
    Member from;
    Member to;
    Money amount;

    public boolean involves(Member member) {
        return from.equals(member) || to.equals(member);
    }
}
