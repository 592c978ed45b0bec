package com.flagship.split_ledger.reconciliation;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

/**
 * One member whose advisory balance differs from the authoritative one.
 * {@code difference} is authoritative minus advisory.
 */
@Value
public class BalanceDiscrepancy {
    Member member;
    Money advisory;
    Money authoritative;

    public Money getDifference() {
        return authoritative.minus(advisory);
    }
}
