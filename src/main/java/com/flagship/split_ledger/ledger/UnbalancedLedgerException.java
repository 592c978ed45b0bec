package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.money.Money;

/**
 * A balance snapshot does not net to zero. The closed-ledger invariant makes this
 * impossible for consistent input, so seeing it means upstream data is corrupt.
 */
public class UnbalancedLedgerException extends IllegalStateException {

    private final long groupId;
    private final Money total;

    public UnbalancedLedgerException(long groupId, Money total) {
        super(String.format("Balances of group %d do not net to zero (total=%s)", groupId, total));
        this.groupId = groupId;
        this.total = total;
    }

    public long getGroupId() {
        return groupId;
    }

    public Money getTotal() {
        return total;
    }
}
