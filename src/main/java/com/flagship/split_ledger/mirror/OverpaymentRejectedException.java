package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.money.Money;

/**
 * A settlement offered more value than the caller owes.
 */
public class OverpaymentRejectedException extends MirrorRevertException {

    static final String REASON = "Cannot overpay your debt";

    private final Money offered;
    private final Money owed;

    public OverpaymentRejectedException(Money offered, Money owed) {
        super(REASON);
        this.offered = offered;
        this.owed = owed;
    }

    public Money getOffered() {
        return offered;
    }

    public Money getOwed() {
        return owed;
    }
}
