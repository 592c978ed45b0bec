package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;

/**
 * Code that runs at the recipient when value arrives, before the transfer completes.
 * Throwing aborts the transfer.
 */
@FunctionalInterface
public interface ValueReceiver {

    void onValueReceived(Member from, Money amount);
}
