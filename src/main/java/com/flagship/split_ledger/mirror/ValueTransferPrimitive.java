package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;

/**
 * Moves value between two parties, atomically: either the full amount arrives and a receipt
 * is returned, or nothing moves and an exception is thrown.
 *
 * Implementations may call back into the recipient while the transfer is in flight.
 */
public interface ValueTransferPrimitive {

    /**
     * @throws InsufficientFundsException if {@code from} cannot cover the amount
     * @throws TransferRejectedException if {@code to} refuses the value
     */
    TransferReceipt transfer(Member from, Member to, Money amount);
}
