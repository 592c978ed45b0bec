package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.money.Money;
import lombok.Value;

/**
 * Proof of a completed transfer. {@code reference} identifies the transfer globally and is
 * what the ledger uses as a settlement's external reference.
 */
@Value
public class TransferReceipt {
    String reference;
    Money confirmedAmount;
}
