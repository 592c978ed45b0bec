package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;

public class InsufficientFundsException extends TransferFailedException {

    public InsufficientFundsException(Member from, Money requested, Money available) {
        super(String.format("Insufficient funds: %s requested %s but holds %s", from, requested, available));
    }
}
