package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;

/**
 * The recipient refused the value.
 */
public class TransferRejectedException extends TransferFailedException {

    public TransferRejectedException(Member to) {
        super("Transfer rejected by recipient: " + to);
    }
}
