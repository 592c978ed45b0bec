package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

import java.time.Instant;

/**
 * DebtSettled: {@code debtor} paid {@code creditor} through the mirror and the transfer
 * identified by {@code transferReference} completed.
 */
@Value
public class MirrorSettlementEvent {
    public static final String EVENT_TYPE = "DebtSettled";

    long groupId;
    Member debtor;
    Member creditor;
    Money amount;
    String transferReference;
    Instant occurredAt;
}
