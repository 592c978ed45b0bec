package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A completed value transfer from {@code from} to {@code to} within a group.
 *
 * Settlements only ever reduce debt: {@code from}'s balance rises by the amount and
 * {@code to}'s falls by it. {@code externalRef} identifies the authoritative transfer; it is
 * absent only for records that predate one.
 */
@Value
public class Settlement {
    UUID id;
    long groupId;
    Member from;
    Member to;
    Money amount;
    String externalRef;
    Instant settledAt;

    public Settlement(UUID id, long groupId, Member from, Member to, Money amount,
                      String externalRef, Instant settledAt) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Settlement parties are required");
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("Cannot settle with yourself: " + from);
        }
        if (amount == null) {
            throw new IllegalArgumentException("Settlement amount is required");
        }
        amount.requirePositive();
        this.id = id;
        this.groupId = groupId;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.externalRef = externalRef;
        this.settledAt = settledAt;
    }

    public static Settlement record(long groupId, Member from, Member to, Money amount, String externalRef) {
        return new Settlement(UUID.randomUUID(), groupId, from, to, amount, externalRef, Instant.now());
    }

    public boolean hasExternalRef() {
        return externalRef != null;
    }
}
