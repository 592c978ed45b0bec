package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A payment by one member, split equally among a participant subset of its group.
 *
 * Invariants: {@code amount > 0}, at least one participant. The payer may or may not be a
 * participant. Shares are derived with floor division and are never stored.
 */
@Value
public class Expense {
    Long id;
    long groupId;
    Member payer;
    Money amount;
    String description;
    Set<Member> participants;
    Instant createdAt;

    public Expense(Long id, long groupId, Member payer, Money amount, String description,
                   Collection<Member> participants, Instant createdAt) {
        if (payer == null) {
            throw new IllegalArgumentException("Expense payer is required");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Expense amount is required");
        }
        amount.requirePositive();
        if (participants == null || participants.isEmpty()) {
            throw new IllegalArgumentException("Expense must have at least one participant");
        }
        this.id = id;
        this.groupId = groupId;
        this.payer = payer;
        this.amount = amount;
        this.description = description;
        this.participants = Collections.unmodifiableSet(new LinkedHashSet<>(participants));
        this.createdAt = createdAt;
    }

    /**
     * Creates a not-yet-stored expense stamped with the current time.
     */
    public static Expense create(long groupId, Member payer, Money amount, String description,
                                 Collection<Member> participants) {
        return new Expense(null, groupId, payer, amount, description, participants, Instant.now());
    }

    /**
     * Each participant's floor-divided portion.
     */
    public Money share() {
        return amount.divideFloor(participants.size());
    }

    /**
     * What the participants are actually debited in total, {@code share * k}. This is also
     * what the payer is credited.
     */
    public Money distributedAmount() {
        return share().times(participants.size());
    }

    /**
     * Base units credited to no one, {@code amount mod k}. Always below the participant count.
     */
    public Money roundingRemainder() {
        return amount.remainder(participants.size());
    }
}
