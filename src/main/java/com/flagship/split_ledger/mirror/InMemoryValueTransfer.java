package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Value transfer between in-process accounts.
 *
 * Each transfer debits the sender, credits the recipient, then runs the recipient's
 * {@link ValueReceiver} if one is registered. A receiver that throws undoes the transfer.
 * References are 32-byte hex strings: a random 16-byte prefix chosen per instance followed by
 * a 16-byte sequence, so separate instances never hand out the same reference.
 */
@Slf4j
public class InMemoryValueTransfer implements ValueTransferPrimitive {

    private final Map<Member, Money> accounts = new HashMap<>();
    private final Map<Member, ValueReceiver> receivers = new HashMap<>();
    private final Set<Member> refusing = new HashSet<>();
    private final String referencePrefix;
    private long sequence;

    public InMemoryValueTransfer() {
        UUID instanceId = UUID.randomUUID();
        this.referencePrefix = String.format("0x%016x%016x",
            instanceId.getMostSignificantBits(), instanceId.getLeastSignificantBits());
    }

    public synchronized void fund(Member member, Money amount) {
        accounts.merge(member, amount.requirePositive(), Money::plus);
    }

    public synchronized Money balanceOf(Member member) {
        return accounts.getOrDefault(member, Money.ZERO);
    }

    public synchronized void registerReceiver(Member member, ValueReceiver receiver) {
        receivers.put(member, receiver);
    }

    public synchronized void refuseTransfersTo(Member member) {
        refusing.add(member);
    }

    @Override
    public synchronized TransferReceipt transfer(Member from, Member to, Money amount) {
        amount.requirePositive();
        if (refusing.contains(to)) {
            throw new TransferRejectedException(to);
        }
        Money available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(from, amount, available);
        }

        accounts.put(from, available.minus(amount));
        accounts.merge(to, amount, Money::plus);

        ValueReceiver receiver = receivers.get(to);
        if (receiver != null) {
            try {
                receiver.onValueReceived(from, amount);
            } catch (RuntimeException e) {
                accounts.merge(to, amount.negate(), Money::plus);
                accounts.merge(from, amount, Money::plus);
                throw e;
            }
        }

        String reference = referencePrefix + String.format("%032x", ++sequence);
        log.debug("Transfer completed: reference={}, from={}, to={}, amount={}", reference, from, to, amount);
        return new TransferReceipt(reference, amount);
    }
}
