package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryValueTransferTest {

    private final Member alice = Member.of(String.format("0x%040x", 1));
    private final Member bob = Member.of(String.format("0x%040x", 2));

    private static InMemoryValueTransfer funded(Member member) {
        InMemoryValueTransfer transfer = new InMemoryValueTransfer();
        transfer.fund(member, Money.ofUnits(1_000));
        return transfer;
    }

    @Test
    @DisplayName("References are 32-byte hex and never repeat, also across instances")
    void referencesUniqueAcrossInstances() {
        Set<String> references = new HashSet<>();

        for (int instance = 0; instance < 5; instance++) {
            InMemoryValueTransfer transfer = funded(alice);
            for (int i = 0; i < 10; i++) {
                String reference = transfer.transfer(alice, bob, Money.ofUnits(1)).getReference();
                assertTrue(reference.matches("^0x[0-9a-f]{64}$"), reference);
                assertTrue(references.add(reference), "repeated reference " + reference);
            }
        }
        assertEquals(50, references.size());
    }

    @Test
    @DisplayName("A receiver that throws undoes the transfer")
    void receiverFailureUndoesTransfer() {
        InMemoryValueTransfer transfer = funded(alice);
        transfer.registerReceiver(bob, (from, amount) -> {
            throw new IllegalStateException("no thanks");
        });

        assertThrows(IllegalStateException.class, () -> transfer.transfer(alice, bob, Money.ofUnits(10)));

        assertEquals(Money.ofUnits(1_000), transfer.balanceOf(alice));
        assertEquals(Money.ZERO, transfer.balanceOf(bob));
    }

    @Test
    @DisplayName("Transfers beyond the sender's funds fail")
    void insufficientFunds() {
        InMemoryValueTransfer transfer = funded(alice);

        assertThrows(InsufficientFundsException.class, () -> transfer.transfer(alice, bob, Money.ofUnits(1_001)));
        assertEquals(Money.ZERO, transfer.balanceOf(bob));
    }
}
