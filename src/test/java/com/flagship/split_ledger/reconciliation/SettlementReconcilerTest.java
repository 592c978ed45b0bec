package com.flagship.split_ledger.reconciliation;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.group.NotAGroupMemberException;
import com.flagship.split_ledger.ledger.BalanceQueryService;
import com.flagship.split_ledger.ledger.BalanceSnapshot;
import com.flagship.split_ledger.mirror.MirrorSettlementEvent;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.DuplicateReferenceException;
import com.flagship.split_ledger.settlement.Settlement;
import com.flagship.split_ledger.settlement.SettlementLedgerService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementReconcilerTest {

    private static final long GROUP_ID = 1L;

    @Mock
    private SettlementLedgerService settlementLedgerService;

    @Mock
    private BalanceQueryService balanceQueryService;

    private SimpleMeterRegistry meterRegistry;
    private SettlementReconciler reconciler;

    private final Member alice = member(1);
    private final Member bob = member(2);
    private final Member charlie = member(3);

    private static Member member(int n) {
        return Member.of(String.format("0x%040x", n));
    }

    private static MirrorSettlementEvent event(Member debtor, Member creditor, long amount, String reference) {
        return new MirrorSettlementEvent(GROUP_ID, debtor, creditor, Money.ofUnits(amount), reference, Instant.now());
    }

    private static Settlement stored(MirrorSettlementEvent event) {
        return Settlement.record(event.getGroupId(), event.getDebtor(), event.getCreditor(),
            event.getAmount(), event.getTransferReference());
    }

    private static BalanceSnapshot snapshot(Object... memberAndUnits) {
        Map<Member, Money> balances = new LinkedHashMap<>();
        for (int i = 0; i < memberAndUnits.length; i += 2) {
            balances.put((Member) memberAndUnits[i], Money.ofUnits((Long) memberAndUnits[i + 1]));
        }
        return new BalanceSnapshot(GROUP_ID, balances);
    }

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciler = new SettlementReconciler(settlementLedgerService, balanceQueryService,
            new LedgerMetrics(meterRegistry));
    }

    @Test
    @DisplayName("A new mirror settlement is recorded under its transfer reference")
    void appliesNewEvent() {
        MirrorSettlementEvent event = event(bob, alice, 50, "0xabc");
        when(settlementLedgerService.recordSettlement(GROUP_ID, bob, alice, Money.ofUnits(50), "0xabc"))
            .thenReturn(stored(event));

        assertEquals(SettlementReconciler.Outcome.RECORDED, reconciler.apply(event));
        assertEquals(1.0, meterRegistry.counter("mirror.events", "outcome", "recorded").count());
    }

    @Test
    @DisplayName("An event already on the ledger counts as applied")
    void duplicateIsAlreadyRecorded() {
        MirrorSettlementEvent event = event(bob, alice, 50, "0xabc");
        when(settlementLedgerService.recordSettlement(GROUP_ID, bob, alice, Money.ofUnits(50), "0xabc"))
            .thenThrow(new DuplicateReferenceException("0xabc", UUID.randomUUID()));

        assertEquals(SettlementReconciler.Outcome.ALREADY_RECORDED, reconciler.apply(event));
    }

    @Test
    @DisplayName("Listener callback applies the event")
    void listenerDelegatesToApply() {
        MirrorSettlementEvent event = event(charlie, alice, 7, "0xdef");
        when(settlementLedgerService.recordSettlement(GROUP_ID, charlie, alice, Money.ofUnits(7), "0xdef"))
            .thenReturn(stored(event));

        reconciler.onDebtSettled(event);

        verify(settlementLedgerService).recordSettlement(GROUP_ID, charlie, alice, Money.ofUnits(7), "0xdef");
    }

    @Test
    @DisplayName("Events without a transfer reference are refused")
    void missingReference() {
        assertThrows(IllegalArgumentException.class, () -> reconciler.apply(event(bob, alice, 50, " ")));
        verifyNoInteractions(settlementLedgerService);
    }

    @Test
    @DisplayName("Replaying a stream records each transfer once and reports the rest")
    void reconcileReplayedStream() {
        MirrorSettlementEvent first = event(bob, alice, 50, "0x01");
        MirrorSettlementEvent second = event(charlie, alice, 20, "0x02");
        MirrorSettlementEvent broken = event(charlie, bob, 5, "0x03");

        when(settlementLedgerService.recordSettlement(GROUP_ID, bob, alice, Money.ofUnits(50), "0x01"))
            .thenReturn(stored(first))
            .thenThrow(new DuplicateReferenceException("0x01", UUID.randomUUID()));
        when(settlementLedgerService.recordSettlement(GROUP_ID, charlie, alice, Money.ofUnits(20), "0x02"))
            .thenReturn(stored(second));
        when(settlementLedgerService.recordSettlement(GROUP_ID, charlie, bob, Money.ofUnits(5), "0x03"))
            .thenThrow(new NotAGroupMemberException(GROUP_ID, bob));

        ReconciliationReport report = reconciler.reconcile(List.of(first, second, broken, first));

        assertEquals(2, report.getRecorded());
        assertEquals(1, report.getAlreadyRecorded());
        assertEquals(1, report.getFailures().size());
        assertTrue(report.getFailures().containsKey("0x03"));
        assertEquals(4, report.total());
        assertFalse(report.isComplete());
    }

    @Test
    @DisplayName("Matching snapshots have no discrepancies")
    void noDiscrepancies() {
        BalanceSnapshot balances = snapshot(alice, 50L, bob, 0L, charlie, -50L);

        assertTrue(reconciler.findDiscrepancies(balances, balances).isEmpty());
    }

    @Test
    @DisplayName("Differences are reported per member; missing members count as zero")
    void discrepanciesReported() {
        BalanceSnapshot advisory = snapshot(alice, 100L, bob, -50L, charlie, -50L);
        BalanceSnapshot authoritative = snapshot(alice, 50L, bob, 0L, charlie, -50L);

        List<BalanceDiscrepancy> discrepancies = reconciler.findDiscrepancies(advisory, authoritative);

        assertEquals(2, discrepancies.size());
        assertEquals(alice, discrepancies.get(0).getMember());
        assertEquals(Money.ofUnits(-50), discrepancies.get(0).getDifference());
        assertEquals(bob, discrepancies.get(1).getMember());
        assertEquals(Money.ofUnits(50), discrepancies.get(1).getDifference());

        Member dave = member(4);
        List<BalanceDiscrepancy> extra = reconciler.findDiscrepancies(
            snapshot(alice, 0L), snapshot(alice, 0L, dave, 5L));
        assertEquals(1, extra.size());
        assertEquals(dave, extra.get(0).getMember());
        assertEquals(Money.ZERO, extra.get(0).getAdvisory());
    }

    @Test
    @DisplayName("Cross-check compares the ledger's balances with the mirror's")
    void crossCheckUsesLedgerBalances() {
        when(balanceQueryService.getBalances(GROUP_ID)).thenReturn(snapshot(alice, 100L, bob, -100L));

        List<BalanceDiscrepancy> discrepancies =
            reconciler.crossCheck(GROUP_ID, snapshot(alice, 60L, bob, -60L));

        assertEquals(2, discrepancies.size());
        assertEquals(2.0, meterRegistry.counter("ledger.discrepancies").count());
    }
}
