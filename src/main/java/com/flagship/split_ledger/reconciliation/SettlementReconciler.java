package com.flagship.split_ledger.reconciliation;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.ledger.BalanceQueryService;
import com.flagship.split_ledger.ledger.BalanceSnapshot;
import com.flagship.split_ledger.mirror.MirrorEventListener;
import com.flagship.split_ledger.mirror.MirrorSettlementEvent;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.DuplicateReferenceException;
import com.flagship.split_ledger.settlement.SettlementLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Projects mirror settlement events into the off-chain ledger.
 *
 * The mirror is the event source and the ledger an idempotent projection of it: each event
 * is recorded under its transfer reference, so replaying an event, or a whole stream, never
 * records a transfer twice. An event already on the ledger counts as applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementReconciler implements MirrorEventListener {

    public enum Outcome {
        RECORDED,
        ALREADY_RECORDED
    }

    private final SettlementLedgerService settlementLedgerService;
    private final BalanceQueryService balanceQueryService;
    private final LedgerMetrics ledgerMetrics;

    @Override
    public void onDebtSettled(MirrorSettlementEvent event) {
        apply(event);
    }

    /**
     * Records one event's settlement.
     *
     * @throws IllegalArgumentException if the event carries no transfer reference
     */
    public Outcome apply(MirrorSettlementEvent event) {
        if (event.getTransferReference() == null || event.getTransferReference().isBlank()) {
            throw new IllegalArgumentException("Mirror settlement event has no transfer reference");
        }
        try {
            settlementLedgerService.recordSettlement(
                event.getGroupId(),
                event.getDebtor(),
                event.getCreditor(),
                event.getAmount(),
                event.getTransferReference()
            );
            ledgerMetrics.recordMirrorEvent("recorded");
            return Outcome.RECORDED;
        } catch (DuplicateReferenceException e) {
            log.debug("Mirror settlement already on ledger: reference={}", event.getTransferReference());
            ledgerMetrics.recordMirrorEvent("already_recorded");
            return Outcome.ALREADY_RECORDED;
        }
    }

    /**
     * Applies events in order. A failing event is reported and the rest still applied;
     * the failed ones can be replayed once the cause is fixed.
     */
    public ReconciliationReport reconcile(List<MirrorSettlementEvent> events) {
        int recorded = 0;
        int alreadyRecorded = 0;
        ReconciliationReport.ReconciliationReportBuilder report = ReconciliationReport.builder();

        for (MirrorSettlementEvent event : events) {
            try {
                if (apply(event) == Outcome.RECORDED) {
                    recorded++;
                } else {
                    alreadyRecorded++;
                }
            } catch (RuntimeException e) {
                ledgerMetrics.recordMirrorEvent("failed");
                log.error("Failed to reconcile mirror settlement: groupId={}, reference={}, error={}",
                        event.getGroupId(), event.getTransferReference(), e.getMessage());
                report.failure(String.valueOf(event.getTransferReference()), e.getMessage());
            }
        }

        ReconciliationReport result = report.recorded(recorded).alreadyRecorded(alreadyRecorded).build();
        log.info("Reconciled mirror settlements: recorded={}, alreadyRecorded={}, failed={}",
                result.getRecorded(), result.getAlreadyRecorded(), result.getFailures().size());
        return result;
    }

    /**
     * Members whose balances differ between the two snapshots, authoritative order first.
     * A member missing from one side counts as zero there.
     */
    public List<BalanceDiscrepancy> findDiscrepancies(BalanceSnapshot advisory, BalanceSnapshot authoritative) {
        Set<Member> members = new LinkedHashSet<>(authoritative.members());
        members.addAll(advisory.members());

        List<BalanceDiscrepancy> discrepancies = new ArrayList<>();
        for (Member member : members) {
            BalanceDiscrepancy candidate = new BalanceDiscrepancy(
                member, advisory.balanceOf(member), authoritative.balanceOf(member));
            if (!candidate.getDifference().isZero()) {
                discrepancies.add(candidate);
            }
        }
        return discrepancies;
    }

    /**
     * Compares the ledger's balances for a group with the mirror's.
     */
    public List<BalanceDiscrepancy> crossCheck(long groupId, BalanceSnapshot mirrorBalances) {
        MDC.put("groupId", String.valueOf(groupId));
        try {
            List<BalanceDiscrepancy> discrepancies =
                findDiscrepancies(balanceQueryService.getBalances(groupId), mirrorBalances);
            ledgerMetrics.recordDiscrepancies(discrepancies.size());
            if (discrepancies.isEmpty()) {
                log.info("Ledger agrees with mirror");
            } else {
                log.warn("Ledger disagrees with mirror: discrepancies={}", discrepancies);
            }
            return discrepancies;
        } finally {
            MDC.remove("groupId");
        }
    }
}
