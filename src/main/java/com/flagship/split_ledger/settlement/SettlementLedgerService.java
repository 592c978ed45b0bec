package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.group.GroupDirectory;
import com.flagship.split_ledger.group.GroupNotFoundException;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.group.NotAGroupMemberException;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records settlements: value that has already moved between two members.
 *
 * Key principles:
 * - Append-only: settlements are never updated or deleted
 * - Idempotent per external transfer reference: the same confirmed transfer is reflected
 *   in the ledger at most once, no matter how often it is reported
 * - Nothing is validated against balances here; overpayment control belongs to whoever
 *   moves the value
 *
 * Duplicate detection happens twice. The reference cache catches replays cheaply; the
 * unique constraint on {@code external_ref} catches concurrent first recordings, where
 * exactly one insert wins and the rest surface as {@link DuplicateReferenceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementLedgerService {

    private final SettlementRepository settlementRepository;
    private final SettlementReferenceCache referenceCache;
    private final GroupDirectory groupDirectory;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Appends a settlement to the group's ledger.
     *
     * @param externalRef identifier of the confirmed transfer; {@code null} records without
     *                    duplicate protection
     * @return the stored settlement
     * @throws com.flagship.split_ledger.money.InvalidAmountException if the amount is not positive
     * @throws IllegalArgumentException if a member would settle with themselves
     * @throws GroupNotFoundException if the group does not exist
     * @throws NotAGroupMemberException if either party is not a member
     * @throws DuplicateReferenceException if the reference was already recorded
     */
    @Transactional
    public Settlement recordSettlement(long groupId, Member from, Member to, Money amount, String externalRef) {
        long startTime = System.currentTimeMillis();
        MDC.put("groupId", String.valueOf(groupId));

        try {
            Settlement settlement = Settlement.record(groupId, from, to, amount, blankToNull(externalRef));

            groupDirectory.requireMember(groupId, from);
            groupDirectory.requireMember(groupId, to);

            if (settlement.hasExternalRef()) {
                Optional<UUID> existing = referenceCache.findSettlementId(settlement.getExternalRef());
                if (existing.isPresent()) {
                    log.info("Transfer reference already recorded: externalRef={}, settlementId={}",
                            settlement.getExternalRef(), existing.get());
                    throw new DuplicateReferenceException(settlement.getExternalRef(), existing.get());
                }
            }

            SettlementEntity saved;
            try {
                saved = settlementRepository.saveAndFlush(SettlementEntity.fromDomain(settlement));
            } catch (DataIntegrityViolationException e) {
                if (isExternalRefViolation(e)) {
                    log.info("Concurrent recording lost on transfer reference: externalRef={}",
                            settlement.getExternalRef());
                    throw new DuplicateReferenceException(settlement.getExternalRef(), e);
                }
                throw e;
            }

            Settlement stored = saved.toDomain();
            rememberAfterCommit(stored);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordSettlement("success");
            ledgerMetrics.recordLatency("settle", duration);

            log.info("Settlement recorded: settlementId={}, from={}, to={}, amount={}, externalRef={}, duration={}ms",
                    stored.getId(), from, to, amount, stored.getExternalRef(), duration);
            return stored;

        } catch (DuplicateReferenceException e) {
            ledgerMetrics.recordSettlement("duplicate");
            throw e;
        } catch (IllegalArgumentException | GroupNotFoundException | NotAGroupMemberException e) {
            ledgerMetrics.recordSettlement("rejected");
            log.warn("Settlement rejected: error={}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordSettlement("error");
            log.error("Settlement recording failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove("groupId");
        }
    }

    @Transactional(readOnly = true)
    public List<Settlement> listSettlements(long groupId) {
        return settlementRepository.findByGroupIdOrderBySettledAtAscIdAsc(groupId)
            .stream()
            .map(SettlementEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Settlement> findByExternalRef(String externalRef) {
        return settlementRepository.findByExternalRef(externalRef)
            .map(SettlementEntity::toDomain);
    }

    private void rememberAfterCommit(Settlement settlement) {
        if (!settlement.hasExternalRef()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    referenceCache.remember(settlement.getExternalRef(), settlement.getId());
                }
            });
        } else {
            referenceCache.remember(settlement.getExternalRef(), settlement.getId());
        }
    }

    private static boolean isExternalRefViolation(DataIntegrityViolationException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause != null ? cause.getMessage() : e.getMessage();
        return message != null && message.contains(SettlementEntity.EXTERNAL_REF_CONSTRAINT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
