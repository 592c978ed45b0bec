package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.settlement.dto.RecordSettlementRequest;
import com.flagship.split_ledger.settlement.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for settlements.
 *
 * Recording is idempotent per {@code external_ref}: a repeated report of the same transfer
 * (same group, parties and amount) returns 200 with the settlement already on the ledger.
 * A reference already used for a different transfer is rejected with 409.
 */
@RestController
@RequestMapping("/api/groups/{groupId}/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementLedgerService settlementLedgerService;

    @PostMapping
    public ResponseEntity<SettlementResponse> recordSettlement(@PathVariable("groupId") long groupId,
                                                               @Valid @RequestBody RecordSettlementRequest request) {
        Member from = Member.of(request.getFrom());
        Member to = Member.of(request.getTo());
        Money amount = Money.parseUnits(request.getAmount());
        try {
            Settlement settlement = settlementLedgerService.recordSettlement(
                groupId, from, to, amount, request.getExternalRef());
            return ResponseEntity.status(HttpStatus.CREATED).body(SettlementResponse.from(settlement));
        } catch (DuplicateReferenceException e) {
            Settlement existing = settlementLedgerService.findByExternalRef(e.getExternalRef())
                .orElseThrow(() -> new IllegalStateException(
                    "Transfer reference reported as recorded but not found: " + e.getExternalRef()));
            if (!isSameTransfer(existing, groupId, from, to, amount)) {
                log.warn("Transfer reference already recorded for a different transfer: externalRef={}, settlementId={}",
                        e.getExternalRef(), existing.getId());
                throw e;
            }
            log.info("Returning existing settlement for transfer reference: externalRef={}, settlementId={}",
                    e.getExternalRef(), existing.getId());
            return ResponseEntity.ok(SettlementResponse.from(existing));
        }
    }

    private static boolean isSameTransfer(Settlement existing, long groupId, Member from, Member to, Money amount) {
        return existing.getGroupId() == groupId
            && existing.getFrom().equals(from)
            && existing.getTo().equals(to)
            && existing.getAmount().equals(amount);
    }

    @GetMapping
    public List<SettlementResponse> listSettlements(@PathVariable("groupId") long groupId) {
        return settlementLedgerService.listSettlements(groupId).stream()
            .map(SettlementResponse::from)
            .toList();
    }
}
