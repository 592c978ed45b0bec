package com.flagship.split_ledger.settlement;

import java.util.Optional;
import java.util.UUID;

/**
 * A settlement with this external transfer reference has already been recorded.
 *
 * Callers should treat the transfer as already reflected in the ledger and stop retrying.
 */
public class DuplicateReferenceException extends RuntimeException {

    private final String externalRef;
    private final UUID existingSettlementId;

    public DuplicateReferenceException(String externalRef, UUID existingSettlementId) {
        super("Settlement already recorded for transfer reference: " + externalRef);
        this.externalRef = externalRef;
        this.existingSettlementId = existingSettlementId;
    }

    public DuplicateReferenceException(String externalRef, Throwable cause) {
        super("Settlement already recorded for transfer reference: " + externalRef, cause);
        this.externalRef = externalRef;
        this.existingSettlementId = null;
    }

    public String getExternalRef() {
        return externalRef;
    }

    /**
     * Id of the settlement holding the reference, when the detecting path knew it.
     */
    public Optional<UUID> getExistingSettlementId() {
        return Optional.ofNullable(existingSettlementId);
    }
}
