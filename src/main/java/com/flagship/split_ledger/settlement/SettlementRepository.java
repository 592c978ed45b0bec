package com.flagship.split_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    /**
     * Finds the settlement recorded for an external transfer reference.
     * Used for duplicate detection when the reference cache misses.
     */
    Optional<SettlementEntity> findByExternalRef(String externalRef);

    List<SettlementEntity> findByGroupIdOrderBySettledAtAscIdAsc(long groupId);

    long countByGroupId(long groupId);
}
