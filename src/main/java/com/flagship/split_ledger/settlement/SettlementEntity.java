package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the settlements table.
 *
 * Key design principles:
 * - No setters and every column {@code updatable = false}: the table is append-only
 *   (a database trigger rejects updates as well)
 * - {@code external_ref} carries a unique constraint; it is what makes recording
 *   idempotent under retries and concurrent duplicate notifications
 */
@Entity
@Table(
    name = "settlements",
    indexes = {
        @Index(name = "idx_settlements_group_settled", columnList = "group_id, settled_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementEntity {

    /**
     * Name of the unique constraint on {@code external_ref}, used to recognise duplicate
     * recordings among integrity violations.
     */
    public static final String EXTERNAL_REF_CONSTRAINT = "uq_settlements_external_ref";

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private long groupId;

    @Column(name = "from_address", nullable = false, updatable = false, length = 42)
    private String fromAddress;

    @Column(name = "to_address", nullable = false, updatable = false, length = 42)
    private String toAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "external_ref", updatable = false, unique = true, length = 128)
    private String externalRef;

    @Column(name = "settled_at", nullable = false, updatable = false)
    private Instant settledAt;

    public static SettlementEntity fromDomain(Settlement settlement) {
        return new SettlementEntity(
            settlement.getId(),
            settlement.getGroupId(),
            settlement.getFrom().getAddress(),
            settlement.getTo().getAddress(),
            settlement.getAmount().units(),
            settlement.getExternalRef(),
            settlement.getSettledAt()
        );
    }

    public Settlement toDomain() {
        return new Settlement(
            id,
            groupId,
            Member.of(fromAddress),
            Member.of(toAddress),
            Money.ofUnits(amount),
            externalRef,
            settledAt
        );
    }
}
