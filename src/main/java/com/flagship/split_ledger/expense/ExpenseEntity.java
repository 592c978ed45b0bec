package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JPA entity for expenses.
 *
 * No setters: rows are append-only from the ledger's point of view, and
 * {@link #fromDomain(Expense)} is the only way to build one.
 */
@Entity
@Table(name = "expenses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExpenseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private long groupId;

    @Column(name = "payer_address", nullable = false, updatable = false, length = 42)
    private String payerAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(length = 500, updatable = false)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_participants", joinColumns = @JoinColumn(name = "expense_id"))
    @Column(name = "member_address", nullable = false, length = 42)
    private Set<String> participantAddresses = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ExpenseEntity fromDomain(Expense expense) {
        ExpenseEntity entity = new ExpenseEntity();
        entity.groupId = expense.getGroupId();
        entity.payerAddress = expense.getPayer().getAddress();
        entity.amount = expense.getAmount().units();
        entity.description = expense.getDescription();
        entity.participantAddresses = expense.getParticipants().stream()
            .map(Member::getAddress)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        entity.createdAt = expense.getCreatedAt();
        return entity;
    }

    public Expense toDomain() {
        return new Expense(
            id,
            groupId,
            Member.of(payerAddress),
            Money.ofUnits(amount),
            description,
            participantAddresses.stream()
                .map(Member::of)
                .sorted(Comparator.comparing(Member::getAddress))
                .toList(),
            createdAt
        );
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
