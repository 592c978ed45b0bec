package com.flagship.split_ledger.expense;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, Long> {

    /**
     * Expenses of a group in creation order, ascending. Order is for presentation only; it
     * does not affect balances.
     */
    List<ExpenseEntity> findByGroupIdOrderByCreatedAtAscIdAsc(long groupId);
}
