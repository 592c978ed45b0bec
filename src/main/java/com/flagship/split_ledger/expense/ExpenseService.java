package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.group.GroupDirectory;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Records and lists expenses.
 *
 * Every reference (payer, participants) is checked against the roster before anything is
 * written; an expense is stored whole or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final GroupDirectory groupDirectory;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public Expense addExpense(long groupId, Member payer, Money amount, String description,
                              Collection<Member> participants) {
        Expense expense = Expense.create(groupId, payer, amount, description, participants);

        groupDirectory.requireMember(groupId, payer);
        for (Member participant : expense.getParticipants()) {
            groupDirectory.requireMember(groupId, participant);
        }

        ExpenseEntity saved = expenseRepository.save(ExpenseEntity.fromDomain(expense));
        Expense stored = saved.toDomain();
        ledgerMetrics.incrementExpensesAdded();

        MDC.put("groupId", String.valueOf(groupId));
        try {
            if (stored.roundingRemainder().isPositive()) {
                ledgerMetrics.incrementRoundingRemainders();
                log.info("Expense recorded with rounding remainder: expenseId={}, amount={}, participants={}, remainder={}",
                        stored.getId(), amount, stored.getParticipants().size(), stored.roundingRemainder());
            } else {
                log.info("Expense recorded: expenseId={}, payer={}, amount={}, participants={}",
                        stored.getId(), payer, amount, stored.getParticipants().size());
            }
        } finally {
            MDC.remove("groupId");
        }
        return stored;
    }

    @Transactional(readOnly = true)
    public List<Expense> listExpenses(long groupId) {
        return expenseRepository.findByGroupIdOrderByCreatedAtAscIdAsc(groupId)
            .stream()
            .map(ExpenseEntity::toDomain)
            .toList();
    }
}
