package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseService;
import com.flagship.split_ledger.expense.RoundingRemainder;
import com.flagship.split_ledger.group.Group;
import com.flagship.split_ledger.group.GroupDirectory;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.Settlement;
import com.flagship.split_ledger.settlement.SettlementLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read model of a group's ledger: balances, simplified debts and rounding remainders.
 *
 * Nothing here is cached or stored. Every query recomputes from the full expense and
 * settlement history inside one read-only transaction, so the answer always reflects a
 * single consistent prefix of that history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceQueryService {

    private final GroupDirectory groupDirectory;
    private final ExpenseService expenseService;
    private final SettlementLedgerService settlementLedgerService;
    private final BalanceAggregator balanceAggregator;
    private final DebtSimplifier debtSimplifier;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws com.flagship.split_ledger.group.GroupNotFoundException if no such group exists
     */
    @Transactional(readOnly = true)
    public BalanceSnapshot getBalances(long groupId) {
        Group group = groupDirectory.getGroup(groupId);
        List<Expense> expenses = expenseService.listExpenses(groupId);
        List<Settlement> settlements = settlementLedgerService.listSettlements(groupId);

        return ledgerMetrics.timeBalances(
            () -> balanceAggregator.computeBalances(group, expenses, settlements));
    }

    @Transactional(readOnly = true)
    public List<SimplifiedDebt> getSimplifiedDebts(long groupId) {
        BalanceSnapshot snapshot = getBalances(groupId);
        List<SimplifiedDebt> debts = debtSimplifier.simplify(snapshot);
        ledgerMetrics.recordSimplification(debts.size());
        log.debug("Simplified debts: groupId={}, nonZeroMembers={}, transfers={}",
                groupId, snapshot.nonZeroCount(), debts.size());
        return debts;
    }

    /**
     * Simplified debts in which the member appears as debtor or creditor. The plan is
     * computed for the whole group first, so a member's view never disagrees with it.
     */
    @Transactional(readOnly = true)
    public List<SimplifiedDebt> getSimplifiedDebts(long groupId, Member member) {
        return getSimplifiedDebts(groupId).stream()
            .filter(debt -> debt.involves(member))
            .toList();
    }

    /**
     * Expenses whose equal split left part of the amount undistributed.
     */
    @Transactional(readOnly = true)
    public List<RoundingRemainder> getRoundingRemainders(long groupId) {
        groupDirectory.getGroup(groupId);
        return expenseService.listExpenses(groupId).stream()
            .map(RoundingRemainder::of)
            .filter(remainder -> remainder.getRemainder().isPositive())
            .toList();
    }
}
