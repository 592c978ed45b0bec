package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.group.Group;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.group.NotAGroupMemberException;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.settlement.Settlement;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds a group's expense and settlement history into one signed balance per member.
 *
 * The fold is pure and order-independent. It keeps the ledger closed: every unit credited
 * is debited somewhere else, so the balances of a group always sum to exactly zero.
 *
 * Per expense with {@code k} participants and {@code share = amount / k} (floor):
 * <ul>
 *   <li>every participant is debited {@code share}, the payer included when participating;</li>
 *   <li>the payer is credited {@code share * k}, the amount actually distributed.</li>
 * </ul>
 * The remaining {@code amount mod k} units are credited to no one (see {@link Expense#roundingRemainder()}).
 *
 * Per settlement: {@code from} is credited the amount (their debt shrinks) and {@code to} is
 * debited it (what they are owed shrinks).
 */
@Component
public class BalanceAggregator {

    /**
     * @throws NotAGroupMemberException if any record references a member outside the roster;
     *         raised before folding anything
     */
    public BalanceSnapshot computeBalances(Group group,
                                           Collection<Expense> expenses,
                                           Collection<Settlement> settlements) {
        validateReferences(group, expenses, settlements);

        Map<Member, Money> balances = new LinkedHashMap<>();
        for (Member member : group.getMembers()) {
            balances.put(member, Money.ZERO);
        }

        for (Expense expense : expenses) {
            Money share = expense.share();
            balances.merge(expense.getPayer(), expense.distributedAmount(), Money::plus);
            for (Member participant : expense.getParticipants()) {
                balances.merge(participant, share.negate(), Money::plus);
            }
        }

        for (Settlement settlement : settlements) {
            balances.merge(settlement.getFrom(), settlement.getAmount(), Money::plus);
            balances.merge(settlement.getTo(), settlement.getAmount().negate(), Money::plus);
        }

        return new BalanceSnapshot(group.getId(), balances);
    }

    private void validateReferences(Group group, Collection<Expense> expenses, Collection<Settlement> settlements) {
        for (Expense expense : expenses) {
            requireMember(group, expense.getPayer());
            for (Member participant : expense.getParticipants()) {
                requireMember(group, participant);
            }
        }
        for (Settlement settlement : settlements) {
            requireMember(group, settlement.getFrom());
            requireMember(group, settlement.getTo());
        }
    }

    private void requireMember(Group group, Member member) {
        if (!group.hasMember(member)) {
            throw new NotAGroupMemberException(group.getId(), member);
        }
    }
}
