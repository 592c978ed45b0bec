package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Reduces a balance snapshot to an ordered list of debtor-to-creditor transfers that zeroes
 * every balance.
 *
 * Greedy largest-to-largest matching: each step pairs the creditor owed the most with the
 * debtor owing the most and settles the smaller of the two amounts, which retires at least
 * one of them. With {@code n} non-zero members this yields at most {@code n - 1} transfers.
 * Equal amounts are ordered by the snapshot's member order, so output is reproducible.
 *
 * Pure: reads the snapshot, allocates a fresh list, touches nothing else.
 */
@Component
public class DebtSimplifier {

    private static final Comparator<Party> LARGEST_FIRST =
        Comparator.comparing(Party::remaining).reversed()
            .thenComparingInt(Party::position);

    /**
     * @throws UnbalancedLedgerException if the balances do not sum to zero
     */
    public List<SimplifiedDebt> simplify(BalanceSnapshot snapshot) {
        Money total = snapshot.total();
        if (!total.isZero()) {
            throw new UnbalancedLedgerException(snapshot.getGroupId(), total);
        }

        PriorityQueue<Party> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Party> debtors = new PriorityQueue<>(LARGEST_FIRST);

        int position = 0;
        for (Map.Entry<Member, Money> entry : snapshot.asMap().entrySet()) {
            Money balance = entry.getValue();
            if (balance.isPositive()) {
                creditors.add(new Party(entry.getKey(), position, balance));
            } else if (balance.isNegative()) {
                debtors.add(new Party(entry.getKey(), position, balance.negate()));
            }
            position++;
        }

        List<SimplifiedDebt> transfers = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Party creditor = creditors.poll();
            Party debtor = debtors.poll();

            Money amount = Money.min(creditor.remaining(), debtor.remaining());
            if (amount.isPositive()) {
                transfers.add(new SimplifiedDebt(debtor.member(), creditor.member(), amount));
            }

            Party creditorLeft = creditor.reducedBy(amount);
            Party debtorLeft = debtor.reducedBy(amount);
            if (creditorLeft.remaining().isPositive()) {
                creditors.add(creditorLeft);
            }
            if (debtorLeft.remaining().isPositive()) {
                debtors.add(debtorLeft);
            }
        }
        return transfers;
    }

    private record Party(Member member, int position, Money remaining) {

        Party reducedBy(Money amount) {
            return new Party(member, position, remaining.minus(amount));
        }
    }
}
