package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-member net balances of one group at one point in time.
 *
 * Positive means the member is owed, negative means the member owes. Iteration order is the
 * member enumeration order the snapshot was built with; the simplifier relies on it for
 * deterministic tie-breaks. A fresh snapshot is produced by every aggregation.
 */
public final class BalanceSnapshot {

    private final long groupId;
    private final Map<Member, Money> balances;

    public BalanceSnapshot(long groupId, Map<Member, Money> balances) {
        this.groupId = groupId;
        this.balances = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(balances)));
    }

    public static BalanceSnapshot empty(long groupId) {
        return new BalanceSnapshot(groupId, Map.of());
    }

    public long getGroupId() {
        return groupId;
    }

    public Map<Member, Money> asMap() {
        return balances;
    }

    public List<Member> members() {
        return List.copyOf(balances.keySet());
    }

    /**
     * Balance of a member, zero for members the snapshot does not know.
     */
    public Money balanceOf(Member member) {
        return balances.getOrDefault(member, Money.ZERO);
    }

    /**
     * Sum of all balances. Zero for every consistent group.
     */
    public Money total() {
        Money total = Money.ZERO;
        for (Money balance : balances.values()) {
            total = total.plus(balance);
        }
        return total;
    }

    public long nonZeroCount() {
        return balances.values().stream().filter(b -> !b.isZero()).count();
    }

    public boolean isSettled() {
        return nonZeroCount() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BalanceSnapshot)) {
            return false;
        }
        BalanceSnapshot other = (BalanceSnapshot) o;
        return groupId == other.groupId && balances.equals(other.balances);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, balances);
    }

    @Override
    public String toString() {
        return "BalanceSnapshot{groupId=" + groupId + ", balances=" + balances + "}";
    }
}
