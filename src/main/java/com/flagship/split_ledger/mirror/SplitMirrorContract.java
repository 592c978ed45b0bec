package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.ledger.BalanceSnapshot;
import com.flagship.split_ledger.ledger.SimplifiedDebt;
import com.flagship.split_ledger.money.Money;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process mirror of the on-chain split contract.
 *
 * Holds the canonical balances for value that moves through it. Unlike the off-chain ledger,
 * balances are kept incrementally: every expense applies its shares the moment it is added.
 * The share arithmetic and the debt plan follow the same rules as the off-chain ledger but
 * are computed here on their own, so the two can be checked against each other.
 *
 * Every state-changing call runs inside one {@link ReentrancyGuard} section. Calls are
 * serialized on the instance monitor, so the guard only ever trips on re-entry from a
 * callback on the calling thread, e.g. a recipient reacting to a transfer.
 *
 * Rejected calls throw {@link MirrorRevertException} and leave no trace.
 */
@Slf4j
public class SplitMirrorContract {

    static final String GROUP_DOES_NOT_EXIST = "Group does not exist";
    static final String ALREADY_A_MEMBER = "Already a member";
    static final String NOT_A_GROUP_MEMBER = "Not a group member";
    static final String PARTICIPANT_NOT_A_MEMBER = "Participant not a member";
    static final String AMOUNT_MUST_BE_POSITIVE = "Amount must be positive";
    static final String NEED_PARTICIPANTS = "Need at least one participant";
    static final String EXPENSE_DOES_NOT_EXIST = "Expense does not exist";
    static final String MUST_SEND_VALUE = "Must send value";
    static final String CANNOT_SETTLE_WITH_YOURSELF = "Cannot settle with yourself";
    static final String CREDITOR_NOT_A_MEMBER = "Creditor not a member";
    static final String NOTHING_OWED = "You don't owe anything";
    static final String CREDITOR_NOT_OWED = "Creditor is not owed anything";
    static final String TRANSFER_FAILED = "Transfer failed";

    private final ValueTransferPrimitive valueTransfer;
    private final ReentrancyGuard guard = new ReentrancyGuard();
    private final List<MirrorEventListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<Long, GroupState> groups = new HashMap<>();
    private final Map<Long, MirrorExpense> expenses = new HashMap<>();
    private final Map<Member, List<Long>> userGroups = new HashMap<>();
    private long groupCount;
    private long expenseCount;

    public SplitMirrorContract(ValueTransferPrimitive valueTransfer) {
        this.valueTransfer = Objects.requireNonNull(valueTransfer, "valueTransfer");
    }

    public void addListener(MirrorEventListener listener) {
        listeners.add(listener);
    }

    // ==================== State-changing calls ====================

    /**
     * Creates a group with the caller as creator and first member. Initial members already
     * on the roster are skipped.
     *
     * @return the new group id, starting at 1
     */
    public synchronized long createGroup(Member caller, String name, List<Member> initialMembers) {
        return guard.call(() -> {
            long groupId = ++groupCount;
            GroupState group = new GroupState(name, caller);
            groups.put(groupId, group);
            log.info("GroupCreated: groupId={}, name={}, creator={}", groupId, name, caller);

            enrol(groupId, group, caller);
            for (Member member : initialMembers) {
                if (!group.isMember(member)) {
                    enrol(groupId, group, member);
                }
            }
            return groupId;
        });
    }

    public synchronized void joinGroup(Member caller, long groupId) {
        guard.run(() -> {
            GroupState group = requireGroup(groupId);
            if (group.isMember(caller)) {
                throw new MirrorRevertException(ALREADY_A_MEMBER);
            }
            enrol(groupId, group, caller);
        });
    }

    /**
     * Records an expense paid by the caller and applies it to the balances: each participant
     * is debited {@code floor(amount / k)} and the caller is credited the {@code k} shares
     * actually distributed. The remainder {@code amount mod k} lands on no balance.
     *
     * @return the new expense id, starting at 1 and unique across groups
     */
    public synchronized long addExpense(Member caller, long groupId, Money amount, String description,
                                        List<Member> participants) {
        return guard.call(() -> {
            GroupState group = requireGroup(groupId);
            if (!group.isMember(caller)) {
                throw new MirrorRevertException(NOT_A_GROUP_MEMBER);
            }
            if (!amount.isPositive()) {
                throw new MirrorRevertException(AMOUNT_MUST_BE_POSITIVE);
            }
            Set<Member> sharing = new LinkedHashSet<>(participants);
            if (sharing.isEmpty()) {
                throw new MirrorRevertException(NEED_PARTICIPANTS);
            }
            for (Member participant : sharing) {
                if (!group.isMember(participant)) {
                    throw new MirrorRevertException(PARTICIPANT_NOT_A_MEMBER);
                }
            }

            int count = sharing.size();
            Money share = amount.divideFloor(count);
            for (Member participant : sharing) {
                group.adjust(participant, share.negate());
            }
            group.adjust(caller, share.times(count));

            long expenseId = ++expenseCount;
            expenses.put(expenseId, new MirrorExpense(expenseId, groupId, caller, amount, description,
                Instant.now(), List.copyOf(sharing)));
            group.expenseIds.add(expenseId);

            log.info("ExpenseAdded: groupId={}, expenseId={}, payer={}, amount={}, description={}",
                    groupId, expenseId, caller, amount, description);
            return expenseId;
        });
    }

    /**
     * Pays {@code value} from the caller to {@code creditor} and reduces the caller's debt by it.
     *
     * Balances are updated before the value moves; if the transfer fails, they are restored
     * and the call reverts. Listeners receive a {@link MirrorSettlementEvent} once the call has
     * fully completed.
     *
     * @throws OverpaymentRejectedException if {@code value} exceeds what the caller owes
     * @throws MirrorRevertException for every other rejection
     * @throws ReentrantCallException if invoked while another state-changing call is open
     */
    public synchronized TransferReceipt settle(Member caller, long groupId, Member creditor, Money value) {
        MirrorSettlementEvent event = guard.call(() -> {
            GroupState group = requireGroup(groupId);
            if (!value.isPositive()) {
                throw new MirrorRevertException(MUST_SEND_VALUE);
            }
            if (caller.equals(creditor)) {
                throw new MirrorRevertException(CANNOT_SETTLE_WITH_YOURSELF);
            }
            if (!group.isMember(caller)) {
                throw new MirrorRevertException(NOT_A_GROUP_MEMBER);
            }
            if (!group.isMember(creditor)) {
                throw new MirrorRevertException(CREDITOR_NOT_A_MEMBER);
            }
            Money callerBalance = group.balanceOf(caller);
            if (!callerBalance.isNegative()) {
                throw new MirrorRevertException(NOTHING_OWED);
            }
            if (!group.balanceOf(creditor).isPositive()) {
                throw new MirrorRevertException(CREDITOR_NOT_OWED);
            }
            Money owed = callerBalance.negate();
            if (value.compareTo(owed) > 0) {
                throw new OverpaymentRejectedException(value, owed);
            }

            group.adjust(caller, value);
            group.adjust(creditor, value.negate());

            TransferReceipt receipt;
            try {
                receipt = valueTransfer.transfer(caller, creditor, value);
            } catch (TransferFailedException e) {
                restore(group, caller, creditor, value);
                log.warn("Settlement transfer failed: groupId={}, debtor={}, creditor={}, error={}",
                        groupId, caller, creditor, e.getMessage());
                throw new MirrorRevertException(TRANSFER_FAILED, e);
            } catch (RuntimeException e) {
                restore(group, caller, creditor, value);
                throw e;
            }

            log.info("DebtSettled: groupId={}, debtor={}, creditor={}, amount={}, reference={}",
                    groupId, caller, creditor, value, receipt.getReference());
            return new MirrorSettlementEvent(groupId, caller, creditor, receipt.getConfirmedAmount(),
                receipt.getReference(), Instant.now());
        });

        publish(event);
        return new TransferReceipt(event.getTransferReference(), event.getAmount());
    }

    // ==================== Views ====================

    public synchronized MirrorGroup getGroup(long groupId) {
        GroupState group = requireGroup(groupId);
        return new MirrorGroup(groupId, group.name, group.creator, group.active, group.members.size());
    }

    /**
     * Members in join order.
     */
    public synchronized List<Member> getGroupMembers(long groupId) {
        return List.copyOf(requireGroup(groupId).members);
    }

    public synchronized MirrorExpense getExpense(long expenseId) {
        MirrorExpense expense = expenses.get(expenseId);
        if (expense == null) {
            throw new MirrorRevertException(EXPENSE_DOES_NOT_EXIST);
        }
        return expense;
    }

    public synchronized List<Long> getGroupExpenses(long groupId) {
        return List.copyOf(requireGroup(groupId).expenseIds);
    }

    public synchronized List<Long> getUserGroups(Member member) {
        return List.copyOf(userGroups.getOrDefault(member, List.of()));
    }

    /**
     * Zero for anyone not on the roster.
     */
    public synchronized Money getMemberBalance(long groupId, Member member) {
        return requireGroup(groupId).balanceOf(member);
    }

    public synchronized BalanceSnapshot getAllBalances(long groupId) {
        GroupState group = requireGroup(groupId);
        Map<Member, Money> balances = new LinkedHashMap<>();
        for (Member member : group.members) {
            balances.put(member, group.balanceOf(member));
        }
        return new BalanceSnapshot(groupId, balances);
    }

    /**
     * Transfers that zero every balance: the largest creditor is repeatedly paid by the largest
     * debtor, equal amounts going to the member who joined first.
     */
    public synchronized List<SimplifiedDebt> getSimplifiedDebts(long groupId) {
        GroupState group = requireGroup(groupId);
        List<Member> members = new ArrayList<>(group.members);
        int count = members.size();
        Money[] credit = new Money[count];
        Money[] debt = new Money[count];
        for (int i = 0; i < count; i++) {
            Money balance = group.balanceOf(members.get(i));
            credit[i] = balance.isPositive() ? balance : Money.ZERO;
            debt[i] = balance.isNegative() ? balance.negate() : Money.ZERO;
        }

        List<SimplifiedDebt> debts = new ArrayList<>();
        int creditor = largest(credit);
        int debtor = largest(debt);
        while (creditor >= 0 && debtor >= 0) {
            Money amount = Money.min(credit[creditor], debt[debtor]);
            debts.add(new SimplifiedDebt(members.get(debtor), members.get(creditor), amount));
            credit[creditor] = credit[creditor].minus(amount);
            debt[debtor] = debt[debtor].minus(amount);
            creditor = largest(credit);
            debtor = largest(debt);
        }
        return debts;
    }

    // ==================== Internals ====================

    private GroupState requireGroup(long groupId) {
        GroupState group = groups.get(groupId);
        if (group == null) {
            throw new MirrorRevertException(GROUP_DOES_NOT_EXIST);
        }
        return group;
    }

    /**
     * Index of the largest positive amount, the lowest index on ties; -1 if none is positive.
     */
    private static int largest(Money[] amounts) {
        int best = -1;
        for (int i = 0; i < amounts.length; i++) {
            if (amounts[i].isPositive() && (best < 0 || amounts[i].compareTo(amounts[best]) > 0)) {
                best = i;
            }
        }
        return best;
    }

    private void enrol(long groupId, GroupState group, Member member) {
        group.members.add(member);
        userGroups.computeIfAbsent(member, m -> new ArrayList<>()).add(groupId);
        log.info("MemberJoined: groupId={}, member={}", groupId, member);
    }

    private static void restore(GroupState group, Member debtor, Member creditor, Money value) {
        group.adjust(debtor, value.negate());
        group.adjust(creditor, value);
    }

    private void publish(MirrorSettlementEvent event) {
        for (MirrorEventListener listener : listeners) {
            try {
                listener.onDebtSettled(event);
            } catch (RuntimeException e) {
                // The transfer is final; a listener failure cannot undo it.
                log.error("Mirror event listener failed: groupId={}, reference={}",
                        event.getGroupId(), event.getTransferReference(), e);
            }
        }
    }

    private static final class GroupState {
        final String name;
        final Member creator;
        final boolean active = true;
        final Set<Member> members = new LinkedHashSet<>();
        final Map<Member, Money> balances = new HashMap<>();
        final List<Long> expenseIds = new ArrayList<>();

        GroupState(String name, Member creator) {
            this.name = name;
            this.creator = creator;
        }

        boolean isMember(Member member) {
            return members.contains(member);
        }

        Money balanceOf(Member member) {
            return balances.getOrDefault(member, Money.ZERO);
        }

        void adjust(Member member, Money delta) {
            balances.merge(member, delta, Money::plus);
        }
    }
}
