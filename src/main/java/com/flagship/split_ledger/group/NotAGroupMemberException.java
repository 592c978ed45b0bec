package com.flagship.split_ledger.group;

/**
 * A record referenced a member outside the group's roster. Raised before any balance or
 * ledger mutation, so nothing is ever partially applied.
 */
public class NotAGroupMemberException extends RuntimeException {

    private final long groupId;
    private final Member member;

    public NotAGroupMemberException(long groupId, Member member) {
        super(String.format("%s is not a member of group %d", member, groupId));
        this.groupId = groupId;
        this.member = member;
    }

    public long getGroupId() {
        return groupId;
    }

    public Member getMember() {
        return member;
    }
}
