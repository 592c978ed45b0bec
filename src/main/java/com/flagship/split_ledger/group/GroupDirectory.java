package com.flagship.split_ledger.group;

import java.util.List;

/**
 * Read side of group membership, as the ledger consumes it.
 */
public interface GroupDirectory {

    /**
     * @throws GroupNotFoundException if no such group exists
     */
    Group getGroup(long groupId);

    /**
     * Members in join order.
     *
     * @throws GroupNotFoundException if no such group exists
     */
    List<Member> listMembers(long groupId);

    boolean isMember(long groupId, Member member);

    /**
     * @throws GroupNotFoundException if no such group exists
     * @throws NotAGroupMemberException if the member is not on the roster
     */
    default void requireMember(long groupId, Member member) {
        if (!isMember(groupId, member)) {
            getGroup(groupId);
            throw new NotAGroupMemberException(groupId, member);
        }
    }
}
