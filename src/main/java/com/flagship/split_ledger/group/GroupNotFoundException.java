package com.flagship.split_ledger.group;

public class GroupNotFoundException extends RuntimeException {

    private final long groupId;

    public GroupNotFoundException(long groupId) {
        super("Group does not exist: " + groupId);
        this.groupId = groupId;
    }

    public long getGroupId() {
        return groupId;
    }
}
