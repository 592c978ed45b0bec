package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import lombok.Value;

@Value
public class MirrorGroup {
    long id;
    String name;
    Member creator;
    boolean active;
    int memberCount;
}
