package com.flagship.split_ledger.group;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A roster of members sharing expenses.
 *
 * Members are unique and kept in join order, creator first. That order is the stable
 * enumeration order used for balance snapshots and simplification tie-breaks.
 */
@Value
public class Group {
    long id;
    String name;
    Member creator;
    List<Member> members;
    Instant createdAt;

    public Group(long id, String name, Member creator, List<Member> members, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.creator = creator;
        this.members = List.copyOf(members);
        this.createdAt = createdAt;
    }

    public boolean hasMember(Member member) {
        return members.contains(member);
    }
}
