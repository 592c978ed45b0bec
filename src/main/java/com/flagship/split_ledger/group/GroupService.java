package com.flagship.split_ledger.group;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Group and roster storage.
 *
 * Thin JDBC adapter: the ledger only needs to enumerate members in a stable order and test
 * membership. Members are appended, never removed, because historical expense shares would
 * otherwise be orphaned.
 */
@Service
@Slf4j
public class GroupService implements GroupDirectory {

    private final JdbcTemplate jdbcTemplate;

    public GroupService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates a group. The creator is always the first member; duplicates in the initial
     * roster are collapsed.
     *
     * @return the new group id
     */
    @Transactional
    public long createGroup(String name, Member creator, List<Member> initialMembers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }
        if (creator == null) {
            throw new IllegalArgumentException("Group creator is required");
        }

        Long groupId = jdbcTemplate.queryForObject(
            "INSERT INTO split_groups (name, creator_address, created_at) VALUES (?, ?, CURRENT_TIMESTAMP) RETURNING id",
            Long.class,
            name.trim(),
            creator.getAddress()
        );
        if (groupId == null) {
            throw new IllegalStateException("Group insert returned no id");
        }

        Set<Member> roster = new LinkedHashSet<>();
        roster.add(creator);
        if (initialMembers != null) {
            roster.addAll(initialMembers);
        }
        for (Member member : roster) {
            insertMember(groupId, member);
        }

        log.info("Created group: groupId={}, name={}, members={}", groupId, name, roster.size());
        return groupId;
    }

    /**
     * Adds a member to the end of the roster.
     *
     * @throws GroupNotFoundException if the group does not exist
     * @throws IllegalStateException if the member is already on the roster
     */
    @Transactional
    public void addMember(long groupId, Member member) {
        getGroup(groupId);
        if (isMember(groupId, member)) {
            throw new IllegalStateException(String.format("%s is already a member of group %d", member, groupId));
        }
        try {
            insertMember(groupId, member);
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException(String.format("%s is already a member of group %d", member, groupId), e);
        }
        log.info("Member joined group: groupId={}, member={}", groupId, member);
    }

    @Override
    @Transactional(readOnly = true)
    public Group getGroup(long groupId) {
        List<GroupRow> found = jdbcTemplate.query(
            "SELECT name, creator_address, created_at FROM split_groups WHERE id = ?",
            (rs, rowNum) -> {
                Timestamp createdAt = rs.getTimestamp("created_at");
                return new GroupRow(
                    rs.getString("name"),
                    rs.getString("creator_address"),
                    createdAt != null ? createdAt.toInstant() : null
                );
            },
            groupId
        );
        if (found.isEmpty()) {
            throw new GroupNotFoundException(groupId);
        }
        GroupRow row = found.get(0);
        return new Group(groupId, row.name(), Member.of(row.creatorAddress()),
            listMembersUnchecked(groupId), row.createdAt());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Member> listMembers(long groupId) {
        return getGroup(groupId).getMembers();
    }

    @Override
    public boolean isMember(long groupId, Member member) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM group_members WHERE group_id = ? AND member_address = ?",
            Integer.class,
            groupId,
            member.getAddress()
        );
        return count != null && count > 0;
    }

    /**
     * Ids of every group the member belongs to, newest first.
     */
    @Transactional(readOnly = true)
    public List<Long> listGroupIdsFor(Member member) {
        return jdbcTemplate.queryForList(
            "SELECT g.id FROM split_groups g JOIN group_members m ON m.group_id = g.id " +
            "WHERE m.member_address = ? ORDER BY g.created_at DESC, g.id DESC",
            Long.class,
            member.getAddress()
        );
    }

    private List<Member> listMembersUnchecked(long groupId) {
        return jdbcTemplate.query(
            "SELECT member_address FROM group_members WHERE group_id = ? ORDER BY seq",
            (rs, rowNum) -> Member.of(rs.getString("member_address")),
            groupId
        );
    }

    private void insertMember(long groupId, Member member) {
        jdbcTemplate.update(
            "INSERT INTO group_members (group_id, member_address, joined_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            groupId,
            member.getAddress()
        );
    }

    private record GroupRow(String name, String creatorAddress, Instant createdAt) {}
}
