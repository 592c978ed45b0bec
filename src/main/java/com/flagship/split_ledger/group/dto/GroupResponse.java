package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.group.Group;
import com.flagship.split_ledger.group.Member;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class GroupResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("members")
    List<String> members;

    @JsonProperty("created_at")
    Instant createdAt;

    public static GroupResponse from(Group group) {
        return GroupResponse.builder()
            .id(group.getId())
            .name(group.getName())
            .creator(group.getCreator().getAddress())
            .members(group.getMembers().stream().map(Member::getAddress).toList())
            .createdAt(group.getCreatedAt())
            .build();
    }
}
