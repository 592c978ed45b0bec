package com.flagship.split_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.BalanceSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Net balance per member, in roster order. Positive means the member is owed.
 */
@Value
@Builder
public class BalancesResponse {

    @JsonProperty("group_id")
    long groupId;

    @JsonProperty("balances")
    Map<String, String> balances;

    @JsonProperty("settled")
    boolean settled;

    public static BalancesResponse from(BalanceSnapshot snapshot) {
        Map<String, String> balances = new LinkedHashMap<>();
        snapshot.asMap().forEach((member, balance) -> balances.put(member.getAddress(), balance.toString()));
        return BalancesResponse.builder()
            .groupId(snapshot.getGroupId())
            .balances(balances)
            .settled(snapshot.isSettled())
            .build();
    }
}
