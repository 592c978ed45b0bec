package com.flagship.split_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.Settlement;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("group_id")
    long groupId;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("external_ref")
    String externalRef;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .groupId(settlement.getGroupId())
            .from(settlement.getFrom().getAddress())
            .to(settlement.getTo().getAddress())
            .amount(settlement.getAmount().toString())
            .externalRef(settlement.getExternalRef())
            .settledAt(settlement.getSettledAt())
            .build();
    }
}
