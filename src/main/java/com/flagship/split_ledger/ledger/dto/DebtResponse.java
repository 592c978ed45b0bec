package com.flagship.split_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.SimplifiedDebt;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DebtResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    String amount;

    public static DebtResponse from(SimplifiedDebt debt) {
        return DebtResponse.builder()
            .from(debt.getFrom().getAddress())
            .to(debt.getTo().getAddress())
            .amount(debt.getAmount().toString())
            .build();
    }
}
