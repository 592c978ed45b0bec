package com.flagship.split_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.RoundingRemainder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoundingRemainderResponse {

    @JsonProperty("expense_id")
    Long expenseId;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("participant_count")
    int participantCount;

    @JsonProperty("share")
    String share;

    @JsonProperty("remainder")
    String remainder;

    public static RoundingRemainderResponse from(RoundingRemainder remainder) {
        return RoundingRemainderResponse.builder()
            .expenseId(remainder.getExpenseId())
            .amount(remainder.getAmount().toString())
            .participantCount(remainder.getParticipantCount())
            .share(remainder.getShare().toString())
            .remainder(remainder.getRemainder().toString())
            .build();
    }
}
