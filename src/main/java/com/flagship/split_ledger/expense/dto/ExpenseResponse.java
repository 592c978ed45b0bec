package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.group.Member;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("group_id")
    long groupId;

    @JsonProperty("payer")
    String payer;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("participants")
    List<String> participants;

    @JsonProperty("share")
    String share;

    @JsonProperty("rounding_remainder")
    String roundingRemainder;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .groupId(expense.getGroupId())
            .payer(expense.getPayer().getAddress())
            .amount(expense.getAmount().toString())
            .description(expense.getDescription())
            .participants(expense.getParticipants().stream().map(Member::getAddress).toList())
            .share(expense.share().toString())
            .roundingRemainder(expense.roundingRemainder().toString())
            .createdAt(expense.getCreatedAt())
            .build();
    }
}
