package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for recording an expense. Amounts travel as base-unit integer strings.
 */
@Value
public class CreateExpenseRequest {

    @NotBlank(message = "Payer is required")
    @JsonProperty("payer")
    String payer;

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = "^[0-9]+$", message = "Amount must be a whole number of base units")
    @JsonProperty("amount")
    String amount;

    @JsonProperty("description")
    String description;

    @NotEmpty(message = "At least one participant is required")
    @JsonProperty("participants")
    List<String> participants;
}
