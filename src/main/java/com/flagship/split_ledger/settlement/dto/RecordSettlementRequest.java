package com.flagship.split_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request DTO for recording a confirmed transfer between two members.
 */
@Value
public class RecordSettlementRequest {

    @NotBlank(message = "Debtor address is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Creditor address is required")
    @JsonProperty("to")
    String to;

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = "^[0-9]+$", message = "Amount must be a whole number of base units")
    @JsonProperty("amount")
    String amount;

    @Size(max = 128, message = "External reference must be at most 128 characters")
    @JsonProperty("external_ref")
    String externalRef;
}
