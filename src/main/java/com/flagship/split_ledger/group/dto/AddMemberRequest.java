package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AddMemberRequest(
    @NotBlank(message = "Member address is required")
    @JsonProperty("member")
    String member
) {}
