package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for creating a group. The creator becomes the first member; {@code members}
 * lists anyone else to enrol up front.
 */
@Value
public class CreateGroupRequest {

    @NotBlank(message = "Group name is required")
    @Size(max = 200, message = "Group name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Creator address is required")
    @JsonProperty("creator")
    String creator;

    @JsonProperty("members")
    List<String> members;
}
