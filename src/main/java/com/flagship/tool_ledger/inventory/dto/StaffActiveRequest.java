package com.flagship.tool_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StaffActiveRequest {

    @NotNull(message = "Active flag is required")
    @JsonProperty("active")
    Boolean active;
}
