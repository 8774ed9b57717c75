package com.flagship.tool_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.inventory.StaffRole;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RegisterStaffRequest {

    @NotBlank(message = "Full name is required")
    @JsonProperty("full_name")
    String fullName;

    @NotBlank(message = "Job code is required")
    @JsonProperty("job_code")
    String jobCode;

    @JsonProperty("role")
    StaffRole role;
}
