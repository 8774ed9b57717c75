package com.flagship.tool_ledger.custody.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CheckoutRequest {

    @NotBlank(message = "Staff uid is required")
    @JsonProperty("staff_uid")
    String staffUid;

    @NotBlank(message = "Acting staff uid is required")
    @JsonProperty("acting_staff_uid")
    String actingStaffUid;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}
