package com.flagship.tool_ledger.batch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SubmitBatchRequest {

    @JsonProperty("target_staff_uid")
    String targetStaffUid;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}
