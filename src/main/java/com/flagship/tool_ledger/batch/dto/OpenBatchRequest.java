package com.flagship.tool_ledger.batch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.batch.BatchType;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Opens a batch session. {@code type} is only given for consumable batches; tool
 * batches take their type from the first scan.
 */
@Value
@Builder
@Jacksonized
public class OpenBatchRequest {

    @NotBlank(message = "Acting staff uid is required")
    @JsonProperty("acting_staff_uid")
    String actingStaffUid;

    @JsonProperty("type")
    BatchType type;
}
