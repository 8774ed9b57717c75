package com.flagship.tool_ledger.batch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class ScanRequest {

    @NotBlank(message = "Scanned code is required")
    @JsonProperty("code")
    String code;

    /** Consumables only. */
    @JsonProperty("quantity")
    BigDecimal quantity;
}
