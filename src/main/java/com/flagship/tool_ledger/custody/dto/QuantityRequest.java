package com.flagship.tool_ledger.custody.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request DTO for consumable usage and restock.
 *
 * {@code used_by_uid} only applies to usage and defaults to the acting staff member.
 */
@Value
@Builder
@Jacksonized
public class QuantityRequest {

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotBlank(message = "Acting staff uid is required")
    @JsonProperty("acting_staff_uid")
    String actingStaffUid;

    @JsonProperty("used_by_uid")
    String usedByUid;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}
