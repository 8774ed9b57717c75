package com.flagship.tool_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class RegisterConsumableRequest {

    @NotBlank(message = "Unique id is required")
    @JsonProperty("unique_id")
    String uniqueId;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Unit is required")
    @JsonProperty("unit")
    String unit;

    @NotNull(message = "Initial quantity is required")
    @DecimalMin(value = "0", message = "Initial quantity must not be negative")
    @JsonProperty("initial_quantity")
    BigDecimal initialQuantity;

    @DecimalMin(value = "0", message = "Minimum quantity must not be negative")
    @JsonProperty("min_quantity")
    BigDecimal minQuantity;
}
