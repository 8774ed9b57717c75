package com.flagship.tool_ledger.custody.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.inventory.Consumable;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ConsumableStatusResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("unique_id")
    String uniqueId;

    @JsonProperty("name")
    String name;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("current_quantity")
    BigDecimal currentQuantity;

    @JsonProperty("min_quantity")
    BigDecimal minQuantity;

    @JsonProperty("low_stock")
    boolean lowStock;

    @JsonProperty("last_used_by_name")
    String lastUsedByName;

    @JsonProperty("last_used_at")
    Instant lastUsedAt;

    @JsonProperty("last_restocked_by_name")
    String lastRestockedByName;

    @JsonProperty("last_restocked_at")
    Instant lastRestockedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ConsumableStatusResponse from(Consumable consumable) {
        return ConsumableStatusResponse.builder()
            .id(consumable.getId())
            .uniqueId(consumable.getUniqueId())
            .name(consumable.getName())
            .unit(consumable.getUnit())
            .currentQuantity(consumable.getCurrentQuantity())
            .minQuantity(consumable.getMinQuantity())
            .lowStock(consumable.isLowStock())
            .lastUsedByName(consumable.getLastAssignedToName())
            .lastUsedAt(consumable.getLastAssignedAt())
            .lastRestockedByName(consumable.getLastCheckinByName())
            .lastRestockedAt(consumable.getLastCheckinAt())
            .updatedAt(consumable.getUpdatedAt())
            .build();
    }
}
