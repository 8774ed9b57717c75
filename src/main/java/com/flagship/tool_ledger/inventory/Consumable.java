package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.tool_ledger.store.DocumentRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stock item tracked by quantity rather than by holder, stored at {@code consumables/{id}}.
 * Usage fills the {@code lastAssigned*} fields, restocks fill {@code lastCheckin*}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Consumable {
    public static final String COLLECTION = "consumables";

    String id;
    String uniqueId;
    String name;
    String brand;
    String unit;
    BigDecimal currentQuantity;
    BigDecimal minQuantity;

    String lastAssignedToName;
    String lastAssignedToJobCode;
    String lastAssignedByName;
    Instant lastAssignedAt;
    Instant lastCheckinAt;
    String lastCheckinByName;

    Instant createdAt;
    Instant updatedAt;

    public static DocumentRef refFor(String id) {
        return DocumentRef.of(COLLECTION, id);
    }

    @JsonIgnore
    public boolean isLowStock() {
        return currentQuantity != null && minQuantity != null && currentQuantity.compareTo(minQuantity) <= 0;
    }
}
