package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.tool_ledger.store.DocumentRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Workshop tool as stored at {@code tools/{id}}.
 *
 * The {@code lastAssigned*} and {@code lastCheckin*} fields are a denormalized copy of
 * the latest custody change, written in the same transaction as the status, so the
 * current state can be shown without reading history.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tool {
    public static final String COLLECTION = "tools";

    String id;
    String uniqueId;
    String name;
    String brand;
    String model;
    ToolStatus status;
    /** Uid of the staff member holding the tool; null while available. */
    String currentHolderRef;

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
    public boolean isAvailable() {
        return status == ToolStatus.AVAILABLE;
    }

    @JsonIgnore
    public boolean isCheckedOut() {
        return status == ToolStatus.CHECKED_OUT;
    }

    /**
     * "brand model name", skipping blank parts. Frozen into history entries as the item name.
     */
    @JsonIgnore
    public String getDisplayName() {
        return Stream.of(brand, model, name)
            .filter(part -> part != null && !part.isBlank())
            .map(String::trim)
            .collect(Collectors.joining(" "));
    }
}
