package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.tool_ledger.store.DocumentRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Staff member at {@code staff/{uid}}. {@code assignedItemIds} holds the internal ids of
 * the tools currently checked out to this person and is kept in step with the tool
 * documents by the custody transactions.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Staff {
    public static final String COLLECTION = "staff";

    String uid;
    String fullName;
    String jobCode;
    StaffRole role;
    boolean active;
    @Builder.Default
    List<String> assignedItemIds = List.of();
    Instant createdAt;
    Instant updatedAt;

    public List<String> getAssignedItemIds() {
        return assignedItemIds == null ? List.of() : assignedItemIds;
    }

    public static DocumentRef refFor(String uid) {
        return DocumentRef.of(COLLECTION, uid);
    }
}
