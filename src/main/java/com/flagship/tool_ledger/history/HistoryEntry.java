package com.flagship.tool_ledger.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.tool_ledger.inventory.ItemType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One custody event. Entries are appended to ledger buckets and never modified.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryEntry {
    String id;
    HistoryAction action;
    ItemType itemType;
    String itemId;
    String itemUniqueId;
    /** Staff member who performed the operation. */
    String byStaffUid;
    /** Receiving staff on checkout and usage, returning holder on checkin. */
    String assignedToStaffUid;
    String batchId;
    String notes;
    Instant timestamp;
    BigDecimal quantityBefore;
    BigDecimal quantityChange;
    BigDecimal quantityAfter;
    EntryMetadata metadata;

    @JsonIgnore
    public boolean isPartOfBatch() {
        return batchId != null;
    }

    @JsonIgnore
    public boolean involvesStaff(String staffUid) {
        return staffUid.equals(byStaffUid) || staffUid.equals(assignedToStaffUid);
    }
}
