package com.flagship.tool_ledger.custody;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.tool_ledger.history.HistoryAction;
import com.flagship.tool_ledger.inventory.ItemType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of a committed custody operation.
 *
 * {@code committedAt} is the server timestamp written to the item's instant-status
 * fields and to the history entry {@code entryId}. Whether that entry actually reached
 * the ledgers is deliberately not reported.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CustodyReceipt {
    String entryId;
    HistoryAction action;
    ItemType itemType;
    String itemId;
    String itemUniqueId;
    String staffUid;
    String actingStaffUid;
    String batchId;
    Instant committedAt;
    BigDecimal quantityAfter;
}
