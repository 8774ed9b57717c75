package com.flagship.tool_ledger.custody.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.custody.CustodyReceipt;
import com.flagship.tool_ledger.history.HistoryAction;
import com.flagship.tool_ledger.inventory.ItemType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustodyResponse {

    @JsonProperty("entry_id")
    String entryId;

    @JsonProperty("action")
    HistoryAction action;

    @JsonProperty("item_type")
    ItemType itemType;

    @JsonProperty("item_id")
    String itemId;

    @JsonProperty("unique_id")
    String uniqueId;

    @JsonProperty("staff_uid")
    String staffUid;

    @JsonProperty("acting_staff_uid")
    String actingStaffUid;

    @JsonProperty("batch_id")
    String batchId;

    @JsonProperty("committed_at")
    Instant committedAt;

    @JsonProperty("quantity_after")
    BigDecimal quantityAfter;

    public static CustodyResponse from(CustodyReceipt receipt) {
        return CustodyResponse.builder()
            .entryId(receipt.getEntryId())
            .action(receipt.getAction())
            .itemType(receipt.getItemType())
            .itemId(receipt.getItemId())
            .uniqueId(receipt.getItemUniqueId())
            .staffUid(receipt.getStaffUid())
            .actingStaffUid(receipt.getActingStaffUid())
            .batchId(receipt.getBatchId())
            .committedAt(receipt.getCommittedAt())
            .quantityAfter(receipt.getQuantityAfter())
            .build();
    }
}
