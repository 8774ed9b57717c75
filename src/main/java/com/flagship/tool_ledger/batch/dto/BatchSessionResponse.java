package com.flagship.tool_ledger.batch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.batch.BatchItem;
import com.flagship.tool_ledger.batch.BatchSession;
import com.flagship.tool_ledger.batch.BatchState;
import com.flagship.tool_ledger.batch.BatchType;
import com.flagship.tool_ledger.inventory.ItemType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class BatchSessionResponse {

    @JsonProperty("session_id")
    String sessionId;

    @JsonProperty("acting_staff_uid")
    String actingStaffUid;

    @JsonProperty("state")
    BatchState state;

    @JsonProperty("type")
    BatchType type;

    @JsonProperty("items")
    List<Item> items;

    public static BatchSessionResponse from(BatchSession session) {
        return BatchSessionResponse.builder()
            .sessionId(session.getSessionId())
            .actingStaffUid(session.getActingStaffUid())
            .state(session.getState())
            .type(session.getType())
            .items(session.getItems().stream().map(Item::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Item {

        @JsonProperty("item_type")
        ItemType itemType;

        @JsonProperty("item_id")
        String itemId;

        @JsonProperty("unique_id")
        String uniqueId;

        @JsonProperty("display_name")
        String displayName;

        @JsonProperty("quantity")
        BigDecimal quantity;

        static Item from(BatchItem item) {
            return Item.builder()
                .itemType(item.getItemType())
                .itemId(item.getItemId())
                .uniqueId(item.getUniqueId())
                .displayName(item.getDisplayName())
                .quantity(item.getQuantity())
                .build();
        }
    }
}
