package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.inventory.ItemType;

import java.time.Instant;
import java.util.UUID;

final class LedgerTestEntries {

    private LedgerTestEntries() {
    }

    static HistoryEntry checkout(String toolId, String staffUid, Instant at) {
        return HistoryEntry.builder()
            .id(UUID.randomUUID().toString())
            .action(HistoryAction.CHECKOUT)
            .itemType(ItemType.TOOL)
            .itemId(toolId)
            .itemUniqueId("T-" + toolId)
            .byStaffUid("admin")
            .assignedToStaffUid(staffUid)
            .timestamp(at)
            .build();
    }

    static HistoryEntry checkin(String toolId, String holderUid, Instant at) {
        return HistoryEntry.builder()
            .id(UUID.randomUUID().toString())
            .action(HistoryAction.CHECKIN)
            .itemType(ItemType.TOOL)
            .itemId(toolId)
            .itemUniqueId("T-" + toolId)
            .byStaffUid("admin")
            .assignedToStaffUid(holderUid)
            .timestamp(at)
            .build();
    }
}
