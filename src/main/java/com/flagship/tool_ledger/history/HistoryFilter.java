package com.flagship.tool_ledger.history;

import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Optional criteria for global ledger queries. Unset fields match everything.
 */
@Value
@Builder
public class HistoryFilter implements Predicate<HistoryEntry> {
    String itemId;
    /** Matches either the acting staff member or the assignee. */
    String staffUid;
    HistoryAction action;
    String batchId;

    public static HistoryFilter none() {
        return HistoryFilter.builder().build();
    }

    @Override
    public boolean test(HistoryEntry entry) {
        return (itemId == null || itemId.equals(entry.getItemId()))
            && (staffUid == null || entry.involvesStaff(staffUid))
            && (action == null || action == entry.getAction())
            && (batchId == null || batchId.equals(entry.getBatchId()));
    }
}
