package com.flagship.tool_ledger.history;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ItemHistoryStats {
    String itemId;
    int totalEntries;
    int checkouts;
    int checkins;
    int usages;
    int restocks;
    int uniqueAssignees;
    int batchOperations;
    String mostActiveAssignee;
}
