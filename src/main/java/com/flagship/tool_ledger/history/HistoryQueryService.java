package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.inventory.ItemKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the history ledgers.
 *
 * Item queries go to the per-item ledger. When it has nothing for the range (for example
 * because its best-effort write failed) the global ledger is searched for the item
 * instead, provided the range is small enough for a day-by-day scan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryQueryService {

    private final ItemHistoryLedger itemLedger;
    private final GlobalHistoryLedger globalLedger;
    private final PartitionKeys keys;

    public List<HistoryEntry> queryItemHistory(ItemKey item, Instant start, Instant end, int limit) {
        List<HistoryEntry> entries = itemLedger.query(item.getType(), item.getItemId(), start, end, limit);
        if (!entries.isEmpty() || !keys.fitsDayPartitions(start, end)) {
            return entries;
        }
        List<HistoryEntry> fallback = globalLedger.query(start, end,
            HistoryFilter.builder().itemId(item.getItemId()).build(), limit);
        if (!fallback.isEmpty()) {
            log.info("Item ledger empty for {}, served {} entries from global ledger", item.getUniqueId(), fallback.size());
        }
        return fallback;
    }

    public List<HistoryEntry> queryGlobalHistory(Instant start, Instant end, HistoryFilter filter, int limit) {
        return globalLedger.query(start, end, filter == null ? HistoryFilter.none() : filter, limit);
    }

    public List<HistoryEntry> findBatch(String batchId, Instant start, Instant end) {
        return globalLedger.findBatch(batchId, start, end);
    }

    public ItemHistoryStats itemStats(ItemKey item, Instant start, Instant end) {
        List<HistoryEntry> entries = queryItemHistory(item, start, end, Integer.MAX_VALUE);

        Map<String, Long> perAssignee = entries.stream()
            .map(HistoryEntry::getAssignedToStaffUid)
            .filter(Objects::nonNull)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        String mostActive = perAssignee.entrySet().stream()
            .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
            .map(Map.Entry::getKey)
            .orElse(null);

        return ItemHistoryStats.builder()
            .itemId(item.getItemId())
            .totalEntries(entries.size())
            .checkouts(count(entries, HistoryAction.CHECKOUT))
            .checkins(count(entries, HistoryAction.CHECKIN))
            .usages(count(entries, HistoryAction.USAGE))
            .restocks(count(entries, HistoryAction.RESTOCK))
            .uniqueAssignees(perAssignee.size())
            .batchOperations((int) entries.stream()
                .map(HistoryEntry::getBatchId)
                .filter(Objects::nonNull)
                .distinct()
                .count())
            .mostActiveAssignee(mostActive)
            .build();
    }

    private static int count(List<HistoryEntry> entries, HistoryAction action) {
        return (int) entries.stream().filter(entry -> entry.getAction() == action).count();
    }
}
