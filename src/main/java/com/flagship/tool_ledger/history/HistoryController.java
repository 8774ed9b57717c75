package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.inventory.ItemDirectory;
import com.flagship.tool_ledger.inventory.ItemKey;
import com.flagship.tool_ledger.store.ServerClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Read-only access to the history ledgers. Ranges are inclusive {@code [start, end]}
 * and results come back newest first.
 */
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@Slf4j
public class HistoryController {

    private static final Duration DEFAULT_ITEM_WINDOW = Duration.ofDays(90);
    private static final Duration DEFAULT_BATCH_WINDOW = Duration.ofDays(7);
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 1000;

    private final HistoryQueryService historyQueryService;
    private final ItemDirectory itemDirectory;
    private final PartitionKeys partitionKeys;
    private final ServerClock clock;

    @GetMapping("/items/{uniqueId}")
    public ResponseEntity<List<HistoryEntry>> itemHistory(
            @PathVariable("uniqueId") String uniqueId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_LIMIT) int limit) {

        ItemKey item = resolve(uniqueId);
        Instant to = end != null ? end : clock.peek();
        Instant from = start != null ? start : to.minus(DEFAULT_ITEM_WINDOW);
        return ResponseEntity.ok(historyQueryService.queryItemHistory(item, from, to, checkLimit(limit)));
    }

    @GetMapping("/items/{uniqueId}/stats")
    public ResponseEntity<ItemHistoryStats> itemStats(
            @PathVariable("uniqueId") String uniqueId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        ItemKey item = resolve(uniqueId);
        Instant to = end != null ? end : clock.peek();
        Instant from = start != null ? start : to.minus(DEFAULT_ITEM_WINDOW);
        return ResponseEntity.ok(historyQueryService.itemStats(item, from, to));
    }

    /**
     * Global activity, by default since the start of today in the ledger zone.
     */
    @GetMapping("/global")
    public ResponseEntity<List<HistoryEntry>> globalHistory(
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(value = "item", required = false) String itemCode,
            @RequestParam(value = "staff_uid", required = false) String staffUid,
            @RequestParam(value = "action", required = false) String action,
            @RequestParam(value = "batch_id", required = false) String batchId,
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_LIMIT) int limit) {

        Instant to = end != null ? end : clock.peek();
        Instant from = start != null ? start : LocalDate.ofInstant(to, partitionKeys.getZone())
            .atStartOfDay(partitionKeys.getZone()).toInstant();

        HistoryFilter filter = HistoryFilter.builder()
            .itemId(itemCode != null ? resolve(itemCode).getItemId() : null)
            .staffUid(staffUid)
            .action(action != null ? HistoryAction.fromValue(action) : null)
            .batchId(batchId)
            .build();
        return ResponseEntity.ok(historyQueryService.queryGlobalHistory(from, to, filter, checkLimit(limit)));
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<List<HistoryEntry>> batchHistory(
            @PathVariable("batchId") String batchId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        Instant to = end != null ? end : clock.peek();
        Instant from = start != null ? start : to.minus(DEFAULT_BATCH_WINDOW);
        return ResponseEntity.ok(historyQueryService.findBatch(batchId, from, to));
    }

    private ItemKey resolve(String code) {
        return itemDirectory.resolve(code)
            .orElseThrow(() -> new NoSuchElementException("No item with code " + ItemDirectory.normalize(code)));
    }

    private static int checkLimit(int limit) {
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
