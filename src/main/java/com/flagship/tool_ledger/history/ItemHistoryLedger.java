package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.inventory.ItemType;
import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Month-partitioned history of a single item at
 * {@code {tools|consumables}/{itemId}/history/{MM-YYYY}}.
 */
@Component
public class ItemHistoryLedger extends PartitionedLedger {

    static final String HISTORY = "history";

    public ItemHistoryLedger(DocumentStore store, DocumentMapper mapper, BucketWriter writer, PartitionKeys keys) {
        super(store, mapper, writer, keys);
    }

    public DocumentRef bucketFor(ItemType type, String itemId, String monthKey) {
        // Buckets live in the item document's history subcollection
        return DocumentRef.of(type.getCollection(), itemId).child(HISTORY, monthKey);
    }

    public DocumentRef bucketFor(HistoryEntry entry) {
        return bucketFor(entry.getItemType(), entry.getItemId(), keys.monthKey(timestampOf(entry)));
    }

    public void append(HistoryEntry entry) {
        DocumentRef bucket = bucketFor(entry);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("monthKey", bucket.getId());
        fields.put("itemId", entry.getItemId());
        fields.put("itemUniqueId", entry.getItemUniqueId());
        write(bucket, entry, fields);
    }

    /**
     * Entries of one item within {@code [start, end]}, newest first.
     */
    public List<HistoryEntry> query(ItemType type, String itemId, Instant start, Instant end, int limit) {
        List<DocumentRef> buckets = keys.monthKeys(start, end).stream()
            .map(monthKey -> bucketFor(type, itemId, monthKey))
            .toList();
        return collect(buckets, start, end, entry -> true, limit);
    }

    /**
     * Newest entry from the current or the previous month bucket.
     */
    public Optional<HistoryEntry> lastEntry(ItemType type, String itemId, Instant now) {
        Instant previousMonth = now.atZone(keys.getZone()).minusMonths(1).toInstant();
        List<DocumentRef> buckets = keys.monthKeys(previousMonth, now).stream()
            .map(monthKey -> bucketFor(type, itemId, monthKey))
            .toList();
        return buckets.stream()
            .flatMap(bucket -> readBucket(bucket).stream())
            .min(NEWEST_FIRST);
    }
}
