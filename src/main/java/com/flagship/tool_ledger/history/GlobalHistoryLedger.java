package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Day-partitioned history of every item at {@code global_history/{YYYY}/{MM}/{DD}}.
 */
@Component
public class GlobalHistoryLedger extends PartitionedLedger {

    static final String COLLECTION = "global_history";

    public GlobalHistoryLedger(DocumentStore store, DocumentMapper mapper, BucketWriter writer, PartitionKeys keys) {
        super(store, mapper, writer, keys);
    }

    public DocumentRef bucketFor(String[] daySegments) {
        return DocumentRef.of(COLLECTION, daySegments[0], daySegments[1], daySegments[2]);
    }

    public DocumentRef bucketFor(HistoryEntry entry) {
        return bucketFor(keys.daySegments(timestampOf(entry)));
    }

    public void append(HistoryEntry entry) {
        DocumentRef bucket = bucketFor(entry);
        write(bucket, entry, Map.of("dateKey", keys.dayKey(entry.getTimestamp())));
    }

    public List<HistoryEntry> query(Instant start, Instant end, HistoryFilter filter, int limit) {
        List<DocumentRef> buckets = keys.daySegments(start, end).stream()
            .map(this::bucketFor)
            .toList();
        return collect(buckets, start, end, filter, limit);
    }

    /**
     * All entries written by one batch submission within the range.
     */
    public List<HistoryEntry> findBatch(String batchId, Instant start, Instant end) {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("Batch id is required");
        }
        return query(start, end, HistoryFilter.builder().batchId(batchId).build(), Integer.MAX_VALUE);
    }
}
