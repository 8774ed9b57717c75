package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Read and write plumbing shared by the per-item and global ledgers.
 */
@Slf4j
abstract class PartitionedLedger {

    static final Comparator<HistoryEntry> NEWEST_FIRST = Comparator.comparing(
        HistoryEntry::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    protected final DocumentStore store;
    protected final DocumentMapper mapper;
    protected final BucketWriter writer;
    protected final PartitionKeys keys;

    protected PartitionedLedger(DocumentStore store, DocumentMapper mapper, BucketWriter writer, PartitionKeys keys) {
        this.store = store;
        this.mapper = mapper;
        this.writer = writer;
        this.keys = keys;
    }

    protected void write(DocumentRef bucket, HistoryEntry entry, Map<String, Object> bucketFields) {
        writer.append(bucket, mapper.toMap(entry), bucketFields);
    }

    protected static Instant timestampOf(HistoryEntry entry) {
        if (entry.getTimestamp() == null) {
            throw new IllegalArgumentException("History entry " + entry.getId() + " has no timestamp");
        }
        return entry.getTimestamp();
    }

    /**
     * Reads the given buckets, keeps entries inside {@code [start, end]} that match
     * {@code filter}, and returns at most {@code limit} of them newest first.
     * Missing buckets are skipped.
     */
    protected List<HistoryEntry> collect(List<DocumentRef> buckets, Instant start, Instant end,
                                         Predicate<HistoryEntry> filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        List<HistoryEntry> entries = new ArrayList<>();
        for (DocumentRef bucket : buckets) {
            entries.addAll(readBucket(bucket));
        }
        return entries.stream()
            .filter(entry -> inRange(entry, start, end))
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }

    protected List<HistoryEntry> readBucket(DocumentRef bucket) {
        DocumentSnapshot snapshot = store.get(bucket);
        if (!snapshot.exists()) {
            return List.of();
        }
        List<HistoryEntry> entries = new ArrayList<>();
        for (Map<String, Object> raw : snapshot.getMapList(BucketWriter.TRANSACTIONS)) {
            try {
                entries.add(mapper.toObject(raw, HistoryEntry.class));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable history entry in {}: {}", bucket, e.getMessage());
            }
        }
        return entries;
    }

    // Entries without a timestamp predate server timestamps; keep them rather than hide history
    private static boolean inRange(HistoryEntry entry, Instant start, Instant end) {
        Instant timestamp = entry.getTimestamp();
        return timestamp == null || (!timestamp.isBefore(start) && !timestamp.isAfter(end));
    }
}
