package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.FieldValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends entries to ledger bucket documents.
 *
 * Uses the store's atomic array append when available. Otherwise falls back to
 * read-modify-write, serialized per bucket path with striped locks; that only protects
 * writers inside this process.
 */
@Component
@Slf4j
public class BucketWriter {

    public static final String TRANSACTIONS = "transactions";
    private static final int LOCK_STRIPES = 64;

    private final DocumentStore store;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public BucketWriter(DocumentStore store) {
        this.store = store;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * @param bucket       bucket document, created on first append
     * @param entry        entry to append to {@code transactions}
     * @param bucketFields descriptive fields merged into the bucket on every write
     */
    public void append(DocumentRef bucket, Map<String, Object> entry, Map<String, Object> bucketFields) {
        Map<String, Object> fields = new LinkedHashMap<>(bucketFields);
        fields.put("updatedAt", FieldValue.serverTimestamp());

        if (store.supportsAtomicArrayAppend()) {
            store.appendToArray(bucket, TRANSACTIONS, entry, fields);
            return;
        }

        ReentrantLock lock = stripes[Math.floorMod(bucket.getPath().hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            DocumentSnapshot current = store.get(bucket);
            List<Map<String, Object>> transactions = new ArrayList<>(current.getMapList(TRANSACTIONS));
            transactions.add(entry);
            Map<String, Object> data = new LinkedHashMap<>(fields);
            data.put(TRANSACTIONS, transactions);
            store.set(bucket, data, true);
            log.debug("Appended to {} by read-modify-write ({} entries)", bucket, transactions.size());
        } finally {
            lock.unlock();
        }
    }
}
