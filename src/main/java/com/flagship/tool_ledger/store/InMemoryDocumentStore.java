package com.flagship.tool_ledger.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Optimistic in-process store.
 *
 * Transactions record the version of every document they read and validate those
 * versions at commit; a mismatch means another writer got there first and the attempt
 * is retried. The commit itself (validation, timestamp, apply) happens under a single
 * monitor, so commit timestamps follow commit order.
 *
 * Used by the {@code memory} profile and throughout the unit tests.
 */
@Slf4j
public class InMemoryDocumentStore extends AbstractDocumentStore {

    private final Object monitor = new Object();
    private final TreeMap<String, StoredDocument> documents = new TreeMap<>();
    private final boolean atomicArrayAppend;

    public InMemoryDocumentStore(ServerClock serverClock, int maxAttempts) {
        this(serverClock, maxAttempts, true);
    }

    /**
     * @param atomicArrayAppend when false, {@link #supportsAtomicArrayAppend()} reports false
     *                          so callers exercise their read-modify-write fallback
     */
    public InMemoryDocumentStore(ServerClock serverClock, int maxAttempts, boolean atomicArrayAppend) {
        super(serverClock, maxAttempts);
        this.atomicArrayAppend = atomicArrayAppend;
    }

    @Override
    protected <T> TransactionResult<T> attemptTransaction(TransactionFunction<T> function, int attempt) {
        InMemoryTransaction transaction = new InMemoryTransaction();
        T value = function.apply(transaction);

        Instant commitTime;
        List<DocumentSnapshot> changed = new ArrayList<>();
        synchronized (monitor) {
            // Validate every read; a missing document was read at version 0
            for (Map.Entry<String, Long> read : transaction.readVersions.entrySet()) {
                if (currentVersion(read.getKey()) != read.getValue()) {
                    throw new ConflictDetectedException("Document changed since read: " + read.getKey());
                }
            }
            for (PendingWrite write : transaction.writes) {
                if (write.kind == WriteKind.UPDATE && !documents.containsKey(write.ref.getPath())) {
                    throw new DocumentWriteException("No document to update: " + write.ref);
                }
            }
            // Timestamp and apply while still holding the monitor
            commitTime = serverClock.now();
            for (PendingWrite write : transaction.writes) {
                changed.add(apply(write, commitTime));
            }
        }
        publish(changed);
        return new TransactionResult<>(value, commitTime, attempt);
    }

    @Override
    public DocumentSnapshot get(DocumentRef ref) {
        synchronized (monitor) {
            return snapshotOf(ref);
        }
    }

    @Override
    public void set(DocumentRef ref, Map<String, Object> data, boolean merge) {
        DocumentSnapshot snapshot;
        synchronized (monitor) {
            snapshot = apply(new PendingWrite(ref, merge ? WriteKind.MERGE : WriteKind.SET, data), serverClock.now());
        }
        publish(List.of(snapshot));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void appendToArray(DocumentRef ref, String field, Map<String, Object> element, Map<String, Object> fields) {
        DocumentSnapshot snapshot;
        synchronized (monitor) {
            Instant now = serverClock.now();
            StoredDocument existing = documents.get(ref.getPath());
            Map<String, Object> data = existing == null
                    ? new LinkedHashMap<>()
                    : DocumentValues.deepCopy(existing.data);
            data.putAll(DocumentValues.resolveSentinels(fields, now));
            Object current = data.get(field);
            List<Object> array = current instanceof List ? new ArrayList<>((List<Object>) current) : new ArrayList<>();
            array.add(DocumentValues.resolveSentinels(element, now));
            data.put(field, array);
            snapshot = store(ref, data);
        }
        publish(List.of(snapshot));
    }

    @Override
    public boolean supportsAtomicArrayAppend() {
        return atomicArrayAppend;
    }

    @Override
    public List<DocumentSnapshot> list(String collectionPath) {
        String prefix = collectionPath + "/";
        List<DocumentSnapshot> result = new ArrayList<>();
        synchronized (monitor) {
            for (Map.Entry<String, StoredDocument> entry : documents.tailMap(prefix, true).entrySet()) {
                String path = entry.getKey();
                if (!path.startsWith(prefix)) {
                    break;
                }
                if (path.indexOf('/', prefix.length()) < 0) {
                    result.add(DocumentSnapshot.of(DocumentRef.parse(path), entry.getValue().data, entry.getValue().version));
                }
            }
        }
        return result;
    }

    @Override
    public boolean ping() {
        return true;
    }

    /**
     * Number of stored documents; handy in tests asserting that nothing was written.
     */
    public int size() {
        synchronized (monitor) {
            return documents.size();
        }
    }

    private long currentVersion(String path) {
        StoredDocument document = documents.get(path);
        return document == null ? 0L : document.version;
    }

    private DocumentSnapshot snapshotOf(DocumentRef ref) {
        StoredDocument document = documents.get(ref.getPath());
        if (document == null) {
            return DocumentSnapshot.missing(ref);
        }
        return DocumentSnapshot.of(ref, document.data, document.version);
    }

    private DocumentSnapshot apply(PendingWrite write, Instant now) {
        Map<String, Object> resolved = DocumentValues.resolveSentinels(write.data, now);
        StoredDocument existing = documents.get(write.ref.getPath());
        Map<String, Object> data;
        switch (write.kind) {
            case SET -> data = DocumentValues.deepCopy(resolved);
            case MERGE, UPDATE -> data = DocumentValues.merge(existing == null ? null : existing.data, resolved);
            default -> throw new IllegalStateException("Unknown write kind " + write.kind);
        }
        return store(write.ref, data);
    }

    private DocumentSnapshot store(DocumentRef ref, Map<String, Object> data) {
        long version = currentVersion(ref.getPath()) + 1;
        documents.put(ref.getPath(), new StoredDocument(data, version));
        return DocumentSnapshot.of(ref, data, version);
    }

    private enum WriteKind { SET, MERGE, UPDATE }

    private static final class StoredDocument {
        private final Map<String, Object> data;
        private final long version;

        private StoredDocument(Map<String, Object> data, long version) {
            this.data = data;
            this.version = version;
        }
    }

    private static final class PendingWrite {
        private final DocumentRef ref;
        private final WriteKind kind;
        private final Map<String, Object> data;

        private PendingWrite(DocumentRef ref, WriteKind kind, Map<String, Object> data) {
            this.ref = ref;
            this.kind = kind;
            this.data = DocumentValues.deepCopy(data);
        }
    }

    private final class InMemoryTransaction implements StoreTransaction {
        private final Map<String, Long> readVersions = new HashMap<>();
        private final List<PendingWrite> writes = new ArrayList<>();

        @Override
        public DocumentSnapshot get(DocumentRef ref) {
            if (!writes.isEmpty()) {
                throw new IllegalStateException("Transaction reads must precede writes");
            }
            DocumentSnapshot snapshot = InMemoryDocumentStore.this.get(ref);
            readVersions.putIfAbsent(ref.getPath(), snapshot.getVersion());
            return snapshot;
        }

        @Override
        public void set(DocumentRef ref, Map<String, Object> data, boolean merge) {
            writes.add(new PendingWrite(ref, merge ? WriteKind.MERGE : WriteKind.SET, data));
        }

        @Override
        public void update(DocumentRef ref, Map<String, Object> fields) {
            writes.add(new PendingWrite(ref, WriteKind.UPDATE, fields));
        }
    }
}
