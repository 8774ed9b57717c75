package com.flagship.tool_ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed store. Every document is one row of the {@code documents} table
 * with its body in a JSONB column.
 *
 * Transactions are pessimistic:
 * 1. Reads take row locks with SELECT ... FOR UPDATE
 * 2. Writes are buffered and flushed at the end of the transaction function
 * 3. The commit timestamp is taken while the row locks are held
 *
 * A row lock cannot cover a document that does not exist yet, so a document read as
 * missing is created with a plain INSERT. If a concurrent transaction created it first,
 * the unique path constraint fails the INSERT and the attempt is retried against the
 * now existing row. Deadlocks and serialization failures are retried the same way; both
 * surface as Spring's {@link ConcurrencyFailureException} / {@link DuplicateKeyException}.
 *
 * Array appends are a single {@code INSERT ... ON CONFLICT DO UPDATE} that concatenates
 * the new element onto the stored JSONB array, so concurrent appenders never overwrite
 * each other.
 */
@Slf4j
public class JdbcDocumentStore extends AbstractDocumentStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String SELECT_SQL =
        "SELECT data::text AS data, version FROM documents WHERE path = ?";

    private static final String SELECT_FOR_UPDATE_SQL = SELECT_SQL + " FOR UPDATE";

    private static final String LIST_SQL =
        "SELECT path, data::text AS data, version FROM documents WHERE parent_path = ? ORDER BY path";

    private static final String INSERT_SQL =
        "INSERT INTO documents (path, parent_path, data, version, created_at, updated_at) " +
        "VALUES (?, ?, ?::jsonb, 1, now(), now()) " +
        "RETURNING data::text AS data, version";

    private static final String UPSERT_REPLACE_SQL =
        "INSERT INTO documents (path, parent_path, data, version, created_at, updated_at) " +
        "VALUES (?, ?, ?::jsonb, 1, now(), now()) " +
        "ON CONFLICT (path) DO UPDATE SET data = EXCLUDED.data, " +
        "version = documents.version + 1, updated_at = now() " +
        "RETURNING data::text AS data, version";

    private static final String UPSERT_MERGE_SQL =
        "INSERT INTO documents (path, parent_path, data, version, created_at, updated_at) " +
        "VALUES (?, ?, ?::jsonb, 1, now(), now()) " +
        "ON CONFLICT (path) DO UPDATE SET data = documents.data || EXCLUDED.data, " +
        "version = documents.version + 1, updated_at = now() " +
        "RETURNING data::text AS data, version";

    private static final String UPDATE_SQL =
        "UPDATE documents SET data = data || ?::jsonb, version = version + 1, updated_at = now() " +
        "WHERE path = ? RETURNING data::text AS data, version";

    private static final String APPEND_SQL =
        "INSERT INTO documents (path, parent_path, data, version, created_at, updated_at) " +
        "VALUES (?, ?, ?::jsonb, 1, now(), now()) " +
        "ON CONFLICT (path) DO UPDATE SET " +
        "data = (documents.data || EXCLUDED.data) || jsonb_build_object(?::text, " +
        "COALESCE(documents.data -> ?::text, '[]'::jsonb) || (EXCLUDED.data -> ?::text)), " +
        "version = documents.version + 1, updated_at = now() " +
        "RETURNING data::text AS data, version";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JdbcDocumentStore(JdbcTemplate jdbcTemplate,
                             TransactionTemplate transactionTemplate,
                             ObjectMapper objectMapper,
                             ServerClock serverClock,
                             int maxAttempts) {
        super(serverClock, maxAttempts);
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected <T> TransactionResult<T> attemptTransaction(TransactionFunction<T> function, int attempt) {
        Committed<T> committed;
        try {
            committed = transactionTemplate.execute(status -> {
                JdbcTransaction transaction = new JdbcTransaction();
                T value = function.apply(transaction);
                Instant commitTime = serverClock.now();
                List<DocumentSnapshot> written = transaction.flush(commitTime);
                return new Committed<>(value, commitTime, written);
            });
        } catch (ConcurrencyFailureException | DuplicateKeyException e) {
            throw new ConflictDetectedException(e.getMessage(), e);
        }
        if (committed == null) {
            throw new IllegalStateException("Transaction template returned no result");
        }
        publish(committed.written());
        return new TransactionResult<>(committed.value(), committed.commitTime(), attempt);
    }

    @Override
    public DocumentSnapshot get(DocumentRef ref) {
        return readOne(SELECT_SQL, ref);
    }

    @Override
    public void set(DocumentRef ref, Map<String, Object> data, boolean merge) {
        DocumentSnapshot snapshot = execute(ref, () ->
            upsert(ref, DocumentValues.resolveSentinels(data, serverClock.now()), merge));
        publish(List.of(snapshot));
    }

    @Override
    public void appendToArray(DocumentRef ref, String field, Map<String, Object> element, Map<String, Object> fields) {
        DocumentSnapshot snapshot = execute(ref, () -> {
            Instant now = serverClock.now();
            Map<String, Object> payload = new LinkedHashMap<>(DocumentValues.resolveSentinels(fields, now));
            payload.put(field, List.of(DocumentValues.resolveSentinels(element, now)));
            List<DocumentSnapshot> rows = jdbcTemplate.query(APPEND_SQL, snapshotMapper(ref),
                ref.getPath(), ref.getParentPath(), toJson(payload), field, field, field);
            return single(rows, ref);
        });
        publish(List.of(snapshot));
    }

    @Override
    public List<DocumentSnapshot> list(String collectionPath) {
        try {
            return jdbcTemplate.query(LIST_SQL,
                (rs, rowNum) -> DocumentSnapshot.of(
                    DocumentRef.parse(rs.getString("path")),
                    fromJson(rs.getString("data")),
                    rs.getLong("version")),
                collectionPath);
        } catch (DataAccessException e) {
            throw new DocumentWriteException("Failed to list " + collectionPath, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Document store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private DocumentSnapshot readOne(String sql, DocumentRef ref) {
        List<DocumentSnapshot> rows = jdbcTemplate.query(sql, snapshotMapper(ref), ref.getPath());
        return rows.isEmpty() ? DocumentSnapshot.missing(ref) : rows.get(0);
    }

    private DocumentSnapshot upsert(DocumentRef ref, Map<String, Object> data, boolean merge) {
        List<DocumentSnapshot> rows = jdbcTemplate.query(merge ? UPSERT_MERGE_SQL : UPSERT_REPLACE_SQL,
            snapshotMapper(ref), ref.getPath(), ref.getParentPath(), toJson(data));
        return single(rows, ref);
    }

    private DocumentSnapshot execute(DocumentRef ref, Supplier<DocumentSnapshot> write) {
        try {
            return write.get();
        } catch (DataAccessException e) {
            throw new DocumentWriteException("Write failed for " + ref + ": " + e.getMessage(), e);
        }
    }

    private DocumentSnapshot single(List<DocumentSnapshot> rows, DocumentRef ref) {
        if (rows.isEmpty()) {
            throw new DocumentWriteException("No row returned for " + ref);
        }
        return rows.get(0);
    }

    private RowMapper<DocumentSnapshot> snapshotMapper(DocumentRef ref) {
        return (rs, rowNum) -> DocumentSnapshot.of(ref, fromJson(rs.getString("data")), rs.getLong("version"));
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new DocumentWriteException("Document is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored document is not valid JSON", e);
        }
    }

    private record Committed<T>(T value, Instant commitTime, List<DocumentSnapshot> written) {}

    private enum WriteKind { SET, MERGE, UPDATE }

    private record PendingWrite(DocumentRef ref, WriteKind kind, Map<String, Object> data) {}

    private final class JdbcTransaction implements StoreTransaction {
        private final List<PendingWrite> writes = new ArrayList<>();
        // Paths read as absent; creating them must not silently overwrite a concurrent creator
        private final Set<String> readMissing = new HashSet<>();

        @Override
        public DocumentSnapshot get(DocumentRef ref) {
            if (!writes.isEmpty()) {
                throw new IllegalStateException("Transaction reads must precede writes");
            }
            DocumentSnapshot snapshot = readOne(SELECT_FOR_UPDATE_SQL, ref);
            if (!snapshot.exists()) {
                readMissing.add(ref.getPath());
            }
            return snapshot;
        }

        @Override
        public void set(DocumentRef ref, Map<String, Object> data, boolean merge) {
            writes.add(new PendingWrite(ref, merge ? WriteKind.MERGE : WriteKind.SET, DocumentValues.deepCopy(data)));
        }

        @Override
        public void update(DocumentRef ref, Map<String, Object> fields) {
            writes.add(new PendingWrite(ref, WriteKind.UPDATE, DocumentValues.deepCopy(fields)));
        }

        private List<DocumentSnapshot> flush(Instant commitTime) {
            List<DocumentSnapshot> written = new ArrayList<>();
            for (PendingWrite write : writes) {
                Map<String, Object> resolved = DocumentValues.resolveSentinels(write.data(), commitTime);
                if (write.kind() == WriteKind.UPDATE) {
                    List<DocumentSnapshot> rows = jdbcTemplate.query(UPDATE_SQL, snapshotMapper(write.ref()),
                        toJson(resolved), write.ref().getPath());
                    if (rows.isEmpty()) {
                        throw new DocumentWriteException("No document to update: " + write.ref());
                    }
                    written.add(rows.get(0));
                } else if (readMissing.remove(write.ref().getPath())) {
                    // Raises DuplicateKeyException if another transaction created the document meanwhile
                    List<DocumentSnapshot> rows = jdbcTemplate.query(INSERT_SQL, snapshotMapper(write.ref()),
                        write.ref().getPath(), write.ref().getParentPath(), toJson(resolved));
                    written.add(single(rows, write.ref()));
                } else {
                    written.add(upsert(write.ref(), resolved, write.kind() == WriteKind.MERGE));
                }
            }
            return written;
        }
    }
}
