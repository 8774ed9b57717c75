package com.flagship.tool_ledger.store;

import java.util.List;
import java.util.Map;

/**
 * Hierarchical document store with multi-document transactions.
 *
 * Two implementations exist: {@link InMemoryDocumentStore} (optimistic, version checked)
 * and {@link JdbcDocumentStore} (PostgreSQL JSONB with row locks). Both resolve
 * {@link FieldValue#SERVER_TIMESTAMP} with the same {@link ServerClock}.
 */
public interface DocumentStore {

    /**
     * Runs {@code function} atomically, retrying on conflict.
     *
     * @throws TransactionConflictException when every attempt conflicted
     */
    <T> TransactionResult<T> runTransaction(TransactionFunction<T> function);

    DocumentSnapshot get(DocumentRef ref);

    void set(DocumentRef ref, Map<String, Object> data, boolean merge);

    /**
     * Appends {@code element} to the array {@code field} of the document, creating the
     * document and the array if needed, and merges {@code fields} into it. Concurrent
     * appends to the same document never lose elements.
     */
    void appendToArray(DocumentRef ref, String field, Map<String, Object> element, Map<String, Object> fields);

    /**
     * Whether {@link #appendToArray} is applied atomically by the store itself.
     * Callers fall back to a serialized read-modify-write when it is not.
     */
    default boolean supportsAtomicArrayAppend() {
        return true;
    }

    /**
     * Direct children of a collection, ordered by path.
     */
    List<DocumentSnapshot> list(String collectionPath);

    /**
     * Registers a listener for writes to documents directly under {@code collectionPath}.
     */
    Subscription subscribe(String collectionPath, DocumentChangeListener listener);

    boolean ping();
}
