package com.flagship.tool_ledger.store;

import java.util.Map;

/**
 * View of the store inside {@link DocumentStore#runTransaction}.
 *
 * All reads must happen before the first write. Writes are buffered and applied
 * together when the transaction function returns; if the function throws, nothing
 * is applied.
 */
public interface StoreTransaction {

    DocumentSnapshot get(DocumentRef ref);

    /**
     * Creates or replaces a document. With {@code merge}, top-level fields are merged
     * into the existing document instead of replacing it.
     */
    void set(DocumentRef ref, Map<String, Object> data, boolean merge);

    /**
     * Patches top-level fields of an existing document. Fails the commit if the
     * document does not exist.
     */
    void update(DocumentRef ref, Map<String, Object> fields);
}
