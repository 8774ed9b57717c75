package com.flagship.tool_ledger.store;

@FunctionalInterface
public interface DocumentChangeListener {

    /**
     * Called after a document in the watched collection was written. Runs on the
     * writer's thread after commit, so implementations should be quick.
     */
    void onChange(DocumentSnapshot snapshot);
}
