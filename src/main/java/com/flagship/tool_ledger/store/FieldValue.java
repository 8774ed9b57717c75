package com.flagship.tool_ledger.store;

/**
 * Sentinel values the store resolves at write time.
 */
public enum FieldValue {

    /**
     * Replaced by the store's server clock when the write is applied.
     * Inside a transaction every sentinel resolves to the same commit instant.
     */
    SERVER_TIMESTAMP;

    public static FieldValue serverTimestamp() {
        return SERVER_TIMESTAMP;
    }
}
