package com.flagship.tool_ledger.batch;

/**
 * Why a scan or submit was refused. A refused scan never changes the batch.
 */
public enum ScanRejection {
    ITEM_NOT_FOUND,
    ALREADY_IN_BATCH,
    TYPE_MISMATCH,
    TYPE_NOT_SELECTED,
    BATCH_SUBMITTED,
    INVALID_QUANTITY,
    EMPTY_BATCH
}
