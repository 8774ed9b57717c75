package com.flagship.tool_ledger.custody;

/**
 * How a custody failure should be treated by callers.
 */
public enum ErrorCategory {
    /** Item or staff record does not exist. */
    NOT_FOUND,
    /** Records exist but are not in the state the operation requires. */
    PRECONDITION_FAILED,
    /** The store kept conflicting; nothing was applied and the call may be retried. */
    TRANSACTION_CONFLICT
}
