package com.flagship.tool_ledger.store;

import lombok.Getter;

/**
 * Thrown when a transaction could not commit within the configured number of attempts.
 * Nothing from the transaction was applied.
 */
@Getter
public class TransactionConflictException extends RuntimeException {

    private final int attempts;

    public TransactionConflictException(int attempts, Throwable cause) {
        super("Transaction aborted after " + attempts + " conflicting attempts", cause);
        this.attempts = attempts;
    }
}
