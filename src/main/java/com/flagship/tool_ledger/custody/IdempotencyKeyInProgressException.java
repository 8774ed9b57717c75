package com.flagship.tool_ledger.custody;

import lombok.Getter;

/**
 * Thrown when a request reuses an idempotency key whose first request is still running
 * and did not finish within the configured wait. The client should retry later with
 * the same key.
 */
@Getter
public class IdempotencyKeyInProgressException extends RuntimeException {

    private final String key;

    public IdempotencyKeyInProgressException(String key) {
        super("A request with idempotency key " + key + " is still in progress");
        this.key = key;
    }
}
