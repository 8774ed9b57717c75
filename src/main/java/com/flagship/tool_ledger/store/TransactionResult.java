package com.flagship.tool_ledger.store;

import lombok.Value;

import java.time.Instant;

/**
 * Value returned by a committed transaction together with the server timestamp
 * every {@link FieldValue#SERVER_TIMESTAMP} in it resolved to.
 */
@Value
public class TransactionResult<T> {
    T value;
    Instant commitTime;
    int attempts;
}
