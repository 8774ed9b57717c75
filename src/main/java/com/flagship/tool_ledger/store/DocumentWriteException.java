package com.flagship.tool_ledger.store;

/**
 * A write outside the conflict-retry path failed, e.g. the backing database is unreachable
 * or an update targeted a missing document.
 */
public class DocumentWriteException extends RuntimeException {

    public DocumentWriteException(String message) {
        super(message);
    }

    public DocumentWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
