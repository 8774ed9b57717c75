package com.flagship.tool_ledger.custody;

import lombok.Getter;

/**
 * Failure of the atomic phase of a custody operation. When this is thrown, no item or
 * staff document was changed.
 */
@Getter
public class CustodyException extends RuntimeException {

    private final ErrorKind kind;
    private final String itemId;

    public CustodyException(ErrorKind kind, String itemId, String message) {
        super(message);
        this.kind = kind;
        this.itemId = itemId;
    }

    public CustodyException(ErrorKind kind, String itemId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.itemId = itemId;
    }

    public ErrorCategory getCategory() {
        return kind.getCategory();
    }
}
